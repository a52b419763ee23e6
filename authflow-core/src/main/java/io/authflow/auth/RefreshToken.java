/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.auth;

import io.authflow.util.Assert;

/**
 * A long-lived OAuth 2.0 refresh token, owned by the caller.
 *
 * @param value the token string
 */
public record RefreshToken(String value) {

	public RefreshToken {
		Assert.hasText(value, "refresh token must not be empty");
	}

	@Override
	public String toString() {
		return "RefreshToken[******]";
	}

}
