/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.auth;

import io.authflow.util.Assert;

/**
 * An OAuth 2.0 access token value.
 *
 * @param value the token string
 */
public record AccessToken(String value) {

	public AccessToken {
		Assert.hasText(value, "access token must not be empty");
	}

	@Override
	public String toString() {
		return "AccessToken[******]";
	}

}
