/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.auth;

import io.authflow.util.Assert;

/**
 * A short-lived, single-use authorization code returned on the redirection URI.
 *
 * @param value the code
 */
public record AuthorizationCode(String value) {

	public AuthorizationCode {
		Assert.hasText(value, "authorization code must not be empty");
	}

}
