/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.signer;

import io.authflow.util.Assert;

/**
 * OAuth 1.0a temporary or token credentials.
 *
 * @param value the token identifier
 * @param secret the token shared secret
 */
public record OAuth1Token(String value, String secret) {

	public OAuth1Token {
		Assert.hasText(value, "token must not be empty");
		Assert.notNull(secret, "token secret must not be null");
	}

	@Override
	public String toString() {
		return "OAuth1Token[value=" + value + ", secret=******]";
	}

}
