/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.signer;

import io.authflow.util.Assert;

/**
 * OAuth 1.0a client credentials.
 *
 * @param key the consumer key
 * @param secret the consumer secret
 */
public record OAuth1Consumer(String key, String secret) {

	public OAuth1Consumer {
		Assert.hasText(key, "consumer key must not be empty");
		Assert.notNull(secret, "consumer secret must not be null");
	}

	@Override
	public String toString() {
		return "OAuth1Consumer[key=" + key + ", secret=******]";
	}

}
