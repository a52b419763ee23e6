/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.auth;

import java.security.SecureRandom;
import java.util.Base64;

import io.authflow.util.Assert;

/**
 * Opaque value round-tripped through the authorization server to protect the redirect
 * against cross-site request forgery. It is compared once with the redirect's
 * {@code state} parameter and then discarded.
 *
 * @param value the state string
 */
public record State(String value) {

	private static final SecureRandom secureRandom = new SecureRandom();

	public State {
		Assert.hasText(value, "state must not be empty");
	}

	/**
	 * Generates a state from 32 random bytes, base64url encoded without padding.
	 * @return a new random state
	 */
	public static State random() {
		byte[] stateBytes = new byte[32];
		secureRandom.nextBytes(stateBytes);
		return new State(Base64.getUrlEncoder().withoutPadding().encodeToString(stateBytes));
	}

}
