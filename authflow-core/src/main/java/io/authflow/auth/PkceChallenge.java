/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

import io.authflow.util.Assert;

/**
 * Proof Key for Code Exchange pair using the {@code S256} method. The challenge goes on
 * the authorization URI, the verifier on the token request.
 *
 * @param codeVerifier the secret verifier kept by the client
 * @param codeChallenge the SHA-256 challenge derived from the verifier
 * @see <a href="https://tools.ietf.org/html/rfc7636">RFC 7636</a>
 */
public record PkceChallenge(String codeVerifier, String codeChallenge) {

	public static final String METHOD_S256 = "S256";

	private static final SecureRandom secureRandom = new SecureRandom();

	private static final String ALLOWED_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-._~";

	public PkceChallenge {
		Assert.hasText(codeVerifier, "codeVerifier must not be empty");
		Assert.hasText(codeChallenge, "codeChallenge must not be empty");
	}

	/**
	 * Generates a random 128 character verifier and its challenge.
	 * @return a new PKCE pair
	 */
	public static PkceChallenge generate() {
		StringBuilder codeVerifier = new StringBuilder(128);
		for (int i = 0; i < 128; i++) {
			codeVerifier.append(ALLOWED_CHARS.charAt(secureRandom.nextInt(ALLOWED_CHARS.length())));
		}
		return fromVerifier(codeVerifier.toString());
	}

	/**
	 * Derives the challenge of an existing verifier:
	 * {@code BASE64URL(SHA256(ASCII(code_verifier)))}.
	 * @param codeVerifier the verifier
	 * @return the PKCE pair
	 */
	public static PkceChallenge fromVerifier(String codeVerifier) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
			return new PkceChallenge(codeVerifier, Base64.getUrlEncoder().withoutPadding().encodeToString(hash));
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 algorithm not available", e);
		}
	}

}
