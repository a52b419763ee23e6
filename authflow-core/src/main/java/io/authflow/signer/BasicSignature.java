/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.signer;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;

import io.authflow.http.ClientRequest;
import io.authflow.http.HttpHeaders;
import io.authflow.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * OAuth 1.0a signer. Signs the method, URI, query and form parameters of each request with
 * {@code HMAC-SHA1}, using the consumer secret and, when present, the token secret.
 *
 * @param consumer the client credentials
 * @param token the temporary or token credentials, or {@code null}
 * @see OAuth1Signature
 */
public record BasicSignature(OAuth1Consumer consumer, @Nullable OAuth1Token token) implements Signer {

	private static final SecureRandom secureRandom = new SecureRandom();

	public BasicSignature {
		Assert.notNull(consumer, "consumer must not be null");
	}

	public BasicSignature(OAuth1Consumer consumer) {
		this(consumer, null);
	}

	@Override
	public ClientRequest sign(ClientRequest request) {
		byte[] nonce = new byte[16];
		secureRandom.nextBytes(nonce);
		return sign(request, HexFormat.of().formatHex(nonce), Instant.now().getEpochSecond());
	}

	/**
	 * Signs the request with a given nonce and timestamp.
	 * @param request the unsigned request
	 * @param nonce the nonce
	 * @param timestamp the epoch second
	 * @return the signed request
	 */
	public ClientRequest sign(ClientRequest request, String nonce, long timestamp) {
		String formBody = null;
		boolean isForm = request.header(HttpHeaders.CONTENT_TYPE)
			.map(type -> type.toLowerCase(Locale.ROOT).startsWith(HttpHeaders.APPLICATION_FORM_URLENCODED))
			.orElse(false);
		if (isForm && request.body() != null) {
			formBody = new String(request.body(), StandardCharsets.UTF_8);
		}
		String header = OAuth1Signature.authorizationHeader(consumer, token, request.method(), request.uri(), formBody,
				nonce, timestamp);
		return request.withHeader(HttpHeaders.AUTHORIZATION, header);
	}

}
