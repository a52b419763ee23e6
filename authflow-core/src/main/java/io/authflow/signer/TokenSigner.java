/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.signer;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;

import io.authflow.auth.AccessToken;
import io.authflow.auth.Scope;
import io.authflow.http.ClientRequest;
import io.authflow.http.HttpHeaders;

/**
 * A signer holding an OAuth 2.0 access token, presented as a bearer token (RFC 6750).
 * <p>
 * Tokens are never refreshed behind the caller's back: use {@link #isExpired(Clock)} to
 * detect expiry and run a refresh or a new grant explicitly.
 */
public sealed interface TokenSigner extends Signer permits AccessTokenSigner, NonRefreshableTokenSigner {

	Instant generatedAt();

	AccessToken accessToken();

	String tokenType();

	/**
	 * Lifetime of the access token in seconds, counted from {@link #generatedAt()}.
	 * @return the lifetime in seconds
	 */
	long expiresIn();

	Scope scope();

	/**
	 * The instant the access token expires, clamped to {@link Instant#MAX} or
	 * {@link Instant#MIN} when the lifetime is beyond the range of {@link Instant}.
	 * @return the expiry instant
	 */
	default Instant expiresAt() {
		try {
			return generatedAt().plusSeconds(expiresIn());
		}
		catch (ArithmeticException | DateTimeException ex) {
			return (expiresIn() < 0) ? Instant.MIN : Instant.MAX;
		}
	}

	default boolean isExpired(Clock clock) {
		return !clock.instant().isBefore(expiresAt());
	}

	default boolean isExpired() {
		return isExpired(Clock.systemUTC());
	}

	@Override
	default ClientRequest sign(ClientRequest request) {
		return request.withHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken().value());
	}

}
