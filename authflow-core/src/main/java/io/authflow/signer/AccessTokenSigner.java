/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.signer;

import java.time.Instant;

import io.authflow.auth.AccessToken;
import io.authflow.auth.RefreshToken;
import io.authflow.auth.Scope;
import io.authflow.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Bearer token signer obtained from the authorization code flow or a refresh. It may
 * carry a refresh token to mint a new signer once this one expires.
 *
 * @param generatedAt when the token was received
 * @param accessToken the access token
 * @param tokenType the token type reported by the server
 * @param expiresIn the lifetime in seconds
 * @param refreshToken the refresh token, or {@code null} when none was issued
 * @param scope the granted scope
 */
public record AccessTokenSigner(Instant generatedAt, AccessToken accessToken, String tokenType, long expiresIn,
		@Nullable RefreshToken refreshToken, Scope scope) implements TokenSigner {

	public AccessTokenSigner {
		Assert.notNull(generatedAt, "generatedAt must not be null");
		Assert.notNull(accessToken, "accessToken must not be null");
		Assert.hasText(tokenType, "tokenType must not be empty");
		if (scope == null) {
			scope = Scope.empty();
		}
	}

	/**
	 * Combines this signer with the result of a refresh. Authorization servers may omit
	 * the refresh token from a refresh response, in which case the current one is kept.
	 * @param refreshed the signer decoded from the refresh response
	 * @return the signer to use from now on
	 */
	public AccessTokenSigner refreshedWith(AccessTokenSigner refreshed) {
		if (refreshed.refreshToken() != null) {
			return refreshed;
		}
		return new AccessTokenSigner(refreshed.generatedAt(), refreshed.accessToken(), refreshed.tokenType(),
				refreshed.expiresIn(), this.refreshToken, refreshed.scope());
	}

}
