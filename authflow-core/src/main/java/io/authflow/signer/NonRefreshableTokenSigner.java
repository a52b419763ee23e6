/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.signer;

import java.time.Instant;

import io.authflow.auth.AccessToken;
import io.authflow.auth.Scope;
import io.authflow.util.Assert;

/**
 * Bearer token signer without refresh token, as issued by the implicit and client
 * credentials grants. Once expired a new grant is needed.
 *
 * @param generatedAt when the token was received
 * @param accessToken the access token
 * @param tokenType the token type reported by the server
 * @param expiresIn the lifetime in seconds
 * @param scope the granted scope
 */
public record NonRefreshableTokenSigner(Instant generatedAt, AccessToken accessToken, String tokenType,
		long expiresIn, Scope scope) implements TokenSigner {

	public NonRefreshableTokenSigner {
		Assert.notNull(generatedAt, "generatedAt must not be null");
		Assert.notNull(accessToken, "accessToken must not be null");
		Assert.hasText(tokenType, "tokenType must not be empty");
		if (scope == null) {
			scope = Scope.empty();
		}
	}

}
