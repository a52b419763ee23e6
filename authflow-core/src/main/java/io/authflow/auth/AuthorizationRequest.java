/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.auth;

import io.authflow.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * The parameters a client sends to the authorization endpoint. The same instance is used
 * afterwards to validate the redirection response, in particular its {@code state}.
 *
 * @param clientId the client identifier
 * @param redirectUri the redirection endpoint
 * @param state the CSRF state, or {@code null} to send none
 * @param scopes the requested scopes
 * @param pkce the PKCE challenge, or {@code null} when PKCE is not used
 */
public record AuthorizationRequest(String clientId, RedirectUri redirectUri, @Nullable State state, Scope scopes,
		@Nullable PkceChallenge pkce) {

	public AuthorizationRequest {
		Assert.hasText(clientId, "clientId must not be empty");
		Assert.notNull(redirectUri, "redirectUri must not be null");
		if (scopes == null) {
			scopes = Scope.empty();
		}
	}

	public AuthorizationRequest(String clientId, RedirectUri redirectUri, @Nullable State state, Scope scopes) {
		this(clientId, redirectUri, state, scopes, null);
	}

}
