/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.grant;

import java.net.URI;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;

import io.authflow.auth.AccessToken;
import io.authflow.auth.AuthorizationRequest;
import io.authflow.auth.RedirectUri;
import io.authflow.auth.Scope;
import io.authflow.auth.State;
import io.authflow.signer.NonRefreshableTokenSigner;
import io.authflow.util.Assert;
import io.authflow.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * The implicit grant: the access token is issued directly in the redirect, without
 * token endpoint round trip and without refresh token.
 *
 * @see <a href="https://tools.ietf.org/html/rfc6749#section-4.2">RFC 6749 section
 * 4.2</a>
 */
public final class ImplicitGrant {

	private ImplicitGrant() {
	}

	public static URI authorizationUri(AuthorizationRequest request, URI serverUri) {
		return AuthorizationSupport.authorizationUri("token", request, serverUri);
	}

	public static URI authorizationUri(String clientId, RedirectUri redirectUri, @Nullable State state, Scope scopes,
			URI serverUri) {
		return authorizationUri(new AuthorizationRequest(clientId, redirectUri, state, scopes), serverUri);
	}

	public static GrantResult<NonRefreshableTokenSigner> parseAccessTokenResponse(AuthorizationRequest request,
			URI redirectionUri) {
		return parseAccessTokenResponse(request, redirectionUri, Clock.systemUTC());
	}

	/**
	 * Extracts the token from the redirect. Parameters are read from the fragment and
	 * the query.
	 * @param request the request the resource owner was sent with
	 * @param redirectionUri the URI the authorization server redirected to
	 * @param clock the clock stamping the token
	 * @return the signer or the error code
	 */
	public static GrantResult<NonRefreshableTokenSigner> parseAccessTokenResponse(AuthorizationRequest request,
			URI redirectionUri, Clock clock) {
		Assert.notNull(request, "request must not be null");
		Assert.notNull(redirectionUri, "redirectionUri must not be null");
		Assert.notNull(clock, "clock must not be null");
		Map<String, String> params = Utils.redirectParameters(redirectionUri);
		Optional<String> stateError = AuthorizationSupport.stateError(request, params);
		if (stateError.isPresent()) {
			return GrantResult.failure(stateError.get());
		}
		String error = params.get("error");
		if (Utils.hasText(error)) {
			return GrantResult.failure(error);
		}
		String accessToken = params.get("access_token");
		if (!Utils.hasText(accessToken)) {
			return GrantResult.failure(AuthorizationErrors.MISSING_ACCESS_TOKEN);
		}
		String tokenType = params.get("token_type");
		if (!Utils.hasText(tokenType)) {
			return GrantResult.failure(AuthorizationErrors.MISSING_TOKEN_TYPE);
		}
		String expiresIn = params.get("expires_in");
		if (expiresIn == null) {
			return GrantResult.failure(AuthorizationErrors.MISSING_EXPIRES_IN);
		}
		long seconds;
		try {
			seconds = Long.parseLong(expiresIn.trim());
		}
		catch (NumberFormatException ex) {
			return GrantResult.failure(AuthorizationErrors.INVALID_EXPIRES_IN);
		}
		return GrantResult.success(new NonRefreshableTokenSigner(clock.instant(), new AccessToken(accessToken),
				tokenType, seconds, Scope.parse(params.get("scope"))));
	}

}
