/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.grant;

import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import io.authflow.auth.AuthorizationCode;
import io.authflow.auth.AuthorizationRequest;
import io.authflow.auth.ClientPassword;
import io.authflow.auth.RedirectUri;
import io.authflow.auth.RefreshToken;
import io.authflow.auth.Scope;
import io.authflow.auth.State;
import io.authflow.client.ResponseDecoder;
import io.authflow.json.JsonMapper;
import io.authflow.signer.AccessTokenSigner;
import io.authflow.util.Assert;
import io.authflow.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * The authorization code grant: the resource owner is redirected to the authorization
 * server, which redirects back with a code; the client exchanges the code for an access
 * token and a refresh token.
 *
 * @see <a href="https://tools.ietf.org/html/rfc6749#section-4.1">RFC 6749 section
 * 4.1</a>
 */
public final class AuthorizationCodeGrant {

	private AuthorizationCodeGrant() {
	}

	/**
	 * Builds the URI of the authorization endpoint the resource owner is sent to.
	 * @param request the parameters of the request, kept to validate the redirect
	 * @param serverUri the authorization endpoint
	 * @return the URI with {@code response_type=code}
	 */
	public static URI authorizationUri(AuthorizationRequest request, URI serverUri) {
		return AuthorizationSupport.authorizationUri("code", request, serverUri);
	}

	public static URI authorizationUri(String clientId, RedirectUri redirectUri, @Nullable State state, Scope scopes,
			URI serverUri) {
		return authorizationUri(new AuthorizationRequest(clientId, redirectUri, state, scopes), serverUri);
	}

	/**
	 * Parses the redirect sent back by the authorization server. The {@code state} is
	 * checked first when one was sent; then a {@code code} is a success and an
	 * {@code error} is returned as it is.
	 * @param request the request the resource owner was sent with
	 * @param redirectionUri the URI the authorization server redirected to
	 * @return the authorization code or the error code
	 */
	public static GrantResult<AuthorizationCode> parseAuthorizationResponse(AuthorizationRequest request,
			URI redirectionUri) {
		Assert.notNull(request, "request must not be null");
		Assert.notNull(redirectionUri, "redirectionUri must not be null");
		Map<String, String> params = Utils.redirectParameters(redirectionUri);
		Optional<String> stateError = AuthorizationSupport.stateError(request, params);
		if (stateError.isPresent()) {
			return GrantResult.failure(stateError.get());
		}
		String code = params.get("code");
		if (Utils.hasText(code)) {
			return GrantResult.success(new AuthorizationCode(code));
		}
		String error = params.get("error");
		if (Utils.hasText(error)) {
			return GrantResult.failure(error);
		}
		return GrantResult.failure(AuthorizationErrors.MISSING_REQUIRED_QUERY_PARAMETERS);
	}

	public static TokenRequest<AccessTokenSigner> accessTokenRequest(URI serverUri, AuthorizationCode code,
			@Nullable RedirectUri redirectUri, ClientPassword clientPassword) {
		return accessTokenRequest(serverUri, code, redirectUri, clientPassword, null, defaultDecoder());
	}

	public static TokenRequest<AccessTokenSigner> accessTokenRequest(URI serverUri, AuthorizationCode code,
			@Nullable RedirectUri redirectUri, ClientPassword clientPassword, @Nullable String codeVerifier) {
		return accessTokenRequest(serverUri, code, redirectUri, clientPassword, codeVerifier, defaultDecoder());
	}

	/**
	 * Builds the request exchanging an authorization code for tokens.
	 * @param serverUri the token endpoint
	 * @param code the code received in the redirect
	 * @param redirectUri the redirect URI sent in the authorization request, if any
	 * @param clientPassword the client credentials
	 * @param codeVerifier the PKCE verifier when the authorization request had a
	 * challenge
	 * @param decoder the token response decoder
	 * @return the token request
	 */
	public static TokenRequest<AccessTokenSigner> accessTokenRequest(URI serverUri, AuthorizationCode code,
			@Nullable RedirectUri redirectUri, ClientPassword clientPassword, @Nullable String codeVerifier,
			ResponseDecoder<AccessTokenSigner> decoder) {
		Assert.notNull(code, "code must not be null");
		Map<String, String> form = new LinkedHashMap<>();
		form.put("grant_type", "authorization_code");
		form.put("code", code.value());
		if (redirectUri != null) {
			form.put("redirect_uri", redirectUri.value().toString());
		}
		if (codeVerifier != null) {
			form.put("code_verifier", codeVerifier);
		}
		return AuthorizationSupport.tokenRequest(serverUri, form, clientPassword, decoder);
	}

	public static TokenRequest<AccessTokenSigner> refreshTokenRequest(URI serverUri, RefreshToken refreshToken,
			Scope scopes, ClientPassword clientPassword) {
		return refreshTokenRequest(serverUri, refreshToken, scopes, clientPassword, defaultDecoder());
	}

	/**
	 * Builds the request refreshing an access token. The scopes are sent comma
	 * separated.
	 * @param serverUri the token endpoint
	 * @param refreshToken the refresh token
	 * @param scopes the requested scopes, omitted when empty
	 * @param clientPassword the client credentials
	 * @param decoder the token response decoder
	 * @return the token request
	 * @see AccessTokenSigner#refreshedWith(AccessTokenSigner)
	 */
	public static TokenRequest<AccessTokenSigner> refreshTokenRequest(URI serverUri, RefreshToken refreshToken,
			Scope scopes, ClientPassword clientPassword, ResponseDecoder<AccessTokenSigner> decoder) {
		Assert.notNull(refreshToken, "refreshToken must not be null");
		Map<String, String> form = new LinkedHashMap<>();
		form.put("grant_type", "refresh_token");
		form.put("refresh_token", refreshToken.value());
		if (scopes != null && !scopes.isEmpty()) {
			form.put("scope", scopes.commaDelimited());
		}
		return AuthorizationSupport.tokenRequest(serverUri, form, clientPassword, decoder);
	}

	private static ResponseDecoder<AccessTokenSigner> defaultDecoder() {
		return TokenDecoders.accessTokenSigner(JsonMapper.createDefault(), Clock.systemUTC());
	}

}
