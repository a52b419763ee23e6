/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.grant;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import io.authflow.auth.AuthorizationRequest;
import io.authflow.auth.ClientPassword;
import io.authflow.auth.PkceChallenge;
import io.authflow.auth.State;
import io.authflow.client.ResponseDecoder;
import io.authflow.http.ClientRequest;
import io.authflow.http.HttpHeaders;
import io.authflow.signer.ClientPasswordAuthentication;
import io.authflow.util.Assert;
import io.authflow.util.Utils;

/**
 * Request construction and redirect validation shared by the grants.
 */
final class AuthorizationSupport {

	private AuthorizationSupport() {
	}

	static URI authorizationUri(String responseType, AuthorizationRequest request, URI serverUri) {
		Assert.notNull(request, "request must not be null");
		Assert.notNull(serverUri, "serverUri must not be null");
		Map<String, String> params = new LinkedHashMap<>();
		params.put("client_id", request.clientId());
		params.put("response_type", responseType);
		params.put("redirect_uri", request.redirectUri().value().toString());
		if (request.state() != null) {
			params.put("state", request.state().value());
		}
		if (!request.scopes().isEmpty()) {
			params.put("scope", request.scopes().spaceDelimited());
		}
		PkceChallenge pkce = request.pkce();
		if (pkce != null) {
			params.put("code_challenge", pkce.codeChallenge());
			params.put("code_challenge_method", PkceChallenge.METHOD_S256);
		}
		return Utils.appendQuery(serverUri, Utils.formEncode(params));
	}

	/**
	 * Checks the {@code state} of a redirect against the one that was sent.
	 * @return the error code, empty when the state is valid or none was sent
	 */
	static Optional<String> stateError(AuthorizationRequest request, Map<String, String> params) {
		State expected = request.state();
		if (expected == null) {
			return Optional.empty();
		}
		String actual = params.get("state");
		if (actual == null) {
			return Optional.of(AuthorizationErrors.MISSING_REQUIRED_STATE_PARAMETER);
		}
		if (!expected.value().equals(actual)) {
			return Optional.of(AuthorizationErrors.STATE_PARAMETER_MISMATCH);
		}
		return Optional.empty();
	}

	static <T> TokenRequest<T> tokenRequest(URI serverUri, Map<String, String> form, ClientPassword clientPassword,
			ResponseDecoder<T> decoder) {
		Assert.notNull(serverUri, "serverUri must not be null");
		Assert.notNull(clientPassword, "clientPassword must not be null");
		ClientRequest request = ClientRequest.post(serverUri)
			.header(HttpHeaders.ACCEPT, HttpHeaders.APPLICATION_JSON)
			.formBody(form)
			.build();
		return new TokenRequest<>(request, new ClientPasswordAuthentication(clientPassword), decoder);
	}

}
