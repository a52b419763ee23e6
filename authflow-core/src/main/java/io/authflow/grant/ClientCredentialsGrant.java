/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.grant;

import java.net.URI;
import java.time.Clock;
import java.util.Map;

import io.authflow.auth.ClientPassword;
import io.authflow.client.ResponseDecoder;
import io.authflow.json.JsonMapper;
import io.authflow.signer.NonRefreshableTokenSigner;

/**
 * The client credentials grant: the client authenticates with its own credentials and
 * receives an access token without refresh token.
 *
 * @see <a href="https://tools.ietf.org/html/rfc6749#section-4.4">RFC 6749 section
 * 4.4</a>
 */
public final class ClientCredentialsGrant {

	private ClientCredentialsGrant() {
	}

	public static TokenRequest<NonRefreshableTokenSigner> accessTokenRequest(URI serverUri,
			ClientPassword clientPassword) {
		return accessTokenRequest(serverUri, clientPassword,
				TokenDecoders.nonRefreshableTokenSigner(JsonMapper.createDefault(), Clock.systemUTC()));
	}

	public static TokenRequest<NonRefreshableTokenSigner> accessTokenRequest(URI serverUri,
			ClientPassword clientPassword, ResponseDecoder<NonRefreshableTokenSigner> decoder) {
		return AuthorizationSupport.tokenRequest(serverUri, Map.of("grant_type", "client_credentials"),
				clientPassword, decoder);
	}

}
