/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.signer;

import io.authflow.auth.ClientPassword;
import io.authflow.http.ClientRequest;
import io.authflow.http.HttpHeaders;
import io.authflow.util.Assert;

/**
 * Authenticates the client itself with HTTP Basic credentials. Meant for requests to the
 * token endpoint, not for resource requests.
 *
 * @param clientPassword the client credentials
 */
public record ClientPasswordAuthentication(ClientPassword clientPassword) implements Signer {

	public ClientPasswordAuthentication {
		Assert.notNull(clientPassword, "clientPassword must not be null");
	}

	@Override
	public ClientRequest sign(ClientRequest request) {
		return request.withHeader(HttpHeaders.AUTHORIZATION, clientPassword.authorizationBasic());
	}

}
