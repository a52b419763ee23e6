/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import io.authflow.util.Assert;

/**
 * Client credentials registered with the authorization server, as used by the HTTP Basic
 * client authentication scheme.
 *
 * @param clientId the client identifier
 * @param clientSecret the client secret
 * @see <a href="https://tools.ietf.org/html/rfc6749#section-2.3.1">RFC 6749 section
 * 2.3.1</a>
 */
public record ClientPassword(String clientId, String clientSecret) {

	public ClientPassword {
		Assert.hasText(clientId, "clientId must not be empty");
		Assert.notNull(clientSecret, "clientSecret must not be null");
	}

	/**
	 * Returns the value of the {@code Authorization} header for HTTP Basic authentication
	 * (RFC 7617).
	 * @return {@code Basic base64(clientId:clientSecret)}
	 */
	public String authorizationBasic() {
		String credentials = clientId + ":" + clientSecret;
		return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
	}

	@Override
	public String toString() {
		return "ClientPassword[clientId=" + clientId + ", clientSecret=******]";
	}

}
