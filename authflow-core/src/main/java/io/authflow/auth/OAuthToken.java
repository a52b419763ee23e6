/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import reactor.util.annotation.Nullable;

/**
 * Successful token endpoint response.
 *
 * @param accessToken the access token issued by the authorization server
 * @param tokenType the type of the token, usually {@code bearer}
 * @param expiresIn the lifetime in seconds of the access token
 * @param refreshToken the refresh token, if one was issued
 * @param scope the space-delimited scope of the access token, if returned
 * @see <a href="https://tools.ietf.org/html/rfc6749#section-5.1">RFC 6749 section
 * 5.1</a>
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record OAuthToken( // @formatter:off
	@JsonProperty("access_token") String accessToken,
	@JsonProperty("token_type") String tokenType,
	@JsonProperty("expires_in") Long expiresIn,
	@JsonProperty("refresh_token") @Nullable String refreshToken,
	@JsonProperty("scope") @Nullable String scope) { // @formatter:on

}
