/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.grant;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Set;

import io.authflow.auth.AccessToken;
import io.authflow.auth.OAuthToken;
import io.authflow.auth.RefreshToken;
import io.authflow.auth.Scope;
import io.authflow.client.ResponseDecoder;
import io.authflow.http.HttpHeaders;
import io.authflow.json.JsonMapper;
import io.authflow.signer.AccessTokenSigner;
import io.authflow.signer.NonRefreshableTokenSigner;
import io.authflow.util.Assert;
import io.authflow.util.Utils;

/**
 * Decoders turning a JSON token endpoint response into a token signer stamped with the
 * instant of decoding.
 *
 * @see <a href="https://tools.ietf.org/html/rfc6749#section-5.1">RFC 6749 section
 * 5.1</a>
 */
public final class TokenDecoders {

	private TokenDecoders() {
	}

	public static ResponseDecoder<AccessTokenSigner> accessTokenSigner(JsonMapper jsonMapper, Clock clock) {
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		Assert.notNull(clock, "clock must not be null");
		return new TokenDecoder<>(jsonMapper, clock) {
			@Override
			AccessTokenSigner toSigner(OAuthToken token, Instant generatedAt) throws TokenParseException {
				return toAccessTokenSigner(token, generatedAt);
			}
		};
	}

	public static ResponseDecoder<NonRefreshableTokenSigner> nonRefreshableTokenSigner(JsonMapper jsonMapper,
			Clock clock) {
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		Assert.notNull(clock, "clock must not be null");
		return new TokenDecoder<>(jsonMapper, clock) {
			@Override
			NonRefreshableTokenSigner toSigner(OAuthToken token, Instant generatedAt) throws TokenParseException {
				return toNonRefreshableTokenSigner(token, generatedAt);
			}
		};
	}

	public static AccessTokenSigner toAccessTokenSigner(OAuthToken token, Instant generatedAt)
			throws TokenParseException {
		validate(token);
		RefreshToken refreshToken = Utils.hasText(token.refreshToken()) ? new RefreshToken(token.refreshToken())
				: null;
		return new AccessTokenSigner(generatedAt, new AccessToken(token.accessToken()), token.tokenType(),
				token.expiresIn(), refreshToken, Scope.parse(token.scope()));
	}

	public static NonRefreshableTokenSigner toNonRefreshableTokenSigner(OAuthToken token, Instant generatedAt)
			throws TokenParseException {
		validate(token);
		return new NonRefreshableTokenSigner(generatedAt, new AccessToken(token.accessToken()), token.tokenType(),
				token.expiresIn(), Scope.parse(token.scope()));
	}

	private static void validate(OAuthToken token) throws TokenParseException {
		if (token == null) {
			throw new TokenParseException("Token response is empty");
		}
		if (!Utils.hasText(token.accessToken())) {
			throw new TokenParseException("Token response has no access_token");
		}
		if (!Utils.hasText(token.tokenType())) {
			throw new TokenParseException("Token response has no token_type");
		}
		if (token.expiresIn() == null) {
			throw new TokenParseException("Token response has no expires_in");
		}
	}

	private abstract static class TokenDecoder<T> implements ResponseDecoder<T> {

		private final JsonMapper jsonMapper;

		private final Clock clock;

		TokenDecoder(JsonMapper jsonMapper, Clock clock) {
			this.jsonMapper = jsonMapper;
			this.clock = clock;
		}

		@Override
		public Set<String> mediaTypes() {
			return Set.of(HttpHeaders.APPLICATION_JSON);
		}

		@Override
		public T decode(byte[] body, String contentType) throws IOException {
			OAuthToken token = this.jsonMapper.readValue(body, OAuthToken.class);
			return toSigner(token, this.clock.instant());
		}

		abstract T toSigner(OAuthToken token, Instant generatedAt) throws TokenParseException;

	}

}
