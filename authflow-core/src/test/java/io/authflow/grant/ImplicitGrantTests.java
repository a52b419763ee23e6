/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.grant;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import io.authflow.auth.AuthorizationRequest;
import io.authflow.auth.RedirectUri;
import io.authflow.auth.Scope;
import io.authflow.auth.State;
import io.authflow.signer.NonRefreshableTokenSigner;
import io.authflow.util.Utils;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ImplicitGrantTests {

	private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

	private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

	private static final RedirectUri REDIRECT_URI = RedirectUri.of("https://app.example.com/callback");

	private final AuthorizationRequest statelessRequest = new AuthorizationRequest("client-1", REDIRECT_URI, null,
			Scope.of("read"));

	private final AuthorizationRequest request = new AuthorizationRequest("client-1", REDIRECT_URI,
			new State("s-1"), Scope.of("read"));

	private static URI fragment(String params) {
		return URI.create(REDIRECT_URI.value() + "#" + params);
	}

	private static String error(AuthorizationRequest request, URI redirect) {
		return ImplicitGrant.parseAccessTokenResponse(request, redirect, CLOCK).failure().orElseThrow();
	}

	@Test
	void authorizationUriRequestsToken() {
		URI uri = ImplicitGrant.authorizationUri(request, URI.create("https://accounts.example.com/authorize"));

		assertThat(Utils.formDecode(uri.getRawQuery())).containsEntry("response_type", "token")
			.containsEntry("state", "s-1")
			.containsEntry("scope", "read");
	}

	@Test
	void tokenInFragmentIsSuccess() {
		GrantResult<NonRefreshableTokenSigner> result = ImplicitGrant.parseAccessTokenResponse(statelessRequest,
				fragment("access_token=tok123&token_type=bearer&expires_in=3600"), CLOCK);

		NonRefreshableTokenSigner signer = result.orElseThrow();
		assertThat(signer.accessToken().value()).isEqualTo("tok123");
		assertThat(signer.tokenType()).isEqualTo("bearer");
		assertThat(signer.expiresIn()).isEqualTo(3600);
		assertThat(signer.generatedAt()).isEqualTo(NOW);
		assertThat(signer.scope().isEmpty()).isTrue();
	}

	@Test
	void tokenInQueryWithScopeIsSuccess() {
		GrantResult<NonRefreshableTokenSigner> result = ImplicitGrant.parseAccessTokenResponse(request,
				URI.create(REDIRECT_URI.value()
						+ "?access_token=tok123&token_type=bearer&expires_in=60&scope=read+write&state=s-1"),
				CLOCK);

		assertThat(result.orElseThrow().scope()).isEqualTo(Scope.of("write", "read"));
	}

	@Test
	void stateIsCheckedFirst() {
		assertThat(error(request, fragment("access_token=tok123&token_type=bearer&expires_in=3600")))
			.isEqualTo("missing_required_state_parameter");
		assertThat(error(request, fragment("error=access_denied&state=other")))
			.isEqualTo("state_parameter_mismatch");
	}

	@Test
	void serverErrorIsPassedThrough() {
		assertThat(error(request, fragment("error=access_denied&state=s-1"))).isEqualTo("access_denied");
	}

	@Test
	void missingFieldsAreReported() {
		assertThat(error(statelessRequest, fragment("token_type=bearer&expires_in=3600")))
			.isEqualTo("missing_access_token");
		assertThat(error(statelessRequest, fragment("access_token=tok123&expires_in=3600")))
			.isEqualTo("missing_token_type");
		assertThat(error(statelessRequest, fragment("access_token=tok123&token_type=bearer")))
			.isEqualTo("missing_expires_in");
	}

	@Test
	void nonNumericExpiresInIsInvalid() {
		assertThat(error(statelessRequest, fragment("access_token=tok123&token_type=bearer&expires_in=soon")))
			.isEqualTo("invalid_expires_in");
		assertThat(error(statelessRequest,
				fragment("access_token=tok123&token_type=bearer&expires_in=99999999999999999999")))
			.isEqualTo("invalid_expires_in");
	}

	@Test
	void negativeExpiresInGivesExpiredToken() {
		GrantResult<NonRefreshableTokenSigner> result = ImplicitGrant.parseAccessTokenResponse(statelessRequest,
				fragment("access_token=tok123&token_type=bearer&expires_in=-1"));

		assertThat(result.isSuccess()).isTrue();
		assertThat(result.orElseThrow().expiresIn()).isEqualTo(-1);
		assertThat(result.orElseThrow().isExpired()).isTrue();
	}

	@Test
	void hugeExpiresInNeverExpires() {
		GrantResult<NonRefreshableTokenSigner> result = ImplicitGrant.parseAccessTokenResponse(statelessRequest,
				fragment("access_token=tok123&token_type=bearer&expires_in=9223372036854775807"));

		assertThat(result.orElseThrow().expiresAt()).isEqualTo(Instant.MAX);
		assertThat(result.orElseThrow().isExpired()).isFalse();
	}

}
