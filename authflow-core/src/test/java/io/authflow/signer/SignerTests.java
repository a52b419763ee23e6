/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.signer;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import io.authflow.auth.AccessToken;
import io.authflow.auth.ClientPassword;
import io.authflow.auth.RefreshToken;
import io.authflow.auth.Scope;
import io.authflow.http.ClientRequest;
import io.authflow.http.HttpHeaders;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SignerTests {

	private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

	private final ClientRequest request = ClientRequest.get(URI.create("https://api.example.com/me"))
		.header(HttpHeaders.AUTHORIZATION, "Bearer stale")
		.header(HttpHeaders.ACCEPT, HttpHeaders.APPLICATION_JSON)
		.build();

	@Test
	void disabledReturnsRequestUnchanged() {
		assertThat(Signer.disabled().sign(request)).isSameAs(request);
	}

	@Test
	void clientPasswordReplacesAuthorization() {
		ClientRequest signed = new ClientPasswordAuthentication(new ClientPassword("abc", "xyz")).sign(request);

		assertThat(signed.header("authorization")).hasValue("Basic YWJjOnh5eg==");
		assertThat(signed.headers()).hasSize(2);
		assertThat(request.header(HttpHeaders.AUTHORIZATION)).hasValue("Bearer stale");
	}

	@Test
	void tokenSignersAttachBearerToken() {
		AccessTokenSigner refreshable = new AccessTokenSigner(NOW, new AccessToken("tok123"), "bearer", 3600,
				new RefreshToken("refresh"), Scope.empty());
		NonRefreshableTokenSigner nonRefreshable = new NonRefreshableTokenSigner(NOW, new AccessToken("tok456"),
				"bearer", 3600, Scope.of("read"));

		assertThat(refreshable.sign(request).header(HttpHeaders.AUTHORIZATION)).hasValue("Bearer tok123");
		assertThat(nonRefreshable.sign(request).header(HttpHeaders.AUTHORIZATION)).hasValue("Bearer tok456");
	}

	@Test
	void expiryIsGeneratedAtPlusExpiresIn() {
		NonRefreshableTokenSigner signer = new NonRefreshableTokenSigner(NOW, new AccessToken("tok"), "bearer", 60,
				Scope.empty());

		assertThat(signer.expiresAt()).isEqualTo(NOW.plusSeconds(60));
		assertThat(signer.isExpired(Clock.fixed(NOW.plusSeconds(59), ZoneOffset.UTC))).isFalse();
		assertThat(signer.isExpired(Clock.fixed(NOW.plusSeconds(60), ZoneOffset.UTC))).isTrue();
	}

	@Test
	void expiryBeyondInstantRangeIsClamped() {
		NonRefreshableTokenSigner longLived = new NonRefreshableTokenSigner(NOW, new AccessToken("tok"), "bearer",
				Long.MAX_VALUE, Scope.empty());
		AccessTokenSigner longExpired = new AccessTokenSigner(NOW, new AccessToken("tok"), "bearer", Long.MIN_VALUE,
				null, Scope.empty());

		assertThat(longLived.expiresAt()).isEqualTo(Instant.MAX);
		assertThat(longLived.isExpired()).isFalse();
		assertThat(longExpired.expiresAt()).isEqualTo(Instant.MIN);
		assertThat(longExpired.isExpired()).isTrue();
	}

	@Test
	void refreshedSignerKeepsPreviousRefreshTokenWhenNoneIssued() {
		AccessTokenSigner original = new AccessTokenSigner(NOW, new AccessToken("old"), "bearer", 3600,
				new RefreshToken("refresh"), Scope.of("read"));
		AccessTokenSigner refreshed = new AccessTokenSigner(NOW.plusSeconds(3600), new AccessToken("new"), "bearer",
				3600, null, Scope.of("read"));

		AccessTokenSigner merged = original.refreshedWith(refreshed);

		assertThat(merged.accessToken().value()).isEqualTo("new");
		assertThat(merged.refreshToken()).isEqualTo(new RefreshToken("refresh"));
		assertThat(merged.generatedAt()).isEqualTo(NOW.plusSeconds(3600));
	}

}
