/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.client;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import io.authflow.grant.TokenRequest;
import io.authflow.http.ClientRequest;
import io.authflow.json.TypeRef;
import io.authflow.signer.Signer;
import io.authflow.util.Assert;
import reactor.core.publisher.Mono;

/**
 * A synchronous wrapper around {@link OAuthHttpClient}: every call blocks for at most
 * {@link OAuthClientConfig#blockTimeout()}. A call that does not complete in time
 * returns a {@link ErrorKind#TRANSPORT_FAILURE} result.
 */
public class SyncOAuthHttpClient {

	private final OAuthHttpClient delegate;

	private final Duration blockTimeout;

	public SyncOAuthHttpClient(OAuthHttpClient delegate) {
		Assert.notNull(delegate, "delegate must not be null");
		this.delegate = delegate;
		this.blockTimeout = delegate.config().blockTimeout();
	}

	public static SyncOAuthHttpClient create(OAuthClientConfig config) {
		return new SyncOAuthHttpClient(OAuthHttpClient.create(config));
	}

	public Signer signer() {
		return this.delegate.signer();
	}

	/**
	 * @return a client signing with another signer; this client is left unchanged
	 */
	public SyncOAuthHttpClient withSigner(Signer signer) {
		return new SyncOAuthHttpClient(this.delegate.withSigner(signer));
	}

	public OAuthHttpClient async() {
		return this.delegate;
	}

	public <T> HttpResult<T> execute(ClientRequest request, ResponseDecoder<T> decoder) {
		return block(this.delegate.execute(request, decoder));
	}

	public <T> HttpResult<T> execute(ClientRequest request, ResponseDecoder<T> decoder,
			ResponseDecoder<String> errorDecoder) {
		return block(this.delegate.execute(request, decoder, errorDecoder));
	}

	public <T> HttpResult<T> execute(TokenRequest<T> tokenRequest) {
		return block(this.delegate.execute(tokenRequest));
	}

	public <T> HttpResult<T> getJson(URI uri, Class<T> type) {
		return block(this.delegate.getJson(uri, type));
	}

	public <T> HttpResult<T> getJson(URI uri, TypeRef<T> type) {
		return block(this.delegate.getJson(uri, type));
	}

	public <T> HttpResult<T> postJson(URI uri, Object body, Class<T> type) {
		return block(this.delegate.postJson(uri, body, type));
	}

	public HttpResult<String> getPlainText(URI uri) {
		return block(this.delegate.getPlainText(uri));
	}

	private <T> HttpResult<T> block(Mono<HttpResult<T>> result) {
		HttpResult<T> outcome = result.timeout(this.blockTimeout)
			.onErrorResume(TimeoutException.class, ex -> Mono.just(ResponseClassifier.<T>transportFailure(ex)))
			.block();
		return (outcome != null) ? outcome : ResponseClassifier.transportFailure(null);
	}

}
