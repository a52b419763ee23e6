/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.client;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;

import io.authflow.client.transport.HttpTransport;
import io.authflow.client.transport.JdkHttpTransport;
import io.authflow.grant.TokenRequest;
import io.authflow.http.ClientRequest;
import io.authflow.http.HttpHeaders;
import io.authflow.json.JsonMapper;
import io.authflow.json.TypeRef;
import io.authflow.signer.Signer;
import io.authflow.util.Assert;
import reactor.core.publisher.Mono;

/**
 * Asynchronous client signing every request with its {@link Signer}. Each method
 * returns a lazy {@link Mono} emitting exactly one {@link HttpResult}.
 *
 * <p>
 * A client holds one signer; {@link #withSigner(Signer)} returns a new client sharing
 * the same transport, for instance once a token exchange succeeded: <pre>{@code
 * OAuthHttpClient client = OAuthHttpClient.create(config);
 * HttpResult<NonRefreshableTokenSigner> token = client
 * 	.execute(ClientCredentialsGrant.accessTokenRequest(tokenUri, clientPassword))
 * 	.block();
 * OAuthHttpClient authorized = client.withSigner(token.orElseThrow());
 * }</pre>
 */
public class OAuthHttpClient {

	private final OAuthClientConfig config;

	private final HttpTransport transport;

	private final RequestPipeline pipeline;

	private final JsonMapper jsonMapper;

	private final ResponseDecoder<String> errorDecoder;

	public OAuthHttpClient(OAuthClientConfig config, HttpTransport transport) {
		this(config, transport, (config != null) ? config.jsonMapper() : null);
	}

	private OAuthHttpClient(OAuthClientConfig config, HttpTransport transport, JsonMapper jsonMapper) {
		Assert.notNull(config, "config must not be null");
		Assert.notNull(transport, "transport must not be null");
		this.config = config;
		this.transport = transport;
		this.pipeline = new RequestPipeline(transport);
		this.jsonMapper = jsonMapper;
		this.errorDecoder = ResponseDecoders.errorMessage(jsonMapper);
	}

	/**
	 * Creates a client on a {@link JdkHttpTransport} using the timeouts of the
	 * configuration.
	 * @param config the configuration
	 * @return the client
	 */
	public static OAuthHttpClient create(OAuthClientConfig config) {
		Assert.notNull(config, "config must not be null");
		HttpTransport transport = JdkHttpTransport.builder()
			.connectTimeout(config.connectTimeout())
			.requestTimeout(config.requestTimeout())
			.build();
		return new OAuthHttpClient(config, transport);
	}

	public OAuthClientConfig config() {
		return this.config;
	}

	public Signer signer() {
		return this.config.signer();
	}

	public JsonMapper jsonMapper() {
		return this.jsonMapper;
	}

	/**
	 * Returns a client signing with another signer. This client is left unchanged.
	 * @param signer the new signer
	 * @return a new client sharing this client's transport
	 */
	public OAuthHttpClient withSigner(Signer signer) {
		return new OAuthHttpClient(this.config.withSigner(signer), this.transport, this.jsonMapper);
	}

	public <T> Mono<HttpResult<T>> execute(ClientRequest request, ResponseDecoder<T> decoder) {
		return execute(request, decoder, this.errorDecoder);
	}

	public <T> Mono<HttpResult<T>> execute(ClientRequest request, ResponseDecoder<T> decoder,
			ResponseDecoder<String> errorDecoder) {
		return this.pipeline.execute(signer(), prepare(request), decoder, errorDecoder);
	}

	/**
	 * Executes a token request with its own client authentication, regardless of the
	 * signer of this client.
	 * @param tokenRequest the token request
	 * @param <T> the signer type obtained
	 * @return the token exchange outcome
	 */
	public <T> Mono<HttpResult<T>> execute(TokenRequest<T> tokenRequest) {
		Assert.notNull(tokenRequest, "tokenRequest must not be null");
		return this.pipeline.execute(tokenRequest.signer(), prepare(tokenRequest.request()), tokenRequest.decoder(),
				this.errorDecoder);
	}

	public <T> Mono<HttpResult<T>> getJson(URI uri, Class<T> type) {
		return execute(ClientRequest.get(uri).header(HttpHeaders.ACCEPT, HttpHeaders.APPLICATION_JSON).build(),
				ResponseDecoders.json(this.jsonMapper, type));
	}

	public <T> Mono<HttpResult<T>> getJson(URI uri, TypeRef<T> type) {
		return execute(ClientRequest.get(uri).header(HttpHeaders.ACCEPT, HttpHeaders.APPLICATION_JSON).build(),
				ResponseDecoders.json(this.jsonMapper, type));
	}

	/**
	 * Posts a value serialized as JSON and decodes the JSON response.
	 * @param uri the target
	 * @param body the value to serialize
	 * @param type the response type
	 * @param <T> the response type
	 * @return the outcome
	 * @throws UncheckedIOException if the body cannot be serialized
	 */
	public <T> Mono<HttpResult<T>> postJson(URI uri, Object body, Class<T> type) {
		Assert.notNull(body, "body must not be null");
		byte[] json;
		try {
			json = this.jsonMapper.writeValueAsBytes(body);
		}
		catch (IOException ex) {
			throw new UncheckedIOException("Failed to serialize request body", ex);
		}
		ClientRequest request = ClientRequest.post(uri)
			.header(HttpHeaders.ACCEPT, HttpHeaders.APPLICATION_JSON)
			.body(json, HttpHeaders.APPLICATION_JSON)
			.build();
		return execute(request, ResponseDecoders.json(this.jsonMapper, type));
	}

	public Mono<HttpResult<String>> getPlainText(URI uri) {
		return execute(ClientRequest.get(uri).header(HttpHeaders.ACCEPT, HttpHeaders.TEXT_PLAIN).build(),
				ResponseDecoders.plainText());
	}

	private ClientRequest prepare(ClientRequest request) {
		Assert.notNull(request, "request must not be null");
		if (request.header(HttpHeaders.USER_AGENT).isPresent()) {
			return request;
		}
		return request.withHeader(HttpHeaders.USER_AGENT, this.config.userAgent().headerValue());
	}

}
