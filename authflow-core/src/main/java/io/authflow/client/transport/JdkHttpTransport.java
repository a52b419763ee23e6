/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.client.transport;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import io.authflow.http.ClientRequest;
import io.authflow.http.RawResponse;
import io.authflow.http.ResponseHeaders;
import io.authflow.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * {@link HttpTransport} on top of the JDK {@link HttpClient}. Requests are sent with
 * {@link HttpClient#sendAsync}; cancelling the subscription cancels the exchange.
 */
public class JdkHttpTransport implements HttpTransport {

	private static final Logger logger = LoggerFactory.getLogger(JdkHttpTransport.class);

	public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	private final HttpClient httpClient;

	private final Duration requestTimeout;

	JdkHttpTransport(HttpClient httpClient, Duration requestTimeout) {
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(requestTimeout, "requestTimeout must not be null");
		this.httpClient = httpClient;
		this.requestTimeout = requestTimeout;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public Mono<RawResponse> send(ClientRequest request) {
		Assert.notNull(request, "request must not be null");
		return Mono.fromFuture(() -> {
			HttpRequest httpRequest = toHttpRequest(request);
			logger.trace("Sending {} {}", request.method(), request.uri());
			return this.httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
		}).map(response -> new RawResponse(response.statusCode(), ResponseHeaders.of(response.headers().map()),
				response.body()));
	}

	private HttpRequest toHttpRequest(ClientRequest request) {
		byte[] body = request.body();
		HttpRequest.BodyPublisher publisher = (body != null) ? HttpRequest.BodyPublishers.ofByteArray(body)
				: HttpRequest.BodyPublishers.noBody();
		HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
			.method(request.method().name(), publisher)
			.timeout(this.requestTimeout);
		request.headers().forEach(builder::header);
		return builder.build();
	}

	/**
	 * Builder for {@link JdkHttpTransport}.
	 */
	public static class Builder {

		private HttpClient.Builder clientBuilder = HttpClient.newBuilder()
			.version(HttpClient.Version.HTTP_1_1)
			.followRedirects(HttpClient.Redirect.NORMAL);

		private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		Builder() {
		}

		/**
		 * Sets the {@link HttpClient.Builder} to start from, for proxies, TLS settings
		 * or executors.
		 * @param clientBuilder the client builder
		 * @return this builder
		 */
		public Builder clientBuilder(HttpClient.Builder clientBuilder) {
			Assert.notNull(clientBuilder, "clientBuilder must not be null");
			this.clientBuilder = clientBuilder;
			return this;
		}

		public Builder connectTimeout(Duration connectTimeout) {
			Assert.notNull(connectTimeout, "connectTimeout must not be null");
			this.connectTimeout = connectTimeout;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "requestTimeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public JdkHttpTransport build() {
			return new JdkHttpTransport(this.clientBuilder.connectTimeout(this.connectTimeout).build(),
					this.requestTimeout);
		}

	}

}
