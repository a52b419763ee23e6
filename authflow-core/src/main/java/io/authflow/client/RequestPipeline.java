/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.client;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import io.authflow.client.transport.HttpTransport;
import io.authflow.http.ClientRequest;
import io.authflow.http.HttpHeaders;
import io.authflow.signer.Disabled;
import io.authflow.signer.Signer;
import io.authflow.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Executes one request: sign, send through the {@link HttpTransport}, classify with
 * {@link ResponseClassifier}. There are no retries. A transport that errors or completes
 * without a response yields {@link ErrorKind#TRANSPORT_FAILURE}.
 */
public class RequestPipeline {

	private static final Logger logger = LoggerFactory.getLogger(RequestPipeline.class);

	private static final String MASK = "******";

	private final HttpTransport transport;

	public RequestPipeline(HttpTransport transport) {
		Assert.notNull(transport, "transport must not be null");
		this.transport = transport;
	}

	/**
	 * Describes the execution of a request. Nothing happens until the returned
	 * {@link Mono} is subscribed to; each subscription signs and sends again.
	 * @param signer the signer applied to the request
	 * @param request the unsigned request
	 * @param decoder the decoder for 2xx bodies
	 * @param errorDecoder the decoder for error bodies
	 * @param <T> the success body type
	 * @return the outcome; only a signer failing with an exception is signalled as an
	 * error
	 */
	public <T> Mono<HttpResult<T>> execute(Signer signer, ClientRequest request, ResponseDecoder<T> decoder,
			ResponseDecoder<String> errorDecoder) {
		Assert.notNull(signer, "signer must not be null");
		Assert.notNull(request, "request must not be null");
		Assert.notNull(decoder, "decoder must not be null");
		Assert.notNull(errorDecoder, "errorDecoder must not be null");

		return Mono.defer(() -> {
			ClientRequest signed = sign(signer, request);
			return Mono.defer(() -> this.transport.send(signed))
				.doOnNext(response -> logger.debug("Received {} for {} {} with headers {}", response.statusCode(),
						signed.method(), signed.uri(), response.headers()))
				.map(response -> ResponseClassifier.classify(response, decoder, errorDecoder))
				.onErrorResume(ex -> {
					logger.error("Request {} {} failed", signed.method(), signed.uri(), ex);
					return Mono.just(ResponseClassifier.<T>transportFailure(ex));
				})
				.switchIfEmpty(Mono.fromSupplier(() -> {
					logger.error("No response received for {} {}", signed.method(), signed.uri());
					return ResponseClassifier.<T>transportFailure(null);
				}))
				.doOnCancel(() -> logger.debug("Request {} {} cancelled", signed.method(), signed.uri()));
		});
	}

	private ClientRequest sign(Signer signer, ClientRequest request) {
		if (signer instanceof Disabled) {
			logger.warn("Request {} {} is sent without authorization", request.method(), request.uri());
		}
		ClientRequest signed = signer.sign(request);
		if (logger.isDebugEnabled()) {
			logger.debug("Sending {} {} with headers {}", signed.method(), signed.uri(), maskedHeaders(signed));
		}
		return signed;
	}

	static Map<String, String> maskedHeaders(ClientRequest request) {
		return request.headers()
			.entrySet()
			.stream()
			.collect(Collectors.toMap(Map.Entry::getKey,
					entry -> HttpHeaders.AUTHORIZATION.equalsIgnoreCase(entry.getKey()) ? mask(entry.getValue())
							: entry.getValue(),
					(a, b) -> a, () -> new TreeMap<>(String.CASE_INSENSITIVE_ORDER)));
	}

	private static String mask(String authorization) {
		int space = authorization.indexOf(' ');
		return (space > 0) ? authorization.substring(0, space) + " " + MASK : MASK;
	}

}
