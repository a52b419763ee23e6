/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.client.transport;

import io.authflow.http.ClientRequest;
import io.authflow.http.RawResponse;
import reactor.core.publisher.Mono;

/**
 * Sends one request and emits its response. Implementations own connection handling,
 * timeouts and cancellation. Any failure to obtain a response is an error signal.
 */
@FunctionalInterface
public interface HttpTransport {

	/**
	 * Sends the request. Nothing is sent until the returned {@link Mono} is subscribed
	 * to.
	 * @param request the signed request
	 * @return the response, whatever its status
	 */
	Mono<RawResponse> send(ClientRequest request);

}
