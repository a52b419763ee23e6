/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.http;

import io.authflow.util.Assert;

/**
 * A response as received by the transport, before classification and decoding.
 *
 * @param statusCode the HTTP status code
 * @param headers the response headers
 * @param body the response body, empty when the server sent none
 */
public record RawResponse(int statusCode, ResponseHeaders headers, byte[] body) {

	public RawResponse {
		Assert.notNull(headers, "headers must not be null");
		if (body == null) {
			body = new byte[0];
		}
	}

}
