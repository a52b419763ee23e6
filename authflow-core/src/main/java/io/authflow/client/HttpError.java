/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.client;

import io.authflow.http.ResponseHeaders;
import io.authflow.util.Assert;

/**
 * A failed HTTP call, as a value.
 *
 * @param kind what went wrong
 * @param status the HTTP status of the response, or {@link #INTERNAL_SERVER_ERROR} when
 * no response was received or a successful body could not be decoded
 * @param message a message safe to show to the caller
 * @param headers the response headers, empty when there was no response
 */
public record HttpError(ErrorKind kind, int status, String message, ResponseHeaders headers) {

	public static final int INTERNAL_SERVER_ERROR = 500;

	public HttpError {
		Assert.notNull(kind, "kind must not be null");
		Assert.notNull(message, "message must not be null");
		if (headers == null) {
			headers = ResponseHeaders.empty();
		}
	}

}
