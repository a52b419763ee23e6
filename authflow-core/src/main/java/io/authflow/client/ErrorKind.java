/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.client;

/**
 * Categories of {@link HttpError}.
 */
public enum ErrorKind {

	/**
	 * The response had no {@code Content-Type}, or one the decoder cannot read.
	 */
	UNSUPPORTED_MEDIA_TYPE,

	/**
	 * A success response whose body did not have the expected shape.
	 */
	DECODING_FAILURE,

	/**
	 * An error response without body.
	 */
	EMPTY_RESPONSE,

	/**
	 * An error response from the server, decoded into a message.
	 */
	ERROR_RESPONSE,

	/**
	 * No response was received: connection error, timeout or cancellation.
	 */
	TRANSPORT_FAILURE

}
