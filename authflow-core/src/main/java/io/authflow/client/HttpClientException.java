/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.client;

/**
 * Thrown by {@link HttpResult#orElseThrow()} for callers that prefer exceptions to
 * result values.
 */
public class HttpClientException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final transient HttpError error;

	public HttpClientException(HttpError error) {
		super(error.kind() + " (HTTP " + error.status() + "): " + error.message());
		this.error = error;
	}

	public HttpError getError() {
		return this.error;
	}

}
