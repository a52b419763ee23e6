/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.http;

/**
 * HTTP methods supported by {@link ClientRequest}.
 */
public enum HttpMethod {

	GET, POST, PUT, PATCH, DELETE

}
