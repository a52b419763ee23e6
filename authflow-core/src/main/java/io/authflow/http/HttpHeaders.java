/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.http;

/**
 * Names of HTTP headers and media types in use by signers and the request pipeline.
 */
public interface HttpHeaders {

	String AUTHORIZATION = "Authorization";

	String CONTENT_TYPE = "Content-Type";

	String ACCEPT = "Accept";

	String USER_AGENT = "User-Agent";

	String APPLICATION_JSON = "application/json";

	String APPLICATION_FORM_URLENCODED = "application/x-www-form-urlencoded";

	String TEXT_PLAIN = "text/plain";

}
