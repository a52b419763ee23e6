/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.http;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import io.authflow.util.Assert;
import io.authflow.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * Immutable description of an outgoing HTTP request. Signers derive new instances from
 * it through {@link #withHeader(String, String)}; nothing mutates a request in place.
 */
public final class ClientRequest {

	private final HttpMethod method;

	private final URI uri;

	private final Map<String, String> headers;

	private final byte[] body;

	private ClientRequest(Builder builder) {
		this.method = builder.method;
		this.uri = builder.uri;
		TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		copy.putAll(builder.headers);
		this.headers = Collections.unmodifiableMap(copy);
		this.body = builder.body;
	}

	public static Builder builder(HttpMethod method, URI uri) {
		return new Builder(method, uri);
	}

	public static Builder get(URI uri) {
		return new Builder(HttpMethod.GET, uri);
	}

	public static Builder post(URI uri) {
		return new Builder(HttpMethod.POST, uri);
	}

	public HttpMethod method() {
		return method;
	}

	public URI uri() {
		return uri;
	}

	/**
	 * Returns the request headers; lookups are case-insensitive.
	 * @return an unmodifiable map of header names to values
	 */
	public Map<String, String> headers() {
		return headers;
	}

	public Optional<String> header(String name) {
		return Optional.ofNullable(headers.get(name));
	}

	/**
	 * Returns the request body, or {@code null} when the request has none. The array is
	 * shared, callers must not modify it.
	 * @return the body bytes
	 */
	@Nullable
	public byte[] body() {
		return body;
	}

	/**
	 * Returns the decoded form parameters of the body when the request is
	 * {@code application/x-www-form-urlencoded}.
	 * @return the form parameters, empty for any other kind of body
	 */
	public Map<String, String> formParameters() {
		boolean isForm = header(HttpHeaders.CONTENT_TYPE)
			.map(type -> type.toLowerCase(Locale.ROOT).startsWith(HttpHeaders.APPLICATION_FORM_URLENCODED))
			.orElse(false);
		if (!isForm || body == null) {
			return Map.of();
		}
		return Utils.formDecode(new String(body, StandardCharsets.UTF_8));
	}

	/**
	 * Returns a copy of this request with the given header set, replacing any existing
	 * value of the same name.
	 * @param name the header name
	 * @param value the header value
	 * @return the new request
	 */
	public ClientRequest withHeader(String name, String value) {
		return mutate().header(name, value).build();
	}

	public Builder mutate() {
		Builder builder = new Builder(method, uri);
		builder.headers.putAll(headers);
		builder.body = body;
		return builder;
	}

	@Override
	public String toString() {
		return "ClientRequest[" + method + " " + uri + "]";
	}

	/**
	 * Builder for {@link ClientRequest}.
	 */
	public static final class Builder {

		private final HttpMethod method;

		private final URI uri;

		private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		private byte[] body;

		private Builder(HttpMethod method, URI uri) {
			Assert.notNull(method, "method must not be null");
			Assert.notNull(uri, "uri must not be null");
			this.method = method;
			this.uri = uri;
		}

		public Builder header(String name, String value) {
			Assert.hasText(name, "header name must not be empty");
			Assert.notNull(value, "header value must not be null");
			this.headers.put(name, value);
			return this;
		}

		public Builder body(byte[] body, String contentType) {
			this.body = body;
			return header(HttpHeaders.CONTENT_TYPE, contentType);
		}

		public Builder body(String body, String contentType) {
			return body(body.getBytes(StandardCharsets.UTF_8), contentType);
		}

		/**
		 * Sets an {@code application/x-www-form-urlencoded} body, keeping the iteration
		 * order of the given map.
		 * @param params the form parameters
		 * @return this builder
		 */
		public Builder formBody(Map<String, String> params) {
			return body(Utils.formEncode(params), HttpHeaders.APPLICATION_FORM_URLENCODED);
		}

		public ClientRequest build() {
			return new ClientRequest(this);
		}

	}

}
