/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.client;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import io.authflow.http.HttpHeaders;
import io.authflow.json.JsonMapper;
import io.authflow.json.TypeRef;
import io.authflow.util.Assert;

/**
 * Factory methods for the common {@link ResponseDecoder}s: JSON through a
 * {@link JsonMapper}, plain text, and error message decoders.
 */
public final class ResponseDecoders {

	private static final Set<String> JSON = Set.of(HttpHeaders.APPLICATION_JSON);

	private static final Set<String> PLAIN_TEXT = Set.of(HttpHeaders.TEXT_PLAIN);

	private static final Set<String> ERROR_MEDIA_TYPES = Set.of(HttpHeaders.APPLICATION_JSON, HttpHeaders.TEXT_PLAIN,
			"text/html");

	private static final String[] ERROR_MESSAGE_FIELDS = { "error_description", "error", "message" };

	private ResponseDecoders() {
	}

	public static <T> ResponseDecoder<T> json(JsonMapper jsonMapper, Class<T> type) {
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		Assert.notNull(type, "type must not be null");
		return new SimpleDecoder<>(JSON, (body, contentType) -> jsonMapper.readValue(body, type));
	}

	public static <T> ResponseDecoder<T> json(JsonMapper jsonMapper, TypeRef<T> type) {
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		Assert.notNull(type, "type must not be null");
		return new SimpleDecoder<>(JSON, (body, contentType) -> jsonMapper.readValue(body, type));
	}

	/**
	 * Decodes {@code text/plain} bodies as strings, honouring the {@code charset}
	 * parameter. An empty body is the empty string.
	 * @return the decoder
	 */
	public static ResponseDecoder<String> plainText() {
		return new SimpleDecoder<>(PLAIN_TEXT, (body, contentType) -> new String(body, charset(contentType)));
	}

	public static <T> ResponseDecoder<T> plainText(Function<String, T> mapper) {
		return plainText().map(mapper);
	}

	/**
	 * Decodes error bodies into a message. JSON objects yield their
	 * {@code error_description}, {@code error} or {@code message} field, in that order of
	 * preference, or the whole document when none is a string. Text bodies are returned
	 * as they are.
	 * @param jsonMapper the mapper for JSON bodies
	 * @return the error decoder
	 */
	public static ResponseDecoder<String> errorMessage(JsonMapper jsonMapper) {
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		return new SimpleDecoder<>(ERROR_MEDIA_TYPES, (body, contentType) -> {
			String text = new String(body, charset(contentType));
			if (!HttpHeaders.APPLICATION_JSON.equals(ResponseDecoder.mediaType(contentType))) {
				return text;
			}
			Object json = jsonMapper.readValue(body, Object.class);
			if (json instanceof Map<?, ?> map) {
				for (String field : ERROR_MESSAGE_FIELDS) {
					if (map.get(field) instanceof String message) {
						return message;
					}
				}
			}
			return jsonMapper.writeValueAsString(json);
		});
	}

	/**
	 * Extracts the charset parameter of a {@code Content-Type} value.
	 * @param contentType the header value
	 * @return the charset, UTF-8 when absent or unknown
	 */
	static Charset charset(String contentType) {
		for (String param : contentType.split(";")) {
			String trimmed = param.trim();
			if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
				String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
				try {
					return Charset.forName(name);
				}
				catch (IllegalArgumentException e) {
					return StandardCharsets.UTF_8;
				}
			}
		}
		return StandardCharsets.UTF_8;
	}

	@FunctionalInterface
	private interface BodyReader<T> {

		T read(byte[] body, String contentType) throws IOException;

	}

	private static final class SimpleDecoder<T> implements ResponseDecoder<T> {

		private final Set<String> mediaTypes;

		private final BodyReader<T> reader;

		private SimpleDecoder(Set<String> mediaTypes, BodyReader<T> reader) {
			this.mediaTypes = mediaTypes;
			this.reader = reader;
		}

		@Override
		public Set<String> mediaTypes() {
			return mediaTypes;
		}

		@Override
		public T decode(byte[] body, String contentType) throws IOException {
			return reader.read(body, contentType);
		}

	}

}
