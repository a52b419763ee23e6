/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.client;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

import reactor.util.annotation.Nullable;

/**
 * Turns a response body into a value. Each call site supplies the decoder it needs; the
 * pipeline uses one for success bodies and another one for error bodies.
 *
 * @param <T> the decoded type
 * @see ResponseDecoders
 */
public interface ResponseDecoder<T> {

	/**
	 * The media types this decoder accepts, lowercase and without parameters. An empty
	 * set accepts any media type.
	 * @return the accepted media types
	 */
	Set<String> mediaTypes();

	/**
	 * Decodes a body.
	 * @param body the raw body, possibly empty
	 * @param contentType the full {@code Content-Type} header value
	 * @return the decoded value
	 * @throws IOException when the body does not have the expected shape
	 */
	T decode(byte[] body, String contentType) throws IOException;

	/**
	 * Whether the media type of the given {@code Content-Type} value is accepted.
	 * @param contentType the {@code Content-Type} header value (may be {@code null})
	 * @return {@code true} if this decoder can read the body
	 */
	default boolean accepts(@Nullable String contentType) {
		if (contentType == null) {
			return false;
		}
		return mediaTypes().isEmpty() || mediaTypes().contains(mediaType(contentType));
	}

	/**
	 * Returns a decoder applying the given function to the decoded value.
	 * @param mapper the function
	 * @param <R> the new decoded type
	 * @return the mapped decoder, accepting the same media types
	 */
	default <R> ResponseDecoder<R> map(Function<? super T, ? extends R> mapper) {
		ResponseDecoder<T> self = this;
		return new ResponseDecoder<>() {
			@Override
			public Set<String> mediaTypes() {
				return self.mediaTypes();
			}

			@Override
			public R decode(byte[] body, String contentType) throws IOException {
				return mapper.apply(self.decode(body, contentType));
			}
		};
	}

	/**
	 * Extracts the media type of a {@code Content-Type} value: parameters dropped,
	 * trimmed, lowercase.
	 * @param contentType the header value
	 * @return the media type
	 */
	static String mediaType(String contentType) {
		int idx = contentType.indexOf(';');
		String type = (idx >= 0) ? contentType.substring(0, idx) : contentType;
		return type.trim().toLowerCase(Locale.ROOT);
	}

}
