/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.client;

import java.nio.charset.StandardCharsets;

import io.authflow.http.HttpHeaders;
import io.authflow.http.RawResponse;
import io.authflow.http.ResponseHeaders;
import io.authflow.util.Assert;
import io.authflow.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Turns a raw response into an {@link HttpResult}. The rules are applied in this order:
 * <ol>
 * <li>an error status with an empty body is {@link ErrorKind#EMPTY_RESPONSE};</li>
 * <li>a missing {@code Content-Type} is {@link ErrorKind#UNSUPPORTED_MEDIA_TYPE};</li>
 * <li>a {@code Content-Type} the decoder for the status does not accept is
 * {@link ErrorKind#UNSUPPORTED_MEDIA_TYPE}, with the body in the message;</li>
 * <li>a 2xx status is decoded with the success decoder, a failure being
 * {@link ErrorKind#DECODING_FAILURE};</li>
 * <li>any other status is decoded with the error decoder into
 * {@link ErrorKind#ERROR_RESPONSE}.</li>
 * </ol>
 * Outcomes carry the status of the response, except decoding failures which report 500.
 * Classification has no side effect besides logging decoding failures.
 */
public final class ResponseClassifier {

	private static final Logger logger = LoggerFactory.getLogger(ResponseClassifier.class);

	public static final String EMPTY_RESPONSE_MESSAGE = "Response was empty. Please check request logs";

	public static final String CONTENT_TYPE_NOT_PROVIDED_MESSAGE = "Content-Type not provided";

	public static final String DECODING_FAILURE_MESSAGE = "There was a problem decoding or parsing this response, please check the error logs";

	public static final String TRANSPORT_FAILURE_MESSAGE = "There was a problem with the response. Please check error logs";

	/**
	 * Maximum number of body characters copied into an error message.
	 */
	public static final int MAX_BODY_IN_MESSAGE = 1024;

	private ResponseClassifier() {
	}

	public static <T> HttpResult<T> classify(RawResponse response, ResponseDecoder<T> decoder,
			ResponseDecoder<String> errorDecoder) {
		Assert.notNull(response, "response must not be null");
		return classify(response.statusCode(), response.headers(), response.body(), decoder, errorDecoder);
	}

	/**
	 * Classifies a response.
	 * @param status the HTTP status code
	 * @param headers the response headers
	 * @param body the response body, {@code null} meaning empty
	 * @param decoder the decoder for 2xx bodies
	 * @param errorDecoder the decoder turning any other body into a message
	 * @param <T> the success body type
	 * @return the outcome
	 */
	public static <T> HttpResult<T> classify(int status, ResponseHeaders headers, @Nullable byte[] body,
			ResponseDecoder<T> decoder, ResponseDecoder<String> errorDecoder) {
		Assert.notNull(headers, "headers must not be null");
		Assert.notNull(decoder, "decoder must not be null");
		Assert.notNull(errorDecoder, "errorDecoder must not be null");

		byte[] content = (body != null) ? body : new byte[0];
		boolean successful = status >= 200 && status < 300;

		if (!successful && content.length == 0) {
			return failure(ErrorKind.EMPTY_RESPONSE, status, EMPTY_RESPONSE_MESSAGE, headers);
		}

		String contentType = headers.firstValue(HttpHeaders.CONTENT_TYPE).orElse(null);
		if (contentType == null) {
			return failure(ErrorKind.UNSUPPORTED_MEDIA_TYPE, status, CONTENT_TYPE_NOT_PROVIDED_MESSAGE, headers);
		}

		ResponseDecoder<?> selected = successful ? decoder : errorDecoder;
		if (!selected.accepts(contentType)) {
			return failure(ErrorKind.UNSUPPORTED_MEDIA_TYPE, status, "Unexpected response:\n[" + bodyText(content) + "]",
					headers);
		}

		if (successful) {
			try {
				return HttpResult.success(status, headers, decoder.decode(content, contentType));
			}
			catch (Exception ex) {
				logger.error("Failed to decode {} response with Content-Type {}", status, contentType, ex);
				return failure(ErrorKind.DECODING_FAILURE, HttpError.INTERNAL_SERVER_ERROR, DECODING_FAILURE_MESSAGE,
						headers);
			}
		}

		String message;
		try {
			message = errorDecoder.decode(content, contentType);
		}
		catch (Exception ex) {
			logger.debug("Could not decode {} error body, using the raw body", status, ex);
			message = null;
		}
		if (!Utils.hasText(message)) {
			message = bodyText(content);
		}
		return failure(ErrorKind.ERROR_RESPONSE, status, message, headers);
	}

	/**
	 * The outcome of a request that produced no response.
	 * @param cause the transport error, {@code null} when the transport completed
	 * without a response
	 * @param <T> the success body type
	 * @return a {@link ErrorKind#TRANSPORT_FAILURE} result
	 */
	public static <T> HttpResult<T> transportFailure(@Nullable Throwable cause) {
		return failure(ErrorKind.TRANSPORT_FAILURE, HttpError.INTERNAL_SERVER_ERROR, TRANSPORT_FAILURE_MESSAGE,
				ResponseHeaders.empty());
	}

	private static <T> HttpResult<T> failure(ErrorKind kind, int status, String message, ResponseHeaders headers) {
		return HttpResult.failure(new HttpError(kind, status, message, headers));
	}

	private static String bodyText(byte[] body) {
		return Utils.truncate(new String(body, StandardCharsets.UTF_8), MAX_BODY_IN_MESSAGE);
	}

}
