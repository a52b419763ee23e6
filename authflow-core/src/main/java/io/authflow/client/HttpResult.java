/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.client;

import java.util.Optional;
import java.util.function.Function;

import io.authflow.http.ResponseHeaders;
import io.authflow.util.Assert;

/**
 * Outcome of an HTTP call: either a decoded body or an {@link HttpError}. Failures are
 * returned, never thrown.
 *
 * @param <T> the decoded body type
 */
public sealed interface HttpResult<T> permits HttpResult.Success, HttpResult.Failure {

	static <T> HttpResult<T> success(int status, ResponseHeaders headers, T body) {
		return new Success<>(status, headers, body);
	}

	static <T> HttpResult<T> failure(HttpError error) {
		return new Failure<>(error);
	}

	boolean isSuccess();

	/**
	 * @return the decoded body, empty on failure
	 */
	Optional<T> toOptional();

	/**
	 * @return the error, empty on success
	 */
	Optional<HttpError> failure();

	/**
	 * HTTP status of the outcome; see {@link HttpError#status()} for failures.
	 * @return the status code
	 */
	int status();

	<R> HttpResult<R> map(Function<? super T, ? extends R> mapper);

	<R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super HttpError, ? extends R> onFailure);

	/**
	 * Returns the body or throws.
	 * @return the decoded body
	 * @throws HttpClientException if this is a failure
	 */
	T orElseThrow();

	record Success<T>(int status, ResponseHeaders headers, T body) implements HttpResult<T> {

		public Success {
			Assert.notNull(headers, "headers must not be null");
		}

		@Override
		public boolean isSuccess() {
			return true;
		}

		@Override
		public Optional<T> toOptional() {
			return Optional.ofNullable(body);
		}

		@Override
		public Optional<HttpError> failure() {
			return Optional.empty();
		}

		@Override
		public <R> HttpResult<R> map(Function<? super T, ? extends R> mapper) {
			return new Success<>(status, headers, mapper.apply(body));
		}

		@Override
		public <R> R fold(Function<? super T, ? extends R> onSuccess,
				Function<? super HttpError, ? extends R> onFailure) {
			return onSuccess.apply(body);
		}

		@Override
		public T orElseThrow() {
			return body;
		}

	}

	record Failure<T>(HttpError error) implements HttpResult<T> {

		public Failure {
			Assert.notNull(error, "error must not be null");
		}

		@Override
		public boolean isSuccess() {
			return false;
		}

		@Override
		public Optional<T> toOptional() {
			return Optional.empty();
		}

		@Override
		public Optional<HttpError> failure() {
			return Optional.of(error);
		}

		@Override
		public int status() {
			return error.status();
		}

		@Override
		public <R> HttpResult<R> map(Function<? super T, ? extends R> mapper) {
			return new Failure<>(error);
		}

		@Override
		public <R> R fold(Function<? super T, ? extends R> onSuccess,
				Function<? super HttpError, ? extends R> onFailure) {
			return onFailure.apply(error);
		}

		@Override
		public T orElseThrow() {
			throw new HttpClientException(error);
		}

	}

}
