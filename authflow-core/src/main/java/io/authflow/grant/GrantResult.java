/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.grant;

import java.util.Optional;
import java.util.function.Function;

import io.authflow.util.Assert;

/**
 * Outcome of parsing an authorization redirect: the extracted value, or the error code.
 *
 * @param <T> the value type
 */
public sealed interface GrantResult<T> permits GrantResult.Success, GrantResult.Failure {

	static <T> GrantResult<T> success(T value) {
		return new Success<>(value);
	}

	static <T> GrantResult<T> failure(String error) {
		return new Failure<>(error);
	}

	boolean isSuccess();

	Optional<T> toOptional();

	/**
	 * @return the error code, empty on success
	 */
	Optional<String> failure();

	<R> GrantResult<R> map(Function<? super T, ? extends R> mapper);

	/**
	 * Returns the value or throws.
	 * @return the value
	 * @throws AuthorizationException if this is a failure
	 */
	T orElseThrow();

	record Success<T>(T value) implements GrantResult<T> {

		public Success {
			Assert.notNull(value, "value must not be null");
		}

		@Override
		public boolean isSuccess() {
			return true;
		}

		@Override
		public Optional<T> toOptional() {
			return Optional.of(value);
		}

		@Override
		public Optional<String> failure() {
			return Optional.empty();
		}

		@Override
		public <R> GrantResult<R> map(Function<? super T, ? extends R> mapper) {
			return new Success<>(mapper.apply(value));
		}

		@Override
		public T orElseThrow() {
			return value;
		}

	}

	record Failure<T>(String error) implements GrantResult<T> {

		public Failure {
			Assert.hasText(error, "error must not be empty");
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
		public Optional<String> failure() {
			return Optional.of(error);
		}

		@Override
		public <R> GrantResult<R> map(Function<? super T, ? extends R> mapper) {
			return new Failure<>(error);
		}

		@Override
		public T orElseThrow() {
			throw new AuthorizationException(error);
		}

	}

}
