/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.grant;

/**
 * Thrown by {@link GrantResult#orElseThrow()} when an authorization redirect was
 * rejected.
 */
public class AuthorizationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String error;

	public AuthorizationException(String error) {
		super("Authorization failed: " + error);
		this.error = error;
	}

	/**
	 * @return the error code, see {@link AuthorizationErrors}
	 */
	public String getError() {
		return this.error;
	}

}
