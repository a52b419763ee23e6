/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.grant;

import java.io.IOException;

/**
 * A token endpoint response without one of the required fields.
 */
public class TokenParseException extends IOException {

	private static final long serialVersionUID = 1L;

	public TokenParseException(String message) {
		super(message);
	}

}
