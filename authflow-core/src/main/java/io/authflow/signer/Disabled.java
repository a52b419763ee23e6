/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.signer;

import io.authflow.http.ClientRequest;

/**
 * Leaves requests unsigned, for endpoints that need no authorization.
 */
public enum Disabled implements Signer {

	INSTANCE;

	@Override
	public ClientRequest sign(ClientRequest request) {
		return request;
	}

}
