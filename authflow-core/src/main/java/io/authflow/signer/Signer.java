/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.signer;

import io.authflow.http.ClientRequest;

/**
 * Adds authorization proof to an outgoing request. Each variant knows one way of doing
 * so; the set of variants is closed.
 * <p>
 * Signing is a pure transformation: the input request is left untouched, the returned
 * request carries the {@code Authorization} header, replacing any previous one.
 */
public sealed interface Signer permits Disabled, BasicSignature, ClientPasswordAuthentication, TokenSigner {

	/**
	 * Signs the given request.
	 * @param request the unsigned request
	 * @return the signed request
	 */
	ClientRequest sign(ClientRequest request);

	static Signer disabled() {
		return Disabled.INSTANCE;
	}

}
