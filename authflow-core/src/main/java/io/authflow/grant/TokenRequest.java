/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.grant;

import io.authflow.client.ResponseDecoder;
import io.authflow.http.ClientRequest;
import io.authflow.signer.ClientPasswordAuthentication;
import io.authflow.util.Assert;

/**
 * A token endpoint call ready to be executed: the unsigned form POST, the client
 * authentication that signs it and the decoder of the token response.
 *
 * @param request the unsigned request
 * @param signer the client authentication
 * @param decoder the token response decoder
 * @param <T> the signer type produced by a successful exchange
 */
public record TokenRequest<T>(ClientRequest request, ClientPasswordAuthentication signer,
		ResponseDecoder<T> decoder) {

	public TokenRequest {
		Assert.notNull(request, "request must not be null");
		Assert.notNull(signer, "signer must not be null");
		Assert.notNull(decoder, "decoder must not be null");
	}

	/**
	 * @return the request with its {@code Authorization} header applied
	 */
	public ClientRequest signedRequest() {
		return signer.sign(request);
	}

}
