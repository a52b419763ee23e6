/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.auth;

import java.net.URI;

import io.authflow.util.Assert;

/**
 * The client's redirection endpoint. It must match the one registered with the
 * authorization server; the server, not this library, enforces that.
 *
 * @param value the URI
 * @see <a href="https://tools.ietf.org/html/rfc6749#section-3.1.2">RFC 6749 section
 * 3.1.2</a>
 */
public record RedirectUri(URI value) {

	public RedirectUri {
		Assert.notNull(value, "redirect uri must not be null");
	}

	public static RedirectUri of(String uri) {
		return new RedirectUri(URI.create(uri));
	}

}
