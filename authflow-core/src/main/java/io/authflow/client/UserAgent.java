/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.client;

import io.authflow.util.Assert;
import io.authflow.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * The {@code User-Agent} sent with every request, rendered as
 * {@code appName[/appVersion][ (+appUrl)]}.
 *
 * @param appName the application name
 * @param appVersion the application version, if any
 * @param appUrl the application URL, if any
 */
public record UserAgent(String appName, @Nullable String appVersion, @Nullable String appUrl) {

	public UserAgent {
		Assert.hasText(appName, "appName must not be empty");
	}

	public UserAgent(String appName) {
		this(appName, null, null);
	}

	public String headerValue() {
		StringBuilder value = new StringBuilder(appName);
		if (Utils.hasText(appVersion)) {
			value.append('/').append(appVersion);
		}
		if (Utils.hasText(appUrl)) {
			value.append(" (+").append(appUrl).append(')');
		}
		return value.toString();
	}

}
