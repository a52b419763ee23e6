/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.util;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods for URIs, form encoding and strings.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null} and does not contain
	 * whitespace only
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Encodes the given parameters as {@code application/x-www-form-urlencoded}, keeping
	 * the iteration order of the map.
	 * @param params the parameters
	 * @return the encoded string, empty when there are no parameters
	 */
	public static String formEncode(Map<String, String> params) {
		StringJoiner joiner = new StringJoiner("&");
		for (Map.Entry<String, String> entry : params.entrySet()) {
			joiner.add(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8) + "="
					+ URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
		}
		return joiner.toString();
	}

	/**
	 * Parses an {@code application/x-www-form-urlencoded} string. When a name is repeated
	 * the first value wins; a name without {@code =} maps to an empty value.
	 * @param encoded the encoded string (may be {@code null})
	 * @return the decoded parameters in encounter order
	 */
	public static Map<String, String> formDecode(@Nullable String encoded) {
		Map<String, String> params = new LinkedHashMap<>();
		if (!hasText(encoded)) {
			return params;
		}
		for (String pair : encoded.split("&")) {
			if (pair.isEmpty()) {
				continue;
			}
			int idx = pair.indexOf('=');
			String key = (idx >= 0) ? pair.substring(0, idx) : pair;
			String value = (idx >= 0) ? pair.substring(idx + 1) : "";
			params.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8),
					URLDecoder.decode(value, StandardCharsets.UTF_8));
		}
		return params;
	}

	/**
	 * Collects the parameters of a redirection URI from both its query and its fragment.
	 * Query parameters take precedence over fragment parameters of the same name.
	 * @param uri the redirection URI
	 * @return the decoded parameters
	 */
	public static Map<String, String> redirectParameters(URI uri) {
		Map<String, String> params = formDecode(uri.getRawQuery());
		formDecode(uri.getRawFragment()).forEach(params::putIfAbsent);
		return params;
	}

	/**
	 * Appends already encoded query parameters to a URI, keeping any existing query and
	 * fragment.
	 * @param uri the base URI
	 * @param encodedQuery the {@code application/x-www-form-urlencoded} query to append
	 * @return the new URI
	 */
	public static URI appendQuery(URI uri, String encodedQuery) {
		if (encodedQuery.isEmpty()) {
			return uri;
		}
		String base = uri.toString();
		String fragment = null;
		int hash = base.indexOf('#');
		if (hash >= 0) {
			fragment = base.substring(hash);
			base = base.substring(0, hash);
		}
		String separator = (uri.getRawQuery() == null) ? "?" : (base.endsWith("&") || base.endsWith("?") ? "" : "&");
		return URI.create(base + separator + encodedQuery + (fragment != null ? fragment : ""));
	}

	/**
	 * Truncates a string to the given maximum number of characters, marking the cut with
	 * an ellipsis.
	 * @param value the string
	 * @param maxLength the maximum length to keep
	 * @return the string, possibly truncated
	 */
	public static String truncate(String value, int maxLength) {
		if (value.length() <= maxLength) {
			return value;
		}
		return value.substring(0, maxLength) + "...";
	}

}
