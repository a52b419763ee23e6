/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.http;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable, case-insensitive view over the headers of an HTTP response.
 */
public final class ResponseHeaders {

	private static final ResponseHeaders EMPTY = new ResponseHeaders(Map.of());

	private final Map<String, List<String>> values;

	private ResponseHeaders(Map<String, List<String>> values) {
		TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		values.forEach((name, list) -> copy.merge(name, List.copyOf(list), (a, b) -> {
			List<String> merged = new ArrayList<>(a);
			merged.addAll(b);
			return List.copyOf(merged);
		}));
		this.values = Collections.unmodifiableMap(copy);
	}

	public static ResponseHeaders of(Map<String, List<String>> values) {
		return new ResponseHeaders(values);
	}

	public static ResponseHeaders empty() {
		return EMPTY;
	}

	/**
	 * Returns the first value of the named header.
	 * @param name the header name, matched case-insensitively
	 * @return the first value, or empty when the header is absent
	 */
	public Optional<String> firstValue(String name) {
		List<String> list = values.get(name);
		if (list == null || list.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(list.get(0));
	}

	public List<String> allValues(String name) {
		return values.getOrDefault(name, List.of());
	}

	public Map<String, List<String>> map() {
		return values;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ResponseHeaders)) {
			return false;
		}
		return values.equals(((ResponseHeaders) o).values);
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public String toString() {
		return values.toString();
	}

}
