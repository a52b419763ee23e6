/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.auth;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import io.authflow.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * A set of scope identifiers. The encounter order is kept for rendering, equality
 * ignores it.
 */
public final class Scope {

	private static final Scope EMPTY = new Scope(List.of());

	private final List<String> values;

	private Scope(Collection<String> values) {
		LinkedHashSet<String> distinct = new LinkedHashSet<>();
		for (String value : values) {
			if (Utils.hasText(value)) {
				distinct.add(value);
			}
		}
		this.values = List.copyOf(distinct);
	}

	public static Scope empty() {
		return EMPTY;
	}

	public static Scope of(String... values) {
		return new Scope(Arrays.asList(values));
	}

	public static Scope of(Collection<String> values) {
		return new Scope(values);
	}

	/**
	 * Parses a space-delimited scope string as found in token responses.
	 * @param value the scope string (may be {@code null})
	 * @return the parsed scope, empty for a {@code null} or blank value
	 */
	public static Scope parse(@Nullable String value) {
		if (!Utils.hasText(value)) {
			return EMPTY;
		}
		return new Scope(Arrays.asList(value.trim().split("\\s+")));
	}

	public List<String> values() {
		return values;
	}

	public Set<String> asSet() {
		return new LinkedHashSet<>(values);
	}

	public boolean isEmpty() {
		return values.isEmpty();
	}

	public boolean contains(String value) {
		return values.contains(value);
	}

	/**
	 * Returns a new scope with the identifiers of both scopes.
	 * @param other the scope to add
	 * @return the union, this scope's identifiers first
	 */
	public Scope union(Scope other) {
		List<String> merged = new ArrayList<>(values);
		merged.addAll(other.values);
		return new Scope(merged);
	}

	/**
	 * Renders the identifiers joined by a single space, as used on authorization URIs.
	 * @return the space-delimited scope
	 */
	public String spaceDelimited() {
		return String.join(" ", values);
	}

	/**
	 * Renders the identifiers joined by a comma, as sent on refresh token requests.
	 * @return the comma-delimited scope
	 */
	public String commaDelimited() {
		return String.join(",", values);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Scope)) {
			return false;
		}
		return asSet().equals(((Scope) o).asSet());
	}

	@Override
	public int hashCode() {
		return asSet().hashCode();
	}

	@Override
	public String toString() {
		return "Scope" + values;
	}

}
