/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.json.jackson2;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import io.authflow.json.JsonMapperSupplier;

/**
 * A supplier of {@link io.authflow.json.JsonMapper} instances that uses the Jackson
 * library for JSON serialization and deserialization.
 * <p>
 * The mapper is configured to:
 * <ul>
 * <li>Not call {@code setAccessible()} on constructors/fields, so decoded types must be
 * public</li>
 * <li>Use the {@link ParameterNamesModule} to discover constructor parameter names from
 * bytecode (requires the {@code -parameters} compiler flag, configured in the parent
 * pom.xml)</li>
 * <li>Ignore unknown properties, as authorization servers routinely add vendor
 * fields to token responses</li>
 * </ul>
 */
public class JacksonJsonMapperSupplier implements JsonMapperSupplier {

	@Override
	public io.authflow.json.JsonMapper get() {
		return new JacksonJsonMapper(createMapper());
	}

	private static ObjectMapper createMapper() {
		return JsonMapper.builder()
			.disable(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS)
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.addModule(new ParameterNamesModule())
			.build();
	}

}
