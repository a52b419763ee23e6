/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.json.jackson2;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import io.authflow.json.JsonMapper;
import io.authflow.json.TypeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link JacksonJsonMapper} as produced by {@link JacksonJsonMapperSupplier}.
 */
public class JacksonJsonMapperTests {

	private JsonMapper jsonMapper;

	// Test records must be public for the access-restricted mapper
	public record Token(String value, long expiresIn) {
	}

	@BeforeEach
	void setUp() {
		jsonMapper = new JacksonJsonMapperSupplier().get();
	}

	@Test
	@DisplayName("Should be discovered through the service loader")
	void createDefaultFindsJacksonMapper() {
		assertThat(JsonMapper.createDefault()).isInstanceOf(JacksonJsonMapper.class);
	}

	@Test
	@DisplayName("Should deserialize a record and ignore unknown properties")
	void deserializeRecordIgnoringUnknownFields() throws IOException {
		String json = """
				{
					"value": "abc",
					"expiresIn": 3600,
					"vendor_extension": true
				}
				""";

		Token token = jsonMapper.readValue(json.getBytes(StandardCharsets.UTF_8), Token.class);

		assertThat(token.value()).isEqualTo("abc");
		assertThat(token.expiresIn()).isEqualTo(3600L);
	}

	@Test
	@DisplayName("Should deserialize parameterized types")
	void deserializeWithTypeRef() throws IOException {
		byte[] json = "{\"scopes\":[\"read\",\"write\"]}".getBytes(StandardCharsets.UTF_8);

		Map<String, List<String>> value = jsonMapper.readValue(json, new TypeRef<Map<String, List<String>>>() {
		});

		assertThat(value).containsEntry("scopes", List.of("read", "write"));
	}

	@Test
	void writeThenReadString() throws IOException {
		String json = jsonMapper.writeValueAsString(new Token("xyz", 10));

		assertThat(jsonMapper.readValue(json, Token.class)).isEqualTo(new Token("xyz", 10));
	}

	@Test
	void malformedJsonIsAnIOException() {
		assertThatThrownBy(() -> jsonMapper.readValue("{not json", Token.class)).isInstanceOf(IOException.class);
	}

	@Test
	void nullObjectMapperIsRejected() {
		assertThatThrownBy(() -> new JacksonJsonMapper(null)).isInstanceOf(IllegalArgumentException.class)
			.hasMessage("ObjectMapper must not be null");
	}

}
