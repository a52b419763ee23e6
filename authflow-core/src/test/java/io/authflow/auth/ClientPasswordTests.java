/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.auth;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientPasswordTests {

	@Test
	void basicCredentialIsBase64OfIdAndSecret() {
		assertThat(new ClientPassword("abc", "xyz").authorizationBasic()).isEqualTo("Basic YWJjOnh5eg==");
	}

	@Test
	void toStringMasksSecret() {
		assertThat(new ClientPassword("abc", "super-secret").toString()).contains("abc")
			.doesNotContain("super-secret");
	}

	@Test
	void blankClientIdIsRejected() {
		assertThatThrownBy(() -> new ClientPassword(" ", "xyz")).isInstanceOf(IllegalArgumentException.class);
	}

}
