/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.authflow.json;

import java.util.function.Supplier;

/**
 * Service provider for {@link JsonMapper} implementations, discovered through
 * {@link java.util.ServiceLoader}.
 */
public interface JsonMapperSupplier extends Supplier<JsonMapper> {

}
