/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.json;

import java.util.function.Supplier;

/**
 * Strategy interface for resolving a {@link GatewayJsonMapper}. Implementations are
 * discovered through {@link java.util.ServiceLoader}.
 */
public interface GatewayJsonMapperSupplier extends Supplier<GatewayJsonMapper> {

}
