/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.json.jackson2;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import io.agentgateway.json.GatewayJsonMapper;
import io.agentgateway.json.GatewayJsonMapperSupplier;

/**
 * A supplier of {@link GatewayJsonMapper} instances that uses the Jackson library for
 * JSON serialization and deserialization.
 * <p>
 * The mapper is configured to:
 * <ul>
 * <li>Not call {@code setAccessible()} on constructors/fields, so wire records must be
 * public</li>
 * <li>Use the {@link ParameterNamesModule} to discover constructor parameter names from
 * bytecode (requires the {@code -parameters} compiler flag, configured in the parent
 * pom.xml)</li>
 * <li>Ignore unknown properties, since gateway payloads may grow new fields at any
 * time</li>
 * </ul>
 */
public class JacksonGatewayJsonMapperSupplier implements GatewayJsonMapperSupplier {

	@Override
	public GatewayJsonMapper get() {
		return new JacksonGatewayJsonMapper(createMapper());
	}

	private static ObjectMapper createMapper() {
		return JsonMapper.builder()
			.disable(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS)
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.addModule(new ParameterNamesModule())
			.build();
	}

}
