/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.json.jackson2;

import java.io.IOException;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.agentgateway.json.GatewayJsonMapper;
import io.agentgateway.json.TypeRef;

/**
 * Jackson-based implementation of {@link GatewayJsonMapper}. Wraps a Jackson
 * {@link ObjectMapper} but keeps the client code decoupled from Jackson types.
 */
public final class JacksonGatewayJsonMapper implements GatewayJsonMapper {

	private final ObjectMapper objectMapper;

	/**
	 * Constructs a new JacksonGatewayJsonMapper instance with the given ObjectMapper.
	 * @param objectMapper the ObjectMapper to be used for JSON serialization and
	 * deserialization. Must not be null.
	 * @throws IllegalArgumentException if the provided ObjectMapper is null.
	 */
	public JacksonGatewayJsonMapper(ObjectMapper objectMapper) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.objectMapper = objectMapper;
	}

	/**
	 * Returns the underlying Jackson {@link ObjectMapper} used for JSON serialization and
	 * deserialization.
	 * @return the ObjectMapper instance
	 */
	public ObjectMapper getObjectMapper() {
		return objectMapper;
	}

	@Override
	public <T> T readValue(String content, Class<T> type) throws IOException {
		return objectMapper.readValue(content, type);
	}

	@Override
	public <T> T readValue(String content, TypeRef<T> type) throws IOException {
		JavaType javaType = objectMapper.getTypeFactory().constructType(type.getType());
		return objectMapper.readValue(content, javaType);
	}

	@Override
	public <T> T convertValue(Object fromValue, Class<T> type) {
		return objectMapper.convertValue(fromValue, type);
	}

	@Override
	public <T> T convertValue(Object fromValue, TypeRef<T> type) {
		JavaType javaType = objectMapper.getTypeFactory().constructType(type.getType());
		return objectMapper.convertValue(fromValue, javaType);
	}

	@Override
	public String writeValueAsString(Object value) throws IOException {
		return objectMapper.writeValueAsString(value);
	}

}
