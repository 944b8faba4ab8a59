/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.json;

import java.io.IOException;
import java.util.Iterator;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Reads and writes the JSON text of gateway frames. The client core depends only on this
 * interface; a binding such as {@code gateway-json-jackson2} provides the
 * implementation.
 *
 * <p>
 * Payloads arrive as generic trees (maps, lists and scalars) and are converted to typed
 * results with the {@code convertValue} methods.
 */
public interface GatewayJsonMapper {

	/**
	 * Parses JSON text into an instance of the given class.
	 * @throws IOException if the text is not valid JSON or does not fit the type
	 */
	<T> T readValue(String content, Class<T> type) throws IOException;

	/**
	 * Parses JSON text into an instance of a generic type.
	 * @throws IOException if the text is not valid JSON or does not fit the type
	 */
	<T> T readValue(String content, TypeRef<T> type) throws IOException;

	/**
	 * Converts an already parsed value, such as a frame payload, to the given class.
	 * @throws IllegalArgumentException if the value cannot be converted
	 */
	<T> T convertValue(Object fromValue, Class<T> type);

	/**
	 * Converts an already parsed value to a generic type.
	 * @throws IllegalArgumentException if the value cannot be converted
	 */
	<T> T convertValue(Object fromValue, TypeRef<T> type);

	String writeValueAsString(Object value) throws IOException;

	/**
	 * Returns the mapper of the first {@link GatewayJsonMapperSupplier} registered with
	 * {@link ServiceLoader} that loads and supplies a mapper.
	 * @return the mapper
	 * @throws IllegalStateException if no binding is on the class path, or none could be
	 * loaded; failures of the candidates tried are attached as suppressed exceptions
	 */
	static GatewayJsonMapper createDefault() {
		IllegalStateException failure = null;
		Iterator<GatewayJsonMapperSupplier> suppliers = ServiceLoader.load(GatewayJsonMapperSupplier.class)
			.iterator();
		while (true) {
			try {
				if (!suppliers.hasNext()) {
					break;
				}
				GatewayJsonMapper mapper = suppliers.next().get();
				if (mapper != null) {
					return mapper;
				}
			}
			catch (ServiceConfigurationError | RuntimeException e) {
				if (failure == null) {
					failure = new IllegalStateException("Failed to load a GatewayJsonMapper binding", e);
				}
				else {
					failure.addSuppressed(e);
				}
			}
		}
		if (failure != null) {
			throw failure;
		}
		throw new IllegalStateException(
				"No GatewayJsonMapper binding found on the class path, add gateway-json-jackson2");
	}

}
