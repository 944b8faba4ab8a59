/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.logger;

import java.util.Map;

/**
 * Callback receiving the client's lifecycle messages: connection state changes, calls
 * sent, reconnection scheduling, dropped frames and failing subscribers.
 * <p>
 * Wire-level tracing is not sent here; it goes to SLF4J at debug level.
 */
@FunctionalInterface
public interface GatewayLogger {

	/**
	 * Severity of a lifecycle message.
	 */
	enum Level {

		INFO, WARN, ERROR

	}

	void log(Level level, String message, Map<String, Object> meta);

	default void info(String message) {
		log(Level.INFO, message, Map.of());
	}

	default void info(String message, Map<String, Object> meta) {
		log(Level.INFO, message, meta);
	}

	default void warn(String message, Map<String, Object> meta) {
		log(Level.WARN, message, meta);
	}

	default void error(String message) {
		log(Level.ERROR, message, Map.of());
	}

	default void error(String message, Map<String, Object> meta) {
		log(Level.ERROR, message, meta);
	}

	static GatewayLogger noop() {
		return (level, message, meta) -> {
		};
	}

}
