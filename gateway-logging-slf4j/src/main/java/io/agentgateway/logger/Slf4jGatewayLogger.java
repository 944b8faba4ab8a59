/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.logger;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards the client's lifecycle messages to SLF4J. The metadata, when present, is
 * appended to the message.
 */
public class Slf4jGatewayLogger implements GatewayLogger {

	private final Logger delegate;

	public Slf4jGatewayLogger(Class<?> clazz) {
		this(LoggerFactory.getLogger(clazz));
	}

	public Slf4jGatewayLogger(String name) {
		this(LoggerFactory.getLogger(name));
	}

	public Slf4jGatewayLogger(Logger delegate) {
		if (delegate == null) {
			throw new IllegalArgumentException("delegate must not be null");
		}
		this.delegate = delegate;
	}

	@Override
	public void log(final Level level, final String message, final Map<String, Object> meta) {
		boolean withMeta = meta != null && !meta.isEmpty();
		switch (level) {
			case ERROR -> {
				if (withMeta) {
					delegate.error("{} {}", message, meta);
				}
				else {
					delegate.error(message);
				}
			}
			case WARN -> {
				if (withMeta) {
					delegate.warn("{} {}", message, meta);
				}
				else {
					delegate.warn(message);
				}
			}
			default -> {
				if (withMeta) {
					delegate.info("{} {}", message, meta);
				}
				else {
					delegate.info(message);
				}
			}
		}
	}

}
