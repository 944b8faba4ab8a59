/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.client;

import java.time.Duration;

import io.agentgateway.util.Assert;

/**
 * Settings of the automatic reconnection that follows an unexpected close.
 *
 * @param enabled whether to reconnect at all
 * @param maxAttempts consecutive failed attempts after which reconnection stops
 * @param initialDelay delay before the first attempt, doubled for each further attempt
 * @param maxDelay upper bound of the delay
 * @see ReconnectPolicy
 */
public record ReconnectOptions(boolean enabled, int maxAttempts, Duration initialDelay, Duration maxDelay) {

	public static final int DEFAULT_MAX_ATTEMPTS = 5;

	public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(1000);

	public static final Duration DEFAULT_MAX_DELAY = Duration.ofMillis(30000);

	public ReconnectOptions {
		Assert.isTrue(maxAttempts >= 0, "maxAttempts must not be negative");
		Assert.notNull(initialDelay, "initialDelay must not be null");
		Assert.notNull(maxDelay, "maxDelay must not be null");
		Assert.isTrue(!initialDelay.isNegative(), "initialDelay must not be negative");
		Assert.isTrue(!maxDelay.isNegative(), "maxDelay must not be negative");
	}

	public static ReconnectOptions defaults() {
		return new ReconnectOptions(true, DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY);
	}

	public static ReconnectOptions disabled() {
		return new ReconnectOptions(false, DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY);
	}

	public static ReconnectOptions of(int maxAttempts, Duration initialDelay, Duration maxDelay) {
		return new ReconnectOptions(true, maxAttempts, initialDelay, maxDelay);
	}

}
