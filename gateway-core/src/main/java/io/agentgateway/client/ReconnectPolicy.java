/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.client;

import java.time.Duration;

import io.agentgateway.util.Assert;

/**
 * Exponential backoff schedule for reconnection attempts.
 *
 * <p>
 * The delay before attempt {@code n} (0-indexed) is
 * {@code min(initialDelay * 2^n, maxDelay)}. Once {@code maxAttempts} attempts have
 * failed in a row the policy is exhausted.
 */
public final class ReconnectPolicy {

	private final ReconnectOptions options;

	public ReconnectPolicy(ReconnectOptions options) {
		Assert.notNull(options, "options must not be null");
		this.options = options;
	}

	public boolean isEnabled() {
		return this.options.enabled();
	}

	public int maxAttempts() {
		return this.options.maxAttempts();
	}

	/**
	 * @param attempts the number of attempts already made
	 * @return whether no further attempt may be scheduled
	 */
	public boolean isExhausted(int attempts) {
		return attempts >= this.options.maxAttempts();
	}

	/**
	 * Computes the delay before the given attempt.
	 * @param attempt the 0-indexed attempt number
	 * @return the delay, never more than the configured maximum
	 */
	public Duration delayFor(int attempt) {
		Assert.isTrue(attempt >= 0, "attempt must not be negative");
		long initial = this.options.initialDelay().toMillis();
		long max = this.options.maxDelay().toMillis();
		if (initial == 0) {
			return Duration.ZERO;
		}
		// initial << attempt overflows for large attempts; compare against max instead
		if (attempt >= 62 || initial > (max >> Math.min(attempt, 62))) {
			return Duration.ofMillis(max);
		}
		return Duration.ofMillis(Math.min(initial << attempt, max));
	}

}
