/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.client;

import java.util.Optional;

import io.agentgateway.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Per-call options.
 *
 * <p>
 * A de-duplication key guards against issuing the same logical call twice: while a call
 * carrying a key is outstanding, another call with the same key on the same client
 * fails with {@link io.agentgateway.spec.GatewayDuplicateCallException}. Keys are scoped
 * to one client instance.
 */
public final class CallContext {

	private static final CallContext EMPTY = new CallContext(null);

	@Nullable
	private final String dedupKey;

	private CallContext(@Nullable String dedupKey) {
		this.dedupKey = dedupKey;
	}

	public static CallContext empty() {
		return EMPTY;
	}

	public static CallContext dedup(String key) {
		Assert.hasText(key, "De-duplication key must not be empty");
		return new CallContext(key);
	}

	public Optional<String> dedupKey() {
		return Optional.ofNullable(this.dedupKey);
	}

	@Override
	public String toString() {
		return "CallContext[dedupKey=" + this.dedupKey + "]";
	}

}
