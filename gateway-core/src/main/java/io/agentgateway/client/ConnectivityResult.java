/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.client;

import reactor.util.annotation.Nullable;

/**
 * Outcome of {@link GatewayConnectivity#test}.
 *
 * @param success whether the gateway accepted the connection and answered
 * @param latencyMs the measured ping round trip, set on success
 * @param version the gateway version, set on success
 * @param error description of the failure, set on failure
 */
public record ConnectivityResult(boolean success, @Nullable Long latencyMs, @Nullable String version,
		@Nullable String error) {

	public static ConnectivityResult success(long latencyMs, @Nullable String version) {
		return new ConnectivityResult(true, latencyMs, version, null);
	}

	public static ConnectivityResult failure(String error) {
		return new ConnectivityResult(false, null, null, error);
	}

}
