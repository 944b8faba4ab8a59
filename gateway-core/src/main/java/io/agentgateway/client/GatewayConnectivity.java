/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.client;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.agentgateway.client.transport.WebSocketClientTransport;
import io.agentgateway.spec.GatewayClientTransport;
import io.agentgateway.util.Assert;
import io.agentgateway.util.Utils;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Checks whether a gateway is reachable and accepts the given credentials.
 *
 * <p>
 * A check connects a dedicated client with reconnection disabled, pings the gateway,
 * reads its version and disconnects again, whatever the outcome. Failures are reported
 * in the {@link ConnectivityResult}; the returned Mono never errors.
 */
public final class GatewayConnectivity {

	private static final Logger logger = LoggerFactory.getLogger(GatewayConnectivity.class);

	public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(10000);

	private GatewayConnectivity() {
	}

	public static Mono<ConnectivityResult> test(String gatewayUrl, @Nullable String authToken) {
		return test(gatewayUrl, authToken, DEFAULT_TIMEOUT);
	}

	/**
	 * Checks a gateway over a WebSocket connection.
	 * @param gatewayUrl the {@code ws} or {@code wss} URL of the gateway
	 * @param authToken the token to authenticate with, may be {@code null}
	 * @param connectionTimeout the bound on opening and authenticating the connection
	 * @return the outcome of the check
	 */
	public static Mono<ConnectivityResult> test(String gatewayUrl, @Nullable String authToken,
			Duration connectionTimeout) {
		return Mono.defer(() -> {
			GatewayClientOptions options = GatewayClientOptions.builder(gatewayUrl)
				.authToken(authToken)
				.connectionTimeout(connectionTimeout)
				.build();
			GatewayClientTransport transport = WebSocketClientTransport.builder(options.gatewayUrl())
				.connectTimeout(connectionTimeout)
				.build();
			return test(GatewayClient.async(transport).options(options));
		}).onErrorResume(error -> Mono.just(ConnectivityResult.failure(Utils.describe(error))));
	}

	/**
	 * Checks a gateway with a client built by the given builder. The builder's options
	 * are used with reconnection disabled.
	 * @param clientSpec the client builder, with options set
	 * @return the outcome of the check
	 */
	public static Mono<ConnectivityResult> test(GatewayClient.AsyncSpec clientSpec) {
		Assert.notNull(clientSpec, "clientSpec must not be null");
		return Mono.usingWhen(Mono.fromSupplier(() -> clientSpec.withoutReconnect().build()),
				GatewayConnectivity::probe, GatewayAsyncClient::closeGracefully,
				(client, error) -> client.closeGracefully(), GatewayAsyncClient::closeGracefully)
			.onErrorResume(error -> {
				logger.debug("Gateway connectivity check failed", error);
				return Mono.just(ConnectivityResult.failure(Utils.describe(error)));
			});
	}

	private static Mono<ConnectivityResult> probe(GatewayAsyncClient client) {
		return client.connect()
			.then(client.ping())
			.flatMap(pong -> client.getGatewayStatus()
				.map(status -> ConnectivityResult.success(pong.latencyMs(), status.version()))
				.defaultIfEmpty(ConnectivityResult.success(pong.latencyMs(), null)));
	}

}
