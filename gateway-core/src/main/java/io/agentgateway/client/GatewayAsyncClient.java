/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.client;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

import io.agentgateway.json.TypeRef;
import io.agentgateway.spec.ConnectionStatus;
import io.agentgateway.spec.GatewaySchema;
import io.agentgateway.spec.SessionEvent;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * A non-blocking client of an agent execution gateway.
 *
 * <p>
 * The client keeps a single WebSocket connection, authenticates it with the gateway's
 * challenge/response handshake and multiplexes concurrent calls over it. Events the
 * gateway pushes for a session are delivered to the subscribers of that session.
 *
 * <p>
 * The lifecycle is:
 * <ol>
 * <li>{@link #connect()} opens the socket and completes once the gateway accepted the
 * handshake. Concurrent callers share one connection attempt.
 * <li>Calls and high-level operations may be issued while {@link #isConnected()}. A call
 * made while not connected fails immediately with
 * {@link io.agentgateway.spec.GatewayNotConnectedException}; calls are never queued.
 * <li>When an established connection is lost, outstanding calls fail with
 * {@link io.agentgateway.spec.GatewayConnectionClosedException} and, if enabled, the
 * client reconnects with exponential backoff. Subscriptions survive reconnects.
 * <li>{@link #disconnect()} closes the connection and suppresses reconnection until the
 * next explicit {@link #connect()}.
 * </ol>
 *
 * <p>
 * All returned publishers are cold: nothing happens until they are subscribed.
 *
 * @see GatewayClient
 * @see GatewaySyncClient
 */
public interface GatewayAsyncClient {

	/**
	 * Opens and authenticates the connection. Completes immediately when already
	 * connected; returns the pending attempt when one is in flight.
	 * @return a Mono that completes once connected, or errors with
	 * {@link io.agentgateway.spec.GatewayHandshakeException} when the handshake fails or
	 * does not complete within the connection timeout
	 */
	Mono<Void> connect();

	/**
	 * Closes the connection immediately, fails outstanding calls and cancels any pending
	 * reconnection. Calling it again has no further effect.
	 */
	void disconnect();

	/**
	 * Disconnects and waits for the close frame to be written.
	 * @return a Mono that completes when the socket is closed
	 */
	Mono<Void> closeGracefully();

	ConnectionStatus getStatus();

	boolean isConnected();

	/**
	 * The payload the gateway returned when it accepted the handshake.
	 * @return the payload, or {@code null} when not connected or none was sent
	 */
	@Nullable
	Object getServerHello();

	// --------------------------
	// Calls
	// --------------------------

	/**
	 * Calls a gateway method with the default request timeout.
	 * @param method the method name
	 * @param params the parameters, or {@code null} for none
	 * @return the untyped response payload; empty when the gateway sent none
	 */
	Mono<Object> call(String method, @Nullable Object params);

	Mono<Object> call(String method, @Nullable Object params, Duration timeout);

	Mono<Object> call(String method, @Nullable Object params, Duration timeout, CallContext context);

	/**
	 * Calls a gateway method and converts the response payload.
	 * @param method the method name
	 * @param params the parameters, or {@code null} for none
	 * @param resultType the type of the payload
	 * @param timeout how long to wait for the response
	 * @param <T> the payload type
	 * @return the converted payload; empty when the gateway sent none
	 */
	<T> Mono<T> call(String method, @Nullable Object params, TypeRef<T> resultType, Duration timeout);

	// --------------------------
	// Events
	// --------------------------

	/**
	 * Registers a callback for the events of a session. Use
	 * {@link io.agentgateway.spec.EventRouter#WILDCARD} to receive every event.
	 * @param sessionId the session id
	 * @param callback invoked on the I/O thread for every event of the session
	 * @return a handle that removes this subscription when disposed
	 */
	Disposable subscribe(String sessionId, Consumer<SessionEvent> callback);

	/**
	 * The events of a session as a stream. Cancelling the subscription to the returned
	 * Flux removes the underlying subscription.
	 * @param sessionId the session id or {@link io.agentgateway.spec.EventRouter#WILDCARD}
	 * @return the events of the session
	 */
	Flux<SessionEvent> sessionEvents(String sessionId);

	// --------------------------
	// Sessions
	// --------------------------

	Mono<GatewaySchema.SessionRef> sendTask(GatewaySchema.SendTaskRequest request);

	Mono<GatewaySchema.SessionRef> resumeSession(String sessionId, @Nullable String prompt);

	/**
	 * Lists the sessions known to the gateway.
	 * @return the sessions, an empty list when the gateway returned nothing
	 */
	Mono<List<GatewaySchema.Session>> listSessions();

	Mono<GatewaySchema.SessionHistory> getSessionHistory(String sessionId);

	Mono<GatewaySchema.StopSessionResult> stopSession(String sessionId);

	// --------------------------
	// Gateway
	// --------------------------

	Mono<GatewaySchema.GatewayStatus> getGatewayStatus();

	/**
	 * Pings the gateway using the ping timeout and measures the round trip.
	 * @return the ping outcome with the measured latency
	 */
	Mono<GatewaySchema.PingResult> ping();

}
