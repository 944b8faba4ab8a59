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
import reactor.util.annotation.Nullable;

/**
 * A blocking client of an agent execution gateway that wraps a
 * {@link GatewayAsyncClient}.
 *
 * <p>
 * Every operation blocks until the gateway answered or the operation's timeout expired,
 * and throws the same {@link io.agentgateway.spec.GatewayException}s the async client
 * signals. Event subscriptions are callback based and never block.
 *
 * <p>
 * The client is {@link AutoCloseable}; closing it disconnects from the gateway.
 *
 * @see GatewayClient
 * @see GatewayAsyncClient
 */
public interface GatewaySyncClient extends AutoCloseable {

	/**
	 * Connects and authenticates, blocking at most for the connection timeout.
	 */
	void connect();

	void disconnect();

	/**
	 * Disconnects and waits for the close frame to be written.
	 * @return true if closed gracefully, false otherwise
	 */
	boolean closeGracefully();

	@Override
	void close();

	ConnectionStatus getStatus();

	boolean isConnected();

	@Nullable
	Object getServerHello();

	@Nullable
	Object call(String method, @Nullable Object params);

	@Nullable
	Object call(String method, @Nullable Object params, Duration timeout);

	@Nullable
	<T> T call(String method, @Nullable Object params, TypeRef<T> resultType, Duration timeout);

	Disposable subscribe(String sessionId, Consumer<SessionEvent> callback);

	GatewaySchema.SessionRef sendTask(GatewaySchema.SendTaskRequest request);

	GatewaySchema.SessionRef resumeSession(String sessionId, @Nullable String prompt);

	List<GatewaySchema.Session> listSessions();

	GatewaySchema.SessionHistory getSessionHistory(String sessionId);

	GatewaySchema.StopSessionResult stopSession(String sessionId);

	GatewaySchema.GatewayStatus getGatewayStatus();

	GatewaySchema.PingResult ping();

}
