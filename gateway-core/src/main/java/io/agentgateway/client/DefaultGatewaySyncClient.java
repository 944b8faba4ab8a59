/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.client;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.agentgateway.json.TypeRef;
import io.agentgateway.spec.ConnectionStatus;
import io.agentgateway.spec.GatewaySchema;
import io.agentgateway.spec.SessionEvent;
import io.agentgateway.util.Assert;
import reactor.core.Disposable;

/**
 * Default {@link GatewaySyncClient}, blocking on the Monos of the delegate.
 *
 * <p>
 * No extra timeout is applied around calls: each call is bounded by its own request
 * timeout and {@link #connect()} by the connection timeout of the delegate.
 */
public class DefaultGatewaySyncClient implements GatewaySyncClient {

	private static final Logger logger = LoggerFactory.getLogger(DefaultGatewaySyncClient.class);

	private static final long DEFAULT_CLOSE_TIMEOUT_MS = 10_000L;

	private final GatewayAsyncClient delegate;

	DefaultGatewaySyncClient(GatewayAsyncClient delegate) {
		Assert.notNull(delegate, "The delegate can not be null");
		this.delegate = delegate;
	}

	@Override
	public void connect() {
		this.delegate.connect().block();
	}

	@Override
	public void disconnect() {
		this.delegate.disconnect();
	}

	@Override
	public boolean closeGracefully() {
		try {
			this.delegate.closeGracefully().block(Duration.ofMillis(DEFAULT_CLOSE_TIMEOUT_MS));
		}
		catch (RuntimeException e) {
			logger.warn("Client didn't close within timeout of {} ms.", DEFAULT_CLOSE_TIMEOUT_MS, e);
			return false;
		}
		return true;
	}

	@Override
	public void close() {
		this.delegate.disconnect();
	}

	@Override
	public ConnectionStatus getStatus() {
		return this.delegate.getStatus();
	}

	@Override
	public boolean isConnected() {
		return this.delegate.isConnected();
	}

	@Override
	public Object getServerHello() {
		return this.delegate.getServerHello();
	}

	@Override
	public Object call(String method, Object params) {
		return this.delegate.call(method, params).block();
	}

	@Override
	public Object call(String method, Object params, Duration timeout) {
		return this.delegate.call(method, params, timeout).block();
	}

	@Override
	public <T> T call(String method, Object params, TypeRef<T> resultType, Duration timeout) {
		return this.delegate.call(method, params, resultType, timeout).block();
	}

	@Override
	public Disposable subscribe(String sessionId, Consumer<SessionEvent> callback) {
		return this.delegate.subscribe(sessionId, callback);
	}

	// --------------------------
	// Sessions
	// --------------------------

	@Override
	public GatewaySchema.SessionRef sendTask(GatewaySchema.SendTaskRequest request) {
		return this.delegate.sendTask(request).block();
	}

	@Override
	public GatewaySchema.SessionRef resumeSession(String sessionId, String prompt) {
		return this.delegate.resumeSession(sessionId, prompt).block();
	}

	@Override
	public List<GatewaySchema.Session> listSessions() {
		return this.delegate.listSessions().block();
	}

	@Override
	public GatewaySchema.SessionHistory getSessionHistory(String sessionId) {
		return this.delegate.getSessionHistory(sessionId).block();
	}

	@Override
	public GatewaySchema.StopSessionResult stopSession(String sessionId) {
		return this.delegate.stopSession(sessionId).block();
	}

	// --------------------------
	// Gateway
	// --------------------------

	@Override
	public GatewaySchema.GatewayStatus getGatewayStatus() {
		return this.delegate.getGatewayStatus().block();
	}

	@Override
	public GatewaySchema.PingResult ping() {
		return this.delegate.ping().block();
	}

}
