/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.client;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.agentgateway.json.GatewayJsonMapper;
import io.agentgateway.json.TypeRef;
import io.agentgateway.logger.GatewayLogger;
import io.agentgateway.spec.ConnectionStatus;
import io.agentgateway.spec.EventRouter;
import io.agentgateway.spec.GatewayClientTransport;
import io.agentgateway.spec.GatewayConnectionClosedException;
import io.agentgateway.spec.GatewayDuplicateCallException;
import io.agentgateway.spec.GatewayFrame;
import io.agentgateway.spec.GatewayFrameCodec;
import io.agentgateway.spec.GatewayHandshakeException;
import io.agentgateway.spec.GatewayNotConnectedException;
import io.agentgateway.spec.GatewayRemoteException;
import io.agentgateway.spec.GatewaySchema;
import io.agentgateway.spec.GatewayTransportListener;
import io.agentgateway.spec.PendingRequestTable;
import io.agentgateway.spec.RequestIdGenerator;
import io.agentgateway.spec.SessionEvent;
import io.agentgateway.util.Assert;
import io.agentgateway.util.Utils;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.util.annotation.Nullable;

/**
 * Default {@link GatewayAsyncClient}: the connection and handshake state machine on top
 * of a {@link GatewayClientTransport}.
 *
 * <p>
 * Every socket the client opens gets its own {@link SocketListener}. Only the listener of
 * the current socket may change the client's state; signals arriving from a socket that
 * was replaced or closed by the client are ignored. The connection state, the in-flight
 * attempt and the reconnection counter are guarded by a single lock, which is never held
 * while waiting on I/O.
 *
 * @see GatewayClient
 */
public class DefaultGatewayAsyncClient implements GatewayAsyncClient {

	private static final Logger logger = LoggerFactory.getLogger(DefaultGatewayAsyncClient.class);

	private static final int ABNORMAL_CLOSURE = 1006;

	private static final TypeRef<GatewaySchema.SessionRef> SESSION_REF_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<List<GatewaySchema.Session>> SESSION_LIST_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<GatewaySchema.SessionHistory> SESSION_HISTORY_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<GatewaySchema.StopSessionResult> STOP_SESSION_RESULT_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<GatewaySchema.GatewayStatus> GATEWAY_STATUS_TYPE_REF = new TypeRef<>() {
	};

	private final GatewayClientTransport transport;

	private final GatewayClientOptions options;

	private final GatewayFrameCodec codec;

	private final PendingRequestTable pendingRequests;

	private final EventRouter eventRouter;

	private final ReconnectPolicy reconnectPolicy;

	private final Scheduler timer;

	private final GatewayLogger gatewayLogger;

	private final Set<String> inFlightDedupKeys = ConcurrentHashMap.newKeySet();

	private final Object lock = new Object();

	private volatile ConnectionStatus status = ConnectionStatus.DISCONNECTED;

	@Nullable
	private volatile Object serverHello;

	// guarded by lock
	@Nullable
	private ConnectAttempt inFlight;

	@Nullable
	private SocketListener activeListener;

	private int reconnectAttempts;

	private boolean reconnectPending;

	private long reconnectTicket;

	@Nullable
	private Disposable reconnectTimer;

	private boolean userDisconnected;

	DefaultGatewayAsyncClient(GatewayClientTransport transport, GatewayClientOptions options,
			GatewayJsonMapper jsonMapper, Scheduler timer, Clock clock, RequestIdGenerator idGenerator) {
		Assert.notNull(transport, "transport must not be null");
		Assert.notNull(options, "options must not be null");
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		Assert.notNull(timer, "timer must not be null");
		Assert.notNull(clock, "clock must not be null");
		Assert.notNull(idGenerator, "idGenerator must not be null");
		this.transport = transport;
		this.options = options;
		this.codec = new GatewayFrameCodec(jsonMapper);
		this.timer = timer;
		this.gatewayLogger = options.logger();
		this.pendingRequests = new PendingRequestTable(idGenerator, timer);
		this.eventRouter = new EventRouter(options.logger(), clock);
		this.reconnectPolicy = new ReconnectPolicy(options.reconnect());
	}

	// --------------------------
	// Lifecycle
	// --------------------------

	@Override
	public Mono<Void> connect() {
		return Mono.defer(() -> {
			synchronized (this.lock) {
				this.userDisconnected = false;
				cancelReconnectTimer();
			}
			return connectInternal();
		});
	}

	private Mono<Void> connectInternal() {
		return Mono.defer(() -> {
			ConnectAttempt attempt;
			synchronized (this.lock) {
				if (this.status == ConnectionStatus.CONNECTED) {
					return Mono.empty();
				}
				if (this.inFlight != null) {
					return this.inFlight.result();
				}
				attempt = new ConnectAttempt();
				this.inFlight = attempt;
				this.activeListener = attempt.listener;
				this.status = ConnectionStatus.CONNECTING;
			}

			this.gatewayLogger.info("Connecting to gateway", Map.of("url", this.options.gatewayUrl().toString()));

			long timeoutMillis = this.options.connectionTimeout().toMillis();
			attempt.timeoutHandle = this.timer.schedule(
					() -> failAttempt(attempt,
							new GatewayHandshakeException("Connection timeout after " + timeoutMillis + "ms")),
					timeoutMillis, TimeUnit.MILLISECONDS);

			this.transport.connect(attempt.listener)
				.subscribe(null, error -> failAttempt(attempt,
						new GatewayHandshakeException("Failed to open connection: " + Utils.describe(error), error)));

			return attempt.result();
		});
	}

	@Override
	public void disconnect() {
		closeGracefully().subscribe(null, error -> logger.warn("Failed to close the gateway connection", error));
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			ConnectAttempt attempt;
			ConnectionStatus previous;
			synchronized (this.lock) {
				this.userDisconnected = true;
				cancelReconnectTimer();
				attempt = this.inFlight;
				this.inFlight = null;
				this.activeListener = null;
				this.serverHello = null;
				previous = this.status;
				this.status = ConnectionStatus.DISCONNECTED;
			}

			if (attempt != null && attempt.settle()) {
				attempt.cancelTimer();
				attempt.sink.tryEmitError(new GatewayConnectionClosedException("Disconnected by client"));
			}
			int failed = this.pendingRequests.failAll("Client disconnected");
			if (failed > 0) {
				logger.debug("Failed {} outstanding request(s) on disconnect", failed);
			}
			if (previous != ConnectionStatus.DISCONNECTED) {
				this.gatewayLogger.info("Disconnected from gateway",
						Map.of("code", GatewayClientTransport.NORMAL_CLOSURE, "reason", "Client disconnect"));
			}
			return this.transport.close(GatewayClientTransport.NORMAL_CLOSURE, "Client disconnect");
		});
	}

	@Override
	public ConnectionStatus getStatus() {
		return this.status;
	}

	@Override
	public boolean isConnected() {
		return this.status == ConnectionStatus.CONNECTED;
	}

	@Override
	@Nullable
	public Object getServerHello() {
		return this.serverHello;
	}

	// --------------------------
	// Calls
	// --------------------------

	@Override
	public Mono<Object> call(String method, @Nullable Object params) {
		return call(method, params, this.options.requestTimeout(), CallContext.empty());
	}

	@Override
	public Mono<Object> call(String method, @Nullable Object params, Duration timeout) {
		return call(method, params, timeout, CallContext.empty());
	}

	@Override
	public Mono<Object> call(String method, @Nullable Object params, Duration timeout, CallContext context) {
		Assert.hasText(method, "method must not be empty");
		Assert.notNull(timeout, "timeout must not be null");
		Assert.notNull(context, "context must not be null");
		return Mono.defer(() -> {
			if (!isConnected()) {
				return Mono.error(new GatewayNotConnectedException());
			}

			String dedupKey = context.dedupKey().orElse(null);
			if (dedupKey != null && !this.inFlightDedupKeys.add(dedupKey)) {
				return Mono.error(new GatewayDuplicateCallException(dedupKey));
			}

			PendingRequestTable.Registration registration;
			try {
				registration = this.pendingRequests.register(method, PendingRequestTable.Kind.APPLICATION, timeout);
			}
			catch (RuntimeException e) {
				releaseDedupKey(dedupKey);
				return Mono.error(e);
			}

			write(registration.id(), new GatewayFrame.Request(registration.id(), method, params));
			this.gatewayLogger.info("RPC call sent", Map.of("method", method, "id", registration.id()));

			Mono<Object> response = registration.response();
			return (dedupKey != null) ? response.doFinally(signal -> releaseDedupKey(dedupKey)) : response;
		});
	}

	@Override
	public <T> Mono<T> call(String method, @Nullable Object params, TypeRef<T> resultType, Duration timeout) {
		Assert.notNull(resultType, "resultType must not be null");
		return call(method, params, timeout).map(payload -> this.codec.convertPayload(payload, resultType));
	}

	private void releaseDedupKey(@Nullable String dedupKey) {
		if (dedupKey != null) {
			this.inFlightDedupKeys.remove(dedupKey);
		}
	}

	private void write(String requestId, GatewayFrame.Request request) {
		String text;
		try {
			text = this.codec.encode(request);
		}
		catch (IOException e) {
			this.pendingRequests.fail(requestId,
					new UncheckedIOException("Failed to encode request '" + request.method() + "'", e));
			return;
		}
		this.transport.sendText(text)
			.subscribe(null, error -> this.pendingRequests.fail(requestId, new GatewayConnectionClosedException(
					"Failed to send request '" + request.method() + "': " + Utils.describe(error), error)));
	}

	// --------------------------
	// Events
	// --------------------------

	@Override
	public Disposable subscribe(String sessionId, Consumer<SessionEvent> callback) {
		return this.eventRouter.subscribe(sessionId, callback);
	}

	@Override
	public Flux<SessionEvent> sessionEvents(String sessionId) {
		return this.eventRouter.events(sessionId);
	}

	// --------------------------
	// Sessions
	// --------------------------

	@Override
	public Mono<GatewaySchema.SessionRef> sendTask(GatewaySchema.SendTaskRequest request) {
		Assert.notNull(request, "request must not be null");
		return call(GatewaySchema.METHOD_SESSIONS_SEND, request, SESSION_REF_TYPE_REF,
				this.options.requestTimeout());
	}

	@Override
	public Mono<GatewaySchema.SessionRef> resumeSession(String sessionId, @Nullable String prompt) {
		return Mono.fromSupplier(() -> new GatewaySchema.ResumeSessionRequest(sessionId, prompt))
			.flatMap(params -> call(GatewaySchema.METHOD_SESSIONS_RESUME, params, SESSION_REF_TYPE_REF,
					this.options.requestTimeout()));
	}

	@Override
	public Mono<List<GatewaySchema.Session>> listSessions() {
		return call(GatewaySchema.METHOD_SESSIONS_LIST, Map.of(), SESSION_LIST_TYPE_REF,
				this.options.requestTimeout())
			.defaultIfEmpty(List.of());
	}

	@Override
	public Mono<GatewaySchema.SessionHistory> getSessionHistory(String sessionId) {
		return Mono.fromSupplier(() -> new GatewaySchema.SessionIdParams(sessionId))
			.flatMap(params -> call(GatewaySchema.METHOD_SESSIONS_HISTORY, params, SESSION_HISTORY_TYPE_REF,
					this.options.requestTimeout()));
	}

	@Override
	public Mono<GatewaySchema.StopSessionResult> stopSession(String sessionId) {
		return Mono.fromSupplier(() -> new GatewaySchema.SessionIdParams(sessionId))
			.flatMap(params -> call(GatewaySchema.METHOD_SESSIONS_STOP, params, STOP_SESSION_RESULT_TYPE_REF,
					this.options.requestTimeout()));
	}

	// --------------------------
	// Gateway
	// --------------------------

	@Override
	public Mono<GatewaySchema.GatewayStatus> getGatewayStatus() {
		return call(GatewaySchema.METHOD_STATUS, Map.of(), GATEWAY_STATUS_TYPE_REF, this.options.requestTimeout());
	}

	@Override
	public Mono<GatewaySchema.PingResult> ping() {
		return Mono.defer(() -> {
			long start = System.nanoTime();
			return call(GatewaySchema.METHOD_PING, Map.of(), this.options.pingTimeout())
				.then(Mono.fromSupplier(() -> new GatewaySchema.PingResult(true,
						TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start))));
		});
	}

	// --------------------------
	// Handshake
	// --------------------------

	private void answerChallenge(SocketListener listener) {
		GatewaySchema.ConnectParams params = new GatewaySchema.ConnectParams(this.options.minProtocol(),
				this.options.maxProtocol(), this.options.clientInfo(),
				new GatewaySchema.Auth(this.options.authToken()));

		PendingRequestTable.Registration registration = this.pendingRequests.register(GatewaySchema.METHOD_CONNECT,
				PendingRequestTable.Kind.HANDSHAKE, this.options.connectionTimeout());
		listener.handshakeRequestId = registration.id();

		registration.response()
			.map(Optional::of)
			.defaultIfEmpty(Optional.empty())
			.subscribe(hello -> onHandshakeAccepted(listener, hello.orElse(null)),
					error -> onHandshakeFailed(listener, error));

		logger.debug("Answering connection challenge with request {}", registration.id());
		write(registration.id(), new GatewayFrame.Request(registration.id(), GatewaySchema.METHOD_CONNECT, params));
	}

	private void onHandshakeAccepted(SocketListener listener, @Nullable Object hello) {
		ConnectAttempt attempt = listener.attempt;
		synchronized (this.lock) {
			if (this.activeListener != listener || !attempt.settle()) {
				return;
			}
			listener.authenticated = true;
			this.status = ConnectionStatus.CONNECTED;
			this.reconnectAttempts = 0;
			this.serverHello = hello;
			if (this.inFlight == attempt) {
				this.inFlight = null;
			}
		}
		attempt.cancelTimer();
		this.gatewayLogger.info("Connected to gateway");
		attempt.sink.tryEmitEmpty();
	}

	private void onHandshakeFailed(SocketListener listener, Throwable error) {
		GatewayHandshakeException failure;
		if (error instanceof GatewayHandshakeException handshakeException) {
			failure = handshakeException;
		}
		else if (error instanceof GatewayRemoteException remoteException) {
			failure = new GatewayHandshakeException("Handshake rejected: " + remoteException.getMessage(),
					remoteException);
		}
		else {
			failure = new GatewayHandshakeException("Handshake failed: " + Utils.describe(error), error);
		}
		failAttempt(listener.attempt, failure);
	}

	private void failAttempt(ConnectAttempt attempt, GatewayHandshakeException error) {
		synchronized (this.lock) {
			if (!attempt.settle()) {
				return;
			}
			if (this.inFlight == attempt) {
				this.inFlight = null;
			}
			if (this.activeListener == attempt.listener) {
				this.activeListener = null;
				this.status = ConnectionStatus.ERROR;
			}
		}
		attempt.cancelTimer();

		String handshakeRequestId = attempt.listener.handshakeRequestId;
		if (handshakeRequestId != null) {
			this.pendingRequests.fail(handshakeRequestId, error);
		}

		logger.debug("Connection attempt failed", error);
		this.gatewayLogger.error("Connection failed", Map.of("error", Utils.describe(error)));
		this.transport.close(GatewayClientTransport.NORMAL_CLOSURE, "Handshake failed")
			.subscribe(null, closeError -> logger.debug("Failed to close socket after handshake failure", closeError));
		attempt.sink.tryEmitError(error);
	}

	// --------------------------
	// Connection loss and reconnection
	// --------------------------

	private void onSocketEnd(SocketListener listener, int code, String reason, @Nullable Throwable cause) {
		boolean wasConnected;
		synchronized (this.lock) {
			if (this.activeListener != listener) {
				logger.debug("Ignoring end of a replaced socket (code {})", code);
				return;
			}
			wasConnected = listener.authenticated;
			if (wasConnected) {
				this.activeListener = null;
				this.serverHello = null;
				this.status = (cause != null) ? ConnectionStatus.ERROR : ConnectionStatus.DISCONNECTED;
			}
		}

		if (!wasConnected) {
			String message = (cause != null) ? "Connection error during handshake: " + Utils.describe(cause)
					: "Connection closed during handshake (code " + code + ")";
			failAttempt(listener.attempt, new GatewayHandshakeException(message, cause));
			return;
		}

		if (cause != null) {
			this.gatewayLogger.error("Connection error", Map.of("error", Utils.describe(cause)));
		}
		this.gatewayLogger.info("Disconnected from gateway", Map.of("code", code, "reason", reason));

		int failed = this.pendingRequests.failAll("Connection closed");
		if (failed > 0) {
			logger.debug("Failed {} outstanding request(s) after connection loss", failed);
		}
		if (this.reconnectPolicy.isEnabled()) {
			scheduleReconnect();
		}
	}

	private void scheduleReconnect() {
		synchronized (this.lock) {
			if (this.reconnectPending || this.userDisconnected) {
				return;
			}
			if (this.reconnectPolicy.isExhausted(this.reconnectAttempts)) {
				this.status = ConnectionStatus.ERROR;
				this.gatewayLogger.error("Max reconnection attempts reached",
						Map.of("maxAttempts", this.reconnectPolicy.maxAttempts()));
				return;
			}
			Duration delay = this.reconnectPolicy.delayFor(this.reconnectAttempts);
			this.gatewayLogger.info("Scheduling reconnection in " + delay.toMillis() + "ms", Map
				.of("attempt", this.reconnectAttempts + 1, "maxAttempts", this.reconnectPolicy.maxAttempts()));

			// a zero delay may run the task before schedule() returns
			long ticket = ++this.reconnectTicket;
			this.reconnectPending = true;
			Disposable handle = this.timer.schedule(() -> attemptReconnect(ticket), delay.toMillis(),
					TimeUnit.MILLISECONDS);
			if (this.reconnectPending && this.reconnectTicket == ticket) {
				this.reconnectTimer = handle;
			}
		}
	}

	private void attemptReconnect(long ticket) {
		synchronized (this.lock) {
			if (!this.reconnectPending || this.reconnectTicket != ticket || this.userDisconnected) {
				return;
			}
			this.reconnectPending = false;
			this.reconnectTimer = null;
			this.reconnectAttempts++;
		}
		connectInternal().subscribe(null, error -> {
			this.gatewayLogger.error("Reconnection failed", Map.of("error", Utils.describe(error)));
			scheduleReconnect();
		});
	}

	// guarded by lock
	private void cancelReconnectTimer() {
		this.reconnectPending = false;
		if (this.reconnectTimer != null) {
			this.reconnectTimer.dispose();
			this.reconnectTimer = null;
		}
	}

	/**
	 * One attempt to open and authenticate a socket.
	 */
	private final class ConnectAttempt {

		private final Sinks.One<Void> sink = Sinks.one();

		private final AtomicBoolean settled = new AtomicBoolean();

		private final SocketListener listener = new SocketListener(this);

		private volatile Disposable timeoutHandle;

		private Mono<Void> result() {
			return this.sink.asMono();
		}

		private boolean settle() {
			return this.settled.compareAndSet(false, true);
		}

		private void cancelTimer() {
			Disposable handle = this.timeoutHandle;
			if (handle != null) {
				handle.dispose();
			}
		}

	}

	/**
	 * Receives the signals of one socket.
	 */
	private final class SocketListener implements GatewayTransportListener {

		private final ConnectAttempt attempt;

		private final AtomicBoolean challengeAnswered = new AtomicBoolean();

		private volatile boolean authenticated;

		@Nullable
		private volatile String handshakeRequestId;

		private SocketListener(ConnectAttempt attempt) {
			this.attempt = attempt;
		}

		private boolean isActive() {
			synchronized (lock) {
				return activeListener == this;
			}
		}

		@Override
		public void onText(String text) {
			if (!isActive()) {
				logger.debug("Ignoring frame from a replaced socket");
				return;
			}

			GatewayFrame frame;
			try {
				frame = codec.decode(text);
			}
			catch (IOException | IllegalArgumentException e) {
				logger.debug("Dropping malformed frame: {}", text, e);
				gatewayLogger.error("Failed to parse message", Map.of("error", Utils.describe(e)));
				return;
			}

			if (frame instanceof GatewayFrame.Response response) {
				if (!pendingRequests.complete(response)) {
					gatewayLogger.warn("Received response for unknown request", Map.of("id", response.id()));
				}
			}
			else if (frame instanceof GatewayFrame.Event event) {
				handleEvent(event);
			}
			else if (frame instanceof GatewayFrame.Request request) {
				logger.debug("Ignoring request '{}' sent by the gateway", request.method());
			}
		}

		private void handleEvent(GatewayFrame.Event event) {
			if (this.authenticated) {
				eventRouter.dispatch(event);
				return;
			}
			if (GatewaySchema.EVENT_CONNECT_CHALLENGE.equals(event.event())
					&& this.challengeAnswered.compareAndSet(false, true)) {
				answerChallenge(this);
			}
			else {
				logger.debug("Ignoring event '{}' received before authentication", event.event());
			}
		}

		@Override
		public void onClose(int statusCode, String reason) {
			onSocketEnd(this, statusCode, (reason != null) ? reason : "", null);
		}

		@Override
		public void onError(Throwable error) {
			onSocketEnd(this, ABNORMAL_CLOSURE, Utils.describe(error), error);
		}

	}

}
