/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.client;

import java.time.Clock;

import io.agentgateway.client.transport.WebSocketClientTransport;
import io.agentgateway.json.GatewayJsonMapper;
import io.agentgateway.spec.GatewayClientTransport;
import io.agentgateway.spec.RequestIdGenerator;
import io.agentgateway.util.Assert;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Factory for gateway clients.
 *
 * <p>
 * Example of an asynchronous client over the default WebSocket transport:
 *
 * <pre>{@code
 * GatewayAsyncClient client = GatewayClient.async(GatewayClientOptions.builder("wss://gateway.example.com/ws")
 *     .authToken(token)
 *     .build())
 *   .build();
 *
 * client.connect()
 *   .then(client.sendTask(new GatewaySchema.SendTaskRequest("Fix the failing build")))
 *   .subscribe(session -> client.subscribe(session.sessionId(), event -> handle(event)));
 * }</pre>
 *
 * <p>
 * Example of a blocking client over a custom transport:
 *
 * <pre>{@code
 * try (GatewaySyncClient client = GatewayClient.sync(transport).options(options).build()) {
 *     client.connect();
 *     GatewaySchema.PingResult pong = client.ping();
 * }
 * }</pre>
 *
 * @see GatewayAsyncClient
 * @see GatewaySyncClient
 */
public final class GatewayClient {

	private GatewayClient() {
	}

	/**
	 * Starts building an asynchronous client that talks through the given transport.
	 * @param transport the transport
	 * @return a new builder
	 */
	public static AsyncSpec async(GatewayClientTransport transport) {
		return new AsyncSpec(transport);
	}

	/**
	 * Starts building an asynchronous client over a {@link WebSocketClientTransport} for
	 * the options' gateway URL.
	 * @param options the client options
	 * @return a new builder, already configured with the options
	 */
	public static AsyncSpec async(GatewayClientOptions options) {
		Assert.notNull(options, "options must not be null");
		return new AsyncSpec(webSocketTransport(options)).options(options);
	}

	public static SyncSpec sync(GatewayClientTransport transport) {
		return new SyncSpec(new AsyncSpec(transport));
	}

	public static SyncSpec sync(GatewayClientOptions options) {
		return new SyncSpec(async(options));
	}

	private static GatewayClientTransport webSocketTransport(GatewayClientOptions options) {
		return WebSocketClientTransport.builder(options.gatewayUrl())
			.connectTimeout(options.connectionTimeout())
			.build();
	}

	/**
	 * Builder of a {@link GatewayAsyncClient}. Only the options are required.
	 */
	public static final class AsyncSpec {

		private final GatewayClientTransport transport;

		private GatewayClientOptions options;

		private GatewayJsonMapper jsonMapper;

		private Scheduler scheduler = Schedulers.parallel();

		private Clock clock = Clock.systemUTC();

		private RequestIdGenerator requestIdGenerator = RequestIdGenerator.ofIncremental();

		private AsyncSpec(GatewayClientTransport transport) {
			Assert.notNull(transport, "Transport must not be null");
			this.transport = transport;
		}

		public AsyncSpec options(GatewayClientOptions options) {
			Assert.notNull(options, "options must not be null");
			this.options = options;
			return this;
		}

		/**
		 * Sets the JSON mapper. Defaults to the implementation found on the class path.
		 * @param jsonMapper the mapper
		 * @return this builder
		 */
		public AsyncSpec jsonMapper(GatewayJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "jsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		/**
		 * Sets the scheduler running request, connection and reconnection timers.
		 * @param scheduler the scheduler
		 * @return this builder
		 */
		public AsyncSpec scheduler(Scheduler scheduler) {
			Assert.notNull(scheduler, "scheduler must not be null");
			this.scheduler = scheduler;
			return this;
		}

		public AsyncSpec clock(Clock clock) {
			Assert.notNull(clock, "clock must not be null");
			this.clock = clock;
			return this;
		}

		public AsyncSpec requestIdGenerator(RequestIdGenerator requestIdGenerator) {
			Assert.notNull(requestIdGenerator, "requestIdGenerator must not be null");
			this.requestIdGenerator = requestIdGenerator;
			return this;
		}

		AsyncSpec withoutReconnect() {
			Assert.notNull(this.options, "options must be set");
			this.options = this.options.toBuilder().reconnect(ReconnectOptions.disabled()).build();
			return this;
		}

		public GatewayAsyncClient build() {
			Assert.notNull(this.options, "options must be set");
			GatewayJsonMapper mapper = (this.jsonMapper != null) ? this.jsonMapper : GatewayJsonMapper.createDefault();
			return new DefaultGatewayAsyncClient(this.transport, this.options, mapper, this.scheduler, this.clock,
					this.requestIdGenerator);
		}

	}

	/**
	 * Builder of a {@link GatewaySyncClient}.
	 */
	public static final class SyncSpec {

		private final AsyncSpec delegate;

		private SyncSpec(AsyncSpec delegate) {
			this.delegate = delegate;
		}

		public SyncSpec options(GatewayClientOptions options) {
			this.delegate.options(options);
			return this;
		}

		public SyncSpec jsonMapper(GatewayJsonMapper jsonMapper) {
			this.delegate.jsonMapper(jsonMapper);
			return this;
		}

		public SyncSpec scheduler(Scheduler scheduler) {
			this.delegate.scheduler(scheduler);
			return this;
		}

		public SyncSpec clock(Clock clock) {
			this.delegate.clock(clock);
			return this;
		}

		public SyncSpec requestIdGenerator(RequestIdGenerator requestIdGenerator) {
			this.delegate.requestIdGenerator(requestIdGenerator);
			return this;
		}

		public GatewaySyncClient build() {
			return new DefaultGatewaySyncClient(this.delegate.build());
		}

	}

}
