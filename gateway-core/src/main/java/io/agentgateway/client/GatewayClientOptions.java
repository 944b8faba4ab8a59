/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.client;

import java.net.URI;
import java.time.Duration;

import io.agentgateway.logger.GatewayLogger;
import io.agentgateway.spec.GatewaySchema;
import io.agentgateway.util.Assert;

/**
 * Immutable configuration of a gateway client.
 *
 * <pre>{@code
 * GatewayClientOptions options = GatewayClientOptions.builder("wss://gateway.example.com/ws")
 *     .authToken(token)
 *     .reconnect(ReconnectOptions.of(3, Duration.ofMillis(500), Duration.ofSeconds(10)))
 *     .logger(new Slf4jGatewayLogger(MyService.class))
 *     .build();
 * }</pre>
 */
public final class GatewayClientOptions {

	public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofMillis(30000);

	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofMillis(30000);

	public static final Duration DEFAULT_PING_TIMEOUT = Duration.ofMillis(5000);

	private final URI gatewayUrl;

	private final String authToken;

	private final ReconnectOptions reconnect;

	private final Duration connectionTimeout;

	private final Duration requestTimeout;

	private final Duration pingTimeout;

	private final GatewayLogger logger;

	private final GatewaySchema.ClientInfo clientInfo;

	private final int minProtocol;

	private final int maxProtocol;

	private GatewayClientOptions(Builder builder) {
		this.gatewayUrl = builder.gatewayUrl;
		this.authToken = builder.authToken;
		this.reconnect = builder.reconnect;
		this.connectionTimeout = builder.connectionTimeout;
		this.requestTimeout = builder.requestTimeout;
		this.pingTimeout = builder.pingTimeout;
		this.logger = builder.logger;
		this.clientInfo = builder.clientInfo;
		this.minProtocol = builder.minProtocol;
		this.maxProtocol = builder.maxProtocol;
	}

	public static Builder builder(String gatewayUrl) {
		Assert.hasText(gatewayUrl, "gatewayUrl must not be empty");
		return builder(URI.create(gatewayUrl));
	}

	public static Builder builder(URI gatewayUrl) {
		return new Builder(gatewayUrl);
	}

	public Builder toBuilder() {
		return new Builder(this.gatewayUrl).authToken(this.authToken)
			.reconnect(this.reconnect)
			.connectionTimeout(this.connectionTimeout)
			.requestTimeout(this.requestTimeout)
			.pingTimeout(this.pingTimeout)
			.logger(this.logger)
			.clientInfo(this.clientInfo)
			.protocolRange(this.minProtocol, this.maxProtocol);
	}

	public URI gatewayUrl() {
		return this.gatewayUrl;
	}

	public String authToken() {
		return this.authToken;
	}

	public ReconnectOptions reconnect() {
		return this.reconnect;
	}

	public Duration connectionTimeout() {
		return this.connectionTimeout;
	}

	public Duration requestTimeout() {
		return this.requestTimeout;
	}

	public Duration pingTimeout() {
		return this.pingTimeout;
	}

	public GatewayLogger logger() {
		return this.logger;
	}

	public GatewaySchema.ClientInfo clientInfo() {
		return this.clientInfo;
	}

	public int minProtocol() {
		return this.minProtocol;
	}

	public int maxProtocol() {
		return this.maxProtocol;
	}

	public static final class Builder {

		private final URI gatewayUrl;

		private String authToken = "";

		private ReconnectOptions reconnect = ReconnectOptions.defaults();

		private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		private Duration pingTimeout = DEFAULT_PING_TIMEOUT;

		private GatewayLogger logger = GatewayLogger.noop();

		private GatewaySchema.ClientInfo clientInfo = GatewaySchema.ClientInfo.defaults();

		private int minProtocol = GatewaySchema.PROTOCOL_VERSION;

		private int maxProtocol = GatewaySchema.PROTOCOL_VERSION;

		private Builder(URI gatewayUrl) {
			Assert.notNull(gatewayUrl, "gatewayUrl must not be null");
			this.gatewayUrl = gatewayUrl;
		}

		/**
		 * Token presented during the handshake. A {@code null} token is sent as an empty
		 * string.
		 * @param authToken the token
		 * @return this builder
		 */
		public Builder authToken(String authToken) {
			this.authToken = (authToken != null) ? authToken : "";
			return this;
		}

		public Builder reconnect(ReconnectOptions reconnect) {
			Assert.notNull(reconnect, "reconnect must not be null");
			this.reconnect = reconnect;
			return this;
		}

		public Builder connectionTimeout(Duration connectionTimeout) {
			Assert.notNull(connectionTimeout, "connectionTimeout must not be null");
			this.connectionTimeout = connectionTimeout;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "requestTimeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder pingTimeout(Duration pingTimeout) {
			Assert.notNull(pingTimeout, "pingTimeout must not be null");
			this.pingTimeout = pingTimeout;
			return this;
		}

		public Builder logger(GatewayLogger logger) {
			Assert.notNull(logger, "logger must not be null");
			this.logger = logger;
			return this;
		}

		public Builder clientInfo(GatewaySchema.ClientInfo clientInfo) {
			Assert.notNull(clientInfo, "clientInfo must not be null");
			this.clientInfo = clientInfo;
			return this;
		}

		public Builder protocolRange(int minProtocol, int maxProtocol) {
			this.minProtocol = minProtocol;
			this.maxProtocol = maxProtocol;
			return this;
		}

		public GatewayClientOptions build() {
			String scheme = this.gatewayUrl.getScheme();
			Assert.isTrue("ws".equalsIgnoreCase(scheme) || "wss".equalsIgnoreCase(scheme),
					"gatewayUrl must use the ws or wss scheme: " + this.gatewayUrl);
			Assert.isTrue(!this.connectionTimeout.isNegative() && !this.connectionTimeout.isZero(),
					"connectionTimeout must be positive");
			Assert.isTrue(!this.requestTimeout.isNegative() && !this.requestTimeout.isZero(),
					"requestTimeout must be positive");
			Assert.isTrue(!this.pingTimeout.isNegative() && !this.pingTimeout.isZero(),
					"pingTimeout must be positive");
			Assert.isTrue(this.minProtocol > 0 && this.minProtocol <= this.maxProtocol,
					"protocol range must satisfy 0 < minProtocol <= maxProtocol");
			return new GatewayClientOptions(this);
		}

	}

}
