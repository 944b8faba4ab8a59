/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.agentgateway.client.transport;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.agentgateway.spec.GatewayClientTransport;
import io.agentgateway.spec.GatewayTransportListener;
import io.agentgateway.util.Assert;
import reactor.core.publisher.Mono;

/**
 * The WebSocket implementation of {@link GatewayClientTransport}, built on the JDK
 * {@link HttpClient}.
 *
 * <p>
 * Outbound frames are chained so that only one {@code sendText} is in progress on the
 * socket at any time, as required by {@link WebSocket}.
 *
 * <p>
 * Every {@link #connect} and {@link #close} starts a new generation. A socket whose
 * opening completes after its generation ended is aborted instead of being adopted.
 *
 * @author Aliaksei Darafeyeu
 */
public class WebSocketClientTransport implements GatewayClientTransport {

	private static final Logger logger = LoggerFactory.getLogger(WebSocketClientTransport.class);

	private final HttpClient httpClient;

	private final URI uri;

	private final Duration connectTimeout;

	private final AtomicReference<WebSocket> webSocketRef = new AtomicReference<>();

	private final AtomicReference<TransportState> state = new AtomicReference<>(TransportState.DISCONNECTED);

	private final AtomicLong generation = new AtomicLong();

	private final Object stateLock = new Object();

	private final Object sendLock = new Object();

	private CompletableFuture<?> lastSend = CompletableFuture.completedFuture(null);

	WebSocketClientTransport(URI uri, HttpClient.Builder clientBuilder, Duration connectTimeout) {
		this.uri = uri;
		this.httpClient = clientBuilder.build();
		this.connectTimeout = connectTimeout;
	}

	/**
	 * Creates a new builder for a transport connecting to the given URI.
	 * @param uri the {@code ws://} or {@code wss://} URI of the gateway
	 * @return a new Builder instance
	 */
	public static Builder builder(URI uri) {
		return new Builder().uri(uri);
	}

	/**
	 * The state of the socket.
	 */
	public enum TransportState {

		DISCONNECTED, CONNECTING, CONNECTED, CLOSED

	}

	/**
	 * A builder for creating instances of WebSocketClientTransport.
	 */
	public static class Builder {

		private URI uri;

		private Duration connectTimeout = Duration.ofSeconds(10);

		private final HttpClient.Builder clientBuilder = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1);

		public Builder uri(URI uri) {
			this.uri = uri;
			return this;
		}

		public Builder connectTimeout(Duration connectTimeout) {
			Assert.notNull(connectTimeout, "connectTimeout must not be null");
			this.connectTimeout = connectTimeout;
			return this;
		}

		public Builder customizeClient(Consumer<HttpClient.Builder> clientCustomizer) {
			Assert.notNull(clientCustomizer, "clientCustomizer must not be null");
			clientCustomizer.accept(this.clientBuilder);
			return this;
		}

		public WebSocketClientTransport build() {
			Assert.notNull(this.uri, "uri must not be null");
			String scheme = this.uri.getScheme();
			Assert.isTrue("ws".equalsIgnoreCase(scheme) || "wss".equalsIgnoreCase(scheme),
					"Gateway URI must use the ws or wss scheme: " + this.uri);
			return new WebSocketClientTransport(this.uri, this.clientBuilder, this.connectTimeout);
		}

	}

	@Override
	public Mono<Void> connect(GatewayTransportListener listener) {
		Assert.notNull(listener, "listener must not be null");
		return Mono.defer(() -> {
			long generation;
			WebSocket previous;
			synchronized (this.stateLock) {
				generation = this.generation.incrementAndGet();
				previous = this.webSocketRef.getAndSet(null);
				this.state.set(TransportState.CONNECTING);
			}
			if (previous != null) {
				logger.debug("Aborting previous socket before reconnecting");
				previous.abort();
			}

			// the stages below run whether or not the Mono is still subscribed
			CompletableFuture<WebSocket> opening = this.httpClient.newWebSocketBuilder()
				.connectTimeout(this.connectTimeout)
				.buildAsync(this.uri, new ListenerAdapter(listener))
				.whenComplete((webSocket, error) -> {
					if (error != null) {
						markClosed(generation);
					}
				})
				.thenApply(webSocket -> {
					if (!adopt(webSocket, generation)) {
						logger.debug("Socket to {} opened after the transport was closed, aborting it", this.uri);
						webSocket.abort();
						throw new CompletionException(
								new IllegalStateException("WebSocket was closed while connecting."));
					}
					return webSocket;
				});

			return Mono.fromFuture(opening, true).then();
		});
	}

	private boolean adopt(WebSocket webSocket, long generation) {
		synchronized (this.stateLock) {
			if (this.generation.get() != generation) {
				return false;
			}
			this.webSocketRef.set(webSocket);
			synchronized (this.sendLock) {
				this.lastSend = CompletableFuture.completedFuture(null);
			}
			this.state.set(TransportState.CONNECTED);
		}
		logger.debug("WebSocket connected to {}", this.uri);
		return true;
	}

	private void markClosed(long generation) {
		synchronized (this.stateLock) {
			if (this.generation.get() == generation) {
				this.state.set(TransportState.CLOSED);
			}
		}
	}

	@Override
	public Mono<Void> sendText(String text) {
		return Mono.defer(() -> {
			WebSocket webSocket = this.webSocketRef.get();
			if (webSocket == null && this.state.get() == TransportState.CONNECTING) {
				return Mono.error(new IllegalStateException("WebSocket is connecting."));
			}
			if (webSocket == null || this.state.get() != TransportState.CONNECTED || webSocket.isOutputClosed()) {
				return Mono.error(new IllegalStateException("WebSocket is closed."));
			}
			CompletableFuture<?> send;
			synchronized (this.sendLock) {
				send = this.lastSend.exceptionally(error -> null)
					.thenCompose(ignored -> webSocket.sendText(text, true));
				this.lastSend = send;
			}
			return Mono.fromFuture(send).then();
		});
	}

	@Override
	public Mono<Void> close(int statusCode, String reason) {
		return Mono.defer(() -> {
			WebSocket webSocket;
			synchronized (this.stateLock) {
				// invalidates an opening still in progress
				this.generation.incrementAndGet();
				webSocket = this.webSocketRef.getAndSet(null);
				this.state.set(TransportState.CLOSED);
			}
			if (webSocket == null || webSocket.isOutputClosed()) {
				return Mono.empty();
			}
			return Mono.fromFuture(webSocket.sendClose(statusCode, reason)).then().onErrorResume(error -> {
				logger.warn("Failed to send close frame, aborting socket", error);
				webSocket.abort();
				return Mono.empty();
			});
		});
	}

	public TransportState getState() {
		return this.state.get();
	}

	private final class ListenerAdapter implements WebSocket.Listener {

		private final GatewayTransportListener listener;

		private final StringBuilder messageBuffer = new StringBuilder();

		private ListenerAdapter(GatewayTransportListener listener) {
			this.listener = listener;
		}

		@Override
		public void onOpen(WebSocket webSocket) {
			webSocket.request(1);
		}

		@Override
		public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
			this.messageBuffer.append(data);
			if (last) {
				String fullMessage = this.messageBuffer.toString();
				this.messageBuffer.setLength(0);
				this.listener.onText(fullMessage);
			}
			webSocket.request(1);
			return null;
		}

		@Override
		public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
			if (webSocketRef.compareAndSet(webSocket, null)) {
				state.set(TransportState.CLOSED);
			}
			this.listener.onClose(statusCode, reason);
			return null;
		}

		@Override
		public void onError(WebSocket webSocket, Throwable error) {
			if (webSocketRef.compareAndSet(webSocket, null)) {
				state.set(TransportState.CLOSED);
			}
			logger.debug("WebSocket error", error);
			this.listener.onError(error);
		}

	}

}
