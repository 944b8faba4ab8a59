/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.client.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import io.agentgateway.spec.GatewayTransportListener;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class WebSocketClientTransportTests {

	private static final String WEBSOCKET_GUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";

	private static final GatewayTransportListener IGNORING_LISTENER = new GatewayTransportListener() {
		@Override
		public void onText(String text) {
		}

		@Override
		public void onClose(int statusCode, String reason) {
		}

		@Override
		public void onError(Throwable error) {
		}
	};

	@Test
	void rejectsNonWebSocketSchemes() {
		assertThatThrownBy(() -> WebSocketClientTransport.builder(URI.create("http://localhost:18789/ws")).build())
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("ws or wss");
	}

	@Test
	void requiresUri() {
		assertThatThrownBy(() -> WebSocketClientTransport.builder(null).build())
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void startsDisconnected() {
		WebSocketClientTransport transport = WebSocketClientTransport.builder(URI.create("wss://gateway.example.com/ws"))
			.build();

		assertThat(transport.getState()).isEqualTo(WebSocketClientTransport.TransportState.DISCONNECTED);
	}

	@Test
	void sendBeforeConnectFails() {
		WebSocketClientTransport transport = WebSocketClientTransport.builder(URI.create("ws://localhost:18789/ws"))
			.build();

		StepVerifier.create(transport.sendText("{}"))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(IllegalStateException.class)
				.hasMessage("WebSocket is closed."))
			.verify(Duration.ofSeconds(5));
	}

	@Test
	void closeWithoutSocketCompletes() {
		WebSocketClientTransport transport = WebSocketClientTransport.builder(URI.create("ws://localhost:18789/ws"))
			.build();

		StepVerifier.create(transport.close(1000, "Client disconnect")).verifyComplete();
		assertThat(transport.getState()).isEqualTo(WebSocketClientTransport.TransportState.CLOSED);
	}

	@Test
	void connectToUnreachableGatewayFails() {
		List<String> signals = new CopyOnWriteArrayList<>();
		WebSocketClientTransport transport = WebSocketClientTransport.builder(URI.create("ws://127.0.0.1:1/ws"))
			.connectTimeout(Duration.ofSeconds(2))
			.build();

		StepVerifier.create(transport.connect(new GatewayTransportListener() {
			@Override
			public void onText(String text) {
				signals.add("text");
			}

			@Override
			public void onClose(int statusCode, String reason) {
				signals.add("close");
			}

			@Override
			public void onError(Throwable error) {
				signals.add("error");
			}
		})).expectError().verify(Duration.ofSeconds(10));

		assertThat(transport.getState()).isEqualTo(WebSocketClientTransport.TransportState.CLOSED);
		assertThat(signals).doesNotContain("text");
	}

	@Test
	void socketOpenedAfterCloseIsAborted() throws Exception {
		CountDownLatch transportClosed = new CountDownLatch(1);
		AtomicBoolean peerSawClose = new AtomicBoolean();
		AtomicReference<Throwable> gatewayFailure = new AtomicReference<>();

		try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
			Thread gateway = new Thread(() -> {
				try (Socket socket = server.accept()) {
					socket.setSoTimeout(10_000);
					BufferedReader reader = new BufferedReader(
							new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII));
					String key = null;
					String line;
					while ((line = reader.readLine()) != null && !line.isEmpty()) {
						if (line.toLowerCase(Locale.ROOT).startsWith("sec-websocket-key:")) {
							key = line.substring(line.indexOf(':') + 1).trim();
						}
					}
					// hold the upgrade back until the client gave up on the socket
					transportClosed.await(10, TimeUnit.SECONDS);
					OutputStream out = socket.getOutputStream();
					out.write(("HTTP/1.1 101 Switching Protocols\r\nUpgrade: websocket\r\nConnection: Upgrade\r\n"
							+ "Sec-WebSocket-Accept: " + acceptKey(key) + "\r\n\r\n")
						.getBytes(StandardCharsets.US_ASCII));
					out.flush();
					try {
						while (reader.read() != -1) {
							// drain until the client drops the connection
						}
					}
					catch (IOException e) {
						// reset by the client
					}
					peerSawClose.set(true);
				}
				catch (Exception e) {
					gatewayFailure.set(e);
				}
			}, "delayed-upgrade-gateway");
			gateway.setDaemon(true);
			gateway.start();

			WebSocketClientTransport transport = WebSocketClientTransport
				.builder(URI.create("ws://127.0.0.1:" + server.getLocalPort() + "/ws"))
				.build();

			StepVerifier.create(transport.connect(IGNORING_LISTENER)).then(() -> {
				assertThat(transport.getState()).isEqualTo(WebSocketClientTransport.TransportState.CONNECTING);
				transport.close(1000, "Client disconnect").block(Duration.ofSeconds(5));
				transportClosed.countDown();
			})
				.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(IllegalStateException.class)
					.hasMessage("WebSocket was closed while connecting."))
				.verify(Duration.ofSeconds(15));

			assertThat(transport.getState()).isEqualTo(WebSocketClientTransport.TransportState.CLOSED);
			await().atMost(Duration.ofSeconds(10)).untilTrue(peerSawClose);
			assertThat(gatewayFailure.get()).isNull();

			StepVerifier.create(transport.sendText("{}")).expectError(IllegalStateException.class)
				.verify(Duration.ofSeconds(5));
		}
	}

	private static String acceptKey(String key) throws Exception {
		byte[] digest = MessageDigest.getInstance("SHA-1")
			.digest((key + WEBSOCKET_GUID).getBytes(StandardCharsets.US_ASCII));
		return Base64.getEncoder().encodeToString(digest);
	}

}
