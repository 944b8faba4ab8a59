/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import io.agentgateway.MockGatewayTransport;
import io.agentgateway.spec.ConnectionStatus;
import io.agentgateway.spec.GatewayConnectionClosedException;
import io.agentgateway.spec.SessionEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Reconnection after an unexpected close, driven on virtual time.
 */
class GatewayReconnectTests {

	private final List<String> logs = new CopyOnWriteArrayList<>();

	private MockGatewayTransport transport;

	private VirtualTimeScheduler scheduler;

	private GatewayAsyncClient client;

	@BeforeEach
	void setUp() {
		this.transport = new MockGatewayTransport();
		this.scheduler = VirtualTimeScheduler.create();
		GatewayClientOptions options = GatewayClientOptions.builder("ws://localhost:18789/ws")
			.reconnect(ReconnectOptions.of(3, Duration.ofMillis(100), Duration.ofMillis(1000)))
			.logger((level, message, meta) -> this.logs.add(message))
			.build();
		this.client = GatewayClient.async(this.transport).options(options).scheduler(this.scheduler).build();
		StepVerifier.create(this.client.connect()).verifyComplete();
	}

	@AfterEach
	void tearDown() {
		this.client.disconnect();
		this.scheduler.dispose();
	}

	@Test
	void reconnectsAfterUnexpectedClose() {
		List<SessionEvent> received = new ArrayList<>();
		this.client.subscribe("s-1", received::add);

		this.transport.simulateClose(1006, "abnormal closure");

		assertThat(this.client.getStatus()).isEqualTo(ConnectionStatus.DISCONNECTED);
		assertThat(this.logs).contains("Scheduling reconnection in 100ms");

		this.scheduler.advanceTimeBy(Duration.ofMillis(99));
		assertThat(this.transport.connectCount()).isEqualTo(1);

		this.scheduler.advanceTimeBy(Duration.ofMillis(1));
		assertThat(this.transport.connectCount()).isEqualTo(2);
		assertThat(this.client.getStatus()).isEqualTo(ConnectionStatus.CONNECTED);

		this.transport.simulateEvent("session.output", Map.of("sessionId", "s-1", "text", "after reconnect"));
		assertThat(received).hasSize(1);
	}

	@Test
	void outstandingCallsFailBeforeReconnecting() {
		StepVerifier.create(this.client.call("slow", Map.of()))
			.then(() -> this.transport.simulateClose(1001, "going away"))
			.expectError(GatewayConnectionClosedException.class)
			.verify(Duration.ofSeconds(5));

		this.scheduler.advanceTimeBy(Duration.ofMillis(100));
		assertThat(this.client.isConnected()).isTrue();
	}

	@Test
	void backsOffExponentiallyAndGivesUpAfterMaxAttempts() {
		this.transport.failAllConnects(true);

		this.transport.simulateClose(1006, "abnormal closure");

		this.scheduler.advanceTimeBy(Duration.ofMillis(100));
		assertThat(this.transport.connectCount()).isEqualTo(2);

		this.scheduler.advanceTimeBy(Duration.ofMillis(199));
		assertThat(this.transport.connectCount()).isEqualTo(2);
		this.scheduler.advanceTimeBy(Duration.ofMillis(1));
		assertThat(this.transport.connectCount()).isEqualTo(3);

		this.scheduler.advanceTimeBy(Duration.ofMillis(400));
		assertThat(this.transport.connectCount()).isEqualTo(4);

		assertThat(this.client.getStatus()).isEqualTo(ConnectionStatus.ERROR);
		assertThat(this.logs).containsSubsequence("Scheduling reconnection in 100ms", "Reconnection failed",
				"Scheduling reconnection in 200ms", "Reconnection failed", "Scheduling reconnection in 400ms",
				"Reconnection failed", "Max reconnection attempts reached");

		this.scheduler.advanceTimeBy(Duration.ofMinutes(10));
		assertThat(this.transport.connectCount()).isEqualTo(4);
		assertThat(this.client.getStatus()).isEqualTo(ConnectionStatus.ERROR);
	}

	@Test
	void explicitConnectRecoversAfterGivingUp() {
		this.transport.failAllConnects(true);
		this.transport.simulateClose(1006, "abnormal closure");
		this.scheduler.advanceTimeBy(Duration.ofSeconds(1));
		assertThat(this.client.getStatus()).isEqualTo(ConnectionStatus.ERROR);

		this.transport.failAllConnects(false);
		StepVerifier.create(this.client.connect()).verifyComplete();

		assertThat(this.client.getStatus()).isEqualTo(ConnectionStatus.CONNECTED);
	}

	@Test
	void successfulReconnectResetsTheAttemptCounter() {
		this.transport.failNextConnects(1);
		this.transport.simulateClose(1006, "abnormal closure");

		this.scheduler.advanceTimeBy(Duration.ofMillis(100));
		this.scheduler.advanceTimeBy(Duration.ofMillis(200));
		assertThat(this.transport.connectCount()).isEqualTo(3);
		assertThat(this.client.isConnected()).isTrue();

		this.logs.clear();
		this.transport.simulateClose(1006, "abnormal closure");

		assertThat(this.logs).contains("Scheduling reconnection in 100ms");
		this.scheduler.advanceTimeBy(Duration.ofMillis(100));
		assertThat(this.transport.connectCount()).isEqualTo(4);
		assertThat(this.client.isConnected()).isTrue();
	}

	@Test
	void handshakeFailureDuringReconnectCountsAsFailedAttempt() {
		this.transport.handshake(MockGatewayTransport.HandshakeMode.REJECT);
		this.transport.simulateClose(1006, "abnormal closure");

		this.scheduler.advanceTimeBy(Duration.ofMillis(100));

		assertThat(this.transport.connectCount()).isEqualTo(2);
		assertThat(this.logs).containsSubsequence("Reconnection failed", "Scheduling reconnection in 200ms");
	}

	@Test
	void disconnectCancelsPendingReconnection() {
		this.transport.simulateClose(1006, "abnormal closure");

		this.client.disconnect();
		this.scheduler.advanceTimeBy(Duration.ofSeconds(5));

		assertThat(this.transport.connectCount()).isEqualTo(1);
		assertThat(this.client.getStatus()).isEqualTo(ConnectionStatus.DISCONNECTED);
	}

	@Test
	void userDisconnectDoesNotTriggerReconnection() {
		this.client.disconnect();

		this.scheduler.advanceTimeBy(Duration.ofSeconds(5));

		assertThat(this.transport.connectCount()).isEqualTo(1);
		assertThat(this.logs).doesNotContain("Scheduling reconnection in 100ms");
	}

}
