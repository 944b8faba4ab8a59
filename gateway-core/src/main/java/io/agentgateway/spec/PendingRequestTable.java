/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.spec;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.agentgateway.util.Assert;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.util.annotation.Nullable;

/**
 * Tracks the requests that are waiting for a response.
 *
 * <p>
 * Each entry is settled exactly once, by whichever happens first: the matching
 * response, the expiry of its timer, or the loss of the connection. Removal from the
 * table decides the winner, only the thread that removed an entry may complete it.
 *
 * <p>
 * The handshake {@code connect} request and application calls share the table. They
 * differ only in the error reported on timeout or connection loss, see {@link Kind}.
 */
public final class PendingRequestTable {

	private static final Logger logger = LoggerFactory.getLogger(PendingRequestTable.class);

	/**
	 * The role of a pending request.
	 */
	public enum Kind {

		/** The authentication request sent in answer to the connection challenge. */
		HANDSHAKE,

		/** A request issued by the application once connected. */
		APPLICATION

	}

	/**
	 * The id assigned to a newly registered request and the {@link Mono} that settles
	 * with its outcome. The Mono completes empty when the gateway answered without a
	 * payload.
	 */
	public record Registration(String id, Mono<Object> response) {
	}

	private final ConcurrentHashMap<String, PendingRequest> pending = new ConcurrentHashMap<>();

	private final RequestIdGenerator idGenerator;

	private final Scheduler timer;

	public PendingRequestTable(RequestIdGenerator idGenerator, Scheduler timer) {
		Assert.notNull(idGenerator, "idGenerator must not be null");
		Assert.notNull(timer, "timer must not be null");
		this.idGenerator = idGenerator;
		this.timer = timer;
	}

	/**
	 * Allocates a fresh correlation id and starts the timeout of the new entry.
	 * @param method the method being called, used in timeout messages
	 * @param kind the role of the request
	 * @param timeout how long to wait for the response
	 * @return the registration
	 */
	public Registration register(String method, Kind kind, Duration timeout) {
		Assert.hasText(method, "method must not be empty");
		Assert.notNull(kind, "kind must not be null");
		Assert.notNull(timeout, "timeout must not be null");
		Assert.isTrue(!timeout.isNegative(), "timeout must not be negative");

		String id = this.idGenerator.generate();
		Assert.notNull(id, "Request id generator returned null");

		PendingRequest request = new PendingRequest(id, method, kind, timeout);
		if (this.pending.putIfAbsent(id, request) != null) {
			throw new IllegalStateException("Request id '" + id + "' is already outstanding");
		}
		request.timeoutHandle = this.timer.schedule(() -> expire(id), timeout.toMillis(), TimeUnit.MILLISECONDS);
		return new Registration(id, request.sink.asMono());
	}

	/**
	 * Settles the entry matching the response id.
	 * @param response the received response
	 * @return {@code false} when no entry with that id is pending
	 */
	public boolean complete(GatewayFrame.Response response) {
		PendingRequest request = this.pending.remove(response.id());
		if (request == null) {
			logger.debug("Discarding response for unknown or settled request {}", response.id());
			return false;
		}
		request.cancelTimer();
		if (response.ok()) {
			if (response.payload() == null) {
				request.sink.tryEmitEmpty();
			}
			else {
				request.sink.tryEmitValue(response.payload());
			}
		}
		else {
			request.sink.tryEmitError(new GatewayRemoteException(response.error()));
		}
		return true;
	}

	/**
	 * Fails a single entry, for example after its frame could not be written.
	 * @param id the request id
	 * @param error the error to report
	 * @return {@code false} when no entry with that id is pending
	 */
	public boolean fail(String id, Throwable error) {
		PendingRequest request = this.pending.remove(id);
		if (request == null) {
			return false;
		}
		request.cancelTimer();
		request.sink.tryEmitError(error);
		return true;
	}

	/**
	 * Fails every outstanding entry and empties the table.
	 * @param reason description of why the connection ended
	 * @return the number of entries that were failed
	 */
	public int failAll(String reason) {
		int failed = 0;
		for (String id : this.pending.keySet()) {
			PendingRequest request = this.pending.remove(id);
			if (request == null) {
				continue;
			}
			request.cancelTimer();
			Throwable error = (request.kind == Kind.HANDSHAKE)
					? new GatewayHandshakeException("Handshake aborted: " + reason)
					: new GatewayConnectionClosedException(reason);
			request.sink.tryEmitError(error);
			failed++;
		}
		return failed;
	}

	public boolean contains(String id) {
		return this.pending.containsKey(id);
	}

	public int size() {
		return this.pending.size();
	}

	@Nullable
	public Kind kindOf(String id) {
		PendingRequest request = this.pending.get(id);
		return (request != null) ? request.kind : null;
	}

	private void expire(String id) {
		PendingRequest request = this.pending.remove(id);
		if (request == null) {
			return;
		}
		logger.debug("Request {} ({}) expired after {}", id, request.method, request.timeout);
		Throwable error = (request.kind == Kind.HANDSHAKE)
				? new GatewayHandshakeException(
						"Handshake '" + request.method + "' timed out after " + request.timeout.toMillis() + "ms")
				: new GatewayTimeoutException(request.method, request.timeout);
		request.sink.tryEmitError(error);
	}

	private static final class PendingRequest {

		private final String id;

		private final String method;

		private final Kind kind;

		private final Duration timeout;

		private final Sinks.One<Object> sink = Sinks.one();

		private volatile Disposable timeoutHandle;

		private PendingRequest(String id, String method, Kind kind, Duration timeout) {
			this.id = id;
			this.method = method;
			this.kind = kind;
			this.timeout = timeout;
		}

		private void cancelTimer() {
			Disposable handle = this.timeoutHandle;
			if (handle != null) {
				handle.dispose();
			}
		}

		@Override
		public String toString() {
			return "PendingRequest[" + this.id + ", " + this.method + ", " + this.kind + "]";
		}

	}

}
