/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.agentgateway.spec;

public class GatewayHandshakeException extends GatewayException {

	private static final long serialVersionUID = 1L;

	public GatewayHandshakeException(String message) {
		super(message);
	}

	public GatewayHandshakeException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public GatewayErrorKind kind() {
		return GatewayErrorKind.HANDSHAKE_FAILED;
	}

}
