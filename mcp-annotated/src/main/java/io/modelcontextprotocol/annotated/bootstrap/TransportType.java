/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.bootstrap;

/**
 * How clients reach the server.
 */
public enum TransportType {

	/**
	 * Process standard input and output, connected automatically at bootstrap.
	 */
	STDIO,

	/**
	 * HTTP Server-Sent Events; the host mounts {@link McpModule#httpTransport()}.
	 */
	SSE,

	/**
	 * No transport is connected; the host attaches its own.
	 */
	NONE

}
