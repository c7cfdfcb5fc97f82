/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.handler;

/**
 * The capability kinds an annotated method can expose. Each kind is registered into its
 * own namespace of the MCP server.
 */
public enum HandlerKind {

	RESOURCE("resource"), TOOL("tool"), PROMPT("prompt");

	private final String label;

	HandlerKind(String label) {
		this.label = label;
	}

	public String label() {
		return this.label;
	}

}
