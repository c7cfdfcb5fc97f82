/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.server;

import java.time.Duration;

import io.modelcontextprotocol.spec.McpSchema;

/**
 * Options of the MCP server built by {@link McpEngine}.
 *
 * @param capabilities advertised server capabilities, defaulted when {@code null}
 * @param instructions optional instructions returned on initialization
 * @param requestTimeout timeout of server initiated requests, or {@code null} for the
 * server default
 */
public record McpServerOptions(McpSchema.ServerCapabilities capabilities, String instructions,
		Duration requestTimeout) {

	/**
	 * Resources, tools and prompts with list change notifications, plus logging.
	 */
	public static final McpSchema.ServerCapabilities DEFAULT_CAPABILITIES = McpSchema.ServerCapabilities.builder()
		.resources(false, true)
		.tools(true)
		.prompts(true)
		.logging()
		.build();

	public McpServerOptions {
		capabilities = capabilities != null ? capabilities : DEFAULT_CAPABILITIES;
	}

	public static McpServerOptions defaults() {
		return new McpServerOptions(null, null, null);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private McpSchema.ServerCapabilities capabilities;

		private String instructions;

		private Duration requestTimeout;

		public Builder capabilities(McpSchema.ServerCapabilities capabilities) {
			this.capabilities = capabilities;
			return this;
		}

		public Builder instructions(String instructions) {
			this.instructions = instructions;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		public McpServerOptions build() {
			return new McpServerOptions(this.capabilities, this.instructions, this.requestTimeout);
		}

	}

}
