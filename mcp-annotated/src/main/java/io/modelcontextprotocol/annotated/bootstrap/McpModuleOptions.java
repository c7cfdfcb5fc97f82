/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.bootstrap;

import io.modelcontextprotocol.annotated.server.McpServerOptions;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Options of an {@link McpModule}.
 *
 * @param serverInfo name and version advertised to clients
 * @param serverOptions server options, defaulted when {@code null}
 * @param transport how clients reach the server
 */
public record McpModuleOptions(McpSchema.Implementation serverInfo, McpServerOptions serverOptions,
		TransportType transport) {

	public static final McpSchema.Implementation DEFAULT_SERVER_INFO = new McpSchema.Implementation(
			"mcp-annotated-server", "0.0.1");

	public McpModuleOptions {
		serverInfo = serverInfo != null ? serverInfo : DEFAULT_SERVER_INFO;
		serverOptions = serverOptions != null ? serverOptions : McpServerOptions.defaults();
		transport = transport != null ? transport : TransportType.STDIO;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private McpSchema.Implementation serverInfo;

		private McpServerOptions serverOptions;

		private TransportType transport;

		public Builder serverInfo(String name, String version) {
			this.serverInfo = new McpSchema.Implementation(name, version);
			return this;
		}

		public Builder serverInfo(McpSchema.Implementation serverInfo) {
			this.serverInfo = serverInfo;
			return this;
		}

		public Builder serverOptions(McpServerOptions serverOptions) {
			this.serverOptions = serverOptions;
			return this;
		}

		public Builder transport(TransportType transport) {
			this.transport = transport;
			return this;
		}

		public McpModuleOptions build() {
			return new McpModuleOptions(this.serverInfo, this.serverOptions, this.transport);
		}

	}

}
