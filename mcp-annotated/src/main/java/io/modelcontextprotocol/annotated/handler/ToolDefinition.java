/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.handler;

import java.util.ArrayList;
import java.util.List;

/**
 * Definition of a tool.
 *
 * @param name unique tool name
 * @param description optional description
 * @param parameters declared argument shape, never {@code null}
 * @param inputSchema raw JSON schema overriding the shape, or {@code null}
 */
public record ToolDefinition(String name, String description, List<ToolParameterSpec> parameters,
		String inputSchema) implements HandlerDefinition {

	public ToolDefinition {
		parameters = parameters != null ? List.copyOf(parameters) : List.of();
	}

	@Override
	public HandlerKind kind() {
		return HandlerKind.TOOL;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private String name;

		private String description;

		private final List<ToolParameterSpec> parameters = new ArrayList<>();

		private String inputSchema;

		public Builder name(String name) {
			this.name = name;
			return this;
		}

		public Builder description(String description) {
			this.description = description;
			return this;
		}

		public Builder parameter(ToolParameterSpec parameter) {
			this.parameters.add(parameter);
			return this;
		}

		public Builder parameters(List<ToolParameterSpec> parameters) {
			this.parameters.addAll(parameters);
			return this;
		}

		public Builder inputSchema(String inputSchema) {
			this.inputSchema = inputSchema;
			return this;
		}

		public ToolDefinition build() {
			return new ToolDefinition(this.name, this.description, this.parameters, this.inputSchema);
		}

	}

}
