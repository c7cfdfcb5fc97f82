/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.handler;

import java.util.ArrayList;
import java.util.List;

/**
 * Definition of a prompt.
 *
 * @param name unique prompt name
 * @param description optional description
 * @param arguments ordered arguments, never {@code null}
 */
public record PromptDefinition(String name, String description,
		List<PromptArgumentSpec> arguments) implements HandlerDefinition {

	public PromptDefinition {
		arguments = arguments != null ? List.copyOf(arguments) : List.of();
	}

	@Override
	public HandlerKind kind() {
		return HandlerKind.PROMPT;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private String name;

		private String description;

		private final List<PromptArgumentSpec> arguments = new ArrayList<>();

		public Builder name(String name) {
			this.name = name;
			return this;
		}

		public Builder description(String description) {
			this.description = description;
			return this;
		}

		public Builder argument(String name, String description, boolean required) {
			this.arguments.add(new PromptArgumentSpec(name, description, required));
			return this;
		}

		public PromptDefinition build() {
			return new PromptDefinition(this.name, this.description, this.arguments);
		}

	}

}
