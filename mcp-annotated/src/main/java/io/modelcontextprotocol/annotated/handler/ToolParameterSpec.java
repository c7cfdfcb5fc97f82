/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.handler;

import java.util.Set;

/**
 * One named entry of a tool argument shape.
 *
 * @param name argument name
 * @param type JSON schema type of the argument
 * @param description optional description
 * @param required whether callers must supply the argument
 */
public record ToolParameterSpec(String name, String type, String description, boolean required) {

	public static final Set<String> JSON_TYPES = Set.of("string", "integer", "number", "boolean", "object",
			"array");

	public static ToolParameterSpec required(String name, String type) {
		return new ToolParameterSpec(name, type, null, true);
	}

	public static ToolParameterSpec optional(String name, String type) {
		return new ToolParameterSpec(name, type, null, false);
	}

}
