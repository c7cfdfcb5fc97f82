/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.server;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.annotated.handler.PromptArgumentSpec;
import io.modelcontextprotocol.annotated.handler.ToolParameterSpec;
import io.modelcontextprotocol.util.Utils;

/**
 * Builds the JSON schemas handler arguments are published and validated with.
 */
public final class ArgumentSchemas {

	/**
	 * Schema of a tool that takes no arguments.
	 */
	public static final String EMPTY_OBJECT_SCHEMA = "{\"type\":\"object\",\"properties\":{}}";

	private ArgumentSchemas() {
	}

	/**
	 * @param parameters the declared tool parameters
	 * @return an object schema with one property per parameter
	 * @throws IllegalArgumentException if a parameter has no name, a duplicate name or a
	 * type that is not a JSON schema type
	 */
	public static ObjectNode forToolParameters(List<ToolParameterSpec> parameters, ObjectMapper objectMapper) {
		ObjectNode schema = objectSchema(objectMapper);
		ObjectNode properties = (ObjectNode) schema.get("properties");
		ArrayNode required = objectMapper.createArrayNode();
		Set<String> seen = new HashSet<>();
		for (ToolParameterSpec parameter : parameters) {
			if (!Utils.hasText(parameter.name())) {
				throw new IllegalArgumentException("Tool parameter without a name");
			}
			if (!seen.add(parameter.name())) {
				throw new IllegalArgumentException("Duplicate tool parameter '" + parameter.name() + "'");
			}
			if (!ToolParameterSpec.JSON_TYPES.contains(parameter.type())) {
				throw new IllegalArgumentException(
						"Unsupported type '" + parameter.type() + "' of tool parameter '" + parameter.name() + "'");
			}
			properties.set(parameter.name(), property(objectMapper, parameter.type(), parameter.description()));
			if (parameter.required()) {
				required.add(parameter.name());
			}
		}
		if (!required.isEmpty()) {
			schema.set("required", required);
		}
		return schema;
	}

	/**
	 * @param arguments prompt arguments, all of which must have a name
	 * @return an object schema with one string property per argument
	 */
	public static ObjectNode forPromptArguments(List<PromptArgumentSpec> arguments, ObjectMapper objectMapper) {
		ObjectNode schema = objectSchema(objectMapper);
		ObjectNode properties = (ObjectNode) schema.get("properties");
		ArrayNode required = objectMapper.createArrayNode();
		for (PromptArgumentSpec argument : arguments) {
			properties.set(argument.name(), property(objectMapper, "string", argument.description()));
			if (argument.required()) {
				required.add(argument.name());
			}
		}
		if (!required.isEmpty()) {
			schema.set("required", required);
		}
		return schema;
	}

	/**
	 * Parses a raw tool input schema.
	 * @throws IllegalArgumentException if the text is not a JSON object
	 */
	public static ObjectNode parse(String rawSchema, ObjectMapper objectMapper) {
		JsonNode node;
		try {
			node = objectMapper.readTree(rawSchema);
		}
		catch (JsonProcessingException ex) {
			throw new IllegalArgumentException("Invalid input schema: " + ex.getOriginalMessage(), ex);
		}
		if (!(node instanceof ObjectNode objectNode)) {
			throw new IllegalArgumentException("Input schema must be a JSON object");
		}
		return objectNode;
	}

	private static ObjectNode objectSchema(ObjectMapper objectMapper) {
		ObjectNode schema = objectMapper.createObjectNode();
		schema.put("type", "object");
		schema.set("properties", objectMapper.createObjectNode());
		return schema;
	}

	private static ObjectNode property(ObjectMapper objectMapper, String type, String description) {
		ObjectNode property = objectMapper.createObjectNode();
		property.put("type", type);
		if (Utils.hasText(description)) {
			property.put("description", description);
		}
		return property;
	}

}
