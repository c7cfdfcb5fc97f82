/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.server;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.modelcontextprotocol.spec.McpError;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates call arguments against a handler argument schema using the NetworkNT JSON
 * Schema Validator. Schemas are compiled once at registration.
 */
public class ArgumentValidator {

	private static final Logger logger = LoggerFactory.getLogger(ArgumentValidator.class);

	private final ObjectMapper objectMapper;

	private final JsonSchemaFactory schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

	public ArgumentValidator(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Compiles the schema and all of its validators.
	 * @throws IllegalArgumentException if the schema cannot be compiled
	 */
	public JsonSchema compile(JsonNode schema) {
		try {
			JsonSchema compiled = this.schemaFactory.getSchema(schema);
			compiled.initializeValidators();
			return compiled;
		}
		catch (JsonSchemaException | IllegalArgumentException ex) {
			throw new IllegalArgumentException("Invalid argument schema: " + ex.getMessage(), ex);
		}
	}

	/**
	 * @return the validation errors, empty when the arguments are valid
	 */
	public Set<ValidationMessage> check(JsonSchema schema, Map<String, ?> arguments) {
		JsonNode instance = this.objectMapper.valueToTree(arguments != null ? arguments : Map.of());
		return schema.validate(instance);
	}

	/**
	 * Validates the arguments of a call.
	 * @param schema the compiled argument schema
	 * @param arguments the call arguments, {@code null} meaning none
	 * @param subject what is being called, for the error message
	 * @throws McpError with {@link McpSchema.ErrorCodes#INVALID_PARAMS} when invalid
	 */
	public void validate(JsonSchema schema, Map<String, ?> arguments, String subject) {
		Set<ValidationMessage> errors = check(schema, arguments);
		if (!errors.isEmpty()) {
			String details = errors.stream().map(ValidationMessage::getMessage).sorted().collect(Collectors.joining("; "));
			logger.debug("Invalid arguments for {}: {}", subject, details);
			throw new McpError(new McpSchema.JSONRPCResponse.JSONRPCError(McpSchema.ErrorCodes.INVALID_PARAMS,
					"Invalid arguments for " + subject + ": " + details, null));
		}
	}

}
