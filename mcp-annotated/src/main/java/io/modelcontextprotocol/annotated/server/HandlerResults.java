/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.server;

import java.util.Base64;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Converts the raw return values of handler methods into protocol results.
 * <p>
 * Protocol result types pass through unchanged, strings become text and any other value
 * is serialized to JSON text.
 */
final class HandlerResults {

	private HandlerResults() {
	}

	static McpSchema.CallToolResult toCallToolResult(Object value, ObjectMapper objectMapper) {
		if (value instanceof McpSchema.CallToolResult result) {
			return result;
		}
		if (value == null) {
			return new McpSchema.CallToolResult(List.of(), false);
		}
		if (value instanceof McpSchema.Content content) {
			return new McpSchema.CallToolResult(List.of(content), false);
		}
		if (isListOf(value, McpSchema.Content.class)) {
			return new McpSchema.CallToolResult(castList(value), false);
		}
		return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(text(value, objectMapper))), false);
	}

	static McpSchema.CallToolResult toolError(Throwable error) {
		String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
		return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(message)), true);
	}

	static McpSchema.ReadResourceResult toReadResourceResult(Object value, String uri, String mimeType,
			ObjectMapper objectMapper) {
		if (value instanceof McpSchema.ReadResourceResult result) {
			return result;
		}
		if (value instanceof McpSchema.ResourceContents contents) {
			return new McpSchema.ReadResourceResult(List.of(contents));
		}
		if (isListOf(value, McpSchema.ResourceContents.class)) {
			return new McpSchema.ReadResourceResult(castList(value));
		}
		if (value instanceof byte[] bytes) {
			return new McpSchema.ReadResourceResult(List.of(new McpSchema.BlobResourceContents(uri,
					mimeType != null ? mimeType : "application/octet-stream", Base64.getEncoder().encodeToString(bytes))));
		}
		if (value == null || value instanceof CharSequence) {
			String text = value != null ? value.toString() : "";
			return new McpSchema.ReadResourceResult(List
				.of(new McpSchema.TextResourceContents(uri, mimeType != null ? mimeType : "text/plain", text)));
		}
		return new McpSchema.ReadResourceResult(List.of(new McpSchema.TextResourceContents(uri,
				mimeType != null ? mimeType : "application/json", text(value, objectMapper))));
	}

	static McpSchema.GetPromptResult toGetPromptResult(Object value, String description, ObjectMapper objectMapper) {
		if (value instanceof McpSchema.GetPromptResult result) {
			return result;
		}
		if (value instanceof McpSchema.PromptMessage message) {
			return new McpSchema.GetPromptResult(description, List.of(message));
		}
		if (isListOf(value, McpSchema.PromptMessage.class)) {
			return new McpSchema.GetPromptResult(description, castList(value));
		}
		String text = value == null ? "" : text(value, objectMapper);
		return new McpSchema.GetPromptResult(description,
				List.of(new McpSchema.PromptMessage(McpSchema.Role.USER, new McpSchema.TextContent(text))));
	}

	private static String text(Object value, ObjectMapper objectMapper) {
		if (value instanceof CharSequence) {
			return value.toString();
		}
		try {
			return objectMapper.writeValueAsString(value);
		}
		catch (JsonProcessingException ex) {
			throw new IllegalStateException("Cannot serialize handler result of type " + value.getClass().getName(),
					ex);
		}
	}

	private static boolean isListOf(Object value, Class<?> elementType) {
		return value instanceof List<?> list && !list.isEmpty() && list.stream().allMatch(elementType::isInstance);
	}

	@SuppressWarnings("unchecked")
	private static <T> List<T> castList(Object value) {
		return (List<T>) value;
	}

}
