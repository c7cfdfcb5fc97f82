/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.handler;

import java.util.Map;

import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * The inputs of a single handler call, as received from the MCP server.
 *
 * @param kind kind of the handler being called
 * @param exchange the server exchange of the calling session, may be {@code null}
 * @param arguments tool or prompt arguments, never {@code null}
 * @param uri requested resource URI, or {@code null}
 * @param uriVariables variables extracted from a template resource URI, never
 * {@code null}
 * @param request the raw protocol request, or {@code null} for tool calls
 */
public record HandlerInvocation(HandlerKind kind, McpSyncServerExchange exchange, Map<String, Object> arguments,
		String uri, Map<String, String> uriVariables, Object request) {

	public HandlerInvocation {
		arguments = arguments != null ? arguments : Map.of();
		uriVariables = uriVariables != null ? uriVariables : Map.of();
	}

	public static HandlerInvocation tool(McpSyncServerExchange exchange, Map<String, Object> arguments) {
		return new HandlerInvocation(HandlerKind.TOOL, exchange, arguments, null, null, null);
	}

	public static HandlerInvocation prompt(McpSyncServerExchange exchange, McpSchema.GetPromptRequest request) {
		return new HandlerInvocation(HandlerKind.PROMPT, exchange, request.arguments(), null, null, request);
	}

	public static HandlerInvocation resource(McpSyncServerExchange exchange, McpSchema.ReadResourceRequest request,
			Map<String, String> uriVariables) {
		return new HandlerInvocation(HandlerKind.RESOURCE, exchange, null, request.uri(), uriVariables, request);
	}

}
