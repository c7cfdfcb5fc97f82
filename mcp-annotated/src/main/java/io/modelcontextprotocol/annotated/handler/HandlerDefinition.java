/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.handler;

/**
 * Declarative definition of an MCP handler, captured from an annotation or supplied
 * programmatically. Definitions are not validated on construction: a definition without
 * a name is a legal value that the registrar rejects.
 */
public sealed interface HandlerDefinition permits ResourceDefinition, ToolDefinition, PromptDefinition {

	HandlerKind kind();

	/**
	 * @return the name, unique within the kind; may be {@code null} or blank
	 */
	String name();

	/**
	 * @return the description, or {@code null} when absent
	 */
	String description();

}
