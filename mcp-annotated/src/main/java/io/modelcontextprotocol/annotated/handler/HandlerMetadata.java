/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.handler;

/**
 * What an annotation lookup yields for a method.
 *
 * @param methodName name of the annotated method
 * @param definition the captured definition
 */
public record HandlerMetadata(String methodName, HandlerDefinition definition) {

	public HandlerKind kind() {
		return this.definition.kind();
	}

}
