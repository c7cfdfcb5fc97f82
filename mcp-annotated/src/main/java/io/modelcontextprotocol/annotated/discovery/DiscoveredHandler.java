/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.discovery;

import io.modelcontextprotocol.annotated.handler.BoundHandler;
import io.modelcontextprotocol.annotated.handler.HandlerKind;
import io.modelcontextprotocol.annotated.handler.HandlerMetadata;

/**
 * An annotated method found on a managed instance, bound to that instance.
 *
 * @param instance the owning instance
 * @param metadata the definition read from the annotation
 * @param handler the bound callable
 */
public record DiscoveredHandler(Object instance, HandlerMetadata metadata, BoundHandler handler) {

	public HandlerKind kind() {
		return this.metadata.kind();
	}

}
