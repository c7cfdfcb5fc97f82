/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.handler;

import java.util.List;

/**
 * A handler callable bound to its owning instance.
 * <p>
 * Implementations are usually {@link MethodHandler}s created by discovery, but any lambda
 * can be registered programmatically.
 */
@FunctionalInterface
public interface BoundHandler {

	/**
	 * Calls the handler.
	 * @param invocation the call inputs
	 * @return the raw handler result, converted by the registrar
	 * @throws Exception anything the handler throws
	 */
	Object invoke(HandlerInvocation invocation) throws Exception;

	/**
	 * Checks that this handler can serve calls of the given kind.
	 * @param kind the kind it is registered as
	 * @throws IllegalStateException if it cannot
	 */
	default void verify(HandlerKind kind) {
	}

	/**
	 * @return argument shape derived from the handler signature, empty when unknown
	 */
	default List<ToolParameterSpec> declaredParameters() {
		return List.of();
	}

}
