/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.bootstrap;

import reactor.core.publisher.Mono;

/**
 * Supplies module options asynchronously, for hosts that resolve their configuration
 * before the server is built.
 */
@FunctionalInterface
public interface McpOptionsFactory {

	Mono<McpModuleOptions> createMcpOptions();

}
