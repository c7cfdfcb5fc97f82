/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.handler;

/**
 * A string argument of a prompt.
 *
 * @param name argument name; an argument without one is dropped at registration
 * @param description optional description
 * @param required whether callers must supply the argument
 */
public record PromptArgumentSpec(String name, String description, boolean required) {

}
