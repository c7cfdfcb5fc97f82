/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as an MCP prompt handler.
 *
 * <pre>{@code
 * @McpPrompt(name = "greeting", description = "Personalized greeting",
 * 		arguments = { @McpPromptArg(name = "name", required = true),
 * 				@McpPromptArg(name = "formal") })
 * public String greeting(@McpParam("name") String name, @McpParam("formal") String formal) {
 * 	return ("true".equals(formal) ? "Greetings, " : "Hello, ") + name + "!";
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface McpPrompt {

	/**
	 * Unique name of the prompt. Required; a blank name is rejected at registration.
	 */
	String name() default "";

	String description() default "";

	McpPromptArg[] arguments() default {};

}
