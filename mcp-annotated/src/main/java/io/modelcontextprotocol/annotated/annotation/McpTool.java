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
 * Marks a method as an MCP tool handler.
 * <p>
 * The input schema of the tool is taken from, in order of precedence, the raw
 * {@link #inputSchema()}, the declared {@link #params()}, or the method parameters
 * annotated with {@link McpParam}. A tool without any of them accepts an empty object.
 *
 * <pre>{@code
 * @McpTool(name = "add", description = "Adds two numbers")
 * public int add(@McpParam("a") int a, @McpParam("b") int b) {
 * 	return a + b;
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface McpTool {

	/**
	 * Unique name of the tool. Required; a blank name is rejected at registration.
	 */
	String name() default "";

	String description() default "";

	/**
	 * Declared argument shape of the tool.
	 */
	McpToolParam[] params() default {};

	/**
	 * Raw JSON schema of the tool input, used as is when not blank.
	 */
	String inputSchema() default "";

}
