/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * One entry of the argument shape declared by {@link McpTool#params()}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({})
public @interface McpToolParam {

	String name();

	/**
	 * JSON schema type: {@code string}, {@code integer}, {@code number},
	 * {@code boolean}, {@code object} or {@code array}.
	 */
	String type() default "string";

	String description() default "";

	boolean required() default true;

}
