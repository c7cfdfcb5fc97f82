/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * A string argument of a {@link McpPrompt}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({})
public @interface McpPromptArg {

	String name() default "";

	String description() default "";

	boolean required() default false;

}
