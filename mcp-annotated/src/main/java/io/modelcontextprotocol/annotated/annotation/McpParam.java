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
 * Binds a handler method parameter to a named tool or prompt argument, or to a URI
 * template variable of a template resource. Values are converted to the parameter type
 * with Jackson.
 * <p>
 * On tool methods without an explicit schema the annotated parameters also make up the
 * synthesized input schema.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface McpParam {

	/**
	 * Argument or variable name.
	 */
	String value();

	String description() default "";

	boolean required() default true;

}
