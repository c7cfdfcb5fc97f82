/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import io.modelcontextprotocol.spec.McpSchema;

/**
 * Marks a method as an MCP resource handler.
 * <p>
 * A resource is either fixed, addressed by an exact {@link #uri()}, or templated,
 * addressed by a {@link #uriTemplate()} such as {@code users://{id}/profile}. The two
 * attributes are mutually exclusive; setting {@code uriTemplate} makes the resource a
 * template resource.
 *
 * <pre>{@code
 * @McpResource(name = "user-profile", uriTemplate = "users://{id}/profile",
 * 		description = "Profile of a single user", mimeType = "application/json")
 * public UserProfile profile(@McpParam("id") String id) {
 * 	return users.find(id);
 * }
 * }</pre>
 *
 * @see io.modelcontextprotocol.annotated.handler.HandlerMetadataReader
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface McpResource {

	/**
	 * Unique name of the resource. Required; a blank name is rejected at registration.
	 */
	String name() default "";

	String description() default "";

	/**
	 * Exact URI of a fixed resource.
	 */
	String uri() default "";

	/**
	 * RFC 6570 style template of a template resource.
	 */
	String uriTemplate() default "";

	String mimeType() default "";

	/**
	 * Intended audience of the resource contents. Empty means unspecified.
	 */
	McpSchema.Role[] audience() default {};

	/**
	 * Importance between 0 and 1. Negative means unspecified.
	 */
	double priority() default -1;

}
