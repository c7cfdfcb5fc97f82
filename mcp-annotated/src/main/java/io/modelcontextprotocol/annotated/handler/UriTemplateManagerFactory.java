/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.handler;

import io.modelcontextprotocol.util.McpUriTemplateManager;
import io.modelcontextprotocol.util.McpUriTemplateManagerFactory;

/**
 * Creates {@link UriTemplate} matchers for the server, so that resource reads are routed
 * by the same templates the registrar accepts.
 *
 * @author Christian Tzolov
 */
public class UriTemplateManagerFactory implements McpUriTemplateManagerFactory {

	/**
	 * @param uriTemplate the resource URI or URI template
	 * @throws IllegalArgumentException if the template is blank or malformed
	 */
	@Override
	public McpUriTemplateManager create(String uriTemplate) {
		return new UriTemplate(uriTemplate);
	}

}
