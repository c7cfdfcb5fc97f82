/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.handler;

import java.util.List;

import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.util.Utils;

/**
 * Optional descriptive metadata of a resource.
 *
 * @param mimeType MIME type of the contents, or {@code null}
 * @param audience intended audience, or {@code null}
 * @param priority importance between 0 and 1, or {@code null}
 */
public record ResourceMetadata(String mimeType, List<McpSchema.Role> audience, Double priority) {

	public static final ResourceMetadata EMPTY = new ResourceMetadata(null, null, null);

	public ResourceMetadata {
		audience = audience != null ? List.copyOf(audience) : null;
	}

	/**
	 * @return the annotations to publish with the resource, or {@code null} when neither
	 * audience nor priority is set
	 */
	public McpSchema.Annotations toAnnotations() {
		if (Utils.isEmpty(this.audience) && this.priority == null) {
			return null;
		}
		return new McpSchema.Annotations(this.audience, this.priority);
	}

}
