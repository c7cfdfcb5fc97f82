/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.handler;

/**
 * Definition of a fixed or template resource.
 * <p>
 * The presence of {@code uriTemplate} is the sole discriminant between the two variants.
 * It is expected to hold either a {@link String} or a precompiled {@link UriTemplate};
 * any other type is reported by the registrar.
 *
 * @param name unique resource name
 * @param description optional description
 * @param uri exact URI of a fixed resource
 * @param uriTemplate template of a template resource, a {@link String} or a
 * {@link UriTemplate}
 * @param metadata descriptive metadata, never {@code null}
 */
public record ResourceDefinition(String name, String description, String uri, Object uriTemplate,
		ResourceMetadata metadata) implements HandlerDefinition {

	public ResourceDefinition {
		metadata = metadata != null ? metadata : ResourceMetadata.EMPTY;
	}

	@Override
	public HandlerKind kind() {
		return HandlerKind.RESOURCE;
	}

	public boolean isTemplate() {
		return this.uriTemplate != null;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private String name;

		private String description;

		private String uri;

		private Object uriTemplate;

		private ResourceMetadata metadata;

		public Builder name(String name) {
			this.name = name;
			return this;
		}

		public Builder description(String description) {
			this.description = description;
			return this;
		}

		public Builder uri(String uri) {
			this.uri = uri;
			return this;
		}

		public Builder uriTemplate(String uriTemplate) {
			this.uriTemplate = uriTemplate;
			return this;
		}

		public Builder uriTemplate(UriTemplate uriTemplate) {
			this.uriTemplate = uriTemplate;
			return this;
		}

		public Builder metadata(ResourceMetadata metadata) {
			this.metadata = metadata;
			return this;
		}

		public ResourceDefinition build() {
			return new ResourceDefinition(this.name, this.description, this.uri, this.uriTemplate, this.metadata);
		}

	}

}
