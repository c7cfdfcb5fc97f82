/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.handler;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import io.modelcontextprotocol.annotated.annotation.McpPrompt;
import io.modelcontextprotocol.annotated.annotation.McpResource;
import io.modelcontextprotocol.annotated.annotation.McpTool;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.util.Assert;
import io.modelcontextprotocol.util.Utils;

/**
 * Reads the handler definition an annotation attaches to a method.
 * <p>
 * Every kind has its own annotation, so a method annotated as a tool never satisfies a
 * resource or prompt lookup. Lookups are cached per kind and method; the cache only ever
 * grows with the methods of the managed classes.
 */
public class HandlerMetadataReader {

	private final Map<LookupKey, Optional<HandlerMetadata>> cache = new ConcurrentHashMap<>();

	/**
	 * Looks up the definition of the given kind attached to the method.
	 * @param kind the handler kind
	 * @param method the method to inspect
	 * @return the metadata, or empty when the method carries no annotation of that kind
	 */
	public Optional<HandlerMetadata> lookup(HandlerKind kind, Method method) {
		Assert.notNull(kind, "Handler kind must not be null");
		Assert.notNull(method, "Method must not be null");
		return this.cache.computeIfAbsent(new LookupKey(kind, method), key -> read(key.kind(), key.method()));
	}

	protected Optional<HandlerMetadata> read(HandlerKind kind, Method method) {
		HandlerDefinition definition = switch (kind) {
			case RESOURCE -> {
				McpResource resource = method.getAnnotation(McpResource.class);
				yield resource != null ? toDefinition(resource) : null;
			}
			case TOOL -> {
				McpTool tool = method.getAnnotation(McpTool.class);
				yield tool != null ? toDefinition(tool) : null;
			}
			case PROMPT -> {
				McpPrompt prompt = method.getAnnotation(McpPrompt.class);
				yield prompt != null ? toDefinition(prompt) : null;
			}
		};
		return Optional.ofNullable(definition).map(d -> new HandlerMetadata(method.getName(), d));
	}

	private static ResourceDefinition toDefinition(McpResource resource) {
		List<McpSchema.Role> audience = resource.audience().length > 0
				? List.of(resource.audience()) : null;
		Double priority = resource.priority() >= 0 ? resource.priority() : null;
		return new ResourceDefinition(resource.name(), textOrNull(resource.description()),
				textOrNull(resource.uri()), textOrNull(resource.uriTemplate()),
				new ResourceMetadata(textOrNull(resource.mimeType()), audience, priority));
	}

	private static ToolDefinition toDefinition(McpTool tool) {
		List<ToolParameterSpec> parameters = Arrays.stream(tool.params())
			.map(p -> new ToolParameterSpec(p.name(), p.type(), textOrNull(p.description()), p.required()))
			.collect(Collectors.toList());
		return new ToolDefinition(tool.name(), textOrNull(tool.description()), parameters,
				textOrNull(tool.inputSchema()));
	}

	private static PromptDefinition toDefinition(McpPrompt prompt) {
		List<PromptArgumentSpec> arguments = Arrays.stream(prompt.arguments())
			.map(a -> new PromptArgumentSpec(a.name(), textOrNull(a.description()), a.required()))
			.collect(Collectors.toList());
		return new PromptDefinition(prompt.name(), textOrNull(prompt.description()), arguments);
	}

	private static String textOrNull(String value) {
		return Utils.hasText(value) ? value : null;
	}

	private record LookupKey(HandlerKind kind, Method method) {
	}

}
