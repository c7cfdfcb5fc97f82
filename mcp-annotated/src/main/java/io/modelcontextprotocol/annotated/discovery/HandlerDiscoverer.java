/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.discovery;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.annotated.handler.HandlerKind;
import io.modelcontextprotocol.annotated.handler.HandlerMetadata;
import io.modelcontextprotocol.annotated.handler.HandlerMetadataReader;
import io.modelcontextprotocol.annotated.handler.MethodHandler;
import io.modelcontextprotocol.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans the managed instances for methods annotated as handlers of a given kind.
 * <p>
 * Every call is a fresh snapshot of the instance source. Instances are visited in source
 * order and their methods sorted by name and signature, so repeated scans over the same
 * instances yield the same handlers in the same order. A method or instance that cannot
 * be inspected is logged and skipped.
 */
public class HandlerDiscoverer {

	private static final Logger logger = LoggerFactory.getLogger(HandlerDiscoverer.class);

	private static final Comparator<Method> METHOD_ORDER = Comparator.comparing(Method::getName)
		.thenComparing(HandlerDiscoverer::signature);

	private final ManagedInstances instances;

	private final HandlerMetadataReader metadataReader;

	private final ObjectMapper objectMapper;

	public HandlerDiscoverer(ManagedInstances instances) {
		this(instances, new HandlerMetadataReader(), new ObjectMapper());
	}

	public HandlerDiscoverer(ManagedInstances instances, HandlerMetadataReader metadataReader,
			ObjectMapper objectMapper) {
		Assert.notNull(instances, "Managed instances must not be null");
		Assert.notNull(metadataReader, "Metadata reader must not be null");
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		this.instances = instances;
		this.metadataReader = metadataReader;
		this.objectMapper = objectMapper;
	}

	public List<DiscoveredHandler> discoverResources() {
		return discover(HandlerKind.RESOURCE);
	}

	public List<DiscoveredHandler> discoverTools() {
		return discover(HandlerKind.TOOL);
	}

	public List<DiscoveredHandler> discoverPrompts() {
		return discover(HandlerKind.PROMPT);
	}

	/**
	 * Finds every method annotated as a handler of the given kind.
	 * @param kind the handler kind
	 * @return the discovered handlers, in deterministic order
	 */
	public List<DiscoveredHandler> discover(HandlerKind kind) {
		Assert.notNull(kind, "Handler kind must not be null");
		Collection<?> snapshot;
		try {
			snapshot = this.instances.instances();
		}
		catch (RuntimeException ex) {
			logger.error("Failed to enumerate managed instances for {} discovery", kind.label(), ex);
			return List.of();
		}
		if (snapshot == null) {
			return List.of();
		}

		List<DiscoveredHandler> handlers = new ArrayList<>();
		for (Object instance : snapshot) {
			if (instance == null) {
				continue;
			}
			List<Method> methods;
			try {
				methods = candidateMethods(instance.getClass());
			}
			catch (RuntimeException | LinkageError ex) {
				logger.warn("Skipping instance of {}: its methods cannot be enumerated", instance.getClass().getName(),
						ex);
				continue;
			}
			for (Method method : methods) {
				Optional<HandlerMetadata> metadata;
				try {
					metadata = this.metadataReader.lookup(kind, method);
				}
				catch (RuntimeException ex) {
					logger.warn("Skipping method {}.{}: {} lookup failed", instance.getClass().getName(),
							method.getName(), kind.label(), ex);
					continue;
				}
				metadata.ifPresent(m -> handlers
					.add(new DiscoveredHandler(instance, m, new MethodHandler(instance, method, kind, this.objectMapper))));
			}
		}
		logger.debug("Discovered {} {} handler(s)", handlers.size(), kind.label());
		return handlers;
	}

	/**
	 * Collects the public methods of the type and the non-public ones declared along its
	 * superclass chain, keeping only the most derived declaration of an overridden method.
	 */
	static List<Method> candidateMethods(Class<?> type) {
		Map<String, Method> bySignature = new LinkedHashMap<>();
		for (Method method : type.getMethods()) {
			if (isCandidate(method)) {
				bySignature.putIfAbsent(signature(method), method);
			}
		}
		for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
			for (Method method : current.getDeclaredMethods()) {
				if (isCandidate(method) && !Modifier.isPublic(method.getModifiers())) {
					bySignature.putIfAbsent(signature(method), method);
				}
			}
		}
		return bySignature.values().stream().sorted(METHOD_ORDER).collect(Collectors.toList());
	}

	private static boolean isCandidate(Method method) {
		return !Modifier.isStatic(method.getModifiers()) && !method.isBridge() && !method.isSynthetic()
				&& method.getDeclaringClass() != Object.class;
	}

	private static String signature(Method method) {
		return method.getName() + Arrays.stream(method.getParameterTypes())
			.map(Class::getName)
			.collect(Collectors.joining(",", "(", ")"));
	}

}
