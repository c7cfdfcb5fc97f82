/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.discovery;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Source of the objects the host application manages, scanned for annotated handlers.
 * Typically backed by a dependency injection container.
 */
@FunctionalInterface
public interface ManagedInstances {

	/**
	 * @return the managed instances in a stable order; may contain {@code null}s
	 */
	Collection<?> instances();

	static ManagedInstances of(Object... instances) {
		List<Object> list = Arrays.asList(instances);
		return () -> list;
	}

}
