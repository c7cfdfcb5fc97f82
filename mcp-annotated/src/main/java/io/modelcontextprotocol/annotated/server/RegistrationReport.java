/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.server;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import io.modelcontextprotocol.annotated.handler.HandlerKind;

/**
 * The outcomes of a batch of registrations, in registration order.
 */
public record RegistrationReport(List<RegistrationOutcome> outcomes) {

	public RegistrationReport {
		outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
	}

	public static RegistrationReport empty() {
		return new RegistrationReport(List.of());
	}

	public RegistrationReport merge(RegistrationReport other) {
		List<RegistrationOutcome> merged = new ArrayList<>(this.outcomes);
		merged.addAll(other.outcomes());
		return new RegistrationReport(merged);
	}

	public List<RegistrationOutcome> withStatus(RegistrationOutcome.Status status) {
		return this.outcomes.stream().filter(o -> o.status() == status).collect(Collectors.toList());
	}

	public List<String> registeredNames(HandlerKind kind) {
		return this.outcomes.stream()
			.filter(o -> o.kind() == kind && o.isRegistered())
			.map(RegistrationOutcome::name)
			.collect(Collectors.toList());
	}

	public boolean hasFailures() {
		return this.outcomes.stream().anyMatch(o -> o.status() == RegistrationOutcome.Status.FAILED);
	}

	@Override
	public String toString() {
		return "RegistrationReport[registered=" + withStatus(RegistrationOutcome.Status.REGISTERED).size()
				+ ", skipped=" + withStatus(RegistrationOutcome.Status.SKIPPED).size() + ", failed="
				+ withStatus(RegistrationOutcome.Status.FAILED).size() + "]";
	}

}
