/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.server;

import io.modelcontextprotocol.annotated.handler.HandlerKind;

/**
 * Result of registering one handler definition.
 *
 * @param kind the handler kind
 * @param name the definition name as given, may be blank
 * @param status what happened
 * @param message reason of a skip or failure, {@code null} when registered
 */
public record RegistrationOutcome(HandlerKind kind, String name, Status status, String message) {

	public enum Status {

		/**
		 * The handler is registered with the server.
		 */
		REGISTERED,

		/**
		 * The definition was ignored because it has no name.
		 */
		SKIPPED,

		/**
		 * The definition is invalid or the server rejected it.
		 */
		FAILED

	}

	public static RegistrationOutcome registered(HandlerKind kind, String name) {
		return new RegistrationOutcome(kind, name, Status.REGISTERED, null);
	}

	public static RegistrationOutcome skipped(HandlerKind kind, String name, String message) {
		return new RegistrationOutcome(kind, name, Status.SKIPPED, message);
	}

	public static RegistrationOutcome failed(HandlerKind kind, String name, String message) {
		return new RegistrationOutcome(kind, name, Status.FAILED, message);
	}

	public boolean isRegistered() {
		return this.status == Status.REGISTERED;
	}

}
