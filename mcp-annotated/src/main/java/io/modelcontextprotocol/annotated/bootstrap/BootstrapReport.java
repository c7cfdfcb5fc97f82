/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.bootstrap;

import io.modelcontextprotocol.annotated.server.RegistrationReport;

/**
 * What a bootstrap did.
 *
 * @param resources outcomes of resource registration
 * @param tools outcomes of tool registration
 * @param prompts outcomes of prompt registration
 * @param transport the configured transport
 * @param connected whether a transport was connected automatically
 * @param connectError why the automatic connection failed, or {@code null}
 */
public record BootstrapReport(RegistrationReport resources, RegistrationReport tools, RegistrationReport prompts,
		TransportType transport, boolean connected, String connectError) {

	/**
	 * @return all registration outcomes, resources first, then tools, then prompts
	 */
	public RegistrationReport registrations() {
		return this.resources.merge(this.tools).merge(this.prompts);
	}

}
