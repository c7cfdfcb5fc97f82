/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.bootstrap;

import java.util.function.Supplier;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.annotated.discovery.HandlerDiscoverer;
import io.modelcontextprotocol.annotated.handler.HandlerKind;
import io.modelcontextprotocol.annotated.server.McpEngine;
import io.modelcontextprotocol.annotated.server.McpHandlerRegistrar;
import io.modelcontextprotocol.annotated.server.RegistrationReport;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import io.modelcontextprotocol.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers every discovered handler with the engine, then connects the process stream
 * transport when the module runs over stdio.
 * <p>
 * Runs at most once; later calls return the report of the first run. Nothing it does is
 * fatal to the host: registration problems are reported per definition and a failed
 * stdio connection is logged and recorded.
 */
public class McpBootstrap {

	private static final Logger logger = LoggerFactory.getLogger(McpBootstrap.class);

	private final HandlerDiscoverer discoverer;

	private final McpHandlerRegistrar registrar;

	private final McpEngine engine;

	private final TransportType transport;

	private final Supplier<McpServerTransportProvider> stdioTransport;

	private BootstrapReport report;

	public McpBootstrap(HandlerDiscoverer discoverer, McpHandlerRegistrar registrar, McpEngine engine,
			TransportType transport) {
		this(discoverer, registrar, engine, transport, null);
	}

	/**
	 * @param stdioTransport supplies the stdio transport, a
	 * {@link StdioServerTransportProvider} over the process streams when {@code null}
	 */
	public McpBootstrap(HandlerDiscoverer discoverer, McpHandlerRegistrar registrar, McpEngine engine,
			TransportType transport, Supplier<McpServerTransportProvider> stdioTransport) {
		Assert.notNull(discoverer, "Discoverer must not be null");
		Assert.notNull(registrar, "Registrar must not be null");
		Assert.notNull(engine, "Engine must not be null");
		Assert.notNull(transport, "Transport type must not be null");
		this.discoverer = discoverer;
		this.registrar = registrar;
		this.engine = engine;
		this.transport = transport;
		this.stdioTransport = stdioTransport != null ? stdioTransport : this::processStreamTransport;
	}

	public synchronized BootstrapReport bootstrap() {
		if (this.report != null) {
			return this.report;
		}

		RegistrationReport resources = this.registrar.registerAll(this.discoverer.discover(HandlerKind.RESOURCE));
		RegistrationReport tools = this.registrar.registerAll(this.discoverer.discover(HandlerKind.TOOL));
		RegistrationReport prompts = this.registrar.registerAll(this.discoverer.discover(HandlerKind.PROMPT));
		logger.info("Registered {} resource(s), {} tool(s) and {} prompt(s)",
				resources.registeredNames(HandlerKind.RESOURCE).size(), tools.registeredNames(HandlerKind.TOOL).size(),
				prompts.registeredNames(HandlerKind.PROMPT).size());

		boolean connected = false;
		String connectError = null;
		if (this.transport == TransportType.STDIO) {
			try {
				this.engine.connect(this.stdioTransport.get());
				connected = true;
			}
			catch (RuntimeException ex) {
				logger.error("Failed to connect the stdio transport, the server is not reachable over stdio", ex);
				connectError = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getName();
			}
		}

		this.report = new BootstrapReport(resources, tools, prompts, this.transport, connected, connectError);
		return this.report;
	}

	private McpServerTransportProvider processStreamTransport() {
		ObjectMapper objectMapper = this.engine.getObjectMapper();
		return objectMapper != null ? new StdioServerTransportProvider(objectMapper)
				: new StdioServerTransportProvider();
	}

}
