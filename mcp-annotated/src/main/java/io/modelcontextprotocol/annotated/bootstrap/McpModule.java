/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.bootstrap;

import java.time.Duration;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.annotated.discovery.HandlerDiscoverer;
import io.modelcontextprotocol.annotated.discovery.ManagedInstances;
import io.modelcontextprotocol.annotated.handler.HandlerMetadataReader;
import io.modelcontextprotocol.annotated.server.McpEngine;
import io.modelcontextprotocol.annotated.server.McpHandlerRegistrar;
import io.modelcontextprotocol.annotated.server.transport.HttpServletSseMultiplexer;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import io.modelcontextprotocol.util.Assert;

/**
 * Entry point wiring discovery, registration and transports around one {@link McpEngine}.
 *
 * <pre>{@code
 * McpModule module = McpModule.forRoot(McpModuleOptions.builder().transport(TransportType.SSE).build())
 * 	.handlers(new WeatherService())
 * 	.build();
 * module.bootstrap();
 * context.addServlet(new ServletHolder(module.httpTransport()), "/api/mcp/*");
 * }</pre>
 *
 * @author Christian Tzolov
 */
public class McpModule implements AutoCloseable {

	private final McpModuleOptions options;

	private final McpEngine engine;

	private final McpHandlerRegistrar registrar;

	private final McpBootstrap bootstrap;

	private final HttpServletSseMultiplexer.Builder httpTransportBuilder;

	private HttpServletSseMultiplexer httpTransport;

	private McpModule(McpModuleOptions options, ManagedInstances instances, ObjectMapper objectMapper,
			HttpServletSseMultiplexer.Builder httpTransportBuilder,
			Supplier<McpServerTransportProvider> stdioTransport) {
		this.options = options;
		this.engine = McpEngine.create(options.serverInfo(), options.serverOptions(), objectMapper);
		this.registrar = new McpHandlerRegistrar(this.engine, objectMapper);
		HandlerDiscoverer discoverer = new HandlerDiscoverer(instances, new HandlerMetadataReader(), objectMapper);
		this.bootstrap = new McpBootstrap(discoverer, this.registrar, this.engine, options.transport(),
				stdioTransport);
		this.httpTransportBuilder = httpTransportBuilder != null ? httpTransportBuilder
				: HttpServletSseMultiplexer.builder().objectMapper(objectMapper);
	}

	public static Builder forRoot(McpModuleOptions options) {
		Assert.notNull(options, "Module options must not be null");
		return new Builder(() -> options);
	}

	/**
	 * @param optionsFactory resolved when the module is built
	 * @param timeout how long to wait for the options
	 */
	public static Builder forRootAsync(McpOptionsFactory optionsFactory, Duration timeout) {
		Assert.notNull(optionsFactory, "Options factory must not be null");
		Assert.notNull(timeout, "Timeout must not be null");
		return new Builder(() -> {
			McpModuleOptions options = optionsFactory.createMcpOptions().block(timeout);
			if (options == null) {
				throw new IllegalStateException("Options factory completed without options");
			}
			return options;
		});
	}

	/**
	 * Discovers and registers all handlers, and connects stdio when configured. Runs
	 * once.
	 */
	public BootstrapReport bootstrap() {
		return this.bootstrap.bootstrap();
	}

	public McpModuleOptions options() {
		return this.options;
	}

	public McpEngine engine() {
		return this.engine;
	}

	/**
	 * @return the registrar, for handlers registered programmatically
	 */
	public McpHandlerRegistrar registrar() {
		return this.registrar;
	}

	/**
	 * Returns the SSE servlet, creating it and connecting it to the engine on first use.
	 * @throws IllegalStateException if the module does not use the SSE transport
	 */
	public synchronized HttpServletSseMultiplexer httpTransport() {
		if (this.options.transport() != TransportType.SSE) {
			throw new IllegalStateException("HTTP transport requires transport SSE, configured: "
					+ this.options.transport());
		}
		if (this.httpTransport == null) {
			HttpServletSseMultiplexer transport = this.httpTransportBuilder.build();
			this.engine.connect(transport);
			this.httpTransport = transport;
		}
		return this.httpTransport;
	}

	@Override
	public void close() {
		this.engine.close();
	}

	public static class Builder {

		private final Supplier<McpModuleOptions> options;

		private ManagedInstances instances;

		private ObjectMapper objectMapper;

		private HttpServletSseMultiplexer.Builder httpTransport;

		private Supplier<McpServerTransportProvider> stdioTransport;

		private Builder(Supplier<McpModuleOptions> options) {
			this.options = options;
		}

		/**
		 * Scans the given objects for handlers.
		 */
		public Builder handlers(Object... handlers) {
			this.instances = ManagedInstances.of(handlers);
			return this;
		}

		/**
		 * Scans the instances of the given source, typically a DI container.
		 */
		public Builder instances(ManagedInstances instances) {
			this.instances = instances;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * Customizes the SSE servlet.
		 */
		public Builder httpTransport(HttpServletSseMultiplexer.Builder httpTransport) {
			this.httpTransport = httpTransport;
			return this;
		}

		/**
		 * Replaces the process stream transport used in stdio mode.
		 */
		public Builder stdioTransport(Supplier<McpServerTransportProvider> stdioTransport) {
			this.stdioTransport = stdioTransport;
			return this;
		}

		public McpModule build() {
			if (this.instances == null) {
				throw new IllegalStateException("No handlers or managed instances configured");
			}
			ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : new ObjectMapper();
			return new McpModule(this.options.get(), this.instances, mapper, this.httpTransport, this.stdioTransport);
		}

	}

}
