/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.examples;

import io.modelcontextprotocol.annotated.bootstrap.BootstrapReport;
import io.modelcontextprotocol.annotated.bootstrap.McpModule;
import io.modelcontextprotocol.annotated.bootstrap.McpModuleOptions;
import io.modelcontextprotocol.annotated.bootstrap.TransportType;
import io.modelcontextprotocol.annotated.server.transport.HttpServletSseMultiplexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the weather sample over stdio (the default) or, with {@code sse [port]}, over SSE
 * on embedded Jetty.
 */
public class Main {

	private static final Logger logger = LoggerFactory.getLogger(Main.class);

	public static void main(String[] args) throws Exception {
		TransportType transport = args.length > 0 && "sse".equalsIgnoreCase(args[0]) ? TransportType.SSE
				: TransportType.STDIO;
		int port = args.length > 1 ? Integer.parseInt(args[1]) : 8080;

		McpModuleOptions options = McpModuleOptions.builder()
			.serverInfo("weather-server", "0.1.0")
			.transport(transport)
			.build();

		try (McpModule module = McpModule.forRoot(options).handlers(new WeatherService()).build()) {
			BootstrapReport report = module.bootstrap();
			if (report.registrations().hasFailures()) {
				logger.warn("Some handlers were not registered: {}", report.registrations());
			}

			if (transport == TransportType.SSE) {
				try (var ignore = new JettyServer(module.httpTransport(), HttpServletSseMultiplexer.DEFAULT_PREFIX,
						port)) {
					logger.info("Listening on http://localhost:{}{}/sse", port, HttpServletSseMultiplexer.DEFAULT_PREFIX);
					Thread.currentThread().join();
				}
			}
			else {
				Thread.currentThread().join();
			}
		}
	}

}
