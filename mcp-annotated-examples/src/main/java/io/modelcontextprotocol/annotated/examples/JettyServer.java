/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.examples;

import jakarta.servlet.http.HttpServlet;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

public class JettyServer implements AutoCloseable {

	private final Server server;

	public JettyServer(HttpServlet servlet, String prefix, int port) {
		server = new Server(port);

		ServletContextHandler context = new ServletContextHandler();
		context.setContextPath("/");
		server.setHandler(context);

		ServletHolder holder = new ServletHolder(servlet);
		holder.setAsyncSupported(true);
		context.addServlet(holder, prefix + "/*");

		try {
			server.start();
		}
		catch (Exception e) {
			throw new IllegalStateException("Failed to start Jetty on port " + port, e);
		}
	}

	@Override
	public void close() throws Exception {
		server.stop();
	}

}
