/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.server;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.annotated.handler.UriTemplateManagerFactory;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerSession;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import io.modelcontextprotocol.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The single MCP server shared by every registration and every transport.
 * <p>
 * The server is built once, without a transport. Transports are attached afterwards
 * with {@link #connect(McpServerTransportProvider)}; any number of them can share the
 * server, and server wide notifications and shutdown fan out to all of them.
 * <p>
 * Resource reads are routed with {@link UriTemplateManagerFactory}, so a template
 * resource receives every URI its template matches.
 *
 * @author Christian Tzolov
 */
public class McpEngine {

	private static final Logger logger = LoggerFactory.getLogger(McpEngine.class);

	private final McpSyncServer server;

	private final TransportFanOut transports;

	private final McpSchema.Implementation serverInfo;

	private final ObjectMapper objectMapper;

	protected McpEngine(McpSyncServer server, TransportFanOut transports, McpSchema.Implementation serverInfo,
			ObjectMapper objectMapper) {
		this.server = server;
		this.transports = transports;
		this.serverInfo = serverInfo;
		this.objectMapper = objectMapper;
	}

	/**
	 * Builds the engine.
	 * @param serverInfo name and version advertised to clients
	 * @param options server options, defaulted when {@code null}
	 * @param objectMapper mapper used for protocol messages, a new one when {@code null}
	 * @return the engine, not yet connected to any transport
	 */
	public static McpEngine create(McpSchema.Implementation serverInfo, McpServerOptions options,
			ObjectMapper objectMapper) {
		Assert.notNull(serverInfo, "Server info must not be null");
		McpServerOptions effective = options != null ? options : McpServerOptions.defaults();
		ObjectMapper mapper = objectMapper != null ? objectMapper : new ObjectMapper();

		TransportFanOut transports = new TransportFanOut();
		McpServer.SyncSpecification specification = McpServer.sync(transports)
			.serverInfo(serverInfo)
			.capabilities(effective.capabilities())
			.uriTemplateManagerFactory(new UriTemplateManagerFactory())
			.objectMapper(mapper);
		if (effective.instructions() != null) {
			specification.instructions(effective.instructions());
		}
		if (effective.requestTimeout() != null) {
			specification.requestTimeout(effective.requestTimeout());
		}
		McpSyncServer server = specification.build();
		logger.info("MCP server {} {} created", serverInfo.name(), serverInfo.version());
		return new McpEngine(server, transports, serverInfo, mapper);
	}

	/**
	 * Attaches a transport. Sessions the transport opens are served by this engine.
	 * @param transportProvider the transport to attach
	 */
	public void connect(McpServerTransportProvider transportProvider) {
		Assert.notNull(transportProvider, "Transport provider must not be null");
		this.transports.attach(transportProvider);
		logger.info("Connected transport {}", transportProvider.getClass().getSimpleName());
	}

	public void addTool(McpServerFeatures.SyncToolSpecification specification) {
		this.server.addTool(specification);
	}

	public void addResource(McpServerFeatures.SyncResourceSpecification specification) {
		this.server.addResource(specification);
	}

	public void addPrompt(McpServerFeatures.SyncPromptSpecification specification) {
		this.server.addPrompt(specification);
	}

	public McpSyncServer getServer() {
		return this.server;
	}

	public McpSchema.Implementation getServerInfo() {
		return this.serverInfo;
	}

	public ObjectMapper getObjectMapper() {
		return this.objectMapper;
	}

	/**
	 * Gracefully closes the server and every attached transport.
	 */
	public void close() {
		this.server.closeGracefully();
	}

	/**
	 * The transport provider the server is built with. It keeps the session factory the
	 * server hands over, gives it to every transport attached later, and forwards
	 * notifications and shutdown to all of them.
	 */
	static class TransportFanOut implements McpServerTransportProvider {

		private final List<McpServerTransportProvider> attached = new CopyOnWriteArrayList<>();

		private volatile McpServerSession.Factory sessionFactory;

		@Override
		public void setSessionFactory(McpServerSession.Factory sessionFactory) {
			this.sessionFactory = sessionFactory;
		}

		void attach(McpServerTransportProvider transportProvider) {
			if (this.sessionFactory == null) {
				throw new IllegalStateException("MCP server has not provided a session factory");
			}
			transportProvider.setSessionFactory(this.sessionFactory);
			this.attached.add(transportProvider);
		}

		@Override
		public Mono<Void> notifyClients(String method, Object params) {
			return Flux.fromIterable(this.attached)
				.flatMap(transport -> transport.notifyClients(method, params)
					.onErrorResume(e -> {
						logger.error("Failed to notify clients of {}", transport.getClass().getSimpleName(), e);
						return Mono.empty();
					}))
				.then();
		}

		@Override
		public Mono<Void> closeGracefully() {
			return Flux.fromIterable(this.attached).flatMap(McpServerTransportProvider::closeGracefully).then();
		}

	}

}
