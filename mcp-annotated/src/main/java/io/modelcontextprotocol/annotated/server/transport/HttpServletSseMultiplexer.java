/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.server.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerSession;
import io.modelcontextprotocol.spec.McpServerTransport;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import io.modelcontextprotocol.util.Assert;
import io.modelcontextprotocol.util.Utils;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Servlet based SSE transport that multiplexes any number of client sessions onto one
 * MCP server.
 * <p>
 * The servlet is meant to be mounted at {@code <prefix>/*} (by default
 * {@value #DEFAULT_PREFIX}) and serves:
 * <ul>
 * <li>{@code GET <prefix>/sse} - opens a session and announces its message endpoint with
 * an {@code endpoint} event</li>
 * <li>{@code POST <prefix>/messages?sessionId=<id>} - routes a JSON-RPC message to the
 * session; responses are pushed on the session's SSE stream</li>
 * <li>{@code GET <prefix>/health} - liveness probe</li>
 * </ul>
 * Sessions leave the registry as soon as their stream completes, errors, times out or a
 * write to it fails. Teardown of the server session happens asynchronously and never
 * overlaps a message that is still being handled.
 *
 * @author Christian Tzolov
 */
@WebServlet(asyncSupported = true)
public class HttpServletSseMultiplexer extends HttpServlet implements McpServerTransportProvider {

	private static final Logger logger = LoggerFactory.getLogger(HttpServletSseMultiplexer.class);

	public static final String DEFAULT_PREFIX = "/api/mcp";

	public static final String SSE_PATH = "/sse";

	public static final String MESSAGES_PATH = "/messages";

	public static final String HEALTH_PATH = "/health";

	public static final String SESSION_ID_PARAM = "sessionId";

	public static final String ENDPOINT_EVENT_TYPE = "endpoint";

	public static final String MESSAGE_EVENT_TYPE = "message";

	public static final String UTF_8 = "UTF-8";

	public static final String APPLICATION_JSON = "application/json";

	private final ObjectMapper objectMapper;

	private final String baseUrl;

	private final Duration keepAliveInterval;

	private final SseSessionRegistry registry;

	private final AtomicBoolean isClosing = new AtomicBoolean(false);

	private volatile McpServerSession.Factory sessionFactory;

	private HttpServletSseMultiplexer(ObjectMapper objectMapper, String baseUrl, Duration keepAliveInterval,
			int maxSessions) {
		this.objectMapper = objectMapper;
		this.baseUrl = baseUrl;
		this.keepAliveInterval = keepAliveInterval;
		this.registry = new SseSessionRegistry(maxSessions);
	}

	@Override
	public void setSessionFactory(McpServerSession.Factory sessionFactory) {
		this.sessionFactory = sessionFactory;
	}

	/**
	 * @return the number of open sessions
	 */
	public int sessionCount() {
		return this.registry.size();
	}

	@Override
	public Mono<Void> notifyClients(String method, Object params) {
		if (this.registry.size() == 0) {
			logger.debug("No active sessions to broadcast message to");
			return Mono.empty();
		}
		return Flux.fromIterable(this.registry.all())
			.filter(entry -> entry.serverSession() != null)
			.flatMap(entry -> entry.serverSession()
				.sendNotification(method, params)
				.doOnError(e -> logger.error("Failed to send message to session {}: {}", entry.id(), e.getMessage()))
				.onErrorComplete())
			.then();
	}

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		String path = request.getPathInfo();
		if (SSE_PATH.equals(path)) {
			openSession(request, response);
		}
		else if (HEALTH_PATH.equals(path)) {
			health(response);
		}
		else {
			response.sendError(HttpServletResponse.SC_NOT_FOUND);
		}
	}

	@Override
	protected void doPost(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		if (MESSAGES_PATH.equals(request.getPathInfo())) {
			routeMessage(request, response);
		}
		else {
			response.sendError(HttpServletResponse.SC_NOT_FOUND);
		}
	}

	private void openSession(HttpServletRequest request, HttpServletResponse response) throws IOException {
		McpServerSession.Factory factory = this.sessionFactory;
		if (factory == null) {
			logger.error("SSE connection refused: no MCP server is connected to this transport");
			response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "MCP Server not initialized");
			return;
		}
		if (this.isClosing.get()) {
			response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Server is shutting down");
			return;
		}
		if (!this.registry.tryReserve()) {
			logger.warn("SSE connection refused: session limit reached");
			response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Too many sessions");
			return;
		}

		String sessionId = UUID.randomUUID().toString();
		AsyncContext asyncContext = null;
		SseSession entry = null;
		try {
			response.setContentType("text/event-stream");
			response.setCharacterEncoding(UTF_8);
			response.setHeader("Cache-Control", "no-cache");
			response.setHeader("Connection", "keep-alive");

			asyncContext = request.startAsync();
			asyncContext.setTimeout(0);
			PrintWriter writer = response.getWriter();

			SessionTransport transport = new SessionTransport(sessionId, asyncContext, writer);
			entry = new SseSession(sessionId, transport);
			this.registry.register(entry);
			asyncContext.addListener(new SessionListener(sessionId));

			entry.attach(factory.create(transport));
			transport.sendEvent(ENDPOINT_EVENT_TYPE, endpointUrl(request, sessionId));
			startKeepAlive(entry);
			logger.debug("Opened SSE session {}", sessionId);
		}
		catch (Exception ex) {
			logger.error("Failed to open SSE session {}", sessionId, ex);
			if (entry != null) {
				this.registry.remove(sessionId);
			}
			else {
				this.registry.cancelReservation();
			}
			// the error status must be written before the stream is completed
			if (!response.isCommitted()) {
				response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Failed to open session");
			}
			if (entry != null) {
				teardownLater(entry);
			}
			else if (asyncContext != null) {
				asyncContext.complete();
			}
		}
	}

	private void routeMessage(HttpServletRequest request, HttpServletResponse response) throws IOException {
		String sessionId = request.getParameter(SESSION_ID_PARAM);
		if (!Utils.hasText(sessionId)) {
			logger.warn("Message without sessionId rejected");
			response.sendError(HttpServletResponse.SC_BAD_REQUEST, "Missing sessionId parameter");
			return;
		}
		SseSession entry = this.registry.get(sessionId);
		if (entry == null || !entry.tryAcquire()) {
			logger.debug("No open session {}", sessionId);
			response.sendError(HttpServletResponse.SC_NOT_FOUND, "No connection found for this sessionId");
			return;
		}
		try {
			entry.transport().handlePostMessage(request, response, entry.serverSession());
		}
		finally {
			entry.release();
		}
	}

	private void health(HttpServletResponse response) throws IOException {
		Map<String, String> body = new LinkedHashMap<>();
		body.put("status", "ok");
		body.put("timestamp", Instant.now().toString());
		response.setStatus(HttpServletResponse.SC_OK);
		response.setContentType(APPLICATION_JSON);
		response.setCharacterEncoding(UTF_8);
		PrintWriter writer = response.getWriter();
		writer.write(this.objectMapper.writeValueAsString(body));
		writer.flush();
	}

	private String endpointUrl(HttpServletRequest request, String sessionId) {
		String base = this.baseUrl.endsWith("/") ? this.baseUrl.substring(0, this.baseUrl.length() - 1)
				: this.baseUrl;
		return base + request.getContextPath() + request.getServletPath() + MESSAGES_PATH + "?" + SESSION_ID_PARAM
				+ "=" + sessionId;
	}

	private void startKeepAlive(SseSession entry) {
		if (this.keepAliveInterval == null) {
			return;
		}
		Disposable keepAlive = Flux.interval(this.keepAliveInterval).subscribe(tick -> {
			try {
				entry.transport().sendComment("ping");
			}
			catch (IOException ex) {
				logger.debug("Keep-alive to session {} failed: {}", entry.id(), ex.getMessage());
				closeSessionLater(entry.id());
			}
		});
		entry.keepAlive(keepAlive);
	}

	/**
	 * Removes the session from the registry and tears it down.
	 * @return completes once the session is closed; never errors
	 */
	Mono<Void> closeSession(String sessionId) {
		SseSession entry = this.registry.remove(sessionId);
		if (entry == null) {
			return Mono.empty();
		}
		logger.debug("Closing SSE session {}", sessionId);
		return entry.close()
			.doOnError(e -> logger.error("Error closing SSE session {}", sessionId, e))
			.onErrorComplete();
	}

	private void closeSessionLater(String sessionId) {
		closeSession(sessionId).subscribeOn(Schedulers.boundedElastic()).subscribe();
	}

	private void teardownLater(SseSession entry) {
		entry.close()
			.doOnError(e -> logger.error("Error closing SSE session {}", entry.id(), e))
			.onErrorComplete()
			.subscribeOn(Schedulers.boundedElastic())
			.subscribe();
	}

	@Override
	public Mono<Void> closeGracefully() {
		this.isClosing.set(true);
		logger.debug("Initiating graceful shutdown with {} active sessions", this.registry.size());
		return Flux.fromIterable(this.registry.all())
			.flatMap(entry -> closeSession(entry.id()).subscribeOn(Schedulers.boundedElastic()))
			.then()
			.doOnSuccess(v -> logger.debug("Graceful shutdown completed"));
	}

	@Override
	public void destroy() {
		closeGracefully().block();
		super.destroy();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Closes the session when its stream ends for any reason.
	 */
	private class SessionListener implements AsyncListener {

		private final String sessionId;

		SessionListener(String sessionId) {
			this.sessionId = sessionId;
		}

		@Override
		public void onComplete(AsyncEvent event) {
			closeSessionLater(this.sessionId);
		}

		@Override
		public void onTimeout(AsyncEvent event) {
			logger.debug("SSE session {} timed out", this.sessionId);
			closeSessionLater(this.sessionId);
		}

		@Override
		public void onError(AsyncEvent event) {
			logger.debug("SSE session {} failed", this.sessionId, event.getThrowable());
			closeSessionLater(this.sessionId);
		}

		@Override
		public void onStartAsync(AsyncEvent event) {
		}

	}

	/**
	 * The transport of one SSE session. Writes to the stream are serialized; the first
	 * failed write closes the session.
	 */
	class SessionTransport implements McpServerTransport {

		private final String sessionId;

		private final AsyncContext asyncContext;

		private final PrintWriter writer;

		private final ReentrantLock writeLock = new ReentrantLock();

		private final AtomicBoolean completed = new AtomicBoolean(false);

		SessionTransport(String sessionId, AsyncContext asyncContext, PrintWriter writer) {
			this.sessionId = sessionId;
			this.asyncContext = asyncContext;
			this.writer = writer;
		}

		void handlePostMessage(HttpServletRequest request, HttpServletResponse response,
				McpServerSession serverSession) throws IOException {
			McpSchema.JSONRPCMessage message;
			try {
				StringBuilder body = new StringBuilder();
				BufferedReader reader = request.getReader();
				String line;
				while ((line = reader.readLine()) != null) {
					body.append(line);
				}
				message = McpSchema.deserializeJsonRpcMessage(objectMapper, body.toString());
			}
			catch (IOException | IllegalArgumentException ex) {
				logger.warn("Invalid message format for session {}: {}", this.sessionId, ex.getMessage());
				response.sendError(HttpServletResponse.SC_BAD_REQUEST, "Invalid message format");
				return;
			}

			try {
				serverSession.handle(message).block();
				response.setStatus(HttpServletResponse.SC_OK);
			}
			catch (Exception ex) {
				logger.error("Error handling message for session {}", this.sessionId, ex);
				if (!response.isCommitted()) {
					response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Error processing message");
				}
			}
		}

		void sendEvent(String eventType, String data) throws IOException {
			write("event: " + eventType + "\ndata: " + data + "\n\n");
		}

		void sendComment(String comment) throws IOException {
			write(": " + comment + "\n\n");
		}

		private void write(String frame) throws IOException {
			this.writeLock.lock();
			try {
				if (this.completed.get()) {
					throw new IOException("Session " + this.sessionId + " is closed");
				}
				this.writer.write(frame);
				this.writer.flush();
				if (this.writer.checkError()) {
					throw new IOException("Client disconnected");
				}
			}
			finally {
				this.writeLock.unlock();
			}
		}

		@Override
		public Mono<Void> sendMessage(McpSchema.JSONRPCMessage message) {
			return Mono.fromRunnable(() -> {
				try {
					sendEvent(MESSAGE_EVENT_TYPE, objectMapper.writeValueAsString(message));
				}
				catch (IOException ex) {
					logger.error("Failed to send message to session {}: {}", this.sessionId, ex.getMessage());
					closeSessionLater(this.sessionId);
					throw new IllegalStateException("Failed to send message to session " + this.sessionId, ex);
				}
			});
		}

		@Override
		public <T> T unmarshalFrom(Object data, TypeReference<T> typeRef) {
			return objectMapper.convertValue(data, typeRef);
		}

		@Override
		public Mono<Void> closeGracefully() {
			return closeSession(this.sessionId).then(Mono.fromRunnable(this::complete));
		}

		/**
		 * Ends the SSE stream once.
		 */
		void complete() {
			if (this.completed.compareAndSet(false, true)) {
				try {
					this.asyncContext.complete();
				}
				catch (IllegalStateException ex) {
					logger.debug("SSE stream of session {} already completed", this.sessionId);
				}
			}
		}

	}

	/**
	 * Builder of {@link HttpServletSseMultiplexer}.
	 */
	public static class Builder {

		private ObjectMapper objectMapper;

		private String baseUrl = "";

		private Duration keepAliveInterval;

		private int maxSessions;

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "ObjectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * Sets the scheme, host and port prepended to the advertised message endpoint.
		 * Empty by default, which advertises a path relative to the server.
		 */
		public Builder baseUrl(String baseUrl) {
			Assert.notNull(baseUrl, "Base URL must not be null");
			this.baseUrl = baseUrl;
			return this;
		}

		/**
		 * Sets the interval of SSE comment pings used to detect dead clients. Disabled
		 * when not set.
		 */
		public Builder keepAliveInterval(Duration keepAliveInterval) {
			this.keepAliveInterval = keepAliveInterval;
			return this;
		}

		/**
		 * Caps the number of open sessions; {@code 0} means unlimited.
		 */
		public Builder maxSessions(int maxSessions) {
			if (maxSessions < 0) {
				throw new IllegalArgumentException("Max sessions must not be negative");
			}
			this.maxSessions = maxSessions;
			return this;
		}

		public HttpServletSseMultiplexer build() {
			return new HttpServletSseMultiplexer(this.objectMapper != null ? this.objectMapper : new ObjectMapper(),
					this.baseUrl, this.keepAliveInterval, this.maxSessions);
		}

	}

}
