/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.annotated.handler.HandlerKind;
import io.modelcontextprotocol.annotated.handler.ResourceDefinition;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerSession;
import io.modelcontextprotocol.spec.McpServerTransport;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;

/**
 * Reads template resources through a server session, so that the server's own resource
 * lookup decides which handler receives the URI.
 */
class TemplateResourceRoutingTests {

	private final ObjectMapper objectMapper = new ObjectMapper();

	private final AtomicInteger requestIds = new AtomicInteger();

	private McpEngine engine;

	private McpHandlerRegistrar registrar;

	private RecordingTransport transport;

	private McpServerSession session;

	@BeforeEach
	void setUp() {
		this.engine = McpEngine.create(new McpSchema.Implementation("routing-server", "1.0.0"), null,
				this.objectMapper);
		this.registrar = new McpHandlerRegistrar(this.engine, this.objectMapper);

		assertThat(this.registrar.registerResource(
				ResourceDefinition.builder().name("docs").uriTemplate("docs://{+path}").build(),
				invocation -> "doc:" + invocation.uriVariables().get("path"))
			.isRegistered()).isTrue();
		assertThat(this.registrar.registerResource(
				ResourceDefinition.builder().name("search").uriTemplate("search://items{?q}").build(),
				invocation -> "q=" + invocation.uriVariables().getOrDefault("q", "<none>"))
			.isRegistered()).isTrue();
		assertThat(this.registrar.registerResource(
				ResourceDefinition.builder().name("city").uriTemplate("weather://forecast/{city}").build(),
				invocation -> "city:" + invocation.uriVariables().get("city"))
			.isRegistered()).isTrue();
		assertThat(this.registrar
			.registerResource(ResourceDefinition.builder().name("motd").uri("test://motd").build(),
					invocation -> "Welcome")
			.isRegistered()).isTrue();
		assertThat(this.registrar.registeredNames(HandlerKind.RESOURCE)).hasSize(4);

		McpServerTransportProvider provider = mock(McpServerTransportProvider.class);
		when(provider.notifyClients(any(), any())).thenReturn(Mono.empty());
		when(provider.closeGracefully()).thenReturn(Mono.empty());
		this.engine.connect(provider);
		ArgumentCaptor<McpServerSession.Factory> factory = ArgumentCaptor.forClass(McpServerSession.Factory.class);
		verify(provider).setSessionFactory(factory.capture());

		this.transport = new RecordingTransport(this.objectMapper);
		this.session = factory.getValue().create(this.transport);
		request(McpSchema.METHOD_INITIALIZE, new McpSchema.InitializeRequest(McpSchema.LATEST_PROTOCOL_VERSION,
				McpSchema.ClientCapabilities.builder().build(), new McpSchema.Implementation("client", "1.0.0")));
		this.session
			.handle(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION,
					McpSchema.METHOD_NOTIFICATION_INITIALIZED, null))
			.block(Duration.ofSeconds(5));
	}

	@AfterEach
	void tearDown() {
		this.engine.close();
	}

	@Test
	void reservedExpansionMatchesSeveralSegments() {
		assertThat(readText("docs://single")).isEqualTo("doc:single");
		assertThat(readText("docs://a/b/c.md")).isEqualTo("doc:a/b/c.md");
	}

	@Test
	void queryExpansionIsOptional() {
		assertThat(readText("search://items")).isEqualTo("q=<none>");
		assertThat(readText("search://items?q=rain")).isEqualTo("q=rain");
	}

	@Test
	void simpleExpansionMatchesOneSegment() {
		assertThat(readText("weather://forecast/New%20York")).isEqualTo("city:New York");
		assertThat(read("weather://forecast/a/b").error()).isNotNull();
	}

	@Test
	void fixedUriMatchesOnlyItself() {
		assertThat(readText("test://motd")).isEqualTo("Welcome");
		assertThat(read("test://motd/extra").error()).isNotNull();
	}

	private String readText(String uri) {
		McpSchema.JSONRPCResponse response = read(uri);
		assertThat(response.error()).as("error reading %s", uri).isNull();
		McpSchema.ReadResourceResult result = this.objectMapper.convertValue(response.result(),
				McpSchema.ReadResourceResult.class);
		return ((McpSchema.TextResourceContents) result.contents().get(0)).text();
	}

	private McpSchema.JSONRPCResponse read(String uri) {
		return request(McpSchema.METHOD_RESOURCES_READ, new McpSchema.ReadResourceRequest(uri));
	}

	private McpSchema.JSONRPCResponse request(String method, Object params) {
		int id = this.requestIds.incrementAndGet();
		this.session.handle(new McpSchema.JSONRPCRequest(McpSchema.JSONRPC_VERSION, method, id, params))
			.block(Duration.ofSeconds(5));
		return this.transport.responses()
			.stream()
			.filter(response -> Integer.valueOf(id).equals(response.id()))
			.findFirst()
			.orElseThrow(() -> new AssertionError("No response to " + method));
	}

	static class RecordingTransport implements McpServerTransport {

		private final ObjectMapper objectMapper;

		private final List<McpSchema.JSONRPCMessage> sent = new CopyOnWriteArrayList<>();

		RecordingTransport(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
		}

		List<McpSchema.JSONRPCResponse> responses() {
			return this.sent.stream()
				.filter(McpSchema.JSONRPCResponse.class::isInstance)
				.map(McpSchema.JSONRPCResponse.class::cast)
				.collect(Collectors.toList());
		}

		@Override
		public Mono<Void> sendMessage(McpSchema.JSONRPCMessage message) {
			return Mono.fromRunnable(() -> this.sent.add(message));
		}

		@Override
		public <T> T unmarshalFrom(Object data, TypeReference<T> typeRef) {
			return this.objectMapper.convertValue(data, typeRef);
		}

		@Override
		public Mono<Void> closeGracefully() {
			return Mono.empty();
		}

	}

}
