/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.bootstrap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.annotated.annotation.McpParam;
import io.modelcontextprotocol.annotated.annotation.McpPrompt;
import io.modelcontextprotocol.annotated.annotation.McpResource;
import io.modelcontextprotocol.annotated.annotation.McpTool;
import io.modelcontextprotocol.annotated.discovery.HandlerDiscoverer;
import io.modelcontextprotocol.annotated.discovery.ManagedInstances;
import io.modelcontextprotocol.annotated.handler.HandlerKind;
import io.modelcontextprotocol.annotated.handler.HandlerMetadataReader;
import io.modelcontextprotocol.annotated.server.McpEngine;
import io.modelcontextprotocol.annotated.server.McpHandlerRegistrar;
import io.modelcontextprotocol.annotated.server.RegistrationOutcome;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class McpBootstrapTests {

	private final ObjectMapper objectMapper = new ObjectMapper();

	@Mock
	private McpEngine engine;

	@Mock
	private McpServerTransportProvider stdio;

	@Test
	void registersResourcesThenToolsThenPrompts() {
		McpBootstrap bootstrap = bootstrap(TransportType.NONE, () -> this.stdio);

		BootstrapReport report = bootstrap.bootstrap();

		InOrder order = inOrder(this.engine);
		order.verify(this.engine).addResource(any(McpServerFeatures.SyncResourceSpecification.class));
		order.verify(this.engine).addTool(any(McpServerFeatures.SyncToolSpecification.class));
		order.verify(this.engine).addPrompt(any(McpServerFeatures.SyncPromptSpecification.class));
		assertThat(report.resources().registeredNames(HandlerKind.RESOURCE)).containsExactly("notes");
		assertThat(report.tools().registeredNames(HandlerKind.TOOL)).containsExactly("add");
		assertThat(report.prompts().registeredNames(HandlerKind.PROMPT)).containsExactly("summarize");
		assertThat(report.registrations().outcomes()).hasSize(3);
		assertThat(report.registrations().hasFailures()).isFalse();
	}

	@Test
	void runsOnlyOnce() {
		AtomicInteger transportsCreated = new AtomicInteger();
		McpBootstrap bootstrap = bootstrap(TransportType.STDIO, () -> {
			transportsCreated.incrementAndGet();
			return this.stdio;
		});

		BootstrapReport first = bootstrap.bootstrap();
		BootstrapReport second = bootstrap.bootstrap();

		assertThat(second).isSameAs(first);
		assertThat(transportsCreated).hasValue(1);
		verify(this.engine, times(1)).addTool(any());
		verify(this.engine, times(1)).connect(this.stdio);
	}

	@Test
	void stdioIsConnectedAfterRegistration() {
		BootstrapReport report = bootstrap(TransportType.STDIO, () -> this.stdio).bootstrap();

		InOrder order = inOrder(this.engine);
		order.verify(this.engine).addPrompt(any());
		order.verify(this.engine).connect(this.stdio);
		assertThat(report.connected()).isTrue();
		assertThat(report.connectError()).isNull();
		assertThat(report.transport()).isEqualTo(TransportType.STDIO);
	}

	@Test
	void failedStdioConnectionIsRecordedNotThrown() {
		doThrow(new IllegalStateException("stdin closed")).when(this.engine).connect(this.stdio);

		BootstrapReport report = bootstrap(TransportType.STDIO, () -> this.stdio).bootstrap();

		assertThat(report.connected()).isFalse();
		assertThat(report.connectError()).isEqualTo("stdin closed");
		assertThat(report.tools().registeredNames(HandlerKind.TOOL)).containsExactly("add");
	}

	@Test
	void otherTransportsDoNotConnectStdio() {
		for (TransportType transport : new TransportType[] { TransportType.SSE, TransportType.NONE }) {
			BootstrapReport report = bootstrap(transport, () -> this.stdio).bootstrap();

			assertThat(report.connected()).isFalse();
			assertThat(report.connectError()).isNull();
			assertThat(report.transport()).isEqualTo(transport);
		}
		verify(this.engine, never()).connect(any());
	}

	@Test
	void uncompilableToolSchemaFailsOnlyThatTool() {
		HandlerDiscoverer discoverer = new HandlerDiscoverer(
				ManagedInstances.of(new BrokenSchemaHandlers(), new NoteHandlers()), new HandlerMetadataReader(),
				this.objectMapper);
		McpBootstrap bootstrap = new McpBootstrap(discoverer, new McpHandlerRegistrar(this.engine, this.objectMapper),
				this.engine, TransportType.NONE);

		BootstrapReport report = bootstrap.bootstrap();

		assertThat(report.tools().withStatus(RegistrationOutcome.Status.FAILED))
			.extracting(RegistrationOutcome::name)
			.containsExactly("grep");
		assertThat(report.tools().registeredNames(HandlerKind.TOOL)).containsExactly("add");
		assertThat(report.prompts().registeredNames(HandlerKind.PROMPT)).containsExactly("summarize");
	}

	private McpBootstrap bootstrap(TransportType transport,
			Supplier<McpServerTransportProvider> stdioTransport) {
		HandlerDiscoverer discoverer = new HandlerDiscoverer(ManagedInstances.of(new NoteHandlers()),
				new HandlerMetadataReader(), this.objectMapper);
		McpHandlerRegistrar registrar = new McpHandlerRegistrar(this.engine, this.objectMapper);
		return new McpBootstrap(discoverer, registrar, this.engine, transport, stdioTransport);
	}

	public static class BrokenSchemaHandlers {

		@McpTool(name = "grep", inputSchema = "{\"type\":\"object\",\"properties\":{\"q\":{\"pattern\":\"[\"}}}")
		public String grep() {
			return "";
		}

	}

	public static class NoteHandlers {

		@McpPrompt(name = "summarize")
		public String summarize() {
			return "Summarize the notes";
		}

		@McpTool(name = "add")
		public int add(@McpParam("a") int a, @McpParam("b") int b) {
			return a + b;
		}

		@McpResource(name = "notes", uri = "notes://all")
		public String notes() {
			return "none yet";
		}

	}

}
