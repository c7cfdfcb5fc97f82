/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.discovery;

import static org.assertj.core.api.Assertions.assertThat;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.annotated.annotation.McpPrompt;
import io.modelcontextprotocol.annotated.annotation.McpResource;
import io.modelcontextprotocol.annotated.annotation.McpTool;
import io.modelcontextprotocol.annotated.handler.HandlerInvocation;
import io.modelcontextprotocol.annotated.handler.HandlerKind;
import io.modelcontextprotocol.annotated.handler.HandlerMetadata;
import io.modelcontextprotocol.annotated.handler.HandlerMetadataReader;
import org.junit.jupiter.api.Test;

class HandlerDiscovererTests {

	static class Base {

		@McpTool(name = "base")
		public String base() {
			return "base";
		}

		@McpTool(name = "overridden")
		public String overridden() {
			return "base";
		}

		@McpTool(name = "inherited-private")
		private String inheritedPrivate() {
			return "private";
		}

	}

	static class Derived extends Base {

		@Override
		@McpTool(name = "overridden")
		public String overridden() {
			return "derived";
		}

		@McpTool(name = "zeta")
		public String zeta() {
			return "zeta";
		}

		@McpTool(name = "alpha")
		protected String alpha() {
			return "alpha";
		}

		@McpTool(name = "static")
		public static String ignoredStatic() {
			return "static";
		}

		@McpResource(name = "res", uri = "res://1")
		public String resource() {
			return "r";
		}

		@McpPrompt(name = "prompt")
		public String prompt() {
			return "p";
		}

	}

	static class Other {

		@McpTool(name = "other")
		public String other() {
			return "other";
		}

	}

	@Test
	void discoversAnnotatedMethodsOfTheRequestedKindOnly() {
		HandlerDiscoverer discoverer = new HandlerDiscoverer(ManagedInstances.of(new Derived()));

		assertThat(names(discoverer.discoverResources())).containsExactly("res");
		assertThat(names(discoverer.discoverPrompts())).containsExactly("prompt");
		assertThat(names(discoverer.discoverTools())).containsExactlyInAnyOrder("alpha", "base", "inherited-private",
				"overridden", "zeta");
	}

	@Test
	void ordersByInstanceThenMethodName() {
		HandlerDiscoverer discoverer = new HandlerDiscoverer(ManagedInstances.of(new Other(), new Derived()));

		assertThat(names(discoverer.discover(HandlerKind.TOOL))).containsExactly("other", "alpha", "base",
				"inherited-private", "overridden", "zeta");
	}

	@Test
	void bindsOverriddenMethodToMostDerivedDeclaration() throws Exception {
		Derived instance = new Derived();
		DiscoveredHandler handler = new HandlerDiscoverer(ManagedInstances.of(instance)).discoverTools()
			.stream()
			.filter(h -> h.metadata().definition().name().equals("overridden"))
			.findFirst()
			.orElseThrow();

		assertThat(handler.instance()).isSameAs(instance);
		assertThat(handler.handler().invoke(HandlerInvocation.tool(null, Map.of()))).isEqualTo("derived");
	}

	@Test
	void invokesNonPublicInheritedMethods() throws Exception {
		DiscoveredHandler handler = new HandlerDiscoverer(ManagedInstances.of(new Derived())).discoverTools()
			.stream()
			.filter(h -> h.metadata().definition().name().equals("inherited-private"))
			.findFirst()
			.orElseThrow();

		assertThat(handler.handler().invoke(HandlerInvocation.tool(null, Map.of()))).isEqualTo("private");
	}

	@Test
	void skipsNullInstances() {
		HandlerDiscoverer discoverer = new HandlerDiscoverer(() -> Arrays.asList(null, new Other(), null));

		assertThat(names(discoverer.discoverTools())).containsExactly("other");
	}

	@Test
	void skipsMethodsWhoseLookupFails() {
		HandlerMetadataReader failing = new HandlerMetadataReader() {
			@Override
			protected Optional<HandlerMetadata> read(HandlerKind kind, Method method) {
				if (method.getName().equals("zeta")) {
					throw new IllegalStateException("broken metadata");
				}
				return super.read(kind, method);
			}
		};
		HandlerDiscoverer discoverer = new HandlerDiscoverer(ManagedInstances.of(new Derived()), failing,
				new ObjectMapper());

		assertThat(names(discoverer.discoverTools())).contains("alpha", "overridden").doesNotContain("zeta");
	}

	@Test
	void failingInstanceSourceYieldsNothing() {
		HandlerDiscoverer discoverer = new HandlerDiscoverer(() -> {
			throw new IllegalStateException("container not ready");
		});

		assertThat(discoverer.discoverTools()).isEmpty();
	}

	@Test
	void repeatedDiscoveryYieldsFreshEqualSnapshots() {
		HandlerDiscoverer discoverer = new HandlerDiscoverer(ManagedInstances.of(new Derived(), new Other()));

		List<DiscoveredHandler> first = discoverer.discoverTools();
		List<DiscoveredHandler> second = discoverer.discoverTools();

		assertThat(names(second)).isEqualTo(names(first));
		assertThat(second.get(0)).isNotSameAs(first.get(0));
	}

	private static List<String> names(List<DiscoveredHandler> handlers) {
		return handlers.stream().map(h -> h.metadata().definition().name()).collect(Collectors.toList());
	}

}
