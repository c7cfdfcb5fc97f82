/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.server;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import io.modelcontextprotocol.annotated.discovery.DiscoveredHandler;
import io.modelcontextprotocol.annotated.handler.BoundHandler;
import io.modelcontextprotocol.annotated.handler.HandlerDefinition;
import io.modelcontextprotocol.annotated.handler.HandlerInvocation;
import io.modelcontextprotocol.annotated.handler.HandlerKind;
import io.modelcontextprotocol.annotated.handler.PromptArgumentSpec;
import io.modelcontextprotocol.annotated.handler.PromptDefinition;
import io.modelcontextprotocol.annotated.handler.ResourceDefinition;
import io.modelcontextprotocol.annotated.handler.ToolDefinition;
import io.modelcontextprotocol.annotated.handler.ToolParameterSpec;
import io.modelcontextprotocol.annotated.handler.UriTemplate;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpError;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.util.Assert;
import io.modelcontextprotocol.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers handler definitions with the {@link McpEngine}.
 * <p>
 * Definitions without a name are skipped. Invalid definitions and definitions whose name
 * is already registered within the same kind fail. Neither case throws: every call
 * returns a {@link RegistrationOutcome}, and earlier registrations stay in place.
 *
 * @author Christian Tzolov
 */
public class McpHandlerRegistrar {

	private static final Logger logger = LoggerFactory.getLogger(McpHandlerRegistrar.class);

	private final McpEngine engine;

	private final ObjectMapper objectMapper;

	private final ArgumentValidator validator;

	private final Map<HandlerKind, Set<String>> registeredNames = new EnumMap<>(HandlerKind.class);

	public McpHandlerRegistrar(McpEngine engine) {
		this(engine, new ObjectMapper());
	}

	public McpHandlerRegistrar(McpEngine engine, ObjectMapper objectMapper) {
		Assert.notNull(engine, "Engine must not be null");
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		this.engine = engine;
		this.objectMapper = objectMapper;
		this.validator = new ArgumentValidator(objectMapper);
		for (HandlerKind kind : HandlerKind.values()) {
			this.registeredNames.put(kind, ConcurrentHashMap.newKeySet());
		}
	}

	/**
	 * @return the names registered so far for the kind
	 */
	public Set<String> registeredNames(HandlerKind kind) {
		return Collections.unmodifiableSet(this.registeredNames.get(kind));
	}

	public RegistrationReport registerAll(List<DiscoveredHandler> handlers) {
		List<RegistrationOutcome> outcomes = new ArrayList<>();
		for (DiscoveredHandler handler : handlers) {
			outcomes.add(register(handler));
		}
		return new RegistrationReport(outcomes);
	}

	public RegistrationOutcome register(DiscoveredHandler handler) {
		HandlerDefinition definition = handler.metadata().definition();
		if (definition instanceof ResourceDefinition resource) {
			return registerResource(resource, handler.handler());
		}
		if (definition instanceof ToolDefinition tool) {
			return registerTool(tool, handler.handler());
		}
		return registerPrompt((PromptDefinition) definition, handler.handler());
	}

	public RegistrationOutcome registerResource(ResourceDefinition definition, BoundHandler handler) {
		HandlerKind kind = HandlerKind.RESOURCE;
		RegistrationOutcome rejected = precheck(definition, handler, kind);
		if (rejected != null) {
			return rejected;
		}
		String name = definition.name();

		UriTemplate template = null;
		String uri;
		if (definition.isTemplate()) {
			if (definition.uri() != null) {
				return fail(kind, name, "both uri and uriTemplate are set");
			}
			Object raw = definition.uriTemplate();
			if (raw instanceof UriTemplate compiled) {
				template = compiled;
			}
			else if (raw instanceof String text) {
				try {
					template = new UriTemplate(text);
				}
				catch (IllegalArgumentException ex) {
					return fail(kind, name, ex.getMessage());
				}
			}
			else {
				return fail(kind, name, "unsupported uriTemplate type " + raw.getClass().getName());
			}
			uri = template.getTemplate();
		}
		else if (Utils.hasText(definition.uri())) {
			if (UriTemplate.isTemplate(definition.uri())) {
				return fail(kind, name, "uri '" + definition.uri() + "' contains a template expression, use uriTemplate");
			}
			uri = definition.uri();
		}
		else {
			return fail(kind, name, "neither uri nor uriTemplate is set");
		}

		String mimeType = definition.metadata().mimeType();
		McpSchema.Resource resource = new McpSchema.Resource(uri, name, definition.description(), mimeType,
				definition.metadata().toAnnotations());
		UriTemplate matcher = template;
		McpServerFeatures.SyncResourceSpecification specification = new McpServerFeatures.SyncResourceSpecification(
				resource, (exchange, request) -> {
					Map<String, String> variables = matcher != null ? matcher.match(request.uri()).orElse(Map.of())
							: Map.of();
					Object result = invoke(handler, HandlerInvocation.resource(exchange, request, variables), name);
					return HandlerResults.toReadResourceResult(result, request.uri(), mimeType, this.objectMapper);
				});

		return addToEngine(kind, name, () -> this.engine.addResource(specification));
	}

	public RegistrationOutcome registerTool(ToolDefinition definition, BoundHandler handler) {
		HandlerKind kind = HandlerKind.TOOL;
		RegistrationOutcome rejected = precheck(definition, handler, kind);
		if (rejected != null) {
			return rejected;
		}
		String name = definition.name();

		McpSchema.Tool tool;
		JsonSchema compiled;
		try {
			ObjectNode shape = toolShape(definition, handler.declaredParameters());
			compiled = shape != null ? this.validator.compile(shape) : null;
			String schema = shape != null ? shape.toString() : ArgumentSchemas.EMPTY_OBJECT_SCHEMA;
			tool = new McpSchema.Tool(name, definition.description(), schema);
		}
		catch (IllegalArgumentException ex) {
			return fail(kind, name, ex.getMessage());
		}

		McpServerFeatures.SyncToolSpecification specification = new McpServerFeatures.SyncToolSpecification(tool,
				(exchange, arguments) -> {
					if (compiled != null) {
						this.validator.validate(compiled, arguments, "tool '" + name + "'");
					}
					try {
						Object result = handler.invoke(HandlerInvocation.tool(exchange, arguments));
						return HandlerResults.toCallToolResult(result, this.objectMapper);
					}
					catch (McpError ex) {
						throw ex;
					}
					catch (Exception ex) {
						logger.warn("Tool '{}' failed", name, ex);
						return HandlerResults.toolError(ex);
					}
				});

		return addToEngine(kind, name, () -> this.engine.addTool(specification));
	}

	public RegistrationOutcome registerPrompt(PromptDefinition definition, BoundHandler handler) {
		HandlerKind kind = HandlerKind.PROMPT;
		RegistrationOutcome rejected = precheck(definition, handler, kind);
		if (rejected != null) {
			return rejected;
		}
		String name = definition.name();

		List<PromptArgumentSpec> arguments = new ArrayList<>();
		for (PromptArgumentSpec argument : definition.arguments()) {
			if (Utils.hasText(argument.name())) {
				arguments.add(argument);
			}
			else {
				logger.warn("Dropping unnamed argument of prompt '{}'", name);
			}
		}
		if (arguments.isEmpty() && !definition.arguments().isEmpty()) {
			logger.warn("Prompt '{}' has no valid arguments, registering it without arguments", name);
		}

		McpSchema.Prompt prompt;
		JsonSchema compiled;
		if (arguments.isEmpty()) {
			prompt = new McpSchema.Prompt(name, definition.description(), null);
			compiled = null;
		}
		else {
			prompt = new McpSchema.Prompt(name, definition.description(),
					arguments.stream()
						.map(a -> new McpSchema.PromptArgument(a.name(), a.description(), a.required()))
						.collect(Collectors.toList()));
			try {
				compiled = this.validator.compile(ArgumentSchemas.forPromptArguments(arguments, this.objectMapper));
			}
			catch (IllegalArgumentException ex) {
				return fail(kind, name, ex.getMessage());
			}
		}

		McpServerFeatures.SyncPromptSpecification specification = new McpServerFeatures.SyncPromptSpecification(
				prompt, (exchange, request) -> {
					if (compiled != null) {
						this.validator.validate(compiled, request.arguments(), "prompt '" + name + "'");
					}
					Object result = invoke(handler, HandlerInvocation.prompt(exchange, request), name);
					return HandlerResults.toGetPromptResult(result, definition.description(), this.objectMapper);
				});

		return addToEngine(kind, name, () -> this.engine.addPrompt(specification));
	}

	private RegistrationOutcome precheck(HandlerDefinition definition, BoundHandler handler, HandlerKind kind) {
		Assert.notNull(definition, "Definition must not be null");
		Assert.notNull(handler, "Handler must not be null");
		if (!Utils.hasText(definition.name())) {
			logger.warn("Skipping {} definition without a name", kind.label());
			return RegistrationOutcome.skipped(kind, definition.name(), "missing name");
		}
		if (this.registeredNames.get(kind).contains(definition.name())) {
			return fail(kind, definition.name(), "a " + kind.label() + " with this name is already registered");
		}
		try {
			handler.verify(kind);
		}
		catch (IllegalStateException ex) {
			return fail(kind, definition.name(), ex.getMessage());
		}
		return null;
	}

	/**
	 * Input schema precedence: raw schema, declared parameters, then method parameters.
	 */
	private ObjectNode toolShape(ToolDefinition definition, List<ToolParameterSpec> methodParameters) {
		boolean hasRaw = Utils.hasText(definition.inputSchema());
		boolean hasDeclared = !definition.parameters().isEmpty();
		boolean hasMethod = !Utils.isEmpty(methodParameters);
		if ((hasRaw ? 1 : 0) + (hasDeclared ? 1 : 0) + (hasMethod ? 1 : 0) > 1) {
			logger.warn("Tool '{}' declares its arguments more than once, using the {}", definition.name(),
					hasRaw ? "input schema" : "declared parameters");
		}
		if (hasRaw) {
			return ArgumentSchemas.parse(definition.inputSchema(), this.objectMapper);
		}
		if (hasDeclared) {
			return ArgumentSchemas.forToolParameters(definition.parameters(), this.objectMapper);
		}
		if (hasMethod) {
			return ArgumentSchemas.forToolParameters(methodParameters, this.objectMapper);
		}
		return null;
	}

	private RegistrationOutcome addToEngine(HandlerKind kind, String name, Runnable registration) {
		Set<String> names = this.registeredNames.get(kind);
		if (!names.add(name)) {
			return fail(kind, name, "a " + kind.label() + " with this name is already registered");
		}
		try {
			registration.run();
		}
		catch (RuntimeException ex) {
			names.remove(name);
			return fail(kind, name, "rejected by the server: " + ex.getMessage());
		}
		logger.debug("Registered {} '{}'", kind.label(), name);
		return RegistrationOutcome.registered(kind, name);
	}

	private Object invoke(BoundHandler handler, HandlerInvocation invocation, String name) {
		try {
			return handler.invoke(invocation);
		}
		catch (RuntimeException ex) {
			throw ex;
		}
		catch (Exception ex) {
			throw new McpError(new McpSchema.JSONRPCResponse.JSONRPCError(McpSchema.ErrorCodes.INTERNAL_ERROR,
					invocation.kind().label() + " '" + name + "' failed: " + ex.getMessage(), null));
		}
	}

	private static RegistrationOutcome fail(HandlerKind kind, String name, String reason) {
		logger.error("Failed to register {} '{}': {}", kind.label(), name, reason);
		return RegistrationOutcome.failed(kind, name, reason);
	}

}
