/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.handler;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.annotated.annotation.McpParam;
import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.spec.McpError;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.util.Assert;
import io.modelcontextprotocol.util.Utils;

/**
 * A {@link BoundHandler} that calls an annotated method on its owner.
 * <p>
 * Method parameters are bound by type:
 * <ul>
 * <li>{@link McpSyncServerExchange} - the exchange of the calling session</li>
 * <li>{@link McpSchema.ReadResourceRequest} / {@link McpSchema.GetPromptRequest} - the
 * raw request</li>
 * <li>parameters annotated with {@link McpParam} - a named argument or URI variable,
 * converted with Jackson</li>
 * <li>{@link Map} - all tool/prompt arguments, or all URI variables of a resource</li>
 * <li>{@link String} / {@link URI} - the requested resource URI</li>
 * </ul>
 */
public class MethodHandler implements BoundHandler {

	private final Object owner;

	private final Method method;

	private final HandlerKind kind;

	private final ObjectMapper objectMapper;

	private final List<ParameterBinder> binders;

	private final List<String> unsupported;

	public MethodHandler(Object owner, Method method, HandlerKind kind, ObjectMapper objectMapper) {
		Assert.notNull(owner, "Owner must not be null");
		Assert.notNull(method, "Method must not be null");
		Assert.notNull(kind, "Handler kind must not be null");
		this.owner = owner;
		this.method = method;
		this.kind = kind;
		this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();

		if (!Modifier.isPublic(method.getModifiers()) || !Modifier.isPublic(method.getDeclaringClass().getModifiers())) {
			method.trySetAccessible();
		}

		List<ParameterBinder> binders = new ArrayList<>();
		List<String> unsupported = new ArrayList<>();
		for (Parameter parameter : method.getParameters()) {
			ParameterBinder binder = resolve(parameter);
			if (binder == null) {
				unsupported.add(parameter.getType().getSimpleName() + " " + parameter.getName());
			}
			binders.add(binder);
		}
		this.binders = Collections.unmodifiableList(binders);
		this.unsupported = List.copyOf(unsupported);
	}

	public Object getOwner() {
		return this.owner;
	}

	public Method getMethod() {
		return this.method;
	}

	@Override
	public void verify(HandlerKind kind) {
		if (kind != this.kind) {
			throw new IllegalStateException(
					"Method " + describe() + " is bound as a " + this.kind.label() + ", not a " + kind.label());
		}
		if (!this.unsupported.isEmpty()) {
			throw new IllegalStateException(
					"Unsupported parameters " + this.unsupported + " on " + this.kind.label() + " method " + describe());
		}
	}

	@Override
	public List<ToolParameterSpec> declaredParameters() {
		List<ToolParameterSpec> specs = new ArrayList<>();
		for (Parameter parameter : this.method.getParameters()) {
			McpParam param = parameter.getAnnotation(McpParam.class);
			if (param != null) {
				String description = Utils.hasText(param.description()) ? param.description() : null;
				specs.add(new ToolParameterSpec(param.value(), jsonType(parameter.getType()), description,
						param.required()));
			}
		}
		return specs;
	}

	@Override
	public Object invoke(HandlerInvocation invocation) throws Exception {
		verify(invocation.kind());
		Object[] args = new Object[this.binders.size()];
		for (int i = 0; i < args.length; i++) {
			args[i] = this.binders.get(i).bind(invocation);
		}
		try {
			return this.method.invoke(this.owner, args);
		}
		catch (InvocationTargetException ex) {
			Throwable cause = ex.getTargetException();
			if (cause instanceof Exception exception) {
				throw exception;
			}
			if (cause instanceof Error error) {
				throw error;
			}
			throw ex;
		}
	}

	private ParameterBinder resolve(Parameter parameter) {
		Class<?> type = parameter.getType();
		McpParam param = parameter.getAnnotation(McpParam.class);
		if (param != null) {
			return invocation -> convert(param.value(), lookup(invocation, param.value()), parameter);
		}
		if (McpSyncServerExchange.class.isAssignableFrom(type)) {
			return HandlerInvocation::exchange;
		}
		if (type == McpSchema.ReadResourceRequest.class && this.kind == HandlerKind.RESOURCE
				|| type == McpSchema.GetPromptRequest.class && this.kind == HandlerKind.PROMPT) {
			return HandlerInvocation::request;
		}
		if (Map.class.isAssignableFrom(type)) {
			return this.kind == HandlerKind.RESOURCE ? HandlerInvocation::uriVariables : HandlerInvocation::arguments;
		}
		if (this.kind == HandlerKind.RESOURCE && type == String.class) {
			return HandlerInvocation::uri;
		}
		if (this.kind == HandlerKind.RESOURCE && type == URI.class) {
			return invocation -> invocation.uri() != null ? URI.create(invocation.uri()) : null;
		}
		return null;
	}

	private Object lookup(HandlerInvocation invocation, String name) {
		return this.kind == HandlerKind.RESOURCE ? invocation.uriVariables().get(name)
				: invocation.arguments().get(name);
	}

	private Object convert(String name, Object value, Parameter parameter) {
		Class<?> type = parameter.getType();
		if (value == null) {
			if (type.isPrimitive()) {
				throw invalidParams("Missing argument '" + name + "'");
			}
			return null;
		}
		try {
			return this.objectMapper.convertValue(value,
					this.objectMapper.getTypeFactory().constructType(parameter.getParameterizedType()));
		}
		catch (IllegalArgumentException ex) {
			throw invalidParams("Invalid value for argument '" + name + "': " + ex.getMessage());
		}
	}

	private static McpError invalidParams(String message) {
		return new McpError(new McpSchema.JSONRPCResponse.JSONRPCError(McpSchema.ErrorCodes.INVALID_PARAMS, message,
				null));
	}

	static String jsonType(Class<?> type) {
		if (type == String.class || type == char.class || type == Character.class || type.isEnum()
				|| type == URI.class) {
			return "string";
		}
		if (type == boolean.class || type == Boolean.class) {
			return "boolean";
		}
		if (type == int.class || type == long.class || type == short.class || type == byte.class
				|| type == Integer.class || type == Long.class || type == Short.class || type == Byte.class
				|| type == BigInteger.class) {
			return "integer";
		}
		if (type == double.class || type == float.class || Number.class.isAssignableFrom(type)
				|| type == BigDecimal.class) {
			return "number";
		}
		if (type.isArray() || Collection.class.isAssignableFrom(type)) {
			return "array";
		}
		return "object";
	}

	private String describe() {
		return this.method.getDeclaringClass().getSimpleName() + "." + this.method.getName();
	}

	@Override
	public String toString() {
		return "MethodHandler[" + describe() + "]";
	}

	@FunctionalInterface
	private interface ParameterBinder {

		Object bind(HandlerInvocation invocation);

	}

}
