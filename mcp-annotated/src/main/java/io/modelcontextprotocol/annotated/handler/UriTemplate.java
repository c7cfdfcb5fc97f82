/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.handler;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.modelcontextprotocol.util.McpUriTemplateManager;
import io.modelcontextprotocol.util.Utils;

/**
 * A compiled URI template used to match the URIs of template resources and to extract
 * their variables.
 * <p>
 * Supported expressions are a subset of RFC 6570:
 * <ul>
 * <li>{@code {var}} - a single path segment, percent-decoded</li>
 * <li>{@code {+var}} - reserved expansion, may span several segments</li>
 * <li>{@code {?a,b}} - optional query parameters</li>
 * </ul>
 * A template without expressions matches its own text only. Instances are immutable and
 * thread-safe. The server routes resource reads through the same matcher, see
 * {@link UriTemplateManagerFactory}.
 */
public final class UriTemplate implements McpUriTemplateManager {

	private static final Pattern EXPRESSION = Pattern.compile("\\{([^{}]*)}");

	private final String template;

	private final Pattern pattern;

	private final List<String> variableNames;

	private final List<Group> groups;

	private final Set<String> queryNames;

	/**
	 * Compiles the given template.
	 * @param template the URI template
	 * @throws IllegalArgumentException if the template is blank, declares a variable
	 * twice or contains an empty expression
	 */
	public UriTemplate(String template) {
		if (!Utils.hasText(template)) {
			throw new IllegalArgumentException("URI template must not be null or empty");
		}
		this.template = template;

		List<String> names = new ArrayList<>();
		List<Group> groups = new ArrayList<>();
		Set<String> queryNames = new LinkedHashSet<>();
		StringBuilder regex = new StringBuilder("^");

		Matcher matcher = EXPRESSION.matcher(template);
		int last = 0;
		while (matcher.find()) {
			regex.append(Pattern.quote(template.substring(last, matcher.start())));
			String expression = matcher.group(1).trim();
			if (expression.isEmpty()) {
				throw new IllegalArgumentException("Empty expression in URI template: " + template);
			}
			char operator = expression.charAt(0);
			if (operator == '?') {
				for (String name : split(expression.substring(1), template)) {
					addName(names, name, template);
					queryNames.add(name);
				}
				regex.append("(?:\\?([^#]*))?");
				groups.add(new Group(null, false, true));
			}
			else if (operator == '+') {
				String name = expression.substring(1).trim();
				addName(names, name, template);
				regex.append("(.+)");
				groups.add(new Group(name, false, false));
			}
			else {
				addName(names, expression, template);
				regex.append("([^/?#]+)");
				groups.add(new Group(expression, true, false));
			}
			last = matcher.end();
		}
		regex.append(Pattern.quote(template.substring(last))).append("$");

		this.pattern = Pattern.compile(regex.toString());
		this.variableNames = Collections.unmodifiableList(names);
		this.groups = List.copyOf(groups);
		this.queryNames = Collections.unmodifiableSet(queryNames);
	}

	public static UriTemplate of(String template) {
		return new UriTemplate(template);
	}

	public String getTemplate() {
		return this.template;
	}

	/**
	 * @return whether the text contains at least one template expression
	 */
	public static boolean isTemplate(String uri) {
		return uri != null && EXPRESSION.matcher(uri).find();
	}

	/**
	 * @return the variable names in declaration order
	 */
	@Override
	public List<String> getVariableNames() {
		return this.variableNames;
	}

	@Override
	public boolean matches(String uri) {
		return uri != null && this.pattern.matcher(uri).matches();
	}

	@Override
	public boolean isUriTemplate(String uri) {
		return isTemplate(uri);
	}

	/**
	 * @return the variable values of the URI, empty when it does not match
	 */
	@Override
	public Map<String, String> extractVariableValues(String uri) {
		return match(uri).orElse(Map.of());
	}

	/**
	 * Matches the URI against this template.
	 * @param uri the concrete URI
	 * @return the variable values keyed by name, or empty when the URI does not match.
	 * Query variables absent from the URI are omitted.
	 */
	public Optional<Map<String, String>> match(String uri) {
		if (uri == null) {
			return Optional.empty();
		}
		Matcher matcher = this.pattern.matcher(uri);
		if (!matcher.matches()) {
			return Optional.empty();
		}
		Map<String, String> values = new LinkedHashMap<>();
		for (int i = 0; i < this.groups.size(); i++) {
			Group group = this.groups.get(i);
			String value = matcher.group(i + 1);
			if (value == null) {
				continue;
			}
			if (group.query()) {
				parseQuery(value, values);
			}
			else {
				values.put(group.name(), group.decode() ? decode(value) : value);
			}
		}
		return Optional.of(values);
	}

	private void parseQuery(String query, Map<String, String> values) {
		for (String pair : query.split("&")) {
			int idx = pair.indexOf('=');
			String key = decode(idx > 0 ? pair.substring(0, idx) : pair);
			if (this.queryNames.contains(key)) {
				values.put(key, idx > 0 ? decode(pair.substring(idx + 1)) : "");
			}
		}
	}

	private static List<String> split(String names, String template) {
		List<String> result = new ArrayList<>();
		for (String name : names.split(",")) {
			if (name.isBlank()) {
				throw new IllegalArgumentException("Empty variable name in URI template: " + template);
			}
			result.add(name.trim());
		}
		return result;
	}

	private static void addName(List<String> names, String name, String template) {
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Empty variable name in URI template: " + template);
		}
		if (names.contains(name)) {
			throw new IllegalArgumentException("Duplicate variable '" + name + "' in URI template: " + template);
		}
		names.add(name);
	}

	private static String decode(String value) {
		return URLDecoder.decode(value, StandardCharsets.UTF_8);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof UriTemplate other && this.template.equals(other.template);
	}

	@Override
	public int hashCode() {
		return this.template.hashCode();
	}

	@Override
	public String toString() {
		return this.template;
	}

	private record Group(String name, boolean decode, boolean query) {
	}

}
