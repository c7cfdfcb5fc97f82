/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.examples;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import io.modelcontextprotocol.annotated.annotation.McpParam;
import io.modelcontextprotocol.annotated.annotation.McpPrompt;
import io.modelcontextprotocol.annotated.annotation.McpPromptArg;
import io.modelcontextprotocol.annotated.annotation.McpResource;
import io.modelcontextprotocol.annotated.annotation.McpTool;
import io.modelcontextprotocol.annotated.annotation.McpToolParam;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Sample handlers backed by a fixed table of city temperatures.
 */
public class WeatherService {

	private final Map<String, Double> temperatures = new TreeMap<>(
			Map.of("amsterdam", 14.5, "lisbon", 22.0, "oslo", 6.5, "tokyo", 18.0));

	@McpResource(name = "cities", description = "Cities with a known forecast", uri = "weather://cities",
			mimeType = "application/json", audience = McpSchema.Role.USER)
	public List<String> cities() {
		return List.copyOf(this.temperatures.keySet());
	}

	@McpResource(name = "forecast", description = "Current forecast of a city",
			uriTemplate = "weather://forecast/{city}", mimeType = "text/plain")
	public String forecast(@McpParam("city") String city) {
		Double celsius = this.temperatures.get(city.toLowerCase(Locale.ROOT));
		if (celsius == null) {
			throw new IllegalArgumentException("Unknown city: " + city);
		}
		return city + ": " + celsius + " C";
	}

	@McpTool(name = "get_temperature", description = "Returns the temperature of a city")
	public Map<String, Object> temperature(@McpParam(value = "city", description = "City name") String city,
			@McpParam(value = "unit", description = "celsius or fahrenheit", required = false) String unit) {
		Double celsius = this.temperatures.get(city.toLowerCase(Locale.ROOT));
		if (celsius == null) {
			throw new IllegalArgumentException("Unknown city: " + city);
		}
		boolean fahrenheit = "fahrenheit".equalsIgnoreCase(unit);
		return Map.of("city", city, "unit", fahrenheit ? "fahrenheit" : "celsius", "value",
				fahrenheit ? toFahrenheit(celsius) : celsius);
	}

	@McpTool(name = "to_fahrenheit", description = "Converts Celsius to Fahrenheit",
			params = @McpToolParam(name = "celsius", type = "number", description = "Temperature in Celsius"))
	public String convert(Map<String, Object> arguments) {
		double celsius = ((Number) arguments.get("celsius")).doubleValue();
		return String.valueOf(toFahrenheit(celsius));
	}

	@McpTool(name = "list_cities")
	public String listCities() {
		return String.join(", ", this.temperatures.keySet());
	}

	@McpPrompt(name = "weather_report", description = "Asks for a short weather report",
			arguments = { @McpPromptArg(name = "city", description = "City to report on", required = true),
					@McpPromptArg(name = "style", description = "Tone of the report") })
	public String weatherReport(@McpParam("city") String city, @McpParam(value = "style", required = false) String style) {
		return "Write a " + (style != null ? style : "brief") + " weather report for " + city + ".";
	}

	static double toFahrenheit(double celsius) {
		return celsius * 9 / 5 + 32;
	}

}
