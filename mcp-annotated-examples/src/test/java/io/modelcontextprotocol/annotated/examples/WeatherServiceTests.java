/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.annotated.examples;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Map;

import io.modelcontextprotocol.annotated.bootstrap.BootstrapReport;
import io.modelcontextprotocol.annotated.bootstrap.McpModule;
import io.modelcontextprotocol.annotated.bootstrap.McpModuleOptions;
import io.modelcontextprotocol.annotated.bootstrap.TransportType;
import io.modelcontextprotocol.annotated.handler.HandlerKind;
import org.junit.jupiter.api.Test;

class WeatherServiceTests {

	@Test
	void everyHandlerIsRegistered() {
		try (McpModule module = McpModule.forRoot(McpModuleOptions.builder().transport(TransportType.NONE).build())
			.handlers(new WeatherService())
			.build()) {

			BootstrapReport report = module.bootstrap();

			assertThat(report.registrations().hasFailures()).isFalse();
			assertThat(report.resources().registeredNames(HandlerKind.RESOURCE)).containsExactly("cities",
					"forecast");
			assertThat(report.tools().registeredNames(HandlerKind.TOOL)).containsExactlyInAnyOrder("get_temperature",
					"to_fahrenheit", "list_cities");
			assertThat(report.prompts().registeredNames(HandlerKind.PROMPT)).containsExactly("weather_report");
			assertThat(report.connected()).isFalse();
		}
	}

	@Test
	void temperatureCanBeReportedInFahrenheit() {
		WeatherService service = new WeatherService();

		Map<String, Object> lisbon = service.temperature("Lisbon", "fahrenheit");
		assertThat(lisbon).containsEntry("unit", "fahrenheit");
		assertThat((Double) lisbon.get("value")).isCloseTo(71.6, within(0.001));
		assertThat(service.temperature("oslo", null)).containsEntry("value", 6.5);
		assertThatThrownBy(() -> service.temperature("Atlantis", null)).hasMessageContaining("Atlantis");
	}

	@Test
	void forecastAndPromptText() {
		WeatherService service = new WeatherService();

		assertThat(service.forecast("tokyo")).isEqualTo("tokyo: 18.0 C");
		assertThat(service.weatherReport("Oslo", null)).isEqualTo("Write a brief weather report for Oslo.");
		assertThat(WeatherService.toFahrenheit(100)).isEqualTo(212.0);
	}

}
