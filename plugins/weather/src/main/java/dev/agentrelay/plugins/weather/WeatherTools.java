/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package dev.agentrelay.plugins.weather;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonProperty;

import dev.agentrelay.ai.Tool;
import dev.agentrelay.ai.ToolContext;
import dev.agentrelay.ai.ToolResult;
import dev.agentrelay.core.ErrorKind;

/**
 * Factory for the weather lookup tools.
 *
 * <p>
 * {@code get_weather} always reports in Celsius. {@code get_weather_stateful}
 * reports in the unit stored under {@link #UNIT_PREFERENCE_KEY} and records the
 * city it looked up under {@link #LAST_CITY_KEY}.
 */
public final class WeatherTools {

  private static final Logger logger = LoggerFactory.getLogger(WeatherTools.class);

  public static final String GET_WEATHER = "get_weather";
  public static final String GET_WEATHER_STATEFUL = "get_weather_stateful";

  /** Session key holding the preferred temperature unit. */
  public static final String UNIT_PREFERENCE_KEY = "user_preference_temperature_unit";

  /** Session key the stateful tool writes the last checked city to. */
  public static final String LAST_CITY_KEY = "last_city_checked_stateful";

  static final Map<String, Object> INPUT_SCHEMA = Map.of("type", "object", "properties",
      Map.of("city", Map.of("type", "string", "description", "The name of the city (e.g., \"New York\", \"London\")")),
      "required", List.of("city"));

  /** Input of both weather tools. */
  public static class WeatherInput {
    @JsonProperty("city")
    private String city;

    public WeatherInput() {
    }

    public WeatherInput(String city) {
      this.city = city;
    }

    public String getCity() {
      return city;
    }

    public void setCity(String city) {
      this.city = city;
    }
  }

  private WeatherTools() {
  }

  /**
   * Creates the stateless weather tool.
   *
   * @param table
   *            the known cities
   * @return the tool
   */
  public static Tool<WeatherInput> getWeather(WeatherTable table) {
    return Tool.<WeatherInput>builder().name(GET_WEATHER)
        .description("Retrieves the current weather report for a specified city.").inputSchema(INPUT_SCHEMA)
        .inputClass(WeatherInput.class).handler((ctx, input) -> {
          logger.debug("{} called for city: {}", GET_WEATHER, input.getCity());
          return lookup(table, input.getCity(), TemperatureUnit.CELSIUS, false);
        }).build();
  }

  /**
   * Creates the weather tool that honours the session's unit preference.
   *
   * @param table
   *            the known cities
   * @return the tool
   */
  public static Tool<WeatherInput> getWeatherStateful(WeatherTable table) {
    return Tool.<WeatherInput>builder().name(GET_WEATHER_STATEFUL)
        .description("Retrieves weather for a city, converting the temperature to the user's preferred unit.")
        .inputSchema(INPUT_SCHEMA).inputClass(WeatherInput.class).handler((ctx, input) -> {
          TemperatureUnit unit = preferredUnit(ctx);
          logger.debug("{} called for city: {} (unit {})", GET_WEATHER_STATEFUL, input.getCity(),
              unit.getDisplayName());
          return lookup(table, input.getCity(), unit, true);
        }).build();
  }

  static TemperatureUnit preferredUnit(ToolContext ctx) {
    return TemperatureUnit.fromPreference(ctx != null ? ctx.getState().get(UNIT_PREFERENCE_KEY) : null);
  }

  private static ToolResult lookup(WeatherTable table, String city, TemperatureUnit unit, boolean recordCity) {
    if (city == null || city.trim().isEmpty()) {
      return ToolResult.failure(ErrorKind.VALIDATION, "city is required");
    }
    WeatherTable.Entry entry = table.lookup(city);
    if (entry == null) {
      return ToolResult.failure(ErrorKind.NOT_FOUND, "no weather data for " + city);
    }

    double temperature = unit.fromCelsius(entry.getTemperatureCelsius());
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put(ToolResult.REPORT, formatReport(entry, temperature, unit));
    payload.put("city", entry.getCity());
    payload.put("condition", entry.getCondition());
    payload.put("temperature", temperature);
    payload.put("unit", unit.getDisplayName());
    return recordCity
        ? ToolResult.success(payload, Map.of(LAST_CITY_KEY, entry.getCity()))
        : ToolResult.success(payload);
  }

  static String formatReport(WeatherTable.Entry entry, double temperature, TemperatureUnit unit) {
    return String.format(Locale.ROOT, "The weather in %s is %s with a temperature of %s%s (%s).",
        entry.getCity(), entry.getCondition(), formatTemperature(temperature), unit.getSymbol(),
        unit.getDisplayName());
  }

  /** Whole temperatures print without a decimal: 77 rather than 77.0, but 64.4 stays 64.4. */
  static String formatTemperature(double temperature) {
    return new DecimalFormat("0.#", DecimalFormatSymbols.getInstance(Locale.ROOT)).format(temperature);
  }
}
