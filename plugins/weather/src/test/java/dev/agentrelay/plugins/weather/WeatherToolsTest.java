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

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import dev.agentrelay.ai.Tool;
import dev.agentrelay.ai.ToolContext;
import dev.agentrelay.ai.ToolResult;
import dev.agentrelay.core.ErrorKind;

/** Unit tests for the weather tools. */
class WeatherToolsTest {

  private final Tool<WeatherTools.WeatherInput> getWeather = WeatherTools.getWeather(WeatherTable.defaultTable());
  private final Tool<WeatherTools.WeatherInput> stateful = WeatherTools
      .getWeatherStateful(WeatherTable.defaultTable());

  private static ToolContext prefers(String unit) {
    return ToolContext.ofState(Map.of(WeatherTools.UNIT_PREFERENCE_KEY, unit));
  }

  @Test
  void testKnownCity() {
    ToolResult result = getWeather.invoke(ToolContext.ofState(Map.of()), Map.of("city", "London"));

    assertTrue(result.isSuccess());
    assertEquals("The weather in London is cloudy with a temperature of 15°C (Celsius).", result.getReport());
    assertEquals("London", result.getPayload().get("city"));
    assertEquals("cloudy", result.getPayload().get("condition"));
    assertEquals(15.0, result.getPayload().get("temperature"));
    assertEquals("Celsius", result.getPayload().get("unit"));
    assertTrue(result.getStateWrite().isEmpty());
  }

  @Test
  void testLookupIgnoresCaseAndWhitespace() {
    ToolResult canonical = getWeather.invoke(ToolContext.ofState(Map.of()), Map.of("city", "New York"));
    for (String variant : List.of("new york", "  NEW YORK  ", "NewYork", "new\tyork")) {
      assertEquals(canonical, getWeather.invoke(ToolContext.ofState(Map.of()), Map.of("city", variant)), variant);
    }
  }

  @Test
  void testUnknownCity() {
    ToolResult result = getWeather.invoke(ToolContext.ofState(Map.of()), Map.of("city", " Paris "));

    assertTrue(result.isFailure());
    assertEquals(ErrorKind.NOT_FOUND, result.getErrorKind());
    assertEquals("no weather data for  Paris ", result.getMessage());
  }

  @Test
  void testMissingCity() {
    Map<String, Object> blank = new HashMap<>();
    blank.put("city", "   ");

    assertEquals(ErrorKind.VALIDATION, getWeather.invoke(ToolContext.ofState(Map.of()), Map.of()).getErrorKind());
    assertEquals("city is required", getWeather.invoke(ToolContext.ofState(Map.of()), blank).getMessage());
  }

  @Test
  void testStatefulFahrenheit() {
    ToolResult result = stateful.invoke(prefers("Fahrenheit"), Map.of("city", "new york"));

    assertEquals("The weather in New York is sunny with a temperature of 77°F (Fahrenheit).", result.getReport());
    assertEquals(77.0, result.getPayload().get("temperature"));
    assertEquals(Map.of(WeatherTools.LAST_CITY_KEY, "New York"), result.getStateWrite());
  }

  @Test
  void testFractionalTemperatureKeepsOneDecimal() {
    ToolResult result = stateful.invoke(prefers("Fahrenheit"), Map.of("city", "Tokyo"));

    assertEquals("The weather in Tokyo is light rain with a temperature of 64.4°F (Fahrenheit).", result.getReport());
    assertEquals("-40", WeatherTools.formatTemperature(-40.0));
    assertEquals("59", WeatherTools.formatTemperature(59.0));
  }

  @Test
  void testStatefulDefaultsToCelsius() {
    ToolResult noPreference = stateful.invoke(ToolContext.ofState(Map.of()), Map.of("city", "Tokyo"));
    ToolResult unrecognized = stateful.invoke(prefers("Kelvin"), Map.of("city", "Tokyo"));

    assertTrue(noPreference.getReport().contains("18°C (Celsius)"));
    assertEquals(noPreference, unrecognized);
  }

  @Test
  void testStatefulMatchesStatelessInCelsius() {
    for (WeatherTable.Entry entry : WeatherTable.defaultTable().getEntries()) {
      Map<String, Object> args = Map.of("city", entry.getCity());
      assertEquals(getWeather.invoke(prefers("Celsius"), args).getReport(),
          stateful.invoke(prefers("Celsius"), args).getReport());
    }
  }

  @Test
  void testStatefulUnknownCityWritesNothing() {
    ToolResult result = stateful.invoke(prefers("Fahrenheit"), Map.of("city", "Atlantis"));

    assertEquals(ErrorKind.NOT_FOUND, result.getErrorKind());
    assertTrue(result.getStateWrite().isEmpty());
  }

  @Test
  void testDefinitionAdvertisesCityArgument() {
    assertEquals(List.of("city"), getWeather.getDefinition().getInputSchema().get("required"));
  }

  @Test
  void testDuplicateCitiesRejected() {
    assertThrows(IllegalArgumentException.class, () -> new WeatherTable(
        List.of(new WeatherTable.Entry("New York", "sunny", 25), new WeatherTable.Entry("newyork", "rain", 10))));
  }
}
