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
import java.util.Map;

import org.junit.jupiter.api.Test;

import dev.agentrelay.AgentRelay;
import dev.agentrelay.ai.session.Session;

/** End-to-end conversations with the weather team. */
class WeatherTeamScenarioTest {

  private static final String APP = "weather_app";
  private static final String USER = "user_1";
  private static final String SESSION = "session_001";

  private static AgentRelay relay(String coordinator) {
    return AgentRelay.builder().plugin(WeatherPlugin.create()).inferenceEngine(WeatherTeam.rules())
        .rootHandler(coordinator).build();
  }

  private static AgentRelay statefulRelay(String unit) {
    AgentRelay relay = relay(WeatherTeam.WEATHER_AGENT_STATEFUL);
    relay.createSession(APP, USER, SESSION, Map.of(WeatherTools.UNIT_PREFERENCE_KEY, unit));
    return relay;
  }

  private static Map<String, Object> state(AgentRelay relay) {
    return relay.getSession(APP, USER, SESSION).getState();
  }

  @Test
  void testWeatherInCelsius() {
    AgentRelay relay = statefulRelay("Celsius");

    String reply = relay.runTurn("What's the weather in London?", APP, USER, SESSION);

    assertTrue(reply.contains("15°C"), reply);
    assertEquals("London", state(relay).get(WeatherTools.LAST_CITY_KEY));
    assertEquals(reply, state(relay).get(WeatherTeam.LAST_WEATHER_REPORT_KEY));
  }

  @Test
  void testPreferenceChangeBetweenTurns() {
    AgentRelay relay = statefulRelay("Celsius");
    relay.runTurn("What's the weather in London?", APP, USER, SESSION);

    relay.applyStateWrite(APP, USER, SESSION, Map.of(WeatherTools.UNIT_PREFERENCE_KEY, "Fahrenheit"));
    String reply = relay.runTurn("Tell me the weather in New York.", APP, USER, SESSION);

    assertTrue(reply.contains("77°F"), reply);
    assertEquals("New York", state(relay).get(WeatherTools.LAST_CITY_KEY));
    assertEquals(reply, state(relay).get(WeatherTeam.LAST_WEATHER_REPORT_KEY));
  }

  @Test
  void testGreetingIsDelegated() {
    AgentRelay relay = statefulRelay("Celsius");

    assertEquals("Hello there!", relay.runTurn("Hi!", APP, USER, SESSION));
    assertEquals("Hello, Ada!", relay.runTurn("Hi, I'm Ada", APP, USER, SESSION));
    assertFalse(state(relay).containsKey(WeatherTeam.LAST_WEATHER_REPORT_KEY));
  }

  @Test
  void testUnknownCityLeavesStateUntouched() {
    AgentRelay relay = statefulRelay("Celsius");
    Map<String, Object> before = new HashMap<>(state(relay));

    String reply = relay.runTurn("What's the weather in Paris?", APP, USER, SESSION);

    assertTrue(reply.startsWith("I'm sorry"), reply);
    assertTrue(reply.contains("Paris"), reply);
    assertEquals(before, state(relay));
  }

  @Test
  void testFarewellKeepsLastReport() {
    AgentRelay relay = statefulRelay("Celsius");
    String report = relay.runTurn("Tell me the weather in Tokyo", APP, USER, SESSION);

    assertEquals("Goodbye! Have a great day.", relay.runTurn("Thanks, bye!", APP, USER, SESSION));
    assertEquals(report, state(relay).get(WeatherTeam.LAST_WEATHER_REPORT_KEY));
  }

  @Test
  void testBasicCoordinator() {
    AgentRelay relay = relay(WeatherTeam.WEATHER_AGENT_V1);
    Session session = relay.createSession(APP, USER, SESSION);

    assertEquals("The weather in London is cloudy with a temperature of 15°C (Celsius).",
        relay.runTurn("What is the weather like in London?", APP, USER, SESSION));
    assertTrue(relay.runTurn("How about Paris?", APP, USER, SESSION).contains("no weather data for Paris"));
    assertEquals(relay.getOptions().getDeclineText(), relay.runTurn("Hello there!", APP, USER, SESSION));
    assertEquals(session.getState(), state(relay));
  }

  @Test
  void testTeamCoordinator() {
    AgentRelay relay = relay(WeatherTeam.WEATHER_AGENT_V2);
    relay.createSession(APP, USER, SESSION);

    assertEquals("Hello there!", relay.runTurn("Hello there!", APP, USER, SESSION));
    assertTrue(relay.runTurn("What is the weather in New York?", APP, USER, SESSION).contains("25°C"));
    assertEquals("Goodbye! Have a great day.", relay.runTurn("Thanks, bye!", APP, USER, SESSION));
    assertTrue(state(relay).isEmpty());
  }
}
