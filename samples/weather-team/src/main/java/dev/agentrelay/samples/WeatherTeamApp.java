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

package dev.agentrelay.samples;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.agentrelay.AgentRelay;
import dev.agentrelay.AgentRelayOptions;
import dev.agentrelay.ai.session.Session;
import dev.agentrelay.plugins.weather.WeatherPlugin;
import dev.agentrelay.plugins.weather.WeatherTeam;
import dev.agentrelay.plugins.weather.WeatherTools;

/**
 * Weather Team Application.
 *
 * <p>
 * This sample walks through three conversations:
 * <ul>
 * <li>A single weather coordinator answering weather questions</li>
 * <li>A coordinator that delegates greetings and farewells to
 * specialists</li>
 * <li>A stateful coordinator that formats temperatures in the unit stored in
 * the session and remembers its last report</li>
 * </ul>
 *
 * <p>
 * To run: mvn exec:java -pl samples/weather-team
 */
public class WeatherTeamApp {

  private static final Logger logger = LoggerFactory.getLogger(WeatherTeamApp.class);

  private final AgentRelayOptions options;

  public WeatherTeamApp(AgentRelayOptions options) {
    this.options = options;
  }

  private AgentRelay relay(String coordinator) {
    return AgentRelay.builder().options(options).plugin(WeatherPlugin.create())
        .inferenceEngine(WeatherTeam.rules()).rootHandler(coordinator).build();
  }

  private static void ask(AgentRelay relay, Session session, String query) {
    System.out.println("\n>>> User Query: " + query);
    String reply = relay.runTurn(query, session.getAppName(), session.getUserId(), session.getId());
    System.out.println("<<< Agent Response: " + reply);
  }

  /** Weather questions against the single-tool coordinator. */
  public void runBasicConversation() {
    System.out.println("\n=== Basic weather agent ===");
    AgentRelay relay = relay(WeatherTeam.WEATHER_AGENT_V1);
    Session session = relay.createSession("weather_tutorial_app", "user_1", "session_001");

    for (String query : List.of("What is the weather like in London?", "How about Paris?",
        "Tell me the weather in New York")) {
      ask(relay, session, query);
    }
  }

  /** Greetings, weather and farewells against the delegating coordinator. */
  public void runTeamConversation() {
    System.out.println("\n=== Weather agent team ===");
    AgentRelay relay = relay(WeatherTeam.WEATHER_AGENT_V2);
    Session session = relay.createSession("weather_tutorial_agent_team", "user_1_agent_team",
        "session_001_agent_team");

    for (String query : List.of("Hello there!", "What is the weather in New York?", "Tell me the weather in London",
        "Thanks, bye!")) {
      ask(relay, session, query);
    }
  }

  /** Unit preference changes between turns and the captured report. */
  public void runStatefulConversation() {
    System.out.println("\n=== Stateful weather agent ===");
    AgentRelay relay = relay(WeatherTeam.WEATHER_AGENT_STATEFUL);
    Session session = relay.createSession("weather_tutorial_session_state", "user_state_demo",
        "session_state_demo_001", Map.of(WeatherTools.UNIT_PREFERENCE_KEY, "Celsius"));
    System.out.println("Initial state: " + session.getState());

    ask(relay, session, "What's the weather in London?");

    System.out.println("\n--- Switching unit preference to Fahrenheit ---");
    Session updated = relay.applyStateWrite(session.getAppName(), session.getUserId(), session.getId(),
        Map.of(WeatherTools.UNIT_PREFERENCE_KEY, "Fahrenheit"));
    logger.info("Stored preference: {}", updated.getStateValue(WeatherTools.UNIT_PREFERENCE_KEY));

    ask(relay, session, "Tell me the weather in New York.");
    ask(relay, session, "Hi!");

    Session last = relay.getSession(session.getAppName(), session.getUserId(), session.getId());
    System.out.println("\n--- Final session state ---");
    System.out.println("Temperature unit: " + last.getStateValue(WeatherTools.UNIT_PREFERENCE_KEY));
    System.out.println("Last weather report: " + last.getStateValue(WeatherTeam.LAST_WEATHER_REPORT_KEY));
    System.out.println("Last city checked: " + last.getStateValue(WeatherTools.LAST_CITY_KEY));
  }

  public static void main(String[] args) {
    WeatherTeamApp app = new WeatherTeamApp(AgentRelayOptions.builder().build());
    app.runBasicConversation();
    app.runTeamConversation();
    app.runStatefulConversation();
  }
}
