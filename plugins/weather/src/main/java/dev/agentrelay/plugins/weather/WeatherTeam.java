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

import java.util.List;

import dev.agentrelay.ai.HandlerConfig;
import dev.agentrelay.ai.Tool;
import dev.agentrelay.ai.routing.RuleBasedInferenceEngine;

/**
 * The weather team: three coordinators of increasing capability, the greeting
 * and farewell specialists they delegate to, and the rules that stand in for a
 * language model when routing their turns.
 */
public final class WeatherTeam {

  /** Weather only, no delegates. */
  public static final String WEATHER_AGENT_V1 = "weather_agent_v1";

  /** Weather plus greeting and farewell delegates. */
  public static final String WEATHER_AGENT_V2 = "weather_agent_v2";

  /** Unit-aware weather with delegates; captures its reports. */
  public static final String WEATHER_AGENT_STATEFUL = "weather_agent_v4_stateful";

  public static final String GREETING_AGENT = "greeting_agent";
  public static final String FAREWELL_AGENT = "farewell_agent";

  /** Session key the stateful coordinator captures its final reply under. */
  public static final String LAST_WEATHER_REPORT_KEY = "last_weather_report";

  private static final String CITY = "(?<city>[\\p{L}][\\p{L} .'-]*?)\\s*[?.!]*\\s*$";
  static final String WEATHER_QUERY = "(?i)\\bweather\\b.*?\\bin\\s+" + CITY;
  static final String FOLLOW_UP_QUERY = "(?i)^\\s*(?:how|what)\\s+about\\s+" + CITY;
  static final String GREETING = "(?i)^\\s*(?:hi|hello|hey|greetings|good\\s+(?:morning|afternoon|evening))\\b";
  static final String FAREWELL = "(?i)\\b(?:bye|goodbye|see\\s+you|farewell)\\b";
  static final String INTRODUCTION = "(?i)\\b(?:i\\s+am|i'm|my\\s+name\\s+is|this\\s+is)\\s+(?<name>\\p{L}+)";

  private WeatherTeam() {
  }

  public static HandlerConfig greetingAgent(Tool<?> sayHello) {
    return HandlerConfig.builder().name(GREETING_AGENT).intent("greeting")
        .description("Handles simple greetings and hellos using the 'say_hello' tool.")
        .instruction("You are the Greeting Agent. Your ONLY task is to provide a friendly greeting to the user. "
            + "Use the 'say_hello' tool to generate the greeting. "
            + "If the user provides their name, make sure to pass it to the tool.")
        .tools(List.of(sayHello)).build();
  }

  public static HandlerConfig farewellAgent(Tool<?> sayGoodbye) {
    return HandlerConfig.builder().name(FAREWELL_AGENT).intent("farewell")
        .description("Handles simple farewells and goodbyes using the 'say_goodbye' tool.")
        .instruction("You are the Farewell Agent. Your ONLY task is to provide a polite goodbye message "
            + "using the 'say_goodbye' tool.")
        .tools(List.of(sayGoodbye)).build();
  }

  public static HandlerConfig weatherAgentV1(Tool<?> getWeather) {
    return HandlerConfig.builder().name(WEATHER_AGENT_V1).intent("weather")
        .description("Provides weather information for specific cities.")
        .instruction("You are a helpful weather assistant. Use the 'get_weather' tool to find the weather "
            + "for the city the user names. If the tool returns an error, inform the user politely.")
        .tools(List.of(getWeather)).build();
  }

  public static HandlerConfig weatherAgentV2(Tool<?> getWeather, Tool<?> sayHello, Tool<?> sayGoodbye) {
    return HandlerConfig.builder().name(WEATHER_AGENT_V2).intent("weather")
        .description("The main coordinator. Handles weather requests and delegates greetings and farewells.")
        .instruction("You are the main Weather Agent coordinating a team. Use 'get_weather' for weather requests. "
            + "Delegate greetings to 'greeting_agent' and farewells to 'farewell_agent'. "
            + "For anything else, state that you cannot handle it.")
        .tools(List.of(getWeather)).handlers(List.of(greetingAgent(sayHello), farewellAgent(sayGoodbye)))
        .build();
  }

  /**
   * Creates the stateful coordinator. Its successful replies are captured
   * under {@link #LAST_WEATHER_REPORT_KEY}.
   *
   * @param getWeatherStateful
   *            the unit-aware weather tool
   * @param sayHello
   *            the greeting tool
   * @param sayGoodbye
   *            the farewell tool
   * @return the handler configuration
   */
  public static HandlerConfig weatherAgentStateful(Tool<?> getWeatherStateful, Tool<?> sayHello,
      Tool<?> sayGoodbye) {
    return HandlerConfig.builder().name(WEATHER_AGENT_STATEFUL).intent("weather")
        .description("Provides weather in the user's preferred unit, delegates greetings and farewells, "
            + "and saves its report to state.")
        .instruction("You are the main Weather Agent. Provide weather using 'get_weather_stateful'; the tool "
            + "formats the temperature in the unit stored in state. Delegate greetings to 'greeting_agent' "
            + "and farewells to 'farewell_agent'.")
        .tools(List.of(getWeatherStateful)).handlers(List.of(greetingAgent(sayHello), farewellAgent(sayGoodbye)))
        .outputKey(LAST_WEATHER_REPORT_KEY).build();
  }

  /**
   * Builds the rule-based engine that routes the weather team's turns.
   *
   * @return the inference engine
   */
  public static RuleBasedInferenceEngine rules() {
    RuleBasedInferenceEngine.Builder builder = RuleBasedInferenceEngine.builder();
    weatherRules(builder, WEATHER_AGENT_V1, WeatherTools.GET_WEATHER);
    weatherRules(builder, WEATHER_AGENT_V2, WeatherTools.GET_WEATHER);
    delegationRules(builder, WEATHER_AGENT_V2);
    weatherRules(builder, WEATHER_AGENT_STATEFUL, WeatherTools.GET_WEATHER_STATEFUL);
    delegationRules(builder, WEATHER_AGENT_STATEFUL);

    return builder.when(GREETING_AGENT, INTRODUCTION).callTool(GreetingTools.SAY_HELLO, "name")
        .when(GREETING_AGENT, ".*").callTool(GreetingTools.SAY_HELLO)
        .when(FAREWELL_AGENT, ".*").callTool(GreetingTools.SAY_GOODBYE)
        .build();
  }

  private static void weatherRules(RuleBasedInferenceEngine.Builder builder, String coordinator, String tool) {
    builder.when(coordinator, WEATHER_QUERY).callTool(tool, "city")
        .when(coordinator, FOLLOW_UP_QUERY).callTool(tool, "city");
  }

  private static void delegationRules(RuleBasedInferenceEngine.Builder builder, String coordinator) {
    builder.when(coordinator, FAREWELL).delegateTo(FAREWELL_AGENT)
        .when(coordinator, GREETING).delegateTo(GREETING_AGENT);
  }
}
