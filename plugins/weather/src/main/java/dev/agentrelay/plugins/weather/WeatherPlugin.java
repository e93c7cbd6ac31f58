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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.agentrelay.ai.Handler;
import dev.agentrelay.ai.Tool;
import dev.agentrelay.core.Action;
import dev.agentrelay.core.Plugin;

/**
 * Weather plugin: contributes the weather, greeting and farewell tools and the
 * weather team's handlers.
 *
 * <pre>{@code
 * AgentRelay relay = AgentRelay.builder().plugin(WeatherPlugin.create()).inferenceEngine(WeatherTeam.rules())
 *     .rootHandler(WeatherTeam.WEATHER_AGENT_V2).build();
 * }</pre>
 */
public class WeatherPlugin implements Plugin {

  private static final Logger logger = LoggerFactory.getLogger(WeatherPlugin.class);
  public static final String PROVIDER = "weather";

  private final WeatherTable table;

  /**
   * Creates a new WeatherPlugin.
   *
   * @param table
   *            the known cities
   */
  public WeatherPlugin(WeatherTable table) {
    this.table = table;
  }

  /**
   * Creates a WeatherPlugin backed by the default city table.
   *
   * @return the plugin
   */
  public static WeatherPlugin create() {
    return new WeatherPlugin(WeatherTable.defaultTable());
  }

  @Override
  public String getName() {
    return PROVIDER;
  }

  @Override
  public List<Action> init() {
    Tool<WeatherTools.WeatherInput> getWeather = WeatherTools.getWeather(table);
    Tool<WeatherTools.WeatherInput> getWeatherStateful = WeatherTools.getWeatherStateful(table);
    Tool<GreetingTools.GreetingInput> sayHello = GreetingTools.sayHello();
    Tool<Map<String, Object>> sayGoodbye = GreetingTools.sayGoodbye();

    List<Action> actions = new ArrayList<>();
    actions.add(getWeather);
    actions.add(getWeatherStateful);
    actions.add(sayHello);
    actions.add(sayGoodbye);

    actions.add(new Handler(WeatherTeam.greetingAgent(sayHello)));
    actions.add(new Handler(WeatherTeam.farewellAgent(sayGoodbye)));
    actions.add(new Handler(WeatherTeam.weatherAgentV1(getWeather)));
    actions.add(new Handler(WeatherTeam.weatherAgentV2(getWeather, sayHello, sayGoodbye)));
    actions.add(new Handler(WeatherTeam.weatherAgentStateful(getWeatherStateful, sayHello, sayGoodbye)));

    logger.info("Weather plugin provides {} cities, {} actions", table.getEntries().size(), actions.size());
    return actions;
  }
}
