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

package dev.agentrelay.ai.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import dev.agentrelay.ai.Handler;
import dev.agentrelay.ai.HandlerConfig;
import dev.agentrelay.ai.Tool;
import dev.agentrelay.ai.ToolResult;

final class RoutingFixtures {

  private RoutingFixtures() {
  }

  static Tool<Map<String, Object>> tool(String name) {
    return Tool.<Map<String, Object>>builder().name(name).description("Tool " + name)
        .handler((ctx, args) -> ToolResult.report(name)).build();
  }

  static List<Tool<?>> tools(String... names) {
    List<Tool<?>> tools = new ArrayList<>();
    for (String name : names) {
      tools.add(tool(name));
    }
    return tools;
  }

  /** A coordinator with get_weather, delegating to greeting_agent and farewell_agent. */
  static Handler team() {
    HandlerConfig greeting = HandlerConfig.builder().name("greeting_agent").intent("greeting")
        .tools(tools("say_hello")).build();
    HandlerConfig farewell = HandlerConfig.builder().name("farewell_agent").intent("farewell")
        .tools(tools("say_goodbye")).build();
    return new Handler(HandlerConfig.builder().name("weather_agent").intent("weather").tools(tools("get_weather"))
        .handlers(List.of(greeting, farewell)).build());
  }
}
