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

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonProperty;

import dev.agentrelay.ai.Tool;
import dev.agentrelay.ai.ToolResult;

/**
 * Factory for the greeting and farewell tools. Neither writes session state.
 */
public final class GreetingTools {

  private static final Logger logger = LoggerFactory.getLogger(GreetingTools.class);

  public static final String SAY_HELLO = "say_hello";
  public static final String SAY_GOODBYE = "say_goodbye";

  static final String GENERIC_GREETING = "Hello there!";
  static final String FAREWELL = "Goodbye! Have a great day.";

  /** Input of {@code say_hello}. */
  public static class GreetingInput {
    @JsonProperty("name")
    private String name;

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }
  }

  private GreetingTools() {
  }

  /**
   * Creates the greeting tool.
   *
   * @return the tool
   */
  public static Tool<GreetingInput> sayHello() {
    return Tool.<GreetingInput>builder().name(SAY_HELLO)
        .description("Provides a simple greeting, addressing the user by name if one is given.")
        .inputSchema(Map.of("type", "object", "properties",
            Map.of("name", Map.of("type", "string", "description", "The name of the person to greet"))))
        .inputClass(GreetingInput.class).handler((ctx, input) -> {
          logger.debug("{} called with name: {}", SAY_HELLO, input.getName());
          return ToolResult.report(greet(input.getName()));
        }).build();
  }

  /**
   * Creates the farewell tool. Any arguments are ignored.
   *
   * @return the tool
   */
  public static Tool<Map<String, Object>> sayGoodbye() {
    return Tool.<Map<String, Object>>builder().name(SAY_GOODBYE)
        .description("Provides a simple farewell message to conclude the conversation.").handler((ctx, args) -> {
          logger.debug("{} called", SAY_GOODBYE);
          return ToolResult.report(FAREWELL);
        }).build();
  }

  static String greet(String name) {
    if (name == null || name.trim().isEmpty()) {
      return GENERIC_GREETING;
    }
    return "Hello, " + name.trim() + "!";
  }
}
