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

import java.util.Map;

import org.junit.jupiter.api.Test;

import dev.agentrelay.ai.ToolContext;
import dev.agentrelay.ai.ToolResult;

/** Unit tests for the greeting and farewell tools. */
class GreetingToolsTest {

  private final ToolContext ctx = ToolContext.ofState(Map.of());

  @Test
  void testSayHelloWithName() {
    ToolResult result = GreetingTools.sayHello().invoke(ctx, Map.of("name", "Alice"));

    assertEquals("Hello, Alice!", result.getReport());
    assertTrue(result.getStateWrite().isEmpty());
  }

  @Test
  void testSayHelloWithoutName() {
    assertEquals("Hello there!", GreetingTools.sayHello().invoke(ctx, Map.of()).getReport());
    assertEquals("Hello there!", GreetingTools.sayHello().invoke(ctx, Map.of("name", "  ")).getReport());
  }

  @Test
  void testSayGoodbyeIgnoresArguments() {
    assertEquals("Goodbye! Have a great day.", GreetingTools.sayGoodbye().invoke(ctx, null).getReport());
    assertEquals("Goodbye! Have a great day.",
        GreetingTools.sayGoodbye().invoke(ctx, Map.of("name", "Bob")).getReport());
  }
}
