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

import static dev.agentrelay.ai.routing.RoutingFixtures.tools;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import dev.agentrelay.ai.CapabilityException;
import dev.agentrelay.ai.Handler;
import dev.agentrelay.ai.HandlerConfig;
import dev.agentrelay.core.ErrorKind;

/** Unit tests for CapabilityTable. */
class CapabilityTableTest {

  @Test
  void testRowsPerIntent() {
    CapabilityTable table = CapabilityTable.from(RoutingFixtures.team());

    assertEquals(3, table.getCapabilities().size());
    assertEquals("weather_agent", table.getCapability("weather").getHandler().getName());
    assertEquals(List.of("say_hello"), table.getCapability("greeting").getAllowedTools());
    assertEquals(List.of("say_goodbye"), table.getCapability("farewell").getAllowedTools());
    assertNull(table.getCapability("shopping"));
  }

  @Test
  void testFindDelegate() {
    CapabilityTable table = CapabilityTable.from(RoutingFixtures.team());

    assertEquals("farewell_agent", table.findDelegate("farewell_agent").getName());
    assertNull(table.findDelegate("weather_agent"));
    assertNull(table.findDelegate("shopping_agent"));
    assertNull(table.findDelegate(null));
  }

  @Test
  void testRequireAllowed() {
    CapabilityTable table = CapabilityTable.from(RoutingFixtures.team());
    Handler greeting = table.findDelegate("greeting_agent");

    assertEquals("say_hello", table.requireAllowed(greeting, "say_hello").getName());

    CapabilityException e = assertThrows(CapabilityException.class,
        () -> table.requireAllowed(greeting, "get_weather"));
    assertEquals(ErrorKind.CAPABILITY, e.getKind());
    assertEquals("greeting_agent", e.getHandlerName());
    assertEquals("get_weather", e.getToolName());
  }

  @Test
  void testNestedDelegationRejected() {
    HandlerConfig leaf = HandlerConfig.builder().name("leaf").build();
    HandlerConfig middle = HandlerConfig.builder().name("middle").handlers(List.of(leaf)).build();
    Handler root = new Handler(HandlerConfig.builder().name("root").handlers(List.of(middle)).build());

    assertThrows(CapabilityException.class, () -> CapabilityTable.from(root));
  }

  @Test
  void testDuplicateIntentRejected() {
    HandlerConfig a = HandlerConfig.builder().name("a").intent("greeting").tools(tools("say_hello")).build();
    HandlerConfig b = HandlerConfig.builder().name("b").intent("greeting").build();
    Handler root = new Handler(HandlerConfig.builder().name("root").handlers(List.of(a, b)).build());

    assertThrows(CapabilityException.class, () -> CapabilityTable.from(root));
  }

  @Test
  void testSubHandlerNamedLikeRootRejected() {
    HandlerConfig twin = HandlerConfig.builder().name("root").intent("other").build();
    Handler root = new Handler(HandlerConfig.builder().name("root").handlers(List.of(twin)).build());

    assertThrows(CapabilityException.class, () -> CapabilityTable.from(root));
  }
}
