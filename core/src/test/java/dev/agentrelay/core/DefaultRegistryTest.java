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

package dev.agentrelay.core;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for DefaultRegistry.
 */
@ExtendWith(MockitoExtension.class)
class DefaultRegistryTest {

  private DefaultRegistry registry;

  @Mock
  private Plugin mockPlugin;

  @BeforeEach
  void setUp() {
    registry = new DefaultRegistry();
  }

  private Action action(ActionType type, String name) {
    Action action = mock(Action.class);
    lenient().when(action.getType()).thenReturn(type);
    lenient().when(action.getName()).thenReturn(name);
    lenient().when(action.getKey()).thenReturn(type.keyFromName(name));
    return action;
  }

  @Test
  void testRegisterPlugin() {
    registry.registerPlugin("test-plugin", mockPlugin);

    assertSame(mockPlugin, registry.lookupPlugin("test-plugin"));
    assertEquals(List.of(mockPlugin), registry.listPlugins());
  }

  @Test
  void testRegisterPluginDuplicate() {
    registry.registerPlugin("test-plugin", mockPlugin);

    assertThrows(IllegalStateException.class, () -> registry.registerPlugin("test-plugin", mockPlugin));
  }

  @Test
  void testRegisterAction() {
    Action tool = action(ActionType.TOOL, "get_weather");

    registry.registerAction("/tool/get_weather", tool);

    assertSame(tool, registry.lookupAction("/tool/get_weather"));
    assertSame(tool, registry.lookupAction(ActionType.TOOL, "get_weather"));
  }

  @Test
  void testRegisterActionDuplicate() {
    Action tool = action(ActionType.TOOL, "get_weather");
    registry.registerAction("/tool/get_weather", tool);

    assertThrows(IllegalStateException.class, () -> registry.registerAction("/tool/get_weather", tool));
  }

  @Test
  void testLookupMissingAction() {
    assertNull(registry.lookupAction(ActionType.HANDLER, "nobody"));
  }

  @Test
  void testListActionsByTypePreservesOrder() {
    Action weather = action(ActionType.TOOL, "get_weather");
    Action hello = action(ActionType.TOOL, "say_hello");
    Action greeter = action(ActionType.HANDLER, "greeting_agent");

    registry.registerAction(weather.getKey(), weather);
    registry.registerAction(greeter.getKey(), greeter);
    registry.registerAction(hello.getKey(), hello);

    assertEquals(List.of(weather, hello), registry.listActions(ActionType.TOOL));
    assertEquals(List.of(greeter), registry.listActions(ActionType.HANDLER));
    assertEquals(3, registry.listActions().size());
  }

  @Test
  void testActionRegisterDefaultMethodUsesKey() {
    Action tool = action(ActionType.TOOL, "say_goodbye");
    doCallRealMethod().when(tool).register(registry);

    tool.register(registry);

    assertSame(tool, registry.lookupAction("/tool/say_goodbye"));
  }
}
