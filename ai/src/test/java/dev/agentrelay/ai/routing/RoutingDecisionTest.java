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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/** Unit tests for RoutingDecision. */
class RoutingDecisionTest {

  @Test
  void testVariants() {
    RoutingDecision self = RoutingDecision.handleSelf("get_weather");
    RoutingDecision delegate = RoutingDecision.delegate("greeting_agent");

    assertEquals(RoutingDecision.Kind.HANDLE_SELF, self.getKind());
    assertEquals("get_weather", self.getToolName());
    assertNull(self.getHandlerId());
    assertEquals(RoutingDecision.Kind.DELEGATE, delegate.getKind());
    assertEquals("greeting_agent", delegate.getHandlerId());
    assertTrue(RoutingDecision.decline().isDecline());
    assertFalse(self.isDecline());
  }

  @Test
  void testEquality() {
    assertEquals(RoutingDecision.handleSelf("a"), RoutingDecision.handleSelf("a"));
    assertNotEquals(RoutingDecision.handleSelf("a"), RoutingDecision.delegate("a"));
    assertEquals("Delegate(greeting_agent)", RoutingDecision.delegate("greeting_agent").toString());
    assertEquals("Decline", RoutingDecision.decline().toString());
  }

  @Test
  void testNullsRejected() {
    assertThrows(NullPointerException.class, () -> RoutingDecision.handleSelf(null));
    assertThrows(NullPointerException.class, () -> RoutingDecision.delegate(null));
  }
}
