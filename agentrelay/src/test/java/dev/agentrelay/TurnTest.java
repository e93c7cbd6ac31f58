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

package dev.agentrelay;

import static org.junit.jupiter.api.Assertions.*;

import java.lang.reflect.Modifier;
import java.util.List;

import org.junit.jupiter.api.Test;

import dev.agentrelay.ai.session.SessionKey;

/** Unit tests for Turn and TurnPhase. */
class TurnTest {

  private final Turn turn = new Turn(SessionKey.of("app", "user", "s1"), "hello");

  @Test
  void testStartsInStart() {
    assertEquals(TurnPhase.START, turn.getPhase());
    assertFalse(turn.isFinalized());
    assertNull(turn.getDecision());
    assertTrue(turn.getPendingWrite().isEmpty());
  }

  @Test
  void testHappyPath() {
    turn.advance(TurnPhase.ROUTED);
    turn.advance(TurnPhase.DELEGATED_TOOL);
    turn.advance(TurnPhase.FINALIZED);

    assertTrue(turn.isFinalized());
    assertEquals(List.of(TurnPhase.START, TurnPhase.ROUTED, TurnPhase.DELEGATED_TOOL, TurnPhase.FINALIZED),
        turn.getPhaseHistory());
  }

  @Test
  void testShortcutsToFinalized() {
    assertTrue(TurnPhase.START.canAdvanceTo(TurnPhase.FINALIZED));
    assertTrue(TurnPhase.ROUTED.canAdvanceTo(TurnPhase.FINALIZED));
  }

  @Test
  void testIllegalTransitions() {
    assertThrows(IllegalStateException.class, () -> turn.advance(TurnPhase.SELF_TOOL));

    turn.advance(TurnPhase.ROUTED);
    turn.advance(TurnPhase.DECLINED);
    assertThrows(IllegalStateException.class, () -> turn.advance(TurnPhase.SELF_TOOL));

    turn.advance(TurnPhase.FINALIZED);
    for (TurnPhase phase : TurnPhase.values()) {
      assertThrows(IllegalStateException.class, () -> turn.advance(phase));
    }
    assertEquals(TurnPhase.FINALIZED, turn.getPhase());
  }

  @Test
  void testFinishRecordsOutcome() {
    turn.finish(Turn.Outcome.INFERENCE_ERROR, "sorry", null);

    assertEquals(Turn.Outcome.INFERENCE_ERROR, turn.getOutcome());
    assertEquals("inference_error", turn.getOutcome().getValue());
    assertEquals("sorry", turn.getFinalText());
    assertThrows(IllegalStateException.class, () -> turn.finish(Turn.Outcome.SUCCESS, "again", null));
  }

  @Test
  void testPhaseChangesAreNotPublic() throws Exception {
    assertFalse(Modifier.isPublic(Turn.class.getDeclaredMethod("advance", TurnPhase.class).getModifiers()));
  }
}
