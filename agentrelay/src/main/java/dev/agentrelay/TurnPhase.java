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

/**
 * The phases a turn moves through.
 *
 * <pre>
 * START -&gt; ROUTED -&gt; {SELF_TOOL | DELEGATED_TOOL | DECLINED} -&gt; FINALIZED
 * </pre>
 *
 * A turn may also go straight to FINALIZED from START (session lookup or
 * routing failed) or from ROUTED (cancelled before a tool ran).
 */
public enum TurnPhase {
  START, ROUTED, SELF_TOOL, DELEGATED_TOOL, DECLINED, FINALIZED;

  /**
   * Checks whether a turn in this phase may move to the next one.
   *
   * @param next
   *            the target phase
   * @return true if the transition is allowed
   */
  public boolean canAdvanceTo(TurnPhase next) {
    switch (this) {
      case START :
        return next == ROUTED || next == FINALIZED;
      case ROUTED :
        return next == SELF_TOOL || next == DELEGATED_TOOL || next == DECLINED || next == FINALIZED;
      case SELF_TOOL :
      case DELEGATED_TOOL :
      case DECLINED :
        return next == FINALIZED;
      default :
        return false;
    }
  }
}
