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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import dev.agentrelay.ai.ToolResult;
import dev.agentrelay.ai.routing.Route;
import dev.agentrelay.ai.routing.RoutingDecision;
import dev.agentrelay.ai.session.Session;
import dev.agentrelay.ai.session.SessionKey;

/**
 * Turn is the record of one conversation turn: the utterance, the session
 * snapshot it was routed against, the routing decision, the tool result and
 * the final reply. Turns are never persisted.
 *
 * <p>
 * Phase changes follow {@link TurnPhase#canAdvanceTo(TurnPhase)}; any other
 * transition throws {@link IllegalStateException}.
 */
public class Turn {

  /** How a finalized turn ended. */
  public enum Outcome {
    SUCCESS, FAILURE, DECLINED, INFERENCE_ERROR, TIMEOUT, CAPABILITY_ERROR, SESSION_ERROR, CANCELLED;

    /**
     * Returns the lower-case name used in metrics.
     *
     * @return the metric value
     */
    public String getValue() {
      return name().toLowerCase();
    }
  }

  private final SessionKey sessionKey;
  private final String utterance;
  private final List<TurnPhase> history = new ArrayList<>();

  private TurnPhase phase = TurnPhase.START;
  private Session session;
  private Route route;
  private ToolResult toolResult;
  private Map<String, Object> pendingWrite = Collections.emptyMap();
  private String finalText;
  private Outcome outcome;
  private Throwable error;

  /**
   * Creates a new Turn in phase {@link TurnPhase#START}.
   *
   * @param sessionKey
   *            the session the turn belongs to
   * @param utterance
   *            the user utterance
   */
  public Turn(SessionKey sessionKey, String utterance) {
    this.sessionKey = sessionKey;
    this.utterance = utterance;
    history.add(TurnPhase.START);
  }

  /**
   * Moves the turn to the next phase.
   *
   * @param next
   *            the target phase
   * @throws IllegalStateException
   *             if the transition is not allowed
   */
  synchronized void advance(TurnPhase next) {
    if (!phase.canAdvanceTo(next)) {
      throw new IllegalStateException("Turn cannot move from " + phase + " to " + next);
    }
    phase = next;
    history.add(next);
  }

  synchronized void routed(Route route) {
    advance(TurnPhase.ROUTED);
    this.route = route;
  }

  synchronized void dispatched() {
    if (route.isDecline()) {
      advance(TurnPhase.DECLINED);
    } else {
      advance(route.isDelegated() ? TurnPhase.DELEGATED_TOOL : TurnPhase.SELF_TOOL);
    }
  }

  synchronized void finish(Outcome outcome, String finalText, Throwable error) {
    advance(TurnPhase.FINALIZED);
    this.outcome = outcome;
    this.finalText = finalText;
    this.error = error;
  }

  synchronized void setSession(Session session) {
    this.session = session;
  }

  synchronized void setToolResult(ToolResult toolResult) {
    this.toolResult = toolResult;
  }

  synchronized void setPendingWrite(Map<String, Object> pendingWrite) {
    this.pendingWrite = pendingWrite;
  }

  public SessionKey getSessionKey() {
    return sessionKey;
  }

  public String getUtterance() {
    return utterance;
  }

  public synchronized TurnPhase getPhase() {
    return phase;
  }

  /**
   * Gets the phases this turn went through, starting with
   * {@link TurnPhase#START}.
   *
   * @return the phase history
   */
  public synchronized List<TurnPhase> getPhaseHistory() {
    return List.copyOf(history);
  }

  public synchronized boolean isFinalized() {
    return phase == TurnPhase.FINALIZED;
  }

  /**
   * Gets the session snapshot the turn was routed against.
   *
   * @return the snapshot, or null if the session could not be loaded
   */
  public synchronized Session getSession() {
    return session;
  }

  /**
   * Gets the routing decision.
   *
   * @return the decision, or null if routing did not complete
   */
  public synchronized RoutingDecision getDecision() {
    return route != null ? route.getDecision() : null;
  }

  /**
   * Gets the name of the handler that resolved the turn.
   *
   * @return the handler name, or null for a decline or a failed routing
   */
  public synchronized String getHandlerName() {
    return route != null && route.getHandler() != null ? route.getHandler().getName() : null;
  }

  /**
   * Gets the name of the invoked tool.
   *
   * @return the tool name, or null if no tool was invoked
   */
  public synchronized String getToolName() {
    return route != null && route.getTool() != null ? route.getTool().getName() : null;
  }

  public synchronized ToolResult getToolResult() {
    return toolResult;
  }

  /**
   * Gets the state write committed at the end of the turn: the tool's write
   * followed by the output-key capture.
   *
   * @return the write, empty if nothing was committed
   */
  public synchronized Map<String, Object> getPendingWrite() {
    return pendingWrite;
  }

  public synchronized String getFinalText() {
    return finalText;
  }

  public synchronized Outcome getOutcome() {
    return outcome;
  }

  /**
   * Gets the error that ended the turn.
   *
   * @return the error, or null if the turn produced a reply normally
   */
  public synchronized Throwable getError() {
    return error;
  }

  synchronized Route getRoute() {
    return route;
  }

  @Override
  public synchronized String toString() {
    return "Turn{" + sessionKey + ", phase=" + phase + ", decision=" + getDecision() + ", outcome=" + outcome + "}";
  }
}
