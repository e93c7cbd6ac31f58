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

import java.util.Objects;

/**
 * RoutingDecision records how a turn is resolved: the coordinator handles it
 * with one of its own tools, delegates it to a specialist, or declines it.
 *
 * <p>
 * A decision is produced once per turn and is immutable.
 */
public final class RoutingDecision {

  /** The variants of a routing decision. */
  public enum Kind {
    /** The coordinator invokes one of its own tools. */
    HANDLE_SELF,
    /** A specialist resolves the turn with one of its tools. */
    DELEGATE,
    /** No handler applies; no tool is invoked. */
    DECLINE
  }

  private static final RoutingDecision DECLINE = new RoutingDecision(Kind.DECLINE, null, null);

  private final Kind kind;
  private final String toolName;
  private final String handlerId;

  private RoutingDecision(Kind kind, String toolName, String handlerId) {
    this.kind = kind;
    this.toolName = toolName;
    this.handlerId = handlerId;
  }

  /**
   * Creates a decision for the coordinator to invoke its own tool.
   *
   * @param toolName
   *            the tool name
   * @return the decision
   */
  public static RoutingDecision handleSelf(String toolName) {
    return new RoutingDecision(Kind.HANDLE_SELF, Objects.requireNonNull(toolName, "toolName"), null);
  }

  /**
   * Creates a decision to delegate to a specialist.
   *
   * @param handlerId
   *            the specialist name
   * @return the decision
   */
  public static RoutingDecision delegate(String handlerId) {
    return new RoutingDecision(Kind.DELEGATE, null, Objects.requireNonNull(handlerId, "handlerId"));
  }

  /**
   * Returns the decline decision.
   *
   * @return the decision
   */
  public static RoutingDecision decline() {
    return DECLINE;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Gets the tool name of a {@link Kind#HANDLE_SELF} decision.
   *
   * @return the tool name, or null for other kinds
   */
  public String getToolName() {
    return toolName;
  }

  /**
   * Gets the specialist of a {@link Kind#DELEGATE} decision.
   *
   * @return the handler id, or null for other kinds
   */
  public String getHandlerId() {
    return handlerId;
  }

  public boolean isDecline() {
    return kind == Kind.DECLINE;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RoutingDecision)) {
      return false;
    }
    RoutingDecision that = (RoutingDecision) o;
    return kind == that.kind && Objects.equals(toolName, that.toolName) && Objects.equals(handlerId, that.handlerId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, toolName, handlerId);
  }

  @Override
  public String toString() {
    switch (kind) {
      case HANDLE_SELF :
        return "HandleSelf(" + toolName + ")";
      case DELEGATE :
        return "Delegate(" + handlerId + ")";
      default :
        return "Decline";
    }
  }
}
