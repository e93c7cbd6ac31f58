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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import dev.agentrelay.ai.Handler;
import dev.agentrelay.ai.Tool;

/**
 * Route is the outcome of routing one turn: the decision, and for a non-decline
 * decision the resolved handler, the allow-listed tool and its arguments.
 */
public final class Route {

  private static final Route DECLINE = new Route(RoutingDecision.decline(), null, null, null);

  private final RoutingDecision decision;
  private final Handler handler;
  private final Tool<?> tool;
  private final Map<String, Object> arguments;

  private Route(RoutingDecision decision, Handler handler, Tool<?> tool, Map<String, Object> arguments) {
    this.decision = decision;
    this.handler = handler;
    this.tool = tool;
    this.arguments = arguments != null
        ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
        : Collections.emptyMap();
  }

  /**
   * Creates a route where the coordinator invokes its own tool.
   *
   * @param coordinator
   *            the coordinator
   * @param tool
   *            the allow-listed tool
   * @param arguments
   *            the tool arguments
   * @return the route
   */
  public static Route self(Handler coordinator, Tool<?> tool, Map<String, Object> arguments) {
    return new Route(RoutingDecision.handleSelf(tool.getName()), coordinator, tool, arguments);
  }

  /**
   * Creates a route where a specialist invokes one of its tools.
   *
   * @param specialist
   *            the specialist
   * @param tool
   *            the allow-listed tool
   * @param arguments
   *            the tool arguments
   * @return the route
   */
  public static Route delegated(Handler specialist, Tool<?> tool, Map<String, Object> arguments) {
    return new Route(RoutingDecision.delegate(specialist.getName()), specialist, tool, arguments);
  }

  /**
   * Returns the decline route.
   *
   * @return the route
   */
  public static Route decline() {
    return DECLINE;
  }

  public RoutingDecision getDecision() {
    return decision;
  }

  /**
   * Gets the handler that resolves the turn.
   *
   * @return the handler, or null for a decline
   */
  public Handler getHandler() {
    return handler;
  }

  /**
   * Gets the tool to invoke.
   *
   * @return the tool, or null for a decline
   */
  public Tool<?> getTool() {
    return tool;
  }

  public Map<String, Object> getArguments() {
    return arguments;
  }

  public boolean isDecline() {
    return decision.isDecline();
  }

  public boolean isDelegated() {
    return decision.getKind() == RoutingDecision.Kind.DELEGATE;
  }

  @Override
  public String toString() {
    return "Route{" + decision + (tool != null ? ", tool=" + tool.getName() + ", args=" + arguments : "") + "}";
  }
}
