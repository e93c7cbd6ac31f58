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
import java.util.List;
import java.util.Map;

import dev.agentrelay.ai.CapabilityException;
import dev.agentrelay.ai.Handler;
import dev.agentrelay.ai.Tool;

/**
 * CapabilityTable maps each intent category to the handler that serves it and
 * the ordered allow-list of tools that handler may invoke.
 *
 * <p>
 * The table is built from a root handler (the coordinator) and its direct
 * sub-handlers. Delegation is single-level, so a sub-handler that declares
 * sub-handlers of its own is rejected.
 */
public final class CapabilityTable {

  /** One row of the table. */
  public static final class Capability {
    private final String intent;
    private final Handler handler;
    private final List<String> allowedTools;

    Capability(String intent, Handler handler) {
      this.intent = intent;
      this.handler = handler;
      this.allowedTools = List.copyOf(handler.getAllowedToolNames());
    }

    public String getIntent() {
      return intent;
    }

    public Handler getHandler() {
      return handler;
    }

    public List<String> getAllowedTools() {
      return allowedTools;
    }

    @Override
    public String toString() {
      return intent + " -> " + handler.getName() + " " + allowedTools;
    }
  }

  private final Handler root;
  private final Map<String, Capability> byIntent;
  private final Map<String, Capability> byHandler;

  private CapabilityTable(Handler root, Map<String, Capability> byIntent, Map<String, Capability> byHandler) {
    this.root = root;
    this.byIntent = Collections.unmodifiableMap(byIntent);
    this.byHandler = Collections.unmodifiableMap(byHandler);
  }

  /**
   * Builds the table for a coordinator.
   *
   * @param root
   *            the coordinator handler
   * @return the table
   * @throws CapabilityException
   *             if a sub-handler declares its own sub-handlers, or two
   *             handlers share a name or an intent
   */
  public static CapabilityTable from(Handler root) {
    if (root == null) {
      throw new IllegalArgumentException("root handler is required");
    }
    Map<String, Capability> byIntent = new LinkedHashMap<>();
    Map<String, Capability> byHandler = new LinkedHashMap<>();
    add(root, byIntent, byHandler);
    for (Handler sub : root.getSubHandlers()) {
      if (!sub.getSubHandlers().isEmpty()) {
        throw new CapabilityException(
            "handler '" + sub.getName() + "' cannot declare delegates: delegation is single-level", sub.getName(),
            null);
      }
      add(sub, byIntent, byHandler);
    }
    return new CapabilityTable(root, byIntent, byHandler);
  }

  private static void add(Handler handler, Map<String, Capability> byIntent, Map<String, Capability> byHandler) {
    Capability capability = new Capability(handler.getIntent(), handler);
    if (byHandler.containsKey(handler.getName())) {
      throw new CapabilityException("duplicate handler '" + handler.getName() + "'", handler.getName(), null);
    }
    if (byIntent.containsKey(capability.getIntent())) {
      throw new CapabilityException("intent '" + capability.getIntent() + "' is served by both '"
          + byIntent.get(capability.getIntent()).getHandler().getName() + "' and '" + handler.getName() + "'",
          handler.getName(), null);
    }
    byIntent.put(capability.getIntent(), capability);
    byHandler.put(handler.getName(), capability);
  }

  public Handler getRoot() {
    return root;
  }

  /**
   * Gets the capability for an intent category.
   *
   * @param intent
   *            the intent category
   * @return the capability, or null if no handler serves the intent
   */
  public Capability getCapability(String intent) {
    return intent != null ? byIntent.get(intent) : null;
  }

  /**
   * Finds a delegation target of the root by handler name.
   *
   * @param handlerId
   *            the handler name
   * @return the sub-handler, or null if the root cannot delegate to it
   */
  public Handler findDelegate(String handlerId) {
    if (handlerId == null || handlerId.equals(root.getName())) {
      return null;
    }
    Capability capability = byHandler.get(handlerId);
    return capability != null ? capability.getHandler() : null;
  }

  /**
   * Resolves a tool on a handler's allow-list.
   *
   * @param handler
   *            the handler
   * @param toolName
   *            the tool name
   * @return the tool
   * @throws CapabilityException
   *             if the tool is not on the handler's allow-list
   */
  public Tool<?> requireAllowed(Handler handler, String toolName) {
    Tool<?> tool = handler.getTool(toolName);
    if (tool == null) {
      throw CapabilityException.toolNotAllowed(handler.getName(), toolName);
    }
    return tool;
  }

  /**
   * Gets all rows, root first.
   *
   * @return the capabilities
   */
  public List<Capability> getCapabilities() {
    return List.copyOf(byIntent.values());
  }

  @Override
  public String toString() {
    return "CapabilityTable" + byIntent.values();
  }
}
