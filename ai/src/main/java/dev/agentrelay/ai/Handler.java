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

package dev.agentrelay.ai;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.agentrelay.core.Action;
import dev.agentrelay.core.ActionType;

/**
 * Handler is a bounded-capability responder built from a
 * {@link HandlerConfig}. It exposes its ordered tool allow-list and, for a
 * coordinator, the specialists it may delegate to.
 *
 * <p>
 * When offered to an inference engine, a specialist is described as a tool
 * definition via {@link #asDefinition()}, so the engine can pick it the same
 * way it picks a tool.
 */
public class Handler implements Action {

  private final HandlerConfig config;
  private final Map<String, Tool<?>> tools;
  private final Map<String, Handler> subHandlers;

  /**
   * Creates a new Handler.
   *
   * @param config
   *            the handler configuration
   * @throws IllegalArgumentException
   *             if two tools or two sub-handlers share a name
   */
  public Handler(HandlerConfig config) {
    if (config == null || config.getName() == null) {
      throw new IllegalArgumentException("Handler config with a name is required");
    }
    this.config = config;

    Map<String, Tool<?>> toolMap = new LinkedHashMap<>();
    for (Tool<?> tool : config.getTools()) {
      if (toolMap.put(tool.getName(), tool) != null) {
        throw new IllegalArgumentException(
            "Handler '" + config.getName() + "' lists tool '" + tool.getName() + "' twice");
      }
    }
    this.tools = Collections.unmodifiableMap(toolMap);

    Map<String, Handler> subs = new LinkedHashMap<>();
    for (HandlerConfig sub : config.getHandlers()) {
      if (subs.put(sub.getName(), new Handler(sub)) != null) {
        throw new IllegalArgumentException(
            "Handler '" + config.getName() + "' lists sub-handler '" + sub.getName() + "' twice");
      }
    }
    this.subHandlers = Collections.unmodifiableMap(subs);
  }

  @Override
  public String getName() {
    return config.getName();
  }

  @Override
  public ActionType getType() {
    return ActionType.HANDLER;
  }

  @Override
  public String getDescription() {
    return config.getDescription();
  }

  /**
   * Gets the handler configuration.
   *
   * @return the configuration
   */
  public HandlerConfig getConfig() {
    return config;
  }

  public String getIntent() {
    return config.getIntent();
  }

  public String getInstruction() {
    return config.getInstruction();
  }

  /**
   * Gets the output key.
   *
   * @return the output key, or null if final reports are not captured
   */
  public String getOutputKey() {
    return config.getOutputKey();
  }

  /**
   * Gets the allow-list of tool names, in declaration order.
   *
   * @return the tool names
   */
  public List<String> getAllowedToolNames() {
    return new ArrayList<>(tools.keySet());
  }

  /**
   * Checks whether this handler may invoke the named tool.
   *
   * @param toolName
   *            the tool name
   * @return true if the tool is on the allow-list
   */
  public boolean allows(String toolName) {
    return toolName != null && tools.containsKey(toolName);
  }

  /**
   * Gets an allow-listed tool by name.
   *
   * @param toolName
   *            the tool name
   * @return the tool, or null if it is not on the allow-list
   */
  public Tool<?> getTool(String toolName) {
    return toolName != null ? tools.get(toolName) : null;
  }

  /**
   * Gets the allow-listed tools, in declaration order.
   *
   * @return the tools
   */
  public List<Tool<?>> getTools() {
    return new ArrayList<>(tools.values());
  }

  /**
   * Gets the specialists this handler may delegate to.
   *
   * @return the sub-handlers
   */
  public List<Handler> getSubHandlers() {
    return new ArrayList<>(subHandlers.values());
  }

  /**
   * Gets a specialist by name.
   *
   * @param name
   *            the handler name
   * @return the sub-handler, or null if this handler cannot delegate to it
   */
  public Handler getSubHandler(String name) {
    return name != null ? subHandlers.get(name) : null;
  }

  /**
   * Gets the tool definitions of the allow-listed tools.
   *
   * @return the definitions
   */
  public List<ToolDefinition> getToolDefinitions() {
    List<ToolDefinition> definitions = new ArrayList<>();
    for (Tool<?> tool : tools.values()) {
      definitions.add(tool.getDefinition());
    }
    return definitions;
  }

  /**
   * Gets the definitions of the delegation targets.
   *
   * @return the definitions
   */
  public List<ToolDefinition> getDelegateDefinitions() {
    List<ToolDefinition> definitions = new ArrayList<>();
    for (Handler sub : subHandlers.values()) {
      definitions.add(sub.asDefinition());
    }
    return definitions;
  }

  /**
   * Describes this handler as a delegation target.
   *
   * @return the definition
   */
  public ToolDefinition asDefinition() {
    return new ToolDefinition(getName(), getDescription(), Map.of("type", "object"));
  }

  @Override
  public String toString() {
    return "Handler{" + getName() + ", tools=" + tools.keySet() + ", delegates=" + subHandlers.keySet() + "}";
  }
}
