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

import dev.agentrelay.ai.Handler;
import dev.agentrelay.ai.ToolDefinition;

/**
 * InferenceRequest is everything an {@link InferenceEngine} sees when asked to
 * decide a turn: the utterance, the session state snapshot, and the schema of
 * the active handler (its instruction, its tools and its delegates).
 */
public class InferenceRequest {

  private final String utterance;
  private final Map<String, Object> state;
  private final String handlerName;
  private final String instruction;
  private final List<ToolDefinition> tools;
  private final List<ToolDefinition> delegates;

  /**
   * Creates a new InferenceRequest.
   *
   * @param utterance
   *            the user utterance
   * @param state
   *            the session state snapshot
   * @param handlerName
   *            the active handler
   * @param instruction
   *            the active handler's instruction
   * @param tools
   *            the tools the active handler may invoke
   * @param delegates
   *            the specialists the active handler may delegate to
   */
  public InferenceRequest(String utterance, Map<String, Object> state, String handlerName, String instruction,
      List<ToolDefinition> tools, List<ToolDefinition> delegates) {
    this.utterance = utterance;
    this.state = state != null
        ? Collections.unmodifiableMap(new LinkedHashMap<>(state))
        : Collections.emptyMap();
    this.handlerName = handlerName;
    this.instruction = instruction;
    this.tools = tools != null ? List.copyOf(tools) : List.of();
    this.delegates = delegates != null ? List.copyOf(delegates) : List.of();
  }

  /**
   * Creates the request for a handler.
   *
   * @param handler
   *            the active handler
   * @param utterance
   *            the user utterance
   * @param state
   *            the session state snapshot
   * @return the request
   */
  public static InferenceRequest forHandler(Handler handler, String utterance, Map<String, Object> state) {
    return new InferenceRequest(utterance, state, handler.getName(), handler.getInstruction(),
        handler.getToolDefinitions(), handler.getDelegateDefinitions());
  }

  public String getUtterance() {
    return utterance;
  }

  public Map<String, Object> getState() {
    return state;
  }

  public String getHandlerName() {
    return handlerName;
  }

  public String getInstruction() {
    return instruction;
  }

  public List<ToolDefinition> getTools() {
    return tools;
  }

  public List<ToolDefinition> getDelegates() {
    return delegates;
  }
}
