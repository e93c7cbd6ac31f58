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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import dev.agentrelay.ai.session.SessionKey;

/**
 * ToolContext carries the request-scoped inputs of a tool invocation: the
 * session the turn belongs to, the handler that invoked the tool, and the
 * session state snapshot taken at the start of the turn.
 *
 * <p>
 * The snapshot is read-only. A tool that needs to change session state returns
 * a state write in its {@link ToolResult}; the write is committed only after
 * the turn finalizes successfully.
 */
public class ToolContext {

  private final SessionKey sessionKey;
  private final String handlerName;
  private final Map<String, Object> state;

  /**
   * Creates a new ToolContext.
   *
   * @param sessionKey
   *            the session the turn runs against, may be null outside a turn
   * @param handlerName
   *            the handler invoking the tool, may be null
   * @param state
   *            the session state snapshot
   */
  public ToolContext(SessionKey sessionKey, String handlerName, Map<String, Object> state) {
    this.sessionKey = sessionKey;
    this.handlerName = handlerName;
    this.state = state != null
        ? Collections.unmodifiableMap(new LinkedHashMap<>(state))
        : Collections.emptyMap();
  }

  /**
   * Creates a ToolContext with only a state snapshot.
   *
   * @param state
   *            the session state snapshot
   * @return the context
   */
  public static ToolContext ofState(Map<String, Object> state) {
    return new ToolContext(null, null, state);
  }

  /**
   * Returns the session key.
   *
   * @return the session key, or null when invoked outside a turn
   */
  public SessionKey getSessionKey() {
    return sessionKey;
  }

  /**
   * Returns the name of the handler invoking the tool.
   *
   * @return the handler name, or null if not set
   */
  public String getHandlerName() {
    return handlerName;
  }

  /**
   * Returns the read-only session state snapshot.
   *
   * @return the state snapshot
   */
  public Map<String, Object> getState() {
    return state;
  }

  /**
   * Returns a state value rendered as a string.
   *
   * @param key
   *            the state key
   * @param defaultValue
   *            the value to return when the key is absent
   * @return the value, or {@code defaultValue}
   */
  public String getString(String key, String defaultValue) {
    Object value = state.get(key);
    return value != null ? value.toString() : defaultValue;
  }
}
