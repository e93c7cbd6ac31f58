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

package dev.agentrelay.core;

/**
 * ActionType represents the kind of a registered action. Each type corresponds
 * to a different Agent Relay primitive.
 */
public enum ActionType {
  /**
   * A tool that a handler may invoke to resolve a turn.
   */
  TOOL("tool"),

  /**
   * A handler (coordinator or specialist) that owns an allow-list of tools.
   */
  HANDLER("handler");

  private final String value;

  ActionType(String value) {
    this.value = value;
  }

  /**
   * Returns the string value of the action type.
   *
   * @return the action type string value
   */
  public String getValue() {
    return value;
  }

  /**
   * Creates an ActionType from a string value.
   *
   * @param value
   *            the string value
   * @return the corresponding ActionType
   * @throws IllegalArgumentException
   *             if the value doesn't match any ActionType
   */
  public static ActionType fromValue(String value) {
    for (ActionType type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown action type: " + value);
  }

  /**
   * Creates the registry key for an action of this type with the given name.
   *
   * @param name
   *            the action name
   * @return the registry key
   */
  public String keyFromName(String name) {
    return "/" + value + "/" + name;
  }

  @Override
  public String toString() {
    return value;
  }
}
