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
 * Action is the common contract of everything that can be registered in a
 * {@link Registry}: tools and handlers.
 */
public interface Action {

  /**
   * Returns the name of the action. Names are unique per action type.
   *
   * @return the action name
   */
  String getName();

  /**
   * Returns the type of the action.
   *
   * @return the action type
   */
  ActionType getType();

  /**
   * Returns a human-readable description. Inference engines use it to decide
   * when the action applies.
   *
   * @return the description, may be null
   */
  String getDescription();

  /**
   * Returns the registry key of this action.
   *
   * @return the key, e.g. {@code /tool/get_weather}
   */
  default String getKey() {
    return getType().keyFromName(getName());
  }

  /**
   * Registers this action with the given registry.
   *
   * @param registry
   *            the registry
   */
  default void register(Registry registry) {
    registry.registerAction(getKey(), this);
  }
}
