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

import java.util.List;

/**
 * Registry holds all registered actions and plugins, and provides methods to
 * register, query, and look them up.
 */
public interface Registry {

  /**
   * Records the plugin in the registry.
   *
   * @param name
   *            the plugin name
   * @param plugin
   *            the plugin to register
   * @throws IllegalStateException
   *             if a plugin with the same name is already registered
   */
  void registerPlugin(String name, Plugin plugin);

  /**
   * Records the action in the registry.
   *
   * @param key
   *            the action key (type + name)
   * @param action
   *            the action to register
   * @throws IllegalStateException
   *             if an action with the same key is already registered
   */
  void registerAction(String key, Action action);

  /**
   * Returns the plugin for the given name.
   *
   * @param name
   *            the plugin name
   * @return the plugin, or null if not found
   */
  Plugin lookupPlugin(String name);

  /**
   * Returns the action for the given key.
   *
   * @param key
   *            the action key
   * @return the action, or null if not found
   */
  Action lookupAction(String key);

  /**
   * Returns the action for the given type and name.
   *
   * @param type
   *            the action type
   * @param name
   *            the action name
   * @return the action, or null if not found
   */
  default Action lookupAction(ActionType type, String name) {
    return lookupAction(type.keyFromName(name));
  }

  /**
   * Returns a list of all registered actions, in registration order.
   *
   * @return list of all registered actions
   */
  List<Action> listActions();

  /**
   * Returns a list of all registered actions of the specified type.
   *
   * @param type
   *            the action type to filter by
   * @return list of actions of the specified type
   */
  List<Action> listActions(ActionType type);

  /**
   * Returns a list of all registered plugins.
   *
   * @return list of all registered plugins
   */
  List<Plugin> listPlugins();
}
