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
 * Plugin is the interface implemented by types that contribute tools and
 * handlers to an Agent Relay instance.
 *
 * <p>
 * Plugins are registered and initialized via the AgentRelay builder.
 */
public interface Plugin {

  /**
   * Returns the unique identifier for the plugin. This name is used for
   * registration and lookup.
   *
   * @return the plugin name
   */
  String getName();

  /**
   * Initializes the plugin. This method is called once during initialization.
   * The plugin returns the actions it provides; tools must come before the
   * handlers that reference them.
   *
   * @return list of actions provided by this plugin
   */
  List<Action> init();

  /**
   * Initializes the plugin with access to the registry.
   *
   * <p>
   * Override this method instead of {@link #init()} when the plugin needs to
   * resolve actions registered by other plugins.
   *
   * @param registry
   *            the registry for resolving dependencies
   * @return list of actions provided by this plugin
   */
  default List<Action> init(Registry registry) {
    return init();
  }
}
