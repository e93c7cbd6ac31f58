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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DefaultRegistry is the default implementation of the Registry interface. It
 * provides thread-safe storage and lookup of actions and plugins, preserving
 * registration order.
 */
public class DefaultRegistry implements Registry {

  private static final Logger logger = LoggerFactory.getLogger(DefaultRegistry.class);

  private final Map<String, Action> actions = Collections.synchronizedMap(new LinkedHashMap<>());
  private final Map<String, Plugin> plugins = Collections.synchronizedMap(new LinkedHashMap<>());

  /**
   * Creates a new empty registry.
   */
  public DefaultRegistry() {
  }

  @Override
  public void registerPlugin(String name, Plugin plugin) {
    synchronized (plugins) {
      if (plugins.containsKey(name)) {
        throw new IllegalStateException("Plugin already registered: " + name);
      }
      plugins.put(name, plugin);
    }
    logger.debug("Registered plugin: {}", name);
  }

  @Override
  public void registerAction(String key, Action action) {
    synchronized (actions) {
      if (actions.containsKey(key)) {
        throw new IllegalStateException("Action already registered: " + key);
      }
      actions.put(key, action);
    }
    logger.debug("Registered action: {}", key);
  }

  @Override
  public Plugin lookupPlugin(String name) {
    return plugins.get(name);
  }

  @Override
  public Action lookupAction(String key) {
    return actions.get(key);
  }

  @Override
  public List<Action> listActions() {
    synchronized (actions) {
      return new ArrayList<>(actions.values());
    }
  }

  @Override
  public List<Action> listActions(ActionType type) {
    String prefix = "/" + type.getValue() + "/";
    List<Action> result = new ArrayList<>();
    synchronized (actions) {
      for (Map.Entry<String, Action> entry : actions.entrySet()) {
        if (entry.getKey().startsWith(prefix)) {
          result.add(entry.getValue());
        }
      }
    }
    return result;
  }

  @Override
  public List<Plugin> listPlugins() {
    synchronized (plugins) {
      return new ArrayList<>(plugins.values());
    }
  }
}
