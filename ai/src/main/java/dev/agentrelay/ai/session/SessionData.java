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

package dev.agentrelay.ai.session;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import dev.agentrelay.core.ErrorKind;
import dev.agentrelay.core.RelayException;

/**
 * SessionData is the mutable record a {@link SessionStore} keeps for one
 * session. Store implementations mutate it only through
 * {@link #merge(Map, Instant)} and expose it only as {@link Session} snapshots.
 */
public class SessionData {

  private final SessionKey key;
  private final Map<String, Object> state;
  private final Instant createTime;
  private Instant lastUpdateTime;

  /**
   * Creates a new SessionData.
   *
   * @param key
   *            the session key
   * @param initialState
   *            the initial state, may be null
   * @param createTime
   *            the creation timestamp
   */
  public SessionData(SessionKey key, Map<String, Object> initialState, Instant createTime) {
    this.key = key;
    this.state = new LinkedHashMap<>();
    if (initialState != null) {
      this.state.putAll(initialState);
    }
    this.createTime = createTime;
    this.lastUpdateTime = createTime;
  }

  public SessionKey getKey() {
    return key;
  }

  /**
   * Merges a partial state mapping by key overwrite and bumps the last-update
   * timestamp. Keys absent from {@code write} are left untouched.
   *
   * @param write
   *            the partial state mapping
   * @param now
   *            the update timestamp
   */
  public synchronized void merge(Map<String, Object> write, Instant now) {
    state.putAll(write);
    lastUpdateTime = now;
  }

  /**
   * Takes an immutable snapshot of the current data.
   *
   * @return the snapshot
   */
  public synchronized Session snapshot() {
    return new Session(key, state, createTime, lastUpdateTime);
  }

  /**
   * Validates a state mapping. Keys must be non-blank strings and values must
   * be text, numbers or booleans.
   *
   * @param state
   *            the mapping to validate, may be null
   * @throws RelayException
   *             of kind {@link ErrorKind#VALIDATION} if the mapping is invalid
   */
  public static void validateState(Map<String, Object> state) {
    if (state == null) {
      return;
    }
    for (Map.Entry<String, Object> entry : state.entrySet()) {
      String stateKey = entry.getKey();
      if (stateKey == null || stateKey.trim().isEmpty()) {
        throw new RelayException(ErrorKind.VALIDATION, "state keys must not be blank");
      }
      Object value = entry.getValue();
      if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
        throw new RelayException(ErrorKind.VALIDATION, "state value for '" + stateKey
            + "' must be text, a number or a boolean, got " + (value == null ? "null" : value.getClass().getName()));
      }
    }
  }
}
