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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * SessionStore is the interface for keeping session state.
 *
 * <p>
 * Implementations can provide different storage backends such as:
 * <ul>
 * <li>In-memory storage (the default)</li>
 * <li>Database storage</li>
 * <li>Redis or other distributed cache</li>
 * </ul>
 *
 * <p>
 * Every implementation must honour the same contract: keys are unique,
 * sessions are created explicitly, state changes only through
 * {@link #applyStateWrite(SessionKey, Map)} with per-key overwrite semantics,
 * and writes to one key are serialized. Failures are reported by completing
 * the returned future exceptionally with a {@link SessionException} or a
 * validation error.
 */
public interface SessionStore {

  /**
   * Creates a session.
   *
   * @param key
   *            the composite session key
   * @param initialState
   *            the initial state, null for an empty mapping
   * @return a CompletableFuture containing the new session, failing with
   *         {@link SessionException} of kind {@code ALREADY_EXISTS} if the key
   *         is in use
   */
  CompletableFuture<Session> create(SessionKey key, Map<String, Object> initialState);

  /**
   * Retrieves a session.
   *
   * @param key
   *            the composite session key
   * @return a CompletableFuture containing a snapshot of the session, failing
   *         with {@link SessionException} of kind {@code NOT_FOUND} if absent
   */
  CompletableFuture<Session> get(SessionKey key);

  /**
   * Merges a partial state mapping into a session by key overwrite.
   *
   * @param key
   *            the composite session key
   * @param write
   *            the partial mapping
   * @return a CompletableFuture containing the session after the merge
   */
  CompletableFuture<Session> applyStateWrite(SessionKey key, Map<String, Object> write);

  /**
   * Merges a partial state mapping into the given session.
   *
   * @param session
   *            a snapshot of the session to update
   * @param write
   *            the partial mapping
   * @return a CompletableFuture containing the session after the merge
   */
  default CompletableFuture<Session> applyStateWrite(Session session, Map<String, Object> write) {
    return applyStateWrite(session.getKey(), write);
  }

  /**
   * Checks if a session exists.
   *
   * @param key
   *            the composite session key
   * @return a CompletableFuture containing true if the session exists
   */
  default CompletableFuture<Boolean> exists(SessionKey key) {
    return get(key).handle((session, error) -> error == null);
  }
}
