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

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.agentrelay.core.RelayException;

/**
 * InMemorySessionStore is the default, process-lifetime implementation of
 * SessionStore.
 *
 * <p>
 * Writes to one key are serialized by the map's per-key compute; different
 * keys proceed independently.
 *
 * <p>
 * <b>Note:</b> Sessions are lost when the application exits.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger logger = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final Map<SessionKey, SessionData> data = new ConcurrentHashMap<>();
  private final Clock clock;

  /**
   * Creates a new InMemorySessionStore using the system clock.
   */
  public InMemorySessionStore() {
    this(Clock.systemUTC());
  }

  /**
   * Creates a new InMemorySessionStore.
   *
   * @param clock
   *            the clock used for creation and update timestamps
   */
  public InMemorySessionStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public CompletableFuture<Session> create(SessionKey key, Map<String, Object> initialState) {
    try {
      SessionData.validateState(initialState);
    } catch (RelayException e) {
      return CompletableFuture.failedFuture(e);
    }
    SessionData fresh = new SessionData(key, initialState, clock.instant());
    if (data.putIfAbsent(key, fresh) != null) {
      return CompletableFuture.failedFuture(SessionException.alreadyExists(key));
    }
    logger.debug("Created session {}", key);
    return CompletableFuture.completedFuture(fresh.snapshot());
  }

  @Override
  public CompletableFuture<Session> get(SessionKey key) {
    SessionData sessionData = data.get(key);
    if (sessionData == null) {
      return CompletableFuture.failedFuture(SessionException.notFound(key));
    }
    return CompletableFuture.completedFuture(sessionData.snapshot());
  }

  @Override
  public CompletableFuture<Session> applyStateWrite(SessionKey key, Map<String, Object> write) {
    try {
      SessionData.validateState(write);
    } catch (RelayException e) {
      return CompletableFuture.failedFuture(e);
    }
    AtomicReference<Session> updated = new AtomicReference<>();
    data.computeIfPresent(key, (k, sessionData) -> {
      if (write != null && !write.isEmpty()) {
        sessionData.merge(write, clock.instant());
      }
      updated.set(sessionData.snapshot());
      return sessionData;
    });
    if (updated.get() == null) {
      return CompletableFuture.failedFuture(SessionException.notFound(key));
    }
    logger.debug("Applied state write {} to session {}", write, key);
    return CompletableFuture.completedFuture(updated.get());
  }

  @Override
  public CompletableFuture<Boolean> exists(SessionKey key) {
    return CompletableFuture.completedFuture(data.containsKey(key));
  }

  /**
   * Returns the number of sessions currently stored.
   *
   * @return the session count
   */
  public int size() {
    return data.size();
  }
}
