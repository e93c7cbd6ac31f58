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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Session is an immutable snapshot of a conversational session: its key, its
 * state mapping and its timestamps.
 *
 * <p>
 * Snapshots are what a {@link SessionStore} hands out. They never change after
 * creation; reading the session again after a state write returns a new
 * snapshot.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Session {

  @JsonProperty("key")
  private final SessionKey key;

  @JsonProperty("state")
  private final Map<String, Object> state;

  @JsonProperty("createTime")
  private final Instant createTime;

  @JsonProperty("lastUpdateTime")
  private final Instant lastUpdateTime;

  /**
   * Creates a new Session snapshot.
   *
   * @param key
   *            the session key
   * @param state
   *            the state mapping, copied
   * @param createTime
   *            the creation timestamp
   * @param lastUpdateTime
   *            the last-update timestamp
   */
  public Session(SessionKey key, Map<String, Object> state, Instant createTime, Instant lastUpdateTime) {
    this.key = key;
    this.state = state != null
        ? Collections.unmodifiableMap(new LinkedHashMap<>(state))
        : Collections.emptyMap();
    this.createTime = createTime;
    this.lastUpdateTime = lastUpdateTime;
  }

  public SessionKey getKey() {
    return key;
  }

  @JsonIgnore
  public String getAppName() {
    return key.getAppName();
  }

  @JsonIgnore
  public String getUserId() {
    return key.getUserId();
  }

  @JsonIgnore
  public String getId() {
    return key.getSessionId();
  }

  /**
   * Gets the read-only state mapping.
   *
   * @return the state
   */
  public Map<String, Object> getState() {
    return state;
  }

  /**
   * Gets a single state value.
   *
   * @param stateKey
   *            the state key
   * @return the value, or null if absent
   */
  public Object getStateValue(String stateKey) {
    return state.get(stateKey);
  }

  public Instant getCreateTime() {
    return createTime;
  }

  public Instant getLastUpdateTime() {
    return lastUpdateTime;
  }

  @Override
  public String toString() {
    return "Session{" + key + ", state=" + state + "}";
  }
}
