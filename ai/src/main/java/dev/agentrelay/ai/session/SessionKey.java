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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * SessionKey is the composite identity of a session: application, user and
 * session id. Keys are immutable and compare by value.
 */
public final class SessionKey {

  @JsonProperty("appName")
  private final String appName;

  @JsonProperty("userId")
  private final String userId;

  @JsonProperty("sessionId")
  private final String sessionId;

  /**
   * Creates a new SessionKey.
   *
   * @param appName
   *            the application scope
   * @param userId
   *            the user id
   * @param sessionId
   *            the session id
   * @throws IllegalArgumentException
   *             if any part is null or blank
   */
  @JsonCreator
  public SessionKey(@JsonProperty("appName") String appName, @JsonProperty("userId") String userId,
      @JsonProperty("sessionId") String sessionId) {
    this.appName = requirePart("appName", appName);
    this.userId = requirePart("userId", userId);
    this.sessionId = requirePart("sessionId", sessionId);
  }

  /**
   * Creates a new SessionKey.
   *
   * @param appName
   *            the application scope
   * @param userId
   *            the user id
   * @param sessionId
   *            the session id
   * @return the key
   */
  public static SessionKey of(String appName, String userId, String sessionId) {
    return new SessionKey(appName, userId, sessionId);
  }

  private static String requirePart(String name, String value) {
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return value;
  }

  public String getAppName() {
    return appName;
  }

  public String getUserId() {
    return userId;
  }

  public String getSessionId() {
    return sessionId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SessionKey)) {
      return false;
    }
    SessionKey that = (SessionKey) o;
    return appName.equals(that.appName) && userId.equals(that.userId) && sessionId.equals(that.sessionId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(appName, userId, sessionId);
  }

  @Override
  public String toString() {
    return appName + "/" + userId + "/" + sessionId;
  }
}
