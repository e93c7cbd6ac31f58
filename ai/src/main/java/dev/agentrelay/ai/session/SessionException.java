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

import dev.agentrelay.core.ErrorKind;
import dev.agentrelay.core.RelayException;

/** Exception thrown when a session lookup or creation fails. */
public class SessionException extends RelayException {

  private final SessionKey sessionKey;

  /**
   * Creates a new SessionException.
   *
   * @param kind
   *            the error kind
   * @param message
   *            the error message
   * @param sessionKey
   *            the key involved
   */
  public SessionException(ErrorKind kind, String message, SessionKey sessionKey) {
    super(kind, message);
    this.sessionKey = sessionKey;
  }

  /**
   * Creates the exception raised when no session exists for a key.
   *
   * @param key
   *            the key
   * @return the exception
   */
  public static SessionException notFound(SessionKey key) {
    return new SessionException(ErrorKind.NOT_FOUND, "Session not found: " + key, key);
  }

  /**
   * Creates the exception raised when a key is already in use.
   *
   * @param key
   *            the key
   * @return the exception
   */
  public static SessionException alreadyExists(SessionKey key) {
    return new SessionException(ErrorKind.ALREADY_EXISTS, "Session already exists: " + key, key);
  }

  /**
   * Gets the session key involved.
   *
   * @return the key
   */
  public SessionKey getSessionKey() {
    return sessionKey;
  }
}
