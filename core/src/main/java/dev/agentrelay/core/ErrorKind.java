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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * ErrorKind classifies the failures surfaced by Agent Relay. Tool failures,
 * session lookups and routing faults all carry one of these kinds so callers
 * can branch without parsing messages.
 */
public enum ErrorKind {
  /** A tool argument was missing or malformed, or a state write was invalid. */
  VALIDATION("validation"),

  /** The requested entity (a city, a session) does not exist. */
  NOT_FOUND("not_found"),

  /** A session with the same composite key already exists. */
  ALREADY_EXISTS("already_exists"),

  /**
   * A handler attempted to use a tool outside its allow-list, or the handler
   * hierarchy is misconfigured. Never shown to the user.
   */
  CAPABILITY("capability"),

  /** The inference engine returned a decision that cannot be used. */
  INFERENCE("inference"),

  /** Inference or tool execution did not finish within the turn timeout. */
  TIMEOUT("timeout"),

  /** A tool failed unexpectedly. */
  INTERNAL("internal");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the string value of the error kind.
   *
   * @return the error kind string value
   */
  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Creates an ErrorKind from a string value.
   *
   * @param value
   *            the string value
   * @return the corresponding ErrorKind
   * @throws IllegalArgumentException
   *             if the value doesn't match any ErrorKind
   */
  @JsonCreator
  public static ErrorKind fromValue(String value) {
    for (ErrorKind kind : values()) {
      if (kind.value.equals(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown error kind: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
