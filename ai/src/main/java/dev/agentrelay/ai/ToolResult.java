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

package dev.agentrelay.ai;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import dev.agentrelay.core.ErrorKind;

/**
 * ToolResult is the outcome of a single tool invocation: either a success
 * carrying a payload and an optional state write, or a failure carrying an
 * {@link ErrorKind} and a human-readable message.
 *
 * <p>
 * Tools never throw to report expected errors such as an unknown city; they
 * return {@link #failure(ErrorKind, String)} instead.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ToolResult {

  /** Payload key holding the user-facing text of a successful result. */
  public static final String REPORT = "report";

  /** Outcome of a tool invocation. */
  public enum Status {
    SUCCESS, FAILURE
  }

  @JsonProperty("status")
  private final Status status;

  @JsonProperty("payload")
  private final Map<String, Object> payload;

  @JsonProperty("stateWrite")
  private final Map<String, Object> stateWrite;

  @JsonProperty("errorKind")
  private final ErrorKind errorKind;

  @JsonProperty("message")
  private final String message;

  private ToolResult(Status status, Map<String, Object> payload, Map<String, Object> stateWrite,
      ErrorKind errorKind, String message) {
    this.status = status;
    this.payload = payload;
    this.stateWrite = stateWrite;
    this.errorKind = errorKind;
    this.message = message;
  }

  /**
   * Creates a successful result without a state write.
   *
   * @param payload
   *            the named output fields
   * @return the result
   */
  public static ToolResult success(Map<String, Object> payload) {
    return success(payload, null);
  }

  /**
   * Creates a successful result.
   *
   * @param payload
   *            the named output fields
   * @param stateWrite
   *            the session state keys to merge once the turn finalizes, may be
   *            null
   * @return the result
   */
  public static ToolResult success(Map<String, Object> payload, Map<String, Object> stateWrite) {
    return new ToolResult(Status.SUCCESS, copy(payload), copy(stateWrite), null, null);
  }

  /**
   * Creates a successful result whose payload is only a report text.
   *
   * @param report
   *            the user-facing text
   * @return the result
   */
  public static ToolResult report(String report) {
    return success(Map.of(REPORT, report));
  }

  /**
   * Creates a failed result.
   *
   * @param errorKind
   *            the error kind
   * @param message
   *            the human-readable message
   * @return the result
   */
  public static ToolResult failure(ErrorKind errorKind, String message) {
    Objects.requireNonNull(errorKind, "errorKind");
    return new ToolResult(Status.FAILURE, Collections.emptyMap(), Collections.emptyMap(), errorKind, message);
  }

  private static Map<String, Object> copy(Map<String, Object> map) {
    if (map == null || map.isEmpty()) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(map));
  }

  public Status getStatus() {
    return status;
  }

  @JsonIgnore
  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }

  @JsonIgnore
  public boolean isFailure() {
    return status == Status.FAILURE;
  }

  /**
   * Gets the payload of a successful result.
   *
   * @return the payload, empty for failures
   */
  public Map<String, Object> getPayload() {
    return payload;
  }

  /**
   * Gets the state write emitted by the tool.
   *
   * @return the state write, empty when the tool writes nothing
   */
  public Map<String, Object> getStateWrite() {
    return stateWrite;
  }

  /**
   * Gets the report text of a successful result.
   *
   * @return the report, or null if the payload has none
   */
  @JsonIgnore
  public String getReport() {
    Object report = payload.get(REPORT);
    return report != null ? report.toString() : null;
  }

  public ErrorKind getErrorKind() {
    return errorKind;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ToolResult)) {
      return false;
    }
    ToolResult that = (ToolResult) o;
    return status == that.status && payload.equals(that.payload) && stateWrite.equals(that.stateWrite)
        && errorKind == that.errorKind && Objects.equals(message, that.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, payload, stateWrite, errorKind, message);
  }

  @Override
  public String toString() {
    if (isSuccess()) {
      return "Success{payload=" + payload + ", stateWrite=" + stateWrite + "}";
    }
    return "Failure{" + errorKind + ": " + message + "}";
  }
}
