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

package dev.agentrelay.ai.routing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * InferenceResult is what an {@link InferenceEngine} returns for one request:
 * a tool call for the active handler, a delegation target, a decline signal,
 * or malformed output.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class InferenceResult {

  /** The variants of an inference result. */
  public enum Kind {
    TOOL_CALL, DELEGATE, DECLINE, MALFORMED
  }

  @JsonProperty("kind")
  private final Kind kind;

  @JsonProperty("toolName")
  private final String toolName;

  @JsonProperty("handlerId")
  private final String handlerId;

  @JsonProperty("arguments")
  private final Map<String, Object> arguments;

  @JsonProperty("reason")
  private final String reason;

  private InferenceResult(Kind kind, String toolName, String handlerId, Map<String, Object> arguments,
      String reason) {
    this.kind = kind;
    this.toolName = toolName;
    this.handlerId = handlerId;
    this.arguments = arguments != null
        ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
        : Collections.emptyMap();
    this.reason = reason;
  }

  /**
   * Creates a tool call for the active handler.
   *
   * @param toolName
   *            the tool to invoke
   * @param arguments
   *            the extracted arguments, may be null
   * @return the result
   */
  public static InferenceResult toolCall(String toolName, Map<String, Object> arguments) {
    return new InferenceResult(Kind.TOOL_CALL, toolName, null, arguments, null);
  }

  /**
   * Creates a delegation to a specialist, which will choose its own tool.
   *
   * @param handlerId
   *            the specialist name
   * @return the result
   */
  public static InferenceResult delegate(String handlerId) {
    return new InferenceResult(Kind.DELEGATE, null, handlerId, null, null);
  }

  /**
   * Creates a delegation to a specialist that already names the specialist's
   * tool call.
   *
   * @param handlerId
   *            the specialist name
   * @param toolName
   *            the tool the specialist should invoke
   * @param arguments
   *            the extracted arguments, may be null
   * @return the result
   */
  public static InferenceResult delegate(String handlerId, String toolName, Map<String, Object> arguments) {
    return new InferenceResult(Kind.DELEGATE, toolName, handlerId, arguments, null);
  }

  /**
   * Creates a decline signal.
   *
   * @return the result
   */
  public static InferenceResult decline() {
    return new InferenceResult(Kind.DECLINE, null, null, null, null);
  }

  /**
   * Creates a result for output the engine could not interpret.
   *
   * @param reason
   *            why the output is unusable
   * @return the result
   */
  public static InferenceResult malformed(String reason) {
    return new InferenceResult(Kind.MALFORMED, null, null, null, reason);
  }

  public Kind getKind() {
    return kind;
  }

  public String getToolName() {
    return toolName;
  }

  public String getHandlerId() {
    return handlerId;
  }

  public Map<String, Object> getArguments() {
    return arguments;
  }

  public String getReason() {
    return reason;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof InferenceResult)) {
      return false;
    }
    InferenceResult that = (InferenceResult) o;
    return kind == that.kind && Objects.equals(toolName, that.toolName) && Objects.equals(handlerId, that.handlerId)
        && arguments.equals(that.arguments) && Objects.equals(reason, that.reason);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, toolName, handlerId, arguments, reason);
  }

  @Override
  public String toString() {
    return "InferenceResult{" + kind + (toolName != null ? ", tool=" + toolName : "")
        + (handlerId != null ? ", handler=" + handlerId : "") + (arguments.isEmpty() ? "" : ", args=" + arguments)
        + (reason != null ? ", reason=" + reason : "") + "}";
  }
}
