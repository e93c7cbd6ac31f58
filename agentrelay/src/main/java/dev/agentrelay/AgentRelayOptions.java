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

package dev.agentrelay;

import java.util.IllegalFormatException;

/**
 * AgentRelayOptions contains configuration options for an AgentRelay.
 *
 * <p>
 * Defaults are read from the environment:
 * <ul>
 * <li>{@code AGENTRELAY_TURN_TIMEOUT_MS}: bound on inference and tool
 * execution per turn, 30000 by default, 0 or less disables it</li>
 * <li>{@code AGENTRELAY_DECLINE_TEXT}: the reply when no handler applies</li>
 * <li>{@code AGENTRELAY_FAILURE_TEMPLATE}: the reply when a tool fails, with
 * {@code %s} replaced by the failure message</li>
 * </ul>
 */
public class AgentRelayOptions {

  static final long DEFAULT_TURN_TIMEOUT_MS = 30_000L;
  static final String DEFAULT_DECLINE_TEXT = "I'm sorry, I can't help with that request.";
  static final String DEFAULT_FAILURE_TEMPLATE = "I'm sorry, I couldn't complete that: %s";
  static final String DEFAULT_INFERENCE_ERROR_TEXT = "I'm sorry, I didn't understand that. Could you rephrase it?";
  static final String DEFAULT_TIMEOUT_TEXT = "I'm sorry, that took too long. Please try again.";

  private final long turnTimeoutMs;
  private final String declineText;
  private final String failureTemplate;
  private final String inferenceErrorText;
  private final String timeoutText;

  private AgentRelayOptions(Builder builder) {
    this.turnTimeoutMs = builder.turnTimeoutMs;
    this.declineText = builder.declineText;
    this.failureTemplate = builder.failureTemplate;
    this.inferenceErrorText = builder.inferenceErrorText;
    this.timeoutText = builder.timeoutText;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the turn timeout.
   *
   * @return the timeout in milliseconds, 0 or less if turns are unbounded
   */
  public long getTurnTimeoutMs() {
    return turnTimeoutMs;
  }

  public String getDeclineText() {
    return declineText;
  }

  public String getFailureTemplate() {
    return failureTemplate;
  }

  public String getInferenceErrorText() {
    return inferenceErrorText;
  }

  public String getTimeoutText() {
    return timeoutText;
  }

  /**
   * Formats the reply for a failed tool.
   *
   * @param message
   *            the failure message
   * @return the apologetic reply
   */
  public String formatFailure(String message) {
    return String.format(failureTemplate, message != null ? message : "unknown error");
  }

  /**
   * Builder for AgentRelayOptions.
   */
  public static class Builder {
    private long turnTimeoutMs = getTurnTimeoutFromEnv();
    private String declineText = envOrDefault("AGENTRELAY_DECLINE_TEXT", DEFAULT_DECLINE_TEXT);
    private String failureTemplate = envOrDefault("AGENTRELAY_FAILURE_TEMPLATE", DEFAULT_FAILURE_TEMPLATE);
    private String inferenceErrorText = DEFAULT_INFERENCE_ERROR_TEXT;
    private String timeoutText = DEFAULT_TIMEOUT_TEXT;

    static long parseTimeout(String value) {
      if (value != null) {
        try {
          return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
          // fall through to default
        }
      }
      return DEFAULT_TURN_TIMEOUT_MS;
    }

    private static long getTurnTimeoutFromEnv() {
      return parseTimeout(System.getenv("AGENTRELAY_TURN_TIMEOUT_MS"));
    }

    private static String envOrDefault(String name, String defaultValue) {
      String value = System.getenv(name);
      return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public Builder turnTimeoutMs(long turnTimeoutMs) {
      this.turnTimeoutMs = turnTimeoutMs;
      return this;
    }

    public Builder declineText(String declineText) {
      this.declineText = declineText;
      return this;
    }

    /**
     * Sets the failure reply template.
     *
     * @param failureTemplate
     *            a {@link String#format} template with one {@code %s}
     * @return this builder
     */
    public Builder failureTemplate(String failureTemplate) {
      this.failureTemplate = failureTemplate;
      return this;
    }

    public Builder inferenceErrorText(String inferenceErrorText) {
      this.inferenceErrorText = inferenceErrorText;
      return this;
    }

    public Builder timeoutText(String timeoutText) {
      this.timeoutText = timeoutText;
      return this;
    }

    public AgentRelayOptions build() {
      if (declineText == null || failureTemplate == null || inferenceErrorText == null || timeoutText == null) {
        throw new IllegalStateException("reply texts must not be null");
      }
      try {
        String.format(failureTemplate, "unknown error");
      } catch (IllegalFormatException e) {
        throw new IllegalStateException("Invalid failure template '" + failureTemplate + "': " + e.getMessage(), e);
      }
      return new AgentRelayOptions(this);
    }
  }
}
