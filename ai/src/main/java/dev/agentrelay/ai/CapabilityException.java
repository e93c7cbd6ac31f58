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

import dev.agentrelay.core.ErrorKind;
import dev.agentrelay.core.RelayException;

/**
 * Thrown when a handler attempts to invoke a tool outside its allow-list, when
 * a specialist attempts to delegate, or when a handler hierarchy is
 * misconfigured.
 *
 * <p>
 * A capability fault signals a broken configuration rather than a recoverable
 * runtime condition. It is never converted to user-facing text.
 */
public class CapabilityException extends RelayException {

  private final String handlerName;
  private final String toolName;

  /**
   * Creates a new CapabilityException.
   *
   * @param message
   *            the error message
   * @param handlerName
   *            the offending handler, may be null
   * @param toolName
   *            the offending tool, may be null
   */
  public CapabilityException(String message, String handlerName, String toolName) {
    super(ErrorKind.CAPABILITY, message);
    this.handlerName = handlerName;
    this.toolName = toolName;
  }

  /**
   * Creates a CapabilityException for a tool missing from a handler's
   * allow-list.
   *
   * @param handlerName
   *            the handler
   * @param toolName
   *            the requested tool
   * @return the exception
   */
  public static CapabilityException toolNotAllowed(String handlerName, String toolName) {
    return new CapabilityException(
        "Handler '" + handlerName + "' is not allowed to invoke tool '" + toolName + "'", handlerName, toolName);
  }

  /**
   * Gets the handler that caused the fault.
   *
   * @return the handler name, or null
   */
  public String getHandlerName() {
    return handlerName;
  }

  /**
   * Gets the tool that caused the fault.
   *
   * @return the tool name, or null
   */
  public String getToolName() {
    return toolName;
  }
}
