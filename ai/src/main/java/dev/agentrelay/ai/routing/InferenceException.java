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

import dev.agentrelay.core.ErrorKind;
import dev.agentrelay.core.RelayException;

/**
 * Thrown when the inference engine returns a decision that cannot be used:
 * malformed output, a missing tool name, or an unknown delegation target.
 */
public class InferenceException extends RelayException {

  public InferenceException(String message) {
    super(ErrorKind.INFERENCE, message);
  }

  public InferenceException(String message, Throwable cause) {
    super(ErrorKind.INFERENCE, message, cause, null);
  }
}
