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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Router decides, once per turn, whether the coordinator handles an utterance
 * itself, delegates it to a specialist, or declines it.
 */
@FunctionalInterface
public interface Router {

  /**
   * Routes an utterance.
   *
   * @param utterance
   *            the user utterance
   * @param state
   *            the session state snapshot taken at the start of the turn
   * @return a CompletableFuture containing the route; fails with
   *         {@link dev.agentrelay.ai.CapabilityException} when the chosen tool
   *         is not on the resolved handler's allow-list, and with
   *         {@link InferenceException} when the decision is unusable
   */
  CompletableFuture<Route> route(String utterance, Map<String, Object> state);
}
