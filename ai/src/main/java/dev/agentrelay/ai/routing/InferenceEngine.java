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

import java.util.concurrent.CompletableFuture;

/**
 * InferenceEngine decides, for the active handler, which tool to call or which
 * specialist to delegate to. Typically backed by a language model; the
 * {@link RuleBasedInferenceEngine} is a deterministic stand-in.
 *
 * <p>
 * Implementations report unusable output as
 * {@link InferenceResult#malformed(String)} rather than by throwing. Any retry
 * policy for malformed output belongs to the implementation.
 */
@FunctionalInterface
public interface InferenceEngine {

  /**
   * Decides a turn for the active handler of the request.
   *
   * @param request
   *            the inference request
   * @return a CompletableFuture containing the result
   */
  CompletableFuture<InferenceResult> infer(InferenceRequest request);
}
