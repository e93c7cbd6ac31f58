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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.agentrelay.ai.CapabilityException;
import dev.agentrelay.ai.Handler;
import dev.agentrelay.ai.Tool;

/**
 * CoordinatorRouter asks the inference engine to decide each turn for the
 * coordinator, and, on delegation, asks again with the specialist active.
 * Every tool it returns is checked against the allow-list of the handler that
 * will invoke it.
 */
public class CoordinatorRouter implements Router {

  private static final Logger logger = LoggerFactory.getLogger(CoordinatorRouter.class);

  private final CapabilityTable table;
  private final InferenceEngine engine;

  /**
   * Creates a new CoordinatorRouter.
   *
   * @param table
   *            the capability table
   * @param engine
   *            the inference engine
   */
  public CoordinatorRouter(CapabilityTable table, InferenceEngine engine) {
    if (table == null || engine == null) {
      throw new IllegalArgumentException("capability table and inference engine are required");
    }
    this.table = table;
    this.engine = engine;
  }

  public CapabilityTable getTable() {
    return table;
  }

  @Override
  public CompletableFuture<Route> route(String utterance, Map<String, Object> state) {
    Handler root = table.getRoot();
    return engine.infer(InferenceRequest.forHandler(root, utterance, state))
        .thenCompose(result -> resolve(root, result, utterance, state));
  }

  private CompletableFuture<Route> resolve(Handler root, InferenceResult result, String utterance,
      Map<String, Object> state) {
    checkUsable(root, result);
    logger.debug("Coordinator '{}' decided {}", root.getName(), result);
    switch (result.getKind()) {
      case TOOL_CALL :
        return CompletableFuture
            .completedFuture(Route.self(root, allowed(root, result.getToolName()), result.getArguments()));
      case DELEGATE :
        Handler specialist = table.findDelegate(result.getHandlerId());
        if (specialist == null) {
          throw new InferenceException(
              "coordinator '" + root.getName() + "' has no delegate named '" + result.getHandlerId() + "'");
        }
        if (result.getToolName() != null) {
          return CompletableFuture.completedFuture(delegated(specialist, result));
        }
        return engine.infer(InferenceRequest.forHandler(specialist, utterance, state))
            .thenApply(inner -> resolveSpecialist(specialist, inner));
      default :
        return CompletableFuture.completedFuture(Route.decline());
    }
  }

  private Route resolveSpecialist(Handler specialist, InferenceResult result) {
    checkUsable(specialist, result);
    logger.debug("Specialist '{}' decided {}", specialist.getName(), result);
    switch (result.getKind()) {
      case TOOL_CALL :
        return delegated(specialist, result);
      case DELEGATE :
        logger.error("Specialist '{}' attempted to delegate to '{}'", specialist.getName(), result.getHandlerId());
        throw new CapabilityException("specialist '" + specialist.getName() + "' cannot delegate",
            specialist.getName(), null);
      default :
        return Route.decline();
    }
  }

  private Route delegated(Handler specialist, InferenceResult result) {
    return Route.delegated(specialist, allowed(specialist, result.getToolName()), result.getArguments());
  }

  private Tool<?> allowed(Handler handler, String toolName) {
    try {
      return table.requireAllowed(handler, toolName);
    } catch (CapabilityException e) {
      logger.error("Capability fault: {}", e.getMessage());
      throw e;
    }
  }

  private static void checkUsable(Handler handler, InferenceResult result) {
    if (result == null) {
      throw new InferenceException("inference engine returned no result for '" + handler.getName() + "'");
    }
    if (result.getKind() == InferenceResult.Kind.MALFORMED) {
      throw new InferenceException("malformed inference output for '" + handler.getName() + "': "
          + result.getReason());
    }
    if (result.getKind() == InferenceResult.Kind.TOOL_CALL && result.getToolName() == null) {
      throw new InferenceException("tool call without a tool name for '" + handler.getName() + "'");
    }
    if (result.getKind() == InferenceResult.Kind.DELEGATE && result.getHandlerId() == null) {
      throw new InferenceException("delegation without a target for '" + handler.getName() + "'");
    }
  }
}
