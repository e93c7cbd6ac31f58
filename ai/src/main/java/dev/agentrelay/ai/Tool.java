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
import java.util.HashMap;
import java.util.Map;
import java.util.function.BiFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.agentrelay.ai.telemetry.ToolTelemetry;
import dev.agentrelay.core.Action;
import dev.agentrelay.core.ActionType;
import dev.agentrelay.core.ErrorKind;
import dev.agentrelay.core.JsonUtils;
import dev.agentrelay.core.RelayException;

/**
 * Tool represents a function that a handler can invoke to resolve a turn.
 *
 * <p>
 * A tool maps its arguments and a session state snapshot to a
 * {@link ToolResult}. Expected errors are returned as failures; argument
 * conversion errors and unexpected exceptions are converted to failures by
 * {@link #invoke(ToolContext, Map)}, so an invocation never throws.
 *
 * @param <I>
 *            the input type
 */
public class Tool<I> implements Action {

  private static final Logger logger = LoggerFactory.getLogger(Tool.class);

  private final String name;
  private final String description;
  private final Map<String, Object> inputSchema;
  private final Class<I> inputClass;
  private final BiFunction<ToolContext, I, ToolResult> handler;

  /**
   * Creates a new Tool.
   *
   * @param name
   *            the tool name
   * @param description
   *            the tool description
   * @param inputSchema
   *            the input JSON schema
   * @param inputClass
   *            the input class for argument conversion, or null to receive the
   *            raw argument map
   * @param handler
   *            the tool handler function
   */
  public Tool(String name, String description, Map<String, Object> inputSchema, Class<I> inputClass,
      BiFunction<ToolContext, I, ToolResult> handler) {
    this.name = name;
    this.description = description;
    this.inputSchema = inputSchema != null ? inputSchema : Map.of("type", "object");
    this.inputClass = inputClass;
    this.handler = handler;
  }

  /**
   * Creates a builder for Tool.
   *
   * @param <I>
   *            the input type
   * @return a new builder
   */
  public static <I> Builder<I> builder() {
    return new Builder<>();
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public ActionType getType() {
    return ActionType.TOOL;
  }

  @Override
  public String getDescription() {
    return description;
  }

  /**
   * Gets the input JSON schema.
   *
   * @return the input schema
   */
  public Map<String, Object> getInputSchema() {
    return inputSchema;
  }

  /**
   * Gets the input class for argument conversion.
   *
   * @return the input class, or null if the tool receives the raw map
   */
  public Class<I> getInputClass() {
    return inputClass;
  }

  /**
   * Gets the tool definition for use in inference requests.
   *
   * @return the tool definition
   */
  public ToolDefinition getDefinition() {
    return new ToolDefinition(name, description, inputSchema);
  }

  /**
   * Invokes the tool.
   *
   * @param ctx
   *            the tool context holding the state snapshot
   * @param arguments
   *            the arguments extracted by the inference engine, may be null
   * @return the result, never null
   */
  public ToolResult invoke(ToolContext ctx, Map<String, Object> arguments) {
    Map<String, Object> args = arguments != null ? arguments : Collections.emptyMap();
    long start = System.currentTimeMillis();
    ToolResult result;
    try {
      result = handler.apply(ctx, convertInput(args));
      if (result == null) {
        result = ToolResult.failure(ErrorKind.INTERNAL, "tool '" + name + "' returned no result");
      }
    } catch (RelayException e) {
      logger.warn("Tool '{}' rejected its input: {}", name, e.getMessage());
      result = ToolResult.failure(e.getKind(), e.getMessage());
    } catch (RuntimeException e) {
      logger.error("Tool execution failed for '{}'", name, e);
      result = ToolResult.failure(ErrorKind.INTERNAL, "tool '" + name + "' failed: " + e.getMessage());
    }

    if (result.isFailure()) {
      logger.debug("Tool '{}' returned failure: {}", name, result);
    } else {
      logger.debug("Executed tool '{}' successfully", name);
    }
    ToolTelemetry.getInstance().recordToolMetrics(name, ctx != null ? ctx.getHandlerName() : null,
        System.currentTimeMillis() - start, result.isFailure() ? result.getErrorKind().getValue() : null);
    return result;
  }

  @SuppressWarnings("unchecked")
  private I convertInput(Map<String, Object> args) {
    if (inputClass == null) {
      return (I) new HashMap<>(args);
    }
    try {
      return JsonUtils.convert(args, inputClass);
    } catch (RelayException e) {
      throw new RelayException(ErrorKind.VALIDATION, "invalid arguments for tool '" + name + "'", e, args);
    }
  }

  /**
   * Builder for Tool.
   *
   * @param <I>
   *            the input type
   */
  public static class Builder<I> {
    private String name;
    private String description;
    private Map<String, Object> inputSchema;
    private Class<I> inputClass;
    private BiFunction<ToolContext, I, ToolResult> handler;

    public Builder<I> name(String name) {
      this.name = name;
      return this;
    }

    public Builder<I> description(String description) {
      this.description = description;
      return this;
    }

    public Builder<I> inputSchema(Map<String, Object> inputSchema) {
      this.inputSchema = inputSchema;
      return this;
    }

    public Builder<I> inputClass(Class<I> inputClass) {
      this.inputClass = inputClass;
      return this;
    }

    public Builder<I> handler(BiFunction<ToolContext, I, ToolResult> handler) {
      this.handler = handler;
      return this;
    }

    public Tool<I> build() {
      if (name == null) {
        throw new IllegalStateException("Tool name is required");
      }
      if (handler == null) {
        throw new IllegalStateException("Tool handler is required");
      }
      return new Tool<>(name, description, inputSchema, inputClass, handler);
    }
  }
}
