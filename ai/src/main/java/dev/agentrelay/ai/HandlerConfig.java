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

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for defining a handler.
 *
 * <p>
 * A handler owns an ordered allow-list of tools and, for a coordinator, a list
 * of specialist sub-handlers it may delegate to. Delegation is single-level: a
 * sub-handler must not declare sub-handlers of its own.
 *
 * <p>
 * Example usage:
 *
 * <pre>{@code
 * HandlerConfig greeter = HandlerConfig.builder().name("greeting_agent").intent("greeting")
 * 		.description("Handles simple greetings").tools(List.of(sayHello)).build();
 *
 * HandlerConfig coordinator = HandlerConfig.builder().name("weather_agent").intent("weather")
 * 		.description("Provides weather and delegates greetings").tools(List.of(getWeather))
 * 		.handlers(List.of(greeter)).outputKey("last_weather_report").build();
 * }</pre>
 */
public class HandlerConfig {

  private String name;
  private String intent;
  private String description;
  private String instruction;
  private List<Tool<?>> tools = new ArrayList<>();
  private List<HandlerConfig> handlers = new ArrayList<>();
  private String outputKey;

  /** Default constructor. */
  public HandlerConfig() {
  }

  /**
   * Gets the handler name.
   *
   * @return the name
   */
  public String getName() {
    return name;
  }

  /**
   * Sets the handler name.
   *
   * @param name
   *            the name
   */
  public void setName(String name) {
    this.name = name;
  }

  /**
   * Gets the intent category served by this handler.
   *
   * @return the intent, or the handler name when none was set
   */
  public String getIntent() {
    return intent != null ? intent : name;
  }

  /**
   * Sets the intent category served by this handler.
   *
   * @param intent
   *            the intent
   */
  public void setIntent(String intent) {
    this.intent = intent;
  }

  /**
   * Gets the description (used when the handler is offered as a delegate).
   *
   * @return the description
   */
  public String getDescription() {
    return description;
  }

  /**
   * Sets the description.
   *
   * @param description
   *            the description
   */
  public void setDescription(String description) {
    this.description = description;
  }

  /**
   * Gets the instruction given to the inference engine for this handler.
   *
   * @return the instruction
   */
  public String getInstruction() {
    return instruction;
  }

  /**
   * Sets the instruction.
   *
   * @param instruction
   *            the instruction
   */
  public void setInstruction(String instruction) {
    this.instruction = instruction;
  }

  /**
   * Gets the tools this handler may invoke, in allow-list order.
   *
   * @return the tools
   */
  public List<Tool<?>> getTools() {
    return tools;
  }

  /**
   * Sets the tools this handler may invoke.
   *
   * @param tools
   *            the tools
   */
  public void setTools(List<Tool<?>> tools) {
    this.tools = tools != null ? new ArrayList<>(tools) : new ArrayList<>();
  }

  /**
   * Gets the sub-handlers this handler may delegate to.
   *
   * @return the sub-handlers
   */
  public List<HandlerConfig> getHandlers() {
    return handlers;
  }

  /**
   * Sets the sub-handlers this handler may delegate to.
   *
   * @param handlers
   *            the sub-handlers
   */
  public void setHandlers(List<HandlerConfig> handlers) {
    this.handlers = handlers != null ? new ArrayList<>(handlers) : new ArrayList<>();
  }

  /**
   * Gets the state key that captures this handler's final report.
   *
   * @return the output key, or null if reports are not captured
   */
  public String getOutputKey() {
    return outputKey;
  }

  /**
   * Sets the state key that captures this handler's final report after a
   * successful turn.
   *
   * @param outputKey
   *            the output key
   */
  public void setOutputKey(String outputKey) {
    this.outputKey = outputKey;
  }

  /**
   * Creates a builder for HandlerConfig.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for HandlerConfig. */
  public static class Builder {
    private final HandlerConfig config = new HandlerConfig();

    public Builder name(String name) {
      config.setName(name);
      return this;
    }

    public Builder intent(String intent) {
      config.setIntent(intent);
      return this;
    }

    public Builder description(String description) {
      config.setDescription(description);
      return this;
    }

    public Builder instruction(String instruction) {
      config.setInstruction(instruction);
      return this;
    }

    public Builder tools(List<Tool<?>> tools) {
      config.setTools(tools);
      return this;
    }

    public Builder handlers(List<HandlerConfig> handlers) {
      config.setHandlers(handlers);
      return this;
    }

    public Builder outputKey(String outputKey) {
      config.setOutputKey(outputKey);
      return this;
    }

    public HandlerConfig build() {
      if (config.getName() == null || config.getName().isEmpty()) {
        throw new IllegalStateException("Handler name is required");
      }
      if (config.getOutputKey() != null && config.getOutputKey().trim().isEmpty()) {
        throw new IllegalStateException("Output key of handler '" + config.getName() + "' must not be blank");
      }
      return config;
    }
  }
}
