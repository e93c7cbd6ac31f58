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

import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ToolDefinition describes a tool, or a delegation target, to an inference
 * engine.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolDefinition {

  @JsonProperty("name")
  private String name;

  @JsonProperty("description")
  private String description;

  @JsonProperty("inputSchema")
  private Map<String, Object> inputSchema;

  /**
   * Default constructor.
   */
  public ToolDefinition() {
  }

  /**
   * Creates a new ToolDefinition.
   *
   * @param name
   *            the tool name
   * @param description
   *            the tool description
   * @param inputSchema
   *            the input JSON schema
   */
  public ToolDefinition(String name, String description, Map<String, Object> inputSchema) {
    this.name = name;
    this.description = description;
    this.inputSchema = inputSchema;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public Map<String, Object> getInputSchema() {
    return inputSchema;
  }

  public void setInputSchema(Map<String, Object> inputSchema) {
    this.inputSchema = inputSchema;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ToolDefinition)) {
      return false;
    }
    ToolDefinition that = (ToolDefinition) o;
    return Objects.equals(name, that.name) && Objects.equals(description, that.description)
        && Objects.equals(inputSchema, that.inputSchema);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, description, inputSchema);
  }
}
