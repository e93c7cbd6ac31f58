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

package dev.agentrelay.core;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JsonUtils provides JSON serialization and conversion utilities for Agent
 * Relay.
 */
public final class JsonUtils {

  private static final ObjectMapper objectMapper;

  static {
    objectMapper = new ObjectMapper();
    objectMapper.registerModule(new JavaTimeModule());
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
  }

  private JsonUtils() {
    // Utility class
  }

  /**
   * Returns the shared ObjectMapper instance.
   *
   * @return the ObjectMapper
   */
  public static ObjectMapper getObjectMapper() {
    return objectMapper;
  }

  /**
   * Converts an object to JSON string.
   *
   * @param value
   *            the object to convert
   * @return the JSON string
   * @throws RelayException
   *             if serialization fails
   */
  public static String toJson(Object value) throws RelayException {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new RelayException("Failed to serialize to JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Parses a JSON string to the specified type.
   *
   * @param json
   *            the JSON string
   * @param clazz
   *            the target class
   * @param <T>
   *            the target type
   * @return the parsed object
   * @throws RelayException
   *             if parsing fails
   */
  public static <T> T fromJson(String json, Class<T> clazz) throws RelayException {
    try {
      return objectMapper.readValue(json, clazz);
    } catch (JsonProcessingException e) {
      throw new RelayException(ErrorKind.VALIDATION, "Failed to parse JSON: " + e.getMessage(), e, null);
    }
  }

  /**
   * Converts an object to the specified type.
   *
   * <p>
   * This is how tool argument maps produced by an inference engine become typed
   * tool inputs.
   *
   * @param value
   *            the object to convert (typically a Map of arguments)
   * @param clazz
   *            the target class
   * @param <T>
   *            the target type
   * @return the converted object
   * @throws RelayException
   *             of kind {@link ErrorKind#VALIDATION} if conversion fails
   */
  public static <T> T convert(Object value, Class<T> clazz) throws RelayException {
    try {
      return objectMapper.convertValue(value, clazz);
    } catch (IllegalArgumentException e) {
      throw new RelayException(ErrorKind.VALIDATION,
          "Failed to convert object to " + clazz.getSimpleName() + ": " + e.getMessage(), e, null);
    }
  }

  /**
   * Converts a bean to a map of its JSON properties.
   *
   * @param value
   *            the object to convert
   * @return the property map
   * @throws RelayException
   *             if conversion fails
   */
  public static Map<String, Object> toMap(Object value) throws RelayException {
    try {
      return objectMapper.convertValue(value, new TypeReference<Map<String, Object>>() {
      });
    } catch (IllegalArgumentException e) {
      throw new RelayException("Failed to convert object to map: " + e.getMessage(), e);
    }
  }

  /**
   * Pretty prints a JSON object.
   *
   * @param value
   *            the object to print
   * @return the pretty-printed JSON string
   * @throws RelayException
   *             if serialization fails
   */
  public static String toPrettyJson(Object value) throws RelayException {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new RelayException("Failed to serialize to JSON: " + e.getMessage(), e);
    }
  }
}
