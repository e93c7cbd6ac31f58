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

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for JsonUtils.
 */
class JsonUtilsTest {

  @Test
  void testConvertMapToBean() {
    CityInput input = JsonUtils.convert(Map.of("city", "London", "ignored", 1), CityInput.class);

    assertEquals("London", input.getCity());
  }

  @Test
  void testConvertFailureIsValidationError() {
    RelayException e = assertThrows(RelayException.class,
        () -> JsonUtils.convert(Map.of("count", "not-a-number"), CountInput.class));

    assertEquals(ErrorKind.VALIDATION, e.getKind());
  }

  @Test
  void testToMap() {
    CityInput input = new CityInput();
    input.setCity("Tokyo");

    assertEquals(Map.of("city", "Tokyo"), JsonUtils.toMap(input));
  }

  @Test
  void testInstantsAreIsoStrings() {
    String json = JsonUtils.toJson(Map.of("at", Instant.parse("2025-01-01T00:00:00Z")));

    assertEquals("{\"at\":\"2025-01-01T00:00:00Z\"}", json);
  }

  @Test
  void testFromJsonInvalid() {
    RelayException e = assertThrows(RelayException.class, () -> JsonUtils.fromJson("{not json", CityInput.class));

    assertEquals(ErrorKind.VALIDATION, e.getKind());
  }

  static class CityInput {
    private String city;

    public String getCity() {
      return city;
    }

    public void setCity(String city) {
      this.city = city;
    }
  }

  static class CountInput {
    private int count;

    public int getCount() {
      return count;
    }

    public void setCount(int count) {
      this.count = count;
    }
  }
}
