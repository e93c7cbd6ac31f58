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

package dev.agentrelay.plugins.weather;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/** Unit tests for TemperatureUnit. */
class TemperatureUnitTest {

  @Test
  void testFromPreference() {
    assertEquals(TemperatureUnit.FAHRENHEIT, TemperatureUnit.fromPreference("Fahrenheit"));
    assertEquals(TemperatureUnit.FAHRENHEIT, TemperatureUnit.fromPreference(" fahrenheit "));
    assertEquals(TemperatureUnit.CELSIUS, TemperatureUnit.fromPreference("Celsius"));
    assertEquals(TemperatureUnit.CELSIUS, TemperatureUnit.fromPreference("Kelvin"));
    assertEquals(TemperatureUnit.CELSIUS, TemperatureUnit.fromPreference(null));
    assertEquals(TemperatureUnit.CELSIUS, TemperatureUnit.fromPreference(42));
  }

  @Test
  void testConversion() {
    assertEquals(77.0, TemperatureUnit.FAHRENHEIT.fromCelsius(25), 1e-9);
    assertEquals(59.0, TemperatureUnit.FAHRENHEIT.fromCelsius(15), 1e-9);
    assertEquals(64.4, TemperatureUnit.FAHRENHEIT.fromCelsius(18), 1e-9);
    assertEquals(-40.0, TemperatureUnit.FAHRENHEIT.fromCelsius(-40), 1e-9);
    assertEquals(18.0, TemperatureUnit.CELSIUS.fromCelsius(18), 1e-9);
  }

  @Test
  void testConversionIsWithinRounding() {
    for (int tenths = -500; tenths <= 500; tenths += 7) {
      double celsius = tenths / 10.0;
      double exact = celsius * 9 / 5 + 32;
      assertEquals(exact, TemperatureUnit.FAHRENHEIT.fromCelsius(celsius), 0.05 + 1e-9);
    }
  }
}
