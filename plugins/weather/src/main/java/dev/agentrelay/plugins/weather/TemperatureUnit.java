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

/**
 * Temperature units a user can prefer.
 */
public enum TemperatureUnit {
  CELSIUS("Celsius", "°C"), FAHRENHEIT("Fahrenheit", "°F");

  private final String displayName;
  private final String symbol;

  TemperatureUnit(String displayName, String symbol) {
    this.displayName = displayName;
    this.symbol = symbol;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getSymbol() {
    return symbol;
  }

  /**
   * Resolves a stored preference. Only "Fahrenheit" (any case) selects
   * Fahrenheit; anything else, including no preference, means Celsius.
   *
   * @param preference
   *            the stored preference value, may be null
   * @return the unit
   */
  public static TemperatureUnit fromPreference(Object preference) {
    if (preference != null && FAHRENHEIT.displayName.equalsIgnoreCase(preference.toString().trim())) {
      return FAHRENHEIT;
    }
    return CELSIUS;
  }

  /**
   * Converts a Celsius temperature to this unit, rounded to one decimal place.
   *
   * @param celsius
   *            the temperature in Celsius
   * @return the converted temperature
   */
  public double fromCelsius(double celsius) {
    double value = this == FAHRENHEIT ? celsius * 9 / 5 + 32 : celsius;
    return Math.round(value * 10) / 10.0;
  }
}
