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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * WeatherTable is the fixed set of cities the weather tools know about.
 *
 * <p>
 * Lookups ignore case and whitespace, so {@code " new york "},
 * {@code "NEW YORK"} and {@code "newyork"} all find New York.
 */
public final class WeatherTable {

  /** One known city. */
  public static final class Entry {
    private final String city;
    private final String condition;
    private final double temperatureCelsius;

    public Entry(String city, String condition, double temperatureCelsius) {
      this.city = city;
      this.condition = condition;
      this.temperatureCelsius = temperatureCelsius;
    }

    /**
     * Gets the canonical city name.
     *
     * @return the city name
     */
    public String getCity() {
      return city;
    }

    public String getCondition() {
      return condition;
    }

    public double getTemperatureCelsius() {
      return temperatureCelsius;
    }
  }

  private static final WeatherTable DEFAULT = new WeatherTable(List.of(new Entry("New York", "sunny", 25),
      new Entry("London", "cloudy", 15), new Entry("Tokyo", "light rain", 18)));

  private final Map<String, Entry> entries = new LinkedHashMap<>();

  /**
   * Creates a new WeatherTable.
   *
   * @param entries
   *            the known cities
   * @throws IllegalArgumentException
   *             if two entries normalize to the same city
   */
  public WeatherTable(List<Entry> entries) {
    for (Entry entry : entries) {
      if (this.entries.put(normalize(entry.getCity()), entry) != null) {
        throw new IllegalArgumentException("City listed twice: " + entry.getCity());
      }
    }
  }

  /**
   * Returns the built-in table of New York, London and Tokyo.
   *
   * @return the default table
   */
  public static WeatherTable defaultTable() {
    return DEFAULT;
  }

  /**
   * Normalizes a city name for lookup: strips all whitespace and lower-cases.
   *
   * @param city
   *            the city as typed
   * @return the lookup key
   */
  public static String normalize(String city) {
    return city.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
  }

  /**
   * Looks up a city.
   *
   * @param city
   *            the city as typed
   * @return the entry, or null if the city is unknown or blank
   */
  public Entry lookup(String city) {
    if (city == null) {
      return null;
    }
    return entries.get(normalize(city));
  }

  public List<Entry> getEntries() {
    return List.copyOf(entries.values());
  }
}
