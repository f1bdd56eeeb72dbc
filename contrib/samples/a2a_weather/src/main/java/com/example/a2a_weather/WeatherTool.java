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
 */
package com.example.a2a_weather;

import com.google.adk.tools.Annotations.Schema;
import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nullable;

/** Weather lookup against a fixed table of cities, exposed to the assistant as a tool. */
public final class WeatherTool {

  /** Current conditions for one city. */
  static final class Conditions {
    final int celsius;
    final String condition;
    final int humidity;

    Conditions(int celsius, String condition, int humidity) {
      this.celsius = celsius;
      this.condition = condition;
      this.humidity = humidity;
    }
  }

  static final ImmutableMap<String, Conditions> WEATHER_DATA =
      ImmutableMap.<String, Conditions>builder()
          .put("New York", new Conditions(22, "Sunny", 60))
          .put("London", new Conditions(18, "Cloudy", 80))
          .put("Tokyo", new Conditions(28, "Rainy", 75))
          .put("Sydney", new Conditions(30, "Clear", 50))
          .put("Paris", new Conditions(20, "Partly Cloudy", 65))
          .put("Berlin", new Conditions(16, "Foggy", 70))
          .put("Moscow", new Conditions(5, "Snowy", 85))
          .put("Dubai", new Conditions(35, "Hot", 45))
          .put("San Francisco", new Conditions(19, "Foggy", 75))
          .put("Chicago", new Conditions(15, "Windy", 60))
          .buildOrThrow();

  private static final String FAHRENHEIT = "fahrenheit";

  /**
   * Describes the current weather in {@code location}. City names match case-insensitively; an
   * unknown city yields a "not available" sentence rather than an error.
   *
   * @param location the city to look up
   * @param unit {@code celsius} (the default when null or blank) or {@code fahrenheit}
   */
  public static String lookup(String location, @Nullable String unit) {
    Map.Entry<String, Conditions> match =
        WEATHER_DATA.entrySet().stream()
            .filter(entry -> entry.getKey().equalsIgnoreCase(location))
            .findFirst()
            .orElse(null);
    if (match == null) {
      return "Weather data for " + location + " is not available.";
    }

    Conditions conditions = match.getValue();
    boolean fahrenheit = unit != null && unit.trim().equalsIgnoreCase(FAHRENHEIT);
    String temperature =
        fahrenheit
            ? String.format(Locale.ROOT, "%.1f°F", toFahrenheit(conditions.celsius))
            : conditions.celsius + "°C";
    return String.format(
        Locale.ROOT,
        "The weather in %s is %s with a temperature of %s and humidity of %d%%.",
        match.getKey(),
        conditions.condition,
        temperature,
        conditions.humidity);
  }

  static double toFahrenheit(int celsius) {
    return celsius * 9.0 / 5.0 + 32;
  }

  /** Tool entry point invoked by the assistant. */
  public static ImmutableMap<String, Object> getWeather(
      @Schema(name = "location", description = "The city or location to get weather for")
          String location,
      @Schema(
              name = "unit",
              description = "The temperature unit, either 'celsius' or 'fahrenheit'")
          String unit) {
    return ImmutableMap.of("result", lookup(location, unit));
  }

  private WeatherTool() {}
}
