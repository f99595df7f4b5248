/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.suppierk.es.application;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Properties;

/**
 * Immutable settings of an {@link Application}.
 *
 * @param clock to timestamp events and notifications with
 * @param snapshottingEnabled whether snapshots are read and written
 * @param snapshottingIntervals positive snapshot intervals keyed by aggregate type name
 * @param maxPolicyDispatches maximum number of events dispatched to policies in one submission
 */
public record ApplicationConfiguration(
    Clock clock,
    boolean snapshottingEnabled,
    Map<String, Integer> snapshottingIntervals,
    int maxPolicyDispatches) {
  public static final String SNAPSHOTTING_ENABLED_PROPERTY = "es.snapshotting.enabled";
  public static final String SNAPSHOTTING_INTERVAL_PROPERTY_PREFIX = "es.snapshotting.interval.";
  public static final String MAX_POLICY_DISPATCHES_PROPERTY = "es.policy.max-dispatches";
  public static final int DEFAULT_MAX_POLICY_DISPATCHES = 10_000;

  public ApplicationConfiguration {
    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }

    if (snapshottingIntervals == null) {
      throw new IllegalArgumentException("Snapshotting intervals cannot be null");
    }

    for (Map.Entry<String, Integer> entry : snapshottingIntervals.entrySet()) {
      if (entry.getKey() == null || entry.getKey().isBlank()) {
        throw new IllegalArgumentException("Aggregate type name cannot be blank");
      }

      if (entry.getValue() == null || entry.getValue() < 1) {
        throw new IllegalArgumentException(
            "Snapshotting interval of '%s' must be positive, got %s"
                .formatted(entry.getKey(), entry.getValue()));
      }
    }

    if (maxPolicyDispatches < 1) {
      throw new IllegalArgumentException(
          "Maximum number of policy dispatches must be positive, got %d"
              .formatted(maxPolicyDispatches));
    }

    snapshottingIntervals = Map.copyOf(snapshottingIntervals);
  }

  /**
   * @return configuration with UTC system clock, snapshotting disabled and default dispatch limit
   */
  public static ApplicationConfiguration defaults() {
    return new ApplicationConfiguration(
        Clock.systemUTC(), false, Map.of(), DEFAULT_MAX_POLICY_DISPATCHES);
  }

  /**
   * Reads configuration from properties, missing values are taken from {@link #defaults()}.
   *
   * <ul>
   *   <li>{@value #SNAPSHOTTING_ENABLED_PROPERTY} - {@code true} or {@code false}
   *   <li>{@value #SNAPSHOTTING_INTERVAL_PROPERTY_PREFIX}{@code <AggregateType>} - positive integer
   *   <li>{@value #MAX_POLICY_DISPATCHES_PROPERTY} - positive integer
   * </ul>
   *
   * @param properties to read
   * @return configuration built from the properties
   * @throws IllegalArgumentException if any of known values is malformed
   */
  public static ApplicationConfiguration fromProperties(final Properties properties) {
    if (properties == null) {
      throw new IllegalArgumentException("Properties cannot be null");
    }

    final String enabledValue = properties.getProperty(SNAPSHOTTING_ENABLED_PROPERTY);
    final boolean enabled;
    if (enabledValue == null) {
      enabled = false;
    } else if ("true".equalsIgnoreCase(enabledValue.trim())) {
      enabled = true;
    } else if ("false".equalsIgnoreCase(enabledValue.trim())) {
      enabled = false;
    } else {
      throw new IllegalArgumentException(
          "'%s' must be true or false, got '%s'"
              .formatted(SNAPSHOTTING_ENABLED_PROPERTY, enabledValue));
    }

    final Map<String, Integer> intervals = new HashMap<>();
    for (String name : properties.stringPropertyNames()) {
      if (name.startsWith(SNAPSHOTTING_INTERVAL_PROPERTY_PREFIX)) {
        intervals.put(
            name.substring(SNAPSHOTTING_INTERVAL_PROPERTY_PREFIX.length()),
            parseInt(name, properties.getProperty(name)));
      }
    }

    final String maxDispatchesValue = properties.getProperty(MAX_POLICY_DISPATCHES_PROPERTY);
    final int maxDispatches =
        maxDispatchesValue == null
            ? DEFAULT_MAX_POLICY_DISPATCHES
            : parseInt(MAX_POLICY_DISPATCHES_PROPERTY, maxDispatchesValue);

    return new ApplicationConfiguration(Clock.systemUTC(), enabled, intervals, maxDispatches);
  }

  /**
   * @param newClock to use
   * @return a copy of this configuration with another clock
   */
  public ApplicationConfiguration withClock(final Clock newClock) {
    return new ApplicationConfiguration(
        newClock, snapshottingEnabled, snapshottingIntervals, maxPolicyDispatches);
  }

  /**
   * Enables snapshotting and sets the interval for the aggregate type.
   *
   * @param aggregateTypeName to take snapshots of
   * @param interval positive number of versions between snapshots
   * @return a copy of this configuration with snapshotting enabled
   */
  public ApplicationConfiguration withSnapshotting(
      final String aggregateTypeName, final int interval) {
    final Map<String, Integer> intervals = new HashMap<>(snapshottingIntervals);
    intervals.put(aggregateTypeName, interval);
    return new ApplicationConfiguration(clock, true, intervals, maxPolicyDispatches);
  }

  /**
   * @param enabled whether snapshots are read and written
   * @return a copy of this configuration with changed flag
   */
  public ApplicationConfiguration withSnapshottingEnabled(final boolean enabled) {
    return new ApplicationConfiguration(
        clock, enabled, snapshottingIntervals, maxPolicyDispatches);
  }

  /**
   * @param maxDispatches positive limit of events dispatched in one submission
   * @return a copy of this configuration with another limit
   */
  public ApplicationConfiguration withMaxPolicyDispatches(final int maxDispatches) {
    return new ApplicationConfiguration(
        clock, snapshottingEnabled, snapshottingIntervals, maxDispatches);
  }

  /**
   * @param aggregateTypeName of the aggregate
   * @return snapshot interval if snapshots of the type are taken
   */
  public OptionalInt snapshottingInterval(final String aggregateTypeName) {
    final Integer interval = snapshottingIntervals.get(aggregateTypeName);
    return snapshottingEnabled && interval != null ? OptionalInt.of(interval) : OptionalInt.empty();
  }

  private static int parseInt(final String name, final String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "'%s' must be an integer, got '%s'".formatted(name, value), e);
    }
  }
}
