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

package io.github.suppierk.es.persistence;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only, per-aggregate ordered log of {@link StoredEvent}s.
 *
 * <p>The only shared mutable resource of the system: submissions running concurrently interact
 * exclusively through {@link #append(List)}, which is all-or-nothing and guarded by an optimistic
 * version check.
 */
public interface EventStore {
  /**
   * Atomically appends events of one or more aggregates.
   *
   * <p>Events of each aggregate must have consecutive versions; the version preceding the first
   * event of an aggregate is the expected stored version of that aggregate. Either every event is
   * appended, receiving positions in the given order, or none is.
   *
   * @param events to append, in commit order
   * @throws ConcurrencyConflictException if any aggregate is not at its expected version
   * @throws IllegalArgumentException if versions of an aggregate are not consecutive
   */
  void append(final List<StoredEvent> events);

  /**
   * Single aggregate variant of {@link #append(List)}.
   *
   * @param originatorId of the aggregate
   * @param expectedVersion currently stored version of the aggregate, {@code 0} for a new one
   * @param events to append, their versions must continue the expected version
   * @throws ConcurrencyConflictException if the aggregate is not at its expected version
   */
  default void append(
      final UUID originatorId, final int expectedVersion, final List<StoredEvent> events) {
    if (originatorId == null || events == null) {
      throw new IllegalArgumentException("Aggregate ID and events cannot be null");
    }

    int nextVersion = expectedVersion + 1;
    for (StoredEvent event : events) {
      if (!originatorId.equals(event.originatorId()) || event.originatorVersion() != nextVersion) {
        throw new IllegalArgumentException(
            "Event %s@%d does not continue aggregate '%s' at version %d"
                .formatted(
                    event.originatorId(),
                    event.originatorVersion(),
                    originatorId,
                    nextVersion - 1));
      }

      nextVersion++;
    }

    append(events);
  }

  /**
   * @param originatorId of the aggregate
   * @param fromVersion first version to read, inclusive
   * @return events of the aggregate ordered by version, empty if there are none
   */
  default List<StoredEvent> read(final UUID originatorId, final int fromVersion) {
    return read(originatorId, fromVersion, Integer.MAX_VALUE);
  }

  /**
   * Point-in-time read of an aggregate history.
   *
   * @param originatorId of the aggregate
   * @param fromVersion first version to read, inclusive
   * @param toVersion last version to read, inclusive
   * @return events of the aggregate ordered by version, empty if there are none
   */
  List<StoredEvent> read(final UUID originatorId, final int fromVersion, final int toVersion);

  /**
   * @param originatorId of the aggregate
   * @return the version of the last stored event, {@code 0} if there are none
   */
  int currentVersion(final UUID originatorId);

  /**
   * Reads the global log of committed events.
   *
   * @param afterPosition last position already seen, {@code 0} to start from the beginning
   * @param limit maximum number of entries to return
   * @return events in commit order
   */
  List<LoggedEvent> readAll(final long afterPosition, final int limit);

  /**
   * Groups events by aggregate preserving the order of first appearance and verifies that the
   * versions of every aggregate are consecutive.
   *
   * @param events to group
   * @return events keyed by aggregate identifier
   * @throws IllegalArgumentException if the versions of an aggregate have gaps or repetitions
   */
  static Map<UUID, List<StoredEvent>> groupByOriginator(final List<StoredEvent> events) {
    if (events == null) {
      throw new IllegalArgumentException("Events cannot be null");
    }

    final Map<UUID, List<StoredEvent>> grouped = new LinkedHashMap<>();
    for (StoredEvent event : events) {
      if (event == null) {
        throw new IllegalArgumentException("Event cannot be null");
      }

      final List<StoredEvent> aggregateEvents =
          grouped.computeIfAbsent(event.originatorId(), id -> new ArrayList<>());

      if (!aggregateEvents.isEmpty()) {
        final int previousVersion =
            aggregateEvents.get(aggregateEvents.size() - 1).originatorVersion();
        if (event.originatorVersion() != previousVersion + 1) {
          throw new IllegalArgumentException(
              "Events of aggregate '%s' are not consecutive: %d follows %d"
                  .formatted(event.originatorId(), event.originatorVersion(), previousVersion));
        }
      }

      aggregateEvents.add(event);
    }

    return grouped;
  }
}
