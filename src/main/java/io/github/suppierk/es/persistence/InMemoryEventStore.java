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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/** Thread-safe {@link EventStore} keeping everything on the heap. */
public final class InMemoryEventStore implements EventStore {
  private final Map<UUID, List<StoredEvent>> eventsByOriginator;
  private final List<LoggedEvent> log;
  private final ReentrantReadWriteLock lock;

  public InMemoryEventStore() {
    this.eventsByOriginator = new HashMap<>();
    this.log = new ArrayList<>();
    this.lock = new ReentrantReadWriteLock();
  }

  /** {@inheritDoc} */
  @Override
  public void append(final List<StoredEvent> events) {
    final Map<UUID, List<StoredEvent>> grouped = EventStore.groupByOriginator(events);
    if (grouped.isEmpty()) {
      return;
    }

    lock.writeLock().lock();
    try {
      // Verify everything first, so that a conflict leaves no trace
      for (Map.Entry<UUID, List<StoredEvent>> entry : grouped.entrySet()) {
        final int expectedVersion = entry.getValue().get(0).originatorVersion() - 1;
        final int actualVersion = storedVersion(entry.getKey());
        if (actualVersion != expectedVersion) {
          throw new ConcurrencyConflictException(entry.getKey(), expectedVersion, actualVersion);
        }
      }

      for (StoredEvent event : events) {
        eventsByOriginator
            .computeIfAbsent(event.originatorId(), id -> new ArrayList<>())
            .add(event);
        log.add(new LoggedEvent(log.size() + 1L, event));
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** {@inheritDoc} */
  @Override
  public List<StoredEvent> read(
      final UUID originatorId, final int fromVersion, final int toVersion) {
    if (originatorId == null) {
      throw new IllegalArgumentException("Aggregate ID cannot be null");
    }

    lock.readLock().lock();
    try {
      final List<StoredEvent> result = new ArrayList<>();
      for (StoredEvent event : eventsByOriginator.getOrDefault(originatorId, List.of())) {
        if (event.originatorVersion() >= fromVersion && event.originatorVersion() <= toVersion) {
          result.add(event);
        }
      }

      return Collections.unmodifiableList(result);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** {@inheritDoc} */
  @Override
  public int currentVersion(final UUID originatorId) {
    if (originatorId == null) {
      throw new IllegalArgumentException("Aggregate ID cannot be null");
    }

    lock.readLock().lock();
    try {
      return storedVersion(originatorId);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** {@inheritDoc} */
  @Override
  public List<LoggedEvent> readAll(final long afterPosition, final int limit) {
    if (afterPosition < 0 || limit < 0) {
      throw new IllegalArgumentException("Position and limit cannot be negative");
    }

    lock.readLock().lock();
    try {
      final int from = (int) Math.min(afterPosition, log.size());
      final int to = (int) Math.min((long) from + limit, log.size());
      return List.copyOf(log.subList(from, to));
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * @return {@code true} if the current thread holds the write lock
   */
  boolean isWriteLockHeld() {
    return lock.isWriteLockedByCurrentThread();
  }

  private int storedVersion(final UUID originatorId) {
    final List<StoredEvent> stored = eventsByOriginator.get(originatorId);
    return stored == null || stored.isEmpty()
        ? 0
        : stored.get(stored.size() - 1).originatorVersion();
  }
}
