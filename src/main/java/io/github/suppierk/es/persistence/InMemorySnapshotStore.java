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

import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/** Thread-safe {@link SnapshotStore} keeping everything on the heap. */
public final class InMemorySnapshotStore implements SnapshotStore {
  private final Map<UUID, NavigableMap<Integer, StoredSnapshot>> snapshotsByOriginator;

  public InMemorySnapshotStore() {
    this.snapshotsByOriginator = new ConcurrentHashMap<>();
  }

  /** {@inheritDoc} */
  @Override
  public void save(final StoredSnapshot snapshot) {
    if (snapshot == null) {
      throw new IllegalArgumentException("Snapshot cannot be null");
    }

    snapshotsByOriginator
        .computeIfAbsent(snapshot.originatorId(), id -> new ConcurrentSkipListMap<>())
        .putIfAbsent(snapshot.originatorVersion(), snapshot);
  }

  /** {@inheritDoc} */
  @Override
  public Optional<StoredSnapshot> latest(final UUID originatorId, final int maxVersion) {
    if (originatorId == null) {
      throw new IllegalArgumentException("Aggregate ID cannot be null");
    }

    final NavigableMap<Integer, StoredSnapshot> snapshots = snapshotsByOriginator.get(originatorId);
    if (snapshots == null) {
      return Optional.empty();
    }

    return Optional.ofNullable(snapshots.floorEntry(maxVersion)).map(Map.Entry::getValue);
  }
}
