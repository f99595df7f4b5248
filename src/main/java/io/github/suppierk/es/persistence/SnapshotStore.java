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

import java.util.Optional;
import java.util.UUID;

/**
 * Storage of {@link StoredSnapshot}s used to shortcut replay.
 *
 * <p>Snapshots are an optimization only: a missing snapshot must never lead to a wrong state, only
 * to a longer replay.
 */
public interface SnapshotStore {
  /**
   * @return an instance of store which does not keep anything
   */
  static SnapshotStore empty() {
    return NoOp.INSTANCE;
  }

  /**
   * Saves the snapshot; saving the same version twice keeps the first one.
   *
   * @param snapshot to save
   */
  void save(final StoredSnapshot snapshot);

  /**
   * @param originatorId of the aggregate
   * @param maxVersion the snapshot version must not exceed, inclusive
   * @return the latest snapshot at or below the given version
   */
  Optional<StoredSnapshot> latest(final UUID originatorId, final int maxVersion);

  /**
   * @param originatorId of the aggregate
   * @return the latest snapshot of the aggregate
   */
  default Optional<StoredSnapshot> latest(final UUID originatorId) {
    return latest(originatorId, Integer.MAX_VALUE);
  }

  /** Default implementation of the store which never has a snapshot. */
  final class NoOp implements SnapshotStore {
    private static final SnapshotStore INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void save(final StoredSnapshot snapshot) {
      // Do nothing
    }

    @Override
    public Optional<StoredSnapshot> latest(final UUID originatorId, final int maxVersion) {
      return Optional.empty();
    }
  }
}
