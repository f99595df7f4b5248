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

import java.time.Instant;
import java.util.UUID;

/**
 * Serialized aggregate state at a given version.
 *
 * @param originatorId of the aggregate
 * @param originatorVersion of the aggregate at the time of the snapshot
 * @param topic name of the aggregate type
 * @param state serialized aggregate state
 * @param timestamp when the snapshot was taken
 */
public record StoredSnapshot(
    UUID originatorId, int originatorVersion, String topic, String state, Instant timestamp) {
  public StoredSnapshot {
    if (originatorId == null || topic == null || state == null || timestamp == null) {
      throw new IllegalArgumentException("Stored snapshot fields cannot be null");
    }

    if (originatorVersion < 1) {
      throw new IllegalArgumentException(
          "Snapshot version must be positive, got %d".formatted(originatorVersion));
    }
  }
}
