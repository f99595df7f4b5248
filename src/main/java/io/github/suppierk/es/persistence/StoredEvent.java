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
 * Serialized form of a domain event as it crosses the Event Store boundary.
 *
 * @param originatorId of the aggregate the event belongs to
 * @param originatorVersion of the aggregate after the event
 * @param topic stable name identifying the event type
 * @param state serialized event payload
 * @param timestamp of the event
 */
public record StoredEvent(
    UUID originatorId, int originatorVersion, String topic, String state, Instant timestamp) {
  public StoredEvent {
    if (originatorId == null || topic == null || state == null || timestamp == null) {
      throw new IllegalArgumentException("Stored event fields cannot be null");
    }

    if (originatorVersion < 1) {
      throw new IllegalArgumentException(
          "Stored event version must be positive, got %d".formatted(originatorVersion));
    }
  }
}
