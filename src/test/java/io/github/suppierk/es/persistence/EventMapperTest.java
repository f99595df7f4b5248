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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.es.k8s.K8sNamespace;
import io.github.suppierk.es.test.Tally;
import io.github.suppierk.es.test.TallyEvent;
import io.github.suppierk.es.test.TallyState;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventMapperTest {
  static final Instant NOW = Instant.parse("2024-01-01T00:00:00.123456789Z");
  static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  EventMapper mapper;

  @BeforeEach
  void setUp() {
    mapper = new EventMapper();
    mapper.register(Tally.TYPE);
  }

  @Test
  void stored_event_must_carry_topic_and_coordinates_of_the_event() {
    final Tally tally = Tally.open(CLOCK, "first");
    final TallyEvent.Marked marked = tally.mark("a");

    final StoredEvent stored = mapper.toStoredEvent(marked);

    assertEquals("Tally.Marked", stored.topic());
    assertEquals(tally.getId(), stored.originatorId());
    assertEquals(2, stored.originatorVersion());
    assertEquals(NOW, stored.timestamp());
    assertEquals(marked, mapper.toDomainEvent(stored));
  }

  @Test
  void when_topic_is_unknown_illegal_state_must_be_thrown() {
    final Tally tally = Tally.open(CLOCK, "first");
    final StoredEvent stored = mapper.toStoredEvent(tally.getPendingEvents().get(0));
    final StoredEvent unknown =
        new StoredEvent(
            stored.originatorId(),
            stored.originatorVersion(),
            "Tally.Closed",
            stored.state(),
            stored.timestamp());

    assertThrows(IllegalStateException.class, () -> mapper.toDomainEvent(unknown));
  }

  @Test
  void when_payload_does_not_match_coordinates_illegal_state_must_be_thrown() {
    final Tally tally = Tally.open(CLOCK, "first");
    final StoredEvent stored = mapper.toStoredEvent(tally.getPendingEvents().get(0));
    final StoredEvent moved =
        new StoredEvent(
            stored.originatorId(), 7, stored.topic(), stored.state(), stored.timestamp());

    assertThrows(IllegalStateException.class, () -> mapper.toDomainEvent(moved));
  }

  @Test
  void when_event_is_not_registered_illegal_state_must_be_thrown() {
    final K8sNamespace k8sNamespace =
        K8sNamespace.register(CLOCK, "1", "kube-system", NOW, List.of());
    final var event = k8sNamespace.getPendingEvents().get(0);

    assertThrows(IllegalStateException.class, () -> mapper.toStoredEvent(event));
  }

  @Test
  void when_aggregate_type_is_registered_twice_illegal_state_must_be_thrown() {
    assertThrows(IllegalStateException.class, () -> mapper.register(Tally.TYPE));
  }

  @Test
  void snapshot_must_restore_the_same_state() {
    final Tally tally = Tally.open(CLOCK, "first");
    tally.mark("a");

    final StoredSnapshot snapshot = mapper.toStoredSnapshot(Tally.TYPE, tally, NOW);

    assertEquals("Tally", snapshot.topic());
    assertEquals(2, snapshot.originatorVersion());
    assertEquals(new TallyState("first", List.of("a")), mapper.toState(Tally.TYPE, snapshot));
  }

  @Test
  void when_snapshot_belongs_to_another_type_illegal_state_must_be_thrown() {
    final Tally tally = Tally.open(CLOCK, "first");
    final StoredSnapshot snapshot = mapper.toStoredSnapshot(Tally.TYPE, tally, NOW);
    final StoredSnapshot foreign =
        new StoredSnapshot(
            snapshot.originatorId(), 1, "K8sNamespace", snapshot.state(), snapshot.timestamp());

    assertThrows(IllegalStateException.class, () -> mapper.toState(Tally.TYPE, foreign));
  }

  @Test
  void when_aggregate_is_blank_snapshot_must_throw_illegal_state() {
    final Tally blank = new Tally(CLOCK);

    assertThrows(
        IllegalStateException.class, () -> mapper.toStoredSnapshot(Tally.TYPE, blank, NOW));
  }
}
