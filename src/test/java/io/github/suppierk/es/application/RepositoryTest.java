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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.k8s.K8sNamespace;
import io.github.suppierk.es.persistence.EventMapper;
import io.github.suppierk.es.persistence.InMemoryEventStore;
import io.github.suppierk.es.persistence.InMemorySnapshotStore;
import io.github.suppierk.es.persistence.StoredSnapshot;
import io.github.suppierk.es.test.Tally;
import io.github.suppierk.es.test.TallyState;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RepositoryTest {
  static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
  static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  InMemoryEventStore eventStore;
  InMemorySnapshotStore snapshotStore;
  EventMapper eventMapper;
  Repository repository;

  @BeforeEach
  void setUp() {
    eventStore = new InMemoryEventStore();
    snapshotStore = new InMemorySnapshotStore();
    eventMapper = new EventMapper();
    eventMapper.register(Tally.TYPE);
    eventMapper.register(K8sNamespace.TYPE);
    repository = new Repository(eventStore, snapshotStore, eventMapper, CLOCK, true);
  }

  UUID storeTally(String... marks) {
    final Tally tally = Tally.open(CLOCK, "first");
    for (String mark : marks) {
      tally.mark(mark);
    }

    eventStore.append(tally.collectEvents().stream().map(eventMapper::toStoredEvent).toList());
    return tally.getId();
  }

  @Test
  void when_aggregate_has_no_events_not_found_must_be_reported() {
    final UUID unknown = UUID.randomUUID();

    final var exception =
        assertThrows(AggregateNotFoundException.class, () -> repository.get(Tally.TYPE, unknown));

    assertEquals(unknown, exception.getAggregateId());
    assertTrue(repository.find(Tally.TYPE, unknown).isEmpty());
  }

  @Test
  void aggregate_must_be_replayed_up_to_its_latest_version() {
    final UUID id = storeTally("a", "b");

    final Tally tally = repository.get(Tally.TYPE, id);

    assertEquals(id, tally.getId());
    assertEquals(3, tally.getVersion());
    assertEquals(new TallyState("first", List.of("a", "b")), tally.getState());
    assertTrue(tally.getPendingEvents().isEmpty());
  }

  @Test
  void point_in_time_read_must_stop_at_requested_version() {
    final UUID id = storeTally("a", "b");

    assertEquals(List.of("a"), repository.get(Tally.TYPE, id, 2).getMarks());
    assertEquals(3, repository.get(Tally.TYPE, id, 10).getVersion());
    assertThrows(IllegalArgumentException.class, () -> repository.get(Tally.TYPE, id, 0));
  }

  @Test
  void replay_from_snapshot_must_equal_replay_from_scratch() {
    final UUID id = storeTally("a", "b", "c");
    final Tally atVersionTwo = repository.get(Tally.TYPE, id, 2);
    snapshotStore.save(eventMapper.toStoredSnapshot(Tally.TYPE, atVersionTwo, NOW));

    final var withoutSnapshots =
        new Repository(eventStore, snapshotStore, eventMapper, CLOCK, false);

    assertEquals(
        withoutSnapshots.get(Tally.TYPE, id).getState(), repository.get(Tally.TYPE, id).getState());
    assertEquals(4, repository.get(Tally.TYPE, id).getVersion());
  }

  @Test
  void snapshot_must_be_used_only_up_to_requested_version() {
    final UUID id = storeTally("a", "b");
    // State which cannot be produced by the events proves the snapshot was read
    snapshotStore.save(
        new StoredSnapshot(id, 2, "Tally", "{\"name\":\"first\",\"marks\":[\"snapshot\"]}", NOW));

    assertEquals(List.of("snapshot", "b"), repository.get(Tally.TYPE, id).getMarks());
    assertEquals(List.of("snapshot"), repository.get(Tally.TYPE, id, 2).getMarks());
    assertEquals(List.of(), repository.get(Tally.TYPE, id, 1).getMarks());
  }

  @Test
  void when_events_belong_to_another_aggregate_type_illegal_state_must_be_thrown() {
    final UUID id = storeTally("a");

    assertThrows(IllegalStateException.class, () -> repository.get(K8sNamespace.TYPE, id));
  }

  @Test
  void when_arguments_are_null_illegal_argument_must_be_thrown() {
    final UUID id = UUID.randomUUID();

    assertThrows(IllegalArgumentException.class, () -> repository.get(null, id));
    assertThrows(IllegalArgumentException.class, () -> repository.get(Tally.TYPE, null));
  }
}
