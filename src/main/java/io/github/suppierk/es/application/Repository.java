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

import io.github.suppierk.es.domain.Aggregate;
import io.github.suppierk.es.domain.AggregateType;
import io.github.suppierk.es.domain.DomainEvent;
import io.github.suppierk.es.persistence.EventMapper;
import io.github.suppierk.es.persistence.EventStore;
import io.github.suppierk.es.persistence.SnapshotStore;
import io.github.suppierk.es.persistence.StoredEvent;
import io.github.suppierk.es.persistence.StoredSnapshot;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reconstructs aggregates from the {@link EventStore}, starting from the latest suitable snapshot
 * when snapshotting is enabled.
 *
 * <p>The repository reads committed data only. Policies which need aggregates mutated earlier in
 * the same submission must use {@link ProcessingEvent#getAggregate} instead.
 */
public final class Repository extends Suspicious {
  private final EventStore eventStore;
  private final SnapshotStore snapshotStore;
  private final EventMapper eventMapper;
  private final Clock clock;
  private final boolean snapshottingEnabled;

  Repository(
      final EventStore eventStore,
      final SnapshotStore snapshotStore,
      final EventMapper eventMapper,
      final Clock clock,
      final boolean snapshottingEnabled) {
    this.eventStore = throwIllegalArgumentIfNull(eventStore, "Event store");
    this.snapshotStore = throwIllegalArgumentIfNull(snapshotStore, "Snapshot store");
    this.eventMapper = throwIllegalArgumentIfNull(eventMapper, "Event mapper");
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
    this.snapshottingEnabled = snapshottingEnabled;
  }

  /**
   * @param aggregateType of the aggregate
   * @param aggregateId of the aggregate
   * @return the aggregate at its latest version
   * @throws AggregateNotFoundException if the aggregate has no events
   */
  public <A extends Aggregate<S, E>, S, E extends DomainEvent> A get(
      final AggregateType<A, S, E> aggregateType, final UUID aggregateId) {
    return find(aggregateType, aggregateId, Integer.MAX_VALUE)
        .orElseThrow(() -> new AggregateNotFoundException(aggregateId));
  }

  /**
   * Point-in-time variant of {@link #get(AggregateType, UUID)}.
   *
   * @param aggregateType of the aggregate
   * @param aggregateId of the aggregate
   * @param version to stop at, the aggregate may end up at a lower version if it has fewer events
   * @return the aggregate at the greatest version not exceeding the requested one
   * @throws AggregateNotFoundException if the aggregate has no events
   */
  public <A extends Aggregate<S, E>, S, E extends DomainEvent> A get(
      final AggregateType<A, S, E> aggregateType, final UUID aggregateId, final int version) {
    if (version < 1) {
      throw new IllegalArgumentException("Version must be positive, got %d".formatted(version));
    }

    return find(aggregateType, aggregateId, version)
        .orElseThrow(() -> new AggregateNotFoundException(aggregateId));
  }

  /**
   * @param aggregateType of the aggregate
   * @param aggregateId of the aggregate
   * @return the aggregate at its latest version, empty if it has no events
   */
  public <A extends Aggregate<S, E>, S, E extends DomainEvent> Optional<A> find(
      final AggregateType<A, S, E> aggregateType, final UUID aggregateId) {
    return find(aggregateType, aggregateId, Integer.MAX_VALUE);
  }

  private <A extends Aggregate<S, E>, S, E extends DomainEvent> Optional<A> find(
      final AggregateType<A, S, E> aggregateType, final UUID aggregateId, final int version) {
    throwIllegalArgumentIfNull(aggregateType, "Aggregate type");
    throwIllegalArgumentIfNull(aggregateId, "Aggregate ID");

    final A aggregate = aggregateType.newInstance(clock);

    int fromVersion = 1;
    if (snapshottingEnabled) {
      final Optional<StoredSnapshot> snapshot = snapshotStore.latest(aggregateId, version);
      if (snapshot.isPresent()) {
        aggregate.restore(
            aggregateId,
            snapshot.get().originatorVersion(),
            eventMapper.toState(aggregateType, snapshot.get()));
        fromVersion = snapshot.get().originatorVersion() + 1;
      }
    }

    final List<StoredEvent> storedEvents = eventStore.read(aggregateId, fromVersion, version);
    if (storedEvents.isEmpty() && aggregate.getVersion() == 0) {
      return Optional.empty();
    }

    final List<E> events = new ArrayList<>(storedEvents.size());
    for (StoredEvent storedEvent : storedEvents) {
      final DomainEvent event = eventMapper.toDomainEvent(storedEvent);
      if (!aggregateType.getEventClass().isInstance(event)) {
        throw new IllegalStateException(
            "Aggregate '%s' is not a '%s', found '%s'"
                .formatted(aggregateId, aggregateType.getName(), storedEvent.topic()));
      }

      events.add(aggregateType.getEventClass().cast(event));
    }

    aggregate.replay(events);
    return Optional.of(aggregate);
  }
}
