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

import io.github.suppierk.es.async.DomainNotification;
import io.github.suppierk.es.domain.Aggregate;
import io.github.suppierk.es.domain.AggregateType;
import io.github.suppierk.es.domain.DomainEvent;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Unit of work of a single submission: the ordered list of new events and the aggregates which
 * produced them.
 *
 * <p>The event list only grows. Policies append to it through {@link #collectEvents}, and the
 * dispatcher walks it with an index, so events collected while processing are dispatched after
 * every event queued before them.
 *
 * <p><b>Design note</b>: instances are confined to the submitting thread and are never shared
 * between submissions, hence no synchronization.
 */
public final class ProcessingEvent extends Suspicious {
  private final Repository repository;
  private final Clock clock;
  private final List<DomainEvent> events;
  private final Map<UUID, Aggregate<?, ?>> aggregates;
  private final List<DomainNotification> notifications;

  ProcessingEvent(final Repository repository, final Clock clock) {
    this.repository = throwIllegalArgumentIfNull(repository, "Repository");
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
    this.events = new ArrayList<>();
    this.aggregates = new LinkedHashMap<>();
    this.notifications = new ArrayList<>();
  }

  /**
   * Moves pending events of the aggregates to the end of the event list and remembers the
   * aggregates for later lookups.
   *
   * @param changedAggregates whose pending events must be recorded
   * @throws IllegalStateException if an aggregate is blank, or another instance of the same
   *     aggregate is already part of this submission
   */
  public void collectEvents(final Aggregate<?, ?>... changedAggregates) {
    throwIllegalArgumentIfNull(changedAggregates, "Aggregates");

    for (Aggregate<?, ?> aggregate : changedAggregates) {
      throwIllegalArgumentIfNull(aggregate, "Aggregate");
      final UUID aggregateId = throwIllegalStateIfNull(aggregate.getId(), "Aggregate ID");

      final Aggregate<?, ?> known = aggregates.get(aggregateId);
      if (known != null && known != aggregate) {
        throw new IllegalStateException(
            "Another instance of aggregate '%s' is already part of this submission"
                .formatted(aggregateId));
      }

      aggregates.put(aggregateId, aggregate);
      events.addAll(aggregate.collectEvents());
    }
  }

  /**
   * Looks the aggregate up among the aggregates of this submission first, and loads it from the
   * repository otherwise. A loaded aggregate becomes part of this submission.
   *
   * @param aggregateType of the aggregate
   * @param aggregateId of the aggregate
   * @return the aggregate with all changes made so far in this submission
   * @throws AggregateNotFoundException if the aggregate is neither known nor recorded
   */
  public <A extends Aggregate<S, E>, S, E extends DomainEvent> A getAggregate(
      final AggregateType<A, S, E> aggregateType, final UUID aggregateId) {
    return findAggregate(aggregateType, aggregateId)
        .orElseThrow(() -> new AggregateNotFoundException(aggregateId));
  }

  /**
   * Same as {@link #getAggregate(AggregateType, UUID)}, reporting a missing aggregate as empty.
   *
   * @param aggregateType of the aggregate
   * @param aggregateId of the aggregate
   * @return the aggregate with all changes made so far in this submission
   */
  public <A extends Aggregate<S, E>, S, E extends DomainEvent> Optional<A> findAggregate(
      final AggregateType<A, S, E> aggregateType, final UUID aggregateId) {
    throwIllegalArgumentIfNull(aggregateType, "Aggregate type");
    throwIllegalArgumentIfNull(aggregateId, "Aggregate ID");

    final Aggregate<?, ?> known = aggregates.get(aggregateId);
    if (known != null) {
      return Optional.of(aggregateType.cast(known));
    }

    final Optional<A> loaded = repository.find(aggregateType, aggregateId);
    loaded.ifPresent(aggregate -> aggregates.put(aggregateId, aggregate));
    return loaded;
  }

  /**
   * Raises a notification which is delivered only if this submission is committed.
   *
   * @param originatorId of the aggregate the notification is about
   * @param message to deliver
   */
  public void addNotification(final UUID originatorId, final String message) {
    notifications.add(
        new DomainNotification(UUID.randomUUID(), Instant.now(clock), originatorId, message));
  }

  /**
   * @param index of the event, starting from {@code 0}
   * @return event at the given position
   */
  public DomainEvent getEvent(final int index) {
    return events.get(index);
  }

  /**
   * @return current number of events, grows while policies collect events
   */
  public int size() {
    return events.size();
  }

  /**
   * @return a copy of the collected events in the order of collection
   */
  public List<DomainEvent> getEvents() {
    return List.copyOf(events);
  }

  /**
   * @return aggregates of this submission keyed by their identifiers
   */
  public Map<UUID, Aggregate<?, ?>> getAggregates() {
    return Collections.unmodifiableMap(aggregates);
  }

  /**
   * @return a copy of the notifications raised so far
   */
  public List<DomainNotification> getNotifications() {
    return List.copyOf(notifications);
  }
}
