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
import io.github.suppierk.es.async.DomainNotificationProducer;
import io.github.suppierk.es.domain.Aggregate;
import io.github.suppierk.es.domain.AggregateType;
import io.github.suppierk.es.domain.DomainEvent;
import io.github.suppierk.es.persistence.EventMapper;
import io.github.suppierk.es.persistence.EventStore;
import io.github.suppierk.es.persistence.LoggedEvent;
import io.github.suppierk.es.persistence.SnapshotStore;
import io.github.suppierk.es.persistence.StoredEvent;
import io.github.suppierk.java.Try;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of event-sourced use cases.
 *
 * <p>Subclasses register their {@link AggregateType}s and {@link Policy}s during construction and
 * expose business operations which load aggregates from the {@link #getRepository()}, change them
 * and {@link #save} them.
 *
 * <p>Each {@link #save} call is one submission:
 *
 * <ul>
 *   <li>pending events of the given aggregates start a new {@link ProcessingEvent};
 *   <li>policies react to every event, including the events produced by other policies;
 *   <li>all events are appended to the {@link EventStore} at once, or none of them is;
 *   <li>after a successful append, notifications are published and snapshots are taken.
 * </ul>
 *
 * <p>A failed submission leaves no trace. Aggregates given to it must be considered stale: a retry
 * starts from loading them again.
 */
public abstract non-sealed class Application extends Suspicious {
  private static final Logger LOGGER = LoggerFactory.getLogger(Application.class);

  private final ApplicationConfiguration configuration;
  private final EventStore eventStore;
  private final SnapshotStore snapshotStore;
  private final DomainNotificationProducer domainNotificationProducer;
  private final EventMapper eventMapper;
  private final Repository repository;
  private final PolicyDispatcher policyDispatcher;
  private final Map<Class<?>, AggregateType<?, ?, ?>> aggregateTypesByClass;

  /**
   * Default constructor.
   *
   * @param configuration of the application
   * @param eventStore to record events into
   * @param snapshotStore to keep snapshots in, use {@link SnapshotStore#empty()} to disable
   * @param domainNotificationProducer to publish notifications raised by policies
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  protected Application(
      final ApplicationConfiguration configuration,
      final EventStore eventStore,
      final SnapshotStore snapshotStore,
      final DomainNotificationProducer domainNotificationProducer) {
    this.configuration = throwIllegalArgumentIfNull(configuration, "Configuration");
    this.eventStore = throwIllegalArgumentIfNull(eventStore, "Event store");
    this.snapshotStore = throwIllegalArgumentIfNull(snapshotStore, "Snapshot store");
    this.domainNotificationProducer =
        throwIllegalArgumentIfNull(domainNotificationProducer, "Notification producer");

    this.eventMapper = new EventMapper();
    this.repository =
        new Repository(
            eventStore,
            snapshotStore,
            eventMapper,
            configuration.clock(),
            configuration.snapshottingEnabled());
    this.policyDispatcher =
        new PolicyDispatcher(this::defaultPolicy, configuration.maxPolicyDispatches());
    this.aggregateTypesByClass = new ConcurrentHashMap<>();
  }

  /**
   * Makes the aggregate type known to the application, so its events can be recorded and read.
   *
   * @param aggregateType to register
   * @throws IllegalStateException if the type, or any of its events, is already registered
   */
  protected final void addAggregateType(final AggregateType<?, ?, ?> aggregateType) {
    throwIllegalArgumentIfNull(aggregateType, "Aggregate type");

    synchronized (aggregateTypesByClass) {
      if (aggregateTypesByClass.containsKey(aggregateType.getAggregateClass())) {
        throw new IllegalStateException(
            "Aggregate type '%s' is already registered".formatted(aggregateType.getName()));
      }

      // Mapper rejects clashing names and events before anything is remembered
      eventMapper.register(aggregateType);
      aggregateTypesByClass.put(aggregateType.getAggregateClass(), aggregateType);
    }
  }

  /**
   * @param eventClass exact class of events to react to
   * @param policy to run within submissions containing such events
   * @param <E> the type of the event
   * @throws IllegalStateException if a policy for the event class is already registered
   */
  public final <E extends DomainEvent> void addPolicy(
      final Class<E> eventClass, final Policy<? super E> policy) {
    policyDispatcher.addPolicy(eventClass, policy);
  }

  /**
   * @return event classes with a registered policy
   */
  public final Set<Class<? extends DomainEvent>> getSupportedEventClasses() {
    return policyDispatcher.getSupportedEventClasses();
  }

  /**
   * Records pending events of the aggregates together with all reactions of policies.
   *
   * @param aggregates with pending events
   * @return all recorded events in the order of recording, empty if there was nothing to record
   * @throws io.github.suppierk.es.persistence.ConcurrencyConflictException if any of the changed
   *     aggregates was changed concurrently, the whole submission must be retried
   * @throws PolicyLoopExceededException if policies did not stop producing events
   */
  public final List<DomainEvent> save(final Aggregate<?, ?>... aggregates) {
    throwIllegalArgumentIfNull(aggregates, "Aggregates");

    final ProcessingEvent processingEvent =
        new ProcessingEvent(repository, configuration.clock());
    processingEvent.collectEvents(aggregates);

    final Try<List<DomainEvent>> output = Try.of(() -> record(processingEvent));

    output.ifSuccess(
        events -> {
          if (!events.isEmpty()) {
            LOGGER.debug(
                "Recorded {} events of {} aggregates",
                events.size(),
                processingEvent.getAggregates().size());
          }

          publishNotifications(processingEvent.getNotifications());
          takeSnapshots(processingEvent, events);
        });

    output.ifFailure(
        reason ->
            LOGGER.warn(
                "Submission of {} events was discarded: {}",
                processingEvent.size(),
                reason.getMessage(),
                reason));

    return output.get();
  }

  /**
   * @return repository to load aggregates with
   */
  public final Repository getRepository() {
    return repository;
  }

  /**
   * Reads the log of all recorded events in the order of recording.
   *
   * @param afterPosition last position already seen, {@code 0} to start from the beginning
   * @param limit maximum number of entries to return
   * @return recorded events with their log positions
   */
  public final List<LoggedEvent> readEventLog(final long afterPosition, final int limit) {
    return eventStore.readAll(afterPosition, limit);
  }

  /**
   * @return configuration of this application
   */
  public final ApplicationConfiguration getConfiguration() {
    return configuration;
  }

  /**
   * @return clock to give to new aggregates
   */
  protected final Clock getClock() {
    return configuration.clock();
  }

  /**
   * Runs for events without a registered policy.
   *
   * @param event without a policy
   * @param processingEvent of the current submission
   */
  protected void defaultPolicy(final DomainEvent event, final ProcessingEvent processingEvent) {
    final Aggregate<?, ?> aggregate = processingEvent.getAggregates().get(event.originatorId());
    LOGGER.debug(
        "Default policy for {} {}",
        aggregate == null ? "unknown aggregate" : aggregate.getClass().getSimpleName(),
        event.getClass().getSimpleName());
  }

  /**
   * @return {@code true} if policy registration is in progress
   */
  final boolean isAnyWriteLockHeld() {
    return policyDispatcher.isAnyWriteLockHeld();
  }

  private List<DomainEvent> record(final ProcessingEvent processingEvent) {
    policyDispatcher.dispatch(processingEvent);

    final List<DomainEvent> events = processingEvent.getEvents();
    if (events.isEmpty()) {
      return events;
    }

    final List<StoredEvent> storedEvents = events.stream().map(eventMapper::toStoredEvent).toList();
    eventStore.append(storedEvents);
    return events;
  }

  private void publishNotifications(final List<DomainNotification> notifications) {
    for (DomainNotification notification : notifications) {
      try {
        domainNotificationProducer.publish(notification);
      } catch (RuntimeException e) {
        LOGGER.warn("Notification {} was not delivered", notification.messageId(), e);
      }
    }
  }

  private void takeSnapshots(
      final ProcessingEvent processingEvent, final List<DomainEvent> events) {
    if (!configuration.snapshottingEnabled() || events.isEmpty()) {
      return;
    }

    // Lowest version recorded in this submission, per aggregate
    final Map<UUID, Integer> firstRecordedVersions = new LinkedHashMap<>();
    for (DomainEvent event : events) {
      firstRecordedVersions.putIfAbsent(event.originatorId(), event.originatorVersion());
    }

    for (Map.Entry<UUID, Integer> entry : firstRecordedVersions.entrySet()) {
      final Aggregate<?, ?> aggregate = processingEvent.getAggregates().get(entry.getKey());
      final AggregateType<?, ?, ?> aggregateType =
          aggregate == null ? null : aggregateTypesByClass.get(aggregate.getClass());
      if (aggregateType == null) {
        continue;
      }

      final OptionalInt interval = configuration.snapshottingInterval(aggregateType.getName());
      if (interval.isEmpty()) {
        continue;
      }

      Try.of(() -> takeSnapshot(aggregateType, aggregate, entry.getValue(), interval.getAsInt()))
          .ifFailure(
              reason ->
                  LOGGER.warn(
                      "Snapshot of aggregate '{}' was not taken", aggregate.getId(), reason));
    }
  }

  private <A extends Aggregate<S, E>, S, E extends DomainEvent> Boolean takeSnapshot(
      final AggregateType<A, S, E> aggregateType,
      final Aggregate<?, ?> aggregate,
      final int firstRecordedVersion,
      final int interval) {
    final A typed = aggregateType.cast(aggregate);
    final int lastRecordedVersion = typed.getVersion();
    final Instant now = Instant.now(configuration.clock());

    if (lastRecordedVersion % interval == 0) {
      snapshotStore.save(eventMapper.toStoredSnapshot(aggregateType, typed, now));
      return Boolean.TRUE;
    }

    // An earlier version of this submission crossed the interval
    final int snapshotVersion = lastRecordedVersion - lastRecordedVersion % interval;
    if (snapshotVersion >= firstRecordedVersion) {
      final A past = repository.get(aggregateType, typed.getId(), snapshotVersion);
      snapshotStore.save(eventMapper.toStoredSnapshot(aggregateType, past, now));
      return Boolean.TRUE;
    }

    return Boolean.FALSE;
  }
}
