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

package io.github.suppierk.es.domain;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Versioned entity whose state is produced solely by replaying its own {@link DomainEvent}s.
 *
 * <p>Subclasses expose business operations which call {@link #trigger(EventFactory)}: the new event
 * is applied to the current state immediately and kept pending until it is collected for
 * recording. Storage is never touched from here.
 *
 * <p>State transitions are defined by {@link #apply(Object, DomainEvent)}, which must be a pure
 * function of the current state and one event - this is what makes replay deterministic.
 *
 * <p><b>Design note</b>: instances are not thread-safe, they are meant to be owned by a single
 * submission at a time.
 *
 * @param <S> the type of the aggregate state, preferably an immutable {@link Record}
 * @param <E> the base type of the events this aggregate produces
 */
public abstract class Aggregate<S, E extends DomainEvent> {
  private final Clock clock;
  private final List<E> pendingEvents;

  private UUID id;
  private int version;
  private S state;

  /**
   * Default constructor.
   *
   * @param clock to timestamp new events with
   * @throws IllegalArgumentException if the clock is {@code null}
   */
  protected Aggregate(final Clock clock) {
    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }

    this.clock = clock;
    this.pendingEvents = new ArrayList<>();
    this.version = 0;
  }

  /**
   * @return identifier of this aggregate, {@code null} until the first event is applied
   */
  public final UUID getId() {
    return id;
  }

  /**
   * @return the version of the last applied event, {@code 0} for a blank aggregate
   */
  public final int getVersion() {
    return version;
  }

  /**
   * @return current state, {@code null} for a blank aggregate
   */
  public final S getState() {
    return state;
  }

  /**
   * @return a copy of events which were triggered but not yet collected
   */
  public final List<E> getPendingEvents() {
    return Collections.unmodifiableList(new ArrayList<>(pendingEvents));
  }

  /**
   * @return {@code true} if there are events waiting to be collected
   */
  public final boolean hasPendingEvents() {
    return !pendingEvents.isEmpty();
  }

  /**
   * Moves pending events out of this aggregate.
   *
   * @return events triggered since the last collection, in the order they were triggered
   */
  public final List<E> collectEvents() {
    final List<E> collected = List.copyOf(pendingEvents);
    pendingEvents.clear();
    return collected;
  }

  /**
   * Defines how a single event changes the state.
   *
   * <p>Must not have side effects and must not read anything but its arguments.
   *
   * @param currentState before the event, {@code null} if the event is the initial one
   * @param event to apply
   * @return new state, never {@code null}
   */
  protected abstract S apply(final S currentState, final E event);

  /**
   * Starts the history of a blank aggregate.
   *
   * @param newId to assign to this aggregate
   * @param factory to create the initial event with
   * @param <T> the type of the initial event
   * @return created event
   * @throws IllegalStateException if this aggregate already has history
   */
  protected final <T extends E> T create(final UUID newId, final EventFactory<T> factory) {
    if (newId == null) {
      throw new IllegalArgumentException("Aggregate ID cannot be null");
    }

    if (id != null || version != 0) {
      throw new IllegalStateException("Aggregate '%s' is already created".formatted(id));
    }

    id = newId;
    return trigger(factory);
  }

  /**
   * Creates a new event for the next version, applies it and keeps it pending.
   *
   * @param factory to create the event with
   * @param <T> the type of the event
   * @return created event
   * @throws IllegalStateException if this aggregate was never created
   */
  protected final <T extends E> T trigger(final EventFactory<T> factory) {
    if (factory == null) {
      throw new IllegalArgumentException("Event factory cannot be null");
    }

    if (id == null) {
      throw new IllegalStateException("Aggregate must be created before triggering events");
    }

    final T event = factory.create(id, version + 1, Instant.now(clock));
    if (event == null) {
      throw new IllegalStateException("Triggered event cannot be null");
    }

    mutate(event);
    pendingEvents.add(event);
    return event;
  }

  /**
   * Loads the state from a snapshot into a blank aggregate.
   *
   * @param snapshotId identifier of the aggregate the snapshot was taken from
   * @param snapshotVersion version of the aggregate at the time of the snapshot
   * @param snapshotState state of the aggregate at the time of the snapshot
   * @throws IllegalStateException if this aggregate is not blank
   */
  public final void restore(
      final UUID snapshotId, final int snapshotVersion, final S snapshotState) {
    if (snapshotId == null || snapshotState == null) {
      throw new IllegalArgumentException("Snapshot ID and state cannot be null");
    }

    if (snapshotVersion < 1) {
      throw new IllegalArgumentException(
          "Snapshot version must be positive, got %d".formatted(snapshotVersion));
    }

    if (id != null || version != 0) {
      throw new IllegalStateException("Only a blank aggregate can be restored from a snapshot");
    }

    id = snapshotId;
    version = snapshotVersion;
    state = snapshotState;
  }

  /**
   * Folds given events over the current state in order.
   *
   * <p>A blank aggregate adopts the identifier of the first event, which must have version {@code
   * 1}; a restored aggregate continues from its snapshot version.
   *
   * @param events to apply, ordered by version
   * @throws EventVersionMismatchException if events do not continue the current version
   */
  public final void replay(final Iterable<? extends E> events) {
    if (events == null) {
      throw new IllegalArgumentException("Events cannot be null");
    }

    if (!pendingEvents.isEmpty()) {
      throw new IllegalStateException("Cannot replay events over pending changes");
    }

    for (E event : events) {
      mutate(event);
    }
  }

  private void mutate(final E event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    if (id == null) {
      if (event.originatorVersion() != 1) {
        throw new EventVersionMismatchException(
            event.originatorId(), 1, event.originatorVersion());
      }

      id = event.originatorId();
    }

    if (!event.originatorId().equals(id)) {
      throw new EventVersionMismatchException(
          "Event of aggregate '%s' cannot be applied to aggregate '%s'"
              .formatted(event.originatorId(), id));
    }

    if (event.originatorVersion() != version + 1) {
      throw new EventVersionMismatchException(id, version + 1, event.originatorVersion());
    }

    final S newState = apply(state, event);
    if (newState == null) {
      throw new IllegalStateException(
          "Applying '%s' produced null state".formatted(event.getClass().getSimpleName()));
    }

    state = newState;
    version = event.originatorVersion();
  }

  /**
   * Creates an event once the aggregate assigned its coordinates.
   *
   * @param <T> the type of the event
   */
  @FunctionalInterface
  public interface EventFactory<T extends DomainEvent> {
    /**
     * @param originatorId of the aggregate
     * @param originatorVersion the aggregate will have after this event
     * @param timestamp of the event
     * @return a new event
     */
    T create(final UUID originatorId, final int originatorVersion, final Instant timestamp);
  }
}
