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
import io.github.suppierk.es.domain.DomainEvent;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link Policy}s over the events of a {@link ProcessingEvent} until no policy produces new
 * events.
 *
 * <p>Exactly one policy runs per event: the one registered for the exact class of the event, or
 * the default policy. Events are dispatched strictly in the order they were collected, so reactions
 * are processed breadth-first across the reaction chain.
 *
 * <p>Registration is guarded by a read-write lock, allowing policies to be added while other
 * threads dispatch.
 */
public final class PolicyDispatcher extends Suspicious {
  private static final Logger LOGGER = LoggerFactory.getLogger(PolicyDispatcher.class);

  private final ReentrantReadWriteLock lock;
  private final Map<Class<? extends DomainEvent>, Policy<? extends DomainEvent>> policies;
  private final Policy<DomainEvent> defaultPolicy;
  private final int maxDispatches;

  /**
   * @param defaultPolicy to run for events without a registered policy
   * @param maxDispatches maximum number of events dispatched for one submission
   */
  PolicyDispatcher(final Policy<DomainEvent> defaultPolicy, final int maxDispatches) {
    this.defaultPolicy = throwIllegalArgumentIfNull(defaultPolicy, "Default policy");

    if (maxDispatches < 1) {
      throw new IllegalArgumentException(
          "Maximum number of dispatches must be positive, got %d".formatted(maxDispatches));
    }

    this.maxDispatches = maxDispatches;
    this.lock = new ReentrantReadWriteLock();
    this.policies = new HashMap<>();
  }

  /**
   * @param eventClass exact class of events to react to
   * @param policy to run
   * @param <E> the type of the event
   * @throws IllegalStateException if a policy for the event class is already registered
   */
  public <E extends DomainEvent> void addPolicy(
      final Class<E> eventClass, final Policy<? super E> policy) {
    throwIllegalArgumentIfNull(eventClass, "Event class");
    throwIllegalArgumentIfNull(policy, "Policy");

    lock.writeLock().lock();
    try {
      if (policies.containsKey(eventClass)) {
        throw new IllegalStateException(
            "Policy for '%s' is already registered".formatted(eventClass.getSimpleName()));
      }

      policies.put(eventClass, policy);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * @return event classes with a registered policy
   */
  public Set<Class<? extends DomainEvent>> getSupportedEventClasses() {
    lock.readLock().lock();
    try {
      return Set.copyOf(policies.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Dispatches every event of the processing event, including the ones collected during dispatch.
   *
   * @param processingEvent to process
   * @throws PolicyLoopExceededException if policies keep producing events beyond the limit
   * @throws IllegalStateException if an aggregate of the submission was changed by a policy, but
   *     its events were never collected
   */
  public void dispatch(final ProcessingEvent processingEvent) {
    throwIllegalArgumentIfNull(processingEvent, "Processing event");

    // The list grows while policies run, the length must be re-read on every iteration
    int cursor = 0;
    while (cursor < processingEvent.size()) {
      if (cursor >= maxDispatches) {
        throw new PolicyLoopExceededException(maxDispatches, processingEvent.size());
      }

      final DomainEvent event = processingEvent.getEvent(cursor);
      LOGGER.debug(
          "Dispatching {}@{} ({})",
          event.originatorId(),
          event.originatorVersion(),
          event.getClass().getSimpleName());

      resolve(event).process(event, processingEvent);
      cursor++;
    }

    for (Aggregate<?, ?> aggregate : processingEvent.getAggregates().values()) {
      if (aggregate.hasPendingEvents()) {
        throw new IllegalStateException(
            "Aggregate '%s' has %d events which were never collected"
                .formatted(aggregate.getId(), aggregate.getPendingEvents().size()));
      }
    }
  }

  /**
   * @return {@code true} if registration is in progress
   */
  boolean isAnyWriteLockHeld() {
    return lock.isWriteLocked();
  }

  @SuppressWarnings("unchecked")
  private Policy<DomainEvent> resolve(final DomainEvent event) {
    lock.readLock().lock();
    try {
      // Registration guarantees the policy accepts the exact class of the event
      final Policy<DomainEvent> policy = (Policy<DomainEvent>) policies.get(event.getClass());
      return policy == null ? defaultPolicy : policy;
    } finally {
      lock.readLock().unlock();
    }
  }
}
