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

import io.github.suppierk.es.domain.DomainEvent;

/**
 * Reaction to a committed-to-be event which runs inside the same submission.
 *
 * <p>A policy may load aggregates through {@link ProcessingEvent#getAggregate}, mutate them and
 * hand their new events over with {@link ProcessingEvent#collectEvents}; collected events are
 * dispatched to policies as well, after all events which were already queued.
 *
 * <p>Policies must not cycle: a policy which produces a new reactable event for every event it
 * consumes is terminated by {@link PolicyLoopExceededException}.
 *
 * @param <E> the type of events this policy reacts to
 */
@FunctionalInterface
public interface Policy<E extends DomainEvent> {
  /**
   * @param <E> the type of events
   * @return a policy which does not react
   */
  static <E extends DomainEvent> Policy<E> noOp() {
    return (event, processingEvent) -> {
      // Do nothing
    };
  }

  /**
   * @param event to react to
   * @param processingEvent of the current submission
   */
  void process(final E event, final ProcessingEvent processingEvent);
}
