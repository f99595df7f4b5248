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

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * Represents an immutable fact which happened to a specific {@link Aggregate}.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>Events are uniquely identified by the pair of {@link #originatorId()} and {@link
 * #originatorVersion()} - within a single aggregate versions start at {@code 1} and increase by
 * exactly one per event.
 *
 * <p>Events are stored and might be placed in a message queue - this is the reason this interface
 * extends {@link Serializable} interface.
 */
public interface DomainEvent extends Serializable {
  /**
   * Defined as {@code originatorId()} because {@code id()} is quite frequently taken to describe
   * the identifier of the event itself.
   *
   * @return an identifier of the {@link Aggregate} this event belongs to
   */
  UUID originatorId();

  /**
   * @return the version the {@link Aggregate} will have once this event is applied
   */
  int originatorVersion();

  /**
   * @return the time when this event was created in the system
   */
  Instant timestamp();
}
