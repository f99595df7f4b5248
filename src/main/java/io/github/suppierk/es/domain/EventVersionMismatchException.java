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

import java.io.Serial;
import java.util.UUID;

/**
 * A specific {@link Exception} to be thrown if a {@link DomainEvent} cannot be applied to an {@link
 * Aggregate} because it belongs to another aggregate or does not follow the current version.
 *
 * <p>This is a programming error: the submission it happens in must not be retried.
 */
public class EventVersionMismatchException extends IllegalStateException {
  @Serial private static final long serialVersionUID = -4183626570146329047L;

  private final transient UUID originatorId;
  private final int expectedVersion;
  private final int actualVersion;

  /**
   * Constructs a new exception describing the version mismatch.
   *
   * @param originatorId of the aggregate the event was applied to
   * @param expectedVersion the aggregate was ready to accept
   * @param actualVersion the event carried
   */
  public EventVersionMismatchException(
      UUID originatorId, int expectedVersion, int actualVersion) {
    super(
        "Aggregate '%s' expected event version %d, but got %d"
            .formatted(originatorId, expectedVersion, actualVersion));
    this.originatorId = originatorId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  /**
   * Constructs a new exception with the specified detail message.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  public EventVersionMismatchException(String message) {
    super(message);
    this.originatorId = null;
    this.expectedVersion = -1;
    this.actualVersion = -1;
  }

  /**
   * @return identifier of the aggregate, or {@code null} if the mismatch was not about versions
   */
  public UUID getOriginatorId() {
    return originatorId;
  }

  /**
   * @return the version aggregate was ready to accept, or {@code -1} if unknown
   */
  public int getExpectedVersion() {
    return expectedVersion;
  }

  /**
   * @return the version the event carried, or {@code -1} if unknown
   */
  public int getActualVersion() {
    return actualVersion;
  }
}
