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

import java.io.Serial;
import java.util.UUID;

/**
 * A specific {@link Exception} to be thrown if events cannot be appended because the stored
 * version of an aggregate differs from the version the events were built upon.
 *
 * <p>Nothing is written when this exception is thrown. The whole submission must be retried from
 * scratch: reload, mutate again, submit again.
 */
public class ConcurrencyConflictException extends RuntimeException {
  @Serial private static final long serialVersionUID = 2403581377712489920L;

  private final UUID originatorId;
  private final int expectedVersion;
  private final int actualVersion;

  /**
   * Constructs a new runtime exception describing the conflict.
   *
   * @param originatorId of the conflicting aggregate
   * @param expectedVersion the new events were built upon
   * @param actualVersion stored at the time of the append
   */
  public ConcurrencyConflictException(
      UUID originatorId, int expectedVersion, int actualVersion) {
    this(originatorId, expectedVersion, actualVersion, null);
  }

  /**
   * Constructs a new runtime exception describing the conflict and the storage failure behind it.
   *
   * @param originatorId of the conflicting aggregate
   * @param expectedVersion the new events were built upon
   * @param actualVersion stored at the time of the append, {@code -1} if unknown
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   *     (A {@code null} value is permitted, and indicates that the cause is nonexistent or
   *     unknown.)
   */
  public ConcurrencyConflictException(
      UUID originatorId, int expectedVersion, int actualVersion, Throwable cause) {
    super(
        "Aggregate '%s' was expected at version %d, but %s"
            .formatted(
                originatorId,
                expectedVersion,
                actualVersion < 0
                    ? "a conflicting version was stored concurrently"
                    : "version %d is stored".formatted(actualVersion)),
        cause);
    this.originatorId = originatorId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  /**
   * Constructs a new runtime exception for a conflict the storage detected without telling which
   * aggregate was affected.
   *
   * @param message the detail message
   * @param cause the storage failure behind the conflict
   */
  public ConcurrencyConflictException(String message, Throwable cause) {
    super(message, cause);
    this.originatorId = null;
    this.expectedVersion = -1;
    this.actualVersion = -1;
  }

  /**
   * @return identifier of the conflicting aggregate, {@code null} if unknown
   */
  public UUID getOriginatorId() {
    return originatorId;
  }

  /**
   * @return the version the new events were built upon, {@code -1} if unknown
   */
  public int getExpectedVersion() {
    return expectedVersion;
  }

  /**
   * @return the version which was stored, {@code -1} if unknown
   */
  public int getActualVersion() {
    return actualVersion;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 409;
  }
}
