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

import java.io.Serial;
import java.util.UUID;

/**
 * A specific {@link Exception} to be thrown if an aggregate has no recorded events.
 *
 * <p>Callers which treat a missing aggregate as "does not exist yet" should prefer the {@code
 * find} variants returning {@link java.util.Optional} instead of catching this exception.
 */
public class AggregateNotFoundException extends RuntimeException {
  @Serial private static final long serialVersionUID = -3190487734529311750L;

  private final UUID aggregateId;

  /**
   * Constructs a new exception for the aggregate without events.
   *
   * @param aggregateId of the missing aggregate
   */
  public AggregateNotFoundException(UUID aggregateId) {
    super("Aggregate '%s' not found".formatted(aggregateId));
    this.aggregateId = aggregateId;
  }

  /**
   * Constructs a new exception with the specified detail message.
   *
   * @param aggregateId of the missing aggregate
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  public AggregateNotFoundException(UUID aggregateId, String message) {
    super(message);
    this.aggregateId = aggregateId;
  }

  /**
   * @return identifier of the aggregate which was not found
   */
  public UUID getAggregateId() {
    return aggregateId;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/404">404 Not Found</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 404;
  }
}
