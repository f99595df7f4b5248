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

/**
 * A specific {@link Exception} to be thrown if policies keep producing events beyond the configured
 * limit of a single submission.
 *
 * <p>Policies are required to be acyclic in effect, e.g. to react only to specific terminal states.
 * This exception surfaces a violation instead of letting the submission run forever; nothing of
 * the submission is recorded.
 */
public class PolicyLoopExceededException extends RuntimeException {
  @Serial private static final long serialVersionUID = 2648316126468290301L;

  private final int maxDispatches;

  /**
   * Constructs a new exception for the exceeded limit.
   *
   * @param maxDispatches the limit which was reached
   * @param queuedEvents number of events collected at the moment the limit was reached
   */
  public PolicyLoopExceededException(int maxDispatches, int queuedEvents) {
    super(
        "Policies dispatched %d events and %d more are still queued, check policies for cycles"
            .formatted(maxDispatches, queuedEvents - maxDispatches));
    this.maxDispatches = maxDispatches;
  }

  /**
   * @return the limit which was reached
   */
  public int getMaxDispatches() {
    return maxDispatches;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/508">508 Loop
   *     Detected</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 508;
  }
}
