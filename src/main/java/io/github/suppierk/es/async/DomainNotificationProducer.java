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

package io.github.suppierk.es.async;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract contract for an entity which is able to publish {@link DomainNotification} for
 * consumption.
 *
 * <p>Notifications are handed over only after the events they describe were committed, so that an
 * aborted submission never reports anything. Delivery is fire-and-forget: a failing producer
 * cannot undo the commit.
 *
 * @see <a href="https://microservices.io/patterns/data/transactional-outbox.html">Transactional
 *     outbox</a>
 */
@FunctionalInterface
public interface DomainNotificationProducer {
  /**
   * @return an instance of publisher which does not perform any operations
   */
  static DomainNotificationProducer empty() {
    return NoOp.INSTANCE;
  }

  /**
   * @return an instance of publisher which writes notifications to the application log
   */
  static DomainNotificationProducer logging() {
    return Logging.INSTANCE;
  }

  /**
   * Delivers {@link DomainNotification} to its consumers.
   *
   * @param notification to publish
   */
  void publish(final DomainNotification notification);

  /** Default implementation of the fake publisher */
  final class NoOp implements DomainNotificationProducer {
    private static final DomainNotificationProducer INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void publish(final DomainNotification notification) {
      // Do nothing
    }
  }

  /** Publisher which only logs notifications. */
  final class Logging implements DomainNotificationProducer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Logging.class);
    private static final DomainNotificationProducer INSTANCE = new Logging();

    private Logging() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void publish(final DomainNotification notification) {
      if (notification == null) {
        throw new IllegalArgumentException("Notification cannot be null");
      }

      LOGGER.info(
          "[{}] {} (aggregate {})",
          notification.messageId(),
          notification.message(),
          notification.originatorId());
    }
  }
}
