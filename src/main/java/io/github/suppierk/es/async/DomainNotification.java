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

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * Human-readable operational message raised while processing events, such as a resource being
 * removed from an external system.
 *
 * <p>Notifications are asynchronous by nature, and it should be possible to place them in a message
 * queue - this is the reason this class implements {@link Serializable} interface.
 *
 * @param messageId unique identifier of this notification
 * @param createdAt time when this notification was raised
 * @param originatorId of the aggregate this notification is about
 * @param message to deliver
 */
public record DomainNotification(
    UUID messageId, Instant createdAt, UUID originatorId, String message) implements Serializable {
  public DomainNotification {
    if (messageId == null || createdAt == null || originatorId == null) {
      throw new IllegalArgumentException("Message ID, creation time and aggregate ID are required");
    }

    if (message == null || message.isBlank()) {
      throw new IllegalArgumentException("Notification message cannot be blank");
    }
  }
}
