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

package io.github.suppierk.es.k8s;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.suppierk.es.application.ApplicationConfiguration;
import io.github.suppierk.es.async.DomainNotificationProducer;
import io.github.suppierk.es.persistence.EventStore;
import io.github.suppierk.es.persistence.InMemoryEventStore;
import io.github.suppierk.es.persistence.InMemorySnapshotStore;
import io.github.suppierk.es.persistence.SnapshotStore;
import java.util.Set;
import org.junit.jupiter.api.Test;

class K8sNamespaceApplicationTest extends AbstractK8sNamespaceApplicationTest {
  @Override
  EventStore createEventStore() {
    return new InMemoryEventStore();
  }

  @Override
  SnapshotStore createSnapshotStore() {
    return new InMemorySnapshotStore();
  }

  @Test
  void deletion_policy_must_be_registered_for_status_changes() {
    final var k8sApplication =
        new K8sNamespaceApplication(
            ApplicationConfiguration.defaults(),
            new InMemoryEventStore(),
            SnapshotStore.empty(),
            DomainNotificationProducer.logging());

    assertEquals(
        Set.of(K8sNamespaceEvent.StatusChanged.class), k8sApplication.getSupportedEventClasses());
  }
}
