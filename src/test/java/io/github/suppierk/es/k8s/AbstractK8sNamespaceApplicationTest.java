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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.application.AggregateNotFoundException;
import io.github.suppierk.es.application.ApplicationConfiguration;
import io.github.suppierk.es.async.DomainNotification;
import io.github.suppierk.es.persistence.ConcurrencyConflictException;
import io.github.suppierk.es.persistence.EventStore;
import io.github.suppierk.es.persistence.LoggedEvent;
import io.github.suppierk.es.persistence.SnapshotStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Scenarios which must behave the same regardless of the storage. */
abstract class AbstractK8sNamespaceApplicationTest {
  static final Instant T1 = Instant.parse("2021-05-26T03:08:15Z");
  static final Instant NOW = Instant.parse("2021-06-01T12:00:00Z");
  static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  EventStore eventStore;
  SnapshotStore snapshotStore;
  List<DomainNotification> published;
  K8sNamespaceApplication application;

  /**
   * @return empty event store
   */
  abstract EventStore createEventStore();

  /**
   * @return empty snapshot store
   */
  abstract SnapshotStore createSnapshotStore();

  @BeforeEach
  void setUpApplication() {
    eventStore = createEventStore();
    snapshotStore = createSnapshotStore();
    published = new ArrayList<>();
    application = newApplication(ApplicationConfiguration.defaults().withClock(CLOCK));
  }

  K8sNamespaceApplication newApplication(ApplicationConfiguration configuration) {
    return new K8sNamespaceApplication(configuration, eventStore, snapshotStore, published::add);
  }

  @Test
  void registered_namespace_must_follow_its_changes() {
    final UUID id = application.registerNamespace("1", "kube-system", T1, null);

    final K8sNamespaceData registered = application.getNamespace(id);
    assertEquals(K8sNamespace.createId("1", "kube-system"), id);
    assertEquals(1, registered.version());
    assertEquals(K8sNamespaceStatus.NA, registered.status());
    assertEquals(T1, registered.creationTimestamp());
    assertEquals(List.of(), registered.owners());

    application.setNamespaceStatus(id, K8sNamespaceStatus.AVAILABLE);
    assertTrue(application.addNamespaceOwner(id, "x"));

    final K8sNamespaceData changed = application.getNamespace(id);
    assertEquals(3, changed.version());
    assertEquals(K8sNamespaceStatus.AVAILABLE, changed.status());
    assertEquals(List.of("x"), changed.owners());

    assertFalse(application.addNamespaceOwner(id, "x"));
    assertEquals(3, application.getNamespace(id).version());

    application.setNamespaceOwners(id, List.of("y", "z"));
    assertEquals(List.of("y", "z"), application.getNamespace(id).owners());
    assertEquals(List.of(), published);
  }

  @Test
  void deleted_namespace_must_be_removed_from_cluster_in_same_submission() {
    final UUID id = application.registerNamespace("1", "albert1", T1, List.of("albert"));
    final long registeredAt = application.readEventLog(0, 10).get(0).position();

    application.setNamespaceStatus(id, K8sNamespaceStatus.DELETED);

    final K8sNamespaceData deleted = application.getNamespace(id);
    assertEquals(3, deleted.version());
    assertEquals(K8sNamespaceStatus.K8S_DELETED, deleted.status());
    assertEquals(K8sNamespaceStatus.DELETED, application.getNamespace(id, 2).status());

    final List<LoggedEvent> removal = application.readEventLog(registeredAt, 10);
    assertEquals(2, removal.size());
    assertEquals("K8sNamespace.StatusChanged", removal.get(0).event().topic());
    assertEquals(3, removal.get(1).event().originatorVersion());

    assertEquals(1, published.size());
    assertEquals(id, published.get(0).originatorId());
    assertEquals("Namespace albert1 deleted on k8s cluster 1", published.get(0).message());
    assertEquals(NOW, published.get(0).createdAt());
  }

  @Test
  void when_namespace_is_not_registered_it_must_not_be_found() {
    final UUID id = K8sNamespace.createId("1", "never");

    assertThrows(AggregateNotFoundException.class, () -> application.getNamespace(id));
    assertTrue(application.findNamespace(id).isEmpty());
    assertThrows(
        AggregateNotFoundException.class,
        () -> application.setNamespaceStatus(id, K8sNamespaceStatus.AVAILABLE));
    assertEquals(List.of(), application.readEventLog(0, 10));
  }

  @Test
  void when_namespace_is_registered_again_conflict_must_be_reported() {
    final UUID id = application.registerNamespace("1", "default", T1, null);

    assertThrows(
        ConcurrencyConflictException.class,
        () -> application.registerNamespace("1", "default", T1, List.of("other")));
    assertEquals(id, application.ensureNamespace("1", "default", T1, List.of("other")));

    final K8sNamespaceData namespace = application.getNamespace(id);
    assertEquals(1, namespace.version());
    assertEquals(List.of(), namespace.owners());
    assertEquals(
        K8sNamespace.createId("1", "fresh"), application.ensureNamespace("1", "fresh", T1, null));
  }

  @Test
  void when_copies_of_namespace_change_concurrently_only_first_must_be_recorded() {
    final UUID id = application.registerNamespace("1", "default", T1, null);
    final K8sNamespace first = application.getRepository().get(K8sNamespace.TYPE, id);
    final K8sNamespace second = application.getRepository().get(K8sNamespace.TYPE, id);

    first.setStatus(K8sNamespaceStatus.AVAILABLE);
    second.setStatus(K8sNamespaceStatus.EXPIRED);
    application.save(first);

    final var exception =
        assertThrows(ConcurrencyConflictException.class, () -> application.save(second));

    assertEquals(id, exception.getOriginatorId());
    assertEquals(K8sNamespaceStatus.AVAILABLE, application.getNamespace(id).status());
  }

  @Test
  void snapshots_must_not_change_what_is_read() {
    final K8sNamespaceApplication snapshotting =
        newApplication(
            ApplicationConfiguration.defaults()
                .withClock(CLOCK)
                .withSnapshotting(K8sNamespace.TYPE.getName(), 1));

    final UUID id = snapshotting.registerNamespace("1", "default", T1, List.of("alice"));
    snapshotting.setNamespaceStatus(id, K8sNamespaceStatus.WILL_EXPIRE);
    snapshotting.addNamespaceOwner(id, "bob");

    assertEquals(3, snapshotStore.latest(id, Integer.MAX_VALUE).orElseThrow().originatorVersion());
    assertEquals(application.getNamespace(id), snapshotting.getNamespace(id));
    assertEquals(application.getNamespace(id, 2), snapshotting.getNamespace(id, 2));
    assertEquals(List.of("alice", "bob"), snapshotting.getNamespace(id).owners());
  }
}
