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

import io.github.suppierk.es.application.AggregateNotFoundException;
import io.github.suppierk.es.application.Application;
import io.github.suppierk.es.application.ApplicationConfiguration;
import io.github.suppierk.es.async.DomainNotificationProducer;
import io.github.suppierk.es.k8s.K8sNamespaceEvent.StatusChanged;
import io.github.suppierk.es.persistence.EventStore;
import io.github.suppierk.es.persistence.SnapshotStore;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Use cases of Kubernetes namespaces.
 *
 * <p>Every changing operation is a separate submission: on {@link
 * io.github.suppierk.es.persistence.ConcurrencyConflictException} nothing was recorded and the
 * operation can be repeated as a whole.
 */
public class K8sNamespaceApplication extends Application {
  /**
   * Default constructor.
   *
   * @param configuration of the application
   * @param eventStore to record events into
   * @param snapshotStore to keep snapshots in
   * @param domainNotificationProducer to publish notifications about removed namespaces
   */
  public K8sNamespaceApplication(
      final ApplicationConfiguration configuration,
      final EventStore eventStore,
      final SnapshotStore snapshotStore,
      final DomainNotificationProducer domainNotificationProducer) {
    super(configuration, eventStore, snapshotStore, domainNotificationProducer);

    addAggregateType(K8sNamespace.TYPE);
    addPolicy(StatusChanged.class, new K8sNamespaceDeletionPolicy());
  }

  /**
   * @param k8sClusterId identifier of the cluster
   * @param namespace name of the namespace within the cluster
   * @param creationTimestamp when the namespace was created on the cluster
   * @param owners initial owners, {@code null} means none
   * @return identifier of the new namespace
   * @throws io.github.suppierk.es.persistence.ConcurrencyConflictException if the namespace is
   *     already registered
   */
  public UUID registerNamespace(
      final String k8sClusterId,
      final String namespace,
      final Instant creationTimestamp,
      final List<String> owners) {
    final K8sNamespace k8sNamespace =
        K8sNamespace.register(getClock(), k8sClusterId, namespace, creationTimestamp, owners);
    save(k8sNamespace);
    return k8sNamespace.getId();
  }

  /**
   * Registers the namespace unless it is already registered.
   *
   * @param k8sClusterId identifier of the cluster
   * @param namespace name of the namespace within the cluster
   * @param creationTimestamp when the namespace was created on the cluster
   * @param owners initial owners, {@code null} means none
   * @return identifier of the namespace
   */
  public UUID ensureNamespace(
      final String k8sClusterId,
      final String namespace,
      final Instant creationTimestamp,
      final List<String> owners) {
    final UUID id = K8sNamespace.createId(k8sClusterId, namespace);
    if (getRepository().find(K8sNamespace.TYPE, id).isPresent()) {
      return id;
    }

    return registerNamespace(k8sClusterId, namespace, creationTimestamp, owners);
  }

  /**
   * @param id of the namespace
   * @param status to change to
   * @throws AggregateNotFoundException if the namespace is not registered
   */
  public void setNamespaceStatus(final UUID id, final K8sNamespaceStatus status) {
    final K8sNamespace k8sNamespace = getRepository().get(K8sNamespace.TYPE, id);
    k8sNamespace.setStatus(status);
    save(k8sNamespace);
  }

  /**
   * @param id of the namespace
   * @param owners to replace current owners with
   * @throws AggregateNotFoundException if the namespace is not registered
   */
  public void setNamespaceOwners(final UUID id, final List<String> owners) {
    final K8sNamespace k8sNamespace = getRepository().get(K8sNamespace.TYPE, id);
    k8sNamespace.setOwners(owners);
    save(k8sNamespace);
  }

  /**
   * @param id of the namespace
   * @param owner to add
   * @return {@code true} if the owner was added, {@code false} if it was already present
   * @throws AggregateNotFoundException if the namespace is not registered
   */
  public boolean addNamespaceOwner(final UUID id, final String owner) {
    final K8sNamespace k8sNamespace = getRepository().get(K8sNamespace.TYPE, id);
    if (!k8sNamespace.addOwner(owner)) {
      return false;
    }

    save(k8sNamespace);
    return true;
  }

  /**
   * @param id of the namespace
   * @return current state of the namespace
   * @throws AggregateNotFoundException if the namespace is not registered
   */
  public K8sNamespaceData getNamespace(final UUID id) {
    return getRepository().get(K8sNamespace.TYPE, id).toData();
  }

  /**
   * @param id of the namespace
   * @return current state of the namespace, empty if it is not registered
   */
  public Optional<K8sNamespaceData> findNamespace(final UUID id) {
    return getRepository().find(K8sNamespace.TYPE, id).map(K8sNamespace::toData);
  }

  /**
   * @param id of the namespace
   * @param version to read the namespace at
   * @return state of the namespace at the given version
   * @throws AggregateNotFoundException if the namespace is not registered
   */
  public K8sNamespaceData getNamespace(final UUID id, final int version) {
    return getRepository().get(K8sNamespace.TYPE, id, version).toData();
  }
}
