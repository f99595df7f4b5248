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

import io.github.suppierk.es.domain.Aggregate;
import io.github.suppierk.es.domain.AggregateIds;
import io.github.suppierk.es.domain.AggregateType;
import io.github.suppierk.es.k8s.K8sNamespaceEvent.OwnersChanged;
import io.github.suppierk.es.k8s.K8sNamespaceEvent.Registered;
import io.github.suppierk.es.k8s.K8sNamespaceEvent.StatusChanged;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Namespace of a Kubernetes cluster, identified by the cluster and the namespace name.
 *
 * <p>Namespaces are never removed from the history: removal is expressed by {@link
 * K8sNamespaceStatus#DELETED} and {@link K8sNamespaceStatus#K8S_DELETED}.
 */
public final class K8sNamespace extends Aggregate<K8sNamespaceState, K8sNamespaceEvent> {
  public static final AggregateType<K8sNamespace, K8sNamespaceState, K8sNamespaceEvent> TYPE =
      AggregateType.builder(
              "K8sNamespace",
              K8sNamespace.class,
              K8sNamespaceState.class,
              K8sNamespaceEvent.class,
              K8sNamespace::new)
          .event("Registered", Registered.class)
          .event("StatusChanged", StatusChanged.class)
          .event("OwnersChanged", OwnersChanged.class)
          .build();

  private static final String ID_KIND = "k8s_namespace";

  /**
   * Creates a blank namespace, use {@link #register} to create a new one.
   *
   * @param clock to timestamp events with
   */
  public K8sNamespace(final Clock clock) {
    super(clock);
  }

  /**
   * @param k8sClusterId identifier of the cluster
   * @param namespace name of the namespace within the cluster
   * @return the same identifier for the same cluster and namespace
   */
  public static UUID createId(final String k8sClusterId, final String namespace) {
    return AggregateIds.fromKeys(ID_KIND, k8sClusterId, namespace);
  }

  /**
   * Registers a namespace with {@link K8sNamespaceStatus#NA} status.
   *
   * @param clock to timestamp events with
   * @param k8sClusterId identifier of the cluster
   * @param namespace name of the namespace within the cluster
   * @param creationTimestamp when the namespace was created on the cluster
   * @param owners initial owners, {@code null} means none
   * @return a new namespace with a pending {@link Registered} event
   */
  public static K8sNamespace register(
      final Clock clock,
      final String k8sClusterId,
      final String namespace,
      final Instant creationTimestamp,
      final List<String> owners) {
    return register(
        clock, k8sClusterId, namespace, creationTimestamp, K8sNamespaceStatus.NA, owners);
  }

  /**
   * @param clock to timestamp events with
   * @param k8sClusterId identifier of the cluster
   * @param namespace name of the namespace within the cluster
   * @param creationTimestamp when the namespace was created on the cluster
   * @param status initial status
   * @param owners initial owners, {@code null} means none
   * @return a new namespace with a pending {@link Registered} event
   */
  public static K8sNamespace register(
      final Clock clock,
      final String k8sClusterId,
      final String namespace,
      final Instant creationTimestamp,
      final K8sNamespaceStatus status,
      final List<String> owners) {
    if (k8sClusterId == null || k8sClusterId.isBlank()) {
      throw new IllegalArgumentException("Cluster ID cannot be blank");
    }

    if (namespace == null || namespace.isBlank()) {
      throw new IllegalArgumentException("Namespace cannot be blank");
    }

    if (creationTimestamp == null || status == null) {
      throw new IllegalArgumentException("Creation timestamp and status cannot be null");
    }

    final List<String> initialOwners = copyOwners(owners);
    final K8sNamespace k8sNamespace = new K8sNamespace(clock);
    k8sNamespace.create(
        createId(k8sClusterId, namespace),
        (id, version, timestamp) ->
            new Registered(
                id,
                version,
                timestamp,
                k8sClusterId,
                namespace,
                creationTimestamp,
                status,
                initialOwners));
    return k8sNamespace;
  }

  /**
   * @param status to change to
   */
  public void setStatus(final K8sNamespaceStatus status) {
    if (status == null) {
      throw new IllegalArgumentException("Status cannot be null");
    }

    trigger((id, version, timestamp) -> new StatusChanged(id, version, timestamp, status));
  }

  /**
   * @param owners to replace current owners with, {@code null} means none
   */
  public void setOwners(final List<String> owners) {
    final List<String> newOwners = copyOwners(owners);
    trigger((id, version, timestamp) -> new OwnersChanged(id, version, timestamp, newOwners));
  }

  /**
   * @param owner to add
   * @return {@code true} if the owner was added, {@code false} if it was already present
   */
  public boolean addOwner(final String owner) {
    if (owner == null || owner.isBlank()) {
      throw new IllegalArgumentException("Owner cannot be blank");
    }

    if (getOwners().contains(owner)) {
      return false;
    }

    final List<String> newOwners = new ArrayList<>(getOwners());
    newOwners.add(owner);
    setOwners(newOwners);
    return true;
  }

  public String getK8sClusterId() {
    return getState().k8sClusterId();
  }

  public String getNamespace() {
    return getState().namespace();
  }

  public Instant getCreationTimestamp() {
    return getState().creationTimestamp();
  }

  public K8sNamespaceStatus getStatus() {
    return getState().status();
  }

  public List<String> getOwners() {
    return getState().owners();
  }

  /**
   * @return read model of the current state
   */
  public K8sNamespaceData toData() {
    final K8sNamespaceState state = getState();
    return new K8sNamespaceData(
        getId(),
        getVersion(),
        state.k8sClusterId(),
        state.namespace(),
        state.creationTimestamp(),
        state.status(),
        state.owners());
  }

  /** {@inheritDoc} */
  @Override
  protected K8sNamespaceState apply(
      final K8sNamespaceState currentState, final K8sNamespaceEvent event) {
    if (event instanceof Registered registered) {
      return new K8sNamespaceState(
          registered.k8sClusterId(),
          registered.namespace(),
          registered.creationTimestamp(),
          registered.status(),
          registered.owners());
    }

    if (currentState == null) {
      throw new IllegalStateException(
          "'%s' cannot be applied before registration"
              .formatted(event.getClass().getSimpleName()));
    }

    if (event instanceof StatusChanged statusChanged) {
      return currentState.withStatus(statusChanged.status());
    }

    if (event instanceof OwnersChanged ownersChanged) {
      return currentState.withOwners(ownersChanged.owners());
    }

    throw new IllegalStateException(
        "Unsupported event '%s'".formatted(event.getClass().getSimpleName()));
  }

  private static List<String> copyOwners(final List<String> owners) {
    if (owners == null) {
      return List.of();
    }

    for (String owner : owners) {
      if (owner == null) {
        throw new IllegalArgumentException("Owner cannot be null");
      }
    }

    return List.copyOf(owners);
  }
}
