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

import io.github.suppierk.es.domain.DomainEvent;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Events of a {@link K8sNamespace}. */
public sealed interface K8sNamespaceEvent extends DomainEvent
    permits K8sNamespaceEvent.Registered,
        K8sNamespaceEvent.StatusChanged,
        K8sNamespaceEvent.OwnersChanged {

  /** Initial event, carries the complete initial state. */
  record Registered(
      UUID originatorId,
      int originatorVersion,
      Instant timestamp,
      String k8sClusterId,
      String namespace,
      Instant creationTimestamp,
      K8sNamespaceStatus status,
      List<String> owners)
      implements K8sNamespaceEvent {
    public Registered {
      owners = owners == null ? List.of() : List.copyOf(owners);
    }
  }

  record StatusChanged(
      UUID originatorId, int originatorVersion, Instant timestamp, K8sNamespaceStatus status)
      implements K8sNamespaceEvent {}

  /** Replaces the owners as a whole. */
  record OwnersChanged(
      UUID originatorId, int originatorVersion, Instant timestamp, List<String> owners)
      implements K8sNamespaceEvent {
    public OwnersChanged {
      owners = owners == null ? List.of() : List.copyOf(owners);
    }
  }
}
