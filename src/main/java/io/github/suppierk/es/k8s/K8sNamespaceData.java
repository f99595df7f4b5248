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

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read model of a {@link K8sNamespace} returned by {@link K8sNamespaceApplication}.
 *
 * @param id of the namespace aggregate
 * @param version of the namespace aggregate
 * @param k8sClusterId identifier of the cluster
 * @param namespace name of the namespace within the cluster
 * @param creationTimestamp when the namespace was created on the cluster
 * @param status current lifecycle status
 * @param owners current owners
 */
public record K8sNamespaceData(
    UUID id,
    int version,
    String k8sClusterId,
    String namespace,
    Instant creationTimestamp,
    K8sNamespaceStatus status,
    List<String> owners) {
  public K8sNamespaceData {
    owners = owners == null ? List.of() : List.copyOf(owners);
  }
}
