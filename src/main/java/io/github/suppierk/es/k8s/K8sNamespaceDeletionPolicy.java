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

import io.github.suppierk.es.application.Policy;
import io.github.suppierk.es.application.ProcessingEvent;
import io.github.suppierk.es.k8s.K8sNamespaceEvent.StatusChanged;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes a namespace marked as {@link K8sNamespaceStatus#DELETED} from its cluster and records
 * the removal as {@link K8sNamespaceStatus#K8S_DELETED} within the same submission.
 *
 * <p>Reacts only while the namespace is {@link K8sNamespaceStatus#DELETED}, so its own event does
 * not trigger it again.
 */
public final class K8sNamespaceDeletionPolicy implements Policy<StatusChanged> {
  private static final Logger LOGGER = LoggerFactory.getLogger(K8sNamespaceDeletionPolicy.class);

  /** {@inheritDoc} */
  @Override
  public void process(final StatusChanged event, final ProcessingEvent processingEvent) {
    final K8sNamespace k8sNamespace =
        processingEvent.getAggregate(K8sNamespace.TYPE, event.originatorId());

    if (k8sNamespace.getStatus() != K8sNamespaceStatus.DELETED) {
      return;
    }

    LOGGER.debug(
        "Removing namespace {} from k8s cluster {}",
        k8sNamespace.getNamespace(),
        k8sNamespace.getK8sClusterId());

    k8sNamespace.setStatus(K8sNamespaceStatus.K8S_DELETED);
    processingEvent.addNotification(
        k8sNamespace.getId(),
        "Namespace %s deleted on k8s cluster %s"
            .formatted(k8sNamespace.getNamespace(), k8sNamespace.getK8sClusterId()));
    processingEvent.collectEvents(k8sNamespace);
  }
}
