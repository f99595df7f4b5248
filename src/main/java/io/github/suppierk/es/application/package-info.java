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

/**
 * Defines how changes of event-sourced aggregates are recorded.
 *
 * <p>Here is an example to help explain how different objects are related to each other - let's
 * assume that we look after namespaces of a Kubernetes cluster:
 *
 * <ul>
 *   <li>Each namespace is an {@link io.github.suppierk.es.domain.Aggregate}, its history is the
 *       sequence of {@link io.github.suppierk.es.domain.DomainEvent}s it went through: registered,
 *       became available, got a new owner.
 *   <li>An operator marks a namespace as deleted with a use case of the {@link
 *       io.github.suppierk.es.application.Application}, which loads the namespace from the {@link
 *       io.github.suppierk.es.application.Repository}, changes its status and saves it.
 *   <li>Saving creates a {@link io.github.suppierk.es.application.ProcessingEvent} containing the
 *       new event, and the {@link io.github.suppierk.es.application.PolicyDispatcher} offers the
 *       event to the {@link io.github.suppierk.es.application.Policy} registered for it:
 *       <ul>
 *         <li>The policy removes the namespace from the cluster, marks the namespace as removed
 *             from the cluster and collects this second event into the same processing event.
 *         <li>The second event is offered to the policy as well, which does not react this time.
 *       </ul>
 *   <li>Both events are appended to the {@link io.github.suppierk.es.persistence.EventStore} at
 *       once. If somebody changed the namespace in the meantime, neither of them is recorded and
 *       the operator retries from the start.
 *   <li>Only after recording, the policy's notification about the removal is published through
 *       the {@link io.github.suppierk.es.async.DomainNotificationProducer}.
 * </ul>
 */
package io.github.suppierk.es.application;
