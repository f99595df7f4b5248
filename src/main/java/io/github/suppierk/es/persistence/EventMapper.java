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

package io.github.suppierk.es.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.suppierk.es.domain.Aggregate;
import io.github.suppierk.es.domain.AggregateType;
import io.github.suppierk.es.domain.DomainEvent;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Converts {@link DomainEvent}s and aggregate states to their stored JSON form and back.
 *
 * <p>Every event class must be registered through its {@link AggregateType} - the stored topic is
 * {@code <aggregate type name>.<event name>}, which keeps stored data independent of Java class
 * names.
 */
public final class EventMapper {
  private static final String TOPIC_SEPARATOR = ".";

  private final ObjectMapper objectMapper;
  private final Map<String, Class<? extends DomainEvent>> eventClassesByTopic;
  private final Map<Class<? extends DomainEvent>, String> topicsByEventClass;
  private final Map<String, AggregateType<?, ?, ?>> aggregateTypesByName;

  /** Creates a mapper with {@link #defaultObjectMapper()}. */
  public EventMapper() {
    this(defaultObjectMapper());
  }

  /**
   * @param objectMapper to serialize with, must be able to handle {@link Instant}s
   */
  public EventMapper(final ObjectMapper objectMapper) {
    if (objectMapper == null) {
      throw new IllegalArgumentException("ObjectMapper cannot be null");
    }

    this.objectMapper = objectMapper;
    this.eventClassesByTopic = new ConcurrentHashMap<>();
    this.topicsByEventClass = new ConcurrentHashMap<>();
    this.aggregateTypesByName = new ConcurrentHashMap<>();
  }

  /**
   * @return an {@link ObjectMapper} which writes ISO-8601 timestamps and tolerates unknown
   *     properties
   */
  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /**
   * Registers all events of the aggregate type.
   *
   * @param aggregateType to register
   * @throws IllegalStateException if the aggregate type or any of its events is already registered
   */
  public synchronized void register(final AggregateType<?, ?, ?> aggregateType) {
    if (aggregateType == null) {
      throw new IllegalArgumentException("Aggregate type cannot be null");
    }

    if (aggregateTypesByName.containsKey(aggregateType.getName())) {
      throw new IllegalStateException(
          "Aggregate type '%s' is already registered".formatted(aggregateType.getName()));
    }

    for (Map.Entry<String, ? extends Class<? extends DomainEvent>> entry :
        aggregateType.getEventClassesByName().entrySet()) {
      if (topicsByEventClass.containsKey(entry.getValue())) {
        throw new IllegalStateException(
            "Event '%s' is already registered".formatted(entry.getValue().getSimpleName()));
      }
    }

    for (Map.Entry<String, ? extends Class<? extends DomainEvent>> entry :
        aggregateType.getEventClassesByName().entrySet()) {
      final String topic = aggregateType.getName() + TOPIC_SEPARATOR + entry.getKey();
      eventClassesByTopic.put(topic, entry.getValue());
      topicsByEventClass.put(entry.getValue(), topic);
    }

    aggregateTypesByName.put(aggregateType.getName(), aggregateType);
  }

  /**
   * @param event to convert
   * @return stored form of the event
   * @throws IllegalStateException if the event class is not registered or cannot be serialized
   */
  public StoredEvent toStoredEvent(final DomainEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    final String topic = topicsByEventClass.get(event.getClass());
    if (topic == null) {
      throw new IllegalStateException(
          "Event '%s' is not registered".formatted(event.getClass().getName()));
    }

    return new StoredEvent(
        event.originatorId(), event.originatorVersion(), topic, write(event), event.timestamp());
  }

  /**
   * @param storedEvent to convert
   * @return the domain event
   * @throws IllegalStateException if the topic is unknown, or the payload does not match the
   *     stored coordinates
   */
  public DomainEvent toDomainEvent(final StoredEvent storedEvent) {
    if (storedEvent == null) {
      throw new IllegalArgumentException("Stored event cannot be null");
    }

    final Class<? extends DomainEvent> eventClass = eventClassesByTopic.get(storedEvent.topic());
    if (eventClass == null) {
      throw new IllegalStateException("Unknown topic '%s'".formatted(storedEvent.topic()));
    }

    final DomainEvent event = read(storedEvent.state(), eventClass);
    if (!storedEvent.originatorId().equals(event.originatorId())
        || storedEvent.originatorVersion() != event.originatorVersion()) {
      throw new IllegalStateException(
          "Stored event %s@%d contains payload of %s@%d"
              .formatted(
                  storedEvent.originatorId(),
                  storedEvent.originatorVersion(),
                  event.originatorId(),
                  event.originatorVersion()));
    }

    return event;
  }

  /**
   * @param aggregateType of the aggregate
   * @param aggregate to take the snapshot of
   * @param takenAt time of the snapshot
   * @param <S> the type of the aggregate state
   * @return stored form of the aggregate state at its current version
   */
  public <S> StoredSnapshot toStoredSnapshot(
      final AggregateType<?, S, ?> aggregateType,
      final Aggregate<S, ?> aggregate,
      final Instant takenAt) {
    if (aggregateType == null || aggregate == null || takenAt == null) {
      throw new IllegalArgumentException("Aggregate type, aggregate and time cannot be null");
    }

    if (aggregate.getId() == null || aggregate.getState() == null) {
      throw new IllegalStateException("Cannot take a snapshot of a blank aggregate");
    }

    return new StoredSnapshot(
        aggregate.getId(),
        aggregate.getVersion(),
        aggregateType.getName(),
        write(aggregate.getState()),
        takenAt);
  }

  /**
   * @param aggregateType of the aggregate
   * @param snapshot to read the state from
   * @param <S> the type of the aggregate state
   * @return deserialized aggregate state
   * @throws IllegalStateException if the snapshot belongs to another aggregate type
   */
  public <S> S toState(final AggregateType<?, S, ?> aggregateType, final StoredSnapshot snapshot) {
    if (aggregateType == null || snapshot == null) {
      throw new IllegalArgumentException("Aggregate type and snapshot cannot be null");
    }

    if (!aggregateType.getName().equals(snapshot.topic())) {
      throw new IllegalStateException(
          "Snapshot of '%s' cannot be read as '%s'"
              .formatted(snapshot.topic(), aggregateType.getName()));
    }

    return read(snapshot.state(), aggregateType.getStateClass());
  }

  private String write(final Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Cannot serialize '%s'".formatted(value.getClass().getName()), e);
    }
  }

  private <T> T read(final String json, final Class<T> valueClass) {
    try {
      return objectMapper.readValue(json, valueClass);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot deserialize '%s'".formatted(valueClass.getName()), e);
    }
  }
}
