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

package io.github.suppierk.es.domain;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Function;

/**
 * Describes an {@link Aggregate} variant: how to create a blank instance, which class holds its
 * state and under which names its events are stored.
 *
 * <p>Event names are explicit rather than derived from class names, so that renaming a Java class
 * does not orphan already stored events.
 *
 * @param <A> the type of the aggregate
 * @param <S> the type of the aggregate state
 * @param <E> the base type of the aggregate events
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public final class AggregateType<
  A extends Aggregate<S, E>,
  S,
  E extends DomainEvent
> {
// @formatter:on
  private final String name;
  private final Class<A> aggregateClass;
  private final Class<S> stateClass;
  private final Class<E> eventClass;
  private final Function<Clock, A> factory;
  private final Map<String, Class<? extends E>> eventClassesByName;

  private AggregateType(
      final String name,
      final Class<A> aggregateClass,
      final Class<S> stateClass,
      final Class<E> eventClass,
      final Function<Clock, A> factory,
      final Map<String, Class<? extends E>> eventClassesByName) {
    this.name = name;
    this.aggregateClass = aggregateClass;
    this.stateClass = stateClass;
    this.eventClass = eventClass;
    this.factory = factory;
    this.eventClassesByName = Collections.unmodifiableMap(new LinkedHashMap<>(eventClassesByName));
  }

  /**
   * Starts the definition of a new aggregate variant.
   *
   * @param name unique name of the aggregate variant, used to build stored topics
   * @param aggregateClass of the aggregate
   * @param stateClass of the aggregate state
   * @param eventClass common supertype of the aggregate events
   * @param factory to create blank aggregate instances with
   * @param <A> the type of the aggregate
   * @param <S> the type of the aggregate state
   * @param <E> the base type of the aggregate events
   * @return a builder to register event names with
   */
  @SuppressWarnings("squid:S119")
  public static <A extends Aggregate<S, E>, S, E extends DomainEvent> Builder<A, S, E> builder(
      final String name,
      final Class<A> aggregateClass,
      final Class<S> stateClass,
      final Class<E> eventClass,
      final Function<Clock, A> factory) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Aggregate type name cannot be blank");
    }

    if (aggregateClass == null || stateClass == null || eventClass == null || factory == null) {
      throw new IllegalArgumentException(
          "Aggregate class, state class, event class and factory are required");
    }

    return new Builder<>(name, aggregateClass, stateClass, eventClass, factory);
  }

  /**
   * @return unique name of this aggregate variant
   */
  public String getName() {
    return name;
  }

  /**
   * @return class of the aggregate
   */
  public Class<A> getAggregateClass() {
    return aggregateClass;
  }

  /**
   * @return class of the aggregate state
   */
  public Class<S> getStateClass() {
    return stateClass;
  }

  /**
   * @return common supertype of the aggregate events
   */
  public Class<E> getEventClass() {
    return eventClass;
  }

  /**
   * @return registered event classes keyed by their stored names
   */
  public Map<String, Class<? extends E>> getEventClassesByName() {
    return eventClassesByName;
  }

  /**
   * @param clock to give to the new instance
   * @return a new blank aggregate
   */
  public A newInstance(final Clock clock) {
    final A aggregate = factory.apply(clock);
    if (aggregate == null) {
      throw new IllegalStateException("Factory of '%s' returned null".formatted(name));
    }

    return aggregate;
  }

  /**
   * @param aggregate to cast
   * @return the same aggregate typed as this variant
   * @throws IllegalStateException if the aggregate belongs to another variant
   */
  public A cast(final Aggregate<?, ?> aggregate) {
    if (!aggregateClass.isInstance(aggregate)) {
      throw new IllegalStateException(
          "Aggregate '%s' is not a '%s'"
              .formatted(aggregate == null ? null : aggregate.getId(), name));
    }

    return aggregateClass.cast(aggregate);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    AggregateType<?, ?, ?> that = (AggregateType<?, ?, ?>) o;
    return name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name);
  }

  @Override
  public String toString() {
    return new StringJoiner(", ", AggregateType.class.getSimpleName() + "[", "]")
        .add("name=" + name)
        .add("events=" + eventClassesByName.keySet())
        .toString();
  }

  /**
   * Collects event names for the {@link AggregateType}.
   *
   * @param <A> the type of the aggregate
   * @param <S> the type of the aggregate state
   * @param <E> the base type of the aggregate events
   */
  @SuppressWarnings("squid:S119")
  public static final class Builder<A extends Aggregate<S, E>, S, E extends DomainEvent> {
    private final String name;
    private final Class<A> aggregateClass;
    private final Class<S> stateClass;
    private final Class<E> eventClass;
    private final Function<Clock, A> factory;
    private final Map<String, Class<? extends E>> eventClassesByName;

    private Builder(
        final String name,
        final Class<A> aggregateClass,
        final Class<S> stateClass,
        final Class<E> eventClass,
        final Function<Clock, A> factory) {
      this.name = name;
      this.aggregateClass = aggregateClass;
      this.stateClass = stateClass;
      this.eventClass = eventClass;
      this.factory = factory;
      this.eventClassesByName = new LinkedHashMap<>();
    }

    /**
     * @param eventName stable name to store the event under
     * @param eventSubclass concrete event class
     * @return this builder
     * @throws IllegalStateException if either the name or the class is already registered
     */
    public Builder<A, S, E> event(final String eventName, final Class<? extends E> eventSubclass) {
      if (eventName == null || eventName.isBlank() || eventSubclass == null) {
        throw new IllegalArgumentException("Event name and class are required");
      }

      if (eventClassesByName.containsKey(eventName)
          || eventClassesByName.containsValue(eventSubclass)) {
        throw new IllegalStateException(
            "Event '%s' (%s) is already registered for '%s'"
                .formatted(eventName, eventSubclass.getSimpleName(), name));
      }

      eventClassesByName.put(eventName, eventSubclass);
      return this;
    }

    /**
     * @return immutable aggregate type
     * @throws IllegalStateException if no events were registered
     */
    public AggregateType<A, S, E> build() {
      if (eventClassesByName.isEmpty()) {
        throw new IllegalStateException("Aggregate type '%s' has no events".formatted(name));
      }

      return new AggregateType<>(
          name, aggregateClass, stateClass, eventClass, factory, eventClassesByName);
    }
  }
}
