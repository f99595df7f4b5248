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

package io.github.suppierk.es.jooq;

import static io.github.suppierk.es.jooq.EventStoreTables.CREATED_AT;
import static io.github.suppierk.es.jooq.EventStoreTables.ORIGINATOR_ID;
import static io.github.suppierk.es.jooq.EventStoreTables.ORIGINATOR_VERSION;
import static io.github.suppierk.es.jooq.EventStoreTables.POSITION;
import static io.github.suppierk.es.jooq.EventStoreTables.STATE;
import static io.github.suppierk.es.jooq.EventStoreTables.STORED_EVENTS;
import static io.github.suppierk.es.jooq.EventStoreTables.TOPIC;

import io.github.suppierk.es.persistence.ConcurrencyConflictException;
import io.github.suppierk.es.persistence.EventStore;
import io.github.suppierk.es.persistence.LoggedEvent;
import io.github.suppierk.es.persistence.StoredEvent;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.jooq.impl.DSL;

/**
 * {@link EventStore} on top of a relational database.
 *
 * <p>Appends run in a single transaction of the read-write {@link DSLContext}: the stored version
 * of every aggregate is verified first, and the unique key on aggregate identifier and version
 * rejects whatever a concurrent transaction slipped in between.
 *
 * <p>Reads use the read-only {@link DSLContext}, which may point to a replica.
 */
public final class JooqEventStore implements EventStore {
  private final DSLContext readWriteDsl;
  private final DSLContext readOnlyDsl;

  /**
   * @param dsl to both read and write with
   */
  public JooqEventStore(final DSLContext dsl) {
    this(dsl, dsl);
  }

  /**
   * @param readWriteDsl to append with
   * @param readOnlyDsl to read with
   */
  public JooqEventStore(final DSLContext readWriteDsl, final DSLContext readOnlyDsl) {
    if (readWriteDsl == null || readOnlyDsl == null) {
      throw new IllegalArgumentException("Read-write and read-only DSLs cannot be null");
    }

    this.readWriteDsl = readWriteDsl;
    this.readOnlyDsl = readOnlyDsl;
  }

  /** {@inheritDoc} */
  @Override
  public void append(final List<StoredEvent> events) {
    final Map<UUID, List<StoredEvent>> grouped = EventStore.groupByOriginator(events);
    if (grouped.isEmpty()) {
      return;
    }

    try {
      readWriteDsl.transaction(
          (final Configuration trx) -> {
            final DSLContext dsl = trx.dsl();

            for (Map.Entry<UUID, List<StoredEvent>> entry : grouped.entrySet()) {
              final int expectedVersion = entry.getValue().get(0).originatorVersion() - 1;
              final int actualVersion = storedVersion(dsl, entry.getKey());
              if (actualVersion != expectedVersion) {
                throw new ConcurrencyConflictException(
                    entry.getKey(), expectedVersion, actualVersion);
              }
            }

            // One statement per event keeps positions in the given order
            for (StoredEvent event : events) {
              dsl.insertInto(STORED_EVENTS)
                  .set(ORIGINATOR_ID, event.originatorId())
                  .set(ORIGINATOR_VERSION, event.originatorVersion())
                  .set(TOPIC, event.topic())
                  .set(STATE, event.state())
                  .set(CREATED_AT, event.timestamp().atOffset(ZoneOffset.UTC))
                  .execute();
            }
          });
    } catch (DataAccessException e) {
      throw translate(e, grouped.size());
    }
  }

  /** {@inheritDoc} */
  @Override
  public List<StoredEvent> read(
      final UUID originatorId, final int fromVersion, final int toVersion) {
    if (originatorId == null) {
      throw new IllegalArgumentException("Aggregate ID cannot be null");
    }

    return readOnlyDsl
        .select(ORIGINATOR_ID, ORIGINATOR_VERSION, TOPIC, STATE, CREATED_AT)
        .from(STORED_EVENTS)
        .where(ORIGINATOR_ID.eq(originatorId))
        .and(ORIGINATOR_VERSION.ge(fromVersion))
        .and(ORIGINATOR_VERSION.le(toVersion))
        .orderBy(ORIGINATOR_VERSION.asc())
        .fetch(JooqEventStore::toStoredEvent);
  }

  /** {@inheritDoc} */
  @Override
  public int currentVersion(final UUID originatorId) {
    if (originatorId == null) {
      throw new IllegalArgumentException("Aggregate ID cannot be null");
    }

    return storedVersion(readOnlyDsl, originatorId);
  }

  /** {@inheritDoc} */
  @Override
  public List<LoggedEvent> readAll(final long afterPosition, final int limit) {
    if (afterPosition < 0 || limit < 0) {
      throw new IllegalArgumentException("Position and limit cannot be negative");
    }

    return readOnlyDsl
        .select(POSITION, ORIGINATOR_ID, ORIGINATOR_VERSION, TOPIC, STATE, CREATED_AT)
        .from(STORED_EVENTS)
        .where(POSITION.gt(afterPosition))
        .orderBy(POSITION.asc())
        .limit(limit)
        .fetch(dbRecord -> new LoggedEvent(dbRecord.get(POSITION), toStoredEvent(dbRecord)));
  }

  private static int storedVersion(final DSLContext dsl, final UUID originatorId) {
    return dsl.select(DSL.coalesce(DSL.max(ORIGINATOR_VERSION), DSL.inline(0)))
        .from(STORED_EVENTS)
        .where(ORIGINATOR_ID.eq(originatorId))
        .fetchSingle()
        .value1();
  }

  private static StoredEvent toStoredEvent(final Record dbRecord) {
    return new StoredEvent(
        dbRecord.get(ORIGINATOR_ID),
        dbRecord.get(ORIGINATOR_VERSION),
        dbRecord.get(TOPIC),
        dbRecord.get(STATE),
        dbRecord.get(CREATED_AT).toInstant());
  }

  /**
   * The unique key does not report which aggregate it rejected.
   *
   * @param e failure of the append transaction
   * @param aggregateCount number of aggregates in the append
   * @return the conflict for integrity violations, the original failure otherwise
   */
  static RuntimeException translate(final DataAccessException e, final int aggregateCount) {
    if (e.sqlStateClass() == SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
      return new ConcurrencyConflictException(
          "One of %d aggregates was changed concurrently, the aggregate is unknown"
              .formatted(aggregateCount),
          e);
    }

    return e;
  }
}
