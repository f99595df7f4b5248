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
import static io.github.suppierk.es.jooq.EventStoreTables.STATE;
import static io.github.suppierk.es.jooq.EventStoreTables.STORED_SNAPSHOTS;
import static io.github.suppierk.es.jooq.EventStoreTables.TOPIC;

import io.github.suppierk.es.persistence.SnapshotStore;
import io.github.suppierk.es.persistence.StoredSnapshot;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link SnapshotStore} on top of a relational database. */
public final class JooqSnapshotStore implements SnapshotStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(JooqSnapshotStore.class);

  private final DSLContext readWriteDsl;
  private final DSLContext readOnlyDsl;

  /**
   * @param dsl to both read and write with
   */
  public JooqSnapshotStore(final DSLContext dsl) {
    this(dsl, dsl);
  }

  /**
   * @param readWriteDsl to save with
   * @param readOnlyDsl to read with
   */
  public JooqSnapshotStore(final DSLContext readWriteDsl, final DSLContext readOnlyDsl) {
    if (readWriteDsl == null || readOnlyDsl == null) {
      throw new IllegalArgumentException("Read-write and read-only DSLs cannot be null");
    }

    this.readWriteDsl = readWriteDsl;
    this.readOnlyDsl = readOnlyDsl;
  }

  /** {@inheritDoc} */
  @Override
  public void save(final StoredSnapshot snapshot) {
    if (snapshot == null) {
      throw new IllegalArgumentException("Snapshot cannot be null");
    }

    try {
      readWriteDsl.transaction(
          (final Configuration trx) -> {
            final DSLContext dsl = trx.dsl();
            final boolean exists =
                dsl.fetchExists(
                    STORED_SNAPSHOTS,
                    ORIGINATOR_ID
                        .eq(snapshot.originatorId())
                        .and(ORIGINATOR_VERSION.eq(snapshot.originatorVersion())));

            if (!exists) {
              dsl.insertInto(STORED_SNAPSHOTS)
                  .set(ORIGINATOR_ID, snapshot.originatorId())
                  .set(ORIGINATOR_VERSION, snapshot.originatorVersion())
                  .set(TOPIC, snapshot.topic())
                  .set(STATE, snapshot.state())
                  .set(CREATED_AT, snapshot.timestamp().atOffset(ZoneOffset.UTC))
                  .execute();
            }
          });
    } catch (DataAccessException e) {
      if (e.sqlStateClass() != SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
        throw e;
      }

      // Concurrent save of the same version, the first one wins
      LOGGER.debug(
          "Snapshot {}@{} already exists", snapshot.originatorId(), snapshot.originatorVersion());
    }
  }

  /** {@inheritDoc} */
  @Override
  public Optional<StoredSnapshot> latest(final UUID originatorId, final int maxVersion) {
    if (originatorId == null) {
      throw new IllegalArgumentException("Aggregate ID cannot be null");
    }

    return readOnlyDsl
        .select(ORIGINATOR_ID, ORIGINATOR_VERSION, TOPIC, STATE, CREATED_AT)
        .from(STORED_SNAPSHOTS)
        .where(ORIGINATOR_ID.eq(originatorId))
        .and(ORIGINATOR_VERSION.le(maxVersion))
        .orderBy(ORIGINATOR_VERSION.desc())
        .limit(1)
        .fetchOptional(
            dbRecord ->
                new StoredSnapshot(
                    dbRecord.get(ORIGINATOR_ID),
                    dbRecord.get(ORIGINATOR_VERSION),
                    dbRecord.get(TOPIC),
                    dbRecord.get(STATE),
                    dbRecord.get(CREATED_AT).toInstant()));
  }
}
