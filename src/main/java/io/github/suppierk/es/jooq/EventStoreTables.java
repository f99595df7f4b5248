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

import java.time.OffsetDateTime;
import java.util.UUID;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/**
 * Tables used by {@link JooqEventStore} and {@link JooqSnapshotStore}.
 *
 * <p>Defined by hand instead of being generated, because the library owns its schema.
 */
public final class EventStoreTables {
  public static final Table<Record> STORED_EVENTS = DSL.table(DSL.name("stored_events"));
  public static final Table<Record> STORED_SNAPSHOTS = DSL.table(DSL.name("stored_snapshots"));

  /** Position of the event in the log of all events, only present in {@link #STORED_EVENTS}. */
  public static final Field<Long> POSITION =
      DSL.field(DSL.name("id"), SQLDataType.BIGINT.identity(true));

  public static final Field<UUID> ORIGINATOR_ID =
      DSL.field(DSL.name("originator_id"), SQLDataType.UUID.nullable(false));
  public static final Field<Integer> ORIGINATOR_VERSION =
      DSL.field(DSL.name("originator_version"), SQLDataType.INTEGER.nullable(false));
  public static final Field<String> TOPIC =
      DSL.field(DSL.name("topic"), SQLDataType.VARCHAR(255).nullable(false));
  public static final Field<String> STATE =
      DSL.field(DSL.name("state"), SQLDataType.CLOB.nullable(false));
  public static final Field<OffsetDateTime> CREATED_AT =
      DSL.field(DSL.name("created_at"), SQLDataType.TIMESTAMPWITHTIMEZONE.nullable(false));

  private EventStoreTables() {
    // Cannot be instantiated
  }

  /**
   * Creates both tables unless they exist.
   *
   * @param dsl with permission to change the schema
   */
  public static void createIfNotExists(final DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext cannot be null");
    }

    dsl.createTableIfNotExists(STORED_EVENTS)
        .columns(POSITION, ORIGINATOR_ID, ORIGINATOR_VERSION, TOPIC, STATE, CREATED_AT)
        .constraints(
            DSL.constraint(DSL.name("pk_stored_events")).primaryKey(POSITION),
            DSL.constraint(DSL.name("uk_stored_events_originator"))
                .unique(ORIGINATOR_ID, ORIGINATOR_VERSION))
        .execute();

    dsl.createTableIfNotExists(STORED_SNAPSHOTS)
        .columns(ORIGINATOR_ID, ORIGINATOR_VERSION, TOPIC, STATE, CREATED_AT)
        .constraints(
            DSL.constraint(DSL.name("pk_stored_snapshots"))
                .primaryKey(ORIGINATOR_ID, ORIGINATOR_VERSION))
        .execute();
  }
}
