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

import static io.github.suppierk.es.jooq.EventStoreTables.STORED_SNAPSHOTS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.persistence.StoredSnapshot;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.h2.jdbcx.JdbcDataSource;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JooqSnapshotStoreTest {
  static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
  static final DSLContext DSL_CONTEXT;

  static {
    final var dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:jooq_snapshot_store;DB_CLOSE_DELAY=-1");
    DSL_CONTEXT = DSL.using(dataSource, SQLDialect.H2);
    EventStoreTables.createIfNotExists(DSL_CONTEXT);
  }

  JooqSnapshotStore store;

  static StoredSnapshot snapshot(UUID originatorId, int version, String state) {
    return new StoredSnapshot(originatorId, version, "Tally", state, NOW);
  }

  @BeforeEach
  void setUp() {
    DSL_CONTEXT.deleteFrom(STORED_SNAPSHOTS).execute();
    store = new JooqSnapshotStore(DSL_CONTEXT);
  }

  @Test
  void when_any_of_the_constructor_arguments_is_null_illegal_argument_must_be_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new JooqSnapshotStore(null));
    assertThrows(IllegalArgumentException.class, () -> new JooqSnapshotStore(DSL_CONTEXT, null));
  }

  @Test
  void latest_snapshot_must_not_exceed_requested_version() {
    final UUID id = UUID.randomUUID();
    store.save(snapshot(id, 2, "{\"v\":2}"));
    store.save(snapshot(id, 4, "{\"v\":4}"));

    assertEquals(Optional.of(snapshot(id, 4, "{\"v\":4}")), store.latest(id));
    assertEquals(Optional.of(snapshot(id, 2, "{\"v\":2}")), store.latest(id, 3));
    assertTrue(store.latest(id, 1).isEmpty());
    assertTrue(store.latest(UUID.randomUUID()).isEmpty());
  }

  @Test
  void saving_the_same_version_twice_must_keep_the_first_snapshot() {
    final UUID id = UUID.randomUUID();
    store.save(snapshot(id, 2, "{\"first\":true}"));
    store.save(snapshot(id, 2, "{\"first\":false}"));

    assertEquals("{\"first\":true}", store.latest(id).orElseThrow().state());
    assertEquals(1, DSL_CONTEXT.fetchCount(STORED_SNAPSHOTS));
  }
}
