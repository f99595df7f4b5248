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

import static io.github.suppierk.es.jooq.EventStoreTables.STORED_EVENTS;
import static io.github.suppierk.es.jooq.EventStoreTables.STORED_SNAPSHOTS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.persistence.ConcurrencyConflictException;
import io.github.suppierk.es.persistence.LoggedEvent;
import io.github.suppierk.es.persistence.StoredEvent;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.h2.jdbcx.JdbcDataSource;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JooqEventStoreTest {
  static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
  static final DSLContext DSL_CONTEXT;

  static {
    final var dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:jooq_event_store;DB_CLOSE_DELAY=-1");
    DSL_CONTEXT = DSL.using(dataSource, SQLDialect.H2);
    EventStoreTables.createIfNotExists(DSL_CONTEXT);
  }

  JooqEventStore store;
  UUID first;
  UUID second;

  static StoredEvent event(UUID originatorId, int version) {
    return new StoredEvent(
        originatorId, version, "Tally.Marked", "{\"version\":" + version + "}", NOW);
  }

  @BeforeEach
  void setUp() {
    DSL_CONTEXT.deleteFrom(STORED_EVENTS).execute();
    store = new JooqEventStore(DSL_CONTEXT);
    first = UUID.randomUUID();
    second = UUID.randomUUID();
  }

  @Test
  void when_any_of_the_constructor_arguments_is_null_illegal_argument_must_be_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new JooqEventStore(null));
    assertThrows(IllegalArgumentException.class, () -> new JooqEventStore(DSL_CONTEXT, null));
    assertThrows(IllegalArgumentException.class, () -> new JooqEventStore(null, DSL_CONTEXT));
  }

  @Test
  void creating_tables_twice_must_not_fail() {
    EventStoreTables.createIfNotExists(DSL_CONTEXT);

    assertEquals(0, DSL_CONTEXT.fetchCount(STORED_EVENTS));
    assertEquals(0, DSL_CONTEXT.fetchCount(STORED_SNAPSHOTS));
  }

  @Nested
  class Append {
    @Test
    void appended_events_must_be_read_in_version_order() {
      store.append(List.of(event(first, 1), event(first, 2), event(second, 1)));
      store.append(first, 2, List.of(event(first, 3)));

      assertEquals(
          List.of(event(first, 1), event(first, 2), event(first, 3)), store.read(first, 1));
      assertEquals(List.of(event(first, 2), event(first, 3)), store.read(first, 2, 3));
      assertEquals(List.of(event(second, 1)), store.read(second, 1));
      assertEquals(3, store.currentVersion(first));
      assertEquals(0, store.currentVersion(UUID.randomUUID()));
    }

    @Test
    void when_any_aggregate_conflicts_the_whole_transaction_must_be_rolled_back() {
      store.append(List.of(event(second, 1)));

      final var exception =
          assertThrows(
              ConcurrencyConflictException.class,
              () -> store.append(List.of(event(first, 1), event(second, 1))));

      assertEquals(second, exception.getOriginatorId());
      assertEquals(0, exception.getExpectedVersion());
      assertEquals(1, exception.getActualVersion());
      assertTrue(store.read(first, 1).isEmpty());
      assertEquals(1, DSL_CONTEXT.fetchCount(STORED_EVENTS));
    }

    @Test
    void when_versions_are_not_consecutive_illegal_argument_must_be_thrown() {
      final List<StoredEvent> withGap = List.of(event(first, 1), event(first, 3));

      assertThrows(IllegalArgumentException.class, () -> store.append(withGap));
      assertEquals(0, DSL_CONTEXT.fetchCount(STORED_EVENTS));
    }

    @Test
    void when_unique_key_rejects_append_conflict_must_not_name_any_aggregate() {
      final var violation =
          new DataAccessException(
              "Duplicate key", new SQLIntegrityConstraintViolationException("Duplicate", "23505"));

      final RuntimeException translated = JooqEventStore.translate(violation, 2);

      final var conflict = assertInstanceOf(ConcurrencyConflictException.class, translated);
      assertNull(conflict.getOriginatorId());
      assertEquals(-1, conflict.getExpectedVersion());
      assertEquals(-1, conflict.getActualVersion());
      assertTrue(conflict.getMessage().contains("unknown"));
      assertSame(violation, conflict.getCause());
    }

    @Test
    void when_append_fails_for_other_reasons_failure_must_be_kept() {
      final var failure = new DataAccessException("Connection lost");

      assertSame(failure, JooqEventStore.translate(failure, 1));
    }
  }

  @Nested
  class Log {
    @Test
    void positions_must_follow_commit_order_across_aggregates() {
      final long start = lastPosition();
      store.append(List.of(event(first, 1), event(second, 1)));
      store.append(List.of(event(second, 2), event(first, 2)));

      final List<LoggedEvent> log = store.readAll(start, 10);

      assertEquals(
          List.of(event(first, 1), event(second, 1), event(second, 2), event(first, 2)),
          log.stream().map(LoggedEvent::event).toList());
      for (int i = 1; i < log.size(); i++) {
        assertTrue(log.get(i - 1).position() < log.get(i).position());
      }
    }

    @Test
    void log_must_be_read_in_pages() {
      final long start = lastPosition();
      store.append(List.of(event(first, 1), event(first, 2), event(first, 3)));

      final List<LoggedEvent> firstPage = store.readAll(start, 2);
      final List<LoggedEvent> secondPage =
          store.readAll(firstPage.get(firstPage.size() - 1).position(), 2);

      assertEquals(2, firstPage.size());
      assertEquals(List.of(event(first, 3)), secondPage.stream().map(LoggedEvent::event).toList());
      assertTrue(store.readAll(secondPage.get(0).position(), 2).isEmpty());
    }

    long lastPosition() {
      // Identity values are not reset by deletions
      final Long max =
          DSL_CONTEXT
              .select(DSL.max(EventStoreTables.POSITION))
              .from(STORED_EVENTS)
              .fetchOne(0, Long.class);
      return max == null ? 0 : max;
    }
  }
}
