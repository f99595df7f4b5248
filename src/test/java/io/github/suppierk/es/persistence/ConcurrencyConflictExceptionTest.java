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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ConcurrencyConflictExceptionTest {
  @Test
  void must_have_conflict_http_status_code() {
    assertEquals(409, new ConcurrencyConflictException(UUID.randomUUID(), 1, 2).getStatusCode());
  }

  @Test
  void conflicting_aggregate_must_survive_serialization() throws Exception {
    final UUID originatorId = UUID.randomUUID();
    final var bytes = new ByteArrayOutputStream();
    try (var output = new ObjectOutputStream(bytes)) {
      output.writeObject(new ConcurrencyConflictException(originatorId, 1, 2));
    }

    final ConcurrencyConflictException read;
    try (var input = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
      read = (ConcurrencyConflictException) input.readObject();
    }

    assertEquals(originatorId, read.getOriginatorId());
    assertEquals(1, read.getExpectedVersion());
    assertEquals(2, read.getActualVersion());
  }

  @Test
  void when_aggregate_is_unknown_versions_must_be_unknown_too() {
    final var exception = new ConcurrencyConflictException("Conflict", null);

    assertNull(exception.getOriginatorId());
    assertEquals(-1, exception.getExpectedVersion());
    assertEquals(-1, exception.getActualVersion());
  }
}
