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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * Deterministic identifiers for aggregates derived from their business keys.
 *
 * <p>Same inputs always produce the same identifier, which is what enables idempotent "get or
 * create" flows: a second registration attempt resolves to the already existing aggregate.
 *
 * @see <a href="https://www.rfc-editor.org/rfc/rfc4122#section-4.3">RFC 4122, name-based UUID</a>
 */
public final class AggregateIds {
  /** Name space for URLs, as defined by RFC 4122 Appendix C. */
  public static final UUID NAMESPACE_URL = UUID.fromString("6ba7b811-9dad-11d1-80b4-00c04fd430c8");

  /** Name space for fully-qualified domain names, as defined by RFC 4122 Appendix C. */
  public static final UUID NAMESPACE_DNS = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

  private AggregateIds() {
    // Cannot be instantiated
  }

  /**
   * Creates a version 5 (SHA-1, name-based) {@link UUID}.
   *
   * @param namespace to scope the name with
   * @param name to derive the identifier from
   * @return the same identifier for the same pair of arguments
   */
  public static UUID nameBased(final UUID namespace, final String name) {
    if (namespace == null || name == null) {
      throw new IllegalArgumentException("Namespace and name cannot be null");
    }

    final MessageDigest sha1;
    try {
      sha1 = MessageDigest.getInstance("SHA-1");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-1 is not supported by this JVM", e);
    }

    final ByteBuffer namespaceBytes = ByteBuffer.allocate(16);
    namespaceBytes.putLong(namespace.getMostSignificantBits());
    namespaceBytes.putLong(namespace.getLeastSignificantBits());

    sha1.update(namespaceBytes.array());
    sha1.update(name.getBytes(StandardCharsets.UTF_8));

    final byte[] hash = sha1.digest();
    hash[6] &= 0x0f;
    hash[6] |= 0x50; // version 5
    hash[8] &= 0x3f;
    hash[8] |= (byte) 0x80; // IETF variant

    final ByteBuffer uuidBytes = ByteBuffer.wrap(hash, 0, 16);
    return new UUID(uuidBytes.getLong(), uuidBytes.getLong());
  }

  /**
   * Builds a URL-like path from the aggregate kind and its business keys and hashes it.
   *
   * @param kind of the aggregate, e.g. {@code k8s_namespace}
   * @param keys business keys in a stable order
   * @return name-based identifier in the {@link #NAMESPACE_URL} name space
   */
  public static UUID fromKeys(final String kind, final String... keys) {
    if (kind == null || keys == null) {
      throw new IllegalArgumentException("Kind and keys cannot be null");
    }

    final StringBuilder path = new StringBuilder("/").append(kind);
    for (String key : keys) {
      if (key == null) {
        throw new IllegalArgumentException("Key of '%s' cannot be null".formatted(kind));
      }

      path.append('/').append(key);
    }

    return nameBased(NAMESPACE_URL, path.toString());
  }
}
