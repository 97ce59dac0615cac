/*
 * Copyright 2025 AxonOps
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

package com.axonops.lrustats.util;

/**
 * Utility for hashing cache keys for logging purposes.
 *
 * <p>Keys often carry user data (ids, emails, query strings), so log lines and exception messages
 * show a short hash instead of the key itself. The same key always gets the same hash, which keeps
 * logs greppable.
 *
 * <p>Example: key "user:42" → hash "d6e4a1c2"
 *
 * @since 1.0.0
 */
public final class KeyHasher {

  private KeyHasher() {
    // Utility class
  }

  /**
   * Creates a compact hex hash of a key for logging.
   *
   * <p>Uses the key's {@link Object#hashCode()}, so the result is only as stable as the key type's
   * own hash function.
   *
   * @param key the cache key (may be null)
   * @return hex string (e.g., "d6e4a1c2"), or "null" for a null key
   */
  public static String hash(Object key) {
    if (key == null) {
      return "null";
    }
    return Integer.toHexString(key.hashCode());
  }

  /**
   * Creates a hash prefixed with the key's simple type name, e.g. {@code "String#d6e4a1c2"}.
   *
   * @param key the cache key (may be null)
   * @return typed hash for log output
   */
  public static String hashWithType(Object key) {
    if (key == null) {
      return "null";
    }
    return key.getClass().getSimpleName() + "#" + hash(key);
  }
}
