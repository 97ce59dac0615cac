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

package com.axonops.lrustats.stats;

/**
 * Hit and miss counters for a single monitored key.
 *
 * <p>Instances are created and advanced only by the owning {@link Statistics}; callers get a live
 * read-only view through {@link Statistics#statsFor(Object)}. Once the key is unmonitored the
 * instance is detached and stops changing.
 *
 * <p>Counters are plain {@code long}s and wrap on overflow.
 *
 * @since 1.0.0
 */
public final class KeyStatistics {

  private long hits;
  private long misses;

  KeyStatistics() {}

  /** Number of lookups of this key that found a value. */
  public long hits() {
    return hits;
  }

  /** Number of lookups of this key that found nothing. */
  public long misses() {
    return misses;
  }

  /** Total lookups of this key (hits + misses). */
  public long accesses() {
    return hits + misses;
  }

  void recordHit() {
    hits++;
  }

  void recordMiss() {
    misses++;
  }

  @Override
  public String toString() {
    return "KeyStatistics{hits=" + hits + ", misses=" + misses + "}";
  }
}
