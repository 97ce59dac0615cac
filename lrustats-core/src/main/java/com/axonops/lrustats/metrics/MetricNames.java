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

package com.axonops.lrustats.metrics;

import java.util.List;

/**
 * Metric name constants for lrustats instrumentation.
 *
 * <p>Names are relative. Each {@link com.axonops.lrustats.cache.LruCache} puts its own name in
 * front, and the registry implementation adds its prefix: the hit counter of a cache named
 * {@code sessions} reporting through {@link DropwizardMetricsAdapter} with the default prefix is
 * {@code com.axonops.lrustats.sessions.cache.hits.total.count}. Statistics are never aggregated
 * across caches.
 *
 * <h2>Metric Categories</h2>
 *
 * <ul>
 *   <li><b>Cache lookups</b> - hit/miss counters incremented by {@link
 *       com.axonops.lrustats.cache.LruCache} on every lookup
 *   <li><b>Cache state</b> - entry count gauge, eviction counter, load latency timer
 *   <li><b>Statistics</b> - gauges reading the cache's {@link
 *       com.axonops.lrustats.stats.Statistics} tracker
 * </ul>
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - suffix {@code .total.count}
 *   <li><b>Timer</b> - suffix {@code .latency}
 *   <li><b>Gauge</b> - suffix {@code .current.count}, or a plain rate
 * </ul>
 *
 * <p>The {@code statistics.*} gauges mirror the tracker, so they reflect exactly what {@code
 * Statistics.totalAccesses()} and friends return. {@link #STATISTICS_HIT_RATE} reads {@code NaN}
 * until the first access.
 *
 * @since 1.0.0
 */
public final class MetricNames {

  private MetricNames() {
    // Constants class
  }

  // ========================================
  // Cache lookups
  // ========================================

  /** Lookups that found a value (Counter). */
  public static final String CACHE_HITS = "cache.hits.total.count";

  /** Lookups that found nothing (Counter). */
  public static final String CACHE_MISSES = "cache.misses.total.count";

  // ========================================
  // Cache state
  // ========================================

  /** Entries evicted because the cache exceeded its maximum size (Counter). */
  public static final String CACHE_EVICTIONS = "cache.evictions.total.count";

  /** Time spent in the loader passed to {@code getOrLoad} on a miss (Timer). */
  public static final String CACHE_LOAD_LATENCY = "cache.loads.latency";

  /** Current number of entries in the cache (Gauge). */
  public static final String CACHE_ENTRIES = "cache.entries.current.count";

  // ========================================
  // Statistics tracker
  // ========================================

  /** Tracker-wide accesses (Gauge over {@code Statistics.totalAccesses()}). */
  public static final String STATISTICS_ACCESSES = "statistics.accesses.total.count";

  /** Tracker-wide hits (Gauge over {@code Statistics.totalHits()}). */
  public static final String STATISTICS_HITS = "statistics.hits.total.count";

  /** Tracker-wide misses (Gauge over {@code Statistics.totalMisses()}). */
  public static final String STATISTICS_MISSES = "statistics.misses.total.count";

  /** Tracker-wide hit rate in [0, 1], NaN before the first access (Gauge). */
  public static final String STATISTICS_HIT_RATE = "statistics.hit_rate";

  /** Number of keys with per-key counters (Gauge). */
  public static final String STATISTICS_MONITORED_KEYS = "statistics.monitored_keys.current.count";

  /** Every gauge a cache registers, in registration order. */
  public static final List<String> GAUGES =
      List.of(
          CACHE_ENTRIES,
          STATISTICS_ACCESSES,
          STATISTICS_HITS,
          STATISTICS_MISSES,
          STATISTICS_HIT_RATE,
          STATISTICS_MONITORED_KEYS);
}
