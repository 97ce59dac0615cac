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

package com.axonops.lrustats.cache;

import com.axonops.lrustats.metrics.MetricNames;
import com.axonops.lrustats.metrics.StatsMetricsRegistry;
import com.axonops.lrustats.stats.Statistics;
import com.axonops.lrustats.stats.StatisticsMutator;
import com.axonops.lrustats.util.KeyHasher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded least-recently-used cache that reports every lookup to a {@link Statistics} tracker.
 *
 * <p>The cache owns the tracker's {@link StatisticsMutator} and never exposes it, so the numbers
 * read through {@link #statistics()} only ever reflect real lookups. Each {@link #get(Object)} or
 * {@link #getOrLoad(Object, Function)} records exactly one access; {@link #containsKey(Object)},
 * {@link #put(Object, Object)} and {@link #remove(Object)} record nothing.
 *
 * <p>Thread safety: all public methods synchronize on the cache, which also serializes every
 * access the cache makes to its tracker. The tracker itself is not thread-safe, so code reading
 * {@link #statistics()} from other threads must synchronize on the cache as well. The metrics
 * gauges do this already.
 *
 * @param <K> key type; must implement {@code equals} and {@code hashCode} consistently
 * @param <V> value type
 * @since 1.0.0
 */
public final class LruCache<K, V> implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(LruCache.class);

  private final String name;
  private final CacheConfig config;
  private final Statistics<K> statistics;
  private final StatisticsMutator<K> mutator;
  private final LinkedHashMap<K, V> entries;

  private long evictions;

  /**
   * Creates a cache with a fresh tracker that monitors no keys.
   *
   * @param name cache name, used as the metric name segment; unique per metrics registry
   * @param config the cache configuration
   */
  public LruCache(String name, CacheConfig config) {
    this(name, config, new Statistics<>());
  }

  /**
   * Creates a cache that reports to the given tracker.
   *
   * <p>The cache claims the tracker's mutator as the last construction step, so the tracker must
   * not have been attached to another cache or claimed by anyone else. If construction fails the
   * tracker is left unclaimed.
   *
   * @param name cache name, used as the metric name segment; unique per metrics registry
   * @param config the cache configuration
   * @param statistics the tracker to record lookups in
   * @throws IllegalArgumentException if name is blank, or another cache with this name is
   *     registered in the same metrics registry
   * @throws IllegalStateException if the tracker's mutator was already claimed
   */
  public LruCache(String name, CacheConfig config, Statistics<K> statistics) {
    Objects.requireNonNull(name, "name cannot be null");
    if (name.isBlank()) {
      throw new IllegalArgumentException("name cannot be blank");
    }
    this.name = name;
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.statistics = Objects.requireNonNull(statistics, "statistics cannot be null");
    this.entries =
        new LinkedHashMap<K, V>(16, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
            if (size() <= LruCache.this.config.maxCacheSize()) {
              return false;
            }
            evictions++;
            LruCache.this
                .config
                .metricsRegistry()
                .incrementCounter(metricName(MetricNames.CACHE_EVICTIONS));
            logger.trace(
                "LruStats: LRU evicting entry - cache: {}, key hash: {}",
                LruCache.this.name,
                KeyHasher.hash(eldest.getKey()));
            return true;
          }
        };

    registerCacheMetrics();
    try {
      this.mutator = StatisticsMutator.claim(statistics);
    } catch (IllegalStateException e) {
      removeCacheMetrics();
      throw e;
    }

    logger.debug(
        "LruStats: Cache initialized - name: {}, maxSize: {}, monitoredKeys: {}",
        name,
        config.maxCacheSize(),
        statistics.numberOfMonitoredKeys());
  }

  /**
   * Looks up a key, recording a hit or a miss.
   *
   * @param key the key to look up
   * @return the cached value, or empty on a miss
   */
  public synchronized Optional<V> get(K key) {
    Objects.requireNonNull(key, "key cannot be null");
    V value = entries.get(key);
    recordLookup(key, value != null);
    return Optional.ofNullable(value);
  }

  /**
   * Looks up a key and loads it on a miss.
   *
   * <p>Records exactly one access. The loader runs while the cache lock is held, so it should be
   * quick and must not call back into this cache.
   *
   * @param key the key to look up
   * @param loader computes the value on a miss; must not return null
   * @return the cached or freshly loaded value
   * @throws NullPointerException if the loader returns null
   */
  public synchronized V getOrLoad(K key, Function<? super K, ? extends V> loader) {
    Objects.requireNonNull(key, "key cannot be null");
    Objects.requireNonNull(loader, "loader cannot be null");

    V cached = entries.get(key);
    if (cached != null) {
      recordLookup(key, true);
      return cached;
    }

    recordLookup(key, false);

    long start = System.nanoTime();
    V loaded = loader.apply(key);
    config
        .metricsRegistry()
        .recordTimer(metricName(MetricNames.CACHE_LOAD_LATENCY), System.nanoTime() - start);

    Objects.requireNonNull(loaded, "loader returned null for key hash " + KeyHasher.hash(key));
    entries.put(key, loaded);
    return loaded;
  }

  /**
   * Stores a value, evicting the least recently used entry if the cache is full. Not recorded as
   * an access.
   */
  public synchronized void put(K key, V value) {
    Objects.requireNonNull(key, "key cannot be null");
    Objects.requireNonNull(value, "value cannot be null");
    entries.put(key, value);
  }

  /**
   * Removes an entry. Statistics for the key are kept.
   *
   * @return true if an entry was removed
   */
  public synchronized boolean remove(K key) {
    return entries.remove(key) != null;
  }

  /** Whether the key is cached. Not recorded as an access and does not refresh recency. */
  public synchronized boolean containsKey(K key) {
    return entries.containsKey(key);
  }

  public synchronized int size() {
    return entries.size();
  }

  public int maxSize() {
    return config.maxCacheSize();
  }

  /** Number of entries evicted for capacity since the cache was created. */
  public synchronized long evictions() {
    return evictions;
  }

  /** Removes all entries. Statistics, including monitored keys, are left untouched. */
  public synchronized void clear() {
    logger.debug("LruStats: Clearing cache {} - {} entries", name, entries.size());
    entries.clear();
  }

  /**
   * The tracker this cache reports to. Reads from other threads must synchronize on the cache.
   *
   * @return the cache's statistics
   */
  public Statistics<K> statistics() {
    return statistics;
  }

  /** Starts monitoring a key in this cache's tracker. See {@link Statistics#monitor(Object)}. */
  public synchronized void monitor(K key) {
    statistics.monitor(key);
  }

  /** Stops monitoring a key in this cache's tracker. */
  public synchronized void unmonitor(K key) {
    statistics.unmonitor(key);
  }

  /** Stops monitoring all keys in this cache's tracker. Totals are kept. */
  public synchronized void unmonitorAll() {
    statistics.unmonitorAll();
  }

  /** The cache name used in its metric names. */
  public String name() {
    return name;
  }

  public CacheConfig getConfig() {
    return config;
  }

  /** Unregisters this cache's gauges. The cache stays usable. */
  @Override
  public void close() {
    removeCacheMetrics();
    logger.debug("LruStats: Cache {} closed - gauges removed", name);
  }

  private void recordLookup(K key, boolean hit) {
    mutator.recordAccess(key, hit);
    config
        .metricsRegistry()
        .incrementCounter(metricName(hit ? MetricNames.CACHE_HITS : MetricNames.CACHE_MISSES));
    logger.trace(
        "LruStats: Cache {} - cache: {}, key hash: {}",
        hit ? "hit" : "miss",
        name,
        KeyHasher.hash(key));
  }

  /**
   * Registers cache and statistics gauges with the metrics registry. If a registration fails,
   * the gauges this call already registered are removed again; gauges owned by others are left
   * alone.
   */
  private void registerCacheMetrics() {
    Map<String, Supplier<Number>> gauges = new LinkedHashMap<>();
    gauges.put(MetricNames.CACHE_ENTRIES, locked(entries::size));
    gauges.put(MetricNames.STATISTICS_ACCESSES, locked(statistics::totalAccesses));
    gauges.put(MetricNames.STATISTICS_HITS, locked(statistics::totalHits));
    gauges.put(MetricNames.STATISTICS_MISSES, locked(statistics::totalMisses));
    gauges.put(MetricNames.STATISTICS_HIT_RATE, locked(statistics::hitRate));
    gauges.put(MetricNames.STATISTICS_MONITORED_KEYS, locked(statistics::numberOfMonitoredKeys));

    StatsMetricsRegistry metrics = config.metricsRegistry();
    List<String> registered = new ArrayList<>();
    try {
      for (Map.Entry<String, Supplier<Number>> gauge : gauges.entrySet()) {
        String fullName = metricName(gauge.getKey());
        metrics.registerGauge(fullName, gauge.getValue());
        registered.add(fullName);
      }
    } catch (RuntimeException e) {
      registered.forEach(metrics::removeGauge);
      logger.warn("LruStats: Failed to register metrics for cache {}", name, e);
      throw e;
    }

    logger.debug("LruStats: Metrics registered for cache {} - {} gauges", name, registered.size());
  }

  private void removeCacheMetrics() {
    StatsMetricsRegistry metrics = config.metricsRegistry();
    for (String gauge : MetricNames.GAUGES) {
      metrics.removeGauge(metricName(gauge));
    }
  }

  /** Full metric name for this cache, e.g. {@code sessions.cache.hits.total.count}. */
  private String metricName(String metric) {
    return name + "." + metric;
  }

  /** Wraps a gauge supplier so it reads under the cache lock. */
  private Supplier<Number> locked(Supplier<Number> reader) {
    return () -> {
      synchronized (this) {
        return reader.get();
      }
    };
  }
}
