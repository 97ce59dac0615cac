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

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Access statistics for a cache: tracker-wide hit/miss totals plus per-key counters for a chosen
 * set of monitored keys.
 *
 * <p>Every access reported by the owning cache counts towards the totals. Only monitored keys get
 * their own {@link KeyStatistics}; accesses to other keys are counted globally and otherwise
 * ignored. Reporting an access never starts monitoring a key.
 *
 * <p>This class is the handle that gets passed around for reporting: it exposes reads and lets
 * callers choose which keys to monitor, but it cannot record accesses. Recording goes through the
 * {@link StatisticsMutator}, which is handed out once per tracker to its owning cache.
 *
 * <p><b>Thread Safety:</b> Not thread-safe. The owning cache serializes all access to the tracker,
 * including reads.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * Statistics<String> stats = new Statistics<>("home", "login");
 * LruCache<String, Page> cache = new LruCache<>("pages", CacheConfig.DEFAULT, stats);
 * ...
 * long loginHits = stats.hitsFor("login");
 * double hitRate = stats.hitRate();
 * }</pre>
 *
 * @param <K> key type; must implement {@code equals} and {@code hashCode} consistently
 * @since 1.0.0
 */
public final class Statistics<K> {

  private final Map<K, KeyStatistics> monitoredKeys = new HashMap<>();

  private long totalAccesses;
  private long totalHits;

  private boolean mutatorClaimed;

  /** Creates a tracker that monitors no keys. */
  public Statistics() {}

  /**
   * Creates a tracker monitoring the given keys.
   *
   * @param keys keys to monitor (may be empty)
   */
  @SafeVarargs
  public Statistics(K... keys) {
    Objects.requireNonNull(keys, "keys cannot be null");
    for (K key : keys) {
      monitor(key);
    }
  }

  /**
   * Creates a tracker monitoring every element of the given collection or range.
   *
   * @param keys keys to monitor
   */
  public Statistics(Iterable<? extends K> keys) {
    monitorAll(keys);
  }

  /**
   * Creates a tracker monitoring every remaining element of the iterator.
   *
   * @param keys iterator over keys to monitor; drained by this call
   */
  public Statistics(Iterator<? extends K> keys) {
    Objects.requireNonNull(keys, "keys cannot be null");
    while (keys.hasNext()) {
      monitor(keys.next());
    }
  }

  /**
   * Creates a tracker monitoring every element of the stream.
   *
   * @param keys stream of keys to monitor; consumed by this call
   */
  public Statistics(Stream<? extends K> keys) {
    Objects.requireNonNull(keys, "keys cannot be null");
    keys.forEachOrdered(this::monitor);
  }

  /** Number of accesses reported so far, monitored or not. */
  public long totalAccesses() {
    return totalAccesses;
  }

  /** Number of reported accesses that were hits. */
  public long totalHits() {
    return totalHits;
  }

  /** Number of reported accesses that were misses. */
  public long totalMisses() {
    return totalAccesses - totalHits;
  }

  /**
   * Fraction of all accesses that were hits.
   *
   * <p>Not guarded: with no recorded accesses this is {@code 0.0 / 0}, i.e. {@link Double#NaN}.
   *
   * @return hit rate in [0, 1], or NaN if nothing was recorded
   */
  public double hitRate() {
    return (double) totalHits / totalAccesses;
  }

  /**
   * Fraction of all accesses that were misses ({@code 1 - hitRate()}).
   *
   * @return miss rate in [0, 1], or NaN if nothing was recorded
   */
  public double missRate() {
    return 1 - hitRate();
  }

  /**
   * Returns the live counters for a monitored key.
   *
   * <p>The returned object keeps reflecting new accesses while the key stays monitored. After
   * {@link #unmonitor(Object)} or {@link #unmonitorAll()} it is detached and frozen.
   *
   * @param key the key to look up
   * @return the key's statistics
   * @throws UnmonitoredKeyException if the key is not monitored
   */
  public KeyStatistics statsFor(K key) {
    KeyStatistics stats = monitoredKeys.get(key);
    if (stats == null) {
      throw new UnmonitoredKeyException(key);
    }
    return stats;
  }

  /**
   * Same as {@link #statsFor(Object)}.
   *
   * @throws UnmonitoredKeyException if the key is not monitored
   */
  public KeyStatistics get(K key) {
    return statsFor(key);
  }

  /** @throws UnmonitoredKeyException if the key is not monitored */
  public long hitsFor(K key) {
    return statsFor(key).hits();
  }

  /** @throws UnmonitoredKeyException if the key is not monitored */
  public long missesFor(K key) {
    return statsFor(key).misses();
  }

  /** @throws UnmonitoredKeyException if the key is not monitored */
  public long accessesFor(K key) {
    return statsFor(key).accesses();
  }

  /**
   * Starts monitoring a key with zero counters.
   *
   * <p>Idempotent: if the key is already monitored its counters are left as they are.
   *
   * @param key the key to monitor
   * @throws NullPointerException if key is null
   */
  public void monitor(K key) {
    Objects.requireNonNull(key, "key cannot be null");
    monitoredKeys.putIfAbsent(key, new KeyStatistics());
  }

  /**
   * Starts monitoring every element of the given collection; already monitored keys keep their
   * counters.
   *
   * @param keys keys to monitor
   */
  public void monitorAll(Iterable<? extends K> keys) {
    Objects.requireNonNull(keys, "keys cannot be null");
    for (K key : keys) {
      monitor(key);
    }
  }

  /**
   * Varargs form of {@link #monitorAll(Iterable)}.
   *
   * @param keys keys to monitor
   */
  @SafeVarargs
  public final void monitorAll(K... keys) {
    Objects.requireNonNull(keys, "keys cannot be null");
    for (K key : keys) {
      monitor(key);
    }
  }

  /**
   * Stops monitoring a key and discards its counters. No-op if the key is not monitored.
   *
   * @param key the key to stop monitoring
   */
  public void unmonitor(K key) {
    monitoredKeys.remove(key);
  }

  /** Stops monitoring all keys. Tracker-wide totals are kept. */
  public void unmonitorAll() {
    monitoredKeys.clear();
  }

  /** Whether per-key counters are being kept for this key. */
  public boolean isMonitoring(K key) {
    return monitoredKeys.containsKey(key);
  }

  /** Number of keys currently monitored. */
  public int numberOfMonitoredKeys() {
    return monitoredKeys.size();
  }

  /** Whether at least one key is monitored. */
  public boolean isMonitoringKeys() {
    return !monitoredKeys.isEmpty();
  }

  /**
   * Unmodifiable live view of the monitored keys.
   *
   * @return monitored keys, in no particular order
   */
  public Set<K> monitoredKeys() {
    return Collections.unmodifiableSet(monitoredKeys.keySet());
  }

  /** Whether this tracker's {@link StatisticsMutator} has been handed out. */
  public boolean isMutatorClaimed() {
    return mutatorClaimed;
  }

  /**
   * Marks the mutator as handed out.
   *
   * @return false if it had already been claimed
   */
  boolean claimMutator() {
    if (mutatorClaimed) {
      return false;
    }
    mutatorClaimed = true;
    return true;
  }

  void recordAccess(K key, boolean hit) {
    totalAccesses++;
    if (hit) {
      totalHits++;
    }

    KeyStatistics stats = monitoredKeys.get(key);
    if (stats != null) {
      if (hit) {
        stats.recordHit();
      } else {
        stats.recordMiss();
      }
    }
  }

  @Override
  public String toString() {
    return "Statistics{totalAccesses="
        + totalAccesses
        + ", totalHits="
        + totalHits
        + ", monitoredKeys="
        + monitoredKeys.size()
        + "}";
  }
}
