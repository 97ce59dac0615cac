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

import com.axonops.lrustats.util.KeyHasher;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write access to a {@link Statistics} tracker.
 *
 * <p>Recording an access is reserved for the cache that owns the tracker, so that code holding a
 * {@code Statistics} reference for reporting cannot skew the measured rates. Each tracker hands
 * out exactly one mutator: the first {@link #claim(Statistics)} succeeds, any later claim fails.
 * An owning cache claims the mutator when it is constructed and never exposes it.
 *
 * <pre>{@code
 * StatisticsMutator<String> mutator = StatisticsMutator.create("home");
 * Statistics<String> stats = mutator.statistics(); // safe to hand out
 *
 * mutator.recordAccess("home", true);
 * }</pre>
 *
 * <p><b>Thread Safety:</b> Not thread-safe, same as the tracker it writes to.
 *
 * @param <K> key type of the tracker
 * @since 1.0.0
 */
public final class StatisticsMutator<K> {
  private static final Logger logger = LoggerFactory.getLogger(StatisticsMutator.class);

  private final Statistics<K> statistics;

  private StatisticsMutator(Statistics<K> statistics) {
    this.statistics = statistics;
  }

  /**
   * Claims the mutator of an existing tracker.
   *
   * @param statistics the tracker to write to
   * @return the tracker's one and only mutator
   * @throws IllegalStateException if the tracker's mutator was already claimed
   * @throws NullPointerException if statistics is null
   */
  public static <K> StatisticsMutator<K> claim(Statistics<K> statistics) {
    Objects.requireNonNull(statistics, "statistics cannot be null");
    if (!statistics.claimMutator()) {
      throw new IllegalStateException(
          "Statistics mutator already claimed - a tracker can be owned by only one cache");
    }
    logger.trace("LruStats: Mutator claimed - {}", statistics);
    return new StatisticsMutator<>(statistics);
  }

  /** Creates an empty tracker and claims its mutator. */
  public static <K> StatisticsMutator<K> create() {
    return claim(new Statistics<>());
  }

  /**
   * Creates a tracker monitoring the given keys and claims its mutator.
   *
   * @param keys keys to monitor
   */
  @SafeVarargs
  public static <K> StatisticsMutator<K> create(K... keys) {
    return claim(new Statistics<>(keys));
  }

  /**
   * Creates a tracker monitoring the given keys and claims its mutator.
   *
   * @param keys keys to monitor
   */
  public static <K> StatisticsMutator<K> create(Iterable<? extends K> keys) {
    return claim(new Statistics<>(keys));
  }

  /** The tracker this mutator writes to. */
  public Statistics<K> statistics() {
    return statistics;
  }

  /**
   * Records one access.
   *
   * <p>Always counts towards the totals. If the key is monitored its own hit or miss counter is
   * advanced too; otherwise the per-key part is skipped. Never starts monitoring a key.
   *
   * @param key the key that was looked up
   * @param hit whether the lookup found a value
   */
  public void recordAccess(K key, boolean hit) {
    statistics.recordAccess(key, hit);
    if (logger.isTraceEnabled()) {
      logger.trace(
          "LruStats: Recorded {} - key hash: {}, monitored: {}",
          hit ? "hit" : "miss",
          KeyHasher.hash(key),
          statistics.isMonitoring(key));
    }
  }

  /** Shorthand for {@code recordAccess(key, true)}. */
  public void recordHit(K key) {
    recordAccess(key, true);
  }

  /** Shorthand for {@code recordAccess(key, false)}. */
  public void recordMiss(K key) {
    recordAccess(key, false);
  }
}
