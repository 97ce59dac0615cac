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

import com.axonops.lrustats.metrics.NoOpMetricsRegistry;
import com.axonops.lrustats.metrics.StatsMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for {@link LruCache}: capacity and metrics integration.
 *
 * <p>Immutable configuration using Java 17 records.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults (10K entries, metrics disabled)
 * LruCache<String, Session> cache = new LruCache<>("sessions", CacheConfig.DEFAULT);
 *
 * // Smaller cache reporting to Dropwizard
 * CacheConfig config = CacheConfig.builder()
 *     .maxCacheSize(500)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp"))
 *     .build();
 * }</pre>
 *
 * <h2>Tuning Recommendations</h2>
 *
 * <ul>
 *   <li>Size the cache from the working set; watch {@code statistics.hit_rate} to tune
 *   <li>Monitor only the keys you need per-key numbers for: every monitored key costs one map entry
 *       in the tracker, whether or not it is currently cached
 * </ul>
 *
 * @param maxCacheSize Maximum entries before the least recently used one is evicted (must be > 0)
 * @param metricsRegistry Metrics implementation (use {@link NoOpMetricsRegistry} for zero
 *     overhead)
 * @since 1.0.0
 * @see LruCache
 * @see com.axonops.lrustats.metrics.MetricNames
 */
public record CacheConfig(int maxCacheSize, StatsMetricsRegistry metricsRegistry) {

  /** Default maximum cache size. */
  public static final int DEFAULT_MAX_CACHE_SIZE = 10_000;

  /** Default configuration: 10K entries, metrics disabled (NoOp). */
  public static final CacheConfig DEFAULT =
      new CacheConfig(DEFAULT_MAX_CACHE_SIZE, NoOpMetricsRegistry.INSTANCE);

  /** Compact constructor with validation. */
  public CacheConfig {
    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be positive");
    }
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
  }

  /**
   * Creates a builder starting from the defaults.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for custom cache configuration. All fields start with the {@link #DEFAULT} values. */
  public static class Builder {
    private int maxCacheSize = DEFAULT_MAX_CACHE_SIZE;
    private StatsMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Set maximum number of entries before LRU eviction.
     *
     * <p><b>Default: 10,000</b>
     *
     * @param size maximum cached entries (must be > 0)
     * @return this builder
     */
    public Builder maxCacheSize(int size) {
      this.maxCacheSize = size;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * <p><b>Default: {@link NoOpMetricsRegistry}</b>
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(StatsMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated immutable configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public CacheConfig build() {
      return new CacheConfig(maxCacheSize, metricsRegistry);
    }
  }
}
