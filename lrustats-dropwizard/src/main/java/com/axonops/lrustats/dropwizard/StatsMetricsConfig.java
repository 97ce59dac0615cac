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

package com.axonops.lrustats.dropwizard;

import com.axonops.lrustats.cache.CacheConfig;
import com.axonops.lrustats.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Convenience factory for CacheConfig with Dropwizard Metrics integration.
 *
 * <p>Sets up a {@link DropwizardMetricsAdapter} and, optionally, a {@link JmxReporter} so cache
 * hit/miss statistics are visible over JMX.
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * // Application registry, custom prefix:
 * CacheConfig config = StatsMetricsConfig.withMetrics(registry, "com.myapp");
 * Statistics<String> tracked = new Statistics<>("admin");
 * LruCache<String, Session> sessions = new LruCache<>("sessions", config, tracked);
 * LruCache<String, Page> pages = new LruCache<>("pages", config);
 *
 * // Larger cache, no JMX:
 * CacheConfig config = StatsMetricsConfig.withMetrics(registry, "com.myapp", false, 50_000);
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> Each distinct registry gets one JmxReporter, started the first
 * time it is passed with JMX enabled. Registries are matched by identity.
 *
 * @since 1.0.0
 */
public final class StatsMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(StatsMetricsConfig.class);

    // Guarded by StatsMetricsConfig.class
    private static final Map<MetricRegistry, JmxReporter> jmxReporters = new IdentityHashMap<>();

    private StatsMetricsConfig() {
        // Utility class
    }

    /**
     * Creates CacheConfig with Dropwizard Metrics integration and automatic JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configured CacheConfig with metrics enabled
     */
    public static CacheConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates CacheConfig with Dropwizard Metrics integration and the default cache size.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to expose the registry over JMX
     * @return configured CacheConfig with metrics enabled
     */
    public static CacheConfig withMetrics(
            MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return withMetrics(registry, metricPrefix, enableJmx, CacheConfig.DEFAULT_MAX_CACHE_SIZE);
    }

    /**
     * Creates CacheConfig with Dropwizard Metrics integration.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to expose the registry over JMX
     * @param maxCacheSize maximum cache entries
     * @return configured CacheConfig with metrics enabled
     * @throws IllegalArgumentException if maxCacheSize is not positive
     */
    public static CacheConfig withMetrics(
            MetricRegistry registry, String metricPrefix, boolean enableJmx, int maxCacheSize) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        CacheConfig config = CacheConfig.builder()
            .maxCacheSize(maxCacheSize)
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();

        if (enableJmx) {
            ensureJmxReporter(registry);
        }
        return config;
    }

    /**
     * Creates CacheConfig with Dropwizard Metrics using the default prefix
     * {@code "com.axonops.lrustats"}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return configured CacheConfig with metrics enabled
     */
    public static CacheConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Starts a JmxReporter for the registry unless one is already running for it.
     *
     * @param registry the MetricRegistry to expose via JMX
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporters.containsKey(registry)) {
            return;
        }
        try {
            JmxReporter reporter = JmxReporter.forRegistry(registry).build();
            reporter.start();
            jmxReporters.put(registry, reporter);
            logger.info(
                "LruStats: JmxReporter started - {} registr{} exposed via JMX",
                jmxReporters.size(),
                jmxReporters.size() == 1 ? "y" : "ies");
        } catch (RuntimeException e) {
            // Not fatal - the registry may already be exposed by the application
            logger.warn("LruStats: Failed to start JmxReporter (may already be configured)", e);
        }
    }

    /** Whether this class has started a JmxReporter for the registry. */
    static synchronized boolean isJmxReporterRunning(MetricRegistry registry) {
        return jmxReporters.containsKey(registry);
    }

    /** Stops every JmxReporter started by this class. */
    public static synchronized void shutdown() {
        if (!jmxReporters.isEmpty()) {
            logger.info("LruStats: Stopping {} JmxReporter(s)", jmxReporters.size());
            jmxReporters.values().forEach(JmxReporter::stop);
            jmxReporters.clear();
        }
    }
}
