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

import java.util.function.Supplier;

/**
 * Abstract metrics registry interface for lrustats.
 *
 * <p>Allows the library to work with or without the Dropwizard Metrics dependency.
 * Implementations can use Dropwizard Metrics, a custom metrics system, or no-op.
 *
 * <p><strong>Metric Types (following Dropwizard patterns):</strong>
 * <ul>
 *   <li><strong>Counter:</strong> Monotonically increasing count</li>
 *   <li><strong>Timer:</strong> Duration in nanoseconds with histogram</li>
 *   <li><strong>Gauge:</strong> Instantaneous value computed on-demand via supplier</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> All implementations must be thread-safe.
 *
 * @since 1.0.0
 */
public interface StatsMetricsRegistry {

    /**
     * Increment a counter by 1.
     *
     * @param name metric name (e.g., "cache.hits.total.count")
     */
    void incrementCounter(String name);

    /**
     * Record a timer measurement in nanoseconds.
     *
     * @param name metric name (e.g., "cache.loads.latency")
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Register a gauge that computes its value on-demand.
     *
     * <p>The supplier is called each time the gauge is read (e.g., via JMX) and should not block.
     * A name belongs to one owner: registering a name that is already taken fails instead of
     * replacing the existing gauge.
     *
     * @param name metric name (e.g., "sessions.statistics.hit_rate")
     * @param valueSupplier function that returns the current value
     * @throws IllegalArgumentException if a metric with this name is already registered
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Remove a previously registered gauge. No-op if no gauge exists with this name.
     *
     * @param name metric name to remove
     */
    void removeGauge(String name);
}
