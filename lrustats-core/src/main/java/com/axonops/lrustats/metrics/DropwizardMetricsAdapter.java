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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Dropwizard Metrics adapter for lrustats.
 *
 * <p>Wraps a Dropwizard {@link MetricRegistry} and delegates all metric operations to it, so cache
 * statistics show up wherever the application already publishes its Dropwizard metrics.
 *
 * <p><strong>Thread Safety:</strong> MetricRegistry and all Dropwizard metric types are
 * thread-safe, and so is this adapter.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * StatsMetricsRegistry metrics = new DropwizardMetricsAdapter(registry, "com.myapp");
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements StatsMetricsRegistry {

    /** Metric prefix used when none is given. */
    public static final String DEFAULT_PREFIX = "com.axonops.lrustats";

    private final MetricRegistry registry;
    private final String prefix;

    /**
     * Creates adapter with default metric prefix: {@code com.axonops.lrustats}
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @throws NullPointerException if registry is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates adapter with custom metric prefix.
     *
     * <p>With prefix {@code "com.myapp"} the hit counter of a cache named {@code sessions}
     * appears as {@code com.myapp.sessions.cache.hits.total.count}.
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @param prefix the metric name prefix
     * @throws NullPointerException if registry or prefix is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(metricName(name)).inc();
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(metricName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Delegates to {@link MetricRegistry#register}, which rejects a name that is already in
     * use, so two caches can never silently share a gauge.
     */
    @Override
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
        registry.register(metricName(name), (Gauge<Number>) valueSupplier::get);
    }

    @Override
    public void removeGauge(String name) {
        registry.remove(metricName(name));
    }

    /** The prefix all metric names are registered under. */
    public String prefix() {
        return prefix;
    }

    private String metricName(String name) {
        return MetricRegistry.name(prefix, name);
    }
}
