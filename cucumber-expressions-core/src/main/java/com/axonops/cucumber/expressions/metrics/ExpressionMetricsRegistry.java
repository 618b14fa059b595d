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

package com.axonops.cucumber.expressions.metrics;

import java.util.function.Supplier;

/**
 * Abstract metrics registry interface for cucumber-expressions-java.
 *
 * <p>Allows the library to work with or without the Dropwizard Metrics dependency.
 * Implementations can use Dropwizard Metrics, custom metrics systems, or no-op.
 *
 * <p><strong>Metric Types:</strong>
 * <ul>
 *   <li><strong>Counter:</strong> Atomic long counter (incrementing values)</li>
 *   <li><strong>Timer:</strong> Measures duration in nanoseconds with histogram</li>
 *   <li><strong>Gauge:</strong> Instantaneous value computed on-demand via supplier</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> All implementations must be thread-safe.
 *
 * @since 1.0.0
 * @see MetricNames
 */
public interface ExpressionMetricsRegistry {

    /**
     * Increment a counter by 1.
     *
     * @param name metric name (e.g., "expressions.compiled.total.count")
     */
    void incrementCounter(String name);

    /**
     * Increment a counter by a specific delta.
     *
     * @param name metric name
     * @param delta amount to increment (must be non-negative)
     */
    void incrementCounter(String name, long delta);

    /**
     * Record a timer measurement in nanoseconds.
     *
     * @param name metric name (e.g., "expressions.compilation.latency")
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Register a gauge that computes its value on-demand.
     *
     * <p>The supplier is called each time the gauge is read and should not block.
     * An existing gauge with the same name is replaced.
     *
     * @param name metric name (e.g., "cache.patterns.current.count")
     * @param valueSupplier function that returns the current value
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Remove a previously registered gauge. No-op if absent.
     *
     * @param name metric name to remove
     */
    void removeGauge(String name);
}
