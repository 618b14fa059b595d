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

package com.axonops.cucumber.expressions.dropwizard;

import com.axonops.cucumber.expressions.cache.ExpressionConfig;
import com.axonops.cucumber.expressions.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for {@link ExpressionConfig} with Dropwizard Metrics integration.
 *
 * <p>Sets up a {@link DropwizardMetricsAdapter} and, optionally, a {@link JmxReporter} so that
 * compilation, cache and matching metrics are visible over JMX.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * CucumberExpressions.configure(ExpressionMetricsConfig.withMetrics(registry, "com.myapp.steps"));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ExpressionMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(ExpressionMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private ExpressionMetricsConfig() {
        // Utility class
    }

    /**
     * Creates a configuration with Dropwizard Metrics and JMX exposure.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configuration with metrics enabled
     */
    public static ExpressionConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates a configuration with Dropwizard Metrics.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to start a JmxReporter for the registry
     * @return configuration with metrics enabled
     */
    public static ExpressionConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return ExpressionConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();
    }

    /**
     * Creates a configuration with Dropwizard Metrics using the default prefix
     * {@value DropwizardMetricsAdapter#DEFAULT_PREFIX}, with JMX exposure.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return configuration with metrics enabled
     */
    public static ExpressionConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * @return true if a JmxReporter has been started and not yet shut down
     */
    public static boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                JmxReporter reporter = JmxReporter.forRegistry(registry).build();
                reporter.start();
                jmxReporter = reporter;
                logger.info("JmxReporter started - expression metrics available via JMX");
            } catch (RuntimeException e) {
                // Registry may already be exposed by the host application
                logger.warn("Failed to start JmxReporter", e);
            }
        }
    }

    /** Stops the JmxReporter if one was started. */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
