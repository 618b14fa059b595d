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

package com.axonops.cucumber.expressions.cache;

import com.axonops.cucumber.expressions.metrics.ExpressionMetricsRegistry;
import com.axonops.cucumber.expressions.metrics.NoOpMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for pattern caching and metrics.
 *
 * <p>Immutable configuration using Java 17 records. Every Cucumber Expression and every raw regular
 * expression ends up as a {@link java.util.regex.Pattern}; the {@link PatternCache} built from this
 * configuration shares those compiled patterns between expressions with the same regex source.
 *
 * <h2>Configuration Examples</h2>
 *
 * <h3>Defaults</h3>
 *
 * <pre>{@code
 * // 10K cached patterns, metrics disabled
 * ExpressionConfig config = ExpressionConfig.DEFAULT;
 * }</pre>
 *
 * <h3>Large Step Library With Metrics</h3>
 *
 * <pre>{@code
 * ExpressionConfig config = ExpressionConfig.builder()
 *     .maxCacheSize(50_000)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.steps"))
 *     .build();
 * CucumberExpressions.setGlobalCache(new PatternCache(config));
 * }</pre>
 *
 * <h3>No Cache</h3>
 *
 * <pre>{@code
 * // Every expression compiles its own Pattern
 * ExpressionConfig config = ExpressionConfig.NO_CACHE;
 * }</pre>
 *
 * @param cacheEnabled Enable pattern caching
 * @param maxCacheSize Maximum patterns in cache before LRU eviction (must be > 0 if cache enabled)
 * @param evictionProtectionMs Protect recently used patterns from eviction for this duration
 * @param metricsRegistry Metrics implementation (use {@link NoOpMetricsRegistry} for zero
 *     overhead)
 * @since 1.0.0
 * @see PatternCache
 * @see com.axonops.cucumber.expressions.metrics.MetricNames
 */
public record ExpressionConfig(
    boolean cacheEnabled,
    int maxCacheSize,
    long evictionProtectionMs,
    ExpressionMetricsRegistry metricsRegistry) {

  /** Default configuration: cache of 10K patterns, 1 second eviction protection, no metrics. */
  public static final ExpressionConfig DEFAULT =
      new ExpressionConfig(
          true, // Cache enabled
          10000, // Max 10K cached patterns
          1000, // 1 second eviction protection
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /** Configuration with caching disabled. */
  public static final ExpressionConfig NO_CACHE =
      new ExpressionConfig(
          false, // Cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /** Compact constructor with validation. */
  public ExpressionConfig {
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");

    if (cacheEnabled) {
      if (maxCacheSize <= 0) {
        throw new IllegalArgumentException("maxCacheSize must be positive when cache enabled");
      }
      if (evictionProtectionMs < 0) {
        throw new IllegalArgumentException(
            "evictionProtectionMs must be non-negative when cache enabled");
      }
    }
  }

  /**
   * Creates a builder starting from {@link #DEFAULT}.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for custom configuration. */
  public static class Builder {
    private boolean cacheEnabled = true;
    private int maxCacheSize = 10000;
    private long evictionProtectionMs = 1000;
    private ExpressionMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Enable or disable pattern caching.
     *
     * @param enabled true to enable caching (default)
     * @return this builder
     */
    public Builder cacheEnabled(boolean enabled) {
      this.cacheEnabled = enabled;
      return this;
    }

    /**
     * Set maximum number of patterns in cache before LRU eviction.
     *
     * <p><b>Default: 10,000</b>
     *
     * @param size maximum cached patterns (must be > 0)
     * @return this builder
     */
    public Builder maxCacheSize(int size) {
      this.maxCacheSize = size;
      return this;
    }

    /**
     * Set how long a recently used pattern is protected from LRU eviction.
     *
     * <p><b>Default: 1000ms</b>
     *
     * @param millis protection window (must be >= 0)
     * @return this builder
     */
    public Builder evictionProtectionMs(long millis) {
      this.evictionProtectionMs = millis;
      return this;
    }

    /**
     * Set the metrics registry.
     *
     * @param registry metrics implementation (must not be null)
     * @return this builder
     */
    public Builder metricsRegistry(ExpressionMetricsRegistry registry) {
      this.metricsRegistry = registry;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return validated configuration
     * @throws IllegalArgumentException if any value is invalid
     */
    public ExpressionConfig build() {
      return new ExpressionConfig(cacheEnabled, maxCacheSize, evictionProtectionMs, metricsRegistry);
    }
  }
}
