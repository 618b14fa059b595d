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

/**
 * Metric name constants for expression compilation, caching and matching.
 *
 * <h2>Metric Categories</h2>
 *
 * <ul>
 *   <li><b>Expression Compilation</b> - Cucumber Expression grammar compilation and failures
 *   <li><b>Pattern Cache</b> - Compiled {@link java.util.regex.Pattern} reuse and eviction
 *   <li><b>Matching</b> - Match attempts, outcomes and latency
 *   <li><b>Errors</b> - Failed conversions of captured values
 * </ul>
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current value (suffix: {@code .current.count})
 * </ul>
 *
 * <p>With {@link DropwizardMetricsAdapter} every name is prefixed, e.g. {@code
 * myapp.steps.matching.operations.total.count}.
 *
 * @since 1.0.0
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Expression Compilation
  // ========================================

  /**
   * Cucumber Expressions compiled successfully.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String EXPRESSIONS_COMPILED = "expressions.compiled.total.count";

  /**
   * Grammar compilation latency (expression text to regex, including pattern lookup).
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String EXPRESSIONS_COMPILATION_LATENCY = "expressions.compilation.latency";

  /**
   * Expressions rejected because of malformed syntax.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_MALFORMED_EXPRESSION = "errors.malformed_expression.total.count";

  /**
   * Expressions rejected because a type hint named no registered transform.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_UNKNOWN_TYPE = "errors.unknown_type.total.count";

  /**
   * Raw regular expressions rejected by {@link java.util.regex.Pattern#compile(String)}.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_INVALID_PATTERN = "errors.invalid_pattern.total.count";

  // ========================================
  // Pattern Cache
  // ========================================

  /**
   * Regex sources compiled into {@link java.util.regex.Pattern} (cache misses).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String PATTERNS_COMPILED = "patterns.compiled.total.count";

  /**
   * Pattern lookups served from cache.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String PATTERNS_CACHE_HITS = "patterns.cache.hits.total.count";

  /**
   * Pattern lookups that required compilation.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String PATTERNS_CACHE_MISSES = "patterns.cache.misses.total.count";

  /**
   * Patterns evicted because the cache exceeded its maximum size.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String CACHE_EVICTIONS_LRU = "cache.evictions.lru.total.count";

  /**
   * Patterns currently held by the cache.
   *
   * <p><b>Type:</b> Gauge (count)
   */
  public static final String CACHE_PATTERNS_COUNT = "cache.patterns.current.count";

  // ========================================
  // Matching
  // ========================================

  /**
   * Match attempts, both Cucumber Expression and regular expression.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_OPERATIONS = "matching.operations.total.count";

  /**
   * Match attempts that produced arguments.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_MATCHED = "matching.matched.total.count";

  /**
   * Match attempts that returned no match.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_NO_MATCH = "matching.no_match.total.count";

  /**
   * Latency of a single match attempt, excluding lazy value transformation.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHING_LATENCY = "matching.latency";

  // ========================================
  // Errors
  // ========================================

  /**
   * Captured values a transform failed to convert.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_TRANSFORMATION = "errors.transformation.total.count";
}
