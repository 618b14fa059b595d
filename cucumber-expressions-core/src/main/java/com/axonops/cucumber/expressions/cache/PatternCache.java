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

import com.axonops.cucumber.expressions.api.InvalidPatternException;
import com.axonops.cucumber.expressions.metrics.ExpressionMetricsRegistry;
import com.axonops.cucumber.expressions.metrics.MetricNames;
import com.axonops.cucumber.expressions.util.ExpressionHasher;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe cache of compiled {@link Pattern} instances keyed by regex source.
 *
 * <p>Cucumber Expressions that compile to the same regex, and raw regular expressions with the same
 * source, share one {@link Pattern}. {@link Pattern} is immutable, so a cached instance can be
 * handed to any number of threads.
 *
 * <p>Eviction: sample-based LRU once the cache exceeds {@code maxCacheSize}. Patterns used within
 * {@code evictionProtectionMs} are never evicted, so the cache may briefly stay above its limit.
 *
 * @since 1.0.0
 */
public final class PatternCache {
  private static final Logger logger = LoggerFactory.getLogger(PatternCache.class);

  private static final int EVICTION_SAMPLE_SIZE = 500;

  private final ExpressionConfig config;
  private final ConcurrentHashMap<String, CachedPattern> cache;

  private final AtomicLong hits = new AtomicLong(0);
  private final AtomicLong misses = new AtomicLong(0);
  private final AtomicLong evictionsLRU = new AtomicLong(0);

  /**
   * Creates a new pattern cache with the given configuration.
   *
   * @param config the cache configuration
   */
  public PatternCache(ExpressionConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");

    if (config.cacheEnabled()) {
      this.cache = new ConcurrentHashMap<>();
      config.metricsRegistry().registerGauge(MetricNames.CACHE_PATTERNS_COUNT, cache::size);
      logger.debug(
          "Pattern cache initialized - maxSize: {}, evictionProtection: {}ms",
          config.maxCacheSize(),
          config.evictionProtectionMs());
    } else {
      this.cache = null;
      logger.info("Pattern caching disabled");
    }
  }

  public ExpressionConfig getConfig() {
    return config;
  }

  /**
   * Gets a cached pattern or compiles it.
   *
   * <p>Lock-free for cache hits. Uses computeIfAbsent so each source is compiled at most once while
   * it stays cached.
   *
   * @param regex regex source
   * @return cached or newly compiled pattern
   * @throws InvalidPatternException if the source is not valid regex syntax
   */
  public Pattern getOrCompile(String regex) {
    Objects.requireNonNull(regex, "regex cannot be null");
    ExpressionMetricsRegistry metrics = config.metricsRegistry();

    if (!config.cacheEnabled()) {
      misses.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
      return compile(regex);
    }

    CachedPattern cached = cache.get(regex);
    if (cached != null) {
      cached.touch();
      hits.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_HITS);
      logger.trace("Cache hit - hash: {}", ExpressionHasher.hash(regex));
      return cached.pattern();
    }

    misses.incrementAndGet();
    metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
    logger.trace("Cache miss - hash: {}, compiling", ExpressionHasher.hash(regex));

    CachedPattern created = cache.computeIfAbsent(regex, k -> new CachedPattern(compile(k)));

    // Soft limit
    int currentSize = cache.size();
    if (currentSize > config.maxCacheSize()) {
      evictLRUBatch(currentSize - config.maxCacheSize());
    }

    return created.pattern();
  }

  private Pattern compile(String regex) {
    try {
      Pattern pattern = Pattern.compile(regex);
      config.metricsRegistry().incrementCounter(MetricNames.PATTERNS_COMPILED);
      return pattern;
    } catch (PatternSyntaxException e) {
      config.metricsRegistry().incrementCounter(MetricNames.ERRORS_INVALID_PATTERN);
      logger.debug(
          "Pattern compilation failed - hash: {}, error: {}",
          ExpressionHasher.hash(regex),
          e.getDescription());
      throw new InvalidPatternException(regex, e);
    }
  }

  /**
   * Evicts least-recently-used patterns.
   *
   * <p>Samples a subset of the cache and evicts the oldest entries, skipping anything accessed
   * within the protection window.
   */
  private void evictLRUBatch(int toEvict) {
    long cutoffTime = System.nanoTime() - config.evictionProtectionMs() * 1_000_000L;

    List<Map.Entry<String, CachedPattern>> candidates =
        cache.entrySet().stream()
            .filter(e -> e.getValue().lastAccessTimeNanos() <= cutoffTime)
            .limit(EVICTION_SAMPLE_SIZE)
            .sorted(Comparator.comparingLong(e -> e.getValue().lastAccessTimeNanos()))
            .limit(toEvict)
            .collect(Collectors.toList());

    int evicted = 0;
    for (Map.Entry<String, CachedPattern> entry : candidates) {
      if (cache.remove(entry.getKey(), entry.getValue())) {
        evictionsLRU.incrementAndGet();
        config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_LRU);
        evicted++;
      }
    }

    if (evicted > 0) {
      logger.debug(
          "LRU eviction completed - evicted: {}, cacheSize: {}/{}",
          evicted,
          cache.size(),
          config.maxCacheSize());
    }
  }

  /**
   * Checks whether a regex source is currently cached.
   *
   * @param regex regex source
   * @return true if cached
   */
  public boolean contains(String regex) {
    return cache != null && cache.containsKey(regex);
  }

  /**
   * Gets a snapshot of the cache statistics.
   *
   * @return current statistics
   */
  public CacheStatistics getStatistics() {
    return new CacheStatistics(
        hits.get(),
        misses.get(),
        evictionsLRU.get(),
        cache != null ? cache.size() : 0,
        config.cacheEnabled() ? config.maxCacheSize() : 0);
  }

  /** Removes every cached pattern. Statistics are kept. */
  public void clear() {
    if (cache != null) {
      int size = cache.size();
      cache.clear();
      logger.debug("Pattern cache cleared - removed: {}", size);
    }
  }

  /** Removes every cached pattern and zeroes the statistics. */
  public void reset() {
    clear();
    hits.set(0);
    misses.set(0);
    evictionsLRU.set(0);
  }

  private static final class CachedPattern {
    private final Pattern pattern;
    private final AtomicLong lastAccessTimeNanos;

    CachedPattern(Pattern pattern) {
      this.pattern = pattern;
      this.lastAccessTimeNanos = new AtomicLong(System.nanoTime());
    }

    Pattern pattern() {
      return pattern;
    }

    void touch() {
      lastAccessTimeNanos.set(System.nanoTime());
    }

    long lastAccessTimeNanos() {
      return lastAccessTimeNanos.get();
    }
  }
}
