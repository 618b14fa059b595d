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

package com.axonops.cucumber.expressions.api;

import com.axonops.cucumber.expressions.cache.CacheStatistics;
import com.axonops.cucumber.expressions.cache.ExpressionConfig;
import com.axonops.cucumber.expressions.cache.PatternCache;
import com.axonops.cucumber.expressions.transform.TransformRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Main entry point for expression compilation and matching.
 *
 * <p>Holds the global {@link PatternCache} used by expressions created without an explicit cache.
 * Transform registries are never global: every call takes one.
 *
 * <p>Thread-safe: All methods can be called concurrently from multiple threads.
 *
 * @since 1.0.0
 */
public final class CucumberExpressions {

    private static volatile PatternCache cache = new PatternCache(ExpressionConfig.DEFAULT);

    private CucumberExpressions() {
        // Utility class
    }

    /**
     * Compiles a Cucumber Expression.
     *
     * @param expression Cucumber Expression text
     * @param registry transforms for placeholder types
     * @return compiled expression
     */
    public static CucumberExpression compile(String expression, TransformRegistry registry) {
        return new CucumberExpression(expression, registry);
    }

    /**
     * Compiles a raw regular expression.
     *
     * @param pattern regex source
     * @param registry transforms for inference
     * @return compiled expression
     */
    public static RegularExpression regex(String pattern, TransformRegistry registry) {
        return new RegularExpression(pattern, registry);
    }

    /**
     * Compiles and matches a Cucumber Expression in one step.
     *
     * @param expression Cucumber Expression text
     * @param text text to match
     * @param registry transforms for placeholder types
     * @return arguments, or null if the text does not match
     */
    public static List<Argument> match(String expression, String text, TransformRegistry registry) {
        return compile(expression, registry).match(text);
    }

    // ========== Global Cache ==========

    public static PatternCache getGlobalCache() {
        return cache;
    }

    /**
     * Replaces the global pattern cache. Existing expressions keep their compiled patterns.
     *
     * @param newCache cache to use for expressions created from now on
     */
    public static void setGlobalCache(PatternCache newCache) {
        cache = Objects.requireNonNull(newCache, "cache cannot be null");
    }

    /**
     * Replaces the global cache with a new one built from {@code config}.
     *
     * @param config cache configuration
     */
    public static void configure(ExpressionConfig config) {
        setGlobalCache(new PatternCache(config));
    }

    /** Clears the global cache and its statistics. */
    public static void resetCache() {
        cache.reset();
    }

    public static CacheStatistics getCacheStatistics() {
        return cache.getStatistics();
    }
}
