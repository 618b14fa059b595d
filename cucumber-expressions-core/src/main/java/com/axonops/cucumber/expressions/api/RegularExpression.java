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

import com.axonops.cucumber.expressions.cache.PatternCache;
import com.axonops.cucumber.expressions.compiler.CaptureGroup;
import com.axonops.cucumber.expressions.compiler.GroupScanner;
import com.axonops.cucumber.expressions.metrics.ExpressionMetricsRegistry;
import com.axonops.cucumber.expressions.metrics.MetricNames;
import com.axonops.cucumber.expressions.transform.Transform;
import com.axonops.cucumber.expressions.transform.TransformRegistry;
import com.axonops.cucumber.expressions.util.ExpressionHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A raw regular expression whose capture groups become typed arguments.
 *
 * <p>No anchoring is added: the pattern is searched for in the text exactly as written, so use
 * {@code ^} and {@code $} for a whole-text match.
 *
 * <p>Each capture group becomes one argument. Its transform is, in order: the built-in {@code int}
 * or {@code float} when the group's body is one of their patterns or the captured text looks like
 * a number; the registered transform declaring the group's body as a capture group pattern; the
 * first transform whose patterns match the captured text; the string transform. Named groups give
 * their name to the argument, other groups are named {@code arg1}, {@code arg2}, ...
 *
 * <p>Thread-safe: immutable after construction.
 *
 * @since 1.0.0
 */
public final class RegularExpression implements Expression {
    private static final Logger logger = LoggerFactory.getLogger(RegularExpression.class);

    private static final List<Transform<?>> NUMERIC = List.of(Transform.INT, Transform.FLOAT);

    private final Pattern regex;
    private final List<CaptureGroup> groups;
    private final TransformRegistry registry;
    private final ExpressionMetricsRegistry metrics;

    /**
     * Compiles a raw pattern using the global pattern cache.
     *
     * @param pattern regex source
     * @param registry transforms for inference
     * @throws InvalidPatternException if the pattern does not compile
     */
    public RegularExpression(String pattern, TransformRegistry registry) {
        this(pattern, registry, CucumberExpressions.getGlobalCache());
    }

    /**
     * Compiles a raw pattern using the given pattern cache.
     */
    public RegularExpression(String pattern, TransformRegistry registry, PatternCache cache) {
        this(Objects.requireNonNull(cache, "cache cannot be null")
                .getOrCompile(Objects.requireNonNull(pattern, "pattern cannot be null")),
            registry, cache.getConfig().metricsRegistry());
    }

    /**
     * Wraps an already compiled pattern. Flags on the pattern are kept.
     *
     * @param pattern compiled pattern
     * @param registry transforms for inference
     */
    public RegularExpression(Pattern pattern, TransformRegistry registry) {
        this(pattern, registry, CucumberExpressions.getGlobalCache().getConfig().metricsRegistry());
    }

    private RegularExpression(Pattern pattern, TransformRegistry registry, ExpressionMetricsRegistry metrics) {
        this.regex = Objects.requireNonNull(pattern, "pattern cannot be null");
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.metrics = metrics;
        this.groups = scanGroups(pattern);
    }

    private static List<CaptureGroup> scanGroups(Pattern pattern) {
        int groupCount = pattern.matcher("").groupCount();
        List<CaptureGroup> scanned = GroupScanner.scan(pattern.pattern());
        if (scanned.size() == groupCount) {
            return List.copyOf(scanned);
        }

        logger.debug("Group scan mismatch - hash: {}, scanned: {}, compiled: {}; using positional groups",
            ExpressionHasher.hashWithKind(pattern.pattern(), true), scanned.size(), groupCount);
        List<CaptureGroup> positional = new ArrayList<>(groupCount);
        for (int i = 1; i <= groupCount; i++) {
            positional.add(new CaptureGroup(i, null, null));
        }
        return List.copyOf(positional);
    }

    @Override
    public List<Argument> match(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        long startNanos = System.nanoTime();

        Matcher matcher = regex.matcher(text);
        boolean matched = matcher.find();

        List<Argument> arguments = null;
        if (matched) {
            arguments = new ArrayList<>(groups.size());
            for (CaptureGroup group : groups) {
                String raw = matcher.group(group.index());
                String name = group.name() != null ? group.name() : "arg" + group.index();
                arguments.add(new Argument(
                    name,
                    group.index() - 1,
                    raw,
                    matcher.start(group.index()),
                    resolveTransform(group, raw),
                    metrics));
            }
        }

        metrics.recordTimer(MetricNames.MATCHING_LATENCY, System.nanoTime() - startNanos);
        metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS);
        metrics.incrementCounter(matched ? MetricNames.MATCHING_MATCHED : MetricNames.MATCHING_NO_MATCH);
        return arguments;
    }

    private Transform<?> resolveTransform(CaptureGroup group, String raw) {
        // Numbers stay numbers, whatever else is registered
        for (Transform<?> numeric : NUMERIC) {
            if (group.source() != null && numeric.getCaptureGroupPatterns().contains(group.source())) {
                return numeric;
            }
        }
        for (Transform<?> numeric : NUMERIC) {
            if (raw != null && numeric.recognizes(raw)) {
                return numeric;
            }
        }

        Transform<?> declared = registry.lookupByCaptureGroupPattern(group.source());
        if (declared != null) {
            return declared;
        }
        return raw != null ? registry.inferFromSample(raw) : Transform.STRING;
    }

    /**
     * @return capture groups in group number order
     */
    public List<CaptureGroup> getCaptureGroups() {
        return groups;
    }

    @Override
    public String getSource() {
        return regex.pattern();
    }

    @Override
    public Pattern getRegex() {
        return regex;
    }

    @Override
    public String toString() {
        return "RegularExpression{/" + regex.pattern() + "/}";
    }
}
