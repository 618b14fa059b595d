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
import com.axonops.cucumber.expressions.compiler.CompiledExpression;
import com.axonops.cucumber.expressions.compiler.ExpressionCompiler;
import com.axonops.cucumber.expressions.compiler.Placeholder;
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
 * An expression written in Cucumber Expression syntax.
 *
 * <p>Syntax summary:
 * <pre>
 * I have {n:int} cuke(s) in my \(small\) belly
 *        ^^^^^^^     ^^^       ^^      ^^
 *        typed       optional  escaped literal parentheses
 *        placeholder group
 * </pre>
 *
 * <p>The expression must match the whole text. Placeholder values are converted by the transform
 * named by their type; an untyped placeholder uses the transform registered under its own name, or
 * is left as a string when there is none.
 *
 * <p>Thread-safe: compiled once at construction, immutable afterwards.
 *
 * <pre>{@code
 * TransformRegistry registry = new TransformRegistry();
 * CucumberExpression expression = new CucumberExpression("I have {n:int} cukes", registry);
 *
 * List<Argument> args = expression.match("I have 42 cukes");
 * int n = args.get(0).getTransformedValue(Integer.class);  // 42
 * }</pre>
 *
 * @since 1.0.0
 */
public final class CucumberExpression implements Expression {
    private static final Logger logger = LoggerFactory.getLogger(CucumberExpression.class);

    private final CompiledExpression compiled;
    private final TransformRegistry registry;
    private final PatternCache cache;
    private final Pattern regex;

    /**
     * Compiles an expression using the global pattern cache.
     *
     * @param expression Cucumber Expression text
     * @param registry transforms for placeholder types
     * @throws MalformedExpressionException if the text is not valid syntax
     * @throws UnknownTypeException if an inline type is not registered
     */
    public CucumberExpression(String expression, TransformRegistry registry) {
        this(expression, List.of(), registry);
    }

    /**
     * Compiles an expression with positional type hints using the global pattern cache.
     *
     * @param expression Cucumber Expression text
     * @param typeHints type per placeholder position, used where no inline type is given; may
     *     contain nulls and may be shorter or longer than the number of placeholders
     * @param registry transforms for placeholder types
     * @throws MalformedExpressionException if the text is not valid syntax
     * @throws UnknownTypeException if an inline type or type hint is not registered
     */
    public CucumberExpression(String expression, List<String> typeHints, TransformRegistry registry) {
        this(expression, typeHints, registry, CucumberExpressions.getGlobalCache());
    }

    /**
     * Compiles an expression using the given pattern cache.
     */
    public CucumberExpression(String expression, List<String> typeHints, TransformRegistry registry,
                              PatternCache cache) {
        Objects.requireNonNull(expression, "expression cannot be null");
        Objects.requireNonNull(typeHints, "typeHints cannot be null");
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");

        ExpressionMetricsRegistry metrics = cache.getConfig().metricsRegistry();
        String hash = ExpressionHasher.hashWithKind(expression, false);
        long startNanos = System.nanoTime();

        try {
            this.compiled = ExpressionCompiler.compile(expression, typeHints, registry);
        } catch (MalformedExpressionException e) {
            metrics.incrementCounter(MetricNames.ERRORS_MALFORMED_EXPRESSION);
            logger.debug("Expression compilation failed - hash: {}, error: {}", hash, e.getMessage());
            throw e;
        } catch (UnknownTypeException e) {
            metrics.incrementCounter(MetricNames.ERRORS_UNKNOWN_TYPE);
            logger.debug("Expression compilation failed - hash: {}, unknown type: {}", hash, e.getTypeName());
            throw e;
        }
        this.regex = cache.getOrCompile(compiled.regex());

        long durationNanos = System.nanoTime() - startNanos;
        metrics.recordTimer(MetricNames.EXPRESSIONS_COMPILATION_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.EXPRESSIONS_COMPILED);
        logger.trace("Expression compiled - hash: {}, placeholders: {}, timeNs: {}",
            hash, compiled.placeholders().size(), durationNanos);
    }

    @Override
    public List<Argument> match(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        ExpressionMetricsRegistry metrics = cache.getConfig().metricsRegistry();
        long startNanos = System.nanoTime();

        Matcher matcher = regex.matcher(text);
        boolean matched = matcher.matches();

        List<Argument> arguments = null;
        if (matched) {
            List<Placeholder> placeholders = compiled.placeholders();
            arguments = new ArrayList<>(placeholders.size());
            for (Placeholder placeholder : placeholders) {
                Transform<?> transform = placeholder.hasType()
                    ? registry.resolveByType(placeholder.type())
                    : registry.resolveByArgumentName(placeholder.name());
                arguments.add(new Argument(
                    placeholder.name(),
                    placeholder.ordinal(),
                    matcher.group(placeholder.group()),
                    matcher.start(placeholder.group()),
                    transform,
                    metrics));
            }
        }

        metrics.recordTimer(MetricNames.MATCHING_LATENCY, System.nanoTime() - startNanos);
        metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS);
        metrics.incrementCounter(matched ? MetricNames.MATCHING_MATCHED : MetricNames.MATCHING_NO_MATCH);
        return arguments;
    }

    /**
     * @return argument slots in declaration order
     */
    public List<Placeholder> getPlaceholders() {
        return compiled.placeholders();
    }

    public CompiledExpression getCompiledExpression() {
        return compiled;
    }

    @Override
    public String getSource() {
        return compiled.expression();
    }

    @Override
    public Pattern getRegex() {
        return regex;
    }

    @Override
    public String toString() {
        return "CucumberExpression{" + compiled.expression() + "}";
    }
}
