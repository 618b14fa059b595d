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

package com.axonops.cucumber.expressions.transform;

import com.axonops.cucumber.expressions.api.InvalidPatternException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A named conversion from captured text to a typed value.
 *
 * <p>A transform has one or more names (the first is its type name, the rest are aliases), an
 * ordered list of capture group patterns describing what its text looks like, and a conversion
 * function. The capture group patterns are regex fragments: they become the body of the capture
 * group for a {@code {name:type}} placeholder, and they drive type inference for raw regular
 * expressions. A transform without patterns only converts.
 *
 * <p>Immutable and thread-safe, provided the conversion function is side-effect free.
 *
 * <pre>{@code
 * Transform<Currency> currency = Transform.of(
 *     List.of("currency"),
 *     List.of("[A-Z]{3}"),
 *     Currency::getInstance);
 * }</pre>
 *
 * @param <T> the converted value type
 * @since 1.0.0
 */
public final class Transform<T> {

    private static final Pattern NAME = Pattern.compile("[\\p{L}\\p{N}_]+");

    /**
     * Built-in integer transform, converted with {@link Integer#valueOf(String)}.
     *
     * <p>{@code \d+} is covered by {@code -?\d+} when matching; it is listed so that a raw regex
     * group written as {@code (\d+)} is recognized by its source text.
     */
    public static final Transform<Integer> INT =
        of(List.of("int"), List.of("-?\\d+", "\\d+"), Integer::valueOf);

    /** Built-in float transform: {@code -?\d*\.?\d+}, converted with {@link Float#valueOf(String)}. */
    public static final Transform<Float> FLOAT =
        of(List.of("float"), List.of("-?\\d*\\.?\\d+"), Float::valueOf);

    /** Identity transform, used whenever nothing more specific applies. */
    public static final Transform<String> STRING =
        of(List.of("string"), List.of(), Function.identity());

    private final List<String> names;
    private final List<String> captureGroupPatterns;
    private final List<Pattern> compiledPatterns;
    private final int groupCount;
    private final Function<String, ? extends T> converter;

    private Transform(List<String> names, List<String> captureGroupPatterns,
                      Function<String, ? extends T> converter) {
        if (names.isEmpty()) {
            throw new IllegalArgumentException("Transform needs at least one name");
        }
        for (String name : names) {
            if (name == null || !NAME.matcher(name).matches()) {
                throw new IllegalArgumentException("Invalid transform name: '" + name + "'");
            }
        }
        this.names = List.copyOf(names);
        this.captureGroupPatterns = List.copyOf(captureGroupPatterns);
        this.converter = converter;

        List<Pattern> compiled = new ArrayList<>(captureGroupPatterns.size());
        int groups = 0;
        for (String fragment : this.captureGroupPatterns) {
            try {
                Pattern pattern = Pattern.compile(fragment);
                groups += pattern.matcher("").groupCount();
                compiled.add(pattern);
            } catch (PatternSyntaxException e) {
                throw new InvalidPatternException(fragment, e);
            }
        }
        this.compiledPatterns = Collections.unmodifiableList(compiled);
        this.groupCount = groups;
    }

    /**
     * Creates a transform.
     *
     * @param names type name followed by optional aliases
     * @param captureGroupPatterns regex fragments recognizing this type, may be empty
     * @param converter string to value conversion
     * @param <T> the converted value type
     * @return new transform
     * @throws IllegalArgumentException if there are no names or a name is not an identifier
     * @throws InvalidPatternException if a fragment is not valid regex syntax
     */
    public static <T> Transform<T> of(List<String> names, List<String> captureGroupPatterns,
                                      Function<String, ? extends T> converter) {
        Objects.requireNonNull(names, "names cannot be null");
        Objects.requireNonNull(captureGroupPatterns, "captureGroupPatterns cannot be null");
        Objects.requireNonNull(converter, "converter cannot be null");
        return new Transform<>(names, captureGroupPatterns, converter);
    }

    /**
     * Creates a conversion-only transform with a single name and no capture group patterns.
     */
    public static <T> Transform<T> of(String name, Function<String, ? extends T> converter) {
        return of(List.of(name), List.of(), converter);
    }

    public String getTypeName() {
        return names.get(0);
    }

    public List<String> getNames() {
        return names;
    }

    public List<String> getCaptureGroupPatterns() {
        return captureGroupPatterns;
    }

    /**
     * @return number of capturing groups nested inside the capture group patterns
     */
    public int getGroupCount() {
        return groupCount;
    }

    /**
     * Tests whether a whole sample is matched by one of the capture group patterns.
     *
     * @param sample captured text
     * @return true if some pattern matches the entire sample
     */
    public boolean recognizes(String sample) {
        for (Pattern pattern : compiledPatterns) {
            if (pattern.matcher(sample).matches()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Converts captured text. Exceptions thrown by the converter propagate unchanged.
     *
     * @param value captured text, never null
     * @return converted value
     */
    public T transform(String value) {
        return converter.apply(value);
    }

    @Override
    public String toString() {
        return "Transform" + names + captureGroupPatterns;
    }
}
