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

import com.axonops.cucumber.expressions.api.UnknownTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Registry of transforms, looked up by type name, argument name, capture group pattern or sample.
 *
 * <p>The built-in {@code int}, {@code float} and {@code string} transforms are always present.
 * Registering a transform under an existing name replaces the previous binding silently (last
 * registration wins), including for built-in names.
 *
 * <p>Thread-safe: lookups are lock-free and never observe a partially applied registration.
 * Registrations are serialized. Lookups that race with a registration may see either the old or
 * the new binding, so finish registering before sharing a registry if that matters.
 *
 * <p>Registries are explicit objects passed to each expression; there is no global registry.
 *
 * @since 1.0.0
 */
public final class TransformRegistry {
    private static final Logger logger = LoggerFactory.getLogger(TransformRegistry.class);

    private static final List<Transform<?>> BUILT_INS = List.of(Transform.INT, Transform.FLOAT, Transform.STRING);

    private final Map<String, Transform<?>> byName = new ConcurrentHashMap<>();

    // User transforms in registration order, consulted before built-ins during inference
    private final List<Transform<?>> custom = new CopyOnWriteArrayList<>();

    public TransformRegistry() {
        for (Transform<?> builtIn : BUILT_INS) {
            for (String name : builtIn.getNames()) {
                byName.put(name, builtIn);
            }
        }
    }

    /**
     * Registers a transform under each of its names.
     *
     * @param transform transform to register
     * @return this registry
     */
    public synchronized TransformRegistry register(Transform<?> transform) {
        Objects.requireNonNull(transform, "transform cannot be null");

        for (String name : transform.getNames()) {
            Transform<?> previous = byName.put(name, transform);
            if (previous != null && previous != transform) {
                logger.debug("Transform '{}' replaced by {}", name, transform);
            }
        }

        custom.remove(transform);
        custom.add(transform);

        // Transforms no longer reachable by any name drop out of inference
        custom.removeIf(t -> t.getNames().stream().noneMatch(n -> byName.get(n) == t));

        logger.trace("Transform registered: {}", transform);
        return this;
    }

    /**
     * Creates and registers a transform.
     *
     * @param names type name followed by optional aliases
     * @param captureGroupPatterns regex fragments recognizing the type
     * @param converter string to value conversion
     * @param <T> the converted value type
     * @return the registered transform
     */
    public <T> Transform<T> register(List<String> names, List<String> captureGroupPatterns,
                                     Function<String, ? extends T> converter) {
        Transform<T> transform = Transform.of(names, captureGroupPatterns, converter);
        register(transform);
        return transform;
    }

    /**
     * Looks up the transform for an explicit type hint.
     *
     * @param typeName type name, exact match
     * @return registered transform
     * @throws UnknownTypeException if no transform has that name
     */
    public Transform<?> resolveByType(String typeName) {
        Objects.requireNonNull(typeName, "typeName cannot be null");
        Transform<?> transform = byName.get(typeName);
        if (transform == null) {
            throw new UnknownTypeException(typeName);
        }
        return transform;
    }

    /**
     * Looks up the transform for an untyped placeholder by its argument name.
     *
     * @param argumentName placeholder name
     * @return transform registered under that name, or {@link Transform#STRING}
     */
    public Transform<?> resolveByArgumentName(String argumentName) {
        Objects.requireNonNull(argumentName, "argumentName cannot be null");
        Transform<?> transform = byName.get(argumentName);
        return transform != null ? transform : Transform.STRING;
    }

    /**
     * Looks up a transform declaring exactly this capture group pattern.
     *
     * @param captureGroupPattern regex fragment, compared as text
     * @return matching transform (user transforms first), or null
     */
    public Transform<?> lookupByCaptureGroupPattern(String captureGroupPattern) {
        if (captureGroupPattern == null) {
            return null;
        }
        for (Transform<?> transform : inferenceOrder()) {
            if (transform.getCaptureGroupPatterns().contains(captureGroupPattern)) {
                return transform;
            }
        }
        return null;
    }

    /**
     * Picks a transform by testing a captured sample against capture group patterns.
     *
     * <p>User transforms are tried in registration order, then the built-ins; the first transform
     * with a pattern matching the whole sample wins.
     *
     * @param sample captured text
     * @return recognizing transform, or {@link Transform#STRING} if none recognizes the sample
     */
    public Transform<?> inferFromSample(String sample) {
        Objects.requireNonNull(sample, "sample cannot be null");
        for (Transform<?> transform : inferenceOrder()) {
            if (transform.recognizes(sample)) {
                return transform;
            }
        }
        return Transform.STRING;
    }

    /**
     * @return every name currently bound to a transform
     */
    public Set<String> getTypeNames() {
        return Set.copyOf(byName.keySet());
    }

    private List<Transform<?>> inferenceOrder() {
        if (custom.isEmpty()) {
            return BUILT_INS;
        }
        List<Transform<?>> ordered = new ArrayList<>(custom);
        ordered.addAll(BUILT_INS);
        return ordered;
    }
}
