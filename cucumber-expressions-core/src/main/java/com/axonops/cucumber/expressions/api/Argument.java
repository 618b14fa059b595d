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

import com.axonops.cucumber.expressions.metrics.ExpressionMetricsRegistry;
import com.axonops.cucumber.expressions.metrics.MetricNames;
import com.axonops.cucumber.expressions.transform.Transform;

import java.util.Objects;

/**
 * One captured argument of a successful match.
 *
 * <p>Pairs the raw captured text with the {@link Transform} that converts it. The transformed
 * value is computed on first access and remembered; a failed conversion is not remembered and
 * fails again on the next access.
 *
 * <p>The raw value is null when the capture sat in an optional group that did not take part in
 * the match. The transformed value is then null too, and the transform is never invoked.
 *
 * <p>Arguments are created per match and are meant to be used by a single thread.
 *
 * @since 1.0.0
 */
public final class Argument {

    private final String name;
    private final int position;
    private final String rawValue;
    private final int offset;
    private final Transform<?> transform;
    private final ExpressionMetricsRegistry metrics;

    private boolean transformed;
    private Object transformedValue;

    Argument(String name, int position, String rawValue, int offset, Transform<?> transform,
             ExpressionMetricsRegistry metrics) {
        this.name = Objects.requireNonNull(name);
        this.position = position;
        this.rawValue = rawValue;
        this.offset = offset;
        this.transform = Objects.requireNonNull(transform);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * @return placeholder name, regex group name, or {@code argN} for unnamed regex groups
     */
    public String getName() {
        return name;
    }

    /**
     * @return 0-based position among the arguments of the match
     */
    public int getPosition() {
        return position;
    }

    /**
     * @return captured text, or null if the capture did not participate in the match
     */
    public String getRawValue() {
        return rawValue;
    }

    /**
     * @return start index of the capture in the matched text, or -1 if it did not participate
     */
    public int getOffset() {
        return offset;
    }

    public Transform<?> getTransform() {
        return transform;
    }

    public String getTypeName() {
        return transform.getTypeName();
    }

    /**
     * Converts the raw value with the bound transform.
     *
     * @return converted value, or null if there is no raw value
     * @throws TransformationException if the transform rejects the raw value
     */
    public Object getTransformedValue() {
        if (rawValue == null) {
            return null;
        }
        if (!transformed) {
            try {
                transformedValue = transform.transform(rawValue);
            } catch (RuntimeException e) {
                metrics.incrementCounter(MetricNames.ERRORS_TRANSFORMATION);
                throw new TransformationException(name, position, rawValue, e);
            }
            transformed = true;
        }
        return transformedValue;
    }

    /**
     * Converts the raw value and casts it.
     *
     * @param type expected value type
     * @param <T> expected value type
     * @return converted value, or null if there is no raw value
     * @throws TransformationException if the transform rejects the raw value
     * @throws ClassCastException if the value is not of the expected type
     */
    public <T> T getTransformedValue(Class<T> type) {
        return type.cast(getTransformedValue());
    }

    @Override
    public String toString() {
        return "Argument{name=" + name + ", type=" + getTypeName() + ", raw=" + rawValue + ", offset=" + offset + "}";
    }
}
