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

import com.axonops.cucumber.expressions.metrics.DropwizardMetricsAdapter;
import com.axonops.cucumber.expressions.metrics.NoOpMetricsRegistry;
import com.axonops.cucumber.expressions.test.TestUtils;
import com.axonops.cucumber.expressions.transform.Transform;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Argument")
class ArgumentTest {

    private static Argument argument(String raw, Transform<?> transform) {
        return new Argument("n", 0, raw, raw == null ? -1 : 3, transform, NoOpMetricsRegistry.INSTANCE);
    }

    @Test
    @DisplayName("Conversion runs once and is memoised")
    void transformedValue_memoised() {
        AtomicInteger calls = new AtomicInteger();
        Argument arg = argument("42", TestUtils.counting("count", List.of("\\d+"), Integer::valueOf, calls));

        assertThat(calls.get()).isZero();
        assertThat(arg.getTransformedValue()).isEqualTo(42);
        assertThat(arg.getTransformedValue()).isEqualTo(42);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Typed accessor casts the converted value")
    void typedAccessor_casts() {
        Argument arg = argument("42", Transform.INT);

        Integer value = arg.getTransformedValue(Integer.class);
        assertThat(value).isEqualTo(42);
        assertThatThrownBy(() -> arg.getTransformedValue(String.class)).isInstanceOf(ClassCastException.class);
    }

    @Test
    @DisplayName("Missing raw value converts to null without calling the transform")
    void nullRaw_nullValue() {
        AtomicInteger calls = new AtomicInteger();
        Argument arg = argument(null, TestUtils.counting("count", List.of(), Integer::valueOf, calls));

        assertThat(arg.getTransformedValue()).isNull();
        assertThat(arg.getTransformedValue(Integer.class)).isNull();
        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("Failed conversion is retried on the next call")
    void failure_notMemoised() {
        AtomicInteger calls = new AtomicInteger();
        Argument arg = argument("x", TestUtils.counting("count", List.of(), Integer::valueOf, calls));

        assertThatThrownBy(arg::getTransformedValue).isInstanceOf(TransformationException.class);
        assertThatThrownBy(arg::getTransformedValue).isInstanceOf(TransformationException.class);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Failed conversion is counted")
    void failure_counted() {
        MetricRegistry registry = new MetricRegistry();
        Argument arg = new Argument("n", 0, "x", 0, Transform.INT, new DropwizardMetricsAdapter(registry, "test"));

        assertThatThrownBy(arg::getTransformedValue)
            .isInstanceOf(TransformationException.class)
            .hasMessageContaining("'n'")
            .hasMessageContaining("value: x");
        assertThat(registry.counter("test.errors.transformation.total.count").getCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Exposes name, position, raw value, offset and type")
    void accessors() {
        Argument arg = new Argument("who", 2, "Bob", 5, Transform.STRING, NoOpMetricsRegistry.INSTANCE);

        assertThat(arg.getName()).isEqualTo("who");
        assertThat(arg.getPosition()).isEqualTo(2);
        assertThat(arg.getRawValue()).isEqualTo("Bob");
        assertThat(arg.getOffset()).isEqualTo(5);
        assertThat(arg.getTransform()).isSameAs(Transform.STRING);
        assertThat(arg.getTypeName()).isEqualTo("string");
        assertThat(arg).hasToString("Argument{name=who, type=string, raw=Bob, offset=5}");
    }
}
