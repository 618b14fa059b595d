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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class DropwizardMetricsAdapterTest {

    @Test
    void testDefaultPrefix() {
        MetricRegistry registry = new MetricRegistry();
        DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry);

        adapter.incrementCounter(MetricNames.MATCHING_OPERATIONS);

        assertThat(adapter.getPrefix()).isEqualTo("com.axonops.cucumber.expressions");
        assertThat(registry.getCounters())
            .containsKey("com.axonops.cucumber.expressions.matching.operations.total.count");
    }

    @Test
    void testCountersAndTimers() {
        MetricRegistry registry = new MetricRegistry();
        DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry, "p");

        adapter.incrementCounter("c");
        adapter.incrementCounter("c", 4);
        adapter.recordTimer("t", 1_000_000);

        assertThat(registry.counter("p.c").getCount()).isEqualTo(5);
        assertThat(registry.timer("p.t").getCount()).isEqualTo(1);
        assertThat(registry.timer("p.t").getSnapshot().getMax()).isEqualTo(1_000_000);
    }

    @Test
    void testGaugeRegistrationIsIdempotent() {
        MetricRegistry registry = new MetricRegistry();
        DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry, "p");
        AtomicInteger value = new AtomicInteger(1);

        adapter.registerGauge("g", () -> 0);
        adapter.registerGauge("g", value::get);

        Gauge<?> gauge = registry.getGauges().get("p.g");
        assertThat(gauge.getValue()).isEqualTo(1);
        value.set(7);
        assertThat(gauge.getValue()).isEqualTo(7);

        adapter.removeGauge("g");
        assertThat(registry.getGauges()).doesNotContainKey("p.g");
    }

    @Test
    void testNullArguments() {
        assertThatNullPointerException().isThrownBy(() -> new DropwizardMetricsAdapter(null));
        assertThatNullPointerException().isThrownBy(() -> new DropwizardMetricsAdapter(new MetricRegistry(), null));
    }

    @Test
    void testNoOpIgnoresEverything() {
        ExpressionMetricsRegistry noOp = NoOpMetricsRegistry.INSTANCE;

        assertThatCode(() -> {
            noOp.incrementCounter("c");
            noOp.incrementCounter("c", 2);
            noOp.recordTimer("t", 1);
            noOp.registerGauge("g", () -> 1);
            noOp.removeGauge("g");
        }).doesNotThrowAnyException();
    }
}
