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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Transform")
class TransformTest {

    // ========== Built-ins ==========

    @Test
    @DisplayName("int recognizes and converts signed integers")
    void int_builtIn() {
        assertThat(Transform.INT.getTypeName()).isEqualTo("int");
        assertThat(Transform.INT.recognizes("-12")).isTrue();
        assertThat(Transform.INT.recognizes("1.5")).isFalse();
        assertThat(Transform.INT.transform("-12")).isEqualTo(-12);
    }

    @Test
    @DisplayName("int lists the unsigned pattern only for source lookup")
    void int_unsignedPatternForSourceLookup() {
        assertThat(Transform.INT.getCaptureGroupPatterns()).containsExactly("-?\\d+", "\\d+");
        assertThat(new TransformRegistry().lookupByCaptureGroupPattern("\\d+")).isSameAs(Transform.INT);
        // Recognition is the same with or without it
        Transform<Integer> signedOnly = Transform.of(List.of("signed"), List.of("-?\\d+"), Integer::valueOf);
        for (String sample : List.of("7", "-7", "007", "7a", "")) {
            assertThat(Transform.INT.recognizes(sample)).as(sample).isEqualTo(signedOnly.recognizes(sample));
        }
    }

    @Test
    @DisplayName("float recognizes decimals with optional integer part")
    void float_builtIn() {
        assertThat(Transform.FLOAT.recognizes(".5")).isTrue();
        assertThat(Transform.FLOAT.recognizes("-3.25")).isTrue();
        assertThat(Transform.FLOAT.recognizes("3.")).isFalse();
        assertThat(Transform.FLOAT.transform("-3.25")).isEqualTo(-3.25f);
    }

    @Test
    @DisplayName("string has no patterns and returns its input")
    void string_builtIn() {
        assertThat(Transform.STRING.getCaptureGroupPatterns()).isEmpty();
        assertThat(Transform.STRING.recognizes("anything")).isFalse();
        assertThat(Transform.STRING.transform("anything")).isEqualTo("anything");
    }

    // ========== Construction ==========

    @Test
    @DisplayName("Recognition matches the whole sample")
    void recognizes_wholeSample() {
        Transform<String> t = Transform.of(List.of("word"), List.of("[a-z]+"), s -> s);

        assertThat(t.recognizes("abc")).isTrue();
        assertThat(t.recognizes("abc1")).isFalse();
    }

    @Test
    @DisplayName("Counts capture groups across all patterns")
    void groupCount_acrossPatterns() {
        Transform<String> t = Transform.of(List.of("pair"), List.of("(\\d+),(\\d+)", "(?:x)(y)"), s -> s);

        assertThat(t.getGroupCount()).isEqualTo(3);
        assertThat(Transform.INT.getGroupCount()).isZero();
    }

    @Test
    @DisplayName("First name is the type name, all names are kept")
    void names() {
        Transform<String> t = Transform.of(List.of("colour", "color"), List.of(), s -> s);

        assertThat(t.getTypeName()).isEqualTo("colour");
        assertThat(t.getNames()).containsExactly("colour", "color");
    }

    @Test
    @DisplayName("Invalid capture group pattern is rejected")
    void invalidPattern_rejected() {
        assertThatThrownBy(() -> Transform.of(List.of("bad"), List.of("(unclosed"), s -> s))
            .isInstanceOf(InvalidPatternException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "two words", "a:b", "{x}"})
    @DisplayName("Names must be word characters")
    void invalidName_rejected(String name) {
        assertThatIllegalArgumentException().isThrownBy(() -> Transform.of(name, s -> s));
    }

    @Test
    @DisplayName("Needs at least one name")
    void noNames_rejected() {
        assertThatIllegalArgumentException().isThrownBy(() -> Transform.of(List.of(), List.of(), s -> s));
    }

    @Test
    @DisplayName("Null arguments are rejected")
    void nulls_rejected() {
        assertThatNullPointerException().isThrownBy(() -> Transform.of(null, List.of(), s -> s));
        assertThatNullPointerException().isThrownBy(() -> Transform.of(List.of("x"), null, s -> s));
        assertThatNullPointerException().isThrownBy(() -> Transform.of("x", null));
    }
}
