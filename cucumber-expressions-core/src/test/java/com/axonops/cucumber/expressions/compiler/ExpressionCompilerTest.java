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

package com.axonops.cucumber.expressions.compiler;

import com.axonops.cucumber.expressions.api.MalformedExpressionException;
import com.axonops.cucumber.expressions.api.UnknownTypeException;
import com.axonops.cucumber.expressions.transform.TransformRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ExpressionCompiler")
class ExpressionCompilerTest {

    private TransformRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TransformRegistry();
    }

    private String regex(String expression) {
        return ExpressionCompiler.compile(expression, List.of(), registry).regex();
    }

    // ========== Regex Output ==========

    @Test
    @DisplayName("Literal text is anchored and escaped")
    void literal_anchoredAndEscaped() {
        assertThat(regex("1+1=2?")).isEqualTo("^1\\+1\\=2\\?$");
        assertThat(regex("a.b*c [d] ^e$ f|g <h> -i !")).isEqualTo("^a\\.b\\*c \\[d\\] \\^e\\$ f\\|g \\<h\\> \\-i \\!$");
        assertThat(regex("")).isEqualTo("^$");
    }

    @Test
    @DisplayName("Escaped characters become literals")
    void escapes_becomeLiterals() {
        assertThat(regex("\\(x\\)")).isEqualTo("^\\(x\\)$");
        assertThat(regex("\\{n\\}")).isEqualTo("^\\{n\\}$");
        assertThat(regex("a\\\\b")).isEqualTo("^a\\\\b$");
        assertThat(regex("\\a")).isEqualTo("^a$");
    }

    @Test
    @DisplayName("Optional group compiles to a non-capturing optional group")
    void optional_nonCapturing() {
        assertThat(regex("cuke(s)")).isEqualTo("^cuke(?:s)?$");
        assertThat(regex("(a.)b")).isEqualTo("^(?:a\\.)?b$");
    }

    @Test
    @DisplayName("Untyped placeholder captures lazily")
    void untyped_lazyCapture() {
        assertThat(regex("I have {n} cukes")).isEqualTo("^I have (.+?) cukes$");
    }

    @Test
    @DisplayName("Typed placeholder captures with the transform's patterns")
    void typed_usesTransformPatterns() {
        assertThat(regex("{n:int}")).isEqualTo("^(-?\\d+|\\d+)$");
        assertThat(regex("{x:float}")).isEqualTo("^(-?\\d*\\.?\\d+)$");
        assertThat(regex("{s:string}")).isEqualTo("^(.+?)$");
    }

    @Test
    @DisplayName("Compilation is deterministic")
    void deterministic() {
        String expression = "I have {n:int} cuke(s) in {where}";
        assertThat(ExpressionCompiler.compile(expression, List.of(), registry))
            .isEqualTo(ExpressionCompiler.compile(expression, List.of(), registry));
    }

    // ========== Placeholders ==========

    @Test
    @DisplayName("Placeholders carry name, type, ordinal, group and optionality")
    void placeholders_metadata() {
        CompiledExpression compiled = ExpressionCompiler.compile("{a} x( {b:int}) {c}", List.of(), registry);

        assertThat(compiled.placeholders()).containsExactly(
            new Placeholder("a", null, 0, 1, false),
            new Placeholder("b", "int", 1, 2, true),
            new Placeholder("c", null, 2, 3, false));
    }

    @Test
    @DisplayName("Group numbers skip groups nested in transform patterns")
    void placeholders_skipNestedGroups() {
        registry.register(List.of("point"), List.of("(\\d+),(\\d+)"), s -> s);

        CompiledExpression compiled = ExpressionCompiler.compile("{p:point} {q:point} {n}", List.of(), registry);

        assertThat(compiled.placeholders()).extracting(Placeholder::group).containsExactly(1, 4, 7);
        assertThat(compiled.regex()).isEqualTo("^((\\d+),(\\d+)) ((\\d+),(\\d+)) (.+?)$");
    }

    @Test
    @DisplayName("Type hints apply by position where no inline type is given")
    void typeHints_positional() {
        CompiledExpression compiled = ExpressionCompiler.compile("{a} {b:float} {c}",
            Arrays.asList("int", "int", null, "int"), registry);

        assertThat(compiled.placeholders()).extracting(Placeholder::type).containsExactly("int", "float", null);
        assertThat(compiled.regex()).isEqualTo("^(-?\\d+|\\d+) (-?\\d*\\.?\\d+) (.+?)$");
    }

    // ========== Parsing ==========

    @Test
    @DisplayName("parse produces tokens without checking types")
    void parse_tokens() {
        List<Token> tokens = ExpressionCompiler.parse("I have {n:bogus} cuke(s)");

        assertThat(tokens).containsExactly(
            new Token.Literal("I have "),
            new Token.Parameter("n", "bogus", 0),
            new Token.Literal(" cuke"),
            new Token.Optional(List.of(new Token.Literal("s"))));
    }

    @Test
    @DisplayName("Unicode letters and digits are valid in names")
    void parse_unicodeNames() {
        assertThat(ExpressionCompiler.parse("{größe_2}"))
            .containsExactly(new Token.Parameter("größe_2", null, 0));
    }

    // ========== Errors ==========

    @ParameterizedTest(name = "\"{0}\" fails at index {1}")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
        "abc}|3|unmatched '}'",
        "a)b|1|unmatched ')'",
        "a(b|1|unclosed optional group",
        "x()|1|empty optional group",
        "((a))|1|optional groups cannot be nested",
        "{x|0|unclosed placeholder",
        "{x:int|0|unclosed placeholder",
        "{}|1|empty placeholder",
        "{ x}|1|placeholder name expected",
        "{a:}|3|type name expected after ':'",
        "{a b}|2|invalid character ' ' in placeholder",
        "end\\|3|dangling escape character"
    })
    @DisplayName("Malformed expressions report where the problem is")
    void malformed_reportsIndex(String expression, int index, String message) {
        assertThatThrownBy(() -> ExpressionCompiler.parse(expression))
            .isInstanceOf(MalformedExpressionException.class)
            .hasMessageContaining(message)
            .satisfies(e -> {
                MalformedExpressionException me = (MalformedExpressionException) e;
                assertThat(me.getIndex()).isEqualTo(index);
                assertThat(me.getExpression()).isEqualTo(expression);
            });
    }

    @Test
    @DisplayName("Unknown inline type fails compilation")
    void unknownType_fails() {
        assertThatThrownBy(() -> regex("{n:bogus}"))
            .isInstanceOf(UnknownTypeException.class);
    }

    @Test
    @DisplayName("Null arguments are rejected")
    void nulls_rejected() {
        assertThatNullPointerException().isThrownBy(() -> ExpressionCompiler.compile(null, List.of(), registry));
        assertThatNullPointerException().isThrownBy(() -> ExpressionCompiler.compile("x", null, registry));
        assertThatNullPointerException().isThrownBy(() -> ExpressionCompiler.compile("x", List.of(), null));
    }
}
