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
import com.axonops.cucumber.expressions.transform.Transform;
import com.axonops.cucumber.expressions.transform.TransformRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles Cucumber Expression text into an anchored regular expression.
 *
 * <p>Grammar:
 * <ul>
 *   <li>{@code \x} - the character {@code x} as a literal</li>
 *   <li>{@code (text)} - optional group, compiled to {@code (?:text)?}. Not nestable.</li>
 *   <li>{@code {name}} / {@code {name:type}} - placeholder, compiled to one capturing group</li>
 *   <li>anything else - literal text, compiled with regex metacharacters escaped</li>
 * </ul>
 *
 * <p>A typed placeholder captures with its transform's capture group patterns (joined as an
 * alternation); an untyped one, or one whose transform has no patterns, captures
 * {@value #DEFAULT_CAPTURE}. Capture groups nested in a transform's patterns are counted, so
 * {@link Placeholder#group()} always points at the placeholder's own group.
 *
 * <p>Compilation is deterministic: the output depends only on the expression, the type hints and
 * the capture group patterns of the transforms the expression names.
 *
 * @since 1.0.0
 */
public final class ExpressionCompiler {

    /** Capture used by placeholders without a recognizing pattern. */
    public static final String DEFAULT_CAPTURE = ".+?";

    private static final String REGEX_META = "\\.[]{}()<>*+-=!?^$|";

    private final String expression;
    private final List<String> typeHints;
    private final TransformRegistry registry;
    private final int length;

    private int position = 0;
    private int ordinal = 0;
    private int groupCount = 0;
    private final List<Placeholder> placeholders = new ArrayList<>();

    private ExpressionCompiler(String expression, List<String> typeHints, TransformRegistry registry) {
        this.expression = expression;
        this.typeHints = typeHints;
        this.registry = registry;
        this.length = expression.length();
    }

    /**
     * Compiles an expression.
     *
     * @param expression Cucumber Expression text
     * @param typeHints positional types for placeholders without an inline type; entries may be null
     * @param registry registry supplying capture group patterns for typed placeholders
     * @return compiled expression
     * @throws MalformedExpressionException if the text is not valid syntax
     * @throws UnknownTypeException if an inline type or type hint is not registered
     */
    public static CompiledExpression compile(String expression, List<String> typeHints,
                                             TransformRegistry registry) {
        Objects.requireNonNull(expression, "expression cannot be null");
        Objects.requireNonNull(typeHints, "typeHints cannot be null");
        Objects.requireNonNull(registry, "registry cannot be null");

        ExpressionCompiler compiler = new ExpressionCompiler(expression, typeHints, registry);
        List<Token> tokens = compiler.parseSequence(false);

        StringBuilder regex = new StringBuilder(expression.length() + 16);
        regex.append('^');
        compiler.emit(tokens, regex, false);
        regex.append('$');

        return new CompiledExpression(expression, regex.toString(), tokens, compiler.placeholders);
    }

    /**
     * Parses an expression without compiling it. Type names are not checked.
     *
     * @param expression Cucumber Expression text
     * @return parsed tokens
     * @throws MalformedExpressionException if the text is not valid syntax
     */
    public static List<Token> parse(String expression) {
        Objects.requireNonNull(expression, "expression cannot be null");
        return new ExpressionCompiler(expression, List.of(), new TransformRegistry()).parseSequence(false);
    }

    // ========== Parsing ==========

    private List<Token> parseSequence(boolean inOptional) {
        List<Token> tokens = new ArrayList<>();
        StringBuilder literal = new StringBuilder();

        while (position < length) {
            char c = expression.charAt(position);
            switch (c) {
                case '\\':
                    if (position + 1 >= length) {
                        throw malformed(position, "dangling escape character");
                    }
                    literal.append(expression.charAt(position + 1));
                    position += 2;
                    break;
                case '{':
                    flush(literal, tokens);
                    tokens.add(parseParameter());
                    break;
                case '(':
                    if (inOptional) {
                        throw malformed(position, "optional groups cannot be nested");
                    }
                    flush(literal, tokens);
                    tokens.add(parseOptional());
                    break;
                case ')':
                    if (!inOptional) {
                        throw malformed(position, "unmatched ')'");
                    }
                    flush(literal, tokens);
                    return tokens;
                case '}':
                    throw malformed(position, "unmatched '}'");
                default:
                    literal.append(c);
                    position++;
            }
        }

        // Caller reports an unclosed optional group
        flush(literal, tokens);
        return tokens;
    }

    private Token parseOptional() {
        int start = position;
        position++; // '('
        List<Token> children = parseSequence(true);
        if (position >= length) {
            throw malformed(start, "unclosed optional group");
        }
        position++; // ')'
        if (children.isEmpty()) {
            throw malformed(start, "empty optional group");
        }
        return new Token.Optional(children);
    }

    private Token parseParameter() {
        int start = position;
        position++; // '{'

        String name = readIdentifier();
        if (name.isEmpty()) {
            throw malformed(position, position < length && expression.charAt(position) == '}'
                ? "empty placeholder" : "placeholder name expected");
        }

        String type = null;
        if (position < length && expression.charAt(position) == ':') {
            position++;
            type = readIdentifier();
            if (type.isEmpty()) {
                throw malformed(position, "type name expected after ':'");
            }
        }

        if (position >= length) {
            throw malformed(start, "unclosed placeholder");
        }
        char c = expression.charAt(position);
        if (c != '}') {
            throw malformed(position, "invalid character '" + c + "' in placeholder");
        }
        position++;

        return new Token.Parameter(name, type, ordinal++);
    }

    private String readIdentifier() {
        int start = position;
        while (position < length) {
            char c = expression.charAt(position);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                break;
            }
            position++;
        }
        return expression.substring(start, position);
    }

    private void flush(StringBuilder literal, List<Token> tokens) {
        if (literal.length() > 0) {
            tokens.add(new Token.Literal(literal.toString()));
            literal.setLength(0);
        }
    }

    private MalformedExpressionException malformed(int index, String message) {
        return new MalformedExpressionException(expression, index, message);
    }

    // ========== Emitting ==========

    private void emit(List<Token> tokens, StringBuilder regex, boolean inOptional) {
        for (Token token : tokens) {
            if (token instanceof Token.Literal literal) {
                escape(literal.text(), regex);
            } else if (token instanceof Token.Optional optional) {
                regex.append("(?:");
                emit(optional.children(), regex, true);
                regex.append(")?");
            } else if (token instanceof Token.Parameter parameter) {
                emitParameter(parameter, regex, inOptional);
            }
        }
    }

    private void emitParameter(Token.Parameter parameter, StringBuilder regex, boolean inOptional) {
        String type = parameter.type();
        if (type == null && parameter.ordinal() < typeHints.size()) {
            type = typeHints.get(parameter.ordinal());
        }

        int group = ++groupCount;
        String capture = DEFAULT_CAPTURE;
        if (type != null) {
            Transform<?> transform = registry.resolveByType(type);
            if (!transform.getCaptureGroupPatterns().isEmpty()) {
                capture = String.join("|", transform.getCaptureGroupPatterns());
                groupCount += transform.getGroupCount();
            }
        }

        regex.append('(').append(capture).append(')');
        placeholders.add(new Placeholder(parameter.name(), type, parameter.ordinal(), group, inOptional));
    }

    private static void escape(String text, StringBuilder regex) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (REGEX_META.indexOf(c) >= 0) {
                regex.append('\\');
            }
            regex.append(c);
        }
    }
}
