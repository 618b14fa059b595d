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

import java.util.List;

/**
 * Element of a parsed Cucumber Expression.
 *
 * @since 1.0.0
 */
public sealed interface Token {

    /**
     * Literal text with escapes already resolved.
     */
    record Literal(String text) implements Token {
    }

    /**
     * {@code (text)}: matched as a whole or not at all. Never contains another optional group.
     */
    record Optional(List<Token> children) implements Token {
        public Optional {
            children = List.copyOf(children);
        }
    }

    /**
     * {@code {name}} or {@code {name:type}}. {@code type} is null when absent.
     */
    record Parameter(String name, String type, int ordinal) implements Token {
    }
}
