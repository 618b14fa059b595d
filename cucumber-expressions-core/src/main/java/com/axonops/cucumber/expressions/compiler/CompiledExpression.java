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
 * Result of compiling a Cucumber Expression: an anchored regex and its argument slots.
 *
 * @param expression original expression text
 * @param regex regex source matching the entire text
 * @param tokens parsed expression
 * @param placeholders argument slots in declaration order
 * @since 1.0.0
 */
public record CompiledExpression(String expression, String regex, List<Token> tokens,
                                 List<Placeholder> placeholders) {

    public CompiledExpression {
        tokens = List.copyOf(tokens);
        placeholders = List.copyOf(placeholders);
    }
}
