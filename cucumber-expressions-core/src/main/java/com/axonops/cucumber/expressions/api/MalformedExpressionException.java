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

/**
 * Thrown when Cucumber Expression text is not syntactically valid.
 *
 * Raised at compile time only, never by {@link Expression#match(String)}.
 *
 * @since 1.0.0
 */
public final class MalformedExpressionException extends CucumberExpressionException {

    private final String expression;
    private final int index;

    public MalformedExpressionException(String expression, int index, String message) {
        super("Malformed expression: " + message + " at index " + index
            + " (expression: " + truncate(expression) + ")");
        this.expression = expression;
        this.index = index;
    }

    public String getExpression() {
        return expression;
    }

    /**
     * @return offset into the expression text where the problem was detected
     */
    public int getIndex() {
        return index;
    }
}
