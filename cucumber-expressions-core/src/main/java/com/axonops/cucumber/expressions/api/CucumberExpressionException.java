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
 * Base exception for all expression compilation and matching errors.
 *
 * Sealed class ensuring exhaustive handling of all error types.
 *
 * <p>A failed match is not an error: {@link Expression#match(String)} returns {@code null}.
 *
 * @since 1.0.0
 */
public sealed class CucumberExpressionException extends RuntimeException
    permits MalformedExpressionException,
            UnknownTypeException,
            InvalidPatternException,
            TransformationException {

    public CucumberExpressionException(String message) {
        super(message);
    }

    public CucumberExpressionException(String message, Throwable cause) {
        super(message, cause);
    }

    static String truncate(String s) {
        return s != null && s.length() > 100 ? s.substring(0, 97) + "..." : s;
    }
}
