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
 * Thrown when a transform's conversion function rejects a captured value.
 *
 * <p>Carries the argument it was raised for so callers can report which capture failed.
 *
 * @since 1.0.0
 */
public final class TransformationException extends CucumberExpressionException {

    private final String argumentName;
    private final int position;
    private final String rawValue;

    public TransformationException(String argumentName, int position, String rawValue, Throwable cause) {
        super("Failed to transform argument '" + argumentName + "' (position " + position
            + ", value: " + truncate(rawValue) + "): " + cause.getMessage(), cause);
        this.argumentName = argumentName;
        this.position = position;
        this.rawValue = rawValue;
    }

    public String getArgumentName() {
        return argumentName;
    }

    /**
     * @return 0-based position of the argument in the match result
     */
    public int getPosition() {
        return position;
    }

    public String getRawValue() {
        return rawValue;
    }
}
