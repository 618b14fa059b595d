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
 * Thrown when an explicit type hint names a type that no transform is registered under.
 *
 * @since 1.0.0
 */
public final class UnknownTypeException extends CucumberExpressionException {

    private final String typeName;

    public UnknownTypeException(String typeName) {
        super("Unknown type: no transform registered for '" + typeName + "'");
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
