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

/**
 * Argument slot of a compiled Cucumber Expression.
 *
 * @param name identifier written inside the braces
 * @param type explicit type (inline or positional hint), or null
 * @param ordinal 0-based declaration position among all placeholders
 * @param group index of the capture group holding this placeholder's text
 * @param optional true if the placeholder sits inside an optional group
 * @since 1.0.0
 */
public record Placeholder(String name, String type, int ordinal, int group, boolean optional) {

    public boolean hasType() {
        return type != null;
    }
}
