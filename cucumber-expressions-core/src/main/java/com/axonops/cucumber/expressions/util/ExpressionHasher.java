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

package com.axonops.cucumber.expressions.util;

/**
 * Utility for hashing expression and pattern strings for logging purposes.
 *
 * <p>Step text may carry user data, so logs identify expressions by hash only.
 * The hash is deterministic: the same expression always gets the same hash.
 *
 * @since 1.0.0
 */
public final class ExpressionHasher {

    private ExpressionHasher() {
        // Utility class
    }

    /**
     * Creates a compact hex hash of an expression string for logging.
     *
     * @param expression expression text or regex source
     * @return hex string (e.g., "7a3f2b1c")
     */
    public static String hash(String expression) {
        if (expression == null) {
            return "null";
        }
        return Integer.toHexString(expression.hashCode());
    }

    /**
     * Creates a hash tagged with the expression flavour.
     *
     * @param expression expression text or regex source
     * @param regex true for a raw regular expression, false for a Cucumber Expression
     * @return hash with flavour indicator (e.g., "7a3f2b1c[RE]" or "7a3f2b1c[CE]")
     */
    public static String hashWithKind(String expression, boolean regex) {
        return hash(expression) + (regex ? "[RE]" : "[CE]");
    }
}
