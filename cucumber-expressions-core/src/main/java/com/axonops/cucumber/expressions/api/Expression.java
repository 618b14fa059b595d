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

import java.util.List;
import java.util.regex.Pattern;

/**
 * A pattern that matches text and extracts typed arguments.
 *
 * <p>Implementations are immutable and can be shared between threads. Each call to
 * {@link #match(String)} creates new {@link Argument} instances.
 *
 * @since 1.0.0
 * @see CucumberExpression
 * @see RegularExpression
 */
public interface Expression {

    /**
     * Matches text against this expression.
     *
     * @param text text to match
     * @return arguments in order, or null if the text does not match
     */
    List<Argument> match(String text);

    /**
     * @return the expression text or regex source this expression was created from
     */
    String getSource();

    /**
     * @return the compiled pattern used for matching
     */
    Pattern getRegex();
}
