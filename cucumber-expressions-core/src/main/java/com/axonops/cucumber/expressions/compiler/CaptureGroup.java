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
 * A capturing group found in raw regex source.
 *
 * @param index 1-based group number, as used by {@link java.util.regex.Matcher#group(int)}
 * @param name group name for {@code (?<name>...)}, otherwise null
 * @param source regex text between the group's parentheses, or null if unknown
 * @since 1.0.0
 */
public record CaptureGroup(int index, String name, String source) {
}
