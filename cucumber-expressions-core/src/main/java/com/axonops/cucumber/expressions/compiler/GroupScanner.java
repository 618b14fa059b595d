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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Finds the capturing groups of a regex source, with their names and bodies.
 *
 * <p>Escapes, {@code \Q...\E} quotes and character classes (including nested classes) are
 * skipped. Non-capturing constructs ({@code (?:}, lookaround, atomic groups, inline flags) are
 * tracked for nesting but not reported.
 *
 * <p>Expects source that {@link java.util.regex.Pattern#compile(String)} already accepted.
 * Comments enabled with {@code (?x)} are not understood; callers compare {@link List#size()}
 * with the compiled pattern's group count.
 *
 * @since 1.0.0
 */
public final class GroupScanner {

    private GroupScanner() {
        // Utility class
    }

    /**
     * Scans regex source for capturing groups.
     *
     * @param regex regex source
     * @return capture groups ordered by group number
     */
    public static List<CaptureGroup> scan(String regex) {
        Objects.requireNonNull(regex, "regex cannot be null");

        int length = regex.length();
        Deque<Frame> open = new ArrayDeque<>();
        TreeMap<Integer, CaptureGroup> groups = new TreeMap<>();
        int count = 0;
        int i = 0;

        while (i < length) {
            char c = regex.charAt(i);
            if (c == '\\') {
                i = skipEscape(regex, i);
            } else if (c == '[') {
                i = skipCharacterClass(regex, i);
            } else if (c == '(') {
                if (i + 1 < length && regex.charAt(i + 1) == '?') {
                    int nameStart = i + 3;
                    if (i + 2 < length && regex.charAt(i + 2) == '<' && nameStart < length
                            && regex.charAt(nameStart) != '=' && regex.charAt(nameStart) != '!') {
                        int nameEnd = regex.indexOf('>', nameStart);
                        if (nameEnd < 0) {
                            break;
                        }
                        open.push(new Frame(++count, regex.substring(nameStart, nameEnd), nameEnd + 1));
                        i = nameEnd + 1;
                    } else {
                        open.push(new Frame(0, null, i + 2));
                        i += 2;
                    }
                } else {
                    open.push(new Frame(++count, null, i + 1));
                    i++;
                }
            } else if (c == ')') {
                Frame frame = open.poll();
                if (frame != null && frame.index > 0) {
                    groups.put(frame.index,
                        new CaptureGroup(frame.index, frame.name, regex.substring(frame.start, i)));
                }
                i++;
            } else {
                i++;
            }
        }

        return new ArrayList<>(groups.values());
    }

    private static int skipEscape(String regex, int i) {
        if (i + 1 < regex.length() && regex.charAt(i + 1) == 'Q') {
            int end = regex.indexOf("\\E", i + 2);
            return end < 0 ? regex.length() : end + 2;
        }
        return i + 2;
    }

    private static int skipCharacterClass(String regex, int start) {
        int length = regex.length();
        int depth = 0;
        int i = start;

        while (i < length) {
            char c = regex.charAt(i);
            if (c == '\\') {
                i = skipEscape(regex, i);
            } else if (c == '[') {
                depth++;
                i++;
                if (i < length && regex.charAt(i) == '^') {
                    i++;
                }
                // A ']' first in a class is literal
                if (i < length && regex.charAt(i) == ']') {
                    i++;
                }
            } else if (c == ']') {
                depth--;
                i++;
                if (depth == 0) {
                    return i;
                }
            } else {
                i++;
            }
        }
        return length;
    }

    private record Frame(int index, String name, int start) {
    }
}
