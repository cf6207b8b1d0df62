/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.colorfy.api.style;

import java.util.regex.Pattern;

/// Fixed ANSI SGR text style sequences.
///
/// ```
/// ┌────────────────┬──────────┐
/// │ Style          │ Sequence │
/// ├────────────────┼──────────┤
/// │ RESET          │ ESC[0m   │
/// │ BOLD           │ ESC[1m   │
/// │ NORMAL_WEIGHT  │ ESC[22m  │
/// │ UNDERLINE      │ ESC[4m   │
/// │ SWAP           │ ESC[7m   │
/// │ ITALIC         │ ESC[3m   │
/// │ STRIKETHROUGH  │ ESC[9m   │
/// └────────────────┴──────────┘
/// ```
public enum Style {
    /// Clears all attributes
    RESET("\u001B[0m"),
    /// Bold weight
    BOLD("\u001B[1m"),
    /// Normal weight, undoes bold
    NORMAL_WEIGHT("\u001B[22m"),
    /// Underlined text
    UNDERLINE("\u001B[4m"),
    /// Reverse video, swaps foreground and background
    SWAP("\u001B[7m"),
    /// Italic text
    ITALIC("\u001B[3m"),
    /// Struck through text
    STRIKETHROUGH("\u001B[9m");

    private static final Pattern SGR_PATTERN = Pattern.compile("\u001B\\[[0-9;]*m");

    private final String sequence;

    Style(String sequence) {
        this.sequence = sequence;
    }

    /// @return the raw escape sequence
    public String sequence() {
        return sequence;
    }

    /// Wraps text in this style followed by a reset.
    ///
    /// @param text the text to style
    /// @return the styled text
    public String apply(String text) {
        return sequence + text + RESET.sequence;
    }

    /// Removes every SGR sequence, leaving plain text.
    ///
    /// @param text text which may contain escape sequences
    /// @return the text without them
    public static String strip(String text) {
        return SGR_PATTERN.matcher(text).replaceAll("");
    }

    @Override
    public String toString() {
        return sequence;
    }
}
