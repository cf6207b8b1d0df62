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

package io.colorfy.api.types.terminal;

import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/// Detects terminal color depth from environment variables.
///
/// ```
/// ┌─────────────────────┬─────────────────────┬─────────────────────┐
/// │ Environment Check   │ Values              │ Color Depth         │
/// ├─────────────────────┼─────────────────────┼─────────────────────┤
/// │ NO_COLOR            │ any non-empty       │ NOCOLOR             │
/// ├─────────────────────┼─────────────────────┼─────────────────────┤
/// │ COLORTERM           │ "truecolor"         │ ANSI24BITCOLOR      │
/// │                     │ "24bit"             │ ANSI24BITCOLOR      │
/// │                     │ "256color"          │ ANSI256COLOR        │
/// │                     │ other non-null      │ ANSI8COLOR          │
/// ├─────────────────────┼─────────────────────┼─────────────────────┤
/// │ TERM                │ contains "256color" │ ANSI256COLOR        │
/// │                     │ contains "color"    │ ANSI8COLOR          │
/// │                     │ other               │ NOCOLOR             │
/// └─────────────────────┴─────────────────────┴─────────────────────┘
/// ```
public final class TerminalColorSupport {

    /// Disables color output regardless of terminal, see https://no-color.org
    public static final String NO_COLOR = "NO_COLOR";
    /// Advertises truecolor or 256 color support
    public static final String COLORTERM = "COLORTERM";
    /// Terminal type name
    public static final String TERM = "TERM";

    private static final Function<String, String> DEFAULT_ENV_ACCESSOR = System::getenv;

    private TerminalColorSupport() {
    }

    /// @return the color depth of the current process environment
    public static ColorDepth detectColorDepth() {
        return detectColorDepth(DEFAULT_ENV_ACCESSOR);
    }

    /// @param envVars environment variable names to values
    /// @return the detected color depth
    public static ColorDepth detectColorDepth(Map<String, String> envVars) {
        return detectColorDepth(envVars::get);
    }

    /// @param envAccessor maps an environment variable name to its value, or null
    /// @return the detected color depth
    public static ColorDepth detectColorDepth(Function<String, String> envAccessor) {
        String noColor = envAccessor.apply(NO_COLOR);
        if (noColor != null && !noColor.isEmpty()) {
            return ColorDepth.NOCOLOR;
        }

        String colorTerm = envAccessor.apply(COLORTERM);
        if (colorTerm != null) {
            colorTerm = colorTerm.toLowerCase(Locale.ROOT);
            if (colorTerm.contains("truecolor") || colorTerm.contains("24bit")) {
                return ColorDepth.ANSI24BITCOLOR;
            } else if (colorTerm.contains("256color")) {
                return ColorDepth.ANSI256COLOR;
            }
            return ColorDepth.ANSI8COLOR;
        }

        String term = envAccessor.apply(TERM);
        if (term != null) {
            term = term.toLowerCase(Locale.ROOT);
            if (term.contains("256color")) {
                return ColorDepth.ANSI256COLOR;
            } else if (term.contains("color")) {
                return ColorDepth.ANSI8COLOR;
            }
        }

        return ColorDepth.NOCOLOR;
    }
}
