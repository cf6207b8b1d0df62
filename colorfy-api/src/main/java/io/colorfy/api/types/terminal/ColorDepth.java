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

import io.colorfy.api.style.Style;

/// The color depth a terminal can display.
///
/// [io.colorfy.api.color.Color] renders only 24-bit sequences, so anything
/// below [#ANSI24BITCOLOR] gets plain text from [#render(String)].
///
/// ```
/// ┌─────────────────┬───────────────────────────────────────┐
/// │ Color Depth     │ Description                           │
/// ├─────────────────┼───────────────────────────────────────┤
/// │ NOCOLOR         │ No color support                      │
/// │ ANSI8COLOR      │ Basic 8 colors                        │
/// │ ANSI256COLOR    │ Extended 256 colors                   │
/// │ ANSI24BITCOLOR  │ True color (16.7 million colors)      │
/// └─────────────────┴───────────────────────────────────────┘
/// ```
public enum ColorDepth {
    /// No color support
    NOCOLOR,

    /// Basic 8-color ANSI support
    ANSI8COLOR,

    /// Extended 256-color ANSI support
    ANSI256COLOR,

    /// Full 24-bit true color support
    ANSI24BITCOLOR;

    /// @return true if at least basic ANSI colors are supported
    public boolean supportsColor() {
        return this != NOCOLOR;
    }

    /// @return true if 256 colors are supported
    public boolean supports256Colors() {
        return this == ANSI256COLOR || this == ANSI24BITCOLOR;
    }

    /// @return true if 24-bit true color is supported
    public boolean supportsTrueColor() {
        return this == ANSI24BITCOLOR;
    }

    /// Prepares styled text for a terminal of this depth.
    ///
    /// @param text text containing ANSI SGR sequences
    /// @return the text unchanged for true color terminals, otherwise the text with every sequence removed
    public String render(String text) {
        return supportsTrueColor() ? text : Style.strip(text);
    }
}
