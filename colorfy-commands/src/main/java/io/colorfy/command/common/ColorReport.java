package io.colorfy.command.common;

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

import io.colorfy.api.color.Color;
import io.colorfy.api.style.Style;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats colors for console output. Output contains ANSI sequences; callers
 * pass it through {@link ColorModeOption#render(String)} before printing.
 */
public final class ColorReport {

    private static final String SWATCH_CELLS = "    ";

    private ColorReport() {
    }

    /**
     * A block of background color, followed by a reset.
     */
    public static String swatch(Color color) {
        return color.toAnsiBackground() + SWATCH_CELLS + Style.RESET;
    }

    /**
     * One line: swatch, hex and channel tuple.
     */
    public static String line(Color color) {
        return swatch(color) + " " + color.apply(color.hex()) + "  " + tuple(color);
    }

    /**
     * The full description of a color used by {@code colorfy show}.
     */
    public static List<String> details(Color color) {
        List<String> lines = new ArrayList<>();
        lines.add(swatch(color) + " " + Style.BOLD.apply(color.hex()));
        lines.add("  rgba:        " + tuple(color));
        lines.add("  css:         " + color.toCss());
        lines.add("  hsl:         " + color.hsl());
        lines.add("  brightness:  " + (color.isBright() ? "bright" : "dark"));
        lines.add("  complement:  " + swatch(color.complement()) + " " + color.complement().hex());
        lines.add("  gray:        " + swatch(color.gray()) + " " + color.gray().hex());
        return lines;
    }

    /**
     * The channel tuple in the form {@code (r, g, b, a)}.
     */
    public static String tuple(Color color) {
        return "(" + color.r() + ", " + color.g() + ", " + color.b() + ", " + color.a() + ")";
    }
}
