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

import io.colorfy.api.types.terminal.ColorDepth;
import io.colorfy.api.types.terminal.TerminalColorSupport;
import picocli.CommandLine;

/**
 * Shared {@code --color} CLI option deciding whether ANSI sequences reach the output.
 * Commands include this as a mixin and pass everything they print through {@link #render(String)}.
 */
public final class ColorModeOption {

    /**
     * When to emit color.
     */
    public enum ColorMode {
        /** Color when attached to a console whose environment advertises true color */
        AUTO,
        /** Always emit 24-bit sequences */
        ALWAYS,
        /** Never emit sequences */
        NEVER
    }

    @CommandLine.Option(
        names = {"--color"},
        paramLabel = "MODE",
        defaultValue = "AUTO",
        description = "When to color the output. Valid values: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})."
    )
    private ColorMode mode = ColorMode.AUTO;

    /**
     * @return the selected mode
     */
    public ColorMode getMode() {
        return mode;
    }

    /**
     * Resolves the selected mode to a color depth. {@code auto} yields no color when
     * output is not an interactive console.
     *
     * @return the depth to render for
     */
    public ColorDepth depth() {
        switch (mode) {
            case ALWAYS:
                return ColorDepth.ANSI24BITCOLOR;
            case NEVER:
                return ColorDepth.NOCOLOR;
            default:
                return System.console() == null ? ColorDepth.NOCOLOR : TerminalColorSupport.detectColorDepth();
        }
    }

    /**
     * @param styled text which may contain ANSI sequences
     * @return the text as it should be printed for the selected mode
     */
    public String render(String styled) {
        return depth().render(styled);
    }
}
