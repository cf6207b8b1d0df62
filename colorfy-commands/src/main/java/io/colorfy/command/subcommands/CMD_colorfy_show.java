package io.colorfy.command.subcommands;

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
import io.colorfy.command.common.ColorConverter;
import io.colorfy.command.common.ColorModeOption;
import io.colorfy.command.common.ColorReport;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

/// Show every view of one or more colors.
///
/// ## Usage
///
/// ```bash
/// colorfy show '#A1B2C3'
/// colorfy show 255,0,0,128 catppuccin-mocha:mauve
/// ```
///
/// ## Output
///
/// For each color: a swatch, hex, rgba tuple, CSS form, HSL, brightness
/// class, and the complement and grayscale derivations.
@CommandLine.Command(
    name = "show",
    header = "Show a color in every form",
    description = "Displays hex, rgba, CSS and HSL forms of each color, with its complement and gray.",
    exitCodeList = {
        "0: Success",
        "2: Invalid color"
    }
)
public class CMD_colorfy_show implements Callable<Integer> {

    @CommandLine.Parameters(
        arity = "1..*",
        paramLabel = "COLOR",
        description = "Colors as #RRGGBB, r,g,b,a or palette:NAME",
        converter = ColorConverter.class
    )
    private List<Color> colors;

    @CommandLine.Mixin
    private ColorModeOption colorMode = new ColorModeOption();

    @Override
    public Integer call() {
        for (int i = 0; i < colors.size(); i++) {
            if (i > 0) {
                System.out.println();
            }
            for (String line : ColorReport.details(colors.get(i))) {
                System.out.println(colorMode.render(line));
            }
        }
        return 0;
    }
}
