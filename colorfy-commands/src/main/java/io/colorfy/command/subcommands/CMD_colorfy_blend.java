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
import io.colorfy.api.color.ColorException;
import io.colorfy.command.common.ColorConverter;
import io.colorfy.command.common.ColorModeOption;
import io.colorfy.command.common.ColorReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Blend two colors.
///
/// ```bash
/// colorfy blend '#000000' '#FFFFFF' --ratio 0.25
/// ```
///
/// Every channel, alpha included, moves from the first color toward the second by the ratio.
@CommandLine.Command(
    name = "blend",
    header = "Blend two colors",
    description = "Linearly interpolates each channel, including alpha, from FROM toward TO.",
    exitCodeList = {
        "0: Success",
        "1: Ratio outside [0, 1]",
        "2: Invalid color"
    }
)
public class CMD_colorfy_blend implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_colorfy_blend.class);

    @CommandLine.Parameters(index = "0", paramLabel = "FROM", converter = ColorConverter.class,
        description = "The starting color")
    private Color from;

    @CommandLine.Parameters(index = "1", paramLabel = "TO", converter = ColorConverter.class,
        description = "The color blended in")
    private Color to;

    @CommandLine.Option(
        names = {"--ratio", "-r"},
        defaultValue = "0.5",
        description = "Weight of TO, between 0 and 1 (default: ${DEFAULT-VALUE})"
    )
    private double ratio = 0.5d;

    @CommandLine.Mixin
    private ColorModeOption colorMode = new ColorModeOption();

    @Override
    public Integer call() {
        try {
            Color blended = from.blend(to, ratio);
            System.out.println(colorMode.render(ColorReport.line(blended)));
            return 0;
        } catch (ColorException e) {
            logger.error("Cannot blend {} with {}: {}", from, to, e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
