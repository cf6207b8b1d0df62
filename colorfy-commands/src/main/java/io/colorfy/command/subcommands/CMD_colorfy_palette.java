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
import io.colorfy.api.palette.Palette;
import io.colorfy.command.common.ColorModeOption;
import io.colorfy.command.common.ColorReport;
import picocli.CommandLine;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/// List the bundled palettes, or the colors of one palette.
///
/// ```bash
/// colorfy palette
/// colorfy palette catppuccin-mocha
/// ```
@CommandLine.Command(
    name = "palette",
    header = "List named color palettes",
    description = "Without an id, lists every palette. With an id, lists that palette's colors.",
    exitCodeList = {
        "0: Success",
        "1: Unknown palette"
    }
)
public class CMD_colorfy_palette implements Callable<Integer> {

    @CommandLine.Parameters(
        arity = "0..1",
        paramLabel = "PALETTE",
        description = "Palette id, e.g. solarized or dracula-pro"
    )
    private String paletteId;

    @CommandLine.Mixin
    private ColorModeOption colorMode = new ColorModeOption();

    @Override
    public Integer call() {
        if (paletteId == null) {
            for (Palette palette : Palette.values()) {
                System.out.printf("%-22s %d colors%n", palette.id(), palette.colors().size());
            }
            return 0;
        }

        Optional<Palette> palette = Palette.byId(paletteId);
        if (palette.isEmpty()) {
            System.err.println("Error: Unknown palette: " + paletteId);
            return 1;
        }

        for (Map.Entry<String, String> entry : palette.get().colors().entrySet()) {
            Color color = Color.hex(entry.getValue());
            String line = String.format("%-14s %s %s", entry.getKey(), ColorReport.swatch(color), color.hex());
            System.out.println(colorMode.render(line));
        }
        return 0;
    }
}
