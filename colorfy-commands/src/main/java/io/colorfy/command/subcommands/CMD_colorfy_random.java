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
import io.colorfy.command.common.ColorModeOption;
import io.colorfy.command.common.ColorReport;
import io.colorfy.command.common.RandomSeedOption;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.Optional;
import java.util.concurrent.Callable;

/// Generate random opaque colors.
///
/// ```bash
/// colorfy random --count 5
/// colorfy random -n 3 --seed 42
/// ```
@CommandLine.Command(
    name = "random",
    header = "Generate random colors",
    description = "Prints opaque colors with uniformly random red, green and blue.",
    exitCodeList = {
        "0: Success",
        "1: Invalid count"
    }
)
public class CMD_colorfy_random implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_colorfy_random.class);

    @CommandLine.Option(
        names = {"--count", "-n"},
        defaultValue = "1",
        description = "Number of colors to generate (default: ${DEFAULT-VALUE})"
    )
    private int count = 1;

    @CommandLine.Mixin
    private RandomSeedOption seedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private ColorModeOption colorMode = new ColorModeOption();

    @Override
    public Integer call() {
        if (count < 1) {
            System.err.println("Error: --count must be at least 1, got " + count);
            return 1;
        }
        logger.debug("generating {} colors, seed {}", count, seedOption);

        Optional<UniformRandomProvider> rng = seedOption.provider();
        for (int i = 0; i < count; i++) {
            Color color = rng.map(Color::random).orElseGet(Color::random);
            System.out.println(colorMode.render(ColorReport.line(color)));
        }
        return 0;
    }
}
