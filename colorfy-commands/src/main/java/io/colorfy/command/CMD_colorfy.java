package io.colorfy.command;

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

import io.colorfy.api.types.terminal.AnsiConsole;
import io.colorfy.command.subcommands.CMD_colorfy_blend;
import io.colorfy.command.subcommands.CMD_colorfy_distance;
import io.colorfy.command.subcommands.CMD_colorfy_palette;
import io.colorfy.command.subcommands.CMD_colorfy_random;
import io.colorfy.command.subcommands.CMD_colorfy_show;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Tools for inspecting, mixing and previewing colors in the terminal
///
/// This is the top level command which serves as an entry point for all sub-commands
@CommandLine.Command(name = "colorfy",
    header = "Inspect, mix and preview colors",
    description = "Colors are given as #RRGGBB, as an r,g,b,a tuple, or as palette:NAME",
    mixinStandardHelpOptions = true,
    subcommands = {
        CMD_colorfy_show.class,
        CMD_colorfy_blend.class,
        CMD_colorfy_distance.class,
        CMD_colorfy_random.class,
        CMD_colorfy_palette.class
    })
public class CMD_colorfy implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_colorfy.class);

    /// run a colorfy command
    /// @param args command line args
    public static void main(String[] args) {
        AnsiConsole.init();
        int exitCode = commandLine().execute(args);
        logger.debug("colorfy exiting with code {}", exitCode);
        System.exit(exitCode);
    }

    /// @return the configured command line, with case-insensitive options and enum values
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_colorfy())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    /// Print help information if no subcommand is specified
    ///
    /// @return 0
    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
