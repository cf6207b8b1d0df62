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
import picocli.CommandLine;

import java.util.Locale;
import java.util.concurrent.Callable;

/// Print the Euclidean RGB distance between two colors. Alpha is not considered.
@CommandLine.Command(
    name = "distance",
    header = "Measure the distance between two colors",
    description = "Prints the Euclidean distance over red, green and blue, from 0 to 441.67."
)
public class CMD_colorfy_distance implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", paramLabel = "A", converter = ColorConverter.class,
        description = "The first color")
    private Color first;

    @CommandLine.Parameters(index = "1", paramLabel = "B", converter = ColorConverter.class,
        description = "The second color")
    private Color second;

    @Override
    public Integer call() {
        System.out.println(String.format(Locale.ROOT, "%.2f", first.distance(second)));
        return 0;
    }
}
