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
import io.colorfy.api.color.ColorResult;
import io.colorfy.api.palette.Palette;
import picocli.CommandLine;

import java.util.Optional;

/**
 * Picocli type converter for {@link Color} arguments.
 * Supports formats: {@code #RRGGBB}, {@code r,g,b,a}, {@code (r, g, b, a)} and
 * {@code palette-id:NAME}, for example {@code dracula:purple}.
 */
public class ColorConverter implements CommandLine.ITypeConverter<Color> {

    @Override
    public Color convert(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new CommandLine.TypeConversionException("Color specification cannot be empty");
        }
        String trimmed = value.trim();

        int colon = trimmed.indexOf(':');
        if (colon > 0) {
            return fromPalette(trimmed.substring(0, colon), trimmed.substring(colon + 1));
        }

        ColorResult result = Color.parse(trimmed);
        if (!result.isSuccess()) {
            throw new CommandLine.TypeConversionException(result.message());
        }
        return result.color();
    }

    private Color fromPalette(String paletteId, String name) {
        Optional<Palette> palette = Palette.byId(paletteId);
        if (palette.isEmpty()) {
            throw new CommandLine.TypeConversionException("Unknown palette: " + paletteId);
        }
        return palette.get().color(name).orElseThrow(() -> new CommandLine.TypeConversionException(
            "Palette " + palette.get().id() + " has no color named " + name));
    }
}
