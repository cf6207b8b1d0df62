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

package io.colorfy.api.color;

import io.colorfy.api.style.Style;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/// An immutable RGBA color with four 8-bit channels.
///
/// A color has two views which are always derived from the channels:
/// - the hex form `#RRGGBB` (uppercase, alpha is not encoded)
/// - the channel tuple `(r, g, b, a)`
///
/// Every derivation returns a new instance. Alpha is carried through
/// [#blend(Color, double)] and [#withAlpha(int)] but has no effect on the
/// ANSI renderings, since terminals have no transparency channel.
///
/// ```
/// ┌──────────────────────┬──────────────────────────────────────────┐
/// │ Operation            │ Result                                   │
/// ├──────────────────────┼──────────────────────────────────────────┤
/// │ complement()         │ (255-r, 255-g, 255-b, a)                 │
/// │ brighten(f)          │ round(f * c) clamped to [0,255], a kept  │
/// │ withAlpha(a)         │ alpha replaced, a in [0,255]             │
/// │ blend(o, t)          │ (int)(c * (1-t) + o * t), alpha included │
/// │ gray()               │ luma on r, g, b, a kept                  │
/// └──────────────────────┴──────────────────────────────────────────┘
/// ```
///
/// @param r red channel, in [0, 255]
/// @param g green channel, in [0, 255]
/// @param b blue channel, in [0, 255]
/// @param a alpha channel, in [0, 255]
public record Color(int r, int g, int b, int a) {

    /// Largest value of any channel
    public static final int MAX_CHANNEL = 255;

    private static final String ANSI_FOREGROUND = "\u001B[38;2;";
    private static final String ANSI_BACKGROUND = "\u001B[48;2;";

    /// Validates the channels.
    ///
    /// @throws ColorException with [ColorError#INVALID_FORMAT] if any channel is outside [0, 255]
    public Color {
        if (!inRange(r) || !inRange(g) || !inRange(b) || !inRange(a)) {
            throw new ColorException(ColorError.INVALID_FORMAT,
                "channels must be integers between 0 and 255, got (" + r + ", " + g + ", " + b + ", " + a + ")");
        }
    }

    /// Parses a `#RRGGBB` string. Hex digits are case-insensitive; alpha is set to 255.
    ///
    /// @param hex the hex string
    /// @return the color, or an [ColorError#INVALID_FORMAT] failure
    public static ColorResult fromHex(String hex) {
        if (hex == null || !hex.startsWith("#")) {
            return ColorResult.failure(ColorError.INVALID_FORMAT, "hex color must start with '#': " + hex);
        }
        String body = hex.substring(1);
        if (body.length() != 6) {
            return ColorResult.failure(ColorError.INVALID_FORMAT, "hex color must be in the format #RRGGBB: " + hex);
        }
        int[] rgb = new int[3];
        for (int i = 0; i < 3; i++) {
            int hi = Character.digit(body.charAt(i * 2), 16);
            int lo = Character.digit(body.charAt(i * 2 + 1), 16);
            if (hi < 0 || lo < 0) {
                return ColorResult.failure(ColorError.INVALID_FORMAT, "invalid hex digits in color: " + hex);
            }
            rgb[i] = (hi << 4) | lo;
        }
        return ColorResult.success(new Color(rgb[0], rgb[1], rgb[2], MAX_CHANNEL));
    }

    /// Builds a color from exactly four channel values `(r, g, b, a)`.
    ///
    /// @param channels the channel values
    /// @return the color, or an [ColorError#INVALID_FORMAT] failure for wrong arity or range
    public static ColorResult fromChannels(int... channels) {
        if (channels == null || channels.length != 4) {
            return ColorResult.failure(ColorError.INVALID_FORMAT,
                "color tuple must have exactly 4 components (r, g, b, a), got "
                    + (channels == null ? "none" : channels.length));
        }
        for (int channel : channels) {
            if (!inRange(channel)) {
                return ColorResult.failure(ColorError.INVALID_FORMAT,
                    "RGBA values must be integers between 0 and 255, got " + channel);
            }
        }
        return ColorResult.success(new Color(channels[0], channels[1], channels[2], channels[3]));
    }

    /// Parses either textual form of a color.
    ///
    /// Strings starting with `#` are read as hex. Otherwise the text must be
    /// a comma separated tuple such as `255,0,0,128` or `(255, 0, 0, 128)`.
    ///
    /// @param text the color text
    /// @return the color, or an [ColorError#INVALID_FORMAT] failure
    public static ColorResult parse(String text) {
        if (text == null) {
            return ColorResult.failure(ColorError.INVALID_FORMAT, "color must not be null");
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("#")) {
            return fromHex(trimmed);
        }
        if (trimmed.startsWith("(") && trimmed.endsWith(")")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        if (!trimmed.contains(",")) {
            return ColorResult.failure(ColorError.INVALID_FORMAT,
                "color must be a hex string (#RRGGBB) or an RGBA tuple (r, g, b, a): " + text);
        }
        String[] parts = trimmed.split(",", -1);
        int[] channels = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                channels[i] = Integer.parseInt(parts[i].trim());
            } catch (NumberFormatException e) {
                return ColorResult.failure(ColorError.INVALID_FORMAT,
                    "color tuple component is not an integer: '" + parts[i].trim() + "'");
            }
        }
        return fromChannels(channels);
    }

    /// Creates a color from a hex literal.
    ///
    /// @param hex a `#RRGGBB` string
    /// @return the color
    /// @throws ColorException if the string is malformed
    public static Color hex(String hex) {
        return fromHex(hex).getRequiredColor();
    }

    /// @param r red
    /// @param g green
    /// @param b blue
    /// @param a alpha
    /// @return the color
    /// @throws ColorException if any channel is out of range
    public static Color of(int r, int g, int b, int a) {
        return new Color(r, g, b, a);
    }

    /// @param r red
    /// @param g green
    /// @param b blue
    /// @return the opaque color
    /// @throws ColorException if any channel is out of range
    public static Color of(int r, int g, int b) {
        return new Color(r, g, b, MAX_CHANNEL);
    }

    /// Generates an opaque color with uniformly random r, g and b.
    ///
    /// @return a random color
    public static Color random() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        return new Color(random.nextInt(256), random.nextInt(256), random.nextInt(256), MAX_CHANNEL);
    }

    /// Generates an opaque color from the given provider. The provider is not
    /// thread-safe, so callers sharing one must guard it.
    ///
    /// @param rng the random source
    /// @return a random color
    public static Color random(UniformRandomProvider rng) {
        Objects.requireNonNull(rng, "rng");
        return new Color(rng.nextInt(256), rng.nextInt(256), rng.nextInt(256), MAX_CHANNEL);
    }

    /// @return the `#RRGGBB` form, uppercase
    public String hex() {
        return String.format(Locale.ROOT, "#%02X%02X%02X", r, g, b);
    }

    /// @return a fresh `{r, g, b, a}` array
    public int[] channels() {
        return new int[]{r, g, b, a};
    }

    /// @return the inverted color, alpha kept
    public Color complement() {
        return new Color(MAX_CHANNEL - r, MAX_CHANNEL - g, MAX_CHANNEL - b, a);
    }

    /// Scales r, g and b by the factor, rounding and clamping each to [0, 255].
    ///
    /// @param factor brightness factor; greater than 1 brightens, less than 1 darkens
    /// @return the scaled color, alpha kept
    public Color brighten(double factor) {
        return new Color(scale(r, factor), scale(g, factor), scale(b, factor), a);
    }

    /// @param alpha the new alpha
    /// @return this color with the given alpha
    /// @throws ColorException with [ColorError#OUT_OF_RANGE] if alpha is outside [0, 255]
    public Color withAlpha(int alpha) {
        if (!inRange(alpha)) {
            throw new ColorException(ColorError.OUT_OF_RANGE, "alpha must be between 0 and 255, got " + alpha);
        }
        return new Color(r, g, b, alpha);
    }

    /// Linearly interpolates all four channels toward another color.
    ///
    /// @param other the color to blend in
    /// @param ratio weight of `other`, in [0, 1]
    /// @return the blended color
    /// @throws ColorException with [ColorError#OUT_OF_RANGE] if ratio is outside [0, 1]
    public Color blend(Color other, double ratio) {
        Objects.requireNonNull(other, "other");
        if (!(ratio >= 0.0d && ratio <= 1.0d)) {
            throw new ColorException(ColorError.OUT_OF_RANGE, "ratio must be between 0 and 1, got " + ratio);
        }
        return new Color(
            mix(r, other.r, ratio),
            mix(g, other.g, ratio),
            mix(b, other.b, ratio),
            mix(a, other.a, ratio)
        );
    }

    /// @return the grayscale color with every rgb channel set to the luma, alpha kept
    public Color gray() {
        int luma = lumaMillis() / 1000;
        return new Color(luma, luma, luma, a);
    }

    /// @return true if the luma `0.299r + 0.587g + 0.114b` is above 128
    public boolean isBright() {
        return lumaMillis() > 128_000;
    }

    /// Converts to hue/saturation/lightness.
    ///
    /// @return hue in degrees, saturation and lightness in percent
    public Hsl hsl() {
        double rn = r / 255.0d;
        double gn = g / 255.0d;
        double bn = b / 255.0d;
        double max = Math.max(rn, Math.max(gn, bn));
        double min = Math.min(rn, Math.min(gn, bn));
        double lightness = (max + min) / 2.0d;
        if (max == min) {
            return new Hsl(0.0d, 0.0d, lightness * 100.0d);
        }

        double delta = max - min;
        double saturation = lightness > 0.5d ? delta / (2.0d - max - min) : delta / (max + min);
        double hue;
        if (max == rn) {
            hue = (gn - bn) / delta + (gn < bn ? 6.0d : 0.0d);
        } else if (max == gn) {
            hue = (bn - rn) / delta + 2.0d;
        } else {
            hue = (rn - gn) / delta + 4.0d;
        }
        hue /= 6.0d;
        return new Hsl(hue * 360.0d, saturation * 100.0d, lightness * 100.0d);
    }

    /// @param other the other color
    /// @return the Euclidean distance over r, g and b; alpha is ignored
    public double distance(Color other) {
        Objects.requireNonNull(other, "other");
        int dr = r - other.r;
        int dg = g - other.g;
        int db = b - other.b;
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }

    /// @return the CSS form, e.g. `rgba(255, 0, 0, 0.50)`
    public String toCss() {
        return String.format(Locale.ROOT, "rgba(%d, %d, %d, %.2f)", r, g, b, a / 255.0d);
    }

    /// @return the 24-bit ANSI foreground sequence for r, g and b
    public String toAnsiForeground() {
        return ANSI_FOREGROUND + r + ";" + g + ";" + b + "m";
    }

    /// @return the 24-bit ANSI background sequence for r, g and b
    public String toAnsiBackground() {
        return ANSI_BACKGROUND + r + ";" + g + ";" + b + "m";
    }

    /// Wraps text in this color's foreground sequence followed by a reset.
    ///
    /// @param text the text to color
    /// @return the colored text
    public String apply(String text) {
        return toAnsiForeground() + text + Style.RESET.sequence();
    }

    @Override
    public String toString() {
        return a == MAX_CHANNEL ? hex() : hex() + String.format(Locale.ROOT, "/%02X", a);
    }

    // luma * 1000, exact in integer arithmetic
    private int lumaMillis() {
        return 299 * r + 587 * g + 114 * b;
    }

    private static boolean inRange(int channel) {
        return channel >= 0 && channel <= MAX_CHANNEL;
    }

    private static int scale(int channel, double factor) {
        long scaled = Math.round(factor * channel);
        return (int) Math.max(0L, Math.min(MAX_CHANNEL, scaled));
    }

    private static int mix(int from, int to, double ratio) {
        return (int) (from * (1.0d - ratio) + to * ratio);
    }
}
