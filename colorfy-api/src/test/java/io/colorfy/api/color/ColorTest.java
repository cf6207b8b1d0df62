package io.colorfy.api.color;

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

import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Color")
class ColorTest {

    @Nested
    @DisplayName("Construction")
    class ConstructionTest {

        @Test
        @DisplayName("should read channels from hex and render hex back")
        void shouldRoundTripHex() {
            Color color = Color.fromHex("#A1B2C3").getRequiredColor();

            assertThat(color.r()).isEqualTo(161);
            assertThat(color.g()).isEqualTo(178);
            assertThat(color.b()).isEqualTo(195);
            assertThat(color.a()).isEqualTo(255);
            assertThat(Color.fromChannels(161, 178, 195, 255).getRequiredColor().hex()).isEqualTo("#A1B2C3");
        }

        @Test
        @DisplayName("should normalize lowercase hex to uppercase")
        void shouldNormalizeCase() {
            assertThat(Color.hex("#a1b2c3").hex()).isEqualTo("#A1B2C3");
            assertThat(Color.hex("#a1b2c3")).isEqualTo(Color.hex("#A1B2C3"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"#ZZZZZZ", "#12345", "#1234567", "A1B2C3", "#", "", "#12 456", "#+1+2+3"})
        @DisplayName("should reject malformed hex strings")
        void shouldRejectMalformedHex(String hex) {
            ColorResult result = Color.fromHex(hex);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.error()).isEqualTo(ColorError.INVALID_FORMAT);
            assertThat(result.getColor()).isEmpty();
        }

        @Test
        @DisplayName("should reject null hex")
        void shouldRejectNullHex() {
            assertThat(Color.fromHex(null).error()).isEqualTo(ColorError.INVALID_FORMAT);
        }

        @Test
        @DisplayName("should reject tuples with the wrong arity")
        void shouldRejectWrongArity() {
            assertThat(Color.fromChannels(1, 2, 3).error()).isEqualTo(ColorError.INVALID_FORMAT);
            assertThat(Color.fromChannels(1, 2, 3, 4, 5).error()).isEqualTo(ColorError.INVALID_FORMAT);
            assertThat(Color.fromChannels().error()).isEqualTo(ColorError.INVALID_FORMAT);
            assertThat(Color.fromChannels((int[]) null).error()).isEqualTo(ColorError.INVALID_FORMAT);
        }

        @Test
        @DisplayName("should reject out of range channels")
        void shouldRejectOutOfRangeChannels() {
            assertThat(Color.fromChannels(256, 0, 0, 0).error()).isEqualTo(ColorError.INVALID_FORMAT);
            assertThat(Color.fromChannels(0, 0, 0, -1).error()).isEqualTo(ColorError.INVALID_FORMAT);
            assertThat(Color.fromChannels(0, 0, 0, 0).isSuccess()).isTrue();
            assertThat(Color.fromChannels(255, 255, 255, 255).isSuccess()).isTrue();
        }

        @Test
        @DisplayName("should reject invalid channels in the canonical constructor")
        void shouldRejectInConstructor() {
            assertThatThrownBy(() -> new Color(0, 300, 0, 255))
                .isInstanceOf(ColorException.class)
                .satisfies(e -> assertThat(((ColorException) e).getError()).isEqualTo(ColorError.INVALID_FORMAT));
        }

        @Test
        @DisplayName("should throw from getRequiredColor on failure")
        void shouldThrowFromRequiredColor() {
            assertThatThrownBy(() -> Color.hex("#XYZ123"))
                .isInstanceOf(ColorException.class)
                .hasMessageContaining("#XYZ123");
        }

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
            "#FF0000        | 255 | 0   | 0   | 255",
            "  #00ff00      | 0   | 255 | 0   | 255",
            "1,2,3,4        | 1   | 2   | 3   | 4",
            "(10, 20, 30, 40) | 10 | 20 | 30  | 40"
        })
        @DisplayName("should parse either textual form")
        void shouldParseTextualForms(String text, int r, int g, int b, int a) {
            assertThat(Color.parse(text).getRequiredColor()).isEqualTo(Color.of(r, g, b, a));
        }

        @ParameterizedTest
        @ValueSource(strings = {"red", "1,2,3", "1,2,3,4,5", "1.5,2,3,4", "a,b,c,d", "1,2,3,256", "(1,2,3,4"})
        @DisplayName("should reject other textual shapes")
        void shouldRejectOtherShapes(String text) {
            assertThat(Color.parse(text).error()).isEqualTo(ColorError.INVALID_FORMAT);
        }

        @Test
        @DisplayName("should default alpha to opaque")
        void shouldDefaultAlpha() {
            assertThat(Color.of(1, 2, 3).a()).isEqualTo(255);
        }

        @Test
        @DisplayName("should return a defensive channel copy")
        void shouldCopyChannels() {
            Color color = Color.of(1, 2, 3, 4);
            int[] channels = color.channels();
            channels[0] = 99;

            assertThat(color.channels()).containsExactly(1, 2, 3, 4);
        }
    }

    @Nested
    @DisplayName("Derivations")
    class DerivationTest {

        @ParameterizedTest
        @ValueSource(strings = {"#000000", "#FFFFFF", "#A1B2C3", "#123456", "#7F8081"})
        @DisplayName("complement should be an involution")
        void complementTwiceIsIdentity(String hex) {
            Color color = Color.hex(hex).withAlpha(17);

            assertThat(color.complement().complement()).isEqualTo(color);
        }

        @Test
        @DisplayName("complement should invert rgb and keep alpha")
        void complementInverts() {
            assertThat(Color.of(10, 20, 30, 40).complement()).isEqualTo(Color.of(245, 235, 225, 40));
        }

        @Test
        @DisplayName("brighten should clamp to the channel range")
        void brightenClamps() {
            assertThat(Color.of(12, 200, 99, 7).brighten(0)).isEqualTo(Color.of(0, 0, 0, 7));
            assertThat(Color.of(100, 100, 100, 255).brighten(10)).isEqualTo(Color.of(255, 255, 255, 255));
            assertThat(Color.of(100, 100, 100, 255).brighten(-2)).isEqualTo(Color.of(0, 0, 0, 255));
        }

        @Test
        @DisplayName("brighten should round the scaled channels")
        void brightenRounds() {
            assertThat(Color.of(101, 10, 3, 255).brighten(0.5)).isEqualTo(Color.of(51, 5, 2, 255));
            assertThat(Color.of(100, 100, 100, 255).brighten(1.5)).isEqualTo(Color.of(150, 150, 150, 255));
        }

        @Test
        @DisplayName("brighten should not mutate the receiver")
        void brightenReturnsNewValue() {
            Color color = Color.of(100, 100, 100, 255);
            color.brighten(2);

            assertThat(color).isEqualTo(Color.of(100, 100, 100, 255));
        }

        @Test
        @DisplayName("withAlpha should accept the inclusive bounds")
        void withAlphaBounds() {
            assertThat(Color.hex("#102030").withAlpha(0).a()).isZero();
            assertThat(Color.hex("#102030").withAlpha(255).a()).isEqualTo(255);
        }

        @ParameterizedTest
        @ValueSource(ints = {-1, 256, Integer.MIN_VALUE, Integer.MAX_VALUE})
        @DisplayName("withAlpha should reject values outside the channel range")
        void withAlphaRejects(int alpha) {
            assertThatThrownBy(() -> Color.hex("#102030").withAlpha(alpha))
                .isInstanceOf(ColorException.class)
                .satisfies(e -> assertThat(((ColorException) e).getError()).isEqualTo(ColorError.OUT_OF_RANGE));
        }

        @Test
        @DisplayName("blend should be exact at the endpoints")
        void blendEndpoints() {
            Color a = Color.of(13, 77, 201, 30);
            Color b = Color.of(250, 3, 99, 255);

            assertThat(a.blend(b, 0.0)).isEqualTo(a);
            assertThat(a.blend(b, 1.0)).isEqualTo(b);
        }

        @Test
        @DisplayName("blend should interpolate every channel including alpha")
        void blendMidpoint() {
            Color blended = Color.of(0, 0, 0, 0).blend(Color.of(255, 100, 51, 255), 0.5);

            assertThat(blended).isEqualTo(Color.of(127, 50, 25, 127));
        }

        @ParameterizedTest
        @ValueSource(doubles = {-0.01, 1.01, Double.NaN, Double.POSITIVE_INFINITY})
        @DisplayName("blend should reject ratios outside [0, 1]")
        void blendRejects(double ratio) {
            assertThatThrownBy(() -> Color.hex("#000000").blend(Color.hex("#FFFFFF"), ratio))
                .isInstanceOf(ColorException.class)
                .satisfies(e -> assertThat(((ColorException) e).getError()).isEqualTo(ColorError.OUT_OF_RANGE));
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 1, 64, 127, 128, 200, 255})
        @DisplayName("gray should leave equal channels unchanged")
        void grayFixedPoint(int level) {
            Color color = Color.of(level, level, level, 255);

            assertThat(color.gray()).isEqualTo(color);
        }

        @Test
        @DisplayName("gray should apply the luma weights and keep alpha")
        void grayLuma() {
            assertThat(Color.of(255, 0, 0, 9).gray()).isEqualTo(Color.of(76, 76, 76, 9));
            assertThat(Color.of(0, 255, 0, 255).gray()).isEqualTo(Color.of(149, 149, 149, 255));
            assertThat(Color.of(0, 0, 255, 255).gray()).isEqualTo(Color.of(29, 29, 29, 255));
        }

        @Test
        @DisplayName("seeded random colors should be reproducible and opaque")
        void seededRandom() {
            Color first = Color.random(RandomSource.SPLIT_MIX_64.create(42L));
            Color second = Color.random(RandomSource.SPLIT_MIX_64.create(42L));

            assertThat(first).isEqualTo(second);
            assertThat(first.a()).isEqualTo(255);
        }

        @Test
        @DisplayName("random colors should be opaque")
        void unseededRandom() {
            for (int i = 0; i < 100; i++) {
                assertThat(Color.random().a()).isEqualTo(255);
            }
        }
    }

    @Nested
    @DisplayName("Queries")
    class QueryTest {

        @Test
        @DisplayName("isBright should compare luma against 128")
        void isBright() {
            assertThat(Color.hex("#FFFFFF").isBright()).isTrue();
            assertThat(Color.hex("#000000").isBright()).isFalse();
            assertThat(Color.of(128, 128, 128).isBright()).isFalse();
            assertThat(Color.of(129, 129, 129).isBright()).isTrue();
            assertThat(Color.hex("#FFFF00").isBright()).isTrue();
            assertThat(Color.hex("#0000FF").isBright()).isFalse();
        }

        @ParameterizedTest
        @CsvSource({
            "#FF0000, 0.0, 100.0, 50.0",
            "#00FF00, 120.0, 100.0, 50.0",
            "#0000FF, 240.0, 100.0, 50.0",
            "#FF00FF, 300.0, 100.0, 50.0",
            "#FFFFFF, 0.0, 0.0, 100.0",
            "#000000, 0.0, 0.0, 0.0",
            "#808080, 0.0, 0.0, 50.19607843137255"
        })
        @DisplayName("hsl should convert primary and achromatic colors")
        void hsl(String hex, double hue, double saturation, double lightness) {
            Hsl hsl = Color.hex(hex).hsl();

            assertThat(hsl.hue()).isCloseTo(hue, within(1e-9));
            assertThat(hsl.saturation()).isCloseTo(saturation, within(1e-9));
            assertThat(hsl.lightness()).isCloseTo(lightness, within(1e-9));
        }

        @Test
        @DisplayName("hsl should wrap red hues when blue exceeds green")
        void hslWraps() {
            Hsl hsl = Color.of(255, 0, 128).hsl();

            assertThat(hsl.hue()).isBetween(329.0, 331.0);
            assertThat(hsl.hue()).isLessThan(360.0);
        }

        @Test
        @DisplayName("hsl should use the light branch of saturation above half lightness")
        void hslLightSaturation() {
            Hsl hsl = Color.of(255, 128, 128).hsl();

            assertThat(hsl.hue()).isCloseTo(0.0, within(1e-9));
            assertThat(hsl.saturation()).isCloseTo(100.0, within(1e-9));
            assertThat(hsl.lightness()).isCloseTo(75.098, within(1e-3));
        }

        @Test
        @DisplayName("distance should span the rgb cube diagonal")
        void distance() {
            double distance = Color.hex("#000000").distance(Color.hex("#FFFFFF"));

            assertThat(distance).isCloseTo(Math.sqrt(3 * 255 * 255), within(1e-9));
            assertThat(distance).isCloseTo(441.67, within(0.01));
        }

        @Test
        @DisplayName("distance should ignore alpha")
        void distanceIgnoresAlpha() {
            assertThat(Color.of(1, 2, 3, 0).distance(Color.of(1, 2, 3, 255))).isZero();
        }

        @Test
        @DisplayName("toCss should render alpha as a two decimal fraction")
        void toCss() {
            assertThat(Color.of(255, 0, 0, 128).toCss()).isEqualTo("rgba(255, 0, 0, 0.50)");
            assertThat(Color.of(1, 2, 3, 255).toCss()).isEqualTo("rgba(1, 2, 3, 1.00)");
            assertThat(Color.of(1, 2, 3, 0).toCss()).isEqualTo("rgba(1, 2, 3, 0.00)");
        }

        @Test
        @DisplayName("ansi sequences should ignore alpha")
        void ansi() {
            Color color = Color.of(10, 20, 30, 0);

            assertThat(color.toAnsiForeground()).isEqualTo("\u001B[38;2;10;20;30m");
            assertThat(color.toAnsiBackground()).isEqualTo("\u001B[48;2;10;20;30m");
            assertThat(color.apply("hi")).isEqualTo("\u001B[38;2;10;20;30mhi\u001B[0m");
        }

        @Test
        @DisplayName("toString should show alpha only when translucent")
        void toStringForm() {
            assertThat(Color.of(255, 0, 16).toString()).isEqualTo("#FF0010");
            assertThat(Color.of(255, 0, 16, 128).toString()).isEqualTo("#FF0010/80");
        }
    }
}
