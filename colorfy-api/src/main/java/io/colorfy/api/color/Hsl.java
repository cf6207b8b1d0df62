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

import java.util.Locale;

/// A color in hue/saturation/lightness form.
///
/// @param hue degrees in [0, 360)
/// @param saturation percent in [0, 100]
/// @param lightness percent in [0, 100]
public record Hsl(double hue, double saturation, double lightness) {

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "hsl(%.1f, %.1f%%, %.1f%%)", hue, saturation, lightness);
    }
}
