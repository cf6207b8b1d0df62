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

import java.util.Optional;

/// The outcome of parsing or constructing a [Color].
///
/// Exactly one of `color` or `error` is non-null. Factories such as
/// [Color#fromHex(String)] return this instead of throwing, so that invalid
/// user input can be handled without exceptions.
///
/// @param color the constructed color, or null on failure
/// @param error the failure kind, or null on success
/// @param message a description of the failure, or null on success
public record ColorResult(Color color, ColorError error, String message) {

    /// Creates a successful result.
    ///
    /// @param color the constructed color
    /// @return a result holding the color
    public static ColorResult success(Color color) {
        return new ColorResult(color, null, null);
    }

    /// Creates a failed result.
    ///
    /// @param error the failure kind
    /// @param message a description of the rejected input
    /// @return a result holding the error
    public static ColorResult failure(ColorError error, String message) {
        return new ColorResult(null, error, message);
    }

    /// @return true if a color was constructed
    public boolean isSuccess() {
        return color != null;
    }

    /// @return the color, or empty on failure
    public Optional<Color> getColor() {
        return Optional.ofNullable(color);
    }

    /// Gets the color, throwing if construction failed.
    ///
    /// @return the color
    /// @throws ColorException carrying this result's error and message
    public Color getRequiredColor() {
        if (color == null) {
            throw new ColorException(error, message);
        }
        return color;
    }
}
