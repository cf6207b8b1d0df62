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

/// Thrown when a color cannot be constructed or a derivation parameter is out of its domain.
///
/// The [ColorError] tells callers which of the two failure kinds occurred.
public class ColorException extends IllegalArgumentException {

    private final ColorError error;

    /// Creates a new exception of the given kind.
    ///
    /// @param error the failure kind
    /// @param message a description of the rejected input
    public ColorException(ColorError error, String message) {
        super(message);
        this.error = error;
    }

    /// @return the failure kind
    public ColorError getError() {
        return error;
    }
}
