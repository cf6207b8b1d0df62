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

/// The color value type.
///
/// ## REQUIREMENTS
///
/// - A color holds four channels `r, g, b, a`, each in [0, 255]
/// - The hex form `#RRGGBB` and the channel tuple are views of the same channels
/// - Every derivation returns a new color
/// - Construction from user input reports failure through [io.colorfy.api.color.ColorResult]
///   rather than by throwing
///
/// ## ERRORS
///
/// - [io.colorfy.api.color.ColorError#INVALID_FORMAT] for malformed hex strings, wrong tuple arity,
///   non-integer or out-of-range tuple components
/// - [io.colorfy.api.color.ColorError#OUT_OF_RANGE] for alpha or blend ratio outside their domain
package io.colorfy.api.color;
