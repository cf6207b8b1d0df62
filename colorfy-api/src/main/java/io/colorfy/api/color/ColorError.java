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

/// The kinds of failure a color operation can report.
public enum ColorError {
    /// Construction input is neither a well formed `#RRGGBB` string nor a
    /// four component channel tuple with every component in [0, 255].
    INVALID_FORMAT,

    /// A parameter (alpha, blend ratio) lies outside its documented domain.
    OUT_OF_RANGE
}
