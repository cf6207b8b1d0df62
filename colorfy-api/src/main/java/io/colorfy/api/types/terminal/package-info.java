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

/// Terminal capabilities.
///
/// - [io.colorfy.api.types.terminal.TerminalColorSupport] reads `NO_COLOR`, `COLORTERM` and `TERM`
///   to decide a [io.colorfy.api.types.terminal.ColorDepth]
/// - [io.colorfy.api.types.terminal.AnsiConsole] is a one-shot process initialization which turns on
///   ANSI processing for Windows consoles
///
/// Environment variables can be injected through a Map or a Function accessor, so detection
/// can be tested without modifying the actual system environment.
package io.colorfy.api.types.terminal;
