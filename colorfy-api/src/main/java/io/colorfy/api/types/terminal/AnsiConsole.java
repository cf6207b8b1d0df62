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

package io.colorfy.api.types.terminal;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

/// One-time process setup so that ANSI sequences render on consoles which
/// do not interpret them by default.
///
/// On Windows, opening the JLine system terminal switches the console into
/// virtual terminal processing mode. The terminal is kept open for the life
/// of the process so the mode stays in effect. Other platforms need nothing.
///
/// Failure is never fatal: it is logged and output simply shows raw sequences.
public final class AnsiConsole {
    private static final Logger logger = LogManager.getLogger(AnsiConsole.class);

    private static final AtomicBoolean initialized = new AtomicBoolean(false);
    private static final TerminalOpener SYSTEM_TERMINAL = () -> TerminalBuilder.builder()
        .system(true)
        .name("colorfy")
        .build();

    private static volatile Terminal terminal;

    private AnsiConsole() {
    }

    /// Opens a terminal whose construction enables ANSI processing.
    @FunctionalInterface
    public interface TerminalOpener {
        /// @return an open terminal
        /// @throws IOException if the console cannot be opened
        Terminal open() throws IOException;
    }

    /// Enables ANSI sequence support for this process. Only the first call has any effect.
    public static void init() {
        if (initialized.compareAndSet(false, true)) {
            enable(System.getProperty("os.name", ""), SYSTEM_TERMINAL);
        }
    }

    /// @return true once [#init()] has run
    public static boolean isInitialized() {
        return initialized.get();
    }

    /// Enables ANSI support for the named platform.
    ///
    /// @param osName the value of the `os.name` system property
    /// @param opener opens the console terminal on platforms that need it
    /// @return true if sequences are expected to render, false if enabling failed
    public static boolean enable(String osName, TerminalOpener opener) {
        if (!isWindows(osName)) {
            logger.debug("ANSI sequences are native on {}", osName);
            return true;
        }
        try {
            terminal = opener.open();
            logger.debug("Enabled virtual terminal processing on {} terminal", terminal.getType());
            return true;
        } catch (IOException | RuntimeException e) {
            logger.warn("An error occurred while enabling ANSI codes support: {}", e.getMessage());
            return false;
        }
    }

    private static boolean isWindows(String osName) {
        return osName != null && osName.toLowerCase(Locale.ROOT).startsWith("windows");
    }
}
