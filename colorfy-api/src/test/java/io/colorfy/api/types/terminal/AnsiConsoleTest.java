package io.colorfy.api.types.terminal;

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

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.fail;

public class AnsiConsoleTest {

    @Test
    public void testNonWindowsNeedsNoTerminal() {
        boolean enabled = AnsiConsole.enable("Linux", () -> fail("terminal should not be opened"));
        assertThat(enabled).isTrue();

        assertThat(AnsiConsole.enable("Mac OS X", () -> fail("terminal should not be opened"))).isTrue();
    }

    @Test
    public void testWindowsFailureIsNotFatal() {
        boolean enabled = AnsiConsole.enable("Windows 10", () -> {
            throw new IOException("no console attached");
        });
        assertThat(enabled).isFalse();

        assertThat(AnsiConsole.enable("Windows Server 2022", () -> {
            throw new IllegalStateException("unsupported");
        })).isFalse();
    }

    @Test
    public void testInitIsIdempotent() {
        assertThatNoException().isThrownBy(() -> {
            AnsiConsole.init();
            AnsiConsole.init();
        });
        assertThat(AnsiConsole.isInitialized()).isTrue();
    }
}
