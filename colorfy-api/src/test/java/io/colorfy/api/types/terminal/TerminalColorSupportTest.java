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

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class TerminalColorSupportTest {

    @Test
    public void testDetectColorDepthWithNoEnvVars() {
        assertThat(TerminalColorSupport.detectColorDepth(new HashMap<>())).isEqualTo(ColorDepth.NOCOLOR);
    }

    @Test
    public void testDetectColorDepthWithColorTerm() {
        Map<String, String> env = new HashMap<>();

        env.put("COLORTERM", "truecolor");
        assertThat(TerminalColorSupport.detectColorDepth(env)).isEqualTo(ColorDepth.ANSI24BITCOLOR);

        env.put("COLORTERM", "24BIT");
        assertThat(TerminalColorSupport.detectColorDepth(env)).isEqualTo(ColorDepth.ANSI24BITCOLOR);

        env.put("COLORTERM", "256color");
        assertThat(TerminalColorSupport.detectColorDepth(env)).isEqualTo(ColorDepth.ANSI256COLOR);

        env.put("COLORTERM", "yes");
        assertThat(TerminalColorSupport.detectColorDepth(env)).isEqualTo(ColorDepth.ANSI8COLOR);
    }

    @Test
    public void testDetectColorDepthWithTerm() {
        assertThat(TerminalColorSupport.detectColorDepth(Map.of("TERM", "xterm-256color")))
            .isEqualTo(ColorDepth.ANSI256COLOR);
        assertThat(TerminalColorSupport.detectColorDepth(Map.of("TERM", "xterm-color")))
            .isEqualTo(ColorDepth.ANSI8COLOR);
        assertThat(TerminalColorSupport.detectColorDepth(Map.of("TERM", "dumb")))
            .isEqualTo(ColorDepth.NOCOLOR);
    }

    @Test
    public void testColorTermTakesPrecedenceOverTerm() {
        Map<String, String> env = Map.of("COLORTERM", "truecolor", "TERM", "dumb");
        assertThat(TerminalColorSupport.detectColorDepth(env)).isEqualTo(ColorDepth.ANSI24BITCOLOR);
    }

    @Test
    public void testNoColorOverridesEverything() {
        Map<String, String> env = Map.of("NO_COLOR", "1", "COLORTERM", "truecolor", "TERM", "xterm-256color");
        assertThat(TerminalColorSupport.detectColorDepth(env)).isEqualTo(ColorDepth.NOCOLOR);

        Map<String, String> empty = Map.of("NO_COLOR", "", "COLORTERM", "truecolor");
        assertThat(TerminalColorSupport.detectColorDepth(empty)).isEqualTo(ColorDepth.ANSI24BITCOLOR);
    }

    @Test
    public void testFunctionAccessor() {
        assertThat(TerminalColorSupport.detectColorDepth(name -> "TERM".equals(name) ? "screen-256color" : null))
            .isEqualTo(ColorDepth.ANSI256COLOR);
    }
}
