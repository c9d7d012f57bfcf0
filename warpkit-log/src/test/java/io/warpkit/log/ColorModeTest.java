/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.warpkit.log;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ColorModeTest {

    @ParameterizedTest
    @CsvSource({
            "ansi, ANSI",
            "Color, ANSI",
            "always, ANSI",
            "plain, PLAIN",
            "NEVER, PLAIN",
            "off, PLAIN",
            "auto, AUTO",
            "default, AUTO",
            "'', AUTO"
    })
    void parsesNamesAndAliases(String text, ColorMode expected) {
        assertEquals(expected, ColorMode.fromString(text));
    }

    @Test
    void nullMeansAuto() {
        assertEquals(ColorMode.AUTO, ColorMode.fromString(null));
    }

    @Test
    void unknownNameIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ColorMode.fromString("rainbow"));
        assertTrue(e.getMessage().contains("rainbow"));
    }

    @Test
    void explicitModesResolveToThemselves() {
        assertEquals(ColorMode.ANSI, ColorMode.ANSI.resolve());
        assertEquals(ColorMode.PLAIN, ColorMode.PLAIN.resolve());
        assertTrue(ColorMode.ANSI.emitsAnsi());
        assertFalse(ColorMode.PLAIN.emitsAnsi());
        assertNotEquals(ColorMode.AUTO, ColorMode.AUTO.resolve());
    }

    @Test
    void invalidConfiguredValueFallsBackToAuto() {
        System.setProperty(WarpkitSettings.COLOR, "rainbow");
        try {
            assertEquals(ColorMode.AUTO, ColorMode.configured());
        } finally {
            System.clearProperty(WarpkitSettings.COLOR);
        }
    }
}
