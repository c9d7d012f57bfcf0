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

package io.warpkit.timer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class TimingUnitTest {

    @ParameterizedTest
    @CsvSource({
            "MILLISECONDS, MICROSECONDS, 1.5, 1500.0",
            "SECONDS, MILLISECONDS, 2.0, 2000.0",
            "MICROSECONDS, SECONDS, 250000.0, 0.25",
            "SECONDS, MICROSECONDS, 1.0, 1000000.0",
            "MILLISECONDS, MILLISECONDS, 3.25, 3.25"
    })
    void convertsThroughTable(TimingUnit from, TimingUnit to, double value, double expected) {
        assertEquals(expected, TimingUnit.convert(value, from, to), 1e-9);
    }

    @ParameterizedTest
    @EnumSource(TimingUnit.class)
    void roundTripsThroughEveryUnit(TimingUnit unit) {
        for (TimingUnit other : TimingUnit.values()) {
            double there = TimingUnit.convert(123.456, unit, other);
            assertEquals(123.456, TimingUnit.convert(there, other, unit), 1e-9, unit + " via " + other);
        }
    }

    @Test
    void fromNanos() {
        assertEquals(2.0, TimingUnit.MILLISECONDS.fromNanos(2_000_000L), 1e-12);
        assertEquals(1.5, TimingUnit.MICROSECONDS.fromNanos(1_500L), 1e-12);
        assertEquals(0.5, TimingUnit.SECONDS.fromNanos(500_000_000L), 1e-12);
    }

    @Test
    void symbolsAndParsing() {
        assertEquals("us", TimingUnit.MICROSECONDS.symbol());
        assertEquals("ms", TimingUnit.MILLISECONDS.symbol());
        assertEquals("s", TimingUnit.SECONDS.symbol());
        assertEquals(TimingUnit.MILLISECONDS, TimingUnit.fromString(" MS "));
        assertEquals(TimingUnit.MICROSECONDS, TimingUnit.fromString("micros"));
        assertEquals(TimingUnit.SECONDS, TimingUnit.fromString("seconds"));
        assertThrows(IllegalArgumentException.class, () -> TimingUnit.fromString("fortnights"));
        assertThrows(IllegalArgumentException.class, () -> TimingUnit.fromString(null));
    }

    @Test
    void elapsedFormatUsesThreeDecimals() {
        assertEquals("[1.500 ms]", ElapsedFormat.format(1.5, TimingUnit.MILLISECONDS));
        assertEquals("[0.000 s]", ElapsedFormat.format(0.0001, TimingUnit.SECONDS));
        assertEquals("\u001B[33m[12.346 us]\u001B[0m", ElapsedFormat.tag(12.3456, TimingUnit.MICROSECONDS).text());
    }
}
