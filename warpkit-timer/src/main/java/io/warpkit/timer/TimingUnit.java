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

import io.warpkit.log.WarpkitSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * Display units of timers and benchmarks. Conversions go through a fixed 3x3 factor table
 * indexed by ordinal, so converting a value is one multiplication.
 *
 * @since 1.0.0
 */
public enum TimingUnit {
    MICROSECONDS("us", 1_000L),
    MILLISECONDS("ms", 1_000_000L),
    SECONDS("s", 1_000_000_000L);

    private static final Logger logger = LogManager.getLogger(TimingUnit.class);

    /** {@code TABLE[from][to]} multiplies a value in {@code from} into {@code to}. */
    private static final double[][] TABLE = {
            {1.0, 0.001, 0.000001},
            {1_000.0, 1.0, 0.001},
            {1_000_000.0, 1_000.0, 1.0}
    };

    private final String symbol;
    private final long nanosPerUnit;

    TimingUnit(String symbol, long nanosPerUnit) {
        this.symbol = symbol;
        this.nanosPerUnit = nanosPerUnit;
    }

    /**
     * @return the short display symbol: {@code us}, {@code ms} or {@code s}
     */
    public String symbol() {
        return symbol;
    }

    public double convert(double value, TimingUnit to) {
        return convert(value, this, to);
    }

    public static double convert(double value, TimingUnit from, TimingUnit to) {
        return value * TABLE[from.ordinal()][to.ordinal()];
    }

    /**
     * @param nanos a duration in nanoseconds
     * @return the same duration in this unit
     */
    public double fromNanos(long nanos) {
        return (double) nanos / nanosPerUnit;
    }

    /**
     * Parses a unit from its symbol or name, case-insensitively.
     *
     * @param value {@code us}, {@code ms}, {@code s}, or a long form such as {@code millis}
     * @return the matching unit
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static TimingUnit fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Timing unit must not be null");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "us":
            case "µs":
            case "micros":
            case "microseconds":
                return MICROSECONDS;
            case "ms":
            case "millis":
            case "milliseconds":
                return MILLISECONDS;
            case "s":
            case "sec":
            case "secs":
            case "seconds":
                return SECONDS;
            default:
                throw new IllegalArgumentException(
                    "Unrecognized timing unit '" + value + "'. Expected one of: us, ms, s.");
        }
    }

    /**
     * @return the unit from {@value WarpkitSettings#TIMER_UNIT}, or milliseconds
     */
    public static TimingUnit configured() {
        String value = WarpkitSettings.getString(WarpkitSettings.TIMER_UNIT, MILLISECONDS.symbol);
        try {
            return fromString(value);
        } catch (IllegalArgumentException e) {
            logger.warn("{}; using ms", e.getMessage());
            return MILLISECONDS;
        }
    }
}
