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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * Controls whether a sink emits ANSI color sequences.
 *
 * <ul>
 *   <li><strong>ANSI:</strong> lines keep the color sequences of their tags and level labels.</li>
 *   <li><strong>PLAIN:</strong> every ANSI sequence is removed before the line is written, for
 *       dumb terminals, log files and captured output.</li>
 *   <li><strong>AUTO:</strong> resolved once through {@link #detect()}.</li>
 * </ul>
 *
 * <p>Environment detection:</p>
 * <ol>
 *   <li>{@code NO_COLOR} set to a non-empty value → PLAIN</li>
 *   <li>{@code TERM} unset or {@code "dumb"} → PLAIN</li>
 *   <li>otherwise → ANSI</li>
 * </ol>
 *
 * @since 1.0.0
 */
public enum ColorMode {
    AUTO("auto"),
    ANSI("ansi"),
    PLAIN("plain");

    private static final Logger logger = LogManager.getLogger(ColorMode.class);

    private final String propertyValue;

    ColorMode(String propertyValue) {
        this.propertyValue = propertyValue;
    }

    /**
     * @return the value used for the {@value WarpkitSettings#COLOR} setting
     */
    public String getPropertyValue() {
        return propertyValue;
    }

    /**
     * Parses a mode name, case-insensitively, accepting a few common aliases.
     *
     * <ul>
     *   <li><strong>AUTO:</strong> "auto", "default", "" (empty string)</li>
     *   <li><strong>ANSI:</strong> "ansi", "color", "colour", "always", "on"</li>
     *   <li><strong>PLAIN:</strong> "plain", "none", "never", "off", "text"</li>
     * </ul>
     *
     * @param value the text to parse
     * @return the matching mode, or AUTO when the value is null
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static ColorMode fromString(String value) {
        if (value == null) {
            return AUTO;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "ansi":
            case "color":
            case "colour":
            case "always":
            case "on":
                return ANSI;
            case "plain":
            case "none":
            case "never":
            case "off":
            case "text":
                return PLAIN;
            case "auto":
            case "default":
            case "":
                return AUTO;
            default:
                throw new IllegalArgumentException(
                    "Unrecognized color mode '" + value + "'. Expected one of: auto, ansi, plain.");
        }
    }

    /**
     * Reads the {@value WarpkitSettings#COLOR} setting, falling back to AUTO on bad values.
     *
     * @return the configured mode, possibly AUTO
     */
    public static ColorMode configured() {
        String value = WarpkitSettings.getString(WarpkitSettings.COLOR, AUTO.propertyValue);
        try {
            return fromString(value);
        } catch (IllegalArgumentException e) {
            logger.warn("{}; using auto", e.getMessage());
            return AUTO;
        }
    }

    /**
     * Picks ANSI or PLAIN from the environment.
     *
     * @return the detected mode, never AUTO
     */
    public static ColorMode detect() {
        String noColor = System.getenv("NO_COLOR");
        if (noColor != null && !noColor.isEmpty()) {
            return PLAIN;
        }
        String term = System.getenv("TERM");
        if (term == null || term.equals("dumb")) {
            return PLAIN;
        }
        return ANSI;
    }

    /**
     * @return this mode, or the detected mode when this is AUTO
     */
    public ColorMode resolve() {
        return this == AUTO ? detect() : this;
    }

    /**
     * @return true if lines written in this mode keep their color sequences
     */
    public boolean emitsAnsi() {
        return resolve() == ANSI;
    }
}
