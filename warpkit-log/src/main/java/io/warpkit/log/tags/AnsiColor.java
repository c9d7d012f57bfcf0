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

package io.warpkit.log.tags;

/**
 * ANSI foreground colors usable for tags and level labels. Each constant carries its SGR code
 * and a pre-built start sequence, so wrapping text never formats a number at log time.
 *
 * <p>The standard colors use codes 30-37, the bright variants 90-97, and {@link #DEFAULT}
 * (code 39) selects the terminal's own foreground color.</p>
 *
 * @see Tags#makeColored(AnsiColor, String)
 * @since 1.0.0
 */
public enum AnsiColor {
    BLACK(30),
    RED(31),
    GREEN(32),
    YELLOW(33),
    BLUE(34),
    MAGENTA(35),
    CYAN(36),
    WHITE(37),
    DEFAULT(39),

    LIGHT_BLACK(90),
    LIGHT_RED(91),
    LIGHT_GREEN(92),
    LIGHT_YELLOW(93),
    LIGHT_BLUE(94),
    LIGHT_MAGENTA(95),
    LIGHT_CYAN(96),
    LIGHT_WHITE(97);

    /**
     * The escape sequence that resets every attribute. Always appended after colored text.
     */
    public static final String RESET = "\u001B[0m";

    private final int code;
    private final String start;

    AnsiColor(int code) {
        this.code = code;
        this.start = "\u001B[" + code + "m";
    }

    /**
     * @return the numeric SGR code of this color
     */
    public int getCode() {
        return code;
    }

    /**
     * @return the escape sequence that switches the foreground to this color
     */
    public String start() {
        return start;
    }

    /**
     * Wraps text in this color, always terminated by {@link #RESET}.
     *
     * @param text the text to color
     * @return the color-wrapped text
     */
    public String wrap(CharSequence text) {
        return new StringBuilder(start.length() + text.length() + RESET.length())
                .append(start)
                .append(text)
                .append(RESET)
                .toString();
    }
}
