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

import io.warpkit.log.tags.AnsiColor;
import io.warpkit.log.tags.Tag;
import io.warpkit.log.tags.Tags;

import java.util.Locale;

/**
 * Renders elapsed values as {@code [1.234 ms]}, with three decimals and a dot separator in
 * every locale.
 */
public final class ElapsedFormat {

    public static final AnsiColor COLOR = AnsiColor.YELLOW;

    public static String format(double value, TimingUnit unit) {
        return String.format(Locale.ROOT, "[%.3f %s]", value, unit.symbol());
    }

    /**
     * @return the formatted value as a yellow tag
     */
    public static Tag tag(double value, TimingUnit unit) {
        return Tags.makeColored(COLOR, format(value, unit));
    }

    private ElapsedFormat() {
        throw new UnsupportedOperationException("Utility class should not be instantiated");
    }
}
