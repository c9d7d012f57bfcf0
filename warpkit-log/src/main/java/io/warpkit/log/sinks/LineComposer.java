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

package io.warpkit.log.sinks;

import io.warpkit.log.Level;
import org.jline.utils.AttributedString;

/**
 * Builds the text of one output line; shared by the sinks of this package.
 */
final class LineComposer {

    static final String SEPARATOR = " : ";

    /**
     * Clears {@code line} and fills it with {@code context + label + " : " + message + '\n'}.
     * With {@code ansi == false} every ANSI sequence, including those embedded in tags, is
     * stripped from the result.
     */
    static void compose(StringBuilder line, Level level, CharSequence context, CharSequence message, boolean ansi) {
        line.setLength(0);
        line.append(context);
        if (level.hasLabel()) {
            line.append(ansi ? level.getColoredLabel() : level.getLabel());
        }
        if (line.length() > 0) {
            line.append(SEPARATOR);
        }
        line.append(message);
        if (!ansi) {
            String plain = AttributedString.stripAnsi(line.toString());
            line.setLength(0);
            line.append(plain);
        }
        line.append('\n');
    }

    static String compose(Level level, CharSequence context, CharSequence message, boolean ansi) {
        StringBuilder line = new StringBuilder(context.length() + message.length() + 16);
        compose(line, level, context, message, ansi);
        return line.toString();
    }

    private LineComposer() {
    }
}
