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

import io.warpkit.log.tags.AnsiColor;

/**
 * Severity of a console line. Each level maps to a fixed label, a fixed color and a fixed
 * destination stream.
 *
 * <table>
 *   <caption>Level mapping</caption>
 *   <tr><th>Level</th><th>Label</th><th>Color</th><th>Stream</th></tr>
 *   <tr><td>MESSAGE</td><td>(none)</td><td>white</td><td>standard output</td></tr>
 *   <tr><td>INFO</td><td>[INFO]</td><td>green</td><td>standard output</td></tr>
 *   <tr><td>DEBUG</td><td>[DEBUG]</td><td>cyan</td><td>standard output</td></tr>
 *   <tr><td>WARN</td><td>[WARN]</td><td>yellow</td><td>diagnostic output</td></tr>
 *   <tr><td>ERROR</td><td>[ERROR]</td><td>red</td><td>diagnostic output</td></tr>
 * </table>
 *
 * <p>{@link #MESSAGE} lines carry no level label at all; they are used for plain reports such as
 * timer results.</p>
 *
 * @since 1.0.0
 */
public enum Level {
    MESSAGE("", AnsiColor.WHITE, false),
    INFO("[INFO]", AnsiColor.GREEN, false),
    DEBUG("[DEBUG]", AnsiColor.CYAN, false),
    WARN("[WARN]", AnsiColor.YELLOW, true),
    ERROR("[ERROR]", AnsiColor.RED, true);

    private final String label;
    private final AnsiColor color;
    private final boolean diagnostic;
    private final String coloredLabel;

    Level(String label, AnsiColor color, boolean diagnostic) {
        this.label = label;
        this.color = color;
        this.diagnostic = diagnostic;
        this.coloredLabel = label.isEmpty() ? "" : color.wrap(label);
    }

    /**
     * @return the bracketed label, empty for {@link #MESSAGE}
     */
    public String getLabel() {
        return label;
    }

    /**
     * @return the label wrapped in this level's color, empty for {@link #MESSAGE}
     */
    public String getColoredLabel() {
        return coloredLabel;
    }

    public AnsiColor getColor() {
        return color;
    }

    /**
     * @return true if lines at this level carry a level label
     */
    public boolean hasLabel() {
        return !label.isEmpty();
    }

    /**
     * @return true if this level routes to the diagnostic (error) stream
     */
    public boolean isDiagnostic() {
        return diagnostic;
    }
}
