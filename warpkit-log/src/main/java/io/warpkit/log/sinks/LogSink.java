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
import io.warpkit.log.Sender;

import java.util.Locale;

/**
 * The serialization point that turns a (level, context, message) triple into one output line.
 * Every {@link Sender} writes through exactly one sink, injected at construction, which lets
 * tests and embedders replace the console with {@link MemoryLogSink} or {@link NoopLogSink}.
 *
 * <h2>Line Format</h2>
 * <pre>{@code <context><level-label> : <message>\n}</pre>
 * <p>{@link Level#MESSAGE} lines have no level label; when both the context and the label are
 * empty the separator is omitted and the line is just the message.</p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>One {@code write} call produces one complete line; lines from concurrent calls never
 *       interleave.</li>
 *   <li>Implementations never throw. Failures are reported, not propagated.</li>
 *   <li>{@link #writef} formats with {@link java.util.Formatter} syntax; a template that cannot
 *       be formatted with the given arguments produces an {@link Level#ERROR} line describing
 *       the failure instead of the message.</li>
 * </ul>
 *
 * <h2>Built-in Implementations</h2>
 * <ul>
 *   <li>{@link ConsoleLogSink} - standard/diagnostic streams behind one lock</li>
 *   <li>{@link MemoryLogSink} - keeps records in memory</li>
 *   <li>{@link NoopLogSink} - discards everything</li>
 * </ul>
 *
 * @see Sender
 * @since 1.0.0
 */
public interface LogSink {

    /**
     * Writes one line built from an already-formatted message.
     *
     * @param level the severity, which selects label, color and stream
     * @param context the pre-joined tag context, possibly empty
     * @param message the message text, written verbatim
     */
    void write(Level level, CharSequence context, CharSequence message);

    /**
     * Formats the template with the arguments and writes the result as one line.
     *
     * @param level the severity
     * @param context the pre-joined tag context, possibly empty
     * @param template a {@link java.util.Formatter} template
     * @param args the template arguments
     */
    default void writef(Level level, CharSequence context, String template, Object... args) {
        String message;
        try {
            message = String.format(Locale.ROOT, template, args);
        } catch (RuntimeException e) {
            write(Level.ERROR, context, describeFormatFailure(level, template, e));
            return;
        }
        write(level, context, message);
    }

    /**
     * Builds the text of the line emitted in place of a message that failed to format.
     *
     * @param level the level the message was logged at
     * @param template the template that failed
     * @param failure the formatting failure
     * @return a one-line description of the failure
     */
    static String describeFormatFailure(Level level, String template, RuntimeException failure) {
        return "failed to format " + level.name() + " message \"" + template + "\": "
                + failure.getClass().getSimpleName()
                + (failure.getMessage() == null ? "" : ": " + failure.getMessage());
    }
}
