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

import io.warpkit.log.ColorMode;
import io.warpkit.log.Level;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A sink that keeps every line in memory instead of writing it to a stream. Useful to test
 * code that logs, or to embed warpkit output in another display.
 *
 * <pre>{@code
 * MemoryLogSink sink = new MemoryLogSink();
 * Sender log = new Sender(Tags.makeDefault("[T]"), sink);
 * log.warn("disk at %d%%", 91);
 *
 * sink.lines();            // ["[T][WARN] : disk at 91%"]
 * sink.records().get(0);   // level WARN, context "[T]", message "disk at 91%"
 * }</pre>
 *
 * <p>Lines are rendered in {@link ColorMode#PLAIN} unless another mode is given. All methods
 * are thread-safe; accessors return snapshots.</p>
 *
 * @since 1.0.0
 */
public class MemoryLogSink implements LogSink {

    private final boolean ansi;
    private final List<LogRecord> records = new ArrayList<>();

    public MemoryLogSink() {
        this(ColorMode.PLAIN);
    }

    public MemoryLogSink(ColorMode colorMode) {
        this.ansi = Objects.requireNonNull(colorMode, "colorMode").emitsAnsi();
    }

    @Override
    public void write(Level level, CharSequence context, CharSequence message) {
        String line = LineComposer.compose(level, context, message, ansi);
        LogRecord record = new LogRecord(level, context.toString(), message.toString(),
                line.substring(0, line.length() - 1));
        synchronized (records) {
            records.add(record);
        }
    }

    public List<LogRecord> records() {
        synchronized (records) {
            return List.copyOf(records);
        }
    }

    /**
     * @return the rendered lines, without trailing newlines, in write order
     */
    public List<String> lines() {
        return records().stream().map(r -> r.line).collect(Collectors.toList());
    }

    public List<LogRecord> recordsAt(Level level) {
        return records().stream().filter(r -> r.level == level).collect(Collectors.toList());
    }

    /**
     * @return the raw messages, without context or label, in write order
     */
    public List<String> messages() {
        return records().stream().map(r -> r.message).collect(Collectors.toList());
    }

    public int size() {
        synchronized (records) {
            return records.size();
        }
    }

    public void clear() {
        synchronized (records) {
            records.clear();
        }
    }
}
