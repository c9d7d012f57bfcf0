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

import java.util.Objects;

/**
 * One line captured by a {@link MemoryLogSink}: its level, its context and its message as
 * they were handed to the sink, plus the rendered line.
 *
 * @since 1.0.0
 */
public final class LogRecord {
    public final Level level;
    public final String context;
    public final String message;
    /** The composed line, without its trailing newline. */
    public final String line;

    public LogRecord(Level level, String context, String message, String line) {
        this.level = Objects.requireNonNull(level, "level");
        this.context = Objects.requireNonNull(context, "context");
        this.message = Objects.requireNonNull(message, "message");
        this.line = Objects.requireNonNull(line, "line");
    }

    @Override
    public String toString() {
        return "LogRecord[" + level + "] " + line;
    }
}
