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

import io.warpkit.log.sinks.ConsoleLogSink;
import io.warpkit.log.sinks.LogSink;
import io.warpkit.log.tags.Tag;
import io.warpkit.log.tags.Tags;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A leveled console logger bound to a fixed context of one or more {@link Tag}s. The tags are
 * joined once, at construction, and the resulting context string is reused by every call.
 *
 * <p>Every method comes in a template form using {@link java.util.Formatter} syntax. Without
 * arguments the template is written verbatim, so a message containing {@code %} needs no
 * escaping:</p>
 * <pre>{@code
 * private static final Sender log = new Sender(Tags.makeColored(AnsiColor.BLUE, "[LOADER]"));
 *
 * log.info("loaded %d rows in %.2f s", rows, seconds);  // [LOADER][INFO] : loaded 10 rows in 0.42 s
 * log.msg("100% done");                                 // [LOADER] : 100% done
 * log.warn("retrying %s", host);                        // to standard error
 * log.dbg(() -> expensiveDump());                       // only when debug logging is enabled
 * }</pre>
 *
 * <h2>Debug Logging</h2>
 * <p>{@code dbg} calls return immediately when debug logging is disabled, before any argument is
 * formatted; the {@link Supplier} form is not even invoked. Arguments of the template form are
 * still evaluated at the call site, so expensive values belong in a supplier. The process-wide default is the
 * build-time constant {@link WarpkitSettings#DEBUG_ENABLED}.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>A sender holds no mutable state and can be shared freely; line atomicity is provided by its
 * {@link LogSink}.</p>
 *
 * @see TimedSender
 * @see HierarchySender
 * @see LogSink
 * @since 1.0.0
 */
public class Sender {

    private final String context;
    private final LogSink sink;
    private final boolean debugEnabled;

    /**
     * Creates a sender writing to {@link ConsoleLogSink#system()}.
     *
     * @param tag the single context tag
     */
    public Sender(Tag tag) {
        this(tag, ConsoleLogSink.system());
    }

    public Sender(Tag tag, LogSink sink) {
        this(Objects.requireNonNull(tag, "tag").text(), sink, WarpkitSettings.DEBUG_ENABLED);
    }

    /**
     * Creates a sender writing to {@link ConsoleLogSink#system()}.
     *
     * @param tags the context tags, joined without delimiter
     */
    public Sender(List<Tag> tags) {
        this(tags, ConsoleLogSink.system());
    }

    public Sender(List<Tag> tags, LogSink sink) {
        this(Tags.join(tags), sink, WarpkitSettings.DEBUG_ENABLED);
    }

    protected Sender(String context, LogSink sink, boolean debugEnabled) {
        this.context = Objects.requireNonNull(context, "context");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.debugEnabled = debugEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the pre-joined context string
     */
    public String context() {
        return context;
    }

    public LogSink sink() {
        return sink;
    }

    public boolean isDebugEnabled() {
        return debugEnabled;
    }

    public void msg(String template, Object... args) {
        emit(Level.MESSAGE, prefix(), template, args);
    }

    public void info(String template, Object... args) {
        emit(Level.INFO, prefix(), template, args);
    }

    public void warn(String template, Object... args) {
        emit(Level.WARN, prefix(), template, args);
    }

    public void err(String template, Object... args) {
        emit(Level.ERROR, prefix(), template, args);
    }

    /**
     * Logs a debug line when debug logging is enabled. When it is disabled nothing is formatted,
     * but the arguments have already been evaluated by the caller; pass expensive values through
     * {@link #dbg(Supplier)} instead.
     *
     * @param template the message or template
     * @param args template arguments, possibly none
     */
    public void dbg(String template, Object... args) {
        if (!debugEnabled) {
            return;
        }
        emit(Level.DEBUG, prefix(), template, args);
    }

    /**
     * Logs a lazily built debug message. The supplier is only invoked when debug logging is
     * enabled.
     *
     * @param message supplies the message text
     */
    public void dbg(Supplier<String> message) {
        if (!debugEnabled) {
            return;
        }
        emit(Level.DEBUG, prefix(), String.valueOf(message.get()), null);
    }

    /**
     * Logs at an explicit level. DEBUG is subject to the same switch as {@code dbg}.
     *
     * @param level the severity
     * @param template the message or template
     * @param args template arguments, possibly none
     */
    public void log(Level level, String template, Object... args) {
        if (level == Level.DEBUG && !debugEnabled) {
            return;
        }
        emit(level, prefix(), template, args);
    }

    /**
     * Logs one line with an extra tag appended after this sender's context, for this call only.
     *
     * <pre>{@code
     * timerLog.tagged(Level.MESSAGE, elapsedTag, "parse"); // [TIMER][1.204 ms] : parse
     * }</pre>
     *
     * @param level the severity
     * @param extra the tag to append after the context
     * @param template the message or template
     * @param args template arguments, possibly none
     */
    public void tagged(Level level, Tag extra, String template, Object... args) {
        if (level == Level.DEBUG && !debugEnabled) {
            return;
        }
        emit(level, prefix() + extra.text(), template, args);
    }

    /**
     * The text written before the level label. Subclasses add to the plain context here.
     *
     * @return the line prefix for the next call
     */
    protected CharSequence prefix() {
        return context;
    }

    protected final void emit(Level level, CharSequence prefix, String template, Object[] args) {
        if (args == null || args.length == 0) {
            sink.write(level, prefix, String.valueOf(template));
        } else {
            sink.writef(level, prefix, template, args);
        }
    }

    /**
     * Builds a {@link Sender} from tags, an optional delimiter and an optional sink.
     *
     * <pre>{@code
     * Sender log = Sender.builder()
     *     .tag(Tags.makeDefault("[APP]"))
     *     .tag(Tags.makeColored(AnsiColor.CYAN, "[NET]"))
     *     .delimiter(" ")
     *     .sink(memorySink)
     *     .build();
     * }</pre>
     */
    public static class Builder {
        private final List<Tag> tags = new ArrayList<>();
        private String delimiter = "";
        private LogSink sink;
        private boolean debugEnabled = WarpkitSettings.DEBUG_ENABLED;

        protected Builder() {
        }

        public Builder tag(Tag tag) {
            tags.add(Objects.requireNonNull(tag, "tag"));
            return this;
        }

        public Builder tags(Tag... tags) {
            return tags(Arrays.asList(tags));
        }

        public Builder tags(List<Tag> tags) {
            for (Tag tag : tags) {
                tag(tag);
            }
            return this;
        }

        public Builder delimiter(String delimiter) {
            this.delimiter = Objects.requireNonNull(delimiter, "delimiter");
            return this;
        }

        public Builder sink(LogSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        /**
         * Overrides the process-wide debug switch for the built sender.
         *
         * @param enabled whether {@code dbg} calls emit lines
         * @return this builder
         */
        public Builder debug(boolean enabled) {
            this.debugEnabled = enabled;
            return this;
        }

        /**
         * @return the tags added so far, joined with the delimiter
         */
        protected String joinedContext() {
            return Tags.join(tags, delimiter);
        }

        /**
         * @return the configured sink, or {@link ConsoleLogSink#system()} when none was set
         */
        protected LogSink resolvedSink() {
            return sink != null ? sink : ConsoleLogSink.system();
        }

        protected boolean isDebugEnabled() {
            return debugEnabled;
        }

        public Sender build() {
            return new Sender(joinedContext(), resolvedSink(), debugEnabled);
        }
    }
}
