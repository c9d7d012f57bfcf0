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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A {@link Sender} whose methods also take a nesting depth, rendered as a repeated indent in
 * front of the context:
 *
 * <pre>{@code
 * HierarchySender log = new HierarchySender(Tags.makeDefault("[STEP]"));
 * log.msg(0, "load");     // [STEP] : load
 * log.msg(1, "parse");    //   [STEP] : parse
 * log.msg(2, "tokens");   //     [STEP] : tokens
 * }</pre>
 *
 * <p>The sender holds no depth of its own; callers pass it on every call. Prefixes for each
 * depth are built once and reused.</p>
 *
 * @since 1.0.0
 */
public class HierarchySender extends Sender {

    public static final String DEFAULT_INDENT = "  ";

    private final String indent;
    private volatile String[] prefixes;

    public HierarchySender(Tag tag) {
        this(tag, ConsoleLogSink.system());
    }

    public HierarchySender(Tag tag, LogSink sink) {
        this(Objects.requireNonNull(tag, "tag").text(), sink, WarpkitSettings.DEBUG_ENABLED, DEFAULT_INDENT);
    }

    public HierarchySender(List<Tag> tags) {
        this(tags, ConsoleLogSink.system());
    }

    public HierarchySender(List<Tag> tags, LogSink sink) {
        this(Tags.join(tags), sink, WarpkitSettings.DEBUG_ENABLED, DEFAULT_INDENT);
    }

    public HierarchySender(List<Tag> tags, LogSink sink, String indent) {
        this(Tags.join(tags), sink, WarpkitSettings.DEBUG_ENABLED, indent);
    }

    protected HierarchySender(String context, LogSink sink, boolean debugEnabled, String indent) {
        super(context, sink, debugEnabled);
        this.indent = Objects.requireNonNull(indent, "indent");
        this.prefixes = new String[]{context};
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getIndent() {
        return indent;
    }

    public void msg(int depth, String template, Object... args) {
        emit(Level.MESSAGE, prefixAt(depth), template, args);
    }

    public void info(int depth, String template, Object... args) {
        emit(Level.INFO, prefixAt(depth), template, args);
    }

    public void warn(int depth, String template, Object... args) {
        emit(Level.WARN, prefixAt(depth), template, args);
    }

    public void err(int depth, String template, Object... args) {
        emit(Level.ERROR, prefixAt(depth), template, args);
    }

    public void dbg(int depth, String template, Object... args) {
        if (!isDebugEnabled()) {
            return;
        }
        emit(Level.DEBUG, prefixAt(depth), template, args);
    }

    public void log(int depth, Level level, String template, Object... args) {
        if (level == Level.DEBUG && !isDebugEnabled()) {
            return;
        }
        emit(level, prefixAt(depth), template, args);
    }

    /**
     * Depth form of {@link Sender#tagged(Level, Tag, String, Object...)}.
     *
     * @param depth the nesting depth, zero or more
     * @param level the severity
     * @param extra the tag to append after the context
     * @param template the message or template
     * @param args template arguments, possibly none
     */
    public void tagged(int depth, Level level, Tag extra, String template, Object... args) {
        if (level == Level.DEBUG && !isDebugEnabled()) {
            return;
        }
        emit(level, prefixAt(depth) + extra.text(), template, args);
    }

    /**
     * @param depth the nesting depth
     * @return the indent repeated {@code depth} times, followed by the context
     * @throws IllegalArgumentException if depth is negative
     */
    public String prefixAt(int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative: " + depth);
        }
        String[] known = prefixes;
        if (depth < known.length) {
            return known[depth];
        }
        return grow(depth);
    }

    private synchronized String grow(int depth) {
        String[] known = prefixes;
        if (depth < known.length) {
            return known[depth];
        }
        String[] larger = Arrays.copyOf(known, Math.max(depth + 1, known.length * 2));
        for (int i = known.length; i < larger.length; i++) {
            larger[i] = indent.repeat(i) + context();
        }
        prefixes = larger;
        return larger[depth];
    }

    /**
     * Builds a {@link HierarchySender} with an optional indent, {@link #DEFAULT_INDENT} unless set.
     */
    public static final class Builder extends Sender.Builder {
        private String indent = DEFAULT_INDENT;

        private Builder() {
        }

        @Override
        public Builder tag(Tag tag) {
            super.tag(tag);
            return this;
        }

        @Override
        public Builder tags(Tag... tags) {
            super.tags(tags);
            return this;
        }

        @Override
        public Builder tags(List<Tag> tags) {
            super.tags(tags);
            return this;
        }

        @Override
        public Builder delimiter(String delimiter) {
            super.delimiter(delimiter);
            return this;
        }

        @Override
        public Builder sink(LogSink sink) {
            super.sink(sink);
            return this;
        }

        @Override
        public Builder debug(boolean enabled) {
            super.debug(enabled);
            return this;
        }

        public Builder indent(String indent) {
            this.indent = Objects.requireNonNull(indent, "indent");
            return this;
        }

        @Override
        public HierarchySender build() {
            return new HierarchySender(joinedContext(), resolvedSink(), isDebugEnabled(), indent);
        }
    }
}
