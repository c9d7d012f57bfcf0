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
import io.warpkit.log.tags.AnsiColor;
import io.warpkit.log.tags.Tag;
import io.warpkit.log.tags.Tags;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * A {@link Sender} that prefixes every line with a wall-clock {@code [HH:mm:ss]} tag.
 *
 * <pre>{@code
 * TimedSender log = new TimedSender(Tags.makeDefault("[SYNC]"));
 * log.info("pulled %d objects", n);   // [14:02:11][SYNC][INFO] : pulled 12 objects
 * }</pre>
 *
 * <p>The rendered timestamp tag is cached and only rebuilt when more than the refresh interval
 * has passed since it was built, so lines logged in a burst share one formatted stamp. The
 * interval defaults to {@link WarpkitSettings#TIMESTAMP_REFRESH_MS}, or one second. A clock that
 * moves backwards also forces a rebuild.</p>
 *
 * <p>The cache is a single immutable holder published through a volatile field; concurrent
 * callers may both rebuild it, but never observe a torn prefix.</p>
 *
 * @since 1.0.0
 */
public class TimedSender extends Sender {

    static final Duration DEFAULT_REFRESH = Duration.ofSeconds(1);
    private static final DateTimeFormatter STAMP_FORMAT = DateTimeFormatter.ofPattern("'['HH:mm:ss']'");

    private final Clock clock;
    private final Duration refresh;
    private volatile AnsiColor timestampColor;
    private volatile Stamp cached;

    public TimedSender(Tag tag) {
        this(tag, ConsoleLogSink.system());
    }

    public TimedSender(Tag tag, LogSink sink) {
        this(Objects.requireNonNull(tag, "tag").text(), sink, WarpkitSettings.DEBUG_ENABLED,
                Clock.systemDefaultZone(), configuredRefresh(), AnsiColor.WHITE);
    }

    public TimedSender(List<Tag> tags) {
        this(tags, ConsoleLogSink.system());
    }

    public TimedSender(List<Tag> tags, LogSink sink) {
        this(Tags.join(tags), sink, WarpkitSettings.DEBUG_ENABLED,
                Clock.systemDefaultZone(), configuredRefresh(), AnsiColor.WHITE);
    }

    protected TimedSender(String context, LogSink sink, boolean debugEnabled, Clock clock,
                          Duration refresh, AnsiColor timestampColor) {
        super(context, sink, debugEnabled);
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(refresh, "refresh");
        if (refresh.isNegative()) {
            throw new IllegalArgumentException("refresh interval must not be negative: " + refresh);
        }
        this.refresh = refresh;
        this.timestampColor = Objects.requireNonNull(timestampColor, "timestampColor");
    }

    /**
     * Starts a builder whose setters and {@code build()} all stay timed.
     *
     * @return a new timed builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public static Builder timedBuilder() {
        return new Builder();
    }

    private static Duration configuredRefresh() {
        return WarpkitSettings.getMillis(WarpkitSettings.TIMESTAMP_REFRESH_MS, DEFAULT_REFRESH);
    }

    /**
     * Drops the cached timestamp; the next line formats the current time.
     */
    public void refreshTimestamp() {
        cached = null;
    }

    /**
     * Changes the color of the timestamp tag. Takes effect on the next line.
     *
     * @param color the new timestamp color
     */
    public void setTimestampColor(AnsiColor color) {
        this.timestampColor = Objects.requireNonNull(color, "color");
        cached = null;
    }

    public AnsiColor getTimestampColor() {
        return timestampColor;
    }

    public Duration getRefreshInterval() {
        return refresh;
    }

    @Override
    protected CharSequence prefix() {
        Instant now = clock.instant();
        Stamp stamp = cached;
        if (stamp == null || stale(stamp.at, now)) {
            stamp = new Stamp(now, Tags.makeColored(timestampColor, formatStamp(now)).text() + context());
            cached = stamp;
        }
        return stamp.prefix;
    }

    private boolean stale(Instant at, Instant now) {
        Duration since = Duration.between(at, now);
        return since.isNegative() || since.compareTo(refresh) > 0;
    }

    private String formatStamp(Instant now) {
        return STAMP_FORMAT.format(now.atZone(clock.getZone()));
    }

    private static final class Stamp {
        private final Instant at;
        private final String prefix;

        private Stamp(Instant at, String prefix) {
            this.at = at;
            this.prefix = prefix;
        }
    }

    /**
     * Builds a {@link TimedSender}; every setting is optional. The inherited setters return this
     * builder, so they chain with the timestamp settings in any order.
     */
    public static final class Builder extends Sender.Builder {
        private Clock clock = Clock.systemDefaultZone();
        private Duration refresh;
        private AnsiColor timestampColor = AnsiColor.WHITE;

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

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder refreshInterval(Duration refresh) {
            this.refresh = Objects.requireNonNull(refresh, "refresh");
            return this;
        }

        public Builder timestampColor(AnsiColor color) {
            this.timestampColor = Objects.requireNonNull(color, "color");
            return this;
        }

        @Override
        public TimedSender build() {
            return new TimedSender(joinedContext(), resolvedSink(), isDebugEnabled(), clock,
                    refresh != null ? refresh : configuredRefresh(), timestampColor);
        }
    }
}
