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

import io.warpkit.log.sinks.MemoryLogSink;
import io.warpkit.log.tags.AnsiColor;
import io.warpkit.log.tags.Tags;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TimedSenderTest {

    private static final Instant NOON = Instant.parse("2024-03-01T12:00:00Z");

    private MutableClock clock;
    private MemoryLogSink sink;
    private TimedSender sender;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOON);
        sink = new MemoryLogSink();
        sender = TimedSender.timedBuilder()
                .tag(Tags.makeDefault("[SYNC]"))
                .sink(sink)
                .clock(clock)
                .refreshInterval(Duration.ofSeconds(1))
                .build();
    }

    @Test
    void prefixesTimestampBeforeContext() {
        sender.info("pulled %d", 12);
        assertEquals(List.of("[12:00:00][SYNC][INFO] : pulled 12"), sink.lines());
    }

    @Test
    void timestampIsCachedWithinInterval() {
        sender.msg("a");
        clock.advance(Duration.ofMillis(1000));
        sender.msg("b");
        clock.advance(Duration.ofMillis(1));
        sender.msg("c");

        assertThat(sink.lines()).containsExactly(
                "[12:00:00][SYNC] : a",
                "[12:00:00][SYNC] : b",
                "[12:00:01][SYNC] : c");
    }

    @Test
    void subMillisecondOverrunRebuildsStamp() {
        clock.set(Instant.parse("2024-03-01T12:00:00.999Z"));
        sender.msg("a");
        clock.advance(Duration.ofNanos(1_000_900_000L));
        sender.msg("b");

        assertThat(sink.lines()).containsExactly(
                "[12:00:00][SYNC] : a",
                "[12:00:01][SYNC] : b");
    }

    @Test
    void exactIntervalKeepsStamp() {
        clock.set(Instant.parse("2024-03-01T12:00:00.999Z"));
        sender.msg("a");
        clock.advance(Duration.ofSeconds(1));
        sender.msg("b");

        assertThat(sink.lines()).containsExactly(
                "[12:00:00][SYNC] : a",
                "[12:00:00][SYNC] : b");
    }

    @Test
    void builderOnSubclassBuildsTimedSender() {
        TimedSender timed = TimedSender.builder()
                .tag(Tags.makeDefault("[A]"))
                .delimiter(" ")
                .tag(Tags.makeDefault("[B]"))
                .sink(sink)
                .clock(clock)
                .refreshInterval(Duration.ofMillis(250))
                .build();

        assertEquals(Duration.ofMillis(250), timed.getRefreshInterval());
        timed.msg("x");
        assertEquals(List.of("[12:00:00][A] [B] : x"), sink.lines());
    }

    @Test
    void refreshIntervalKeepsSubMillisecondPrecision() {
        TimedSender timed = TimedSender.timedBuilder()
                .sink(sink)
                .refreshInterval(Duration.ofNanos(1_500_000))
                .build();
        assertEquals(Duration.ofNanos(1_500_000), timed.getRefreshInterval());
    }

    @Test
    void refreshForcesNewTimestamp() {
        sender.msg("a");
        clock.advance(Duration.ofMillis(400));
        sender.msg("b");
        clock.advance(Duration.ofMillis(700));
        sender.refreshTimestamp();
        sender.msg("c");

        assertThat(sink.lines()).containsExactly(
                "[12:00:00][SYNC] : a",
                "[12:00:00][SYNC] : b",
                "[12:00:01][SYNC] : c");
    }

    @Test
    void clockGoingBackwardsRebuildsStamp() {
        sender.msg("a");
        clock.set(NOON.minusSeconds(3600));
        sender.msg("b");
        assertThat(sink.lines()).containsExactly("[12:00:00][SYNC] : a", "[11:00:00][SYNC] : b");
    }

    @Test
    void timestampColorAppliesToNextLine() {
        MemoryLogSink colored = new MemoryLogSink(ColorMode.ANSI);
        TimedSender timed = TimedSender.timedBuilder().sink(colored).clock(clock).build();
        assertEquals(AnsiColor.WHITE, timed.getTimestampColor());

        timed.msg("white");
        timed.setTimestampColor(AnsiColor.MAGENTA);
        timed.msg("magenta");

        assertThat(colored.lines()).containsExactly(
                "\u001B[37m[12:00:00]\u001B[0m : white",
                "\u001B[35m[12:00:00]\u001B[0m : magenta");
    }

    @Test
    void negativeIntervalIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TimedSender.timedBuilder()
                .sink(sink)
                .refreshInterval(Duration.ofMillis(-1))
                .build());
    }
}
