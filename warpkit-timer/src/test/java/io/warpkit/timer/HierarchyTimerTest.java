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

import io.warpkit.log.sinks.MemoryLogSink;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class HierarchyTimerTest {

    private final MemoryLogSink sink = new MemoryLogSink();
    private final FakeNanoClock clock = new FakeNanoClock();

    private HierarchyTimer timer(String description) {
        return new HierarchyTimer(description, TimingUnit.MILLISECONDS, sink, clock);
    }

    @Test
    void bracketsSubTasks() {
        try (HierarchyTimer build = timer("build")) {
            build.subTask("compile", () -> clock.advanceMillis(3.0));
            clock.advanceMillis(1.0);
            build.subTask("link", TimingUnit.MICROSECONDS, () -> clock.advanceMillis(0.5));
        }

        assertThat(sink.lines()).containsExactly(
                "[TIMER] : build {",
                "  [TIMER][SUB][3.000 ms] : compile",
                "  [TIMER][SUB][500.000 us] : link",
                "} [4.500 ms] (sub-tasks: [3.500 ms])");
    }

    @Test
    void ownTotalIsIndependentOfSubTasks() {
        HierarchyTimer timer = timer("gap");
        timer.subTask("a", () -> clock.advanceMillis(2.0));
        clock.advanceMillis(10.0);
        timer.subTask("b", () -> clock.advanceMillis(2.0));

        assertEquals(4.0, timer.subTaskTotal(), 1e-9);
        assertEquals(14.0, timer.stop().orElseThrow(), 1e-9);
    }

    @Test
    void nestedSubTasksAreIndentedButNotCountedTwice() {
        HierarchyTimer timer = timer("outer");
        double outer = timer.subTask("parent", () -> {
            clock.advanceMillis(1.0);
            timer.subTask("child", () -> clock.advanceMillis(2.0));
        });

        assertEquals(3.0, outer, 1e-9);
        assertEquals(3.0, timer.subTaskTotal(), 1e-9);
        assertThat(sink.lines()).containsSubsequence(
                "    [TIMER][SUB][2.000 ms] : child",
                "  [TIMER][SUB][3.000 ms] : parent");
    }

    @Test
    void failingSubTaskIsStillReported() {
        HierarchyTimer timer = timer("faulty");
        assertThrows(IllegalArgumentException.class, () -> timer.subTask("bad", () -> {
            clock.advanceMillis(1.0);
            throw new IllegalArgumentException("bad input");
        }));
        assertEquals(1.0, timer.subTaskTotal(), 1e-9);
        assertEquals("  [TIMER][SUB][1.000 ms] : bad", sink.lines().get(1));

        timer.subTask("next", () -> clock.advanceMillis(1.0));
        assertEquals("  [TIMER][SUB][1.000 ms] : next", sink.lines().get(2));
    }

    @Test
    void cannotRestartOrReset() {
        HierarchyTimer timer = timer("fixed");
        assertThrows(UnsupportedOperationException.class, timer::start);
        assertThrows(UnsupportedOperationException.class, timer::reset);
    }

    @Test
    void subTaskAfterStopIsRejected() {
        HierarchyTimer timer = timer("done");
        timer.stop();
        assertThrows(IllegalStateException.class, () -> timer.subTask("late", () -> { }));
    }
}
