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

import io.warpkit.log.Level;
import io.warpkit.log.sinks.MemoryLogSink;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class BenchmarkTest {

    private final MemoryLogSink sink = new MemoryLogSink();
    private final FakeNanoClock clock = new FakeNanoClock();

    @Test
    void runsExactlySampleCountTimes() {
        AtomicInteger runs = new AtomicInteger();
        Benchmark.builder("count").samples(5).sink(sink).nanoClock(clock).run(runs::incrementAndGet);
        assertEquals(5, runs.get());
    }

    @Test
    void reportsMeanMedianAndMode() {
        double[] durations = {1.0, 3.0, 2.0, 2.0, 7.0};
        AtomicInteger run = new AtomicInteger();

        Optional<BenchmarkResult> result = Benchmark.builder("steps")
                .samples(durations.length)
                .unit(TimingUnit.MILLISECONDS)
                .sink(sink)
                .nanoClock(clock)
                .run(() -> clock.advanceMillis(durations[run.getAndIncrement()]));

        BenchmarkResult stats = result.orElseThrow();
        assertEquals(3.0, stats.mean(), 1e-9);
        assertEquals(2.0, stats.median(), 1e-9);
        assertEquals(2.0, stats.mode(), 1e-9);

        assertEquals(1, sink.size());
        assertEquals(Level.INFO, sink.records().get(0).level);
        assertThat(sink.lines().get(0).split("\n")).containsExactly(
                "[TIMER][BENCHMARK][INFO] : steps",
                "  [MEAN]   : 3.000 ms",
                "  [MEDIAN] : 2.000 ms",
                "  [MODE]   : 2.000 ms");
    }

    @Test
    void displayUnitConvertsStatistics() {
        BenchmarkResult stats = Benchmark.builder("us")
                .samples(2)
                .unit(TimingUnit.MICROSECONDS)
                .sink(sink)
                .nanoClock(clock)
                .run(() -> clock.advanceMillis(1.5))
                .orElseThrow();
        assertEquals(1500.0, stats.mean(), 1e-6);
        assertThat(sink.lines().get(0)).contains("[MEAN]   : 1500.000 us");
    }

    @Test
    void zeroSamplesWarnsWithoutStatistics() {
        AtomicInteger runs = new AtomicInteger();
        Optional<BenchmarkResult> result = Benchmark.builder("nothing")
                .samples(0).sink(sink).nanoClock(clock).run(runs::incrementAndGet);

        assertTrue(result.isEmpty());
        assertEquals(0, runs.get());
        assertEquals(List.of("[TIMER][BENCHMARK][WARN] : Trying to benchmark empty results"), sink.lines());
    }

    @Test
    void negativeSamplesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Benchmark.builder("bad").samples(-1));
        assertThrows(IllegalArgumentException.class, () -> Benchmark.run("bad", () -> { }, -3));
    }

    @Test
    void defaultSampleCount() {
        AtomicInteger runs = new AtomicInteger();
        Benchmark.builder("default").sink(sink).nanoClock(clock).run(runs::incrementAndGet);
        assertEquals(Benchmark.DEFAULT_SAMPLES, runs.get());
    }
}
