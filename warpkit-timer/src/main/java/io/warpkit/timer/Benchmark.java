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

import io.warpkit.log.Sender;
import io.warpkit.log.WarpkitSettings;
import io.warpkit.log.sinks.LogSink;
import io.warpkit.log.tags.AnsiColor;
import io.warpkit.log.tags.Tag;
import io.warpkit.log.tags.Tags;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/// Runs a task a fixed number of times and reports the mean, median and mode of its run time.
///
/// ```
/// Benchmark.run("hash 1 MiB", () -> digest.digest(block), 16);
/// // [TIMER][BENCHMARK][INFO] : hash 1 MiB
/// //   [MEAN]   : 1.204 ms
/// //   [MEDIAN] : 1.187 ms
/// //   [MODE]   : 1.170 ms
/// ```
///
/// Samples are taken in milliseconds and converted to the display unit once the statistics are
/// computed. A sample count of zero logs a warning and yields no result.
public final class Benchmark {

    private static final Logger logger = LogManager.getLogger(Benchmark.class);

    public static final int DEFAULT_SAMPLES = 8;
    public static final Tag BENCHMARK_TAG = Tags.makeColored(AnsiColor.BLUE, "[TIMER][BENCHMARK]");

    private static final Tag MEAN_TAG = Tags.makeColored(AnsiColor.GREEN, "[MEAN]");
    private static final Tag MEDIAN_TAG = Tags.makeColored(AnsiColor.GREEN, "[MEDIAN]");
    private static final Tag MODE_TAG = Tags.makeColored(AnsiColor.GREEN, "[MODE]");

    private final String description;
    private final int samples;
    private final TimingUnit unit;
    private final Sender sender;
    private final LongSupplier nanoClock;

    private Benchmark(Builder builder) {
        this.description = builder.description;
        this.samples = builder.samples != null ? builder.samples : configuredSamples();
        this.unit = builder.unit != null ? builder.unit : TimingUnit.configured();
        if (builder.sender != null) {
            this.sender = builder.sender;
        } else if (builder.sink != null) {
            this.sender = new Sender(BENCHMARK_TAG, builder.sink);
        } else {
            this.sender = new Sender(BENCHMARK_TAG);
        }
        this.nanoClock = builder.nanoClock;
    }

    public static Builder builder(String description) {
        return new Builder(description);
    }

    /// Benchmarks with the configured sample count, [#DEFAULT_SAMPLES] unless overridden.
    public static Optional<BenchmarkResult> run(String description, Runnable task) {
        return builder(description).run(task);
    }

    public static Optional<BenchmarkResult> run(String description, Runnable task, int samples) {
        return builder(description).samples(samples).run(task);
    }

    static int configuredSamples() {
        int configured = WarpkitSettings.getInt(WarpkitSettings.BENCH_SAMPLES, DEFAULT_SAMPLES);
        if (configured < 0) {
            logger.warn("negative sample count {} for {}, using {}", configured,
                    WarpkitSettings.BENCH_SAMPLES, DEFAULT_SAMPLES);
            return DEFAULT_SAMPLES;
        }
        return configured;
    }

    private Optional<BenchmarkResult> execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        if (samples == 0) {
            sender.warn("Trying to benchmark empty results");
            return Optional.empty();
        }

        double[] millis = new double[samples];
        for (int i = 0; i < samples; i++) {
            long begin = nanoClock.getAsLong();
            task.run();
            millis[i] = TimingUnit.MILLISECONDS.fromNanos(nanoClock.getAsLong() - begin);
        }
        logger.debug("collected {} samples for '{}'", samples, description);

        BenchmarkResult result = SampleStatistics.summarize(description, millis, unit);
        sender.info(render(result));
        return Optional.of(result);
    }

    static String render(BenchmarkResult result) {
        String symbol = result.unit().symbol();
        StringBuilder report = new StringBuilder(result.description());
        report.append(String.format(Locale.ROOT, "\n  %s   : %.3f %s", MEAN_TAG.text(), result.mean(), symbol));
        report.append(String.format(Locale.ROOT, "\n  %s : %.3f %s", MEDIAN_TAG.text(), result.median(), symbol));
        report.append(String.format(Locale.ROOT, "\n  %s   : %.3f %s", MODE_TAG.text(), result.mode(), symbol));
        return report.toString();
    }

    /// Configures and runs one benchmark. Every setting is optional.
    public static final class Builder {
        private final String description;
        private Integer samples;
        private TimingUnit unit;
        private Sender sender;
        private LogSink sink;
        private LongSupplier nanoClock = System::nanoTime;

        private Builder(String description) {
            this.description = Objects.requireNonNull(description, "description");
        }

        /// Sets the number of runs; zero is allowed and produces a warning instead of a result.
        ///
        /// @throws IllegalArgumentException if the count is negative
        public Builder samples(int samples) {
            if (samples < 0) {
                throw new IllegalArgumentException("sample count must not be negative: " + samples);
            }
            this.samples = samples;
            return this;
        }

        public Builder unit(TimingUnit unit) {
            this.unit = Objects.requireNonNull(unit, "unit");
            return this;
        }

        public Builder sender(Sender sender) {
            this.sender = Objects.requireNonNull(sender, "sender");
            return this;
        }

        /// Reports through a `[TIMER][BENCHMARK]` sender on this sink; ignored when a sender is set.
        public Builder sink(LogSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder nanoClock(LongSupplier nanoClock) {
            this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
            return this;
        }

        /// Runs the task the configured number of times and reports the statistics.
        ///
        /// @param task the work to sample
        /// @return the statistics, or empty for a sample count of zero
        public Optional<BenchmarkResult> run(Runnable task) {
            return new Benchmark(this).execute(task);
        }
    }
}
