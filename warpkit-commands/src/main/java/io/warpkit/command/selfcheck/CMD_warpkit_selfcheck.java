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

package io.warpkit.command.selfcheck;

import io.warpkit.check.CheckSummary;
import io.warpkit.check.Registry;
import io.warpkit.check.Suite;
import io.warpkit.command.common.ColorOption;
import io.warpkit.log.Level;
import io.warpkit.log.Sender;
import io.warpkit.log.sinks.LogSink;
import io.warpkit.log.sinks.MemoryLogSink;
import io.warpkit.log.tags.AnsiColor;
import io.warpkit.log.tags.Tag;
import io.warpkit.log.tags.Tags;
import io.warpkit.timer.Benchmark;
import io.warpkit.timer.BenchmarkResult;
import io.warpkit.timer.ElapsedFormat;
import io.warpkit.timer.SampleStatistics;
import io.warpkit.timer.Timer;
import io.warpkit.timer.TimingUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/// Run the toolkit's own checks and exit with 0 when all of them pass
@CommandLine.Command(name = "selfcheck",
    header = "Run the toolkit's self checks",
    description = "Checks statistics, unit conversion, tag joining and line rendering, "
        + "and exits with 1 if any check fails")
public class CMD_warpkit_selfcheck implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_warpkit_selfcheck.class);

    @CommandLine.Mixin
    private ColorOption colorOption = new ColorOption();

    /// Create the selfcheck command
    public CMD_warpkit_selfcheck() {}

    @Override
    public Integer call() {
        LogSink sink = colorOption.createSink();
        try (Registry registry = new Registry("warpkit selfcheck", sink)) {
            registry.addCollection("statistics", List.of(
                () -> checkMedian(registry.suite("median")),
                () -> checkMode(registry.suite("mode")),
                () -> checkMean(registry.suite("mean"))));
            registry.addCollection("units", List.of(
                () -> checkConversions(registry.suite("conversion")),
                () -> checkFormatting(registry.suite("formatting"))));
            registry.addCollection("logging", List.of(
                () -> checkTags(registry.suite("tags")),
                () -> checkLines(registry.suite("lines")),
                () -> checkReports(registry.suite("reports"))));
            int exitCode = registry.conclude();
            logger.debug("selfcheck finished with {}", registry.summary());
            return exitCode;
        }
    }

    static CheckSummary checkMedian(Suite suite) {
        try (suite) {
            suite.checkEquals(SampleStatistics.median(new double[]{1, 3, 5}), 3.0, "median of odd count");
            suite.checkEquals(SampleStatistics.median(new double[]{1, 2, 3, 4}), 2.5, "median of even count");
            suite.checkEquals(SampleStatistics.median(new double[]{9}), 9.0, "median of one sample");
            return suite.summary();
        }
    }

    static CheckSummary checkMode(Suite suite) {
        try (suite) {
            suite.checkEquals(SampleStatistics.mode(new double[]{1, 2, 2, 2, 3, 3}), 2.0, "longest run wins");
            suite.checkEquals(SampleStatistics.mode(new double[]{1, 1, 2, 2}), 1.0, "first run wins a tie");
            suite.checkEquals(SampleStatistics.mode(new double[]{4, 5, 6}), 4.0, "distinct samples give the smallest");
            return suite.summary();
        }
    }

    static CheckSummary checkMean(Suite suite) {
        try (suite) {
            suite.checkClose(SampleStatistics.mean(new double[]{1, 2, 3, 4}), 2.5, 1e-12, "mean of four samples");
            double[] unsorted = {3.0, 1.0, 2.0};
            BenchmarkResult result = SampleStatistics.summarize("sorted", unsorted, TimingUnit.MILLISECONDS);
            suite.check(unsorted[0] == 1.0 && unsorted[2] == 3.0, "summarize sorts in place");
            suite.checkClose(result.mean(), 2.0, 1e-12, "summary mean");
            return suite.summary();
        }
    }

    static CheckSummary checkConversions(Suite suite) {
        try (suite) {
            suite.checkClose(TimingUnit.convert(1.5, TimingUnit.MILLISECONDS, TimingUnit.MICROSECONDS),
                1500.0, 1e-9, "ms to us");
            suite.checkClose(TimingUnit.convert(2.0, TimingUnit.SECONDS, TimingUnit.MILLISECONDS),
                2000.0, 1e-9, "s to ms");
            for (TimingUnit from : TimingUnit.values()) {
                for (TimingUnit to : TimingUnit.values()) {
                    double back = TimingUnit.convert(TimingUnit.convert(42.0, from, to), to, from);
                    suite.checkClose(back, 42.0, 1e-9, from.symbol() + " round trip through " + to.symbol());
                }
            }
            return suite.summary();
        }
    }

    static CheckSummary checkFormatting(Suite suite) {
        try (suite) {
            suite.checkEquals(ElapsedFormat.format(1.5, TimingUnit.MILLISECONDS), "[1.500 ms]", "three decimals");
            suite.checkEquals(ElapsedFormat.format(0.25, TimingUnit.SECONDS), "[0.250 s]", "seconds symbol");
            suite.checkEquals(TimingUnit.fromString("us"), TimingUnit.MICROSECONDS, "parses symbols");
            return suite.summary();
        }
    }

    static CheckSummary checkTags(Suite suite) {
        try (suite) {
            Tag a = Tags.makeDefault("[A]");
            Tag b = Tags.makeDefault("[B]");
            suite.checkEquals(Tags.join(List.of()), "", "empty join");
            suite.checkEquals(Tags.join(List.of(a)), "[A]", "single tag join");
            suite.checkEquals(Tags.join(List.of(a, b), " "), "[A] [B]", "delimiter between tags");
            suite.check(Tags.makeColored(AnsiColor.RED, "x").text().endsWith(AnsiColor.RESET),
                "colored tags end with a reset");
            return suite.summary();
        }
    }

    static CheckSummary checkLines(Suite suite) {
        try (suite) {
            MemoryLogSink memory = new MemoryLogSink();
            Sender sender = Sender.builder().tag(Tags.makeDefault("[X]")).sink(memory).debug(false).build();
            sender.info("n=%d", 3);
            sender.msg("50% verbatim");
            sender.dbg(() -> "hidden");
            sender.warn("%d", "text");
            List<String> lines = memory.lines();
            suite.checkEquals(lines.size(), 3, "disabled debug emits nothing");
            suite.checkEquals(lines.get(0), "[X][INFO] : n=3", "formatted info line");
            suite.checkEquals(lines.get(1), "[X] : 50% verbatim", "message without arguments is verbatim");
            suite.checkEquals(memory.records().get(2).level, Level.ERROR, "format failure becomes an error line");
            return suite.summary();
        }
    }

    static CheckSummary checkReports(Suite suite) {
        try (suite) {
            MemoryLogSink memory = new MemoryLogSink();
            Timer timer = Timer.builder("twice").sink(memory).build();
            timer.stop();
            suite.check(timer.stop().isEmpty(), "second stop returns nothing");
            suite.checkEquals(memory.recordsAt(Level.WARN).size(), 1, "second stop warns");

            Optional<BenchmarkResult> empty = Benchmark.builder("none").samples(0).sink(memory).run(() -> { });
            suite.check(empty.isEmpty(), "zero samples give no result");
            suite.checkEquals(memory.recordsAt(Level.WARN).size(), 2, "zero samples warn");
            return suite.summary();
        }
    }
}
