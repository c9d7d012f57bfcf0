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

package io.warpkit.command.bench;

import io.warpkit.command.common.ColorOption;
import io.warpkit.command.common.TimingUnitOption;
import io.warpkit.log.sinks.LogSink;
import io.warpkit.timer.Benchmark;
import io.warpkit.timer.BenchmarkResult;
import io.warpkit.timer.HierarchyTimer;
import io.warpkit.timer.TimingUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;

/// Benchmark a built-in workload and report mean, median and mode
@CommandLine.Command(name = "bench",
    header = "Benchmark a built-in workload",
    description = {
        "Runs a sleeping or spinning workload a number of times inside a hierarchy timer,",
        "after a few warmup runs, and reports the mean, median and mode of the samples."
    })
public class CMD_warpkit_bench implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_warpkit_bench.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ColorOption colorOption = new ColorOption();

    @CommandLine.Mixin
    private TimingUnitOption unitOption = new TimingUnitOption();

    @CommandLine.Option(names = {"-w", "--workload"},
        description = "Workload to run: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "SPIN")
    private Workload workload = Workload.SPIN;

    @CommandLine.Option(names = {"-a", "--amount"},
        description = "Duration of one workload run in microseconds (default: ${DEFAULT-VALUE})",
        defaultValue = "1000")
    private long amountMicros = 1000;

    @CommandLine.Option(names = {"-n", "--samples"},
        description = "Number of measured runs (default: configured sample count, else "
            + Benchmark.DEFAULT_SAMPLES + ")")
    private Integer samples;

    @CommandLine.Option(names = {"--warmup"},
        description = "Number of unmeasured runs before sampling (default: ${DEFAULT-VALUE})",
        defaultValue = "2")
    private int warmup = 2;

    /// Create the bench command
    public CMD_warpkit_bench() {}

    @Override
    public Integer call() {
        validate();
        TimingUnit unit = unitOption.getUnit();
        LogSink sink = colorOption.createSink();
        logger.debug("benchmarking {} for {} us, samples={}, warmup={}", workload, amountMicros, samples, warmup);

        AtomicReference<Optional<BenchmarkResult>> result = new AtomicReference<>(Optional.empty());
        try (HierarchyTimer timer = new HierarchyTimer("bench " + workload.name().toLowerCase(Locale.ROOT), unit, sink)) {
            timer.subTask("warmup", () -> {
                for (int i = 0; i < warmup; i++) {
                    workload.run(amountMicros);
                }
            });
            timer.subTask("samples", () -> {
                Benchmark.Builder benchmark = Benchmark.builder(workload.name().toLowerCase(Locale.ROOT) + " " + amountMicros + " us")
                    .unit(unit)
                    .sink(sink);
                if (samples != null) {
                    benchmark.samples(samples);
                }
                result.set(benchmark.run(() -> workload.run(amountMicros)));
            });
        }

        result.get().ifPresent(r -> logger.debug("benchmark finished: {}", r));
        return 0;
    }

    private void validate() {
        if (amountMicros < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "--amount must not be negative: " + amountMicros);
        }
        if (samples != null && samples < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "--samples must not be negative: " + samples);
        }
        if (warmup < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "--warmup must not be negative: " + warmup);
        }
    }
}
