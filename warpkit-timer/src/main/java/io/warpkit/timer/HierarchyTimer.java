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

import io.warpkit.log.HierarchySender;
import io.warpkit.log.Level;
import io.warpkit.log.Sender;
import io.warpkit.log.sinks.ConsoleLogSink;
import io.warpkit.log.sinks.LogSink;
import io.warpkit.log.tags.AnsiColor;
import io.warpkit.log.tags.Tag;
import io.warpkit.log.tags.Tags;

import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * A {@link Timer} that brackets a group of timed sub-tasks:
 *
 * <pre>{@code
 * try (HierarchyTimer build = new HierarchyTimer("build")) {
 *     build.subTask("compile", this::compile);
 *     build.subTask("link", TimingUnit.MICROSECONDS, this::link);
 * }
 * // [TIMER] : build {
 * //   [TIMER][SUB][812.004 ms] : compile
 * //   [TIMER][SUB][950.112 us] : link
 * // } [813.240 ms] (sub-tasks: [812.954 ms])
 * }</pre>
 *
 * <p>The timer runs from construction until it is stopped or closed, and cannot be restarted.
 * Its own total is measured independently of its sub-tasks, so the gap between the two numbers
 * is the untimed work in between. Sub-tasks may nest; a nested sub-task is reported one level
 * deeper, and only top-level sub-tasks count towards the sub-task sum.</p>
 *
 * @since 1.0.0
 */
public class HierarchyTimer extends Timer {

    public static final Tag SUB_TAG = Tags.makeColored(AnsiColor.BLUE, "[TIMER][SUB]");

    private final HierarchySender subSender;
    private final Sender closer;
    private double subTaskTotal;
    private int depth;

    public HierarchyTimer(String description) {
        this(description, TimingUnit.configured());
    }

    public HierarchyTimer(String description, TimingUnit unit) {
        this(description, unit, ConsoleLogSink.system());
    }

    public HierarchyTimer(String description, TimingUnit unit, LogSink sink) {
        this(description, unit, sink, System::nanoTime);
    }

    protected HierarchyTimer(String description, TimingUnit unit, LogSink sink, LongSupplier nanoClock) {
        super(description, unit, new Sender(TIMER_TAG, Objects.requireNonNull(sink, "sink")), nanoClock, true);
        this.subSender = new HierarchySender(SUB_TAG, sink);
        this.closer = new Sender(Tags.empty(), sink);
        sender().msg("%s {", description);
    }

    /**
     * @throws UnsupportedOperationException always; a hierarchy timer starts at construction
     */
    @Override
    public void start() {
        throw new UnsupportedOperationException("HierarchyTimer starts at construction and cannot be restarted");
    }

    /**
     * @throws UnsupportedOperationException always; a hierarchy timer cannot be reset
     */
    @Override
    public void reset() {
        throw new UnsupportedOperationException("HierarchyTimer cannot be reset");
    }

    public double subTask(String description, Runnable task) {
        return subTask(description, getUnit(), task);
    }

    /**
     * Runs and times one sub-task, then reports it one level below the current nesting depth.
     * The report is written also when the task throws.
     *
     * @param description the reported description
     * @param displayUnit the unit of the reported and returned value
     * @param task the work to time
     * @return the sub-task's elapsed time in {@code displayUnit}
     * @throws IllegalStateException if this timer has been stopped
     */
    public double subTask(String description, TimingUnit displayUnit, Runnable task) {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(displayUnit, "displayUnit");
        Objects.requireNonNull(task, "task");
        if (!isRunning()) {
            throw new IllegalStateException("HierarchyTimer '" + getDescription() + "' has been stopped");
        }

        int level = depth++;
        long begin = nanoTime();
        long elapsedNanos;
        try {
            task.run();
        } finally {
            elapsedNanos = nanoTime() - begin;
            depth = level;
            if (level == 0) {
                subTaskTotal += getUnit().fromNanos(elapsedNanos);
            }
            double shown = displayUnit.fromNanos(elapsedNanos);
            subSender.tagged(level + 1, Level.MESSAGE, ElapsedFormat.tag(shown, displayUnit), description);
        }
        return displayUnit.fromNanos(elapsedNanos);
    }

    /**
     * @return the summed time of the top-level sub-tasks so far, in this timer's unit
     */
    public double subTaskTotal() {
        return subTaskTotal;
    }

    @Override
    protected void report(double elapsed) {
        closer.msg("} %s (sub-tasks: %s)",
                ElapsedFormat.tag(elapsed, getUnit()).text(),
                ElapsedFormat.tag(subTaskTotal, getUnit()).text());
    }
}
