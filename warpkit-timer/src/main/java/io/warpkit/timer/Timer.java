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
import io.warpkit.log.Sender;
import io.warpkit.log.sinks.LogSink;
import io.warpkit.log.tags.AnsiColor;
import io.warpkit.log.tags.Tag;
import io.warpkit.log.tags.Tags;

import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.LongSupplier;

/**
 * A stopwatch that reports its elapsed time as one console line when stopped.
 *
 * <pre>{@code
 * try (Timer timer = new Timer("load index")) {
 *     index.load();
 * }
 * // [TIMER][412.337 ms] : load index
 *
 * double ms = Timer.measure("warm cache", cache::warm);
 * }</pre>
 *
 * <h2>Lifecycle</h2>
 * <p>A timer starts running when it is constructed, unless built {@link Builder#deferred()},
 * and is stopped by {@link #stop()} or, when still running, by {@link #close()}. Stopping a
 * stopped timer logs a warning and changes nothing. {@link #reset()} starts over from now.</p>
 *
 * <p>Timers are meant to be used from a single thread.</p>
 *
 * @see HierarchyTimer
 * @see Benchmark
 * @since 1.0.0
 */
public class Timer implements AutoCloseable {

    public static final Tag TIMER_TAG = Tags.makeColored(AnsiColor.BLUE, "[TIMER]");

    private final String description;
    private final TimingUnit unit;
    private final Sender sender;
    private final LongSupplier nanoClock;

    private long startNanos;
    private boolean running;
    private double lastElapsed = Double.NaN;

    public Timer() {
        this("");
    }

    public Timer(String description) {
        this(description, TimingUnit.configured());
    }

    public Timer(String description, TimingUnit unit) {
        this(description, unit, new Sender(TIMER_TAG));
    }

    /**
     * @param description the text reported after the elapsed value
     * @param unit the unit of reported and returned values
     * @param sender where the report goes; its context should normally be {@link #TIMER_TAG}
     */
    public Timer(String description, TimingUnit unit, Sender sender) {
        this(description, unit, sender, System::nanoTime, true);
    }

    protected Timer(String description, TimingUnit unit, Sender sender, LongSupplier nanoClock, boolean startNow) {
        this.description = Objects.requireNonNull(description, "description");
        this.unit = Objects.requireNonNull(unit, "unit");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        if (startNow) {
            begin();
        }
    }

    public static Builder builder(String description) {
        return new Builder(description);
    }

    /**
     * Times one run of a task in milliseconds and reports it, also when the task throws.
     *
     * @param description the reported description
     * @param task the work to time
     * @return the elapsed milliseconds
     */
    public static double measure(String description, Runnable task) {
        return measure(description, TimingUnit.MILLISECONDS, task);
    }

    public static double measure(String description, TimingUnit unit, Runnable task) {
        return measure(description, unit, new Sender(TIMER_TAG), task);
    }

    public static double measure(String description, TimingUnit unit, Sender sender, Runnable task) {
        Objects.requireNonNull(task, "task");
        Timer timer = new Timer(description, unit, sender);
        try (timer) {
            task.run();
        }
        return timer.lastElapsed;
    }

    private void begin() {
        startNanos = nanoClock.getAsLong();
        running = true;
    }

    /**
     * Starts a stopped timer. Starting a running timer logs a warning and keeps the original
     * start time.
     */
    public void start() {
        if (running) {
            sender.warn("Trying to start timer '%s' but timer is already running.", description);
            return;
        }
        begin();
    }

    /**
     * Restarts the measurement from now, whether the timer was running or not. Nothing is
     * reported for the discarded interval.
     */
    public void reset() {
        begin();
    }

    /**
     * Stops the timer and reports the elapsed time.
     *
     * @return the elapsed time in this timer's unit, or empty if the timer was not running
     */
    public OptionalDouble stop() {
        if (!running) {
            sender.warn("Trying to stop timer '%s' but timer is not running.", description);
            return OptionalDouble.empty();
        }
        long elapsedNanos = nanoClock.getAsLong() - startNanos;
        running = false;
        lastElapsed = unit.fromNanos(elapsedNanos);
        report(lastElapsed);
        return OptionalDouble.of(lastElapsed);
    }

    /**
     * Writes the line for a completed measurement.
     *
     * @param elapsed the elapsed time in {@link #getUnit()}
     */
    protected void report(double elapsed) {
        sender.tagged(Level.MESSAGE, ElapsedFormat.tag(elapsed, unit), description);
    }

    /**
     * Stops the timer if it is still running.
     */
    @Override
    public void close() {
        if (running) {
            stop();
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return the time elapsed so far while running, else the last measured value, in this
     *     timer's unit; 0 before the first measurement
     */
    public double elapsed() {
        if (running) {
            return unit.fromNanos(nanoClock.getAsLong() - startNanos);
        }
        return Double.isNaN(lastElapsed) ? 0.0 : lastElapsed;
    }

    /**
     * @return the value of the last completed measurement, if any
     */
    public OptionalDouble lastElapsed() {
        return Double.isNaN(lastElapsed) ? OptionalDouble.empty() : OptionalDouble.of(lastElapsed);
    }

    public String getDescription() {
        return description;
    }

    public TimingUnit getUnit() {
        return unit;
    }

    protected Sender sender() {
        return sender;
    }

    protected long nanoTime() {
        return nanoClock.getAsLong();
    }

    /**
     * Builds a {@link Timer} with a custom unit, output or clock.
     *
     * <pre>{@code
     * Timer timer = Timer.builder("flush")
     *     .unit(TimingUnit.MICROSECONDS)
     *     .sink(memorySink)
     *     .deferred()
     *     .build();
     * timer.start();
     * }</pre>
     */
    public static final class Builder {
        private final String description;
        private TimingUnit unit;
        private Sender sender;
        private LogSink sink;
        private LongSupplier nanoClock = System::nanoTime;
        private boolean startNow = true;

        private Builder(String description) {
            this.description = Objects.requireNonNull(description, "description");
        }

        public Builder unit(TimingUnit unit) {
            this.unit = Objects.requireNonNull(unit, "unit");
            return this;
        }

        public Builder sender(Sender sender) {
            this.sender = Objects.requireNonNull(sender, "sender");
            return this;
        }

        /**
         * Writes through a {@code [TIMER]} sender on this sink. Ignored when a sender is set.
         */
        public Builder sink(LogSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder nanoClock(LongSupplier nanoClock) {
            this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
            return this;
        }

        /**
         * The built timer stays stopped until {@link Timer#start()}.
         */
        public Builder deferred() {
            this.startNow = false;
            return this;
        }

        public Timer build() {
            return new Timer(description,
                    unit != null ? unit : TimingUnit.configured(),
                    resolveSender(sender, sink),
                    nanoClock, startNow);
        }
    }

    static Sender resolveSender(Sender sender, LogSink sink) {
        if (sender != null) {
            return sender;
        }
        return sink != null ? new Sender(TIMER_TAG, sink) : new Sender(TIMER_TAG);
    }
}
