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

package io.warpkit.check;

import io.warpkit.log.HierarchySender;
import io.warpkit.log.Level;
import io.warpkit.log.sinks.ConsoleLogSink;
import io.warpkit.log.sinks.LogSink;
import io.warpkit.log.tags.AnsiColor;
import io.warpkit.log.tags.Tag;
import io.warpkit.log.tags.Tags;

import java.util.Objects;

/**
 * A named group of checks, each logged as it is evaluated.
 *
 * <pre>{@code
 * try (Suite suite = new Suite("parser")) {
 *     suite.check(parser.accepts("a+b"), "accepts sums");
 *     suite.checkEquals(parser.parse("1+2").eval(), 3, "evaluates sums");
 * }
 * //   [SUITE] : parser {
 * //     [CASE][PASS] : accepts sums
 * //     [CASE][FAIL] : evaluates sums (expected: 3, actual: 4)
 * //   [SUITE] : } [1/2]
 * }</pre>
 *
 * <p>Checks never throw on failure; they record the outcome and return it.</p>
 *
 * @since 1.0.0
 */
public class Suite implements AutoCloseable {

    public static final Tag SUITE_TAG = Tags.makeColored(AnsiColor.BLUE, "[SUITE]");
    public static final Tag CASE_TAG = Tags.makeColored(AnsiColor.BLUE, "[CASE]");
    public static final Tag PASS_TAG = Tags.makeColored(AnsiColor.GREEN, "[PASS]");
    public static final Tag FAIL_TAG = Tags.makeColored(AnsiColor.RED, "[FAIL]");

    /** Depth of a suite run on its own; cases are logged one level deeper. */
    public static final int DEFAULT_DEPTH = 1;

    private final String description;
    private final HierarchySender suiteSender;
    private final HierarchySender caseSender;
    private final int depth;
    private final CheckSummary summary = new CheckSummary();
    private boolean closed;

    public Suite(String description) {
        this(description, ConsoleLogSink.system());
    }

    public Suite(String description, LogSink sink) {
        this(description, sink, DEFAULT_DEPTH);
    }

    public Suite(String description, LogSink sink, int depth) {
        this.description = Objects.requireNonNull(description, "description");
        Objects.requireNonNull(sink, "sink");
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative: " + depth);
        }
        this.depth = depth;
        this.suiteSender = new HierarchySender(SUITE_TAG, sink);
        this.caseSender = new HierarchySender(CASE_TAG, sink);
        suiteSender.msg(depth, "%s {", description);
    }

    /**
     * Records and logs one check.
     *
     * @param condition the outcome
     * @param description what was checked
     * @return the outcome
     */
    public boolean check(boolean condition, String description) {
        summary.add(condition);
        caseSender.tagged(depth + 1, Level.MESSAGE, condition ? PASS_TAG : FAIL_TAG, description);
        return condition;
    }

    /**
     * Checks {@code Objects.equals(actual, expected)}. A failing line also shows both values.
     *
     * @return whether the values are equal
     */
    public boolean checkEquals(Object actual, Object expected, String description) {
        boolean equal = Objects.equals(actual, expected);
        return check(equal, equal ? description : description + " (expected: " + expected + ", actual: " + actual + ")");
    }

    public boolean checkNotEquals(Object actual, Object unexpected, String description) {
        boolean different = !Objects.equals(actual, unexpected);
        return check(different, different ? description : description + " (both: " + actual + ")");
    }

    /**
     * Checks that two doubles differ by at most {@code tolerance}.
     *
     * @return whether the values are close enough
     */
    public boolean checkClose(double actual, double expected, double tolerance, String description) {
        boolean close = Math.abs(actual - expected) <= tolerance;
        return check(close, close ? description
                : description + " (expected: " + expected + " +/- " + tolerance + ", actual: " + actual + ")");
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return a copy of the counts so far
     */
    public CheckSummary summary() {
        return summary.copy();
    }

    /**
     * Logs the closing summary line. Later calls do nothing.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        suiteSender.msg(depth, "} %s", summary.summaryString());
    }
}
