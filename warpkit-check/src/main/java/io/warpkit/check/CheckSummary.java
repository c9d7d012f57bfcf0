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

import io.warpkit.log.tags.AnsiColor;

import java.util.Objects;

/**
 * Counts passed and failed checks. Summaries of several suites are combined with
 * {@link #merge(CheckSummary)}.
 *
 * <p>Not thread-safe.</p>
 *
 * @since 1.0.0
 */
public final class CheckSummary {

    private int total;
    private int passed;

    public CheckSummary() {
    }

    private CheckSummary(int total, int passed) {
        this.total = total;
        this.passed = passed;
    }

    /**
     * Records one check.
     *
     * @param outcome whether the check passed
     * @return this summary
     */
    public CheckSummary add(boolean outcome) {
        total++;
        if (outcome) {
            passed++;
        }
        return this;
    }

    /**
     * Adds the counts of another summary to this one.
     *
     * @param other the summary to absorb; left unchanged
     * @return this summary
     */
    public CheckSummary merge(CheckSummary other) {
        Objects.requireNonNull(other, "other");
        total += other.total;
        passed += other.passed;
        return this;
    }

    public int total() {
        return total;
    }

    public int passed() {
        return passed;
    }

    public int failed() {
        return total - passed;
    }

    public boolean allPassed() {
        return passed == total;
    }

    /**
     * @return the share of passed checks in percent, 0 when nothing was checked
     */
    public double percentage() {
        return total == 0 ? 0.0 : 100.0 * passed / total;
    }

    public CheckSummary copy() {
        return new CheckSummary(total, passed);
    }

    /**
     * @return {@code [passed/total]} in yellow
     */
    public String summaryString() {
        return AnsiColor.YELLOW.wrap("[" + passed + "/" + total + "]");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CheckSummary)) {
            return false;
        }
        CheckSummary that = (CheckSummary) o;
        return total == that.total && passed == that.passed;
    }

    @Override
    public int hashCode() {
        return Objects.hash(total, passed);
    }

    @Override
    public String toString() {
        return "CheckSummary[" + passed + "/" + total + "]";
    }
}
