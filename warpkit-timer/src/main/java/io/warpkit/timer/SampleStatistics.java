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

import java.util.Arrays;
import java.util.Objects;

/**
 * Summary statistics over benchmark samples. {@link #median} and {@link #mode} expect their
 * input sorted ascending; {@link #summarize} sorts it first, in place.
 */
public final class SampleStatistics {

    public static double mean(double[] samples) {
        requireSamples(samples);
        double sum = 0.0;
        for (double sample : samples) {
            sum += sample;
        }
        return sum / samples.length;
    }

    /**
     * @param sorted samples in ascending order
     * @return the middle value, or the average of the two middle values for an even count
     */
    public static double median(double[] sorted) {
        requireSamples(sorted);
        int size = sorted.length;
        if (size % 2 == 0) {
            return (sorted[size / 2 - 1] + sorted[size / 2]) / 2.0;
        }
        return sorted[size / 2];
    }

    /**
     * Returns the value of the longest run of equal adjacent samples. Among runs of the same
     * length the first one wins, so samples with no repeated value yield the smallest.
     *
     * @param sorted samples in ascending order
     * @return the most frequent value
     */
    public static double mode(double[] sorted) {
        requireSamples(sorted);
        double modeValue = sorted[0];
        int modeCount = 1;
        int runCount = 1;
        for (int i = 1; i < sorted.length; i++) {
            runCount = sorted[i] == sorted[i - 1] ? runCount + 1 : 1;
            if (runCount > modeCount) {
                modeCount = runCount;
                modeValue = sorted[i];
            }
        }
        return modeValue;
    }

    /**
     * Sorts the millisecond samples in place and computes mean, median and mode, expressed in
     * the display unit.
     *
     * @param description the benchmark description
     * @param millis the samples, in milliseconds
     * @param unit the unit of the result
     * @return the summary
     */
    public static BenchmarkResult summarize(String description, double[] millis, TimingUnit unit) {
        requireSamples(millis);
        Arrays.sort(millis);
        TimingUnit from = TimingUnit.MILLISECONDS;
        return new BenchmarkResult(description, millis.length, unit,
                from.convert(mean(millis), unit),
                from.convert(median(millis), unit),
                from.convert(mode(millis), unit));
    }

    private static void requireSamples(double[] samples) {
        Objects.requireNonNull(samples, "samples");
        if (samples.length == 0) {
            throw new IllegalArgumentException("statistics need at least one sample");
        }
    }

    private SampleStatistics() {
        throw new UnsupportedOperationException("Utility class should not be instantiated");
    }
}
