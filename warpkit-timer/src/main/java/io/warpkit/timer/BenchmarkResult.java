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

import java.util.Locale;
import java.util.Objects;

/**
 * Statistics of one benchmark run, in {@link #unit()}.
 *
 * @since 1.0.0
 */
public final class BenchmarkResult {

    private final String description;
    private final int sampleCount;
    private final TimingUnit unit;
    private final double mean;
    private final double median;
    private final double mode;

    public BenchmarkResult(String description, int sampleCount, TimingUnit unit,
                           double mean, double median, double mode) {
        this.description = Objects.requireNonNull(description, "description");
        this.sampleCount = sampleCount;
        this.unit = Objects.requireNonNull(unit, "unit");
        this.mean = mean;
        this.median = median;
        this.mode = mode;
    }

    public String description() {
        return description;
    }

    public int sampleCount() {
        return sampleCount;
    }

    public TimingUnit unit() {
        return unit;
    }

    public double mean() {
        return mean;
    }

    public double median() {
        return median;
    }

    public double mode() {
        return mode;
    }

    /**
     * @param target the unit to convert into
     * @return these statistics expressed in another unit
     */
    public BenchmarkResult in(TimingUnit target) {
        if (target == unit) {
            return this;
        }
        return new BenchmarkResult(description, sampleCount, target,
                unit.convert(mean, target), unit.convert(median, target), unit.convert(mode, target));
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "BenchmarkResult{%s, n=%d, mean=%.3f %s, median=%.3f %s, mode=%.3f %s}",
                description, sampleCount, mean, unit.symbol(), median, unit.symbol(), mode, unit.symbol());
    }
}
