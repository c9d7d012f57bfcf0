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

package io.warpkit.command.common;

import io.warpkit.timer.TimingUnit;
import picocli.CommandLine;

/**
 * Shared {@code --unit} option for reported durations.
 */
public class TimingUnitOption {

    /**
     * Picocli type converter accepting unit symbols ({@code us}, {@code ms}, {@code s}) and names.
     */
    public static class TimingUnitConverter implements CommandLine.ITypeConverter<TimingUnit> {
        @Override
        public TimingUnit convert(String value) {
            return TimingUnit.fromString(value);
        }
    }

    @CommandLine.Option(
        names = {"-u", "--unit"},
        description = "Display unit of durations: us, ms or s (default: configured unit, else ms)",
        converter = TimingUnitConverter.class
    )
    private TimingUnit unit;

    /**
     * @return the selected unit, or the configured default when the option was not given
     */
    public TimingUnit getUnit() {
        return unit != null ? unit : TimingUnit.configured();
    }
}
