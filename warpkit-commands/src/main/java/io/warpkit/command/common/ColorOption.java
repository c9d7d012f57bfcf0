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

import io.warpkit.log.ColorMode;
import io.warpkit.log.sinks.ConsoleLogSink;
import io.warpkit.log.sinks.LogSink;
import picocli.CommandLine;

/**
 * Shared {@code --color} option selecting how command output is rendered.
 */
public class ColorOption {

    /**
     * Picocli type converter accepting the names and aliases of {@link ColorMode}.
     */
    public static class ColorModeConverter implements CommandLine.ITypeConverter<ColorMode> {
        @Override
        public ColorMode convert(String value) {
            return ColorMode.fromString(value);
        }
    }

    @CommandLine.Option(
        names = {"--color"},
        description = "Color output: auto, ansi or plain (default: configured mode, else auto)",
        converter = ColorModeConverter.class
    )
    private ColorMode colorMode;

    /**
     * @return the selected mode, or the configured default when the option was not given
     */
    public ColorMode getColorMode() {
        return colorMode != null ? colorMode : ColorMode.configured();
    }

    /**
     * Creates a console sink on the current {@code System.out} and {@code System.err}, so that
     * redirected streams are honored.
     *
     * @return a sink rendering in the selected color mode
     */
    public LogSink createSink() {
        return new ConsoleLogSink(System.out, System.err, getColorMode());
    }
}
