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

package io.warpkit.command;

import io.warpkit.command.bench.CMD_warpkit_bench;
import io.warpkit.command.selfcheck.CMD_warpkit_selfcheck;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Root of the warpkit command line: timing benchmarks and self checks of the toolkit
@CommandLine.Command(name = "warpkit",
    header = "Console logging and timing toolkit",
    description = "Runs built-in benchmarks and the toolkit's own self checks",
    mixinStandardHelpOptions = true,
    version = "warpkit 1.0.0",
    subcommands = {
        CMD_warpkit_bench.class,
        CMD_warpkit_selfcheck.class,
        CommandLine.HelpCommand.class
    })
public class CMD_warpkit implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_warpkit.class);

    /// Create the root command
    public CMD_warpkit() {}

    /// Build the command line that main runs, configured for case-insensitive input
    /// @return a command line with case-insensitive options and enum values
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_warpkit())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    /// Run a warpkit command
    /// @param args Command line arguments
    public static void main(String[] args) {
        logger.debug("executing commandline");
        int exitCode = commandLine().execute(args);
        logger.debug("exiting main with {}", exitCode);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
