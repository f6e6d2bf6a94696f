package io.ptychotools.command;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


import io.ptychotools.command.patterns.CMD_patterns;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Top level `ptychotools` command
///
/// ```
/// ptychotools patterns assemble --input scan.npz --output assembled.npz --crop-width 128
/// ptychotools patterns info --input scan.npz
/// ptychotools patterns formats
/// ```
@CommandLine.Command(name = "ptychotools",
    header = "Diffraction pattern tools",
    description = "Read, process and assemble diffraction pattern datasets.",
    mixinStandardHelpOptions = true,
    versionProvider = PatternsCLI.VersionProvider.class,
    subcommands = {
        CMD_patterns.class,
        CommandLine.HelpCommand.class
    })
public class PatternsCLI implements Callable<Integer> {

    /**
     * Run the command line
     * @param args Command line arguments
     */
    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Run the command line without exiting
     * @param args Command line arguments
     * @return the exit code
     */
    public static int execute(String... args) {
        return new CommandLine(new PatternsCLI())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true)
            .execute(args);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    /// Reports the implementation version from the jar manifest
    public static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = PatternsCLI.class.getPackage().getImplementationVersion();
            return new String[]{"ptychotools " + (version != null ? version : "development build")};
        }
    }
}
