package io.ptychotools.command.patterns;

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


import io.ptychotools.command.patterns.subcommands.CMD_patterns_assemble;
import io.ptychotools.command.patterns.subcommands.CMD_patterns_formats;
import io.ptychotools.command.patterns.subcommands.CMD_patterns_info;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 # Diffraction Pattern Tools

 ## Subcommands
 - `assemble`: read a pattern file, crop, filter, bin, pad and flip every frame, and write the
   assembled patterns with their indexes as an NPZ archive
 - `info`: show the metadata and contents of a pattern file without processing it
 - `formats`: list the registered pattern file readers and writers

 # Basic Usage
 ```
 patterns assemble --input scan.npz --output assembled.npz --config settings.yaml
 patterns info --input scan.npz
 ```
 */
@CommandLine.Command(name = "patterns",
    header = "Assemble and inspect diffraction pattern datasets",
    description = "Use subcommands to assemble, inspect or list pattern file formats.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: warning", "2: error"},
    subcommands = {
        CMD_patterns_assemble.class,
        CMD_patterns_info.class,
        CMD_patterns_formats.class,
        CommandLine.HelpCommand.class
    })
public class CMD_patterns implements Callable<Integer> {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_WARNING = 1;
    public static final int EXIT_ERROR = 2;

    /**
     * Run a patterns command
     * @param args Command line arguments
     */
    public static void main(String[] args) {
        CMD_patterns cmd = new CMD_patterns();
        int exitCode = new CommandLine(cmd)
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true)
            .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return EXIT_SUCCESS;
    }
}
