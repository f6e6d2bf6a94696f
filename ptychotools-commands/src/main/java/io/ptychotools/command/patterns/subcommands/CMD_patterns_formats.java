package io.ptychotools.command.patterns.subcommands;

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


import io.ptychotools.api.services.DiffractionFileIO;
import io.ptychotools.command.patterns.CMD_patterns;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * List the pattern file readers and writers found on the class path.
 */
@CommandLine.Command(name = "formats",
    header = "List the registered pattern file formats")
public class CMD_patterns_formats implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        DiffractionFileIO fileIO = DiffractionFileIO.load();
        out.println("Readers:");
        fileIO.getReaders().forEach(p -> print(out, p.simpleName(), p.displayName(), p.extensions()));
        out.println("Writers:");
        fileIO.getWriters().forEach(p -> print(out, p.simpleName(), p.displayName(), p.extensions()));
        out.flush();
        return CMD_patterns.EXIT_SUCCESS;
    }

    private static void print(PrintWriter out, String simpleName, String displayName, List<String> extensions) {
        out.printf("  %-8s %s %s%n", simpleName, displayName, extensions);
    }
}
