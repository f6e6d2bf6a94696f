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


import io.ptychotools.api.patterns.DiffractionDataset;
import io.ptychotools.api.patterns.DiffractionMetadata;
import io.ptychotools.api.patterns.DiffractionPatternArray;
import io.ptychotools.api.patterns.SimpleTreeNode;
import io.ptychotools.api.services.DiffractionFileIO;
import io.ptychotools.api.services.DiffractionFileReader;
import io.ptychotools.command.patterns.CMD_patterns;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Show what a reader finds in a pattern file: metadata, contents tree and arrays.
 * No pixels are processed.
 */
@CommandLine.Command(name = "info",
    header = "Show the metadata and contents of a pattern file",
    exitCodeList = {"0: success", "2: error"})
public class CMD_patterns_info implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_patterns_info.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-i", "--input"}, description = "Pattern file to read", required = true)
    private Path inputPath;

    @CommandLine.Option(names = {"--file-type"},
        description = "Reader name; chosen by file extension when omitted")
    private String fileType;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        if (!Files.isRegularFile(inputPath)) {
            logger.error("Not a file: {}", inputPath);
            return CMD_patterns.EXIT_ERROR;
        }
        DiffractionFileIO fileIO = DiffractionFileIO.load();
        Optional<DiffractionFileIO.Plugin<DiffractionFileReader>> plugin =
            fileType != null ? fileIO.getReader(fileType) : fileIO.getReaderFor(inputPath);
        if (plugin.isEmpty()) {
            logger.error("No reader for {}, available: {}", inputPath, fileIO.getReaderNames());
            return CMD_patterns.EXIT_ERROR;
        }

        DiffractionDataset dataset;
        try {
            dataset = plugin.get().create().read(inputPath);
        } catch (IOException e) {
            logger.error("Unable to read {}: {}", inputPath, e.getMessage());
            return CMD_patterns.EXIT_ERROR;
        }

        DiffractionMetadata metadata = dataset.getMetadata();
        out.printf("File: %s (%s)%n", inputPath, plugin.get().displayName());
        out.printf("Patterns: %d total, %d per array, %s%n", metadata.numberOfPatternsTotal(),
            metadata.numberOfPatternsPerArray(), metadata.patternDataType());
        metadata.getDetectorExtent().ifPresent(e -> out.printf("Detector extent: %s%n", e));
        metadata.getDetectorPixelGeometry().ifPresent(g ->
            out.printf("Detector pixel size: %g m x %g m%n", g.widthInMeters(), g.heightInMeters()));
        metadata.getDetectorBitDepth().ifPresent(b -> out.printf("Detector bit depth: %d%n", b));
        metadata.getCropCenter().ifPresent(c ->
            out.printf("Crop center: %d, %d%n", c.positionXInPixels(), c.positionYInPixels()));
        if (metadata.detectorDistanceInMeters() != null) {
            out.printf("Detector distance: %g m%n", metadata.detectorDistanceInMeters());
        }
        if (metadata.probeEnergyInElectronVolts() != null) {
            out.printf("Probe energy: %g eV%n", metadata.probeEnergyInElectronVolts());
        }

        out.println("Contents:");
        printTree(out, dataset.getContentsTree(), 1);
        out.printf("Arrays: %d%n", dataset.size());
        for (DiffractionPatternArray array : dataset) {
            out.printf("  %s: %d patterns%n", array.getLabel(), array.getNumberOfPatterns());
        }
        out.flush();
        return CMD_patterns.EXIT_SUCCESS;
    }

    private static void printTree(PrintWriter out, SimpleTreeNode node, int depth) {
        out.println("  ".repeat(depth) + String.join(" | ", node.getRow()));
        for (SimpleTreeNode child : node.getChildren()) {
            printTree(out, child, depth + 1);
        }
    }
}
