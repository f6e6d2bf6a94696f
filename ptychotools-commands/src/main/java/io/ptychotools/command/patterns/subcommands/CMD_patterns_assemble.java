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


import io.ptychotools.command.patterns.CMD_patterns;
import io.ptychotools.patterns.PatternsAPI;
import io.ptychotools.patterns.PatternsCore;
import io.ptychotools.patterns.dataset.AssembledDiffractionDataset;
import io.ptychotools.patterns.processor.PatternConfigurationException;
import io.ptychotools.patterns.settings.PatternSettings;
import io.ptychotools.patterns.settings.PatternSettingsException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Read a pattern file, process every frame and write the assembled patterns as an NPZ archive.
 * Options given on the command line override values from the settings file.
 */
@CommandLine.Command(name = "assemble",
    header = "Process and assemble the diffraction patterns of a file",
    description = "Reads a pattern file, applies crop, value filter, binning, padding and flips "
        + "to every frame, and writes the assembled indexes and patterns as an NPZ archive.",
    exitCodeList = {"0: success", "1: warning", "2: error"})
public class CMD_patterns_assemble implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_patterns_assemble.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-i", "--input"}, description = "Pattern file to read", required = true)
    private Path inputPath;

    @CommandLine.Option(names = {"-o", "--output"}, description = "NPZ archive to write", required = true)
    private Path outputPath;

    @CommandLine.Option(names = {"-c", "--config"}, description = "YAML settings file to apply first")
    private Path configPath;

    @CommandLine.Option(names = {"--save-config"}, description = "Write the effective settings to this YAML file")
    private Path saveConfigPath;

    @CommandLine.Option(names = {"--file-type"}, description = "Reader name, see 'patterns formats'")
    private String fileType;

    @CommandLine.Option(names = {"-f", "--force"}, description = "Overwrite the output file if it exists")
    private boolean force = false;

    @CommandLine.Option(names = {"--threads"}, description = "Number of processing threads (1-64)")
    private Integer threads;

    @CommandLine.Option(names = {"--queue-capacity"}, description = "Bound of the processing queue, 0 for none")
    private Integer queueCapacity;

    @CommandLine.Option(names = {"--memmap"}, description = "Keep assembled patterns in a memory-mapped scratch file")
    private Boolean memmap;

    @CommandLine.Option(names = {"--scratch"}, description = "Directory for scratch files")
    private Path scratchDirectory;

    @CommandLine.Option(names = {"--detector-width"}, description = "Detector width in pixels")
    private Integer detectorWidth;

    @CommandLine.Option(names = {"--detector-height"}, description = "Detector height in pixels")
    private Integer detectorHeight;

    @CommandLine.Option(names = {"--no-crop"}, description = "Keep whole detector frames")
    private boolean noCrop = false;

    @CommandLine.Option(names = {"--crop-center-x"}, description = "Crop window center column")
    private Integer cropCenterX;

    @CommandLine.Option(names = {"--crop-center-y"}, description = "Crop window center row")
    private Integer cropCenterY;

    @CommandLine.Option(names = {"--crop-width"}, description = "Crop window width in pixels")
    private Integer cropWidth;

    @CommandLine.Option(names = {"--crop-height"}, description = "Crop window height in pixels")
    private Integer cropHeight;

    @CommandLine.Option(names = {"--bin-x"}, description = "Horizontal bin size")
    private Integer binX;

    @CommandLine.Option(names = {"--bin-y"}, description = "Vertical bin size")
    private Integer binY;

    @CommandLine.Option(names = {"--pad-x"}, description = "Columns of zeros added on each side")
    private Integer padX;

    @CommandLine.Option(names = {"--pad-y"}, description = "Rows of zeros added on each side")
    private Integer padY;

    @CommandLine.Option(names = {"--flip-x"}, description = "Mirror frames left to right")
    private boolean flipX = false;

    @CommandLine.Option(names = {"--flip-y"}, description = "Mirror frames top to bottom")
    private boolean flipY = false;

    @CommandLine.Option(names = {"--lower-bound"}, description = "Zero pixel values below this bound")
    private Integer lowerBound;

    @CommandLine.Option(names = {"--upper-bound"}, description = "Zero pixel values at or above this bound")
    private Integer upperBound;

    @CommandLine.Option(names = {"--bad-pixels"}, description = "Two-dimensional .npy mask, nonzero marks a bad pixel")
    private Path badPixelsPath;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        if (Files.exists(outputPath) && !force) {
            logger.error("Output file {} already exists, use --force to overwrite", outputPath);
            return CMD_patterns.EXIT_ERROR;
        }

        try (PatternsCore core = new PatternsCore()) {
            if (configPath != null) {
                core.loadSettings(configPath);
            }
            applyOverrides(core);
            if (saveConfigPath != null) {
                core.saveSettings(saveConfigPath);
            }

            PatternsAPI api = core.getPatternsAPI();
            if (badPixelsPath != null && !api.openBadPixels(badPixelsPath)) {
                return CMD_patterns.EXIT_ERROR;
            }
            String type = fileType != null ? fileType : core.getPatternSettings().getFileType();
            if (!api.openPatterns(inputPath, type)) {
                return CMD_patterns.EXIT_ERROR;
            }

            AssembledDiffractionDataset dataset = core.getDataset();
            api.exportAssembledPatterns(outputPath);
            long[] indexes = dataset.getAssembledIndexes();
            int expected = dataset.getMetadata().numberOfPatternsTotal();
            out.println(dataset.getInfoText());
            out.printf("Assembled %d of %d patterns into %s%n", indexes.length, expected, outputPath);
            out.flush();
            if (indexes.length < expected) {
                logger.warn("{} patterns were not loaded", expected - indexes.length);
                return CMD_patterns.EXIT_WARNING;
            }
            return CMD_patterns.EXIT_SUCCESS;
        } catch (IOException e) {
            logger.error("Unable to assemble {}: {}", inputPath, e.getMessage(), e);
            return CMD_patterns.EXIT_ERROR;
        } catch (PatternConfigurationException | PatternSettingsException | IllegalArgumentException e) {
            logger.error("Invalid settings: {}", e.getMessage());
            return CMD_patterns.EXIT_ERROR;
        }
    }

    private void applyOverrides(PatternsCore core) {
        PatternSettings s = core.getPatternSettings();
        if (threads != null) {
            s.setNumberOfDataThreads(threads);
        }
        if (queueCapacity != null) {
            s.setProcessingQueueCapacity(queueCapacity);
        }
        if (memmap != null) {
            s.setMemmapEnabled(memmap);
        }
        if (scratchDirectory != null) {
            s.setScratchDirectory(scratchDirectory);
        }
        if (detectorWidth != null) {
            core.getDetectorSettings().setWidthInPixels(detectorWidth);
        }
        if (detectorHeight != null) {
            core.getDetectorSettings().setHeightInPixels(detectorHeight);
        }
        if (noCrop) {
            s.setCropEnabled(false);
        }
        if (cropCenterX != null) {
            s.setCropCenterXInPixels(cropCenterX);
        }
        if (cropCenterY != null) {
            s.setCropCenterYInPixels(cropCenterY);
        }
        if (cropWidth != null) {
            s.setCropWidthInPixels(cropWidth);
        }
        if (cropHeight != null) {
            s.setCropHeightInPixels(cropHeight);
        }
        if (binX != null || binY != null) {
            s.setBinningEnabled(true);
            s.setBinSizeX(binX != null ? binX : 1);
            s.setBinSizeY(binY != null ? binY : 1);
        }
        if (padX != null || padY != null) {
            s.setPaddingEnabled(true);
            s.setPadX(padX != null ? padX : 0);
            s.setPadY(padY != null ? padY : 0);
        }
        if (flipX) {
            s.setFlipXEnabled(true);
        }
        if (flipY) {
            s.setFlipYEnabled(true);
        }
        if (lowerBound != null) {
            s.setValueLowerBoundEnabled(true);
            s.setValueLowerBound(lowerBound);
        }
        if (upperBound != null) {
            s.setValueUpperBoundEnabled(true);
            s.setValueUpperBound(upperBound);
        }
    }
}
