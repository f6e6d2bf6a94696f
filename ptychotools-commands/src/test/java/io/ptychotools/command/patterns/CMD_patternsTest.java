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

import io.ptychotools.api.patterns.DiffractionPatterns;
import io.ptychotools.api.patterns.PixelType;
import io.ptychotools.command.PatternsCLI;
import io.ptychotools.patterns.npz.NpyArray;
import io.ptychotools.patterns.npz.NpzArchive;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class CMD_patternsTest {

    @TempDir
    Path tempDir;

    private final StringWriter output = new StringWriter();

    private int run(String... args) {
        return new CommandLine(new PatternsCLI())
            .setOptionsCaseInsensitive(true)
            .setOut(new PrintWriter(output, true))
            .execute(args);
    }

    @Test
    public void testAssembleWritesProcessedArchive() throws IOException {
        Path input = createScan("scan.npz");
        Path assembled = tempDir.resolve("assembled.npz");

        int exitCode = run("patterns", "assemble", "-i", input.toString(), "-o", assembled.toString(),
            "--no-crop", "--bin-x", "2", "--threads", "2");

        assertEquals(CMD_patterns.EXIT_SUCCESS, exitCode, "Command should exit with code 0");
        assertThat(output.toString())
            .contains("scan: 3 x 8W x 16H uint16")
            .contains("Assembled 3 of 3 patterns");
        Map<String, NpyArray> contents = NpzArchive.read(assembled);
        assertThat(contents.get("indexes").toLongs()).containsExactly(10, 11, 12);
        DiffractionPatterns patterns = contents.get("patterns").toPatterns();
        assertThat(patterns.shape()).containsExactly(3, 16, 8);
        assertThat(patterns.get(2, 0, 0)).isEqualTo(8);
    }

    @Test
    public void testAssembleRefusesExistingOutputWithoutForce() throws IOException {
        Path input = createScan("scan.npz");
        Path assembled = tempDir.resolve("assembled.npz");
        Files.writeString(assembled, "keep me");

        assertEquals(CMD_patterns.EXIT_ERROR,
            run("patterns", "assemble", "-i", input.toString(), "-o", assembled.toString(), "--no-crop"));
        assertEquals("keep me", Files.readString(assembled));

        assertEquals(CMD_patterns.EXIT_SUCCESS,
            run("patterns", "assemble", "-i", input.toString(), "-o", assembled.toString(), "--no-crop", "--force"));
        assertThat(NpzArchive.read(assembled)).containsKeys("indexes", "patterns");
    }

    @Test
    public void testAssembleRejectsBinSizeThatDoesNotDivideFrames() throws IOException {
        Path input = createScan("scan.npz");
        Path assembled = tempDir.resolve("assembled.npz");

        int exitCode = run("patterns", "assemble", "-i", input.toString(), "-o", assembled.toString(),
            "--no-crop", "--bin-y", "3");

        assertEquals(CMD_patterns.EXIT_ERROR, exitCode);
        assertThat(assembled).doesNotExist();
    }

    @Test
    public void testAssembleSavesEffectiveSettings() throws IOException {
        Path input = createScan("scan.npz");
        Path settings = tempDir.resolve("effective.yaml");

        run("patterns", "assemble", "-i", input.toString(), "-o", tempDir.resolve("out.npz").toString(),
            "--no-crop", "--flip-y", "--save-config", settings.toString());

        assertThat(Files.readString(settings))
            .contains("CropEnabled: false")
            .contains("FlipYEnabled: true");
    }

    @Test
    public void testAssembleMissingInput() {
        int exitCode = run("patterns", "assemble", "-i", tempDir.resolve("absent.npz").toString(),
            "-o", tempDir.resolve("out.npz").toString());

        assertEquals(CMD_patterns.EXIT_ERROR, exitCode);
    }

    @Test
    public void testInfoDescribesFile() throws IOException {
        Path input = createScan("scan.npz");

        int exitCode = run("patterns", "info", "-i", input.toString());

        assertEquals(CMD_patterns.EXIT_SUCCESS, exitCode);
        assertThat(output.toString())
            .contains("Patterns: 3 total, 3 per array")
            .contains("Detector extent: 16W x 16H")
            .contains("Arrays: 1")
            .contains("scan: 3 patterns");
    }

    @Test
    public void testInfoUnknownExtension() throws IOException {
        Path input = tempDir.resolve("scan.h5");
        Files.writeString(input, "not a pattern file");

        assertEquals(CMD_patterns.EXIT_ERROR, run("patterns", "info", "-i", input.toString()));
    }

    @Test
    public void testFormatsListsNpz() {
        assertEquals(CMD_patterns.EXIT_SUCCESS, run("patterns", "formats"));

        assertThat(output.toString())
            .contains("Readers:")
            .contains("Writers:")
            .contains("NPZ");
    }

    /// three 16x16 uint16 frames, frame `n` filled with `2 * n`, indexed from 10
    private Path createScan(String name) throws IOException {
        DiffractionPatterns patterns = DiffractionPatterns.zeros(3, 16, 16);
        for (int n = 0; n < 3; n++) {
            for (int i = 0; i < 256; i++) {
                patterns.values()[n * 256 + i] = 2 * n;
            }
        }
        Map<String, NpyArray> contents = new LinkedHashMap<>();
        contents.put("indexes", NpyArray.ofLongs(new long[]{10, 11, 12}));
        contents.put("patterns", NpyArray.ofPatterns(patterns, PixelType.UINT16));
        Path file = tempDir.resolve(name);
        NpzArchive.write(file, contents);
        return file;
    }
}
