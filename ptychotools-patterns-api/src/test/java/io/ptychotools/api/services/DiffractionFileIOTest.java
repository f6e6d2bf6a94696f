package io.ptychotools.api.services;

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
import io.ptychotools.api.patterns.SimpleDiffractionDataset;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiffractionFileIOTest {

  @FileFormat(simpleName = "Alpha", displayName = "Alpha Files (*.alpha)", extensions = {".ALPHA"})
  static class AlphaReader implements DiffractionFileReader {
    @Override
    public DiffractionDataset read(Path filePath) {
      return SimpleDiffractionDataset.createNull(filePath);
    }
  }

  @FileFormat(simpleName = "ALPHA", displayName = "Another Alpha")
  static class OtherAlphaReader extends AlphaReader {
  }

  @FileFormat(simpleName = "Beta", displayName = "Beta Files", extensions = {".beta", ".b"})
  static class BetaWriter implements DiffractionFileWriter {
    @Override
    public void write(Path filePath, DiffractionDataset dataset) {
    }
  }

  static class UnannotatedReader extends AlphaReader {
  }

  private static DiffractionFileIO registry() {
    DiffractionFileIO.Plugin<DiffractionFileReader> alpha =
        DiffractionFileIO.plugin(AlphaReader.class, AlphaReader::new);
    DiffractionFileIO.Plugin<DiffractionFileReader> otherAlpha =
        DiffractionFileIO.plugin(OtherAlphaReader.class, OtherAlphaReader::new);
    DiffractionFileIO.Plugin<DiffractionFileWriter> beta =
        DiffractionFileIO.plugin(BetaWriter.class, BetaWriter::new);
    return new DiffractionFileIO(List.of(alpha, otherAlpha), List.of(beta));
  }

  @Test
  void looksUpByNameIgnoringCase() {
    DiffractionFileIO io = registry();

    assertThat(io.getReader("alpha")).isPresent();
    assertThat(io.getReader("ALPHA").orElseThrow().displayName()).isEqualTo("Alpha Files (*.alpha)");
    assertThat(io.getWriter("beta")).isPresent();
    assertThat(io.getReader("gamma")).isEmpty();
  }

  @Test
  void keepsFirstOfDuplicateNames() {
    DiffractionFileIO io = registry();

    assertThat(io.getReaderNames()).containsExactly("Alpha");
  }

  @Test
  void matchesExtensionsIgnoringCase() {
    DiffractionFileIO io = registry();

    assertThat(io.getReaderFor(Path.of("scan.Alpha"))).isPresent();
    assertThat(io.getReaderFor(Path.of("scan.npz"))).isEmpty();
    assertThat(io.getWriterFor(Path.of("out.b")).orElseThrow().simpleName()).isEqualTo("Beta");
  }

  @Test
  void createsFreshInstances() {
    DiffractionFileIO.Plugin<DiffractionFileReader> plugin = registry().getReader("Alpha").orElseThrow();

    assertThat(plugin.create()).isInstanceOf(AlphaReader.class).isNotSameAs(plugin.create());
  }

  @Test
  void rejectsClassWithoutAnnotation() {
    assertThatThrownBy(() -> DiffractionFileIO.plugin(UnannotatedReader.class, UnannotatedReader::new))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("@FileFormat");
  }
}
