/*-
 * #%L
 * Genome Damage and Stability Centre ImageJ Plugins
 *
 * Software for microscopy image analysis
 * %%
 * Copyright (C) 2011 - 2022 Alex Herbert
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */
package uk.ac.sussex.gdsc.em.selection;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.ac.sussex.gdsc.em.star.StarFormatException;

@SuppressWarnings({"javadoc"})
class BackupSelectionWriterTest {
  @Test
  void testWrite(@TempDir Path dir) throws IOException {
    final Path micrographs = dir.resolve("micrographs_ctf.star");
    Files.write(micrographs, Arrays.asList("", "data_", "", "loop_",
        "_rlnMicrographName #1", "_rlnCtfImage #2",
        "MotionCorr/job002/mic1.mrc mic1.ctf",
        "MotionCorr/job002/mic2.mrc mic2.ctf",
        "MotionCorr/job002/mic3.mrc mic3.ctf"));
    final MarkedMicrographs marked = new MarkedMicrographs();
    marked.mark("mic2");
    final Path output = dir.resolve("Select").resolve(BackupSelectionWriter.DEFAULT_NAME);

    Assertions.assertEquals(1, BackupSelectionWriter.write(micrographs, marked, output));

    final List<String> lines = Files.readAllLines(output);
    Assertions.assertEquals(
        Arrays.asList("", "data_", "", "loop_", "_rlnSelected #1", "\t1", "\t0", "\t1"), lines);
  }

  @Test
  void testOpticsTableIsIgnored(@TempDir Path dir) throws IOException {
    final Path micrographs = dir.resolve("micrographs_ctf.star");
    Files.write(micrographs, Arrays.asList("", "# version 30001", "", "data_optics", "", "loop_",
        "_rlnOpticsGroupName #1", "_rlnOpticsGroup #2", "_rlnMicrographPixelSize #3",
        "opticsGroup1 1 0.885", "", "", "# version 30001", "", "data_micrographs", "", "loop_",
        "_rlnMicrographName #1", "_rlnOpticsGroup #2",
        "MotionCorr/job002/mic_0001.mrc 1",
        "MotionCorr/job002/mic_0002.mrc 1"));
    final MarkedMicrographs marked = new MarkedMicrographs();
    marked.mark("mic_0002");
    final Path output = dir.resolve(BackupSelectionWriter.DEFAULT_NAME);

    Assertions.assertEquals(1, BackupSelectionWriter.write(micrographs, marked, output));

    // One row per micrograph
    final List<String> lines = Files.readAllLines(output);
    Assertions.assertEquals(
        Arrays.asList("", "data_", "", "loop_", "_rlnSelected #1", "\t1", "\t0"), lines);
  }

  @Test
  void testNothingMarked(@TempDir Path dir) throws IOException {
    final Path micrographs = dir.resolve("micrographs.star");
    Files.write(micrographs,
        Arrays.asList("data_", "loop_", "_rlnMicrographName", "a.mrc", "b.mrc"));
    final Path output = dir.resolve("out.star");
    Assertions.assertEquals(0,
        BackupSelectionWriter.write(micrographs, new MarkedMicrographs(), output));
    Assertions.assertEquals(2, Files.readAllLines(output).stream().filter("\t1"::equals).count());
  }

  @Test
  void testMissingMicrographColumnThrows(@TempDir Path dir) throws IOException {
    final Path micrographs = dir.resolve("micrographs.star");
    Files.write(micrographs, Arrays.asList("data_", "loop_", "_rlnCtfImage", "a.ctf"));
    final Path output = dir.resolve("out.star");
    Assertions.assertThrows(StarFormatException.class,
        () -> BackupSelectionWriter.write(micrographs, new MarkedMicrographs(), output));
    Assertions.assertFalse(Files.exists(output));
  }
}
