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
package uk.ac.sussex.gdsc.em.star;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings({"javadoc"})
class CoordinateFilesTest {
  @Test
  void testGetBaseName() {
    Assertions.assertEquals("mic1", CoordinateFiles.getBaseName("mic1.mrc"));
    Assertions.assertEquals("mic1", CoordinateFiles.getBaseName("MotionCorr/job003/mic1.mrc"));
    Assertions.assertEquals("mic1", CoordinateFiles.getBaseName("mic1"));
  }

  @Test
  void testGetCuratedPath(@TempDir Path dir) {
    Assertions.assertEquals(dir.resolve("mic1_CURATED.star"),
        CoordinateFiles.getCuratedPath(dir, "Movies/mic1.mrc"));
  }

  @Test
  void testCuratedFileIsPreferred(@TempDir Path dir) throws IOException {
    Files.createFile(dir.resolve("mic1_autopick.star"));
    Files.createFile(dir.resolve("mic1_CURATED.star"));
    Assertions.assertEquals(dir.resolve("mic1_CURATED.star"),
        CoordinateFiles.findCoordinateFile(dir, "mic1.mrc"));
  }

  @Test
  void testFirstCandidateIsUsed(@TempDir Path dir) throws IOException {
    Files.createFile(dir.resolve("mic1_manualpick.star"));
    Files.createFile(dir.resolve("mic1_autopick.star"));
    Files.createFile(dir.resolve("mic1_autopick.txt"));
    Files.createFile(dir.resolve("mic2_autopick.star"));
    Assertions.assertEquals(dir.resolve("mic1_autopick.star"),
        CoordinateFiles.findCoordinateFile(dir, "mic1.mrc"));
    Assertions.assertEquals(dir.resolve("mic2_autopick.star"),
        CoordinateFiles.findCoordinateFile(dir, "mic2.mrc"));
  }

  @Test
  void testNoCandidate(@TempDir Path dir) throws IOException {
    Files.createFile(dir.resolve("mic2_autopick.star"));
    Assertions.assertNull(CoordinateFiles.findCoordinateFile(dir, "mic1.mrc"));
  }
}
