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

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.em.picker.CandidatePoint;

@SuppressWarnings({"javadoc"})
class StarFileTest {
  private static void write(Path path, String... lines) throws IOException {
    try (BufferedWriter out = Files.newBufferedWriter(path)) {
      for (final String line : lines) {
        out.write(line);
        out.newLine();
      }
    }
  }

  @Test
  void canSaveAndLoadCoordinates() throws IOException {
    final Path filename = Files.createTempFile("StarFileTest", ".star");
    final UniformRandomProvider rng = RandomSource.SPLIT_MIX_64.create(1234567L);
    final LocalList<CandidatePoint> out = new LocalList<>();
    for (int i = 0; i < 10; i++) {
      // Positions with up to 6 decimal places are preserved
      out.add(new CandidatePoint(rng.nextInt(400000) / 100.0, rng.nextInt(400000) / 100.0,
          rng.nextInt(1000) / 1000.0));
    }
    StarFile.writeCoordinates(filename, out);
    final List<CandidatePoint> in = StarFile.readCoordinates(filename);
    Assertions.assertEquals(out.size(), in.size());
    for (int i = 0; i < out.size(); i++) {
      Assertions.assertEquals(out.get(i).getX(), in.get(i).getX(), 1e-9);
      Assertions.assertEquals(out.get(i).getY(), in.get(i).getY(), 1e-9);
      Assertions.assertEquals(out.get(i).getScore(), in.get(i).getScore(), 1e-6);
    }
    Files.delete(filename);
  }

  @Test
  void testWriteFormat() throws IOException {
    final Path filename = Files.createTempFile("StarFileTest", ".star");
    StarFile.writeCoordinates(filename, Arrays.asList(new CandidatePoint(12.345, 6, 0.5)));
    final List<String> lines = Files.readAllLines(filename);
    Assertions.assertEquals(Arrays.asList("", "data_", "", "loop_", "_rlnCoordinateX #1",
        "_rlnCoordinateY #2", "_rlnClassNumber #3", "_rlnAnglePsi #4",
        "_rlnAutopickFigureOfMerit #5", ""), lines.subList(0, 10));
    Assertions.assertEquals(11, lines.size());
    final String[] tokens = lines.get(10).trim().split("\\s+");
    Assertions.assertArrayEquals(
        new String[] {"12.345000", "6.000000", "-999", "-999.0", "0.500000"}, tokens);
    Files.delete(filename);
  }

  @Test
  void testRecordedCoordinatesAreWrittenUnchanged() throws IOException {
    final Path input = Files.createTempFile("StarFileTest", ".star");
    write(input, "", "data_", "", "loop_", "_rlnCoordinateX #1", "_rlnCoordinateY #2",
        "_rlnClassNumber #3", "_rlnAnglePsi #4", "_rlnAutopickFigureOfMerit #5", "",
        " 1234.567891   987.654321\t -999     -999.0    0.123456");
    final Path output = Files.createTempFile("StarFileTest", ".star");
    StarFile.writeCoordinates(output, StarFile.readCoordinates(input));
    final List<String> lines = Files.readAllLines(output);
    final String[] tokens = lines.get(lines.size() - 1).trim().split("\\s+");
    Assertions.assertEquals("1234.567891", tokens[0]);
    Assertions.assertEquals("987.654321", tokens[1]);
    Assertions.assertEquals("0.123456", tokens[4]);
    Assertions.assertEquals(new ArrayList<>(StarFile.readCoordinates(input)),
        StarFile.readCoordinates(output));
    Files.delete(input);
    Files.delete(output);
  }

  @Test
  void testReadSkipsLeadingTables() throws IOException {
    final Path filename = Files.createTempFile("StarFileTest", ".star");
    write(filename, "data_optics", "loop_", "_rlnOpticsGroupName #1", "_rlnOpticsGroup #2",
        "opticsGroup1 1", "", "data_particles", "loop_", "_rlnCoordinateX #1",
        "_rlnCoordinateY #2", "10.5 20.25");
    Assertions.assertEquals(Arrays.asList(new CandidatePoint(10.5, 20.25)),
        StarFile.readCoordinates(filename));
    Files.delete(filename);
  }

  @Test
  void testReadUsesColumnNumbers() throws IOException {
    final Path filename = Files.createTempFile("StarFileTest", ".star");
    write(filename, "data_", "loop_", "_rlnAutopickFigureOfMerit #3", "_rlnCoordinateY #2",
        "_rlnCoordinateX #1", "10 20 -0.5", "30.5 40.25 0.75");
    final List<CandidatePoint> in = StarFile.readCoordinates(filename);
    // Negative score is clamped
    Assertions.assertEquals(Arrays.asList(new CandidatePoint(10, 20, 0),
        new CandidatePoint(30.5, 40.25, 0.75)), in);
    Files.delete(filename);
  }

  @Test
  void testReadWithoutScoreUsesDefault() throws IOException {
    final Path filename = Files.createTempFile("StarFileTest", ".star");
    write(filename, "", "data_", "", "loop_", "_rlnCoordinateX", "_rlnCoordinateY", "", "1 2");
    Assertions.assertEquals(Arrays.asList(new CandidatePoint(1, 2)),
        StarFile.readCoordinates(filename));
    Files.delete(filename);
  }

  @Test
  void testReadSkipsInvalidRows() throws IOException {
    final Path filename = Files.createTempFile("StarFileTest", ".star");
    write(filename, "data_", "loop_", "_rlnCoordinateX #1", "_rlnCoordinateY #2",
        // Not enough tokens
        "1",
        // Invalid numbers
        "1 a",
        "5 6");
    // Should not throw. It will log a warning
    Assertions.assertEquals(Arrays.asList(new CandidatePoint(5, 6)),
        StarFile.readCoordinates(filename));
    Files.delete(filename);
  }

  @Test
  void testMissingColumnThrows() throws IOException {
    final Path filename = Files.createTempFile("StarFileTest", ".star");
    write(filename, "data_", "loop_", "_rlnCoordinateX #1", "_rlnAnglePsi #2", "1 2");
    final StarFormatException ex = Assertions.assertThrows(StarFormatException.class,
        () -> StarFile.readCoordinates(filename));
    Assertions.assertEquals(StarFile.COLUMN_Y, ex.getColumnName());
    Assertions.assertEquals(String.format("Input .STAR file: %s, is missing a column for: %s",
        filename.getFileName(), StarFile.COLUMN_Y), ex.getMessage());
    Files.delete(filename);
  }

  @Test
  void testMissingFileThrows() throws IOException {
    final Path filename = Files.createTempFile("StarFileTest", ".star");
    Files.delete(filename);
    Assertions.assertThrows(IOException.class, () -> StarFile.readCoordinates(filename));
  }
}
