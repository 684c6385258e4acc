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
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.FileUtils;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.em.picker.CandidatePoint;

/**
 * Reads and writes particle coordinates in the STAR table format.
 */
public final class StarFile {
  /** The X coordinate column. */
  public static final String COLUMN_X = "_rlnCoordinateX";
  /** The Y coordinate column. */
  public static final String COLUMN_Y = "_rlnCoordinateY";
  /** The class number column. */
  public static final String COLUMN_CLASS = "_rlnClassNumber";
  /** The angle psi column. */
  public static final String COLUMN_PSI = "_rlnAnglePsi";
  /** The figure of merit column. */
  public static final String COLUMN_SCORE = "_rlnAutopickFigureOfMerit";
  /** The micrograph name column. */
  public static final String COLUMN_MICROGRAPH = "_rlnMicrographName";

  private static final String[] COLUMNS =
      {COLUMN_X, COLUMN_Y, COLUMN_CLASS, COLUMN_PSI, COLUMN_SCORE};

  /** No public constructor. */
  private StarFile() {}

  /**
   * Read the coordinates from the last table in the file with an X column. The X and Y columns are
   * required. The score is read from the figure of
   * merit column if present (otherwise the default score is used) and clamped to be non-negative.
   * Rows that cannot be parsed are logged and ignored.
   *
   * @param path the path
   * @return the coordinates
   * @throws StarFormatException if the X or Y column is missing
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public static List<CandidatePoint> readCoordinates(Path path) throws IOException {
    final StarTable table = StarTable.read(path, COLUMN_X);
    final int ix = table.requireColumn(COLUMN_X);
    final int iy = table.requireColumn(COLUMN_Y);
    final int is = table.getColumnIndex(COLUMN_SCORE);
    final int minTokens = Math.max(ix, iy) + 1;

    final LocalList<CandidatePoint> points = new LocalList<>(table.getRows().size());
    int rowNumber = 0;
    for (final String[] row : table.getRows()) {
      rowNumber++;
      if (row.length < minTokens) {
        logInvalidRow(table, rowNumber);
        continue;
      }
      try {
        final double x = Double.parseDouble(row[ix]);
        final double y = Double.parseDouble(row[iy]);
        double score = CandidatePoint.DEFAULT_SCORE;
        if (is >= 0 && is < row.length) {
          score = Math.max(0, Double.parseDouble(row[is]));
        }
        points.add(new CandidatePoint(x, y, score));
      } catch (final NumberFormatException ex) {
        logInvalidRow(table, rowNumber);
      }
    }
    return points;
  }

  private static void logInvalidRow(StarTable table, int rowNumber) {
    Logger.getLogger(StarFile.class.getName())
        .warning(() -> "Invalid coordinates in " + table.getName() + " on data row: " + rowNumber);
  }

  /**
   * Write the coordinates. Positions are written with 6 decimal places so values read from a
   * table are written back unchanged. The class number and angle
   * are not known and are written as -999.
   *
   * @param path the path
   * @param points the points
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public static void writeCoordinates(Path path, List<CandidatePoint> points) throws IOException {
    FileUtils.createParent(path);
    try (BufferedWriter out = Files.newBufferedWriter(path)) {
      out.newLine();
      out.write("data_");
      out.newLine();
      out.newLine();
      out.write("loop_");
      out.newLine();
      for (int i = 0; i < COLUMNS.length; i++) {
        out.write(COLUMNS[i] + " #" + (i + 1));
        out.newLine();
      }
      out.newLine();
      for (final CandidatePoint p : points) {
        out.write(String.format(Locale.ROOT, "%12.6f %12.6f\t -999     -999.0    %.6f",
            p.getX(), p.getY(), p.getScore()));
        out.newLine();
      }
    }
  }
}
