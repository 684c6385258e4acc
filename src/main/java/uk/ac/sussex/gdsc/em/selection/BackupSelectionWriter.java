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

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.FileUtils;
import uk.ac.sussex.gdsc.core.utils.TextUtils;
import uk.ac.sussex.gdsc.em.star.StarFile;
import uk.ac.sussex.gdsc.em.star.StarTable;

/**
 * Writes a micrograph selection table that deselects the marked micrographs.
 *
 * <p>The output has one {@code _rlnSelected} row for each row of the input micrographs table in
 * the same order: 0 for a marked micrograph and 1 otherwise. Micrographs are matched on the base
 * name of the {@code _rlnMicrographName} column. Only the table that holds that column is used so
 * leading tables, such as the optics groups, are ignored.
 */
public final class BackupSelectionWriter {
  /** The default output file name. */
  public static final String DEFAULT_NAME = "backup_selection.star";

  /** No public constructor. */
  private BackupSelectionWriter() {}

  /**
   * Write the selection.
   *
   * @param micrographs the micrographs STAR file
   * @param marked the marked micrographs
   * @param output the output file
   * @return the number of micrographs that were deselected
   * @throws IOException Signals that an I/O exception has occurred, or the micrograph name column
   *         is missing
   */
  public static int write(Path micrographs, MarkedMicrographs marked, Path output)
      throws IOException {
    final StarTable table = StarTable.read(micrographs, StarFile.COLUMN_MICROGRAPH);
    final int column = table.requireColumn(StarFile.COLUMN_MICROGRAPH);

    FileUtils.createParent(output);
    int count = 0;
    int total = 0;
    try (BufferedWriter out = Files.newBufferedWriter(output)) {
      out.newLine();
      out.write("data_");
      out.newLine();
      out.newLine();
      out.write("loop_");
      out.newLine();
      out.write("_rlnSelected #1");
      out.newLine();
      for (final String[] row : table.getRows()) {
        if (column >= row.length) {
          continue;
        }
        total++;
        if (marked.isMarked(row[column])) {
          out.write("\t0");
          count++;
        } else {
          out.write("\t1");
        }
        out.newLine();
      }
    }
    final int deselected = count;
    final int size = total;
    Logger.getLogger(BackupSelectionWriter.class.getName()).info(() -> String.format(
        "%d of %s were deselected", deselected, TextUtils.pleural(size, "micrograph")));
    return count;
  }
}
