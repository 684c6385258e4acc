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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;
import uk.ac.sussex.gdsc.core.utils.FileUtils;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.em.star.CoordinateFiles;

/**
 * An ordered set of micrographs marked as bad by the operator.
 *
 * <p>Names are stored as the micrograph base name (without the directory or extension).
 */
public class MarkedMicrographs {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final LinkedHashSet<String> names = new LinkedHashSet<>();

  /**
   * Load the marked micrographs from a text file. Blank lines and lines starting with {@code #} are
   * ignored. Only the first whitespace-delimited token of each line is used. Duplicates are
   * ignored. A missing file creates an empty set.
   *
   * @param path the path
   * @return the marked micrographs
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public static MarkedMicrographs load(Path path) throws IOException {
    final MarkedMicrographs marked = new MarkedMicrographs();
    if (!Files.exists(path)) {
      return marked;
    }
    try (BufferedReader input = Files.newBufferedReader(path)) {
      String line;
      while ((line = input.readLine()) != null) {
        line = line.trim();
        if (line.isEmpty() || line.charAt(0) == '#') {
          continue;
        }
        marked.mark(WHITESPACE.split(line, 2)[0]);
      }
    }
    return marked;
  }

  /**
   * Save the marked micrographs to a text file, one per line. The parent directory is created if
   * required.
   *
   * @param path the path
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public void save(Path path) throws IOException {
    FileUtils.createParent(path);
    try (BufferedWriter out = Files.newBufferedWriter(path)) {
      for (final String name : names) {
        out.write(name);
        out.newLine();
      }
    }
  }

  /**
   * Mark the micrograph.
   *
   * @param micrograph the micrograph
   * @return true if the micrograph was not already marked
   */
  public boolean mark(String micrograph) {
    return names.add(CoordinateFiles.getBaseName(micrograph));
  }

  /**
   * Unmark the micrograph.
   *
   * @param micrograph the micrograph
   * @return true if the micrograph was marked
   */
  public boolean unmark(String micrograph) {
    return names.remove(CoordinateFiles.getBaseName(micrograph));
  }

  /**
   * Toggle the mark on the micrograph.
   *
   * @param micrograph the micrograph
   * @return true if the micrograph is now marked
   */
  public boolean toggle(String micrograph) {
    return mark(micrograph) || !unmark(micrograph);
  }

  /**
   * Checks if the micrograph is marked.
   *
   * @param micrograph the micrograph
   * @return true if marked
   */
  public boolean isMarked(String micrograph) {
    return names.contains(CoordinateFiles.getBaseName(micrograph));
  }

  /**
   * Gets the number of marked micrographs.
   *
   * @return the size
   */
  public int size() {
    return names.size();
  }

  /**
   * Gets the marked micrograph names in the order they were marked.
   *
   * @return the names
   */
  public List<String> getNames() {
    return new LocalList<>(names);
  }
}
