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
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import uk.ac.sussex.gdsc.core.utils.FileUtils;

/**
 * Locates the coordinate file for a micrograph.
 */
public final class CoordinateFiles {
  /** The suffix of curated coordinate files. */
  public static final String CURATED_SUFFIX = "_CURATED.star";
  /** The STAR file extension. */
  public static final String STAR_EXTENSION = ".star";

  /** No public constructor. */
  private CoordinateFiles() {}

  /**
   * Gets the base name of the micrograph (the file name without the extension).
   *
   * @param micrograph the micrograph file name
   * @return the base name
   */
  public static String getBaseName(String micrograph) {
    return FileUtils.removeExtension(Path.of(micrograph).getFileName().toString());
  }

  /**
   * Gets the path of the curated coordinate file for the micrograph.
   *
   * @param directory the directory
   * @param micrograph the micrograph file name
   * @return the curated path
   */
  public static Path getCuratedPath(Path directory, String micrograph) {
    return directory.resolve(getBaseName(micrograph) + CURATED_SUFFIX);
  }

  /**
   * Find the coordinate file for the micrograph. Candidates are STAR files in the directory whose
   * name starts with the micrograph base name. The curated file is preferred. If there are
   * multiple candidates and no curated file a warning is logged and the first in name order is
   * used.
   *
   * @param directory the directory
   * @param micrograph the micrograph file name
   * @return the coordinate file (or null)
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public static Path findCoordinateFile(Path directory, String micrograph) throws IOException {
    final String base = getBaseName(micrograph);
    final Path curated = directory.resolve(base + CURATED_SUFFIX);
    if (Files.isRegularFile(curated)) {
      return curated;
    }
    final List<Path> candidates;
    try (Stream<Path> files = Files.list(directory)) {
      candidates = files.filter(p -> {
        final String name = p.getFileName().toString();
        return name.startsWith(base) && name.endsWith(STAR_EXTENSION) && Files.isRegularFile(p);
      }).sorted().collect(Collectors.toList());
    }
    if (candidates.isEmpty()) {
      return null;
    }
    if (candidates.size() > 1) {
      Logger.getLogger(CoordinateFiles.class.getName())
          .warning(() -> "Multiple .STAR files found for " + base + "; using "
              + candidates.get(0).getFileName());
    }
    return candidates.get(0);
  }
}
