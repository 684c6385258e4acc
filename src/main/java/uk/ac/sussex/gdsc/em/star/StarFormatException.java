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

/**
 * Signals that a STAR file does not have the required structure.
 */
public class StarFormatException extends IOException {
  private static final long serialVersionUID = 1L;

  /** The missing column name. */
  private final String columnName;

  /**
   * Create a new instance for a missing column.
   *
   * @param file the file name
   * @param columnName the column name
   */
  public StarFormatException(String file, String columnName) {
    super(String.format("Input .STAR file: %s, is missing a column for: %s", file, columnName));
    this.columnName = columnName;
  }

  /**
   * Gets the name of the missing column.
   *
   * @return the column name
   */
  public String getColumnName() {
    return columnName;
  }
}
