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

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import uk.ac.sussex.gdsc.core.utils.LocalList;

/**
 * A single loop table read from a STAR file.
 *
 * <p>A file may hold several tables. Each {@code data_} keyword starts a new table, as does a
 * {@code loop_} keyword following a table that already has content. Header lines start with
 * {@code _} and name a column. The column index is taken from an optional {@code #n} suffix
 * (1-based), otherwise the order of appearance. Blank lines are ignored, as are comment lines
 * starting with {@code #}. All other lines are data rows split on whitespace.
 */
public final class StarTable {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern COLUMN_NUMBER = Pattern.compile("#[1-9][0-9]{0,5}");
  private static final String DATA = "data_";
  private static final String LOOP = "loop_";

  private final String name;
  private final String blockName;
  private final List<String> columns;
  private final List<String[]> rows;

  private StarTable(String name, String blockName, List<String> columns, List<String[]> rows) {
    this.name = name;
    this.blockName = blockName;
    this.columns = columns;
    this.rows = rows;
  }

  /**
   * Read all the tables from the file in the order they appear.
   *
   * @param path the path
   * @return the tables
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public static List<StarTable> readAll(Path path) throws IOException {
    final String name = String.valueOf(path.getFileName());
    final LocalList<StarTable> tables = new LocalList<>();
    String blockName = "";
    LocalList<String> columns = new LocalList<>();
    LocalList<String[]> rows = new LocalList<>();
    try (BufferedReader input = Files.newBufferedReader(path)) {
      String line;
      while ((line = input.readLine()) != null) {
        line = line.trim();
        if (line.isEmpty() || line.startsWith("#")) {
          continue;
        }
        final boolean data = line.startsWith(DATA);
        if (data || line.startsWith(LOOP)) {
          if (!columns.isEmpty() || !rows.isEmpty()) {
            tables.add(new StarTable(name, blockName, columns, rows));
            columns = new LocalList<>();
            rows = new LocalList<>();
          }
          if (data) {
            blockName = line.substring(DATA.length()).trim();
          }
          continue;
        }
        final String[] tokens = WHITESPACE.split(line);
        if (line.charAt(0) == '_') {
          addColumn(columns, tokens);
        } else {
          rows.add(tokens);
        }
      }
    }
    if (!columns.isEmpty() || !rows.isEmpty() || tables.isEmpty()) {
      tables.add(new StarTable(name, blockName, columns, rows));
    }
    return tables;
  }

  /**
   * Read the last table from the file.
   *
   * @param path the path
   * @return the table
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public static StarTable read(Path path) throws IOException {
    final List<StarTable> tables = readAll(path);
    return tables.get(tables.size() - 1);
  }

  /**
   * Read the last table from the file that has the named column. If no table has the column the
   * last table is returned.
   *
   * <p>Use this to skip leading tables such as the optics groups of a micrographs file.
   *
   * @param path the path
   * @param columnName the column name
   * @return the table
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public static StarTable read(Path path, String columnName) throws IOException {
    final List<StarTable> tables = readAll(path);
    for (int i = tables.size(); i-- > 0;) {
      if (tables.get(i).getColumnIndex(columnName) >= 0) {
        return tables.get(i);
      }
    }
    return tables.get(tables.size() - 1);
  }

  private static void addColumn(List<String> columns, String[] tokens) {
    int index = columns.size();
    if (tokens.length > 1 && COLUMN_NUMBER.matcher(tokens[1]).matches()) {
      index = Integer.parseInt(tokens[1].substring(1)) - 1;
    }
    while (columns.size() <= index) {
      columns.add(null);
    }
    columns.set(index, tokens[0]);
  }

  /**
   * Gets the file name of the table.
   *
   * @return the name
   */
  public String getName() {
    return name;
  }

  /**
   * Gets the name of the data block, e.g. {@code optics} for {@code data_optics}. This is empty
   * for an unnamed block.
   *
   * @return the block name
   */
  public String getBlockName() {
    return blockName;
  }

  /**
   * Gets the column names. Unnamed positions are null.
   *
   * @return the columns
   */
  public List<String> getColumns() {
    return Collections.unmodifiableList(columns);
  }

  /**
   * Gets the data rows.
   *
   * @return the rows
   */
  public List<String[]> getRows() {
    return Collections.unmodifiableList(rows);
  }

  /**
   * Gets the 0-based index of the column.
   *
   * @param columnName the column name
   * @return the index (or -1)
   */
  public int getColumnIndex(String columnName) {
    return columns.indexOf(columnName);
  }

  /**
   * Gets the 0-based index of a required column.
   *
   * @param columnName the column name
   * @return the index
   * @throws StarFormatException if the column is missing
   */
  public int requireColumn(String columnName) throws StarFormatException {
    final int index = getColumnIndex(columnName);
    if (index < 0) {
      throw new StarFormatException(name, columnName);
    }
    return index;
  }
}
