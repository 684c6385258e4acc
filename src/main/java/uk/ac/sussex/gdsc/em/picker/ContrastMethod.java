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
package uk.ac.sussex.gdsc.em.picker;

import uk.ac.sussex.gdsc.core.utils.SimpleArrayUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * The method used to remap pixel intensities.
 */
public enum ContrastMethod {
  /** The intensities are not changed. */
  NONE("None"),
  /**
   * Clip to the 2nd and 98th percentiles and rescale to [0, 255].
   */
  PERCENTILE_CLIP("Percentile clip"),
  /**
   * Clip to the mean plus or minus a factor of the standard deviation and rescale to [0, 255].
   * Preferred when a large dark background skews the percentiles.
   */
  SIGMA_CLIP("Sigma clip"),
  /**
   * Rank equalisation within a square neighbourhood sized relative to the particle diameter.
   */
  ADAPTIVE_LOCAL("Adaptive local");

  private static final String MSG_DEFAULT_IS_NULL = "Default value is null";

  /** The Constant values. */
  private static final ContrastMethod[] values;

  /** The Constant descriptions. */
  private static final String[] descriptions;

  static {
    values = values();
    descriptions = new String[values.length];
    for (int i = 0; i < values.length; i++) {
      descriptions[i] = values[i].getDescription();
    }
  }

  /** The description. */
  private final String description;

  ContrastMethod(String description) {
    this.description = description;
  }

  /**
   * Gets the description.
   *
   * @return the description
   */
  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return getDescription();
  }

  /**
   * Gets the descriptions for all of the values.
   *
   * @return the descriptions
   */
  public static String[] getDescriptions() {
    return descriptions.clone();
  }

  /**
   * Create from the description.
   *
   * @param description the description
   * @return the method (or null)
   * @see #getDescription()
   */
  public static ContrastMethod fromDescription(String description) {
    for (final ContrastMethod value : values) {
      if (value.getDescription().equals(description)) {
        return value;
      }
    }
    return null;
  }

  /**
   * Create from the enum {@link #ordinal()}.
   *
   * @param ordinal the ordinal
   * @return the method
   * @throws IndexOutOfBoundsException if the index is invalid
   */
  public static ContrastMethod fromOrdinal(int ordinal) {
    return values[ValidationUtils.checkIndex(ordinal, values)];
  }

  /**
   * Create from the enum {@link #ordinal()}.
   *
   * @param ordinal the ordinal
   * @param defaultValue the default value (must not be null)
   * @return the method
   * @throws NullPointerException if the default value is null
   */
  public static ContrastMethod fromOrdinal(int ordinal, ContrastMethod defaultValue) {
    return SimpleArrayUtils.getIndex(ordinal, values,
        ValidationUtils.checkNotNull(defaultValue, MSG_DEFAULT_IS_NULL));
  }
}
