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

/**
 * Signals that peak detection found more maxima than the configured limit.
 */
public class TooManyPeaksException extends Exception {
  private static final long serialVersionUID = 1L;

  /** The message suggesting how to reduce the number of peaks. */
  public static final String MESSAGE =
      "Too many peaks, try increasing the Threshold value or Min. distance";

  /** The peak count. */
  private final int peakCount;

  /** The max peaks. */
  private final int maxPeaks;

  /**
   * Create a new instance.
   *
   * @param peakCount the peak count
   * @param maxPeaks the max peaks
   */
  public TooManyPeaksException(int peakCount, int maxPeaks) {
    super(MESSAGE + " (" + peakCount + " > " + maxPeaks + ")");
    this.peakCount = peakCount;
    this.maxPeaks = maxPeaks;
  }

  /**
   * Gets the number of peaks found.
   *
   * @return the peak count
   */
  public int getPeakCount() {
    return peakCount;
  }

  /**
   * Gets the maximum allowed number of peaks.
   *
   * @return the max peaks
   */
  public int getMaxPeaks() {
    return maxPeaks;
  }
}
