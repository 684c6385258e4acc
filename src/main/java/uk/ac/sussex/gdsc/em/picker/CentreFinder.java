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

import ij.process.FloatProcessor;

/**
 * Finds the centre of the signal within a search window.
 */
public interface CentreFinder {
  /**
   * Find the centre of the signal in the window. The window has been blurred and oriented so the
   * signal is bright with a minimum of zero.
   *
   * @param window the window
   * @param threshold the refinement threshold in [0, 1)
   * @return the centre {x, y} in window pixel coordinates (may be NaN if undefined)
   */
  double[] findCentre(FloatProcessor window, double threshold);

  /**
   * Create the mask of pixels above {@code mean * (1 + threshold)}.
   *
   * @param window the window
   * @param threshold the threshold
   * @return the mask
   */
  static boolean[] threshold(FloatProcessor window, double threshold) {
    final float[] pixels = (float[]) window.getPixels();
    double sum = 0;
    for (final float v : pixels) {
      sum += v;
    }
    final double level = (sum / pixels.length) * (1 + threshold);
    final boolean[] mask = new boolean[pixels.length];
    for (int i = 0; i < pixels.length; i++) {
      mask[i] = pixels[i] > level;
    }
    return mask;
  }
}
