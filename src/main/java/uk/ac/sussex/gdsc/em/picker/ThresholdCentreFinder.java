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
 * Finds the centre of mass of the pixels above a threshold relative to the window mean.
 *
 * <p>Fast and robust for roughly circular signal.
 */
public class ThresholdCentreFinder implements CentreFinder {
  @Override
  public double[] findCentre(FloatProcessor window, double threshold) {
    final boolean[] mask = CentreFinder.threshold(window, threshold);
    final int width = window.getWidth();
    final int height = window.getHeight();
    double sumx = 0;
    double sumy = 0;
    int count = 0;
    for (int y = 0, i = 0; y < height; y++) {
      for (int x = 0; x < width; x++, i++) {
        if (mask[i]) {
          sumx += x;
          sumy += y;
          count++;
        }
      }
    }
    // An empty mask is undefined (NaN)
    return new double[] {sumx / count, sumy / count};
  }
}
