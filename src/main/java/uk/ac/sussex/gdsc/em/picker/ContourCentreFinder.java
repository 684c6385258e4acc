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
 * Finds the centroid of the thresholded region nearest the window centre.
 *
 * <p>The window is simplified with a grey-scale closing to suppress small regions before masking.
 * The rounded centroid of each connected region is a candidate; the candidate nearest the window
 * centre is chosen if it is within the maximum squared distance
 * {@code ((cx / 2)^2 + (cy / 2)^2) * 0.5}, otherwise the window centre is returned. Handles
 * non-circular particles better than thresholding at a higher cost.
 */
public class ContourCentreFinder implements CentreFinder {
  /** The number of dilations (then erosions) used to simplify the window. */
  public static final int SIMPLIFY_ITERATIONS = 2;

  @Override
  public double[] findCentre(FloatProcessor window, double threshold) {
    final FloatProcessor simple = simplify(window, SIMPLIFY_ITERATIONS);
    final boolean[] mask = CentreFinder.threshold(simple, threshold);
    final ObjectAnalyzer oa =
        new ObjectAnalyzer(mask, window.getWidth(), window.getHeight(), true);

    final double cx = (window.getWidth() - 1) / 2.0;
    final double cy = (window.getHeight() - 1) / 2.0;
    final double maxDistanceSq = (cx * cx / 4 + cy * cy / 4) * 0.5;

    double[] best = {cx, cy};
    double bestDistanceSq = Double.POSITIVE_INFINITY;
    final double[][] centres = oa.getObjectCentres();
    for (int id = 1; id < centres.length; id++) {
      final double x = Math.round(centres[id][0]);
      final double y = Math.round(centres[id][1]);
      final double dx = x - cx;
      final double dy = y - cy;
      final double d2 = dx * dx + dy * dy;
      if (d2 <= maxDistanceSq && d2 < bestDistanceSq) {
        bestDistanceSq = d2;
        best = new double[] {x, y};
      }
    }
    return best;
  }

  /**
   * Simplify the image with a number of 3x3 dilations followed by the same number of erosions.
   *
   * @param ip the image
   * @param iterations the iterations
   * @return the simplified image
   */
  static FloatProcessor simplify(FloatProcessor ip, int iterations) {
    FloatProcessor fp = ip;
    for (int i = 0; i < iterations; i++) {
      fp = ImageFilters.max(fp, 1);
    }
    for (int i = 0; i < iterations; i++) {
      fp = ImageFilters.min(fp, 1);
    }
    return fp == ip ? (FloatProcessor) ip.duplicate() : fp;
  }
}
