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
 * Creates synthetic micrographs containing flat disks.
 */
final class SyntheticImages {
  /** The background level. */
  static final float BACKGROUND = 100;

  private SyntheticImages() {}

  /**
   * Create an image with a uniform background.
   *
   * @param width the width
   * @param height the height
   * @return the image
   */
  static FloatProcessor background(int width, int height) {
    final FloatProcessor fp = new FloatProcessor(width, height);
    fp.set(BACKGROUND);
    return fp;
  }

  /**
   * Draw a disk with the given value. Pixels within the radius of the centre are set.
   *
   * @param fp the image
   * @param cx the centre x
   * @param cy the centre y
   * @param radius the radius
   * @param value the value
   */
  static void disk(FloatProcessor fp, int cx, int cy, double radius, float value) {
    final double r2 = radius * radius;
    for (int y = 0; y < fp.getHeight(); y++) {
      for (int x = 0; x < fp.getWidth(); x++) {
        final double dx = x - cx;
        final double dy = y - cy;
        if (dx * dx + dy * dy <= r2) {
          fp.setf(x, y, value);
        }
      }
    }
  }
}
