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

import ij.plugin.filter.GaussianBlur;
import ij.plugin.filter.RankFilters;
import ij.process.FloatProcessor;
import uk.ac.sussex.gdsc.core.utils.MathUtils;

/**
 * Filters shared by the detection and refinement stages. All methods return a new image.
 */
final class ImageFilters {
  /** The accuracy of the Gaussian kernel. */
  private static final double BLUR_ACCURACY = 0.0002;

  /** No public constructor. */
  private ImageFilters() {}

  /**
   * Apply a Gaussian blur. Returns a copy of the image if {@code sigma <= 0}.
   *
   * @param ip the image
   * @param sigma the blur standard deviation
   * @return the blurred image
   */
  static FloatProcessor blur(FloatProcessor ip, double sigma) {
    final FloatProcessor fp = (FloatProcessor) ip.duplicate();
    if (sigma > 0) {
      new GaussianBlur().blurGaussian(fp, sigma, sigma, BLUR_ACCURACY);
    }
    return fp;
  }

  /**
   * Invert the intensities within the image range: {@code min + max - v}.
   *
   * @param ip the image
   * @return the inverted image
   */
  static FloatProcessor invert(FloatProcessor ip) {
    final float[] pixels = ((float[]) ip.getPixels()).clone();
    final float[] limits = MathUtils.limits(pixels);
    final float sum = limits[0] + limits[1];
    for (int i = 0; i < pixels.length; i++) {
      pixels[i] = sum - pixels[i];
    }
    return new FloatProcessor(ip.getWidth(), ip.getHeight(), pixels);
  }

  /**
   * Subtract the minimum so the lowest value is zero.
   *
   * @param ip the image
   * @return the shifted image
   */
  static FloatProcessor subtractMin(FloatProcessor ip) {
    final float[] pixels = ((float[]) ip.getPixels()).clone();
    final float min = MathUtils.limits(pixels)[0];
    for (int i = 0; i < pixels.length; i++) {
      pixels[i] -= min;
    }
    return new FloatProcessor(ip.getWidth(), ip.getHeight(), pixels);
  }

  /**
   * Apply a maximum filter with a circular kernel. Edge pixels are extended.
   *
   * @param ip the image
   * @param radius the radius
   * @return the filtered image
   */
  static FloatProcessor max(FloatProcessor ip, double radius) {
    return rank(ip, radius, RankFilters.MAX);
  }

  /**
   * Apply a minimum filter with a circular kernel. Edge pixels are extended.
   *
   * @param ip the image
   * @param radius the radius
   * @return the filtered image
   */
  static FloatProcessor min(FloatProcessor ip, double radius) {
    return rank(ip, radius, RankFilters.MIN);
  }

  private static FloatProcessor rank(FloatProcessor ip, double radius, int filterType) {
    final FloatProcessor fp = (FloatProcessor) ip.duplicate();
    new RankFilters().rank(fp, radius, filterType);
    return fp;
  }
}
