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
import java.util.Arrays;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.core.utils.SimpleArrayUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Remaps pixel intensities to improve contrast. All methods return a new image; the input is not
 * modified.
 */
public final class ContrastEnhancer {
  /** The maximum output value. */
  public static final float MAX_VALUE = 255f;
  /** The lower percentile used for percentile clipping. */
  public static final double LOWER_PERCENTILE = 2;
  /** The upper percentile used for percentile clipping. */
  public static final double UPPER_PERCENTILE = 98;
  /** The adaptive neighbourhood half-width as a multiple of the particle diameter. */
  public static final double ADAPTIVE_RATIO = 2;

  private static final int LEVELS = 256;

  /** No public constructor. */
  private ContrastEnhancer() {}

  /**
   * Enhance the contrast using the given method.
   *
   * @param ip the image
   * @param method the method
   * @param parameters the parameters (used for the particle diameter and sigma factor)
   * @return the enhanced image
   */
  public static FloatProcessor enhance(FloatProcessor ip, ContrastMethod method,
      PickerParameters parameters) {
    ValidationUtils.checkNotNull(ip, "image");
    ValidationUtils.checkNotNull(parameters, "parameters");
    switch (method == null ? ContrastMethod.NONE : method) {
      case PERCENTILE_CLIP:
        return percentileClip(ip);
      case SIGMA_CLIP:
        return sigmaClip(ip, parameters.getSigmaFactor());
      case ADAPTIVE_LOCAL:
        return adaptiveLocal(ip,
            Math.max(1, (int) Math.ceil(ADAPTIVE_RATIO * parameters.getParticleDiameter())));
      case NONE:
      default:
        return (FloatProcessor) ip.duplicate();
    }
  }

  /**
   * Clip the image to the 2nd and 98th percentiles and rescale to [0, 255].
   *
   * @param ip the image
   * @return the new image
   */
  public static FloatProcessor percentileClip(FloatProcessor ip) {
    final double[] values = SimpleArrayUtils.toDouble((float[]) ip.getPixels());
    final Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
    percentile.setData(values);
    final double lower = percentile.evaluate(LOWER_PERCENTILE);
    final double upper = percentile.evaluate(UPPER_PERCENTILE);
    return rescale(ip, lower, upper);
  }

  /**
   * Clip the image to the mean plus or minus the standard deviation multiplied by a factor and
   * rescale to [0, 255].
   *
   * @param ip the image
   * @param sigmaFactor the sigma factor
   * @return the new image
   */
  public static FloatProcessor sigmaClip(FloatProcessor ip, double sigmaFactor) {
    final double[] limits = sigmaLimits(ip, sigmaFactor);
    return rescale(ip, limits[0], limits[1]);
  }

  /**
   * Replace pixels outside the mean plus or minus the standard deviation multiplied by a factor
   * with the nearest limit. The intensity range is otherwise unchanged.
   *
   * @param ip the image
   * @param sigmaFactor the sigma factor
   * @return the new image
   */
  public static FloatProcessor whitenOutliers(FloatProcessor ip, double sigmaFactor) {
    final double[] limits = sigmaLimits(ip, sigmaFactor);
    final float lower = (float) limits[0];
    final float upper = (float) limits[1];
    final float[] pixels = ((float[]) ip.getPixels()).clone();
    for (int i = 0; i < pixels.length; i++) {
      if (pixels[i] < lower) {
        pixels[i] = lower;
      } else if (pixels[i] > upper) {
        pixels[i] = upper;
      }
    }
    return new FloatProcessor(ip.getWidth(), ip.getHeight(), pixels);
  }

  private static double[] sigmaLimits(FloatProcessor ip, double sigmaFactor) {
    final double[] values = SimpleArrayUtils.toDouble((float[]) ip.getPixels());
    final double mean = new Mean().evaluate(values);
    final double sd = new StandardDeviation(false).evaluate(values, mean);
    return new double[] {mean - sd * sigmaFactor, mean + sd * sigmaFactor};
  }

  /**
   * Clip the image to the limits and linearly rescale to [0, 255]. If the limits are equal the
   * output is zero.
   *
   * @param ip the image
   * @param lower the lower limit
   * @param upper the upper limit
   * @return the new image
   */
  public static FloatProcessor rescale(FloatProcessor ip, double lower, double upper) {
    final float[] pixels = (float[]) ip.getPixels();
    final float[] out = new float[pixels.length];
    final double range = upper - lower;
    if (range > 0) {
      final double scale = MAX_VALUE / range;
      for (int i = 0; i < pixels.length; i++) {
        final double v = pixels[i];
        if (v <= lower) {
          out[i] = 0;
        } else if (v >= upper) {
          out[i] = MAX_VALUE;
        } else {
          out[i] = (float) ((v - lower) * scale);
        }
      }
    }
    return new FloatProcessor(ip.getWidth(), ip.getHeight(), out);
  }

  /**
   * Equalise the contrast within a square neighbourhood. Each pixel is mapped to its rank within
   * the neighbourhood (ties count as half) scaled to [0, 255]. The neighbourhood is clipped at the
   * image edges.
   *
   * <p>Intensities are first quantised to 256 levels using the image range so a sliding histogram
   * can be used.
   *
   * @param ip the image
   * @param halfWidth the neighbourhood half-width
   * @return the new image
   */
  public static FloatProcessor adaptiveLocal(FloatProcessor ip, int halfWidth) {
    final int width = ip.getWidth();
    final int height = ip.getHeight();
    final int[] levels = quantise((float[]) ip.getPixels());
    final float[] out = new float[levels.length];
    final int[] histogram = new int[LEVELS];

    for (int y = 0; y < height; y++) {
      final int y1 = Math.max(0, y - halfWidth);
      final int y2 = Math.min(height - 1, y + halfWidth);
      Arrays.fill(histogram, 0);
      int count = 0;
      // Initialise with the columns [0, halfWidth - 1]
      for (int x = 0, limit = Math.min(width, halfWidth); x < limit; x++) {
        count += addColumn(levels, histogram, width, x, y1, y2, 1);
      }
      for (int x = 0; x < width; x++) {
        // Slide the window: add the leading column and remove the trailing column
        final int lead = x + halfWidth;
        if (lead < width) {
          count += addColumn(levels, histogram, width, lead, y1, y2, 1);
        }
        final int trail = x - halfWidth - 1;
        if (trail >= 0) {
          count += addColumn(levels, histogram, width, trail, y1, y2, -1);
        }
        final int i = y * width + x;
        final int level = levels[i];
        int below = 0;
        for (int b = 0; b < level; b++) {
          below += histogram[b];
        }
        out[i] = (float) (MAX_VALUE * (below + 0.5 * histogram[level]) / count);
      }
    }
    return new FloatProcessor(width, height, out);
  }

  private static int addColumn(int[] levels, int[] histogram, int width, int x, int y1, int y2,
      int delta) {
    for (int y = y1, i = y1 * width + x; y <= y2; y++, i += width) {
      histogram[levels[i]] += delta;
    }
    return delta * (y2 - y1 + 1);
  }

  private static int[] quantise(float[] pixels) {
    final float[] limits = MathUtils.limits(pixels);
    final float min = limits[0];
    final float max = limits[1];
    final int[] levels = new int[pixels.length];
    if (max > min) {
      final double scale = (LEVELS - 1) / ((double) max - min);
      for (int i = 0; i < pixels.length; i++) {
        levels[i] = (int) Math.round((pixels[i] - min) * scale);
      }
    }
    return levels;
  }
}
