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
import java.util.List;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Finds particle-like centroids as local maxima of a background-subtracted image.
 *
 * <p>The image is blurred and the background is estimated with a maximum filter. Particles are
 * darker than their surroundings (the image is inverted first for negative stain) so the residual
 * {@code max - blurred} is bright at particle centres. The residual contrast is normalised and
 * local maxima are extracted with a minimum separation and a relative threshold. The result is
 * then passed through the {@link ClashResolver} and the {@link EdgeFilter}.
 *
 * <p>This class holds no state and may be used concurrently.
 */
public class PeakDetector {
  private static final Logger LOGGER = Logger.getLogger(PeakDetector.class.getName());

  /**
   * Find the peaks.
   *
   * @param ip the image
   * @param parameters the parameters
   * @return the peaks
   * @throws TooManyPeaksException if the number of raw maxima exceeds the configured limit
   */
  public List<CandidatePoint> findPeaks(FloatProcessor ip, PickerParameters parameters)
      throws TooManyPeaksException {
    ValidationUtils.checkNotNull(ip, "image");
    ValidationUtils.checkNotNull(parameters, "parameters");

    final FloatProcessor residual = computeResidual(ip, parameters);
    final List<CandidatePoint> maxima =
        findMaxima(residual, parameters.getMinDistance(), parameters.getThreshold());
    if (maxima.size() > parameters.getMaxPeaks()) {
      throw new TooManyPeaksException(maxima.size(), parameters.getMaxPeaks());
    }

    final List<CandidatePoint> peaks = suppress(maxima, parameters.getMinDistance());
    final List<CandidatePoint> unique =
        ClashResolver.removeClashes(peaks, parameters.getClashDistance());
    final List<CandidatePoint> result = EdgeFilter.removeEdgePoints(unique,
        parameters.getParticleDiameter(), parameters.getEdgeRatio(), ip.getWidth(), ip.getHeight());
    LOGGER.fine(() -> String.format("Peaks: maxima=%d, separated=%d, unique=%d, inside=%d",
        maxima.size(), peaks.size(), unique.size(), result.size()));
    return result;
  }

  /**
   * Compute the background-subtracted residual image with normalised contrast.
   *
   * @param ip the image
   * @param parameters the parameters
   * @return the residual
   */
  FloatProcessor computeResidual(FloatProcessor ip, PickerParameters parameters) {
    FloatProcessor blurred = ImageFilters.blur(ip, parameters.getBlurSigma());
    if (parameters.isNegativeStain()) {
      blurred = ImageFilters.invert(blurred);
    }
    final FloatProcessor background =
        ImageFilters.max(blurred, parameters.getBackgroundRadius());
    final float[] b = (float[]) background.getPixels();
    final float[] s = (float[]) blurred.getPixels();
    for (int i = 0; i < b.length; i++) {
      b[i] -= s[i];
    }
    return ContrastEnhancer.enhance(background, parameters.getResidualContrast(), parameters);
  }

  /**
   * Find the local maxima. A pixel is a maximum if it is equal to the maximum within the given
   * radius and above {@code min + threshold * (max - min)} of the image. Connected maxima (a
   * plateau) are reported once at their rounded centroid.
   *
   * <p>The maxima are returned in descending order of height. The score is the height normalised
   * to the image range.
   *
   * @param ip the image
   * @param radius the search radius
   * @param threshold the relative threshold
   * @return the maxima
   */
  static List<CandidatePoint> findMaxima(FloatProcessor ip, double radius, double threshold) {
    final float[] pixels = (float[]) ip.getPixels();
    final float[] limits = MathUtils.limits(pixels);
    final double range = (double) limits[1] - limits[0];
    if (range <= 0) {
      // Flat image
      return new LocalList<>();
    }
    final double level = limits[0] + threshold * range;
    final float[] maxPixels = (float[]) ImageFilters.max(ip, radius).getPixels();

    final boolean[] mask = new boolean[pixels.length];
    for (int i = 0; i < pixels.length; i++) {
      mask[i] = pixels[i] == maxPixels[i] && pixels[i] > level;
    }

    // Adjacent maxima must have equal height so each object is a single plateau
    final int width = ip.getWidth();
    final ObjectAnalyzer oa = new ObjectAnalyzer(mask, width, ip.getHeight(), true);
    final int[] objectMask = oa.getObjectMask();
    final float[] height = new float[oa.getMaxObject() + 1];
    for (int i = 0; i < objectMask.length; i++) {
      if (objectMask[i] != 0) {
        height[objectMask[i]] = pixels[i];
      }
    }

    final double[][] centres = oa.getObjectCentres();
    final Maximum[] maxima = new Maximum[oa.getMaxObject()];
    for (int id = 1; id < centres.length; id++) {
      final int x = (int) Math.round(centres[id][0]);
      final int y = (int) Math.round(centres[id][1]);
      maxima[id - 1] = new Maximum(x, y, y * width + x, height[id]);
    }
    Arrays.sort(maxima, PeakDetector::compare);

    final LocalList<CandidatePoint> list = new LocalList<>(maxima.length);
    for (final Maximum m : maxima) {
      list.add(new CandidatePoint(m.x, m.y, (m.value - limits[0]) / range));
    }
    return list;
  }

  /**
   * Greedy suppression of lower maxima within the minimum distance of a higher maximum. The input
   * must be in descending order of height.
   *
   * @param maxima the maxima
   * @param minDistance the min distance
   * @return the separated maxima
   */
  static List<CandidatePoint> suppress(List<CandidatePoint> maxima, double minDistance) {
    final double d2 = minDistance * minDistance;
    final LocalList<CandidatePoint> kept = new LocalList<>(maxima.size());
    for (final CandidatePoint p : maxima) {
      if (!isWithin(kept, p, d2)) {
        kept.add(p);
      }
    }
    return kept;
  }

  private static boolean isWithin(List<CandidatePoint> points, CandidatePoint p, double d2) {
    for (final CandidatePoint k : points) {
      if (k.distanceSq(p) <= d2) {
        return true;
      }
    }
    return false;
  }

  private static int compare(Maximum m1, Maximum m2) {
    final int result = Float.compare(m2.value, m1.value);
    return result == 0 ? Integer.compare(m1.index, m2.index) : result;
  }

  /** A local maximum. */
  private static class Maximum {
    final int x;
    final int y;
    final int index;
    final float value;

    Maximum(int x, int y, int index, float value) {
      this.x = x;
      this.y = y;
      this.index = index;
      this.value = value;
    }
  }
}
