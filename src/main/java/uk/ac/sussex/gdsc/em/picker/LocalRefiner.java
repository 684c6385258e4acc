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
import java.util.List;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Re-centres each candidate on the centre of its underlying signal.
 *
 * <p>A square window of size {@code 2 * half + 1} is extracted around each candidate, where
 * {@code half = (int) (searchBox / 2)}. Candidates whose window would extend past the image edge
 * are not moved. The window is blurred and oriented so the particle is bright and a
 * {@link CentreFinder} locates the centre. Undefined (NaN) centres fall back to the window centre.
 * The window is re-centred on the new position until the position no longer moves, up to
 * {@link #MAX_ITERATIONS} times. A particle clipped by the first window is then fully contained.
 * The refined set is then passed through the {@link ClashResolver} and the {@link EdgeFilter}
 * since refinement can move points into a clash or off the edge.
 */
public class LocalRefiner {
  private static final Logger LOGGER = Logger.getLogger(LocalRefiner.class.getName());

  /** The maximum number of times a window is centred on a candidate. */
  public static final int MAX_ITERATIONS = 5;

  /**
   * Creates the centre finder for the method.
   *
   * @param method the method
   * @return the centre finder (or null for {@link RefinementMethod#NONE})
   */
  public static CentreFinder createCentreFinder(RefinementMethod method) {
    if (method == RefinementMethod.THRESHOLDING) {
      return new ThresholdCentreFinder();
    }
    if (method == RefinementMethod.CONTOURING) {
      return new ContourCentreFinder();
    }
    return null;
  }

  /**
   * Refine the candidates using the refinement method in the parameters. If the method is
   * {@link RefinementMethod#NONE} the candidates are returned unchanged.
   *
   * @param ip the image
   * @param candidates the candidates
   * @param parameters the parameters
   * @return the refined candidates
   */
  public List<CandidatePoint> refine(FloatProcessor ip, List<CandidatePoint> candidates,
      PickerParameters parameters) {
    ValidationUtils.checkNotNull(ip, "image");
    ValidationUtils.checkNotNull(parameters, "parameters");
    final CentreFinder finder = createCentreFinder(parameters.getRefinementMethod());
    if (finder == null) {
      return new LocalList<>(candidates);
    }
    final List<CandidatePoint> refined = refine(ip, candidates, parameters, finder);
    final List<CandidatePoint> unique =
        ClashResolver.removeClashes(refined, parameters.getRefinedClashDistance());
    final List<CandidatePoint> result = EdgeFilter.removeEdgePoints(unique,
        parameters.getParticleDiameter(), parameters.getEdgeRatio(), ip.getWidth(), ip.getHeight());
    LOGGER.fine(() -> String.format("Refined %d: unique=%d, inside=%d", refined.size(),
        unique.size(), result.size()));
    return result;
  }

  /**
   * Refine each candidate position. No clash or edge filtering is performed.
   *
   * @param ip the image
   * @param candidates the candidates
   * @param parameters the parameters
   * @param finder the centre finder
   * @return the refined candidates (same size and order as the input)
   */
  public List<CandidatePoint> refine(FloatProcessor ip, List<CandidatePoint> candidates,
      PickerParameters parameters, CentreFinder finder) {
    final int half = (int) (parameters.getSearchBox() / 2);
    final int size = 2 * half + 1;
    final int width = ip.getWidth();
    final int height = ip.getHeight();
    final float[] pixels = (float[]) ip.getPixels();
    final LocalList<CandidatePoint> result = new LocalList<>(candidates.size());
    for (final CandidatePoint p : candidates) {
      int x = (int) Math.round(p.getX());
      int y = (int) Math.round(p.getY());
      if (!inside(x, y, half, width, height)) {
        // Window cannot be centred: keep the original position
        result.add(p);
        continue;
      }
      for (int i = 0; i < MAX_ITERATIONS && inside(x, y, half, width, height); i++) {
        final FloatProcessor window =
            prepareWindow(extract(pixels, width, x - half, y - half, size), parameters);
        final double[] centre = finder.findCentre(window, parameters.getRefinementThreshold());
        double ox = centre[0];
        double oy = centre[1];
        if (Double.isNaN(ox) || Double.isNaN(oy)) {
          ox = half;
          oy = half;
        }
        final int nx = (int) Math.round(x - half + ox);
        final int ny = (int) Math.round(y - half + oy);
        if (nx == x && ny == y) {
          break;
        }
        x = nx;
        y = ny;
      }
      result.add(p.moveTo(x, y));
    }
    return result;
  }

  private static boolean inside(int x, int y, int half, int width, int height) {
    return x >= half && y >= half && x + half < width && y + half < height;
  }

  private static FloatProcessor extract(float[] pixels, int width, int ox, int oy, int size) {
    final float[] data = new float[size * size];
    for (int y = 0; y < size; y++) {
      System.arraycopy(pixels, (oy + y) * width + ox, data, y * size, size);
    }
    return new FloatProcessor(size, size, data);
  }

  /**
   * Blur the window and orient it so the particle is bright with a minimum of zero.
   *
   * @param window the window
   * @param parameters the parameters
   * @return the prepared window
   */
  static FloatProcessor prepareWindow(FloatProcessor window, PickerParameters parameters) {
    final FloatProcessor blurred = ImageFilters.blur(window, parameters.getBlurSigma());
    if (parameters.isNegativeStain()) {
      return ImageFilters.subtractMin(blurred);
    }
    // max - v: inverted with the minimum at zero
    return ImageFilters.subtractMin(ImageFilters.invert(blurred));
  }
}
