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
import ij.process.ImageProcessor;
import java.util.List;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.TextUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Runs the complete particle picking pipeline on a single image.
 *
 * <p>The pipeline is: optional outlier whitening, contrast enhancement, peak detection
 * (including clash and edge filtering) and optional local refinement. The input image is not
 * modified. Each call uses only its arguments so independent images may be processed in parallel.
 */
public class AutoPicker {
  private static final Logger LOGGER = Logger.getLogger(AutoPicker.class.getName());

  private final PeakDetector detector;
  private final LocalRefiner refiner;

  /**
   * Create a new instance.
   */
  public AutoPicker() {
    this(new PeakDetector(), new LocalRefiner());
  }

  /**
   * Create a new instance.
   *
   * @param detector the detector
   * @param refiner the refiner
   */
  public AutoPicker(PeakDetector detector, LocalRefiner refiner) {
    this.detector = ValidationUtils.checkNotNull(detector, "detector");
    this.refiner = ValidationUtils.checkNotNull(refiner, "refiner");
  }

  /**
   * Run the picker. The image is converted to float.
   *
   * @param ip the image
   * @param parameters the parameters
   * @return the result
   */
  public AutoPickResult run(ImageProcessor ip, PickerParameters parameters) {
    ValidationUtils.checkNotNull(ip, "image");
    ValidationUtils.checkNotNull(parameters, "parameters");
    ValidationUtils.checkArgument(ip.getWidth() > 0 && ip.getHeight() > 0, "Empty image");
    // Work on a copy of the parameters so the run is not affected by concurrent modification
    final PickerParameters params = parameters.copy();
    LOGGER.fine(() -> "Picking: " + params);

    FloatProcessor fp = toFloat(ip);
    if (params.isWhitenOutliers()) {
      fp = ContrastEnhancer.whitenOutliers(fp, params.getSigmaFactor());
    }
    final FloatProcessor enhanced =
        ContrastEnhancer.enhance(fp, params.getContrastMethod(), params);

    List<CandidatePoint> points;
    try {
      points = detector.findPeaks(enhanced, params);
    } catch (final TooManyPeaksException ex) {
      LOGGER.warning(ex::getMessage);
      return AutoPickResult.tooManyPeaks(ex);
    }

    points = refiner.refine(enhanced, points, params);
    final int count = points.size();
    LOGGER.fine(() -> "Picked " + TextUtils.pleural(count, "particle"));
    return AutoPickResult.ok(points);
  }

  private static FloatProcessor toFloat(ImageProcessor ip) {
    if (ip instanceof FloatProcessor) {
      return (FloatProcessor) ip.duplicate();
    }
    return ip.convertToFloatProcessor();
  }
}
