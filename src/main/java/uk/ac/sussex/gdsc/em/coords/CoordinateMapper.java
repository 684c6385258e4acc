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
package uk.ac.sussex.gdsc.em.coords;

import java.util.List;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.em.picker.CandidatePoint;

/**
 * Converts coordinates between the display image and the full-resolution image.
 *
 * <p>The scale factor is {@code full / display}. Conversions truncate to an integer so a round
 * trip {@code toDisplay(toFullResolution(p))} may differ from {@code p} by 1 pixel when the scale
 * is at least 1 (the display image is not larger than the full-resolution image).
 *
 * <p>If the x and y scale factors differ the images are not proportional. This is logged as a
 * warning and the average scale is used for both axes.
 *
 * <p>The y-axis can optionally be inverted so full-resolution y is measured from the bottom edge.
 * This is disabled by default.
 */
public class CoordinateMapper {
  /** The relative tolerance for equal x and y scale factors. */
  public static final double PROPORTIONAL_TOLERANCE = 0.01;

  private static final Logger LOGGER = Logger.getLogger(CoordinateMapper.class.getName());

  private final int fullWidth;
  private final int fullHeight;
  private final int displayWidth;
  private final int displayHeight;
  private final boolean invertY;
  private final double scale;
  private final boolean proportional;

  /**
   * Create a new instance without y-axis inversion.
   *
   * @param fullWidth the full width
   * @param fullHeight the full height
   * @param displayWidth the display width
   * @param displayHeight the display height
   */
  public CoordinateMapper(int fullWidth, int fullHeight, int displayWidth, int displayHeight) {
    this(fullWidth, fullHeight, displayWidth, displayHeight, false);
  }

  /**
   * Create a new instance.
   *
   * @param fullWidth the full width
   * @param fullHeight the full height
   * @param displayWidth the display width
   * @param displayHeight the display height
   * @param invertY set to true to invert the full-resolution y-axis
   * @throws IllegalArgumentException if any dimension is not strictly positive
   */
  public CoordinateMapper(int fullWidth, int fullHeight, int displayWidth, int displayHeight,
      boolean invertY) {
    if (fullWidth <= 0 || fullHeight <= 0 || displayWidth <= 0 || displayHeight <= 0) {
      throw new IllegalArgumentException(
          String.format("Invalid dimensions: full %dx%d, display %dx%d", fullWidth, fullHeight,
              displayWidth, displayHeight));
    }
    this.fullWidth = fullWidth;
    this.fullHeight = fullHeight;
    this.displayWidth = displayWidth;
    this.displayHeight = displayHeight;
    this.invertY = invertY;
    final double sx = (double) fullWidth / displayWidth;
    final double sy = (double) fullHeight / displayHeight;
    proportional = Math.abs(sx - sy) <= PROPORTIONAL_TOLERANCE * Math.max(sx, sy);
    if (proportional) {
      scale = sx;
    } else {
      scale = (sx + sy) / 2;
      LOGGER.warning(() -> String.format(
          "Display image %dx%d is not proportional to full image %dx%d "
              + "(scale x=%s, y=%s); using average scale %s",
          displayWidth, displayHeight, fullWidth, fullHeight, MathUtils.rounded(sx),
          MathUtils.rounded(sy), MathUtils.rounded(scale)));
    }
  }

  /**
   * Gets the scale factor (full / display).
   *
   * @return the scale
   */
  public double getScale() {
    return scale;
  }

  /**
   * Checks if the x and y scale factors are equal (within tolerance).
   *
   * @return true if proportional
   */
  public boolean isProportional() {
    return proportional;
  }

  /**
   * Checks if the y-axis is inverted.
   *
   * @return true if invert Y
   */
  public boolean isInvertY() {
    return invertY;
  }

  /**
   * Gets the full width.
   *
   * @return the full width
   */
  public int getFullWidth() {
    return fullWidth;
  }

  /**
   * Gets the full height.
   *
   * @return the full height
   */
  public int getFullHeight() {
    return fullHeight;
  }

  /**
   * Gets the display width.
   *
   * @return the display width
   */
  public int getDisplayWidth() {
    return displayWidth;
  }

  /**
   * Gets the display height.
   *
   * @return the display height
   */
  public int getDisplayHeight() {
    return displayHeight;
  }

  /**
   * Gets the size of a display pixel given the size of a full-resolution pixel.
   *
   * @param pixelSize the full-resolution pixel size (e.g. Angstrom per pixel)
   * @return the display pixel size
   * @throws IllegalArgumentException if the pixel size is not strictly positive
   */
  public double getDisplayPixelSize(double pixelSize) {
    ValidationUtils.checkStrictlyPositive(pixelSize, "pixelSize");
    return pixelSize * scale;
  }

  /**
   * Convert a length in the units of the full-resolution pixel size to display pixels. The result
   * is truncated.
   *
   * <p>For example a 150 Angstrom particle in a 4x downsampled preview of a micrograph with 1.5
   * Angstrom pixels is {@code (int) (150 / 6) = 25} display pixels.
   *
   * @param length the length (e.g. Angstrom)
   * @param pixelSize the full-resolution pixel size (e.g. Angstrom per pixel)
   * @return the display length in pixels
   * @throws IllegalArgumentException if the pixel size is not strictly positive
   */
  public int toDisplayLength(double length, double pixelSize) {
    return (int) (length / getDisplayPixelSize(pixelSize));
  }

  /**
   * Convert a display point to full resolution. Coordinates are multiplied by the scale and
   * truncated. The score is clamped to be non-negative.
   *
   * @param point the display point
   * @return the full-resolution point
   */
  public CandidatePoint toFullResolution(CandidatePoint point) {
    final double x = (int) (point.getX() * scale);
    double y = (int) (point.getY() * scale);
    if (invertY) {
      y = fullHeight - y;
    }
    return new CandidatePoint(x, y, clampScore(point.getScore()));
  }

  /**
   * Convert a full-resolution point to the display. Coordinates are divided by the scale and
   * truncated. The score is clamped to be non-negative.
   *
   * @param point the full-resolution point
   * @return the display point
   */
  public CandidatePoint toDisplay(CandidatePoint point) {
    final double fy = invertY ? fullHeight - point.getY() : point.getY();
    final double x = (int) (point.getX() / scale);
    final double y = (int) (fy / scale);
    return new CandidatePoint(x, y, clampScore(point.getScore()));
  }

  /**
   * Convert full-resolution points to the display.
   *
   * @param points the full-resolution points
   * @return the display points
   */
  public List<CandidatePoint> toDisplay(List<CandidatePoint> points) {
    final LocalList<CandidatePoint> list = new LocalList<>(points.size());
    points.forEach(p -> list.add(toDisplay(p)));
    return list;
  }

  private static double clampScore(double score) {
    return score > 0 ? score : 0;
  }
}
