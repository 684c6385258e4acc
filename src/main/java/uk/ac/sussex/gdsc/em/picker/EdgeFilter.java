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

import java.util.List;
import uk.ac.sussex.gdsc.core.utils.LocalList;

/**
 * Removes candidate points too close to the image boundary for a full particle box.
 */
public final class EdgeFilter {
  /** No public constructor. */
  private EdgeFilter() {}

  /**
   * Removes the points within the default fraction of the particle diameter of any image edge.
   *
   * @param points the points
   * @param particleDiameter the particle diameter
   * @param width the image width
   * @param height the image height
   * @return the surviving points (in input order)
   * @see PickerParameters#DEFAULT_EDGE_RATIO
   */
  public static List<CandidatePoint> removeEdgePoints(List<CandidatePoint> points,
      double particleDiameter, int width, int height) {
    return removeEdgePoints(points, particleDiameter, PickerParameters.DEFAULT_EDGE_RATIO, width,
        height);
  }

  /**
   * Removes the points within {@code edgeRatio * particleDiameter} of any image edge.
   *
   * @param points the points
   * @param particleDiameter the particle diameter
   * @param edgeRatio the edge ratio
   * @param width the image width
   * @param height the image height
   * @return the surviving points (in input order)
   */
  public static List<CandidatePoint> removeEdgePoints(List<CandidatePoint> points,
      double particleDiameter, double edgeRatio, int width, int height) {
    final double cutoff = edgeRatio * particleDiameter;
    final double maxx = width - cutoff;
    final double maxy = height - cutoff;
    final LocalList<CandidatePoint> result = new LocalList<>(points.size());
    for (final CandidatePoint p : points) {
      final double x = p.getX();
      final double y = p.getY();
      if (x >= cutoff && y >= cutoff && x <= maxx && y <= maxy) {
        result.add(p);
      }
    }
    return result;
  }
}
