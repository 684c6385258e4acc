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
 * Removes candidate points that are closer than a minimum separation.
 *
 * <p>Removal is symmetric: both points of a clashing pair are removed. Points at the same position
 * are duplicates and are also removed. The order of the surviving points is unchanged.
 */
public final class ClashResolver {
  /** No public constructor. */
  private ClashResolver() {}

  /**
   * Removes the clashes. Any pair of points with a distance less than or equal to the minimum
   * distance are both removed.
   *
   * <p>The output contains no pair of points within the minimum distance so repeating the
   * operation on the output removes nothing.
   *
   * @param points the points
   * @param minDistance the min distance
   * @return the surviving points
   */
  public static List<CandidatePoint> removeClashes(List<CandidatePoint> points,
      double minDistance) {
    final int size = points.size();
    final CandidatePoint[] data = points.toArray(new CandidatePoint[0]);
    final boolean[] clash = new boolean[size];
    final double d2 = minDistance * minDistance;
    for (int i = 0; i < size; i++) {
      final CandidatePoint p1 = data[i];
      for (int j = i + 1; j < size; j++) {
        if (p1.distanceSq(data[j]) <= d2) {
          clash[i] = true;
          clash[j] = true;
        }
      }
    }
    final LocalList<CandidatePoint> result = new LocalList<>(size);
    for (int i = 0; i < size; i++) {
      if (!clash[i]) {
        result.add(data[i]);
      }
    }
    return result;
  }

  /**
   * Count the clashing pairs.
   *
   * @param points the points
   * @param minDistance the min distance
   * @return the number of pairs within the minimum distance
   */
  public static int countClashes(List<CandidatePoint> points, double minDistance) {
    final CandidatePoint[] data = points.toArray(new CandidatePoint[0]);
    final double d2 = minDistance * minDistance;
    int count = 0;
    for (int i = 0; i < data.length; i++) {
      for (int j = i + 1; j < data.length; j++) {
        if (data[i].distanceSq(data[j]) <= d2) {
          count++;
        }
      }
    }
    return count;
  }
}
