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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.em.picker.CandidatePoint;

/**
 * Links each display point to the full-resolution point it was derived from.
 *
 * <p>Points loaded from a coordinate table keep their recorded full-resolution value and are
 * written back unchanged. Points added interactively or by the picker are new and have no
 * full-resolution value until the table is converted for saving. Display positions are unique.
 *
 * <p>Insertion order is preserved. This class is not thread-safe.
 */
public class CoordinateLinkTable {
  /** Map of display point to full-resolution point; a null value marks a new point. */
  private final LinkedHashMap<CandidatePoint, CandidatePoint> links = new LinkedHashMap<>();

  /**
   * Remove all points.
   */
  public void clear() {
    links.clear();
  }

  /**
   * Replace the contents with the full-resolution points. Each point is mapped to the display and
   * the link to the recorded value is kept. If two points map to the same display position the
   * first is kept.
   *
   * @param fullResolution the full-resolution points
   * @param mapper the mapper
   * @return the number of points loaded
   */
  public int load(List<CandidatePoint> fullResolution, CoordinateMapper mapper) {
    links.clear();
    for (final CandidatePoint full : fullResolution) {
      final CandidatePoint display = mapper.toDisplay(full);
      if (find(display) == null) {
        links.put(display, full);
      }
    }
    return links.size();
  }

  /**
   * Add a new point.
   *
   * @param point the display point
   * @return true if added; false if a point exists at the same position
   */
  public boolean add(CandidatePoint point) {
    Objects.requireNonNull(point, "point");
    if (find(point) != null) {
      return false;
    }
    links.put(point, null);
    return true;
  }

  /**
   * Remove the point at the same position.
   *
   * @param point the display point
   * @return true if removed
   */
  public boolean remove(CandidatePoint point) {
    final CandidatePoint key = find(point);
    if (key == null) {
      return false;
    }
    links.remove(key);
    return true;
  }

  /**
   * Toggle a point at the given position. The first point whose box of the given half-width
   * contains the position is removed. If no point is found a new point is added.
   *
   * @param x the x
   * @param y the y
   * @param halfWidth the box half-width
   * @return true if a point was added; false if one was removed
   */
  public boolean toggle(int x, int y, double halfWidth) {
    for (final CandidatePoint p : links.keySet()) {
      if (Math.abs(p.getX() - x) <= halfWidth && Math.abs(p.getY() - y) <= halfWidth) {
        links.remove(p);
        return false;
      }
    }
    links.put(new CandidatePoint(x, y), null);
    return true;
  }

  /**
   * Replace all points with the picked points. All points are new.
   *
   * @param points the display points
   */
  public void replaceWithPicked(List<CandidatePoint> points) {
    links.clear();
    points.forEach(this::add);
  }

  /**
   * Checks if the point at the same position is new.
   *
   * @param point the display point
   * @return true if new; false if it has a recorded full-resolution value or is not present
   */
  public boolean isNew(CandidatePoint point) {
    final CandidatePoint key = find(point);
    return key != null && links.get(key) == null;
  }

  /**
   * Gets the recorded full-resolution point for the display point.
   *
   * @param point the display point
   * @return the full-resolution point (or null if new or not present)
   */
  public CandidatePoint getFullResolution(CandidatePoint point) {
    final CandidatePoint key = find(point);
    return key == null ? null : links.get(key);
  }

  /**
   * Gets the number of points.
   *
   * @return the size
   */
  public int size() {
    return links.size();
  }

  /**
   * Gets the display points in insertion order.
   *
   * @return the display points
   */
  public List<CandidatePoint> getDisplayPoints() {
    return new LocalList<>(links.keySet());
  }

  /**
   * Convert the table to full-resolution points in insertion order. Recorded values are returned
   * unchanged; only new points are mapped.
   *
   * @param mapper the mapper
   * @return the full-resolution points
   */
  public List<CandidatePoint> toFullResolution(CoordinateMapper mapper) {
    final LocalList<CandidatePoint> list = new LocalList<>(links.size());
    for (final Map.Entry<CandidatePoint, CandidatePoint> e : links.entrySet()) {
      final CandidatePoint full = e.getValue();
      list.add(full == null ? mapper.toFullResolution(e.getKey()) : full);
    }
    return list;
  }

  private CandidatePoint find(CandidatePoint point) {
    for (final CandidatePoint p : links.keySet()) {
      if (p.isSamePosition(point)) {
        return p;
      }
    }
    return null;
  }
}
