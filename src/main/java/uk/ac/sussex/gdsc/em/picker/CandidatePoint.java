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

import java.util.Objects;

/**
 * A putative particle location with a figure-of-merit score.
 *
 * <p>Display-space points have integer coordinates. Full-resolution points read from a coordinate
 * table may carry fractional coordinates which are preserved.
 */
public final class CandidatePoint {
  /** The default score for manually placed points. */
  public static final double DEFAULT_SCORE = 1.0;

  private final double x;
  private final double y;
  private final double score;

  /**
   * Create a new instance with the default score.
   *
   * @param x the x
   * @param y the y
   */
  public CandidatePoint(double x, double y) {
    this(x, y, DEFAULT_SCORE);
  }

  /**
   * Create a new instance.
   *
   * @param x the x
   * @param y the y
   * @param score the score
   */
  public CandidatePoint(double x, double y, double score) {
    this.x = x;
    this.y = y;
    this.score = score;
  }

  /**
   * Gets the x.
   *
   * @return the x
   */
  public double getX() {
    return x;
  }

  /**
   * Gets the y.
   *
   * @return the y
   */
  public double getY() {
    return y;
  }

  /**
   * Gets the x as an integer (truncated).
   *
   * @return the x
   */
  public int getXint() {
    return (int) x;
  }

  /**
   * Gets the y as an integer (truncated).
   *
   * @return the y
   */
  public int getYint() {
    return (int) y;
  }

  /**
   * Gets the score.
   *
   * @return the score
   */
  public double getScore() {
    return score;
  }

  /**
   * Create a copy with a new position and the same score.
   *
   * @param x the x
   * @param y the y
   * @return the candidate point
   */
  public CandidatePoint moveTo(double x, double y) {
    return new CandidatePoint(x, y, score);
  }

  /**
   * Get the squared distance to the other point.
   *
   * @param other the other point
   * @return the squared distance
   */
  public double distanceSq(CandidatePoint other) {
    final double dx = x - other.x;
    final double dy = y - other.y;
    return dx * dx + dy * dy;
  }

  /**
   * Get the distance to the other point.
   *
   * @param other the other point
   * @return the distance
   */
  public double distance(CandidatePoint other) {
    return Math.sqrt(distanceSq(other));
  }

  /**
   * Check if the point has the same position as the other point (the score is ignored).
   *
   * @param other the other point
   * @return true if the same position
   */
  public boolean isSamePosition(CandidatePoint other) {
    return x == other.x && y == other.y;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CandidatePoint)) {
      return false;
    }
    final CandidatePoint other = (CandidatePoint) obj;
    return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0
        && Double.compare(score, other.score) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(x, y, score);
  }

  @Override
  public String toString() {
    return "(" + x + "," + y + ") score=" + score;
  }
}
