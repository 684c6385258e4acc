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

import java.util.Collections;
import java.util.List;

/**
 * Contains the result of an automatic particle picking run.
 */
public final class AutoPickResult {
  /**
   * The status of the run.
   */
  public enum Status {
    /** The run completed. */
    OK,
    /** The run was aborted because the detector found too many peaks. */
    TOO_MANY_PEAKS
  }

  private final Status status;
  private final List<CandidatePoint> points;
  private final String message;

  private AutoPickResult(Status status, List<CandidatePoint> points, String message) {
    this.status = status;
    this.points = Collections.unmodifiableList(points);
    this.message = message;
  }

  /**
   * Create a completed result.
   *
   * @param points the points
   * @return the result
   */
  static AutoPickResult ok(List<CandidatePoint> points) {
    return new AutoPickResult(Status.OK, points, "");
  }

  /**
   * Create an aborted result.
   *
   * @param ex the exception that aborted the run
   * @return the result
   */
  static AutoPickResult tooManyPeaks(TooManyPeaksException ex) {
    return new AutoPickResult(Status.TOO_MANY_PEAKS, Collections.emptyList(), ex.getMessage());
  }

  /**
   * Gets the status.
   *
   * @return the status
   */
  public Status getStatus() {
    return status;
  }

  /**
   * Checks if the run completed.
   *
   * @return true if OK
   */
  public boolean isOk() {
    return status == Status.OK;
  }

  /**
   * Gets the points in display space. Empty if the run was aborted.
   *
   * @return the points
   */
  public List<CandidatePoint> getPoints() {
    return points;
  }

  /**
   * Gets the message for an aborted run.
   *
   * @return the message (empty if OK)
   */
  public String getMessage() {
    return message;
  }
}
