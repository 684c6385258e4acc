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

/**
 * Provides the parameters for a single run of the particle picker.
 *
 * <p>Invalid values are normalised to a documented default when set. Distances are in display
 * image pixels.
 */
public class PickerParameters {
  /** The default particle diameter. */
  public static final double DEFAULT_PARTICLE_DIAMETER = 50;
  /** The default detection threshold. */
  public static final double DEFAULT_THRESHOLD = 0.5;
  /** The default blur sigma. */
  public static final double DEFAULT_BLUR_SIGMA = 2;
  /** The default refinement threshold. */
  public static final double DEFAULT_REFINEMENT_THRESHOLD = 0.1;
  /** The default maximum number of raw peaks. */
  public static final int DEFAULT_MAX_PEAKS = 1500;
  /** The default edge cutoff as a fraction of the particle diameter. */
  public static final double DEFAULT_EDGE_RATIO = 0.75;
  /** The default minimum distance as a fraction of the particle diameter. */
  public static final double DEFAULT_MIN_DISTANCE_RATIO = 0.75;
  /** The default clash distance after detection as a fraction of the particle diameter. */
  public static final double DEFAULT_CLASH_RATIO = 0.6;
  /** The default refinement search box size as a multiple of the particle radius. */
  public static final double DEFAULT_SEARCH_BOX_RATIO = 3;
  /** The default background filter radius as a multiple of the particle diameter. */
  public static final double DEFAULT_BACKGROUND_RATIO = 1;
  /** The default sigma-clip factor. */
  public static final double DEFAULT_SIGMA_FACTOR = 3;

  /** The particle diameter. */
  private double particleDiameter;

  /** The minimum distance between peaks. Zero to derive from the diameter. */
  private double minDistance;

  /** The detection threshold. */
  private double threshold;

  /** The blur sigma. */
  private double blurSigma;

  /** The refinement method. */
  private RefinementMethod refinementMethod;

  /** The refinement threshold. */
  private double refinementThreshold;

  /** Set to true if the particles are brighter than the background. */
  private boolean negativeStain;

  /** The max peaks. */
  private int maxPeaks;

  /** The edge ratio. */
  private double edgeRatio;

  /** The clash ratio. */
  private double clashRatio;

  /** The search box ratio. */
  private double searchBoxRatio;

  /** The background ratio. */
  private double backgroundRatio;

  /** The contrast method applied to the input image. */
  private ContrastMethod contrastMethod;

  /** The contrast method applied to the background-subtracted residual image. */
  private ContrastMethod residualContrast;

  /** The sigma factor. */
  private double sigmaFactor;

  /** Set to true to clip input outliers before contrast enhancement. */
  private boolean whitenOutliers;

  /**
   * Create a new instance with the default values.
   */
  public PickerParameters() {
    particleDiameter = DEFAULT_PARTICLE_DIAMETER;
    threshold = DEFAULT_THRESHOLD;
    blurSigma = DEFAULT_BLUR_SIGMA;
    refinementMethod = RefinementMethod.NONE;
    refinementThreshold = DEFAULT_REFINEMENT_THRESHOLD;
    maxPeaks = DEFAULT_MAX_PEAKS;
    edgeRatio = DEFAULT_EDGE_RATIO;
    clashRatio = DEFAULT_CLASH_RATIO;
    searchBoxRatio = DEFAULT_SEARCH_BOX_RATIO;
    backgroundRatio = DEFAULT_BACKGROUND_RATIO;
    contrastMethod = ContrastMethod.NONE;
    residualContrast = ContrastMethod.PERCENTILE_CLIP;
    sigmaFactor = DEFAULT_SIGMA_FACTOR;
  }

  /**
   * Copy constructor.
   *
   * @param source the source
   */
  protected PickerParameters(PickerParameters source) {
    particleDiameter = source.particleDiameter;
    minDistance = source.minDistance;
    threshold = source.threshold;
    blurSigma = source.blurSigma;
    refinementMethod = source.refinementMethod;
    refinementThreshold = source.refinementThreshold;
    negativeStain = source.negativeStain;
    maxPeaks = source.maxPeaks;
    edgeRatio = source.edgeRatio;
    clashRatio = source.clashRatio;
    searchBoxRatio = source.searchBoxRatio;
    backgroundRatio = source.backgroundRatio;
    contrastMethod = source.contrastMethod;
    residualContrast = source.residualContrast;
    sigmaFactor = source.sigmaFactor;
    whitenOutliers = source.whitenOutliers;
  }

  /**
   * Copy the parameters.
   *
   * @return the copy
   */
  public PickerParameters copy() {
    return new PickerParameters(this);
  }

  /**
   * Gets the particle diameter.
   *
   * @return the particle diameter
   */
  public double getParticleDiameter() {
    return particleDiameter;
  }

  /**
   * Sets the particle diameter. Values that are not strictly positive are reset to the default.
   *
   * @param particleDiameter the new particle diameter
   */
  public void setParticleDiameter(double particleDiameter) {
    this.particleDiameter =
        positiveOrDefault(particleDiameter, DEFAULT_PARTICLE_DIAMETER);
  }

  /**
   * Gets the particle radius.
   *
   * @return the particle radius
   */
  public double getParticleRadius() {
    return particleDiameter / 2;
  }

  /**
   * Gets the minimum distance between peaks. If not explicitly set this is derived as
   * {@code (int) (0.75 * diameter)}.
   *
   * @return the min distance
   */
  public double getMinDistance() {
    return minDistance > 0 ? minDistance
        : Math.max(1, (int) (particleDiameter * DEFAULT_MIN_DISTANCE_RATIO));
  }

  /**
   * Sets the minimum distance between peaks. Values that are not strictly positive select the
   * value derived from the particle diameter.
   *
   * @param minDistance the new min distance
   */
  public void setMinDistance(double minDistance) {
    this.minDistance = positiveOrDefault(minDistance, 0);
  }

  /**
   * Gets the detection threshold as a fraction of the residual image range.
   *
   * @return the threshold
   */
  public double getThreshold() {
    return threshold;
  }

  /**
   * Sets the detection threshold. The value is clipped to [0, 1]; NaN is reset to the default.
   *
   * @param threshold the new threshold
   */
  public void setThreshold(double threshold) {
    this.threshold = Double.isNaN(threshold) ? DEFAULT_THRESHOLD : clip01(threshold);
  }

  /**
   * Gets the blur sigma.
   *
   * @return the blur sigma
   */
  public double getBlurSigma() {
    return blurSigma;
  }

  /**
   * Sets the blur sigma. Negative values are reset to the default.
   *
   * @param blurSigma the new blur sigma
   */
  public void setBlurSigma(double blurSigma) {
    this.blurSigma = blurSigma >= 0 ? blurSigma : DEFAULT_BLUR_SIGMA;
  }

  /**
   * Gets the refinement method.
   *
   * @return the refinement method
   */
  public RefinementMethod getRefinementMethod() {
    return refinementMethod;
  }

  /**
   * Sets the refinement method. Null is reset to {@link RefinementMethod#NONE}.
   *
   * @param refinementMethod the new refinement method
   */
  public void setRefinementMethod(RefinementMethod refinementMethod) {
    this.refinementMethod = refinementMethod == null ? RefinementMethod.NONE : refinementMethod;
  }

  /**
   * Gets the refinement threshold.
   *
   * @return the refinement threshold
   */
  public double getRefinementThreshold() {
    return refinementThreshold;
  }

  /**
   * Sets the refinement threshold. Values outside [0, 1) are reset to the default.
   *
   * @param refinementThreshold the new refinement threshold
   */
  public void setRefinementThreshold(double refinementThreshold) {
    this.refinementThreshold = refinementThreshold >= 0 && refinementThreshold < 1
        ? refinementThreshold
        : DEFAULT_REFINEMENT_THRESHOLD;
  }

  /**
   * Checks if the particles are brighter than the background.
   *
   * @return true if negative stain
   */
  public boolean isNegativeStain() {
    return negativeStain;
  }

  /**
   * Set to true if the particles are brighter than the background.
   *
   * @param negativeStain the new negative stain
   */
  public void setNegativeStain(boolean negativeStain) {
    this.negativeStain = negativeStain;
  }

  /**
   * Gets the maximum number of raw peaks allowed before detection is aborted.
   *
   * @return the max peaks
   */
  public int getMaxPeaks() {
    return maxPeaks;
  }

  /**
   * Sets the max peaks. Values below 1 are reset to the default.
   *
   * @param maxPeaks the new max peaks
   */
  public void setMaxPeaks(int maxPeaks) {
    this.maxPeaks = maxPeaks > 0 ? maxPeaks : DEFAULT_MAX_PEAKS;
  }

  /**
   * Gets the edge ratio.
   *
   * @return the edge ratio
   */
  public double getEdgeRatio() {
    return edgeRatio;
  }

  /**
   * Sets the edge ratio.
   *
   * @param edgeRatio the new edge ratio
   */
  public void setEdgeRatio(double edgeRatio) {
    this.edgeRatio = positiveOrDefault(edgeRatio, DEFAULT_EDGE_RATIO);
  }

  /**
   * Gets the edge cutoff distance.
   *
   * @return the edge cutoff
   */
  public double getEdgeCutoff() {
    return edgeRatio * particleDiameter;
  }

  /**
   * Gets the clash ratio.
   *
   * @return the clash ratio
   */
  public double getClashRatio() {
    return clashRatio;
  }

  /**
   * Sets the clash ratio.
   *
   * @param clashRatio the new clash ratio
   */
  public void setClashRatio(double clashRatio) {
    this.clashRatio = positiveOrDefault(clashRatio, DEFAULT_CLASH_RATIO);
  }

  /**
   * Gets the clash distance used after detection. This is never less than the minimum distance.
   *
   * @return the clash distance
   */
  public double getClashDistance() {
    return Math.max(getMinDistance(), clashRatio * particleDiameter);
  }

  /**
   * Gets the search box ratio.
   *
   * @return the search box ratio
   */
  public double getSearchBoxRatio() {
    return searchBoxRatio;
  }

  /**
   * Sets the search box ratio.
   *
   * @param searchBoxRatio the new search box ratio
   */
  public void setSearchBoxRatio(double searchBoxRatio) {
    this.searchBoxRatio = positiveOrDefault(searchBoxRatio, DEFAULT_SEARCH_BOX_RATIO);
  }

  /**
   * Gets the refinement search box size.
   *
   * @return the search box size
   */
  public double getSearchBox() {
    return searchBoxRatio * getParticleRadius();
  }

  /**
   * Gets the clash distance used after refinement. This applies the clash ratio to the diameter
   * rebuilt from the integer particle radius and is never less than the minimum distance.
   *
   * @return the refined clash distance
   */
  public double getRefinedClashDistance() {
    return Math.max(getMinDistance(), clashRatio * 2 * (int) getParticleRadius());
  }

  /**
   * Gets the background ratio.
   *
   * @return the background ratio
   */
  public double getBackgroundRatio() {
    return backgroundRatio;
  }

  /**
   * Sets the background ratio.
   *
   * @param backgroundRatio the new background ratio
   */
  public void setBackgroundRatio(double backgroundRatio) {
    this.backgroundRatio = positiveOrDefault(backgroundRatio, DEFAULT_BACKGROUND_RATIO);
  }

  /**
   * Gets the radius of the maximum filter used to estimate the background.
   *
   * @return the background radius
   */
  public double getBackgroundRadius() {
    return backgroundRatio * particleDiameter;
  }

  /**
   * Gets the contrast method applied to the input image.
   *
   * @return the contrast method
   */
  public ContrastMethod getContrastMethod() {
    return contrastMethod;
  }

  /**
   * Sets the contrast method applied to the input image. Null is reset to
   * {@link ContrastMethod#NONE}.
   *
   * @param contrastMethod the new contrast method
   */
  public void setContrastMethod(ContrastMethod contrastMethod) {
    this.contrastMethod = contrastMethod == null ? ContrastMethod.NONE : contrastMethod;
  }

  /**
   * Gets the contrast method applied to the residual image.
   *
   * @return the residual contrast
   */
  public ContrastMethod getResidualContrast() {
    return residualContrast;
  }

  /**
   * Sets the contrast method applied to the residual image. Null is reset to
   * {@link ContrastMethod#PERCENTILE_CLIP}.
   *
   * @param residualContrast the new residual contrast
   */
  public void setResidualContrast(ContrastMethod residualContrast) {
    this.residualContrast =
        residualContrast == null ? ContrastMethod.PERCENTILE_CLIP : residualContrast;
  }

  /**
   * Gets the sigma factor.
   *
   * @return the sigma factor
   */
  public double getSigmaFactor() {
    return sigmaFactor;
  }

  /**
   * Sets the sigma factor.
   *
   * @param sigmaFactor the new sigma factor
   */
  public void setSigmaFactor(double sigmaFactor) {
    this.sigmaFactor = positiveOrDefault(sigmaFactor, DEFAULT_SIGMA_FACTOR);
  }

  /**
   * Checks if input pixels beyond the mean plus or minus the sigma factor multiplied by the
   * standard deviation are replaced with the limit before the input contrast enhancement. This
   * removes the influence of hot pixels and ice contamination on the contrast range.
   *
   * @return true if whitening outliers
   */
  public boolean isWhitenOutliers() {
    return whitenOutliers;
  }

  /**
   * Sets the whiten outliers flag.
   *
   * @param whitenOutliers the new whiten outliers flag
   */
  public void setWhitenOutliers(boolean whitenOutliers) {
    this.whitenOutliers = whitenOutliers;
  }

  private static double positiveOrDefault(double value, double defaultValue) {
    // NaN fails the comparison
    return value > 0 ? value : defaultValue;
  }

  private static double clip01(double value) {
    if (value < 0) {
      return 0;
    }
    return value > 1 ? 1 : value;
  }

  @Override
  public String toString() {
    return "diameter=" + particleDiameter + ", minDistance=" + getMinDistance() + ", threshold="
        + threshold + ", blur=" + blurSigma + ", refinement=" + refinementMethod
        + ", refinementThreshold=" + refinementThreshold + ", negativeStain=" + negativeStain;
  }
}
