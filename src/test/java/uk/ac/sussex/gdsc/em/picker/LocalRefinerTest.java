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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class LocalRefinerTest {
  private static PickerParameters createParameters() {
    final PickerParameters parameters = new PickerParameters();
    parameters.setParticleDiameter(20);
    // Search box 50: window half-width 25
    parameters.setSearchBoxRatio(5);
    return parameters;
  }

  private static FloatProcessor createOffsetParticle() {
    final FloatProcessor fp = SyntheticImages.background(100, 100);
    SyntheticImages.disk(fp, 53, 47, 8, 0);
    return fp;
  }

  @Test
  void testCreateCentreFinder() {
    Assertions.assertNull(LocalRefiner.createCentreFinder(RefinementMethod.NONE));
    Assertions.assertTrue(LocalRefiner
        .createCentreFinder(RefinementMethod.THRESHOLDING) instanceof ThresholdCentreFinder);
    Assertions.assertTrue(LocalRefiner
        .createCentreFinder(RefinementMethod.CONTOURING) instanceof ContourCentreFinder);
  }

  @Test
  void testThresholdingMovesToParticleCentre() {
    final List<CandidatePoint> refined = new LocalRefiner().refine(createOffsetParticle(),
        Arrays.asList(new CandidatePoint(50, 50, 0.7)), createParameters(),
        new ThresholdCentreFinder());
    Assertions.assertEquals(1, refined.size());
    final CandidatePoint p = refined.get(0);
    Assertions.assertEquals(53, p.getX(), 1);
    Assertions.assertEquals(47, p.getY(), 1);
    Assertions.assertEquals(0.7, p.getScore());
  }

  @Test
  void testThresholdingRecentresLargeOffsetWithDefaultWindow() {
    final FloatProcessor fp = SyntheticImages.background(100, 100);
    SyntheticImages.disk(fp, 50, 50, 10, 0);
    final PickerParameters parameters = new PickerParameters();
    parameters.setParticleDiameter(20);
    // The first window clips the particle; re-centring brings it fully into the window
    final int[][] offsets = {{10, 0}, {0, -10}, {7, 7}, {-7, 7}, {-10, 0}};
    for (final int[] offset : offsets) {
      final CandidatePoint p = new LocalRefiner().refine(fp,
          Arrays.asList(new CandidatePoint(50 + offset[0], 50 + offset[1])), parameters,
          new ThresholdCentreFinder()).get(0);
      Assertions.assertEquals(50, p.getX(), 1, () -> "x offset " + Arrays.toString(offset));
      Assertions.assertEquals(50, p.getY(), 1, () -> "y offset " + Arrays.toString(offset));
    }
  }

  @Test
  void testCloseParticlesSurviveRefinement() {
    // Particles 0.9 diameters apart are separated by more than the clash distance
    final FloatProcessor fp = SyntheticImages.background(140, 100);
    SyntheticImages.disk(fp, 80, 50, 7, 0);
    SyntheticImages.disk(fp, 98, 50, 7, 0);
    final PickerParameters parameters = new PickerParameters();
    parameters.setParticleDiameter(20);
    // Search box 20: each window holds only its own particle
    parameters.setSearchBoxRatio(2);
    parameters.setRefinementMethod(RefinementMethod.THRESHOLDING);
    final List<CandidatePoint> refined = new LocalRefiner().refine(fp,
        Arrays.asList(new CandidatePoint(80, 50), new CandidatePoint(98, 50)), parameters);
    Assertions.assertEquals(2, refined.size());
    Assertions.assertEquals(80, refined.get(0).getX(), 1);
    Assertions.assertEquals(98, refined.get(1).getX(), 1);
  }

  @Test
  void testContouringMovesToParticleCentre() {
    final List<CandidatePoint> refined = new LocalRefiner().refine(createOffsetParticle(),
        Arrays.asList(new CandidatePoint(50, 50)), createParameters(),
        new ContourCentreFinder());
    final CandidatePoint p = refined.get(0);
    Assertions.assertEquals(53, p.getX(), 1);
    Assertions.assertEquals(47, p.getY(), 1);
  }

  @Test
  void testNegativeStainWindow() {
    final FloatProcessor fp = SyntheticImages.background(100, 100);
    SyntheticImages.disk(fp, 53, 47, 8, 250);
    final PickerParameters parameters = createParameters();
    parameters.setNegativeStain(true);
    final CandidatePoint p = new LocalRefiner().refine(fp,
        Arrays.asList(new CandidatePoint(50, 50)), parameters, new ThresholdCentreFinder())
        .get(0);
    Assertions.assertEquals(53, p.getX(), 1);
    Assertions.assertEquals(47, p.getY(), 1);
  }

  @Test
  void testCandidateNearEdgeIsNotMoved() {
    final CandidatePoint edge = new CandidatePoint(10, 10);
    final CandidatePoint edge2 = new CandidatePoint(50, 75);
    final List<CandidatePoint> refined = new LocalRefiner().refine(createOffsetParticle(),
        Arrays.asList(edge, edge2), createParameters(), new ThresholdCentreFinder());
    Assertions.assertEquals(Arrays.asList(edge, edge2), refined);
  }

  @Test
  void testUndefinedCentreKeepsPosition() {
    final FloatProcessor fp = SyntheticImages.background(100, 100);
    final PickerParameters parameters = createParameters();
    // No blur so the window is exactly flat and the mask is empty
    parameters.setBlurSigma(0);
    final CandidatePoint p = new CandidatePoint(50, 50);
    final List<CandidatePoint> refined = new LocalRefiner().refine(fp, Arrays.asList(p),
        parameters, new ThresholdCentreFinder());
    Assertions.assertEquals(Arrays.asList(p), refined);
  }

  @Test
  void testRefineWithNoneReturnsCandidates() {
    final List<CandidatePoint> candidates =
        Arrays.asList(new CandidatePoint(50, 50), new CandidatePoint(52, 50));
    final List<CandidatePoint> refined =
        new LocalRefiner().refine(createOffsetParticle(), candidates, createParameters());
    Assertions.assertEquals(candidates, refined);
  }

  @Test
  void testRefineRemovesPointsThatConverge() {
    final PickerParameters parameters = createParameters();
    parameters.setRefinementMethod(RefinementMethod.THRESHOLDING);
    final List<CandidatePoint> candidates =
        Arrays.asList(new CandidatePoint(50, 50), new CandidatePoint(52, 50));
    Assertions.assertTrue(
        new LocalRefiner().refine(createOffsetParticle(), candidates, parameters).isEmpty());
  }

  @Test
  void testInputIsNotModified() {
    final FloatProcessor fp = createOffsetParticle();
    final float[] original = ((float[]) fp.getPixels()).clone();
    new LocalRefiner().refine(fp, Arrays.asList(new CandidatePoint(50, 50)), createParameters(),
        new ContourCentreFinder());
    Assertions.assertArrayEquals(original, (float[]) fp.getPixels());
  }

  @Test
  void testThresholdCentreFinder() {
    final FloatProcessor window = new FloatProcessor(5, 5);
    window.setf(1, 3, 10);
    Assertions.assertArrayEquals(new double[] {1, 3},
        new ThresholdCentreFinder().findCentre(window, 0.1));
    final double[] centre = new ThresholdCentreFinder().findCentre(new FloatProcessor(5, 5), 0.1);
    Assertions.assertTrue(Double.isNaN(centre[0]));
  }

  @Test
  void testContourCentreFinderChoosesNearestRegion() {
    final FloatProcessor window = new FloatProcessor(21, 21);
    SyntheticImages.disk(window, 12, 11, 1.5, 10);
    SyntheticImages.disk(window, 3, 3, 1.5, 10);
    Assertions.assertArrayEquals(new double[] {12, 11},
        new ContourCentreFinder().findCentre(window, 0.1));
  }

  @Test
  void testContourCentreFinderIgnoresDistantRegion() {
    final FloatProcessor window = new FloatProcessor(21, 21);
    SyntheticImages.disk(window, 18, 18, 1.5, 10);
    Assertions.assertArrayEquals(new double[] {10, 10},
        new ContourCentreFinder().findCentre(window, 0.1));
  }
}
