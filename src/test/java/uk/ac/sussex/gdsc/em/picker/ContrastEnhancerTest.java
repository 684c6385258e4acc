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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class ContrastEnhancerTest {
  private static FloatProcessor ramp(int width, int height) {
    final float[] data = new float[width * height];
    for (int i = 0; i < data.length; i++) {
      data[i] = i;
    }
    return new FloatProcessor(width, height, data);
  }

  private static void assertRange(FloatProcessor fp) {
    for (final float v : (float[]) fp.getPixels()) {
      Assertions.assertTrue(v >= 0 && v <= ContrastEnhancer.MAX_VALUE, () -> "Value: " + v);
    }
  }

  @Test
  void testNoneReturnsCopy() {
    final FloatProcessor fp = ramp(5, 4);
    final FloatProcessor out =
        ContrastEnhancer.enhance(fp, ContrastMethod.NONE, new PickerParameters());
    Assertions.assertNotSame(fp, out);
    Assertions.assertArrayEquals((float[]) fp.getPixels(), (float[]) out.getPixels());
  }

  @Test
  void testPercentileClip() {
    final FloatProcessor fp = ramp(10, 10);
    final float[] original = ((float[]) fp.getPixels()).clone();
    final FloatProcessor out = ContrastEnhancer.percentileClip(fp);
    assertRange(out);
    final float[] pixels = (float[]) out.getPixels();
    // R_7 percentiles of 0..99: 1.98 and 97.02
    Assertions.assertEquals(0, pixels[0]);
    Assertions.assertEquals(0, pixels[1]);
    Assertions.assertEquals(ContrastEnhancer.MAX_VALUE, pixels[98]);
    Assertions.assertEquals(ContrastEnhancer.MAX_VALUE, pixels[99]);
    Assertions.assertEquals(255 * (50 - 1.98) / (97.02 - 1.98), pixels[50], 1e-3);
    // Input unchanged
    Assertions.assertArrayEquals(original, (float[]) fp.getPixels());
  }

  @Test
  void testSigmaClip() {
    final float[] data = new float[100];
    data[0] = 1000;
    final FloatProcessor out = ContrastEnhancer.sigmaClip(new FloatProcessor(10, 10, data), 1);
    assertRange(out);
    final float[] pixels = (float[]) out.getPixels();
    Assertions.assertEquals(ContrastEnhancer.MAX_VALUE, pixels[0]);
    // mean=10, sd=99.5; all background pixels are above the lower limit
    final double lower = 10 - Math.sqrt(1000000.0 / 100 - 100);
    final double upper = 10 + Math.sqrt(1000000.0 / 100 - 100);
    Assertions.assertEquals(255 * (0 - lower) / (upper - lower), pixels[1], 1e-3);
  }

  @Test
  void testFlatImage() {
    final FloatProcessor fp = new FloatProcessor(8, 6);
    fp.set(42);
    final PickerParameters parameters = new PickerParameters();
    for (final ContrastMethod method : new ContrastMethod[] {ContrastMethod.PERCENTILE_CLIP,
        ContrastMethod.SIGMA_CLIP}) {
      final FloatProcessor out = ContrastEnhancer.enhance(fp, method, parameters);
      for (final float v : (float[]) out.getPixels()) {
        Assertions.assertEquals(0, v, method::toString);
      }
    }
    final FloatProcessor out = ContrastEnhancer.enhance(fp, ContrastMethod.ADAPTIVE_LOCAL,
        parameters);
    for (final float v : (float[]) out.getPixels()) {
      Assertions.assertEquals(127.5f, v);
    }
  }

  @Test
  void testRescaleWithEqualLimitsIsZero() {
    final FloatProcessor out = ContrastEnhancer.rescale(ramp(3, 3), 4, 4);
    for (final float v : (float[]) out.getPixels()) {
      Assertions.assertEquals(0, v);
    }
  }

  @Test
  void testAdaptiveLocalRanksNeighbourhood() {
    final FloatProcessor fp = ramp(9, 1);
    // Full width neighbourhood: rank of each of 9 distinct values
    final float[] pixels = (float[]) ContrastEnhancer.adaptiveLocal(fp, 10).getPixels();
    for (int i = 0; i < pixels.length; i++) {
      Assertions.assertEquals(255 * (i + 0.5) / 9, pixels[i], 1e-3);
    }
    assertRange(ContrastEnhancer.adaptiveLocal(ramp(20, 15), 3));
  }

  @Test
  void testAdaptiveLocalUsesLocalWindow() {
    // Increasing ramp: with a half-width of 1 each interior pixel is the middle of 3 values
    final FloatProcessor fp = ramp(9, 1);
    final float[] pixels = (float[]) ContrastEnhancer.adaptiveLocal(fp, 1).getPixels();
    Assertions.assertEquals(255 * 0.5 / 2, pixels[0], 1e-3);
    for (int i = 1; i < 8; i++) {
      Assertions.assertEquals(255 * 1.5 / 3, pixels[i], 1e-3);
    }
    Assertions.assertEquals(255 * 1.5 / 2, pixels[8], 1e-3);
  }

  @Test
  void testWhitenOutliers() {
    final float[] data = new float[100];
    data[0] = 1000;
    final FloatProcessor fp = new FloatProcessor(10, 10, data);
    final float[] pixels = (float[]) ContrastEnhancer.whitenOutliers(fp, 1).getPixels();
    final double upper = 10 + Math.sqrt(1000000.0 / 100 - 100);
    Assertions.assertEquals(upper, pixels[0], 1e-3);
    Assertions.assertEquals(0, pixels[1]);
    Assertions.assertEquals(1000, data[0]);
  }
}
