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

import java.util.Arrays;

/**
 * Find objects defined by contiguous non-zero pixels in a binary mask.
 */
public class ObjectAnalyzer {
  private static final int[] DIR_X_OFFSET = {0, 1, 0, -1, 1, 1, -1, -1};
  private static final int[] DIR_Y_OFFSET = {-1, 0, 1, 0, -1, 1, 1, -1};

  private final int maxx;
  private final int maxy;
  private final int xlimit;
  private final int ylimit;
  private final int[] offset;
  private final boolean eightConnected;
  private final int[] objectMask;
  private int maxObject;

  /**
   * Create a new instance using 4-connected pixels.
   *
   * @param mask the mask
   * @param width the width
   * @param height the height
   */
  public ObjectAnalyzer(boolean[] mask, int width, int height) {
    this(mask, width, height, false);
  }

  /**
   * Create a new instance.
   *
   * @param mask the mask
   * @param width the width
   * @param height the height
   * @param eightConnected set to true to join diagonal pixels
   * @throws IllegalArgumentException if the mask size does not match the dimensions
   */
  public ObjectAnalyzer(boolean[] mask, int width, int height, boolean eightConnected) {
    if (mask.length != width * height) {
      throw new IllegalArgumentException(
          "Mask size " + mask.length + " does not match dimensions " + width + "x" + height);
    }
    maxx = width;
    maxy = height;
    xlimit = maxx - 1;
    ylimit = maxy - 1;
    this.eightConnected = eightConnected;

    // Create the offset table (for single array neighbour comparisons)
    offset = new int[DIR_X_OFFSET.length];
    for (int d = offset.length; d-- > 0;) {
      offset[d] = maxx * DIR_Y_OFFSET[d] + DIR_X_OFFSET[d];
    }

    objectMask = new int[mask.length];
    analyseObjects(mask);
  }

  private void analyseObjects(boolean[] mask) {
    int[] plist = new int[100];
    for (int i = 0; i < mask.length; i++) {
      // Look for pixels that are not already in an object
      if (mask[i] && objectMask[i] == 0) {
        plist = expandObject(mask, i, ++maxObject, plist);
      }
    }
  }

  /**
   * Searches from the specified point to find all connected pixels and assigns them the given ID.
   */
  private int[] expandObject(boolean[] mask, int index0, int id, int[] plist) {
    objectMask[index0] = id;
    int listI = 0;
    int listLen = 1;
    final int neighbours = eightConnected ? 8 : 4;
    plist[listI] = index0;

    do {
      final int index1 = plist[listI];
      final int x1 = index1 % maxx;
      final int y1 = index1 / maxx;

      final boolean isInner = (y1 != 0 && y1 != ylimit) && (x1 != 0 && x1 != xlimit);

      for (int d = neighbours; d-- > 0;) {
        if (isInner || isWithinXy(x1, y1, d)) {
          final int index2 = index1 + offset[d];
          if (mask[index2] && objectMask[index2] == 0) {
            objectMask[index2] = id;
            if (plist.length == listLen) {
              plist = Arrays.copyOf(plist, (int) (listLen * 1.5));
            }
            plist[listLen++] = index2;
          }
        }
      }

      listI++;
    } while (listI < listLen);

    return plist;
  }

  /**
   * Returns whether the neighbour in a given direction is within the image. It is assumed that the
   * pixel x,y itself is within the image.
   *
   * @param x x-coordinate of the pixel that has a neighbour in the given direction
   * @param y y-coordinate of the pixel that has a neighbour in the given direction
   * @param direction the direction from the pixel towards the neighbour
   * @return true if the neighbour is within the image
   */
  private boolean isWithinXy(int x, int y, int direction) {
    switch (direction) {
      // 4-connected directions
      case 0:
        return y > 0;
      case 1:
        return x < xlimit;
      case 2:
        return y < ylimit;
      case 3:
        return x > 0;
      // Then remaining 8-connected directions
      case 4:
        return y > 0 && x < xlimit;
      case 5:
        return y < ylimit && x < xlimit;
      case 6:
        return y < ylimit && x > 0;
      case 7:
        return y > 0 && x > 0;
      default:
        return false;
    }
  }

  /**
   * Gets the object mask.
   *
   * @return A pixel array containing the object number for each pixel in the input mask
   */
  public int[] getObjectMask() {
    return objectMask.clone();
  }

  /**
   * Gets the maximum object number.
   *
   * @return the max object
   */
  public int getMaxObject() {
    return maxObject;
  }

  /**
   * Checks if diagonal pixels are connected.
   *
   * @return true if eight connected
   */
  public boolean isEightConnected() {
    return eightConnected;
  }

  /**
   * Gets the width.
   *
   * @return the width
   */
  public int getWidth() {
    return maxx;
  }

  /**
   * Gets the height.
   *
   * @return the height
   */
  public int getHeight() {
    return maxy;
  }

  /**
   * Get the centroid and pixel count of each object. Data is stored indexed by the object number
   * so processing of results should start from 1.
   *
   * @return the centroid of each object (plus the pixel count) [object][cx,cy,n]
   */
  public double[][] getObjectCentres() {
    final int[] count = new int[maxObject + 1];
    final double[] sumx = new double[count.length];
    final double[] sumy = new double[count.length];
    for (int y = 0, i = 0; y < maxy; y++) {
      for (int x = 0; x < maxx; x++, i++) {
        final int value = objectMask[i];
        if (value != 0) {
          sumx[value] += x;
          sumy[value] += y;
          count[value]++;
        }
      }
    }
    final double[][] data = new double[count.length][3];
    for (int i = 1; i < count.length; i++) {
      data[i][0] = sumx[i] / count[i];
      data[i][1] = sumy[i] / count[i];
      data[i][2] = count[i];
    }
    return data;
  }
}
