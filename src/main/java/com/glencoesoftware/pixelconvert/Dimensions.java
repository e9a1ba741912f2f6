/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.util.Arrays;

/**
 * Sizes of the four pixel array axes (width, height, depth, channels).
 * All sizes are positive.
 */
public final class Dimensions {

  private final int[] sizes;

  /**
   * Create a new set of dimensions.
   *
   * @param x width
   * @param y height
   * @param z depth
   * @param c channel count
   */
  public Dimensions(int x, int y, int z, int c) {
    sizes = new int[] {x, y, z, c};
    for (int i=0; i<sizes.length; i++) {
      if (sizes[i] <= 0) {
        throw new IllegalArgumentException(
          "Invalid size " + sizes[i] + " for axis " +
          PixelAxis.values()[i].getType());
      }
    }
    // fails on overflow
    getLength();
  }

  /**
   * @param sizes array of length 4 in XYZC order
   * @return new dimensions
   */
  public static Dimensions of(int... sizes) {
    if (sizes == null || sizes.length != 4) {
      throw new IllegalArgumentException(
        "Expected 4 axis sizes, got " + Arrays.toString(sizes));
    }
    return new Dimensions(sizes[0], sizes[1], sizes[2], sizes[3]);
  }

  /**
   * @param axis the axis to look up
   * @return size of the given axis
   */
  public int getSize(PixelAxis axis) {
    return sizes[axis.ordinal()];
  }

  /**
   * @return width
   */
  public int getX() {
    return sizes[0];
  }

  /**
   * @return height
   */
  public int getY() {
    return sizes[1];
  }

  /**
   * @return depth
   */
  public int getZ() {
    return sizes[2];
  }

  /**
   * @return channel count
   */
  public int getC() {
    return sizes[3];
  }

  /**
   * @return total number of pixels, x * y * z * c
   */
  public int getLength() {
    int length = 1;
    for (int size : sizes) {
      length = Math.multiplyExact(length, size);
    }
    return length;
  }

  /**
   * @return number of pixels in one XY plane
   */
  public int getPlaneSize() {
    return getX() * getY();
  }

  /**
   * @return copy of the sizes in XYZC order
   */
  public int[] toArray() {
    return sizes.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Dimensions)) {
      return false;
    }
    return Arrays.equals(sizes, ((Dimensions) o).sizes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(sizes);
  }

  @Override
  public String toString() {
    return String.format("%dx%dx%dx%d",
      sizes[0], sizes[1], sizes[2], sizes[3]);
  }

}
