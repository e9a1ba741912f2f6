/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.util.OptionalInt;

import com.google.common.math.DoubleMath;

/**
 * Maps 1-based pixel coordinates to offsets into XYZC-ordered storage.
 */
public final class CoordinateIndexer {

  private CoordinateIndexer() {
  }

  /**
   * Calculate the linear offset of a coordinate.
   * Axes absent from the coordinate are treated as 1.
   *
   * @param dims array dimensions
   * @param coord 1-based coordinate
   * @return 0-based offset,
   *   (x-1) + (y-1)*X + (z-1)*X*Y + (c-1)*X*Y*Z
   * @throws ConversionException if a coordinate is outside [1, size]
   */
  public static int linearOffset(Dimensions dims, Coordinate coord) {
    int offset = 0;
    int stride = 1;
    for (PixelAxis axis : PixelAxis.values()) {
      int size = dims.getSize(axis);
      OptionalInt value = coord.get(axis);
      int v = value.orElse(1);
      if (v < 1 || v > size) {
        throw outOfRange(axis, String.valueOf(v), size);
      }
      offset += (v - 1) * stride;
      stride *= size;
    }
    return offset;
  }

  /**
   * Calculate the linear offset of a coordinate read from a table,
   * where coordinates are stored as floating point values.
   * A value is only valid if it is a whole number.
   *
   * @param dims array dimensions
   * @param coords 1-based coordinates in XYZC order; length 4
   * @return 0-based offset
   * @throws ConversionException if a coordinate is not a whole number
   *         in [1, size]
   */
  public static int linearOffset(Dimensions dims, double... coords) {
    if (coords.length != 4) {
      throw new IllegalArgumentException(
        "Expected 4 coordinates, got " + coords.length);
    }
    int offset = 0;
    int stride = 1;
    for (PixelAxis axis : PixelAxis.values()) {
      int size = dims.getSize(axis);
      double v = coords[axis.ordinal()];
      if (!DoubleMath.isMathematicalInteger(v) || v < 1 || v > size) {
        throw outOfRange(axis, String.valueOf(v), size);
      }
      offset += ((int) v - 1) * stride;
      stride *= size;
    }
    return offset;
  }

  private static ConversionException outOfRange(
    PixelAxis axis, String value, int size)
  {
    return new ConversionException(ConversionError.COORDINATE_OUT_OF_RANGE,
      String.format("Coordinate %s=%s is outside [1, %d]",
        axis.getType(), value, size));
  }

}
