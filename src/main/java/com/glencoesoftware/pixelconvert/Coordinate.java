/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.util.OptionalInt;

/**
 * 1-based pixel coordinates over a subset of the XYZC axes.
 * Axes that are not supplied are treated as 1 when indexing.
 */
public final class Coordinate {

  private final Integer[] values = new Integer[PixelAxis.values().length];

  private Coordinate() {
  }

  /**
   * @param x 1-based X coordinate
   * @param y 1-based Y coordinate
   * @return coordinate in the first plane of the first channel
   */
  public static Coordinate of(int x, int y) {
    return new Coordinate().with(PixelAxis.X, x).with(PixelAxis.Y, y);
  }

  /**
   * @param x 1-based X coordinate
   * @param y 1-based Y coordinate
   * @param z 1-based Z coordinate
   * @param c 1-based channel
   * @return coordinate with all four axes supplied
   */
  public static Coordinate of(int x, int y, int z, int c) {
    return of(x, y).with(PixelAxis.Z, z).with(PixelAxis.C, c);
  }

  /**
   * @return coordinate with no axes supplied
   */
  public static Coordinate origin() {
    return new Coordinate();
  }

  /**
   * Copy this coordinate, setting one axis.
   *
   * @param axis axis to set
   * @param value 1-based coordinate on that axis
   * @return new coordinate
   */
  public Coordinate with(PixelAxis axis, int value) {
    Coordinate copy = new Coordinate();
    System.arraycopy(values, 0, copy.values, 0, values.length);
    copy.values[axis.ordinal()] = value;
    return copy;
  }

  /**
   * @param axis axis to look up
   * @return the supplied coordinate, or an empty value if absent
   */
  public OptionalInt get(PixelAxis axis) {
    Integer v = values[axis.ordinal()];
    return v == null ? OptionalInt.empty() : OptionalInt.of(v);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(");
    for (PixelAxis axis : PixelAxis.values()) {
      Integer v = values[axis.ordinal()];
      if (v != null) {
        if (sb.length() > 1) {
          sb.append(", ");
        }
        sb.append(axis.getType()).append('=').append(v);
      }
    }
    return sb.append(')').toString();
  }

}
