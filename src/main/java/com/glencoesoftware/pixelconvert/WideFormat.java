/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

/**
 * Layout of the table produced from a pixel array.
 */
public enum WideFormat {
  /** One row per pixel with a single value column. */
  NONE("none", null),
  /** One row per XYZ location, one value column per channel. */
  BY_CHANNEL("c", PixelAxis.C),
  /** One row per XYC location, one value column per depth frame. */
  BY_DEPTH("d", PixelAxis.Z);

  private final String name;
  private final PixelAxis spreadAxis;

  private WideFormat(String newName, PixelAxis axis) {
    this.name = newName;
    this.spreadAxis = axis;
  }

  /**
   * @return short name used on the command line
   */
  public String getName() {
    return name;
  }

  /**
   * @return axis spread across value columns, or null for {@link #NONE}
   */
  public PixelAxis getSpreadAxis() {
    return spreadAxis;
  }

  /**
   * @param value short name ("none", "c", "d") or enum constant name
   * @return matching format
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static WideFormat fromString(String value) {
    for (WideFormat format : values()) {
      if (format.name.equalsIgnoreCase(value) ||
        format.name().equalsIgnoreCase(value))
      {
        return format;
      }
    }
    if ("false".equalsIgnoreCase(value)) {
      return NONE;
    }
    throw new IllegalArgumentException("Unknown wide format: " + value);
  }
}
