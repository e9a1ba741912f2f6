/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Partial specification of pixel array axis sizes.
 * Each axis is either set to a value or left unspecified; an unspecified
 * axis is distinct from any numeric size.
 */
public final class AxisSizes {

  private static final AxisSizes UNSPECIFIED = new Builder().build();

  private final Map<PixelAxis, Integer> sizes;

  private AxisSizes(Map<PixelAxis, Integer> values) {
    sizes = new EnumMap<PixelAxis, Integer>(PixelAxis.class);
    sizes.putAll(values);
  }

  /**
   * @return axis sizes with every axis unspecified
   */
  public static AxisSizes unspecified() {
    return UNSPECIFIED;
  }

  /**
   * @param dims complete dimensions
   * @return axis sizes with every axis specified
   */
  public static AxisSizes of(Dimensions dims) {
    Builder builder = builder();
    for (PixelAxis axis : PixelAxis.values()) {
      builder.size(axis, dims.getSize(axis));
    }
    return builder.build();
  }

  /**
   * @return a builder with every axis unspecified
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @param axis the axis to look up
   * @return the size of the axis, or an empty value if unspecified
   */
  public OptionalInt get(PixelAxis axis) {
    Integer size = sizes.get(axis);
    return size == null ? OptionalInt.empty() : OptionalInt.of(size);
  }

  /**
   * @return true if at least one axis has been given a size
   */
  public boolean isAnySpecified() {
    return !sizes.isEmpty();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("AxisSizes[");
    for (PixelAxis axis : PixelAxis.values()) {
      if (axis != PixelAxis.X) {
        sb.append(", ");
      }
      sb.append(axis.getType()).append('=');
      Integer size = sizes.get(axis);
      sb.append(size == null ? "?" : size.toString());
    }
    return sb.append(']').toString();
  }

  public static final class Builder {

    private final Map<PixelAxis, Integer> sizes =
      new EnumMap<PixelAxis, Integer>(PixelAxis.class);

    private Builder() {
    }

    /**
     * @param axis axis to set
     * @param size axis size
     * @return this builder
     */
    public Builder size(PixelAxis axis, int size) {
      sizes.put(axis, size);
      return this;
    }

    /**
     * Set or clear the size of an axis.
     *
     * @param axis axis to set
     * @param size axis size, or null to leave the axis unspecified
     * @return this builder
     */
    public Builder size(PixelAxis axis, Integer size) {
      if (size == null) {
        sizes.remove(axis);
      }
      else {
        sizes.put(axis, size);
      }
      return this;
    }

    public Builder x(int size) {
      return size(PixelAxis.X, size);
    }

    public Builder y(int size) {
      return size(PixelAxis.Y, size);
    }

    public Builder z(int size) {
      return size(PixelAxis.Z, size);
    }

    public Builder c(int size) {
      return size(PixelAxis.C, size);
    }

    public AxisSizes build() {
      return new AxisSizes(sizes);
    }
  }

}
