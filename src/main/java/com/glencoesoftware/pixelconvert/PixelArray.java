/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Dense 4D pixel array with axes in XYZC order.
 * Values are stored with X varying fastest, then Y, Z and C.
 * Instances are immutable.
 */
public final class PixelArray {

  private final Dimensions dimensions;
  private final double[] values;

  /**
   * Create a new pixel array.  The values are copied.
   *
   * @param dims array dimensions
   * @param data pixel values in XYZC order; length must equal
   *             dims.getLength()
   */
  public PixelArray(Dimensions dims, double[] data) {
    this(dims, data, true);
  }

  private PixelArray(Dimensions dims, double[] data, boolean copy) {
    if (dims == null) {
      throw new NullPointerException("dims");
    }
    if (data.length != dims.getLength()) {
      throw new IllegalArgumentException("Expected " + dims.getLength() +
        " values for " + dims + ", got " + data.length);
    }
    dimensions = dims;
    values = copy ? data.clone() : data;
  }

  /**
   * Take ownership of the given array without copying.
   * Callers must not modify the array afterwards.
   */
  static PixelArray wrap(Dimensions dims, double[] data) {
    return new PixelArray(dims, data, false);
  }

  /**
   * @param dims array dimensions
   * @return new zero-filled pixel array
   */
  public static PixelArray zeros(Dimensions dims) {
    return wrap(dims, new double[dims.getLength()]);
  }

  /**
   * @return array dimensions
   */
  public Dimensions getDimensions() {
    return dimensions;
  }

  /**
   * @return total number of values
   */
  public int getLength() {
    return values.length;
  }

  /**
   * @return width
   */
  public int getWidth() {
    return dimensions.getX();
  }

  /**
   * @return height
   */
  public int getHeight() {
    return dimensions.getY();
  }

  /**
   * @return depth
   */
  public int getDepth() {
    return dimensions.getZ();
  }

  /**
   * @return number of channels
   */
  public int getChannelCount() {
    return dimensions.getC();
  }

  /**
   * @param offset linear offset in XYZC order
   * @return value at the offset
   */
  public double getValue(int offset) {
    return values[offset];
  }

  /**
   * @param x 1-based X coordinate
   * @param y 1-based Y coordinate
   * @param z 1-based Z coordinate
   * @param c 1-based channel
   * @return pixel value
   */
  public double get(int x, int y, int z, int c) {
    return values[CoordinateIndexer.linearOffset(
      dimensions, Coordinate.of(x, y, z, c))];
  }

  /**
   * @return copy of all values in XYZC order
   */
  public double[] getValues() {
    return values.clone();
  }

  /**
   * @return smallest value
   */
  public double getMin() {
    double min = Double.POSITIVE_INFINITY;
    for (double v : values) {
      min = Math.min(min, v);
    }
    return min;
  }

  /**
   * @return largest value
   */
  public double getMax() {
    double max = Double.NEGATIVE_INFINITY;
    for (double v : values) {
      max = Math.max(max, v);
    }
    return max;
  }

  /**
   * Extract one depth frame, keeping all channels.
   *
   * @param z 1-based depth index
   * @return array of size (x, y, 1, c)
   */
  public PixelArray getFrame(int z) {
    checkIndex(PixelAxis.Z, z);
    int plane = dimensions.getPlaneSize();
    int channelStride = plane * getDepth();
    double[] frame = new double[plane * getChannelCount()];
    for (int c=0; c<getChannelCount(); c++) {
      System.arraycopy(values, c * channelStride + (z - 1) * plane,
        frame, c * plane, plane);
    }
    return wrap(new Dimensions(getWidth(), getHeight(), 1, getChannelCount()),
      frame);
  }

  /**
   * Extract one channel, keeping all depth frames.
   *
   * @param c 1-based channel index
   * @return array of size (x, y, z, 1)
   */
  public PixelArray getChannel(int c) {
    checkIndex(PixelAxis.C, c);
    int channelSize = dimensions.getPlaneSize() * getDepth();
    double[] channel =
      Arrays.copyOfRange(values, (c - 1) * channelSize, c * channelSize);
    return wrap(new Dimensions(getWidth(), getHeight(), getDepth(), 1),
      channel);
  }

  /**
   * Extract a single XY plane.
   *
   * @param z 1-based depth index
   * @param c 1-based channel index
   * @return array of size (x, y, 1, 1)
   */
  public PixelArray getPlane(int z, int c) {
    checkIndex(PixelAxis.Z, z);
    checkIndex(PixelAxis.C, c);
    int plane = dimensions.getPlaneSize();
    int start = ((c - 1) * getDepth() + (z - 1)) * plane;
    return wrap(new Dimensions(getWidth(), getHeight(), 1, 1),
      Arrays.copyOfRange(values, start, start + plane));
  }

  /**
   * Convert to a matrix; advisories are logged.
   *
   * @return see {@link #toMatrix(IAdvisoryListener)}
   */
  public double[][] toMatrix() {
    return toMatrix(new LoggingAdvisoryListener());
  }

  /**
   * Convert to a matrix over the axes that have more than one element.
   * If two axes are larger than 1, the matrix is indexed by those two
   * axes in XYZC order.  If only one axis is larger than 1, a single
   * column matrix is returned.
   *
   * @param listener receives {@link Advisory#ONE_DIMENSIONAL}
   * @return matrix of values
   * @throws ConversionException if more than two axes are larger than 1
   */
  public double[][] toMatrix(IAdvisoryListener listener) {
    List<PixelAxis> used = new ArrayList<PixelAxis>();
    for (PixelAxis axis : PixelAxis.values()) {
      if (dimensions.getSize(axis) > 1) {
        used.add(axis);
      }
    }
    if (used.size() > 2) {
      throw new ConversionException(ConversionError.TOO_MANY_DIMENSIONS,
        "Too many non-empty dimensions: " + dimensions);
    }
    if (used.size() < 2) {
      if (used.size() == 1) {
        listener.notifyAdvisory(Advisory.ONE_DIMENSIONAL,
          Advisory.ONE_DIMENSIONAL.getDescription() + ": " + dimensions);
      }
      double[][] column = new double[values.length][1];
      for (int i=0; i<values.length; i++) {
        column[i][0] = values[i];
      }
      return column;
    }
    int[] strides = strides();
    PixelAxis rowAxis = used.get(0);
    PixelAxis colAxis = used.get(1);
    int rows = dimensions.getSize(rowAxis);
    int cols = dimensions.getSize(colAxis);
    double[][] matrix = new double[rows][cols];
    for (int i=0; i<rows; i++) {
      for (int j=0; j<cols; j++) {
        matrix[i][j] = values[i * strides[rowAxis.ordinal()] +
          j * strides[colAxis.ordinal()]];
      }
    }
    return matrix;
  }

  /**
   * @return nested copy of the values indexed [x][y][z][c] (0-based)
   */
  public double[][][][] toArray() {
    double[][][][] array =
      new double[getWidth()][getHeight()][getDepth()][getChannelCount()];
    int offset = 0;
    for (int c=0; c<getChannelCount(); c++) {
      for (int z=0; z<getDepth(); z++) {
        for (int y=0; y<getHeight(); y++) {
          for (int x=0; x<getWidth(); x++) {
            array[x][y][z][c] = values[offset++];
          }
        }
      }
    }
    return array;
  }

  private int[] strides() {
    int[] strides = new int[4];
    int stride = 1;
    for (PixelAxis axis : PixelAxis.values()) {
      strides[axis.ordinal()] = stride;
      stride *= dimensions.getSize(axis);
    }
    return strides;
  }

  private void checkIndex(PixelAxis axis, int index) {
    if (index < 1 || index > dimensions.getSize(axis)) {
      throw new ConversionException(ConversionError.COORDINATE_OUT_OF_RANGE,
        "Index " + index + " out of range for axis " + axis.getType() +
        " of size " + dimensions.getSize(axis));
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PixelArray)) {
      return false;
    }
    PixelArray other = (PixelArray) o;
    return dimensions.equals(other.dimensions) &&
      Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return 31 * dimensions.hashCode() + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return "PixelArray[" + dimensions + "]";
  }

}
