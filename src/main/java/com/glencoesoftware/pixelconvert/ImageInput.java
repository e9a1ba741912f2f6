/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.util.Optional;

/**
 * Data that can be converted to a pixel array.
 * Every kind of input is a nested subclass; use {@link Visitor} to
 * handle each kind.
 *
 * Nested Java arrays are indexed [x][y], [x][y][z or c] or [x][y][z][c].
 * Integer and boolean values are converted to double (true is 1).
 */
public abstract class ImageInput {

  private ImageInput() {
  }

  /**
   * Dispatch to the visitor method for this kind of input.
   *
   * @param visitor handler for each kind of input
   * @param <T> result type
   * @return the visitor's result
   */
  public abstract <T> T accept(Visitor<T> visitor);

  /**
   * Handler for every kind of input.
   *
   * @param <T> result type
   */
  public interface Visitor<T> {
    T visitFlat(Flat input);
    T visitMatrix(Matrix input);
    T visitVolume(Volume input);
    T visitHypervolume(Hypervolume input);
    T visitShaped(Shaped input);
    T visitTabular(Tabular input);
  }

  // Factory methods

  public static Flat flat(double[] values) {
    return new Flat(values.clone(), AxisSizes.unspecified());
  }

  public static Flat flat(double[] values, AxisSizes sizes) {
    return new Flat(values.clone(), sizes);
  }

  public static Flat flat(int[] values, AxisSizes sizes) {
    double[] converted = new double[values.length];
    for (int i=0; i<values.length; i++) {
      converted[i] = values[i];
    }
    return new Flat(converted, sizes);
  }

  public static Flat flat(boolean[] values, AxisSizes sizes) {
    double[] converted = new double[values.length];
    for (int i=0; i<values.length; i++) {
      converted[i] = values[i] ? 1 : 0;
    }
    return new Flat(converted, sizes);
  }

  public static Matrix matrix(double[][] values) {
    int[] shape = {values.length, columns(values)};
    double[] data = new double[shape[0] * shape[1]];
    for (int x=0; x<shape[0]; x++) {
      checkLength(values[x], shape[1]);
      for (int y=0; y<shape[1]; y++) {
        data[x + y * shape[0]] = values[x][y];
      }
    }
    return new Matrix(shape, data);
  }

  public static Matrix matrix(int[][] values) {
    double[][] converted = new double[values.length][];
    for (int x=0; x<values.length; x++) {
      converted[x] = new double[values[x].length];
      for (int y=0; y<values[x].length; y++) {
        converted[x][y] = values[x][y];
      }
    }
    return matrix(converted);
  }

  public static Matrix matrix(boolean[][] values) {
    double[][] converted = new double[values.length][];
    for (int x=0; x<values.length; x++) {
      converted[x] = new double[values[x].length];
      for (int y=0; y<values[x].length; y++) {
        converted[x][y] = values[x][y] ? 1 : 0;
      }
    }
    return matrix(converted);
  }

  public static Volume volume(double[][][] values) {
    int sx = values.length;
    int sy = columns(values);
    int sz = sy == 0 ? 0 : columns(values[0]);
    double[] data = new double[sx * sy * sz];
    for (int x=0; x<sx; x++) {
      checkLength(values[x], sy);
      for (int y=0; y<sy; y++) {
        checkLength(values[x][y], sz);
        for (int z=0; z<sz; z++) {
          data[x + sx * (y + sy * z)] = values[x][y][z];
        }
      }
    }
    return new Volume(new int[] {sx, sy, sz}, data);
  }

  public static Volume volume(int[][][] values) {
    double[][][] converted = new double[values.length][][];
    for (int x=0; x<values.length; x++) {
      converted[x] = new double[values[x].length][];
      for (int y=0; y<values[x].length; y++) {
        converted[x][y] = new double[values[x][y].length];
        for (int z=0; z<values[x][y].length; z++) {
          converted[x][y][z] = values[x][y][z];
        }
      }
    }
    return volume(converted);
  }

  public static Volume volume(boolean[][][] values) {
    double[][][] converted = new double[values.length][][];
    for (int x=0; x<values.length; x++) {
      converted[x] = new double[values[x].length][];
      for (int y=0; y<values[x].length; y++) {
        converted[x][y] = new double[values[x][y].length];
        for (int z=0; z<values[x][y].length; z++) {
          converted[x][y][z] = values[x][y][z] ? 1 : 0;
        }
      }
    }
    return volume(converted);
  }

  public static Hypervolume hypervolume(double[][][][] values) {
    int sx = values.length;
    int sy = columns(values);
    int sz = sy == 0 ? 0 : columns(values[0]);
    int sc = sz == 0 ? 0 : columns(values[0][0]);
    double[] data = new double[sx * sy * sz * sc];
    for (int x=0; x<sx; x++) {
      checkLength(values[x], sy);
      for (int y=0; y<sy; y++) {
        checkLength(values[x][y], sz);
        for (int z=0; z<sz; z++) {
          checkLength(values[x][y][z], sc);
          for (int c=0; c<sc; c++) {
            data[x + sx * (y + sy * (z + sz * c))] = values[x][y][z][c];
          }
        }
      }
    }
    return new Hypervolume(new int[] {sx, sy, sz, sc}, data);
  }

  public static Hypervolume hypervolume(int[][][][] values) {
    double[][][][] converted = new double[values.length][][][];
    for (int x=0; x<values.length; x++) {
      converted[x] = new double[values[x].length][][];
      for (int y=0; y<values[x].length; y++) {
        converted[x][y] = new double[values[x][y].length][];
        for (int z=0; z<values[x][y].length; z++) {
          converted[x][y][z] = new double[values[x][y][z].length];
          for (int c=0; c<values[x][y][z].length; c++) {
            converted[x][y][z][c] = values[x][y][z][c];
          }
        }
      }
    }
    return hypervolume(converted);
  }

  public static Hypervolume hypervolume(boolean[][][][] values) {
    double[][][][] converted = new double[values.length][][][];
    for (int x=0; x<values.length; x++) {
      converted[x] = new double[values[x].length][][];
      for (int y=0; y<values[x].length; y++) {
        converted[x][y] = new double[values[x][y].length][];
        for (int z=0; z<values[x][y].length; z++) {
          converted[x][y][z] = new double[values[x][y][z].length];
          for (int c=0; c<values[x][y][z].length; c++) {
            converted[x][y][z][c] = values[x][y][z][c] ? 1 : 0;
          }
        }
      }
    }
    return hypervolume(converted);
  }

  /**
   * @param shape axis sizes
   * @param data values with the first axis varying fastest
   * @return array input of any rank
   */
  public static Shaped shaped(int[] shape, double[] data) {
    return new Shaped(shape.clone(), data.clone());
  }

  public static Tabular table(PixelTable table) {
    return new Tabular(table, TableCodec.DEFAULT_VALUE_COLUMN, null);
  }

  public static Tabular table(PixelTable table, String valueColumn) {
    return new Tabular(table, valueColumn, null);
  }

  public static Tabular table(PixelTable table, String valueColumn,
    Dimensions dims)
  {
    return new Tabular(table, valueColumn, dims);
  }

  private static int columns(Object[] values) {
    if (values.length == 0) {
      return 0;
    }
    Object first = values[0];
    if (first instanceof double[]) {
      return ((double[]) first).length;
    }
    return ((Object[]) first).length;
  }

  private static void checkLength(Object row, int expected) {
    int length = row instanceof double[] ?
      ((double[]) row).length : ((Object[]) row).length;
    if (length != expected) {
      throw new IllegalArgumentException(
        "Ragged array: expected " + expected + " elements, got " + length);
    }
  }

  // Input kinds

  /**
   * Values without a shape; dimensions are given or guessed.
   */
  public static final class Flat extends ImageInput {
    private final double[] values;
    private final AxisSizes sizes;

    private Flat(double[] data, AxisSizes axisSizes) {
      values = data;
      sizes = axisSizes;
    }

    public double[] getValues() {
      return values.clone();
    }

    public AxisSizes getAxisSizes() {
      return sizes;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFlat(this);
    }
  }

  /**
   * Base class for inputs that carry a shape.
   */
  public abstract static class Array extends ImageInput {
    private final int[] shape;
    private final double[] data;

    private Array(int[] arrayShape, double[] values) {
      shape = arrayShape;
      data = values;
    }

    /**
     * @return axis sizes, first axis first
     */
    public int[] getShape() {
      return shape.clone();
    }

    /**
     * @return values with the first axis varying fastest
     */
    public double[] getData() {
      return data.clone();
    }
  }

  /** Two axis array, [x][y]. */
  public static final class Matrix extends Array {
    private Matrix(int[] shape, double[] data) {
      super(shape, data);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMatrix(this);
    }
  }

  /** Three axis array; the third axis is depth or colour. */
  public static final class Volume extends Array {
    private Volume(int[] shape, double[] data) {
      super(shape, data);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitVolume(this);
    }
  }

  /** Four axis array, [x][y][z][c]. */
  public static final class Hypervolume extends Array {
    private Hypervolume(int[] shape, double[] data) {
      super(shape, data);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitHypervolume(this);
    }
  }

  /** Array of any rank given as a shape and flat data. */
  public static final class Shaped extends Array {
    private Shaped(int[] shape, double[] data) {
      super(shape, data);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitShaped(this);
    }
  }

  /** Table with coordinate columns and a value column. */
  public static final class Tabular extends ImageInput {
    private final PixelTable table;
    private final String valueColumn;
    private final Dimensions dimensions;

    private Tabular(PixelTable pixels, String column, Dimensions dims) {
      table = pixels;
      valueColumn = column;
      dimensions = dims;
    }

    public PixelTable getTable() {
      return table;
    }

    public String getValueColumn() {
      return valueColumn;
    }

    /**
     * @return dimensions of the decoded array, or empty to guess
     */
    public Optional<Dimensions> getDimensions() {
      return Optional.ofNullable(dimensions);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitTabular(this);
    }
  }

}
