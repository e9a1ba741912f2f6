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
 * 2D grid of colour codes.  Rows correspond to the Y axis of the source
 * image and columns to the X axis.
 */
public final class Raster {

  private final int width;
  private final int height;
  private final String[] codes;

  /**
   * @param w number of columns
   * @param h number of rows
   * @param rowMajor colour codes, one row after another; not copied
   */
  Raster(int w, int h, String[] rowMajor) {
    if (rowMajor.length != w * h) {
      throw new IllegalArgumentException(
        "Expected " + (w * h) + " colour codes, got " + rowMajor.length);
    }
    width = w;
    height = h;
    codes = rowMajor;
  }

  /**
   * @return number of columns (image width)
   */
  public int getWidth() {
    return width;
  }

  /**
   * @return number of rows (image height)
   */
  public int getHeight() {
    return height;
  }

  /**
   * @param row 0-based row (Y) index
   * @param col 0-based column (X) index
   * @return colour code
   */
  public String get(int row, int col) {
    if (row < 0 || row >= height || col < 0 || col >= width) {
      throw new IndexOutOfBoundsException(
        "(" + row + ", " + col + ") outside " + height + "x" + width);
    }
    return codes[row * width + col];
  }

  /**
   * @param row 0-based row (Y) index
   * @return copy of the row's colour codes
   */
  public String[] getRow(int row) {
    if (row < 0 || row >= height) {
      throw new IndexOutOfBoundsException("Row " + row + " of " + height);
    }
    return Arrays.copyOfRange(codes, row * width, (row + 1) * width);
  }

  /**
   * @return copy of the codes as [row][column]
   */
  public String[][] toArray() {
    String[][] rows = new String[height][];
    for (int r=0; r<height; r++) {
      rows[r] = getRow(r);
    }
    return rows;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Raster)) {
      return false;
    }
    Raster other = (Raster) o;
    return width == other.width && Arrays.equals(codes, other.codes);
  }

  @Override
  public int hashCode() {
    return 31 * width + Arrays.hashCode(codes);
  }

  @Override
  public String toString() {
    return "Raster[" + width + "x" + height + "]";
  }

}
