/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts pixel arrays to and from an external library's spatial grids.
 * Grids are single planes, so each depth frame and channel becomes
 * its own grid.
 *
 * @param <G> grid type
 * @param <W> spatial window type
 */
public class SpatialGridAdapter<G, W> {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(SpatialGridAdapter.class);

  private final SpatialGridFactory<G, W> factory;

  /**
   * @param factory creates and reads grids of the external library
   */
  public SpatialGridAdapter(SpatialGridFactory<G, W> factory) {
    this.factory = factory;
  }

  /**
   * @param image pixel array to convert
   * @return see {@link #toGrids(PixelArray, Optional)}
   */
  public SpatialGrids<G> toGrids(PixelArray image) {
    return toGrids(image, Optional.<W>empty());
  }

  /**
   * Convert a pixel array to grids, one per depth frame and channel.
   *
   * Each XY plane is rotated by 90 degrees, so that the image's last row
   * (largest Y) becomes grid row 0 and X runs along the grid columns.
   *
   * @param image pixel array to convert
   * @param window spatial window passed to every grid
   * @return grids in depth-major order
   */
  public SpatialGrids<G> toGrids(PixelArray image, Optional<W> window) {
    int depth = image.getDepth();
    int channels = image.getChannelCount();
    List<G> grids = new ArrayList<G>(depth * channels);
    for (int z=1; z<=depth; z++) {
      for (int c=1; c<=channels; c++) {
        grids.add(factory.create(rotate(image, z, c), window));
      }
    }
    LOGGER.debug("Converted {} to {} grid(s)", image, grids.size());
    return new SpatialGrids<G>(depth, channels, grids);
  }

  /**
   * Convert a grid back to a single plane pixel array, undoing the
   * rotation applied by {@link #toGrids(PixelArray, Optional)}.
   *
   * @param grid grid to convert
   * @return array of size (columns, rows, 1, 1)
   */
  public PixelArray fromGrid(G grid) {
    double[][] rows = factory.toRows(grid);
    int height = rows.length;
    if (height == 0) {
      throw new IllegalArgumentException("Grid has no rows");
    }
    int width = rows[0].length;
    double[] values = new double[width * height];
    for (int i=0; i<height; i++) {
      if (rows[i].length != width) {
        throw new IllegalArgumentException("Grid row " + i + " has " +
          rows[i].length + " columns, expected " + width);
      }
      int y = height - 1 - i;
      System.arraycopy(rows[i], 0, values, y * width, width);
    }
    return PixelArray.wrap(new Dimensions(width, height, 1, 1), values);
  }

  private static double[][] rotate(PixelArray image, int z, int c) {
    int width = image.getWidth();
    int height = image.getHeight();
    int start = ((c - 1) * image.getDepth() + (z - 1)) * width * height;
    double[][] rows = new double[height][width];
    for (int i=0; i<height; i++) {
      int y = height - 1 - i;
      for (int x=0; x<width; x++) {
        rows[i][x] = image.getValue(start + y * width + x);
      }
    }
    return rows;
  }

}
