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
 * Bridge to an external library's 2D spatial grid type.
 * Grids are described as rows of values, where row 0 is the bottom edge
 * of the spatial window and column 0 its left edge.
 *
 * @param <G> grid type
 * @param <W> spatial window type
 */
public interface SpatialGridFactory<G, W> {

  /**
   * @param rows grid values as [row][column]; not retained
   * @param window spatial window, or empty for the library's default
   * @return new grid
   */
  G create(double[][] rows, Optional<W> window);

  /**
   * @param grid grid created by this factory or the external library
   * @return grid values as [row][column]
   */
  double[][] toRows(G grid);

}
