/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Spatial grids produced from one pixel array; one grid per
 * depth frame and channel, in depth-major order.
 *
 * @param <G> grid type
 */
public final class SpatialGrids<G> {

  /**
   * How the grids are nested.
   */
  public enum Layout {
    /** One grid. */
    SINGLE,
    /** One grid per depth frame. */
    FRAMES,
    /** One grid per channel. */
    CHANNELS,
    /** One list of per-channel grids per depth frame. */
    FRAMES_AND_CHANNELS
  }

  private final int depth;
  private final int channels;
  private final ImmutableList<G> grids;

  SpatialGrids(int depth, int channels, List<G> depthMajor) {
    if (depthMajor.size() != depth * channels) {
      throw new IllegalArgumentException("Expected " + (depth * channels) +
        " grids, got " + depthMajor.size());
    }
    this.depth = depth;
    this.channels = channels;
    grids = ImmutableList.copyOf(depthMajor);
  }

  /**
   * @return nesting of the grids
   */
  public Layout getLayout() {
    if (depth == 1) {
      return channels == 1 ? Layout.SINGLE : Layout.CHANNELS;
    }
    return channels == 1 ? Layout.FRAMES : Layout.FRAMES_AND_CHANNELS;
  }

  /**
   * @return number of depth frames
   */
  public int getDepth() {
    return depth;
  }

  /**
   * @return number of channels
   */
  public int getChannelCount() {
    return channels;
  }

  /**
   * @param z 1-based depth index
   * @param c 1-based channel index
   * @return grid for the plane
   */
  public G get(int z, int c) {
    if (z < 1 || z > depth || c < 1 || c > channels) {
      throw new IndexOutOfBoundsException("No grid for z=" + z + ", c=" + c);
    }
    return grids.get((z - 1) * channels + (c - 1));
  }

  /**
   * @param z 1-based depth index
   * @return grids for each channel of the frame
   */
  public List<G> getFrame(int z) {
    if (z < 1 || z > depth) {
      throw new IndexOutOfBoundsException("No frame " + z);
    }
    return grids.subList((z - 1) * channels, z * channels);
  }

  /**
   * @return the only grid
   * @throws IllegalStateException if there is more than one grid
   */
  public G single() {
    if (grids.size() != 1) {
      throw new IllegalStateException(
        "Expected a single grid, layout is " + getLayout());
    }
    return grids.get(0);
  }

  /**
   * @return all grids, depth-major then channel
   */
  public List<G> asList() {
    return grids;
  }

}
