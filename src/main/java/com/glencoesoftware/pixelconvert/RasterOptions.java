/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * Settings for converting a pixel array to rasters.
 */
public final class RasterOptions {

  private static final RasterOptions DEFAULTS = builder().build();

  private final ColourScale colourScale;
  private final boolean rescale;
  private final ImmutableList<Integer> frames;

  private RasterOptions(Builder builder) {
    colourScale = builder.colourScale;
    rescale = builder.rescale;
    frames = builder.frames;
  }

  /**
   * @return default options: rescale, default colour scale, all frames
   */
  public static RasterOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return the requested colour scale, or empty to pick one from the
   *         channel count
   */
  public Optional<ColourScale> getColourScale() {
    return Optional.ofNullable(colourScale);
  }

  /**
   * @return true if values are rescaled to [0, 1] before colour mapping
   */
  public boolean isRescale() {
    return rescale;
  }

  /**
   * @return 1-based depth frames to convert, or empty for all frames
   */
  public Optional<List<Integer>> getFrames() {
    return Optional.ofNullable(frames);
  }

  public static final class Builder {

    private ColourScale colourScale;
    private boolean rescale = true;
    private ImmutableList<Integer> frames;

    private Builder() {
    }

    /**
     * @param scale colour scale, or null for the default
     * @return this builder
     */
    public Builder colourScale(ColourScale scale) {
      colourScale = scale;
      return this;
    }

    /**
     * @param rescaleValues whether to rescale values to [0, 1]
     * @return this builder
     */
    public Builder rescale(boolean rescaleValues) {
      rescale = rescaleValues;
      return this;
    }

    /**
     * @param frameList 1-based depth frames, or null for all frames
     * @return this builder
     */
    public Builder frames(List<Integer> frameList) {
      frames = frameList == null ? null : ImmutableList.copyOf(frameList);
      return this;
    }

    public RasterOptions build() {
      return new RasterOptions(this);
    }
  }

}
