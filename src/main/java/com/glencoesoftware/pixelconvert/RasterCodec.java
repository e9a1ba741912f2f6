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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts pixel arrays to rasters of colour codes, one raster per
 * depth frame.
 */
public class RasterCodec {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(RasterCodec.class);

  /** Value used for every pixel when the image has a single value. */
  private static final double DEGENERATE_VALUE = 0.5;

  private final IAdvisoryListener listener;

  /**
   * Create a codec that logs advisories.
   */
  public RasterCodec() {
    this(new LoggingAdvisoryListener());
  }

  /**
   * @param listener receives notifications about unusual settings or
   *                 degenerate rescaling
   */
  public RasterCodec(IAdvisoryListener listener) {
    this.listener = listener;
  }

  /**
   * Convert with default options.
   *
   * @param image pixel array to convert
   * @return see {@link #encode(PixelArray, RasterOptions)}
   */
  public List<Raster> encode(PixelArray image) {
    return encode(image, RasterOptions.defaults());
  }

  /**
   * Convert a pixel array to one raster per depth frame.
   *
   * If no colour scale is set, single channel images use
   * {@link ColourScale#GRAY} and other images use {@link ColourScale#RGB},
   * which reads the first three channels.
   * If rescaling is enabled, values are mapped to [0, 1] using the
   * minimum and maximum of the whole image before colour mapping.
   *
   * @param image pixel array to convert
   * @param options conversion settings
   * @return rasters in frame order; a single raster if the image
   *         has one frame
   * @throws ConversionException if a requested frame does not exist
   */
  public List<Raster> encode(PixelArray image, RasterOptions options) {
    ColourScale scale = resolveScale(image, options);

    double offset = 0;
    double range = 1;
    boolean degenerate = false;
    if (options.isRescale()) {
      double min = Double.POSITIVE_INFINITY;
      double max = Double.NEGATIVE_INFINITY;
      for (int i=0; i<image.getLength(); i++) {
        double v = image.getValue(i);
        if (!Double.isNaN(v)) {
          min = Math.min(min, v);
          max = Math.max(max, v);
        }
      }
      if (min < max) {
        offset = min;
        range = max - min;
      }
      else {
        degenerate = true;
        listener.notifyAdvisory(Advisory.DEGENERATE_RESCALE,
          Advisory.DEGENERATE_RESCALE.getDescription() + " (value " +
          min + ")");
      }
      LOGGER.debug("Rescaling {} from [{}, {}]", image, min, max);
    }

    List<Integer> frames = new ArrayList<Integer>();
    if (options.getFrames().isPresent()) {
      for (Integer z : options.getFrames().get()) {
        if (z == null || z < 1 || z > image.getDepth()) {
          throw new ConversionException(
            ConversionError.COORDINATE_OUT_OF_RANGE,
            "Frame " + z + " outside [1, " + image.getDepth() + "]");
        }
        frames.add(z);
      }
    }
    else {
      for (int z=1; z<=image.getDepth(); z++) {
        frames.add(z);
      }
    }

    int width = image.getWidth();
    int height = image.getHeight();
    int planeSize = width * height;
    int channelStride = planeSize * image.getDepth();
    double[] pixel = new double[scale.getChannelCount()];
    List<Raster> rasters = new ArrayList<Raster>(frames.size());
    for (int z : frames) {
      int frameStart = (z - 1) * planeSize;
      String[] codes = new String[planeSize];
      for (int i=0; i<planeSize; i++) {
        for (int c=0; c<pixel.length; c++) {
          double v = image.getValue(frameStart + c * channelStride + i);
          pixel[c] = degenerate && !Double.isNaN(v) ?
            DEGENERATE_VALUE : (v - offset) / range;
        }
        // X varies fastest in both the image and a raster row
        codes[i] = scale.apply(pixel);
      }
      rasters.add(new Raster(width, height, codes));
    }
    return rasters;
  }

  /**
   * Convert a single frame.
   *
   * @param image pixel array to convert
   * @param options conversion settings; if frames are selected,
   *                exactly one must be selected
   * @return raster for the frame
   * @throws IllegalArgumentException if more than one frame would
   *         be converted
   */
  public Raster encodeFrame(PixelArray image, RasterOptions options) {
    List<Raster> rasters = encode(image, options);
    if (rasters.size() != 1) {
      throw new IllegalArgumentException(
        "Expected a single frame, got " + rasters.size());
    }
    return rasters.get(0);
  }

  private ColourScale resolveScale(PixelArray image, RasterOptions options) {
    ColourScale scale;
    if (options.getColourScale().isPresent()) {
      scale = options.getColourScale().get();
      if (options.isRescale()) {
        listener.notifyAdvisory(Advisory.CUSTOM_SCALE_WITH_RESCALE,
          Advisory.CUSTOM_SCALE_WITH_RESCALE.getDescription());
      }
    }
    else {
      scale = image.getChannelCount() == 1 ?
        ColourScale.GRAY : ColourScale.RGB;
    }
    if (scale.getChannelCount() > image.getChannelCount()) {
      throw new IllegalArgumentException("Colour scale needs " +
        scale.getChannelCount() + " channels, image has " +
        image.getChannelCount());
    }
    if (image.getChannelCount() > scale.getChannelCount()) {
      LOGGER.debug("Ignoring channels after {}", scale.getChannelCount());
    }
    return scale;
  }

}
