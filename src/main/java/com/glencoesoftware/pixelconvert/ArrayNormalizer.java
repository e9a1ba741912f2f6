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
 * Converts 2, 3 and 4 axis numeric arrays to 4D pixel arrays.
 */
public class ArrayNormalizer {

  /** Size of a third axis that is interpreted as RGB channels. */
  private static final int RGB_CHANNELS = 3;

  private final IAdvisoryListener listener;

  /**
   * Create a normalizer that logs advisories.
   */
  public ArrayNormalizer() {
    this(new LoggingAdvisoryListener());
  }

  /**
   * @param listener receives a notification when the meaning of
   *                 a third axis is assumed
   */
  public ArrayNormalizer(IAdvisoryListener listener) {
    this.listener = listener;
  }

  /**
   * Convert a shaped array to a pixel array.
   *
   * A 2 axis array is a single grayscale plane.  A 3 axis array is
   * treated as a colour image if the last axis has size 3, and as a
   * stack of grayscale planes otherwise.  A 4 axis array is used as is.
   *
   * @param shape axis sizes, first axis first
   * @param data values with the first axis varying fastest
   * @return new pixel array
   * @throws ConversionException if the array has fewer than 2 or more
   *         than 4 axes
   */
  public PixelArray normalize(int[] shape, double[] data) {
    long length = 1;
    for (int size : shape) {
      if (size <= 0) {
        throw new IllegalArgumentException(
          "Invalid array shape " + Arrays.toString(shape));
      }
      length *= size;
    }
    if (length != data.length) {
      throw new IllegalArgumentException("Array shape " +
        Arrays.toString(shape) + " does not match " + data.length +
        " values");
    }

    Dimensions dims;
    switch (shape.length) {
      case 2:
        dims = new Dimensions(shape[0], shape[1], 1, 1);
        break;
      case 3:
        if (shape[2] == RGB_CHANNELS) {
          dims = new Dimensions(shape[0], shape[1], 1, shape[2]);
          notify(Advisory.ASSUMED_COLOUR_AXIS, dims);
        }
        else {
          dims = new Dimensions(shape[0], shape[1], shape[2], 1);
          notify(Advisory.ASSUMED_DEPTH_AXIS, dims);
        }
        break;
      case 4:
        dims = Dimensions.of(shape);
        break;
      default:
        throw new ConversionException(ConversionError.UNSUPPORTED_RANK,
          "Array must have 2 to 4 dimensions, got " + shape.length);
    }
    return new PixelArray(dims, data);
  }

  private void notify(Advisory advisory, Dimensions dims) {
    listener.notifyAdvisory(advisory,
      advisory.getDescription() + " (" + dims + ")");
  }

}
