/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import com.google.common.math.DoubleMath;

/**
 * Determines pixel array dimensions for a flat sequence of values.
 */
public class DimensionResolver {

  /** Relative tolerance when deciding whether a root is a whole number. */
  private static final double WHOLE_TOLERANCE = 1.5e-8;

  private final IAdvisoryListener listener;

  /**
   * Create a resolver that logs advisories.
   */
  public DimensionResolver() {
    this(new LoggingAdvisoryListener());
  }

  /**
   * @param listener receives a notification whenever dimensions are guessed
   */
  public DimensionResolver(IAdvisoryListener listener) {
    this.listener = listener;
  }

  /**
   * Determine dimensions for the given number of values.
   *
   * If any axis size is specified, unspecified axes are set to 1 and
   * the product of all four sizes must equal the length.
   *
   * Otherwise, the first of these guesses to produce whole sizes is used:
   * square grayscale (d, d, 1, 1), square RGB (d, d, 1, 3),
   * cubic grayscale (d, d, d, 1) and cubic RGB (d, d, d, 3).
   * Guesses are reported to the advisory listener.
   *
   * @param length number of values
   * @param explicit axis sizes supplied by the caller
   * @return resolved dimensions
   * @throws ConversionException if explicit sizes do not match the length,
   *         or no guess fits
   */
  public Dimensions resolve(int length, AxisSizes explicit) {
    if (explicit.isAnySpecified()) {
      int[] sizes = new int[4];
      long product = 1;
      for (PixelAxis axis : PixelAxis.values()) {
        int size = explicit.get(axis).orElse(1);
        if (size <= 0) {
          throw new ConversionException(
            ConversionError.INCOMPATIBLE_DIMENSIONS,
            "Invalid size " + size + " for axis " + axis.getType());
        }
        sizes[axis.ordinal()] = size;
        product *= size;
        if (product > Integer.MAX_VALUE) {
          break;
        }
      }
      if (product != length) {
        throw new ConversionException(ConversionError.INCOMPATIBLE_DIMENSIONS,
          "Dimensions " + explicit + " are incompatible with input length " +
          length);
      }
      return Dimensions.of(sizes);
    }

    int d = wholeRoot(length, 2);
    if (d > 0) {
      return guess(Advisory.GUESSED_SQUARE, d, d, 1, 1);
    }
    if (length % 3 == 0) {
      d = wholeRoot(length / 3, 2);
      if (d > 0) {
        return guess(Advisory.GUESSED_SQUARE_RGB, d, d, 1, 3);
      }
    }
    d = wholeRoot(length, 3);
    if (d > 0) {
      return guess(Advisory.GUESSED_CUBE, d, d, d, 1);
    }
    if (length % 3 == 0) {
      d = wholeRoot(length / 3, 3);
      if (d > 0) {
        return guess(Advisory.GUESSED_CUBE_RGB, d, d, d, 3);
      }
    }
    throw new ConversionException(ConversionError.DIMENSIONS_REQUIRED,
      "Please provide image dimensions; cannot guess for length " + length);
  }

  private Dimensions guess(Advisory advisory, int x, int y, int z, int c) {
    Dimensions dims = new Dimensions(x, y, z, c);
    listener.notifyAdvisory(advisory,
      advisory.getDescription() + " (" + dims + ")");
    return dims;
  }

  /**
   * @param value number to take the root of
   * @param degree 2 for a square root, 3 for a cube root
   * @return the root if it is a positive whole number whose power
   *         is exactly the value, otherwise 0
   */
  private static int wholeRoot(int value, int degree) {
    if (value <= 0) {
      return 0;
    }
    double root = degree == 2 ? Math.sqrt(value) : Math.cbrt(value);
    double rounded = Math.rint(root);
    if (!DoubleMath.fuzzyEquals(root, rounded, WHOLE_TOLERANCE * root)) {
      return 0;
    }
    long d = (long) rounded;
    long power = degree == 2 ? d * d : d * d * d;
    return power == value ? (int) d : 0;
  }

}
