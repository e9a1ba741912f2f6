/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

/**
 * Reasons a conversion can fail.
 */
public enum ConversionError {
  /** Explicit axis sizes do not multiply to the number of values. */
  INCOMPATIBLE_DIMENSIONS,
  /** Dimensions could not be guessed and must be supplied. */
  DIMENSIONS_REQUIRED,
  /** Input array has fewer than 2 or more than 4 axes. */
  UNSUPPORTED_RANK,
  /** Coordinate is not an integer within the axis bounds. */
  COORDINATE_OUT_OF_RANGE,
  /** Table contains a coordinate less than 1. */
  NON_POSITIVE_COORDINATE,
  /** Table has no column with the requested value name. */
  MISSING_VALUE_COLUMN,
  /** Table has no x, y, z, c or cc column. */
  MISSING_COORDINATES,
  /** Image has more than two non-trivial axes. */
  TOO_MANY_DIMENSIONS;
}
