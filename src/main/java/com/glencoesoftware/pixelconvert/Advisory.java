/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

/**
 * Non-fatal notices raised when a guess, rather than an explicit setting,
 * determined part of a conversion result.
 */
public enum Advisory {
  GUESSED_SQUARE("Guessing input is a square 2D image"),
  GUESSED_SQUARE_RGB("Guessing input is a square 2D RGB image"),
  GUESSED_CUBE("Guessing input is a cubic 3D image"),
  GUESSED_CUBE_RGB("Guessing input is a cubic 3D RGB image"),
  ASSUMED_COLOUR_AXIS("Assuming third dimension corresponds to colour"),
  ASSUMED_DEPTH_AXIS("Assuming third dimension corresponds to time/depth"),
  GUESSED_DIMENSIONS_FROM_COORDINATES(
    "Guessing image dimensions from maximum coordinate values"),
  CUSTOM_SCALE_WITH_RESCALE("A colour scale was specified, but rescale " +
    "is enabled; results may be unexpected"),
  DEGENERATE_RESCALE("Image has a single value; mapping all pixels to 0.5"),
  ONE_DIMENSIONAL("Image is one-dimensional");

  private final String description;

  private Advisory(String text) {
    description = text;
  }

  /**
   * @return human readable description
   */
  public String getDescription() {
    return description;
  }
}
