/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.util.function.DoubleFunction;

/**
 * Maps the channel values of one pixel to a colour code string.
 */
public interface ColourScale {

  /** Maps a single value in [0, 1] to a gray "#RRGGBB" code. */
  ColourScale GRAY = gray(v -> Colours.toHex(v, v, v, null));

  /** Maps three values in [0, 1] to a "#RRGGBB" code. */
  ColourScale RGB = rgb((r, g, b) -> Colours.toHex(r, g, b, null));

  /**
   * @return number of channel values consumed per pixel (1 or 3)
   */
  int getChannelCount();

  /**
   * @param channels one value per consumed channel; the array is reused
   *                 between pixels and must not be retained
   * @return colour code
   */
  String apply(double[] channels);

  /**
   * @param function maps one value to a colour code
   * @return single channel colour scale
   */
  static ColourScale gray(DoubleFunction<String> function) {
    return new ColourScale() {
      @Override
      public int getChannelCount() {
        return 1;
      }

      @Override
      public String apply(double[] channels) {
        return function.apply(channels[0]);
      }
    };
  }

  /**
   * @param function maps red, green and blue values to a colour code
   * @return three channel colour scale
   */
  static ColourScale rgb(RgbFunction function) {
    return new ColourScale() {
      @Override
      public int getChannelCount() {
        return 3;
      }

      @Override
      public String apply(double[] channels) {
        return function.apply(channels[0], channels[1], channels[2]);
      }
    };
  }

  /**
   * @param alpha opacity in [0, 1]
   * @return RGB scale producing "#RRGGBBAA" codes
   */
  static ColourScale rgba(double alpha) {
    Colours.checkIntensity(alpha);
    return rgb((r, g, b) -> Colours.toHex(r, g, b, alpha));
  }

  @FunctionalInterface
  interface RgbFunction {
    String apply(double red, double green, double blue);
  }

}
