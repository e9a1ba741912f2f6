/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

/**
 * Helper methods for building colour code strings.
 */
final class Colours {

  private static final int MAX_LEVEL = 255;

  private Colours() {
  }

  /**
   * Build a hexadecimal colour code.
   * Each intensity is converted to a level with (int) (255 * v + 0.5).
   *
   * @param red red intensity in [0, 1]
   * @param green green intensity in [0, 1]
   * @param blue blue intensity in [0, 1]
   * @param alpha opacity in [0, 1], or null to omit
   * @return "#RRGGBB" or "#RRGGBBAA"
   */
  static String toHex(double red, double green, double blue, Double alpha) {
    StringBuilder code = new StringBuilder(9).append('#');
    appendLevel(code, red);
    appendLevel(code, green);
    appendLevel(code, blue);
    if (alpha != null) {
      appendLevel(code, alpha);
    }
    return code.toString();
  }

  static void checkIntensity(double v) {
    if (!(v >= 0 && v <= 1)) {
      throw new IllegalArgumentException(
        "Colour intensity " + v + " not in [0,1]");
    }
  }

  private static void appendLevel(StringBuilder code, double v) {
    checkIntensity(v);
    code.append(String.format("%02X", (int) (MAX_LEVEL * v + 0.5)));
  }

}
