/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.util.Locale;

/**
 * The four axes of a pixel array, in storage order.
 */
public enum PixelAxis {
  X('x', "x"),
  Y('y', "y"),
  Z('z', "z"),
  C('c', "c", "cc");

  private final char type;
  private final String[] columnNames;

  private PixelAxis(char t, String... names) {
    type = t;
    columnNames = names;
  }

  /**
   * @return axis type (e.g. 'x')
   */
  public char getType() {
    return type;
  }

  /**
   * @return name of the table column written for this axis
   */
  public String getColumnName() {
    return columnNames[0];
  }

  /**
   * Find the axis that a table column refers to.
   * Matching ignores case; the channel axis accepts both "c" and "cc".
   *
   * @param column table column name
   * @return matching axis, or null if the column is not a coordinate
   */
  public static PixelAxis fromColumnName(String column) {
    if (column == null) {
      return null;
    }
    String name = column.trim().toLowerCase(Locale.ROOT);
    for (PixelAxis axis : values()) {
      for (String alias : axis.columnNames) {
        if (alias.equals(name)) {
          return axis;
        }
      }
    }
    return null;
  }

}
