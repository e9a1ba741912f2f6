/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts pixel arrays to and from tables with one row per pixel
 * (or per location, when values are spread across columns).
 */
public class TableCodec {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(TableCodec.class);

  /** Default name of the column holding pixel values. */
  public static final String DEFAULT_VALUE_COLUMN = "value";

  private final IAdvisoryListener listener;

  /**
   * Create a codec that logs advisories.
   */
  public TableCodec() {
    this(new LoggingAdvisoryListener());
  }

  /**
   * @param listener receives a notification when decoded dimensions
   *                 are guessed
   */
  public TableCodec(IAdvisoryListener listener) {
    this.listener = listener;
  }

  /**
   * Convert to a table with one row per pixel.
   *
   * @param image pixel array to convert
   * @return see {@link #encode(PixelArray, WideFormat, boolean)}
   */
  public PixelTable encode(PixelArray image) {
    return encode(image, WideFormat.NONE, true);
  }

  /**
   * @param image pixel array to convert
   * @param format table layout
   * @return see {@link #encode(PixelArray, WideFormat, boolean)}
   */
  public PixelTable encode(PixelArray image, WideFormat format) {
    return encode(image, format, true);
  }

  /**
   * Convert a pixel array to a table.
   *
   * Coordinate columns are named "x", "y", "z" and "c" and hold 1-based
   * coordinates.  Rows are in XYZC order (X varies fastest).
   * For {@link WideFormat#NONE}, values are stored in a "value" column.
   * For {@link WideFormat#BY_CHANNEL} there is one row per XYZ location
   * and one column per channel ("c.1", "c.2", ...);
   * {@link WideFormat#BY_DEPTH} has one row per XYC location and one
   * column per depth frame ("z.1", "z.2", ...).
   *
   * @param image pixel array to convert
   * @param format table layout
   * @param dropUnused if true, omit Z and C coordinate columns for axes
   *                   of size 1; X and Y are always written
   * @return new table
   */
  public PixelTable encode(PixelArray image, WideFormat format,
    boolean dropUnused)
  {
    Dimensions dims = image.getDimensions();
    PixelAxis spread = format.getSpreadAxis();

    // the grid covers every axis except the one spread across columns
    List<PixelAxis> gridAxes = new ArrayList<PixelAxis>();
    for (PixelAxis axis : PixelAxis.values()) {
      if (axis != spread) {
        gridAxes.add(axis);
      }
    }
    int rows = 1;
    for (PixelAxis axis : gridAxes) {
      rows *= dims.getSize(axis);
    }

    PixelTable.Builder table = PixelTable.builder();
    int stride = 1;
    for (PixelAxis axis : gridAxes) {
      int size = dims.getSize(axis);
      boolean keep = axis == PixelAxis.X || axis == PixelAxis.Y ||
        !dropUnused || size > 1;
      if (keep) {
        int[] coords = new int[rows];
        for (int row=0; row<rows; row++) {
          coords[row] = (row / stride) % size + 1;
        }
        table.column(axis.getColumnName(), coords);
      }
      stride *= size;
    }

    if (spread == null) {
      table.column(DEFAULT_VALUE_COLUMN, image.getValues());
    }
    else {
      int columnCount = dims.getSize(spread);
      for (int i=1; i<=columnCount; i++) {
        PixelArray slice =
          spread == PixelAxis.C ? image.getChannel(i) : image.getFrame(i);
        table.column(spread.getColumnName() + "." + i, slice.getValues());
      }
    }
    PixelTable result = table.build();
    LOGGER.debug("Encoded {} as {} ({})", image, result, format);
    return result;
  }

  /**
   * Convert a table with a "value" column to a pixel array, guessing
   * dimensions from the coordinates.
   *
   * @param table table to convert
   * @return see {@link #decode(PixelTable, String, Dimensions)}
   */
  public PixelArray decode(PixelTable table) {
    return decode(table, DEFAULT_VALUE_COLUMN);
  }

  /**
   * Convert a table to a pixel array, guessing dimensions from the
   * largest coordinate on each axis.
   *
   * @param table table to convert
   * @param valueColumn name of the column holding pixel values
   * @return see {@link #decode(PixelTable, String, Dimensions)}
   */
  public PixelArray decode(PixelTable table, String valueColumn) {
    return decode(table, valueColumn, Optional.<Dimensions>empty());
  }

  /**
   * Convert a table to a pixel array.
   *
   * Coordinate columns are recognized by name, ignoring case: "x", "y",
   * "z", and "c" or "cc" for the channel.  Other columns are ignored.
   * Coordinates are 1-based; missing axes are 1.  Pixels not covered by
   * any row are 0.  If several rows have the same coordinates, the last
   * row wins.
   *
   * @param table table to convert
   * @param valueColumn name of the column holding pixel values
   * @param dims dimensions of the new array
   * @return new pixel array
   * @throws ConversionException if the table has no coordinate or value
   *         column, or a coordinate is out of range
   */
  public PixelArray decode(PixelTable table, String valueColumn,
    Dimensions dims)
  {
    return decode(table, valueColumn, Optional.of(dims));
  }

  private PixelArray decode(PixelTable table, String valueColumn,
    Optional<Dimensions> dims)
  {
    String valueName = table.findColumn(valueColumn);

    Map<PixelAxis, double[]> coordinates =
      new EnumMap<PixelAxis, double[]>(PixelAxis.class);
    for (String name : table.getColumnNames()) {
      if (name.equals(valueName)) {
        continue;
      }
      PixelAxis axis = PixelAxis.fromColumnName(name);
      if (axis != null) {
        if (coordinates.containsKey(axis)) {
          throw new IllegalArgumentException(
            "More than one column for axis " + axis.getType());
        }
        coordinates.put(axis, table.getColumn(name));
      }
    }
    if (coordinates.isEmpty()) {
      throw new ConversionException(ConversionError.MISSING_COORDINATES,
        "Input must have (x, y, value) format or similar; columns are " +
        table.getColumnNames());
    }
    if (valueName == null) {
      throw new ConversionException(ConversionError.MISSING_VALUE_COLUMN,
        String.format("Variable %s is missing", valueColumn));
    }

    for (Map.Entry<PixelAxis, double[]> entry : coordinates.entrySet()) {
      for (double v : entry.getValue()) {
        if (!(v > 0)) {
          throw new ConversionException(
            ConversionError.NON_POSITIVE_COORDINATE,
            "Indices must be positive; found " +
            entry.getKey().getType() + "=" + v);
        }
      }
    }

    Dimensions target = dims.orElseGet(() -> guessDimensions(coordinates));

    double[] values = table.getColumn(valueName);
    double[] pixels = new double[target.getLength()];
    double[] coord = new double[4];
    for (int row=0; row<table.getRowCount(); row++) {
      for (PixelAxis axis : PixelAxis.values()) {
        double[] column = coordinates.get(axis);
        coord[axis.ordinal()] = column == null ? 1 : column[row];
      }
      pixels[CoordinateIndexer.linearOffset(target, coord)] = values[row];
    }
    return PixelArray.wrap(target, pixels);
  }

  private Dimensions guessDimensions(Map<PixelAxis, double[]> coordinates) {
    int[] sizes = {1, 1, 1, 1};
    for (Map.Entry<PixelAxis, double[]> entry : coordinates.entrySet()) {
      double max = 1;
      for (double v : entry.getValue()) {
        max = Math.max(max, v);
      }
      sizes[entry.getKey().ordinal()] = (int) Math.ceil(max);
    }
    Dimensions dims = Dimensions.of(sizes);
    listener.notifyAdvisory(Advisory.GUESSED_DIMENSIONS_FROM_COORDINATES,
      Advisory.GUESSED_DIMENSIONS_FROM_COORDINATES.getDescription() +
      " (" + dims + ")");
    return dims;
  }

}
