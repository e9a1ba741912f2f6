/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.google.common.collect.ImmutableList;

/**
 * Table of named numeric columns, all with the same number of rows.
 * Column names are unique ignoring case.  Instances are immutable.
 */
public final class PixelTable {

  private final ImmutableList<String> names;
  private final Map<String, double[]> columns;
  private final int rowCount;

  private PixelTable(List<String> columnNames, Map<String, double[]> data,
    int rows)
  {
    names = ImmutableList.copyOf(columnNames);
    columns = data;
    rowCount = rows;
  }

  /**
   * @return a builder for a new table
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return column names in insertion order
   */
  public List<String> getColumnNames() {
    return names;
  }

  /**
   * @return number of columns
   */
  public int getColumnCount() {
    return names.size();
  }

  /**
   * @return number of rows
   */
  public int getRowCount() {
    return rowCount;
  }

  /**
   * Find the name of a column, ignoring case.
   *
   * @param name column name to look for
   * @return the column name as stored, or null if there is no such column
   */
  public String findColumn(String name) {
    if (name == null) {
      return null;
    }
    String key = name.toLowerCase(Locale.ROOT);
    for (String n : names) {
      if (n.toLowerCase(Locale.ROOT).equals(key)) {
        return n;
      }
    }
    return null;
  }

  /**
   * @param name column name (case-insensitive)
   * @return copy of the column values
   * @throws IllegalArgumentException if there is no such column
   */
  public double[] getColumn(String name) {
    return column(name).clone();
  }

  /**
   * @param name column name (case-insensitive)
   * @param row 0-based row index
   * @return cell value
   */
  public double get(String name, int row) {
    return column(name)[row];
  }

  /**
   * @param row 0-based row index
   * @return copy of the row, in column order
   */
  public double[] getRow(int row) {
    if (row < 0 || row >= rowCount) {
      throw new IndexOutOfBoundsException("Row " + row + " of " + rowCount);
    }
    double[] values = new double[names.size()];
    for (int i=0; i<values.length; i++) {
      values[i] = columns.get(names.get(i))[row];
    }
    return values;
  }

  private double[] column(String name) {
    String stored = findColumn(name);
    if (stored == null) {
      throw new IllegalArgumentException("No such column: " + name);
    }
    return columns.get(stored);
  }

  @Override
  public String toString() {
    return "PixelTable" + names + "[" + rowCount + " rows]";
  }

  public static final class Builder {

    private final List<String> names = new ArrayList<String>();
    private final Map<String, double[]> columns =
      new LinkedHashMap<String, double[]>();
    private int rowCount = -1;

    private Builder() {
    }

    /**
     * Append a column.  The values are copied.
     *
     * @param name column name; must not match an existing name
     *             ignoring case
     * @param values column values
     * @return this builder
     */
    public Builder column(String name, double[] values) {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Column name must be set");
      }
      for (String existing : names) {
        if (existing.equalsIgnoreCase(name)) {
          throw new IllegalArgumentException("Duplicate column: " + name);
        }
      }
      if (rowCount >= 0 && values.length != rowCount) {
        throw new IllegalArgumentException("Column " + name + " has " +
          values.length + " rows, expected " + rowCount);
      }
      rowCount = values.length;
      names.add(name);
      columns.put(name, values.clone());
      return this;
    }

    /**
     * Append a column of integer values.
     *
     * @param name column name
     * @param values column values
     * @return this builder
     */
    public Builder column(String name, int[] values) {
      double[] converted = new double[values.length];
      for (int i=0; i<values.length; i++) {
        converted[i] = values[i];
      }
      return column(name, converted);
    }

    public PixelTable build() {
      return new PixelTable(names, new LinkedHashMap<String, double[]>(columns),
        Math.max(rowCount, 0));
    }
  }

}
