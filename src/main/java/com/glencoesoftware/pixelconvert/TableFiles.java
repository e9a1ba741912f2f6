/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.google.common.math.DoubleMath;
import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes pixel tables and value lists as CSV.
 */
public final class TableFiles {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(TableFiles.class);

  private TableFiles() {
  }

  /**
   * Read a CSV file with a header row into a table.
   * Every cell must be numeric.
   *
   * @param path CSV file
   * @return new table
   * @throws IOException if the file cannot be read or parsed
   */
  public static PixelTable readTable(Path path) throws IOException {
    List<String[]> rows = parse(path);
    if (rows.isEmpty()) {
      throw new IOException("No header row in " + path);
    }
    String[] header = rows.get(0);
    double[][] columns = new double[header.length][rows.size() - 1];
    for (int r=1; r<rows.size(); r++) {
      String[] row = rows.get(r);
      if (row.length != header.length) {
        throw new IOException(String.format(
          "%s line %d: expected %d values, got %d",
          path, r + 1, header.length, row.length));
      }
      for (int c=0; c<header.length; c++) {
        columns[c][r - 1] = parseValue(row[c], path, r + 1);
      }
    }
    PixelTable.Builder table = PixelTable.builder();
    for (int c=0; c<header.length; c++) {
      if (header[c] == null) {
        throw new IOException(path + ": empty column name at " + (c + 1));
      }
      table.column(header[c].trim(), columns[c]);
    }
    PixelTable result = table.build();
    LOGGER.debug("Read {} from {}", result, path);
    return result;
  }

  /**
   * Read every value in a CSV file without a header, row by row.
   * Values may be separated by commas, whitespace or line breaks.
   *
   * @param path CSV file
   * @return values in file order
   * @throws IOException if the file cannot be read or parsed
   */
  public static double[] readValues(Path path) throws IOException {
    List<Double> values = new ArrayList<Double>();
    List<String[]> rows = parse(path);
    for (int r=0; r<rows.size(); r++) {
      for (String cell : rows.get(r)) {
        if (cell == null) {
          continue;
        }
        // cells may hold several whitespace separated values
        for (String token : cell.trim().split("\\s+")) {
          if (!token.isEmpty()) {
            values.add(parseValue(token, path, r + 1));
          }
        }
      }
    }
    double[] result = new double[values.size()];
    for (int i=0; i<result.length; i++) {
      result[i] = values.get(i);
    }
    LOGGER.debug("Read {} values from {}", result.length, path);
    return result;
  }

  /**
   * Write a table as CSV with a header row.
   * Whole numbers are written without a decimal point.
   *
   * @param table table to write
   * @param path destination file
   * @throws IOException if the file cannot be written
   */
  public static void writeTable(PixelTable table, Path path)
    throws IOException
  {
    CsvWriterSettings settings = new CsvWriterSettings();
    try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      CsvWriter writer = new CsvWriter(out, settings);
      writer.writeHeaders(table.getColumnNames());
      String[] cells = new String[table.getColumnCount()];
      for (int r=0; r<table.getRowCount(); r++) {
        double[] row = table.getRow(r);
        for (int c=0; c<cells.length; c++) {
          cells[c] = formatValue(row[c]);
        }
        writer.writeRow((Object[]) cells);
      }
      writer.flush();
    }
    LOGGER.debug("Wrote {} to {}", table, path);
  }

  static String formatValue(double v) {
    if (DoubleMath.isMathematicalInteger(v) && Math.abs(v) < 1e15) {
      return String.valueOf((long) v);
    }
    return String.valueOf(v);
  }

  private static List<String[]> parse(Path path) throws IOException {
    CsvParserSettings parserSettings = new CsvParserSettings();
    parserSettings.setLineSeparatorDetectionEnabled(true);
    parserSettings.setHeaderExtractionEnabled(false);
    // value lists may be a single long line
    parserSettings.setMaxCharsPerColumn(-1);
    parserSettings.setMaxColumns(
      Math.max(parserSettings.getMaxColumns(), longestLine(path) + 1));

    CsvParser parser = new CsvParser(parserSettings);
    try {
      return parser.parseAll(path.toFile(), StandardCharsets.UTF_8);
    }
    catch (TextParsingException e) {
      throw new IOException("Could not parse " + path, e);
    }
  }

  /**
   * A line of n characters holds at most n + 1 columns.
   */
  private static int longestLine(Path path) throws IOException {
    int longest = 0;
    try (BufferedReader reader =
      Files.newBufferedReader(path, StandardCharsets.UTF_8))
    {
      String line;
      while ((line = reader.readLine()) != null) {
        longest = Math.max(longest, line.length());
      }
    }
    return longest;
  }

  private static double parseValue(String cell, Path path, int line)
    throws IOException
  {
    if (cell == null) {
      throw new IOException(path + " line " + line + ": missing value");
    }
    try {
      return Double.parseDouble(cell.trim());
    }
    catch (NumberFormatException e) {
      throw new IOException(
        path + " line " + line + ": not a number: " + cell, e);
    }
  }

}
