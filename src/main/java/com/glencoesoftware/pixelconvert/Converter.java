/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command line tool for converting pixel data between CSV tables,
 * value lists and colour rasters.
 */
public class Converter implements Callable<Integer> {

  private static final Logger LOGGER = LoggerFactory.getLogger(Converter.class);

  private volatile Path inputPath;
  private volatile Path outputPath;

  private volatile InputFormat inputFormat;
  private volatile OutputFormat outputFormat;
  private volatile String valueColumn;
  private volatile List<Integer> dimensionList;
  private volatile Integer sizeX;
  private volatile Integer sizeY;
  private volatile Integer sizeZ;
  private volatile Integer sizeC;
  private volatile WideFormat wideFormat;
  private volatile boolean keepUnused = false;
  private volatile boolean noRescale = false;
  private volatile List<Integer> frames;
  private volatile boolean overwrite = false;
  private volatile boolean noAdvisories = false;

  private volatile String logLevel;
  private volatile boolean printVersion = false;
  private volatile boolean help = false;

  private IAdvisoryListener advisoryListener;

  // Option setters

  /**
   * @param input path to the input data
   */
  @Parameters(
    index = "0",
    arity = "1",
    description = "file to convert",
    defaultValue = Option.NULL_VALUE
  )
  public void setInputPath(String input) {
    inputPath = input == null ? null : Paths.get(input);
  }

  /**
   * @param output path to the output file
   */
  @Parameters(
    index = "1",
    arity = "1",
    description = "file to write",
    defaultValue = Option.NULL_VALUE
  )
  public void setOutputPath(String output) {
    outputPath = output == null ? null : Paths.get(output);
  }

  /**
   * @param format how the input file is laid out
   */
  @Option(
    names = {"-i", "--input-format"},
    description = "Input layout: ${COMPLETION-CANDIDATES} " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "table"
  )
  public void setInputFormat(InputFormat format) {
    inputFormat = format;
  }

  /**
   * @param format how the output file should be laid out
   */
  @Option(
    names = {"-o", "--output-format"},
    description = "Output layout: ${COMPLETION-CANDIDATES} " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "table"
  )
  public void setOutputFormat(OutputFormat format) {
    outputFormat = format;
  }

  /**
   * @param column name of the input table's value column
   */
  @Option(
    names = "--value-column",
    description = "Name of the column holding pixel values " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = TableCodec.DEFAULT_VALUE_COLUMN
  )
  public void setValueColumn(String column) {
    valueColumn = column;
  }

  /**
   * Set all four image dimensions at once.
   * Cannot be combined with the per-axis size options.
   *
   * @param dims comma-separated X, Y, Z and C sizes
   */
  @Option(
    names = "--dims",
    split = ",",
    description = "Comma-separated image dimensions X,Y,Z,C. " +
      "If not set, dimensions are guessed from the input",
    defaultValue = Option.NULL_VALUE
  )
  public void setDimensions(List<Integer> dims) {
    if (dims != null && dims.size() != 4) {
      throw new IllegalArgumentException(
        "Expected 4 dimensions, got " + dims);
    }
    dimensionList = dims;
  }

  /**
   * @param size image width, or null if unspecified
   */
  @Option(
    names = {"-x", "--size-x"},
    description = "Image width (value lists only)",
    defaultValue = Option.NULL_VALUE
  )
  public void setSizeX(Integer size) {
    sizeX = size;
  }

  /**
   * @param size image height, or null if unspecified
   */
  @Option(
    names = {"-y", "--size-y"},
    description = "Image height (value lists only)",
    defaultValue = Option.NULL_VALUE
  )
  public void setSizeY(Integer size) {
    sizeY = size;
  }

  /**
   * @param size image depth, or null if unspecified
   */
  @Option(
    names = {"-z", "--size-z"},
    description = "Image depth (value lists only)",
    defaultValue = Option.NULL_VALUE
  )
  public void setSizeZ(Integer size) {
    sizeZ = size;
  }

  /**
   * @param size channel count, or null if unspecified
   */
  @Option(
    names = {"-c", "--size-c"},
    description = "Number of channels (value lists only)",
    defaultValue = Option.NULL_VALUE
  )
  public void setSizeC(Integer size) {
    sizeC = size;
  }

  /**
   * @param format table layout for table output
   */
  @Option(
    names = "--wide",
    converter = WideFormatConverter.class,
    description = "Spread values across columns by channel (c) or " +
      "depth (d); 'none' writes one row per pixel " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "none"
  )
  public void setWideFormat(WideFormat format) {
    wideFormat = format;
  }

  /**
   * @param keep true if Z and C columns are written for axes of size 1
   */
  @Option(
    names = "--keep-unused",
    description = "Write coordinate columns for axes of size 1",
    defaultValue = "false"
  )
  public void setKeepUnused(boolean keep) {
    keepUnused = keep;
  }

  /**
   * @param raw true if values are passed to the colour scale as is
   */
  @Option(
    names = "--no-rescale",
    description = "Do not rescale values to [0, 1] before colour mapping; " +
      "values outside [0, 1] will fail",
    defaultValue = "false"
  )
  public void setNoRescale(boolean raw) {
    noRescale = raw;
  }

  /**
   * @param frameList 1-based depth frames to write as rasters
   */
  @Option(
    names = "--frames",
    split = ",",
    description = "Comma-separated list of 1-based depth frames to " +
      "write as rasters (default: all)",
    defaultValue = Option.NULL_VALUE
  )
  public void setFrames(List<Integer> frameList) {
    frames = frameList;
  }

  /**
   * @param overwriteOutput true if an existing output file is replaced
   */
  @Option(
    names = "--overwrite",
    description = "Overwrite the output file if it exists",
    defaultValue = "false"
  )
  public void setOverwrite(boolean overwriteOutput) {
    overwrite = overwriteOutput;
  }

  /**
   * @param quiet true if conversion advisories are discarded
   */
  @Option(
    names = "--no-advisories",
    description = "Do not report guessed dimensions or other conversion " +
      "advisories",
    defaultValue = "false"
  )
  public void setNoAdvisories(boolean quiet) {
    noAdvisories = quiet;
  }

  /**
   * Set the slf4j logging level. Defaults to "WARN".
   *
   * @param level logging level
   */
  @Option(
    names = {"--log-level", "--debug"},
    arity = "0..1",
    description = "Change logging level; valid values are " +
      "OFF, ERROR, WARN, INFO, DEBUG, TRACE and ALL. " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "WARN",
    fallbackValue = "DEBUG"
  )
  public void setLogLevel(String level) {
    if (level != null) {
      logLevel = level;
    }
  }

  /**
   * Configure whether to print version information and exit
   * without converting.
   *
   * @param versionOnly whether or not to print version information and exit
   */
  @Option(
    names = "--version",
    description = "Print version information and exit",
    help = true,
    defaultValue = "false"
  )
  public void setPrintVersionOnly(boolean versionOnly) {
    printVersion = versionOnly;
  }

  /**
   * Configure whether to print help and exit without converting.
   *
   * @param helpOnly whether or not to print help and exit
   */
  @Option(
    names = "--help",
    description = "Print usage information and exit",
    usageHelp = true,
    defaultValue = "false"
  )
  public void setHelp(boolean helpOnly) {
    help = helpOnly;
  }

  // Option getters

  /**
   * @return path to input data
   */
  public Path getInputPath() {
    return inputPath;
  }

  /**
   * @return path to output data
   */
  public Path getOutputPath() {
    return outputPath;
  }

  /**
   * @return input layout
   */
  public InputFormat getInputFormat() {
    return inputFormat;
  }

  /**
   * @return output layout
   */
  public OutputFormat getOutputFormat() {
    return outputFormat;
  }

  /**
   * @return name of the value column
   */
  public String getValueColumn() {
    return valueColumn;
  }

  /**
   * @return dimensions set with --dims, or null
   */
  public Dimensions getDimensions() {
    if (dimensionList == null) {
      return null;
    }
    return new Dimensions(dimensionList.get(0), dimensionList.get(1),
      dimensionList.get(2), dimensionList.get(3));
  }

  /**
   * @return axis sizes from --dims or the per-axis options
   */
  public AxisSizes getAxisSizes() {
    Dimensions dims = getDimensions();
    if (dims != null) {
      return AxisSizes.of(dims);
    }
    return AxisSizes.builder()
      .size(PixelAxis.X, sizeX)
      .size(PixelAxis.Y, sizeY)
      .size(PixelAxis.Z, sizeZ)
      .size(PixelAxis.C, sizeC)
      .build();
  }

  /**
   * @return table layout
   */
  public WideFormat getWideFormat() {
    return wideFormat;
  }

  /**
   * @return true if unused coordinate columns are written
   */
  public boolean getKeepUnused() {
    return keepUnused;
  }

  /**
   * @return true if raster values are not rescaled
   */
  public boolean getNoRescale() {
    return noRescale;
  }

  /**
   * @return selected raster frames, or null for all
   */
  public List<Integer> getFrames() {
    return frames;
  }

  /**
   * @return true if an existing output file is replaced
   */
  public boolean getOverwrite() {
    return overwrite;
  }

  /**
   * @return true if conversion advisories are discarded
   */
  public boolean getNoAdvisories() {
    return noAdvisories;
  }

  /**
   * @return slf4j logging level
   */
  public String getLogLevel() {
    return logLevel;
  }

  /**
   * @return true if only version info is displayed
   */
  public boolean getPrintVersionOnly() {
    return printVersion;
  }

  /**
   * @return true if only usage info is displayed
   */
  public boolean getHelp() {
    return help;
  }

  // Conversion methods

  /**
   * @return 0 if conversion completed without error,
   *         -1 if conversion was not performed
   * @throws Exception on most conversion errors
   */
  @Override
  public Integer call() throws Exception {
    ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
        LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.toLevel(logLevel));

    if (help) {
      return -1;
    }

    if (printVersion) {
      String version = Optional.ofNullable(
        this.getClass().getPackage().getImplementationVersion()
        ).orElse("development");
      System.out.println("Version = " + version);
      return -1;
    }

    if (inputPath == null) {
      throw new IllegalArgumentException("Input path not specified");
    }
    if (outputPath == null) {
      throw new IllegalArgumentException("Output path not specified");
    }
    if (dimensionList != null &&
      (sizeX != null || sizeY != null || sizeZ != null || sizeC != null))
    {
      throw new IllegalArgumentException(
        "--dims cannot be combined with per-axis sizes");
    }
    if (inputFormat == InputFormat.table &&
      (sizeX != null || sizeY != null || sizeZ != null || sizeC != null))
    {
      LOGGER.warn("Per-axis sizes are ignored for table input; use --dims");
    }
    if (Files.exists(outputPath)) {
      if (!overwrite) {
        throw new IllegalArgumentException(
          "Output path " + outputPath + " already exists");
      }
      LOGGER.warn("Overwriting {}", outputPath);
    }

    convert();
    return 0;
  }

  /**
   * Read the input file, build a pixel array and write it in the
   * requested output layout.
   *
   * @throws Exception if the input cannot be read or converted, or the
   *         output cannot be written
   */
  public void convert() throws Exception {
    IAdvisoryListener listener = getAdvisoryListener();

    Slf4JStopWatch t0 = stopWatch();
    ImageInput input = inputFormat.read(inputPath, this);
    t0.stop("read");

    Slf4JStopWatch t1 = stopWatch();
    PixelArray image = new ImageConversions(listener).toPixelArray(input);
    t1.stop("toPixelArray");
    LOGGER.info("Read {} from {}", image, inputPath);

    Slf4JStopWatch t2 = stopWatch();
    outputFormat.write(image, outputPath, this, listener);
    t2.stop("write");
    LOGGER.info("Wrote {} to {}", outputFormat, outputPath);
  }

  private static Slf4JStopWatch stopWatch() {
    return new Slf4JStopWatch(LOGGER, Slf4JStopWatch.DEBUG_LEVEL);
  }

  /**
   * Set a listener for conversion advisories.
   *
   * @param listener an advisory listener
   */
  public void setAdvisoryListener(IAdvisoryListener listener) {
    advisoryListener = listener;
  }

  /**
   * Get the current listener for conversion advisories.
   * If no listener was set, advisories are logged unless
   * --no-advisories was given.
   *
   * @return the current advisory listener
   */
  public IAdvisoryListener getAdvisoryListener() {
    if (advisoryListener == null) {
      if (noAdvisories) {
        setAdvisoryListener(new NoOpAdvisoryListener());
      }
      else {
        setAdvisoryListener(new LoggingAdvisoryListener());
      }
    }
    return advisoryListener;
  }

  /**
   * Perform file conversion as specified by command line arguments.
   * @param args command line arguments
   */
  public static void main(String[] args) {
    int exitCode = new CommandLine(new Converter()).execute(args);
    System.exit(exitCode);
  }

}
