/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Enumeration that backs the --output-format flag. Instances write a
 * pixel array in the chosen representation.
 */
public enum OutputFormat {
  /** CSV table, long or wide. */
  table {
    void write(PixelArray image, Path path, Converter settings,
      IAdvisoryListener listener) throws IOException
    {
      TableCodec codec = new TableCodec(listener);
      TableFiles.writeTable(codec.encode(image, settings.getWideFormat(),
        !settings.getKeepUnused()), path);
    }
  },
  /** JSON document of colour codes, one raster per depth frame. */
  raster {
    void write(PixelArray image, Path path, Converter settings,
      IAdvisoryListener listener) throws IOException
    {
      RasterCodec codec = new RasterCodec(listener);
      RasterOptions options = RasterOptions.builder()
        .rescale(!settings.getNoRescale())
        .frames(settings.getFrames())
        .build();
      new RasterWriter().write(codec.encode(image, options), path);
    }
  };
  abstract void write(PixelArray image, Path path, Converter settings,
    IAdvisoryListener listener) throws IOException;
}
