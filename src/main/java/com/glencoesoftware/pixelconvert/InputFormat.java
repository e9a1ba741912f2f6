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
 * Enumeration that backs the --input-format flag. Instances read a file
 * into an {@link ImageInput}.
 */
public enum InputFormat {
  /** CSV with a header row, coordinate columns and a value column. */
  table {
    ImageInput read(Path path, Converter settings) throws IOException {
      PixelTable pixels = TableFiles.readTable(path);
      Dimensions dims = settings.getDimensions();
      if (dims != null) {
        return ImageInput.table(pixels, settings.getValueColumn(), dims);
      }
      return ImageInput.table(pixels, settings.getValueColumn());
    }
  },
  /** CSV of bare values in XYZC order. */
  values {
    ImageInput read(Path path, Converter settings) throws IOException {
      return ImageInput.flat(
        TableFiles.readValues(path), settings.getAxisSizes());
    }
  };
  abstract ImageInput read(Path path, Converter settings) throws IOException;
}
