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
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Writes rasters as a JSON document:
 * <code>{"width": W, "height": H, "frames": [[["#RRGGBB", ...], ...]]}</code>.
 * Each frame is a list of rows, each row a list of colour codes.
 */
public class RasterWriter {

  private final ObjectMapper objectMapper = new ObjectMapper();

  /**
   * @param rasters frames to write; all must have the same size
   * @return JSON tree
   */
  public ObjectNode toJson(List<Raster> rasters) {
    if (rasters.isEmpty()) {
      throw new IllegalArgumentException("No rasters to write");
    }
    Raster first = rasters.get(0);
    ObjectNode root = objectMapper.createObjectNode();
    root.put("width", first.getWidth());
    root.put("height", first.getHeight());
    ArrayNode frames = root.putArray("frames");
    for (Raster raster : rasters) {
      if (raster.getWidth() != first.getWidth() ||
        raster.getHeight() != first.getHeight())
      {
        throw new IllegalArgumentException("Raster " + raster +
          " does not match " + first);
      }
      ArrayNode frame = frames.addArray();
      for (int row=0; row<raster.getHeight(); row++) {
        ArrayNode codes = frame.addArray();
        for (String code : raster.getRow(row)) {
          codes.add(code);
        }
      }
    }
    return root;
  }

  /**
   * @param rasters frames to write
   * @param path destination file
   * @throws IOException if the file cannot be written
   */
  public void write(List<Raster> rasters, Path path) throws IOException {
    objectMapper.writerWithDefaultPrettyPrinter()
      .writeValue(path.toFile(), toJson(rasters));
  }

}
