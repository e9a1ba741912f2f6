/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert.test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.glencoesoftware.pixelconvert.Advisory;
import com.glencoesoftware.pixelconvert.ColourScale;
import com.glencoesoftware.pixelconvert.ConversionError;
import com.glencoesoftware.pixelconvert.ConversionException;
import com.glencoesoftware.pixelconvert.Dimensions;
import com.glencoesoftware.pixelconvert.PixelArray;
import com.glencoesoftware.pixelconvert.Raster;
import com.glencoesoftware.pixelconvert.RasterCodec;
import com.glencoesoftware.pixelconvert.RasterOptions;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class RasterCodecTest {

  TestAdvisoryListener listener;
  RasterCodec codec;

  @BeforeEach
  public void setup() {
    listener = new TestAdvisoryListener();
    codec = new RasterCodec(listener);
  }

  /**
   * Test that raster rows follow Y and columns follow X.
   */
  @Test
  public void testOrientation() {
    // 3 wide, 2 high; only (x=3, y=1) is bright
    PixelArray image = new PixelArray(new Dimensions(3, 2, 1, 1),
      new double[] {0, 0, 1, 0, 0, 0});
    Raster raster = codec.encodeFrame(image, RasterOptions.defaults());
    assertEquals(3, raster.getWidth());
    assertEquals(2, raster.getHeight());
    assertArrayEquals(new String[][] {
      {"#000000", "#000000", "#FFFFFF"},
      {"#000000", "#000000", "#000000"}
    }, raster.toArray());
    assertEquals("#FFFFFF", raster.get(0, 2));
    assertTrue(listener.getAdvisories().isEmpty());
  }

  /**
   * Test that rescaling maps the minimum to 0 and the maximum to 1.
   */
  @Test
  public void testRescale() {
    List<Double> seen = new ArrayList<Double>();
    ColourScale capture = ColourScale.gray(v -> {
      seen.add(v);
      return "";
    });
    PixelArray image = new PixelArray(new Dimensions(4, 1, 1, 1),
      new double[] {-3, 7, 2, 0.1});
    codec.encode(image,
      RasterOptions.builder().colourScale(capture).build());
    assertEquals(4, seen.size());
    assertEquals(0.0, seen.get(0).doubleValue());
    assertEquals(1.0, seen.get(1).doubleValue());
    assertEquals(0.5, seen.get(2).doubleValue(), 1e-12);
    assertEquals(Collections.singletonList(Advisory.CUSTOM_SCALE_WITH_RESCALE),
      listener.getAdvisories());
  }

  /**
   * Test that a constant image does not divide by zero.
   */
  @Test
  public void testDegenerateRescale() {
    PixelArray image = new PixelArray(new Dimensions(2, 2, 1, 1),
      new double[] {42, 42, 42, 42});
    Raster raster = codec.encodeFrame(image, RasterOptions.defaults());
    for (String[] row : raster.toArray()) {
      assertArrayEquals(new String[] {"#808080", "#808080"}, row);
    }
    assertEquals(Collections.singletonList(Advisory.DEGENERATE_RESCALE),
      listener.getAdvisories());
  }

  /**
   * Test that the rescale range covers all frames, not each one.
   */
  @Test
  public void testGlobalRescale() {
    PixelArray image = new PixelArray(new Dimensions(2, 1, 2, 1),
      new double[] {0, 1, 1, 2});
    List<Raster> rasters = codec.encode(image);
    assertEquals(2, rasters.size());
    assertArrayEquals(new String[] {"#000000", "#808080"},
      rasters.get(0).getRow(0));
    assertArrayEquals(new String[] {"#808080", "#FFFFFF"},
      rasters.get(1).getRow(0));
  }

  /**
   * Test frame selection and ordering.
   */
  @Test
  public void testFrames() {
    PixelArray image = new PixelArray(new Dimensions(1, 1, 3, 1),
      new double[] {0, 0.5, 1});
    RasterOptions options =
      RasterOptions.builder().frames(Arrays.asList(3, 1)).build();
    List<Raster> rasters = codec.encode(image, options);
    assertEquals(2, rasters.size());
    assertEquals("#FFFFFF", rasters.get(0).get(0, 0));
    assertEquals("#000000", rasters.get(1).get(0, 0));

    Raster second = codec.encodeFrame(image,
      RasterOptions.builder().frames(Collections.singletonList(2)).build());
    assertEquals("#808080", second.get(0, 0));

    assertThrows(IllegalArgumentException.class,
      () -> codec.encodeFrame(image, RasterOptions.defaults()));

    ConversionException e = assertThrows(ConversionException.class,
      () -> codec.encode(image,
        RasterOptions.builder().frames(Arrays.asList(4)).build()));
    assertEquals(ConversionError.COORDINATE_OUT_OF_RANGE, e.getError());
  }

  /**
   * Test RGB codes from three channels, ignoring any extra channels.
   */
  @Test
  public void testRgb() {
    // one pixel, channels red, green, blue, extra
    PixelArray image = new PixelArray(new Dimensions(1, 1, 1, 4),
      new double[] {1, 0, 0.2, 0.7});
    Raster raster = codec.encodeFrame(image,
      RasterOptions.builder().rescale(false).build());
    assertEquals("#FF0033", raster.get(0, 0));

    raster = codec.encodeFrame(image,
      RasterOptions.builder().rescale(false)
        .colourScale(ColourScale.rgba(0.5)).build());
    assertEquals("#FF003380", raster.get(0, 0));
    assertTrue(listener.getAdvisories().isEmpty());
  }

  /**
   * Test gray codes without rescaling.
   */
  @Test
  public void testGrayNoRescale() {
    PixelArray image = new PixelArray(new Dimensions(3, 1, 1, 1),
      new double[] {0, 0.25, 1});
    Raster raster = codec.encodeFrame(image,
      RasterOptions.builder().rescale(false).build());
    assertArrayEquals(new String[] {"#000000", "#404040", "#FFFFFF"},
      raster.getRow(0));
  }

  /**
   * Test that values outside [0, 1] fail without rescaling.
   */
  @Test
  public void testOutOfRangeWithoutRescale() {
    PixelArray image = new PixelArray(new Dimensions(2, 1, 1, 1),
      new double[] {0, 2});
    assertThrows(IllegalArgumentException.class,
      () -> codec.encode(image,
        RasterOptions.builder().rescale(false).build()));
  }

  /**
   * Test that a scale needing more channels than the image has fails.
   */
  @Test
  public void testNotEnoughChannels() {
    PixelArray image = PixelArray.zeros(new Dimensions(2, 2, 1, 2));
    assertThrows(IllegalArgumentException.class,
      () -> codec.encode(image, RasterOptions.defaults()));
    assertThrows(IllegalArgumentException.class,
      () -> codec.encode(image, RasterOptions.builder()
        .colourScale(ColourScale.RGB).build()));
  }

}
