/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert.test;

import java.util.Arrays;
import java.util.Collections;

import com.glencoesoftware.pixelconvert.Advisory;
import com.glencoesoftware.pixelconvert.ArrayNormalizer;
import com.glencoesoftware.pixelconvert.AxisSizes;
import com.glencoesoftware.pixelconvert.ConversionError;
import com.glencoesoftware.pixelconvert.ConversionException;
import com.glencoesoftware.pixelconvert.Dimensions;
import com.glencoesoftware.pixelconvert.ImageConversions;
import com.glencoesoftware.pixelconvert.ImageInput;
import com.glencoesoftware.pixelconvert.PixelArray;
import com.glencoesoftware.pixelconvert.PixelTable;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class ArrayNormalizerTest {

  TestAdvisoryListener listener;
  ArrayNormalizer normalizer;
  ImageConversions conversions;

  @BeforeEach
  public void setup() {
    listener = new TestAdvisoryListener();
    normalizer = new ArrayNormalizer(listener);
    conversions = new ImageConversions(listener);
  }

  /**
   * Test that a 2D array becomes a single grayscale plane.
   */
  @Test
  public void testMatrix() {
    double[][] m = {{1, 2, 3}, {4, 5, 6}};
    PixelArray image = conversions.toPixelArray(ImageInput.matrix(m));
    assertEquals(new Dimensions(2, 3, 1, 1), image.getDimensions());
    for (int x=0; x<2; x++) {
      for (int y=0; y<3; y++) {
        assertEquals(m[x][y], image.get(x + 1, y + 1, 1, 1));
      }
    }
    // first axis varies fastest
    assertArrayEquals(new double[] {1, 4, 2, 5, 3, 6}, image.getValues());
    assertTrue(listener.getAdvisories().isEmpty());
  }

  /**
   * Test that a third axis of size 3 is read as colour.
   */
  @Test
  public void testColourAxis() {
    double[][][] v = new double[4][5][3];
    v[3][4][2] = 7;
    PixelArray image = conversions.toPixelArray(ImageInput.volume(v));
    assertEquals(new Dimensions(4, 5, 1, 3), image.getDimensions());
    assertEquals(7, image.get(4, 5, 1, 3));
    assertEquals(Collections.singletonList(Advisory.ASSUMED_COLOUR_AXIS),
      listener.getAdvisories());
  }

  /**
   * Test that a third axis of any other size is read as depth.
   */
  @ParameterizedTest
  @ValueSource(ints = {1, 2, 4, 10})
  public void testDepthAxis(int depth) {
    double[][][] v = new double[2][2][depth];
    v[1][0][depth - 1] = 3;
    PixelArray image = conversions.toPixelArray(ImageInput.volume(v));
    assertEquals(new Dimensions(2, 2, depth, 1), image.getDimensions());
    assertEquals(3, image.get(2, 1, depth, 1));
    assertEquals(Collections.singletonList(Advisory.ASSUMED_DEPTH_AXIS),
      listener.getAdvisories());
  }

  /**
   * Test that a 4D array is unchanged.
   */
  @Test
  public void testHypervolume() {
    double[][][][] h = new double[2][3][4][5];
    h[1][2][3][4] = 9;
    h[0][1][2][3] = 8;
    PixelArray image = conversions.toPixelArray(ImageInput.hypervolume(h));
    assertEquals(new Dimensions(2, 3, 4, 5), image.getDimensions());
    assertEquals(9, image.get(2, 3, 4, 5));
    assertEquals(8, image.get(1, 2, 3, 4));
    assertEquals(9, image.getValue(image.getLength() - 1));
    double[][][][] copy = image.toArray();
    assertEquals(9, copy[1][2][3][4]);
    assertEquals(8, copy[0][1][2][3]);
    assertTrue(listener.getAdvisories().isEmpty());
  }

  /**
   * Test that arrays of other ranks are rejected.
   */
  @ParameterizedTest
  @ValueSource(ints = {1, 5})
  public void testUnsupportedRank(int rank) {
    int[] shape = new int[rank];
    Arrays.fill(shape, 2);
    double[] data = new double[1 << rank];
    ConversionException e = assertThrows(ConversionException.class,
      () -> normalizer.normalize(shape, data));
    assertEquals(ConversionError.UNSUPPORTED_RANK, e.getError());
    e = assertThrows(ConversionException.class,
      () -> conversions.toPixelArray(ImageInput.shaped(shape, data)));
    assertEquals(ConversionError.UNSUPPORTED_RANK, e.getError());
  }

  /**
   * Test that integer and boolean values are converted to double.
   */
  @Test
  public void testCoercion() {
    PixelArray ints = conversions.toPixelArray(
      ImageInput.matrix(new int[][] {{1, 2}, {3, 4}}));
    assertArrayEquals(new double[] {1, 3, 2, 4}, ints.getValues());

    PixelArray bools = conversions.toPixelArray(
      ImageInput.matrix(new boolean[][] {{true, false}, {false, true}}));
    assertArrayEquals(new double[] {1, 0, 0, 1}, bools.getValues());

    PixelArray flat = conversions.toPixelArray(ImageInput.flat(
      new boolean[] {true, true, false, false},
      AxisSizes.builder().x(2).y(2).build()));
    assertArrayEquals(new double[] {1, 1, 0, 0}, flat.getValues());

    // last axis of 2 is depth, not colour
    PixelArray boolVolume = conversions.toPixelArray(ImageInput.volume(
      new boolean[][][] {{{true, false}}, {{false, true}}}));
    assertEquals(new Dimensions(2, 1, 2, 1), boolVolume.getDimensions());
    assertArrayEquals(new double[] {1, 0, 0, 1}, boolVolume.getValues());

    PixelArray intHyper = conversions.toPixelArray(ImageInput.hypervolume(
      new int[][][][] {{{{1, 2}}}, {{{3, 4}}}}));
    assertEquals(new Dimensions(2, 1, 1, 2), intHyper.getDimensions());
    assertArrayEquals(new double[] {1, 3, 2, 4}, intHyper.getValues());

    PixelArray boolHyper = conversions.toPixelArray(ImageInput.hypervolume(
      new boolean[][][][] {{{{true, false}}}, {{{false, false}}}}));
    assertEquals(new Dimensions(2, 1, 1, 2), boolHyper.getDimensions());
    assertArrayEquals(new double[] {1, 0, 0, 0}, boolHyper.getValues());
  }

  /**
   * Test that ragged arrays are rejected.
   */
  @Test
  public void testRagged() {
    double[][] ragged = {{1, 2}, {3}};
    assertThrows(IllegalArgumentException.class,
      () -> ImageInput.matrix(ragged));
  }

  /**
   * Test that shape and data must agree.
   */
  @Test
  public void testShapeMismatch() {
    assertThrows(IllegalArgumentException.class,
      () -> normalizer.normalize(new int[] {2, 2}, new double[5]));
    assertThrows(IllegalArgumentException.class,
      () -> normalizer.normalize(new int[] {0, 2}, new double[0]));
  }

  /**
   * Test that flat and tabular inputs are dispatched to the resolver
   * and table decoder.
   */
  @Test
  public void testDispatch() {
    PixelArray flat = conversions.toPixelArray(
      ImageInput.flat(new double[16]));
    assertEquals(new Dimensions(4, 4, 1, 1), flat.getDimensions());
    assertEquals(Collections.singletonList(Advisory.GUESSED_SQUARE),
      listener.getAdvisories());

    PixelTable table = PixelTable.builder()
      .column("x", new int[] {1, 2})
      .column("value", new double[] {5, 6})
      .build();
    PixelArray decoded = conversions.toPixelArray(
      ImageInput.table(table, "value", new Dimensions(2, 1, 1, 1)));
    assertArrayEquals(new double[] {5, 6}, decoded.getValues());
    assertEquals(1, listener.getAdvisories().size());
  }

  /**
   * Test that the input array is copied.
   */
  @Test
  public void testInputNotAliased() {
    double[] data = {1, 2, 3, 4};
    PixelArray image = normalizer.normalize(new int[] {2, 2}, data);
    data[0] = 100;
    assertEquals(1, image.get(1, 1, 1, 1));
  }

}
