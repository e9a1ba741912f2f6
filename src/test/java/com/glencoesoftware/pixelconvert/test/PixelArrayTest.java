/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert.test;

import java.util.Collections;

import com.glencoesoftware.pixelconvert.Advisory;
import com.glencoesoftware.pixelconvert.ConversionError;
import com.glencoesoftware.pixelconvert.ConversionException;
import com.glencoesoftware.pixelconvert.Dimensions;
import com.glencoesoftware.pixelconvert.PixelArray;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class PixelArrayTest {

  TestAdvisoryListener listener;

  @BeforeEach
  public void setup() {
    listener = new TestAdvisoryListener();
  }

  /**
   * Test that dimensions and values must agree.
   */
  @Test
  public void testConstruction() {
    assertThrows(IllegalArgumentException.class,
      () -> new PixelArray(new Dimensions(2, 2, 1, 1), new double[3]));
    assertThrows(IllegalArgumentException.class,
      () -> new Dimensions(0, 2, 1, 1));
    PixelArray zeros = PixelArray.zeros(new Dimensions(3, 2, 1, 1));
    assertArrayEquals(new double[6], zeros.getValues());
    assertEquals("3x2x1x1", zeros.getDimensions().toString());
  }

  /**
   * Test that the array cannot be changed through its inputs or outputs.
   */
  @Test
  public void testImmutable() {
    double[] data = {1, 2, 3, 4};
    PixelArray image = new PixelArray(new Dimensions(2, 2, 1, 1), data);
    data[0] = 100;
    image.getValues()[1] = 100;
    image.toArray()[1][1][0][0] = 100;
    assertArrayEquals(new double[] {1, 2, 3, 4}, image.getValues());
    assertEquals(1, image.getMin());
    assertEquals(4, image.getMax());
  }

  /**
   * Test value lookup by coordinate.
   */
  @Test
  public void testGet() {
    PixelArray image = TableCodecTest.coded(new Dimensions(3, 2, 2, 2));
    assertEquals(1 + 10 + 100 + 1000, image.get(1, 1, 1, 1));
    assertEquals(3 + 20 + 200 + 2000, image.get(3, 2, 2, 2));
    assertEquals(2 + 10 + 200 + 1000, image.get(2, 1, 2, 1));
    ConversionException e = assertThrows(ConversionException.class,
      () -> image.get(4, 1, 1, 1));
    assertEquals(ConversionError.COORDINATE_OUT_OF_RANGE, e.getError());
  }

  /**
   * Test extracting frames, channels and planes.
   */
  @Test
  public void testSlices() {
    Dimensions dims = new Dimensions(3, 2, 4, 2);
    PixelArray image = TableCodecTest.coded(dims);

    PixelArray frame = image.getFrame(3);
    assertEquals(new Dimensions(3, 2, 1, 2), frame.getDimensions());
    PixelArray channel = image.getChannel(2);
    assertEquals(new Dimensions(3, 2, 4, 1), channel.getDimensions());
    PixelArray plane = image.getPlane(3, 2);
    assertEquals(new Dimensions(3, 2, 1, 1), plane.getDimensions());

    for (int x=1; x<=3; x++) {
      for (int y=1; y<=2; y++) {
        for (int c=1; c<=2; c++) {
          assertEquals(image.get(x, y, 3, c), frame.get(x, y, 1, c));
        }
        for (int z=1; z<=4; z++) {
          assertEquals(image.get(x, y, z, 2), channel.get(x, y, z, 1));
        }
        assertEquals(image.get(x, y, 3, 2), plane.get(x, y, 1, 1));
      }
    }

    ConversionException e = assertThrows(ConversionException.class,
      () -> image.getFrame(5));
    assertEquals(ConversionError.COORDINATE_OUT_OF_RANGE, e.getError());
    e = assertThrows(ConversionException.class, () -> image.getChannel(0));
    assertEquals(ConversionError.COORDINATE_OUT_OF_RANGE, e.getError());
    e = assertThrows(ConversionException.class, () -> image.getPlane(1, 3));
    assertEquals(ConversionError.COORDINATE_OUT_OF_RANGE, e.getError());
  }

  /**
   * Test that a 2D image becomes a [x][y] matrix.
   */
  @Test
  public void testToMatrix() {
    PixelArray image = new PixelArray(new Dimensions(2, 3, 1, 1),
      new double[] {1, 2, 3, 4, 5, 6});
    double[][] m = image.toMatrix(listener);
    assertEquals(2, m.length);
    assertArrayEquals(new double[] {1, 3, 5}, m[0]);
    assertArrayEquals(new double[] {2, 4, 6}, m[1]);
    assertTrue(listener.getAdvisories().isEmpty());
  }

  /**
   * Test that the two non-empty axes are used whichever they are.
   */
  @Test
  public void testToMatrixDepthAndChannel() {
    PixelArray image = TableCodecTest.coded(new Dimensions(1, 1, 2, 3));
    double[][] m = image.toMatrix(listener);
    assertEquals(2, m.length);
    assertEquals(3, m[0].length);
    for (int z=1; z<=2; z++) {
      for (int c=1; c<=3; c++) {
        assertEquals(image.get(1, 1, z, c), m[z - 1][c - 1]);
      }
    }
  }

  /**
   * Test that a single non-empty axis gives a one column matrix.
   */
  @Test
  public void testToMatrixOneDimensional() {
    PixelArray image = new PixelArray(new Dimensions(1, 1, 3, 1),
      new double[] {7, 8, 9});
    double[][] m = image.toMatrix(listener);
    assertEquals(3, m.length);
    assertArrayEquals(new double[] {8}, m[1]);
    assertEquals(Collections.singletonList(Advisory.ONE_DIMENSIONAL),
      listener.getAdvisories());

    PixelArray single = new PixelArray(new Dimensions(1, 1, 1, 1),
      new double[] {5});
    assertArrayEquals(new double[][] {{5}}, single.toMatrix(listener));
    assertEquals(1, listener.getAdvisories().size());
  }

  /**
   * Test that more than two non-empty axes cannot be a matrix.
   */
  @Test
  public void testToMatrixTooManyDimensions() {
    PixelArray image = PixelArray.zeros(new Dimensions(2, 2, 2, 1));
    ConversionException e = assertThrows(ConversionException.class,
      () -> image.toMatrix(listener));
    assertEquals(ConversionError.TOO_MANY_DIMENSIONS, e.getError());
  }

  /**
   * Test equality on dimensions and values.
   */
  @Test
  public void testEquals() {
    double[] data = {1, 2, 3, 4};
    PixelArray a = new PixelArray(new Dimensions(2, 2, 1, 1), data);
    PixelArray b = new PixelArray(new Dimensions(2, 2, 1, 1), data);
    PixelArray c = new PixelArray(new Dimensions(4, 1, 1, 1), data);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
  }

}
