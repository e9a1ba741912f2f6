/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.pixelconvert.test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import com.glencoesoftware.pixelconvert.Dimensions;
import com.glencoesoftware.pixelconvert.PixelArray;
import com.glencoesoftware.pixelconvert.SpatialGridAdapter;
import com.glencoesoftware.pixelconvert.SpatialGridFactory;
import com.glencoesoftware.pixelconvert.SpatialGrids;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

public class SpatialGridAdapterTest {

  /**
   * Minimal grid: a copy of the rows and the window it was created with.
   */
  static class Grid {
    final double[][] rows;
    final String window;

    Grid(double[][] rows, String window) {
      this.rows = rows;
      this.window = window;
    }
  }

  static class GridFactory implements SpatialGridFactory<Grid, String> {
    @Override
    public Grid create(double[][] rows, Optional<String> window) {
      double[][] copy = new double[rows.length][];
      for (int i=0; i<rows.length; i++) {
        copy[i] = rows[i].clone();
      }
      return new Grid(copy, window.orElse("default"));
    }

    @Override
    public double[][] toRows(Grid grid) {
      return grid.rows;
    }
  }

  SpatialGridAdapter<Grid, String> adapter;

  @BeforeEach
  public void setup() {
    adapter = new SpatialGridAdapter<Grid, String>(new GridFactory());
  }

  /**
   * Test that the image's last row becomes the grid's first row.
   */
  @Test
  public void testRotation() {
    // 3 wide, 2 high
    PixelArray image = new PixelArray(new Dimensions(3, 2, 1, 1),
      new double[] {1, 2, 3, 4, 5, 6});
    Grid grid = adapter.toGrids(image).single();
    assertArrayEquals(new double[][] {{4, 5, 6}, {1, 2, 3}}, grid.rows);
    assertEquals("default", grid.window);
  }

  /**
   * Test that converting to a grid and back gives the same plane.
   */
  @Test
  public void testSingleRoundTrip() {
    PixelArray image = TableCodecTest.coded(new Dimensions(5, 3, 1, 1));
    SpatialGrids<Grid> grids = adapter.toGrids(image, Optional.of("window"));
    assertEquals(SpatialGrids.Layout.SINGLE, grids.getLayout());
    assertEquals("window", grids.single().window);
    assertEquals(image, adapter.fromGrid(grids.single()));
  }

  static Stream<Arguments> layouts() {
    return Stream.of(
      Arguments.of(new Dimensions(2, 2, 1, 1), SpatialGrids.Layout.SINGLE),
      Arguments.of(new Dimensions(2, 2, 3, 1), SpatialGrids.Layout.FRAMES),
      Arguments.of(new Dimensions(2, 2, 1, 3), SpatialGrids.Layout.CHANNELS),
      Arguments.of(new Dimensions(2, 2, 2, 3),
        SpatialGrids.Layout.FRAMES_AND_CHANNELS)
    );
  }

  /**
   * Test the grid nesting and that each grid holds the right plane.
   */
  @ParameterizedTest
  @MethodSource("layouts")
  public void testLayouts(Dimensions dims, SpatialGrids.Layout layout) {
    PixelArray image = TableCodecTest.coded(dims);
    SpatialGrids<Grid> grids = adapter.toGrids(image);
    assertEquals(layout, grids.getLayout());
    assertEquals(dims.getZ(), grids.getDepth());
    assertEquals(dims.getC(), grids.getChannelCount());

    List<Grid> all = grids.asList();
    assertEquals(dims.getZ() * dims.getC(), all.size());
    int i = 0;
    for (int z=1; z<=dims.getZ(); z++) {
      List<Grid> frame = grids.getFrame(z);
      assertEquals(dims.getC(), frame.size());
      for (int c=1; c<=dims.getC(); c++) {
        Grid grid = grids.get(z, c);
        // depth-major, then channel
        assertEquals(all.get(i++), grid);
        assertEquals(frame.get(c - 1), grid);
        assertEquals(image.getPlane(z, c), adapter.fromGrid(grid));
      }
    }
  }

  /**
   * Test lookups outside the grid list.
   */
  @Test
  public void testOutOfRange() {
    SpatialGrids<Grid> grids =
      adapter.toGrids(PixelArray.zeros(new Dimensions(2, 2, 2, 1)));
    assertThrows(IllegalStateException.class, () -> grids.single());
    assertThrows(IndexOutOfBoundsException.class, () -> grids.get(3, 1));
    assertThrows(IndexOutOfBoundsException.class, () -> grids.get(1, 2));
    assertThrows(IndexOutOfBoundsException.class, () -> grids.getFrame(0));
  }

  /**
   * Test that malformed grids are rejected.
   */
  @Test
  public void testInvalidGrid() {
    assertThrows(IllegalArgumentException.class,
      () -> adapter.fromGrid(new Grid(new double[0][], "")));
    assertThrows(IllegalArgumentException.class,
      () -> adapter.fromGrid(new Grid(new double[][] {{1, 2}, {3}}, "")));
  }

}
