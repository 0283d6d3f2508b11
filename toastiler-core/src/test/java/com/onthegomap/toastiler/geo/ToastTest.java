package com.onthegomap.toastiler.geo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ToastTest {

  @ParameterizedTest
  @CsvSource({
    "0, 1",
    "1, 5",
    "2, 21",
    "3, 85",
    "8, 87381",
  })
  void testTileCount(int depth, long expected) {
    assertEquals(expected, Toast.tileCount(depth));
  }

  @Test
  void testTileCountRejectsNegativeDepth() {
    assertThrows(IllegalArgumentException.class, () -> Toast.tileCount(-1));
  }

  @ParameterizedTest
  @CsvSource({
    "1, 256",
    "256, 256",
    "257, 512",
    "1000, 1024",
  })
  void testNextHighestPowerOf2(int n, int expected) {
    assertEquals(expected, Toast.nextHighestPowerOf2(n));
  }

  @Test
  void testBaseTiles() {
    assertEquals(List.of(
      new TilePos(1, 0, 0),
      new TilePos(1, 1, 0),
      new TilePos(1, 1, 1),
      new TilePos(1, 0, 1)
    ), Toast.BASE_TILES.stream().map(ToastTile::pos).toList());
  }

  @Test
  void testSubdivideSharesCorners() {
    ToastTile tile = Toast.BASE_TILES.get(0);
    List<ToastTile> children = tile.subdivide();
    assertEquals(tile.pos().children(), children.stream().map(ToastTile::pos).toList());
    assertEquals(tile.ul(), children.get(0).ul());
    assertEquals(tile.ur(), children.get(1).ur());
    assertEquals(tile.ll(), children.get(2).ll());
    assertEquals(tile.lr(), children.get(3).lr());
    assertEquals(children.get(0).lr(), children.get(3).ul());
    children.forEach(child -> assertEquals(tile.increasing(), child.increasing()));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 3, 4, 5, 6})
  void testAreasSumToSphere(int depth) {
    List<ToastTile> tiles = new ArrayList<>(Toast.BASE_TILES);
    for (int n = 1; n < depth; n++) {
      tiles = tiles.stream().flatMap(tile -> tile.subdivide().stream()).toList();
    }
    double sum = tiles.stream().mapToDouble(Toast::tileArea).sum();
    assertEquals(4 * Math.PI, sum, 1e-6);
  }

  @ParameterizedTest
  @CsvSource({
    "0, 0, 0",
    "1, 1, 0",
    "2, 3, 1",
    "3, 7, 3",
    "4, 14, 7",
    "5, 29, 14",
    "6, 59, 29",
    "7, 119, 59",
    "8, 239, 119",
    "9, 479, 239",
    "10, 959, 479",
    "11, 1918, 959",
    "12, 3837, 1918",
  })
  void testTileForPoint(int n, int x, int y) {
    assertEquals(new TilePos(n, x, y), Toast.tileForPoint(n, 0.1, 0.1));
  }

  @Test
  void testTileForPointOnBoundariesDoesNotFail() {
    double[][] latLons = {
      {0, 0}, {0, -0.5 * Math.PI}, {0, 0.5 * Math.PI}, {0, Math.PI}, {0, 1.5 * Math.PI}, {0, 2 * Math.PI},
      {-0.5 * Math.PI, 0}, {-0.5 * Math.PI, Math.PI}, {0.5 * Math.PI, 0}, {0.5 * Math.PI, -Math.PI},
    };
    for (int depth = 0; depth < 4; depth++) {
      for (double[] latLon : latLons) {
        assertEquals(depth, Toast.tileForPoint(depth, latLon[0], latLon[1]).n());
      }
    }
  }

  @Test
  void testSampleGridPixelsFallInsideTheirTile() {
    List<ToastTile> tiles = Toast.BASE_TILES.stream().flatMap(tile -> tile.subdivide().stream()).toList();
    for (ToastTile tile : tiles) {
      SampleGrid grid = Toast.sampleGrid(tile, 4);
      assertEquals(4, grid.resolution());
      for (int row = 0; row < 4; row++) {
        for (int col = 0; col < 4; col++) {
          assertEquals(tile.pos(), Toast.tileForPoint(2, grid.lat(row, col), grid.lon(row, col)),
            "pixel " + col + "," + row + " of " + tile.pos());
        }
      }
    }
  }

  @Test
  void testSampleGridOfOnePixelIsTileCenter() {
    ToastTile tile = Toast.BASE_TILES.get(2);
    SampleGrid grid = Toast.sampleGrid(tile, 1);
    assertEquals(tile.center().lon(), grid.lon(0, 0), 1e-12);
    assertEquals(tile.center().lat(), grid.lat(0, 0), 1e-12);
  }

  @Test
  void testSampleGridRequiresPowerOf2() {
    ToastTile tile = Toast.BASE_TILES.get(0);
    assertThrows(IllegalArgumentException.class, () -> Toast.sampleGrid(tile, 3));
    assertThrows(IllegalArgumentException.class, () -> Toast.sampleGrid(tile, 0));
  }

  @Test
  void testSampleGridLatitudesInRange() {
    SampleGrid grid = Toast.sampleGrid(Toast.BASE_TILES.get(1), 16);
    for (int row = 0; row < 16; row++) {
      for (int col = 0; col < 16; col++) {
        double lat = grid.lat(row, col);
        assertTrue(lat > -Math.PI / 2 && lat < Math.PI / 2, "lat=" + lat);
      }
    }
  }
}
