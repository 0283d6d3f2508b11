package com.onthegomap.toastiler.image;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class TileMergersTest {

  @Test
  void testAverageOfHomogeneousBlocks() {
    TileImage mosaic = TileImage.mosaic(
      TileImage.filled(ImageMode.U8, 2, 2, 10),
      TileImage.filled(ImageMode.U8, 2, 2, 20),
      TileImage.filled(ImageMode.U8, 2, 2, 30),
      TileImage.filled(ImageMode.U8, 2, 2, 40)
    );
    TileImage result = TileMergers.average().merge(mosaic);
    assertEquals(2, result.width());
    assertEquals(2, result.height());
    assertEquals(10, result.get(0, 0));
    assertEquals(20, result.get(1, 0));
    assertEquals(30, result.get(0, 1));
    assertEquals(40, result.get(1, 1));
  }

  @Test
  void testAverageTruncatesEightBit() {
    TileImage mosaic = TileImage.create(ImageMode.U8, 2, 2)
      .set(0, 0, 1).set(1, 0, 2).set(0, 1, 2).set(1, 1, 2);
    assertEquals(1, TileMergers.average().merge(mosaic).get(0, 0));
  }

  @Test
  void testAveragePerChannelInFloat() {
    TileImage mosaic = TileImage.create(ImageMode.F32, 2, 2)
      .set(0, 0, 1).set(1, 0, 2).set(0, 1, 2).set(1, 1, 2);
    assertEquals(1.75, TileMergers.average().merge(mosaic).get(0, 0), 1e-6);

    TileImage rgb = TileImage.filled(ImageMode.RGB, 2, 2, 0);
    for (int y = 0; y < 2; y++) {
      for (int x = 0; x < 2; x++) {
        rgb.set(x, y, 2, 100);
      }
    }
    TileImage merged = TileMergers.average().merge(rgb);
    assertEquals(0, merged.get(0, 0, 0));
    assertEquals(100, merged.get(0, 0, 2));
  }
}
