package com.onthegomap.toastiler.image;

/**
 * Built-in {@link TileMerger} implementations.
 */
public class TileMergers {

  private static final TileMerger AVERAGE = TileMergers::average;

  private TileMergers() {}

  /**
   * Returns a merger that averages each 2x2 block of pixels into one, per channel, converting back to the mosaic's
   * mode (truncating in 8-bit modes).
   */
  public static TileMerger average() {
    return AVERAGE;
  }

  private static TileImage average(TileImage mosaic) {
    int width = mosaic.width() / 2;
    int height = mosaic.height() / 2;
    TileImage result = TileImage.create(mosaic.mode(), width, height);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        for (int c = 0; c < mosaic.channels(); c++) {
          double sum = mosaic.get(2 * x, 2 * y, c) / 4d +
            mosaic.get(2 * x + 1, 2 * y, c) / 4d +
            mosaic.get(2 * x, 2 * y + 1, c) / 4d +
            mosaic.get(2 * x + 1, 2 * y + 1, c) / 4d;
          result.set(x, y, c, sum);
        }
      }
    }
    return result;
  }
}
