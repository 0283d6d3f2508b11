package com.onthegomap.toastiler.samplers;

import com.onthegomap.toastiler.geo.SampleGrid;
import com.onthegomap.toastiler.image.TileImage;
import com.onthegomap.toastiler.image.TileImageFormat;
import com.onthegomap.toastiler.pipeline.TileSampler;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Samples an all-sky image in the plate carrée (equirectangular) projection with nearest-neighbor lookup.
 * <p>
 * Columns span longitude {@code -π} at the left edge to {@code π} at the right, rows span latitude {@code π/2} at the
 * top to {@code -π/2} at the bottom.
 */
public class PlateCarreeSampler implements TileSampler {

  private static final double TWO_PI = 2 * Math.PI;
  private final TileImage source;

  public PlateCarreeSampler(TileImage source) {
    this.source = source;
  }

  /**
   * Loads the source image from a file.
   *
   * @throws UncheckedIOException if the file cannot be read or decoded
   */
  public static PlateCarreeSampler fromFile(Path path) {
    TileImageFormat format = TileImageFormat.forPath(path);
    try {
      return new PlateCarreeSampler(format.decode(Files.readAllBytes(path)));
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read " + path, e);
    }
  }

  @Override
  public TileImage sample(SampleGrid grid) {
    int resolution = grid.resolution();
    TileImage result = TileImage.create(source.mode(), resolution);
    int width = source.width();
    int height = source.height();
    for (int row = 0; row < resolution; row++) {
      for (int col = 0; col < resolution; col++) {
        double lon = grid.lon(row, col);
        double lat = grid.lat(row, col);
        // move into [-π, π)
        lon = ((lon + Math.PI) % TWO_PI + TWO_PI) % TWO_PI - Math.PI;
        int x = clamp((int) Math.floor((lon + Math.PI) / TWO_PI * width), width);
        int y = clamp((int) Math.floor((Math.PI / 2 - lat) / Math.PI * height), height);
        for (int c = 0; c < source.channels(); c++) {
          result.set(col, row, c, source.get(x, y, c));
        }
      }
    }
    return result;
  }

  private static int clamp(int value, int size) {
    return Math.max(0, Math.min(size - 1, value));
  }
}
