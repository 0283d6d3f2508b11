package com.onthegomap.toastiler.geo;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;

/**
 * Utilities for the TOAST projection: base tiles, pyramid sizes, pixel sampling grids, and point lookups.
 */
public class Toast {

  /** The 4 depth-1 tiles derived from an octahedron, in traversal order. */
  public static final List<ToastTile> BASE_TILES = List.of(
    new ToastTile(new TilePos(1, 0, 0),
      LngLat.ofDegrees(0, -90), LngLat.ofDegrees(90, 0), LngLat.ofDegrees(0, 90), LngLat.ofDegrees(180, 0), true),
    new ToastTile(new TilePos(1, 1, 0),
      LngLat.ofDegrees(90, 0), LngLat.ofDegrees(0, -90), LngLat.ofDegrees(0, 0), LngLat.ofDegrees(0, 90), false),
    new ToastTile(new TilePos(1, 1, 1),
      LngLat.ofDegrees(0, 90), LngLat.ofDegrees(0, 0), LngLat.ofDegrees(0, -90), LngLat.ofDegrees(270, 0), true),
    new ToastTile(new TilePos(1, 0, 1),
      LngLat.ofDegrees(180, 0), LngLat.ofDegrees(0, 90), LngLat.ofDegrees(270, 0), LngLat.ofDegrees(0, -90), false)
  );

  public static final int DEFAULT_TILE_SIZE = 256;

  private Toast() {}

  /**
   * Returns the number of tiles in a pyramid from the root down to {@code depth}: {@code (4^(depth+1) - 1) / 3}.
   *
   * @throws IllegalArgumentException if depth is negative or too large
   */
  public static long tileCount(int depth) {
    checkArgument(depth >= 0 && depth <= TilePos.MAX_DEPTH, "invalid depth %s", depth);
    return ((1L << (2 * (depth + 1))) - 1) / 3;
  }

  /** Returns the smallest power of 2 that is {@code >= n}, and at least {@value #DEFAULT_TILE_SIZE}. */
  public static int nextHighestPowerOf2(int n) {
    int result = DEFAULT_TILE_SIZE;
    while (result < n) {
      result <<= 1;
    }
    return result;
  }

  /**
   * Returns the location of each pixel center in a {@code resolution x resolution} image of {@code tile}.
   * <p>
   * The tile's quadrilateral is subdivided {@code log2(resolution)} times the same way {@link ToastTile#subdivide()}
   * splits tiles, and each pixel is the diagonal center of one of the resulting cells.
   *
   * @throws IllegalArgumentException if {@code resolution} is not a positive power of 2
   */
  public static SampleGrid sampleGrid(ToastTile tile, int resolution) {
    checkArgument(resolution > 0 && Integer.bitCount(resolution) == 1,
      "resolution must be a power of 2, got %s", resolution);
    int size = 1;
    // cells[row * size + col] = {ul, ur, lr, ll}
    LngLat[][] cells = {{tile.ul(), tile.ur(), tile.lr(), tile.ll()}};
    boolean increasing = tile.increasing();
    while (size < resolution) {
      int childSize = size * 2;
      LngLat[][] children = new LngLat[childSize * childSize][];
      for (int row = 0; row < size; row++) {
        for (int col = 0; col < size; col++) {
          LngLat[] c = cells[row * size + col];
          LngLat top = SphereMath.mid(c[0], c[1]);
          LngLat right = SphereMath.mid(c[1], c[2]);
          LngLat bottom = SphereMath.mid(c[2], c[3]);
          LngLat left = SphereMath.mid(c[3], c[0]);
          LngLat center = increasing ? SphereMath.mid(c[3], c[1]) : SphereMath.mid(c[0], c[2]);
          int r = row * 2;
          int k = col * 2;
          children[r * childSize + k] = new LngLat[]{c[0], top, center, left};
          children[r * childSize + k + 1] = new LngLat[]{top, c[1], right, center};
          children[(r + 1) * childSize + k] = new LngLat[]{left, center, bottom, c[3]};
          children[(r + 1) * childSize + k + 1] = new LngLat[]{center, right, c[2], bottom};
        }
      }
      cells = children;
      size = childSize;
    }
    double[] lon = new double[resolution * resolution];
    double[] lat = new double[resolution * resolution];
    for (int i = 0; i < cells.length; i++) {
      LngLat[] c = cells[i];
      LngLat center = increasing ? SphereMath.mid(c[3], c[1]) : SphereMath.mid(c[0], c[2]);
      lon[i] = center.lon();
      lat[i] = center.lat();
    }
    return new SampleGrid(resolution, lon, lat);
  }

  /**
   * Returns the area of {@code tile} on the unit sphere, as two spherical triangles on either side of its diagonal.
   * <p>
   * The areas of all tiles at one depth add up to {@code 4π}.
   */
  public static double tileArea(ToastTile tile) {
    double[][] c = tile.cornerVectors();
    if (tile.increasing()) {
      return SphereMath.triangleArea(c[0], c[1], c[3]) + SphereMath.triangleArea(c[1], c[2], c[3]);
    } else {
      return SphereMath.triangleArea(c[0], c[1], c[2]) + SphereMath.triangleArea(c[0], c[2], c[3]);
    }
  }

  /**
   * Returns the position of the tile at {@code depth} that contains the point at {@code lat, lon} (radians).
   * <p>
   * Points on a shared edge go to whichever neighbor the descent picks first.
   */
  public static TilePos tileForPoint(int depth, double lat, double lon) {
    checkArgument(depth >= 0 && depth <= TilePos.MAX_DEPTH, "invalid depth %s", depth);
    if (depth == 0) {
      return TilePos.ROOT;
    }
    double[] point = new LngLat(lon, lat).toVector();
    ToastTile tile = bestContaining(BASE_TILES, point);
    while (tile.pos().n() < depth) {
      tile = bestContaining(tile.subdivide(), point);
    }
    return tile.pos();
  }

  private static ToastTile bestContaining(List<ToastTile> candidates, double[] point) {
    ToastTile best = null;
    double bestMargin = Double.NEGATIVE_INFINITY;
    for (ToastTile candidate : candidates) {
      double margin = SphereMath.containmentMargin(candidate.cornerVectors(), point);
      if (margin > bestMargin) {
        bestMargin = margin;
        best = candidate;
      }
    }
    return best;
  }
}
