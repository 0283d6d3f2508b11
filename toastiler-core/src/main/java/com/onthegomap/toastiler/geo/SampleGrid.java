package com.onthegomap.toastiler.geo;

/**
 * The longitude and latitude (radians) at the center of each pixel of a tile, stored row-major with row 0 along the
 * tile's top edge.
 */
public record SampleGrid(int resolution, double[] lon, double[] lat) {

  public SampleGrid {
    if (lon.length != resolution * resolution || lat.length != lon.length) {
      throw new IllegalArgumentException("expected " + resolution + "x" + resolution + " samples");
    }
  }

  public double lon(int row, int col) {
    return lon[row * resolution + col];
  }

  public double lat(int row, int col) {
    return lat[row * resolution + col];
  }

  @Override
  public String toString() {
    return "SampleGrid[" + resolution + "x" + resolution + "]";
  }
}
