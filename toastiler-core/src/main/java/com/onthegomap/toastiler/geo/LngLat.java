package com.onthegomap.toastiler.geo;

/**
 * A point on the unit sphere as longitude and latitude in radians.
 */
public record LngLat(double lon, double lat) {

  private static final double POLE_EPSILON = 1e-12;

  public static LngLat ofDegrees(double lonDegrees, double latDegrees) {
    return new LngLat(Math.toRadians(lonDegrees), Math.toRadians(latDegrees));
  }

  /** Returns true for the north or south pole, where longitude is meaningless. */
  public boolean isPole() {
    return Math.abs(Math.abs(lat) - Math.PI / 2) < POLE_EPSILON;
  }

  /** Returns the 3D unit vector {@code [x, y, z]} for this point. */
  public double[] toVector() {
    double cosLat = Math.cos(lat);
    return new double[]{cosLat * Math.cos(lon), cosLat * Math.sin(lon), Math.sin(lat)};
  }

  @Override
  public String toString() {
    return "LngLat[lon=" + Math.toDegrees(lon) + "°, lat=" + Math.toDegrees(lat) + "°]";
  }
}
