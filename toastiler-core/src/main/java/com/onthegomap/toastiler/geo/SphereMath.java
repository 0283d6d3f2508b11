package com.onthegomap.toastiler.geo;

/**
 * Spherical geometry on the unit sphere.
 */
public class SphereMath {

  private SphereMath() {}

  /**
   * Returns the point halfway along the great circle between {@code a} and {@code b}.
   * <p>
   * When one end is a pole the result keeps the longitude of the other end.
   */
  public static LngLat mid(LngLat a, LngLat b) {
    double l1 = a.isPole() ? b.lon() : a.lon();
    double l2 = b.isPole() ? a.lon() : b.lon();
    double b1 = a.lat();
    double b2 = b.lat();
    double dl = l2 - l1;
    double bx = Math.cos(b2) * Math.cos(dl);
    double by = Math.cos(b2) * Math.sin(dl);
    double cosB1PlusBx = Math.cos(b1) + bx;
    double outLat = Math.atan2(Math.sin(b1) + Math.sin(b2), Math.sqrt(cosB1PlusBx * cosB1PlusBx + by * by));
    double outLon = l1 + Math.atan2(by, cosB1PlusBx);
    return new LngLat(outLon, outLat);
  }

  static double dot(double[] a, double[] b) {
    return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
  }

  static double[] cross(double[] a, double[] b) {
    return new double[]{
      a[1] * b[2] - a[2] * b[1],
      a[2] * b[0] - a[0] * b[2],
      a[0] * b[1] - a[1] * b[0]
    };
  }

  /** Returns the area (solid angle) of the spherical triangle {@code a, b, c} given as unit vectors. */
  public static double triangleArea(double[] a, double[] b, double[] c) {
    // Van Oosterom and Strackee
    double triple = Math.abs(dot(a, cross(b, c)));
    double denominator = 1 + dot(a, b) + dot(b, c) + dot(c, a);
    return 2 * Math.atan2(triple, denominator);
  }

  /**
   * Returns how far inside the convex spherical polygon {@code corners} the point {@code p} is: positive inside, negative
   * outside, 0 on an edge.
   * <p>
   * The value is the smallest signed sine of the angular distance from {@code p} to an edge's great circle.
   */
  public static double containmentMargin(double[][] corners, double[] p) {
    double[] center = new double[3];
    for (double[] corner : corners) {
      center[0] += corner[0];
      center[1] += corner[1];
      center[2] += corner[2];
    }
    double min = Double.POSITIVE_INFINITY;
    double orientation = 0;
    for (int i = 0; i < corners.length && orientation == 0; i++) {
      orientation = Math.signum(dot(cross(corners[i], corners[(i + 1) % corners.length]), center));
    }
    for (int i = 0; i < corners.length; i++) {
      double[] normal = cross(corners[i], corners[(i + 1) % corners.length]);
      double length = Math.sqrt(dot(normal, normal));
      if (length < 1e-15) {
        // repeated corner
        continue;
      }
      min = Math.min(min, orientation * dot(normal, p) / length);
    }
    return min;
  }
}
