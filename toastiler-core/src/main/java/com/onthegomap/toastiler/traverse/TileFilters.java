package com.onthegomap.toastiler.traverse;

import static com.google.common.base.Preconditions.checkArgument;

import com.onthegomap.toastiler.geo.LngLat;
import com.onthegomap.toastiler.geo.TilePos;

/**
 * Factories for the standard {@link TileFilter} implementations.
 */
public class TileFilters {

  private static final double TWO_PI = 2 * Math.PI;

  private TileFilters() {}

  /** Returns a filter that accepts every tile. */
  public static TileFilter all() {
    return tile -> true;
  }

  /**
   * Returns a filter that accepts tiles whose corners overlap a right ascension (longitude) and declination (latitude)
   * box, all in radians.
   *
   * @throws IllegalArgumentException if a range has {@code min > max}
   * @see #rightAscension(double, double)
   * @see #declination(double, double)
   */
  public static TileFilter bounds(double minRa, double maxRa, double minDec, double maxDec) {
    return declination(minDec, maxDec).and(rightAscension(minRa, maxRa));
  }

  /**
   * Returns a filter that accepts tiles whose corner latitudes overlap {@code [minDec, maxDec]} in radians.
   *
   * @throws IllegalArgumentException if {@code minDec > maxDec}
   */
  public static TileFilter declination(double minDec, double maxDec) {
    checkArgument(minDec <= maxDec, "dec range min %s > max %s", minDec, maxDec);
    return tile -> {
      double tileMinDec = Double.POSITIVE_INFINITY;
      double tileMaxDec = Double.NEGATIVE_INFINITY;
      for (LngLat corner : tile.corners()) {
        tileMinDec = Math.min(tileMinDec, corner.lat());
        tileMaxDec = Math.max(tileMaxDec, corner.lat());
      }
      return minDec <= tileMaxDec && maxDec >= tileMinDec;
    };
  }

  /**
   * Returns a filter on right ascension, {@code [minRa, maxRa]} in radians.
   * <p>
   * Corner longitudes are moved into {@code [0, 2π)}, ignoring poles. When they span at most π the tile is accepted if
   * the range overlaps them. When they span more than π the tile wraps around the 0 meridian and is rejected whenever
   * the range overlaps the open interval between its lowest and highest corner longitude, even if the range also
   * reaches into the part of the sky the tile covers.
   *
   * @throws IllegalArgumentException if {@code minRa > maxRa}
   */
  public static TileFilter rightAscension(double minRa, double maxRa) {
    checkArgument(minRa <= maxRa, "ra range min %s > max %s", minRa, maxRa);
    return tile -> {
      double tileMinRa = Double.POSITIVE_INFINITY;
      double tileMaxRa = Double.NEGATIVE_INFINITY;
      for (LngLat corner : tile.corners()) {
        if (!corner.isPole()) {
          double ra = corner.lon() < 0 ? corner.lon() + TWO_PI : corner.lon();
          tileMinRa = Math.min(tileMinRa, ra);
          tileMaxRa = Math.max(tileMaxRa, ra);
        }
      }
      if (tileMaxRa - tileMinRa > Math.PI) {
        return !(minRa < tileMaxRa && maxRa > tileMinRa);
      }
      return minRa <= tileMaxRa && maxRa >= tileMinRa;
    };
  }

  /**
   * Returns a filter that limits traversal to {@code region} and its descendants.
   * <p>
   * Tiles at or above the region's depth pass only if they contain the region. Deeper tiles always pass since
   * traversal only reaches them through an accepted ancestor.
   */
  public static TileFilter subRegion(TilePos region) {
    return tile -> tile.pos().n() > region.n() || region.isDescendantOf(tile.pos());
  }
}
