package com.onthegomap.toastiler.config;

import com.onthegomap.toastiler.traverse.TileFilter;
import com.onthegomap.toastiler.traverse.TileFilters;
import java.util.List;
import java.util.Optional;

/**
 * Right ascension and declination limits, in radians, on which tiles are built.
 * <p>
 * Either axis may be {@code null}, in which case tiles are not tested on that axis at all.
 */
public record SkyBounds(Interval ra, Interval dec) {

  public SkyBounds {
    if (ra == null && dec == null) {
      throw new IllegalArgumentException("sky bounds need a ra or dec range");
    }
  }

  /** A closed {@code [min, max]} range in radians. */
  public record Interval(double min, double max) {

    public Interval {
      if (min > max) {
        throw new IllegalArgumentException("invalid range, min > max: " + min + "," + max);
      }
    }

    static Interval fromDegrees(double[] range) {
      return range == null ? null : new Interval(Math.toRadians(range[0]), Math.toRadians(range[1]));
    }

    public List<Double> toDegrees() {
      return List.of(Math.toDegrees(min), Math.toDegrees(max));
    }
  }

  /**
   * Returns bounds from {@code [min, max]} ranges in degrees, where a {@code null} range leaves that axis
   * unconstrained, or {@code null} if both are {@code null}.
   */
  public static SkyBounds fromDegrees(double[] raRange, double[] decRange) {
    if (raRange == null && decRange == null) {
      return null;
    }
    return new SkyBounds(Interval.fromDegrees(raRange), Interval.fromDegrees(decRange));
  }

  public Optional<Interval> raRange() {
    return Optional.ofNullable(ra);
  }

  public Optional<Interval> decRange() {
    return Optional.ofNullable(dec);
  }

  public TileFilter filter() {
    TileFilter result = TileFilters.all();
    if (dec != null) {
      result = result.and(TileFilters.declination(dec.min, dec.max));
    }
    if (ra != null) {
      result = result.and(TileFilters.rightAscension(ra.min, ra.max));
    }
    return result;
  }
}
