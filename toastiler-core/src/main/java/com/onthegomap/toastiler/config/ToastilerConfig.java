package com.onthegomap.toastiler.config;

import com.onthegomap.toastiler.geo.TilePos;
import com.onthegomap.toastiler.image.TileImageFormat;
import com.onthegomap.toastiler.traverse.TileFilter;
import com.onthegomap.toastiler.traverse.TileFilters;
import java.time.Duration;

/**
 * Holder for the parameters of a pyramid build.
 *
 * @param depth            deepest level to build
 * @param top              shallowest level to build when merging
 * @param threads          number of threads that sample tiles, 1 to run everything in the calling thread
 * @param tileSize         width and height of each tile in pixels
 * @param format           encoding of tile files
 * @param merge            build upper levels by averaging their children instead of sampling them
 * @param baseLevelOnly    only build the deepest level
 * @param restart          skip sampling tiles that already exist in the output directory
 * @param failOnWriteError abort on the first tile that cannot be written instead of counting it and moving on
 * @param logInterval      time between progress log lines
 * @param writeMetadata    write {@code metadata.json} next to the tiles
 * @param region           only build this tile and its descendants, or {@code null} for all
 * @param bounds           only build tiles overlapping this box, or {@code null} for all
 */
public record ToastilerConfig(
  Arguments arguments,
  int depth,
  int top,
  int threads,
  int tileSize,
  TileImageFormat format,
  boolean merge,
  boolean baseLevelOnly,
  boolean restart,
  boolean failOnWriteError,
  Duration logInterval,
  boolean writeMetadata,
  TilePos region,
  SkyBounds bounds
) {

  public static final int MAX_DEPTH = 20;
  private static final int DEFAULT_DEPTH = 3;

  public ToastilerConfig {
    if (depth < 0 || depth > MAX_DEPTH) {
      throw new IllegalArgumentException("depth must be between 0 and " + MAX_DEPTH + ", was " + depth);
    }
    if (top < 0 || top > depth) {
      throw new IllegalArgumentException("top must be between 0 and depth " + depth + ", was " + top);
    }
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1, was " + threads);
    }
    if (tileSize < 1 || Integer.bitCount(tileSize) != 1) {
      throw new IllegalArgumentException("tile_size must be a power of 2, was " + tileSize);
    }
    if (format == null) {
      throw new IllegalArgumentException("format is required");
    }
  }

  public static ToastilerConfig defaults() {
    return from(Arguments.of());
  }

  public static ToastilerConfig from(Arguments arguments) {
    int depth = arguments.getInteger("depth", "deepest level of the pyramid", DEFAULT_DEPTH);
    boolean baseLevelOnly = arguments.getBoolean("base_level_only", "only build the deepest level", false);
    return new ToastilerConfig(
      arguments,
      depth,
      arguments.getInteger("top", "shallowest level to build", 0),
      arguments.threads(),
      arguments.getInteger("tile_size", "tile width and height in pixels", 256),
      arguments.getObject("format", "tile file format, png or npy", TileImageFormat.PNG, TileImageFormat::from),
      // base level only implies merge mode so that only the deepest level is visited
      baseLevelOnly || arguments.getBoolean("merge", "build upper levels by averaging their 4 children", true),
      baseLevelOnly,
      arguments.getBoolean("restart", "skip sampling tiles that already exist in the output", false),
      arguments.getBoolean("fail_on_write_error", "abort on the first tile that cannot be written", false),
      arguments.getDuration("log_interval|loginterval", "time between progress logs", "10s"),
      arguments.getBoolean("metadata", "write metadata.json to the output directory", true),
      arguments.getObject("region", "only build descendants of this n/x/y tile", null, TilePos::parse),
      SkyBounds.fromDegrees(
        arguments.getRange("ra_range", "right ascension range in degrees, min,max"),
        arguments.getRange("dec_range", "declination range in degrees, min,max")
      )
    );
  }

  /** Returns the filter that applies {@link #region()} and {@link #bounds()}. */
  public TileFilter tileFilter() {
    TileFilter result = TileFilters.all();
    if (region != null) {
      result = result.and(TileFilters.subRegion(region));
    }
    if (bounds != null) {
      result = result.and(bounds.filter());
    }
    return result;
  }
}
