package com.onthegomap.toastiler;

import com.onthegomap.toastiler.geo.TilePos;
import java.util.List;

/**
 * What a pyramid build did.
 *
 * @param tilesEmitted    tiles produced by the pipeline, with or without data
 * @param tilesWritten    tiles written to the output directory
 * @param tilesSkipped    tiles without data, so not written
 * @param failedWrites    tiles that could not be written
 * @param failedPositions positions of the tiles that could not be written
 * @param cancelled       true if the build was stopped by {@link Toastiler#cancel()} before finishing
 */
public record PyramidResult(
  long tilesEmitted,
  long tilesWritten,
  long tilesSkipped,
  long failedWrites,
  List<TilePos> failedPositions,
  boolean cancelled
) {

  public PyramidResult {
    failedPositions = List.copyOf(failedPositions);
  }
}
