package com.onthegomap.toastiler.image;

/**
 * Reduces a 2x2 mosaic of child tiles into their parent tile.
 */
@FunctionalInterface
public interface TileMerger {

  /**
   * @param mosaic the 4 child images stitched together, twice the width and height of a tile
   * @return the parent image, or {@code null} if it has no data
   */
  TileImage merge(TileImage mosaic);
}
