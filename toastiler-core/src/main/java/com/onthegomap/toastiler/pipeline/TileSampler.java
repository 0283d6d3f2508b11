package com.onthegomap.toastiler.pipeline;

import com.onthegomap.toastiler.geo.SampleGrid;
import com.onthegomap.toastiler.image.TileImage;

/**
 * Produces the image of one tile from the input dataset.
 * <p>
 * Implementations must be safe to call from several threads at once when the pyramid is built with more than one
 * thread.
 */
@FunctionalInterface
public interface TileSampler {

  /**
   * @param grid longitude and latitude of every pixel of the tile
   * @return an image with the grid's resolution, or {@code null} if the dataset has no data for this tile
   */
  TileImage sample(SampleGrid grid);
}
