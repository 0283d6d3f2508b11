package com.onthegomap.toastiler.samplers;

import com.onthegomap.toastiler.geo.SampleGrid;
import com.onthegomap.toastiler.image.ImageMode;
import com.onthegomap.toastiler.image.TileImage;
import com.onthegomap.toastiler.pipeline.TileSampler;

/** Returns the same value for every pixel of every tile. */
public record ConstantSampler(ImageMode mode, double value) implements TileSampler {

  @Override
  public TileImage sample(SampleGrid grid) {
    return TileImage.filled(mode, grid.resolution(), grid.resolution(), value);
  }
}
