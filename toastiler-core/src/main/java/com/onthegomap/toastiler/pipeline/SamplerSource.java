package com.onthegomap.toastiler.pipeline;

import com.onthegomap.toastiler.files.TileDirectory;

/**
 * Where the deepest tiles of a pyramid come from.
 */
public sealed interface SamplerSource {

  /** Sample each tile from a dataset. */
  record Callback(TileSampler sampler) implements SamplerSource {}

  /** Read already-generated tiles from a directory and only build the merged levels above them. */
  record ExistingDirectory(TileDirectory directory) implements SamplerSource {}

  static SamplerSource of(TileSampler sampler) {
    return new Callback(sampler);
  }

  static SamplerSource of(TileDirectory directory) {
    return new ExistingDirectory(directory);
  }
}
