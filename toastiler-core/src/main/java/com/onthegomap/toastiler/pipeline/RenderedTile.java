package com.onthegomap.toastiler.pipeline;

import com.onthegomap.toastiler.geo.TilePos;
import com.onthegomap.toastiler.image.TileImage;

/**
 * A finished tile: its position, path relative to the output directory, and image ({@code null} for no data).
 */
public record RenderedTile(TilePos pos, String path, TileImage image) {

  public boolean hasImage() {
    return image != null;
  }
}
