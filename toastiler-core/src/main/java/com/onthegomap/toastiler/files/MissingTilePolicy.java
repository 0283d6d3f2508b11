package com.onthegomap.toastiler.files;

import com.onthegomap.toastiler.image.ImageMode;
import com.onthegomap.toastiler.image.TileImage;

/**
 * What {@link TileDirectory#read} returns for a tile that is not on disk.
 */
public enum MissingTilePolicy {
  /** {@code null}, meaning "no data". */
  NONE,
  /** An all-zero 8-bit RGB tile. */
  ZEROS_RGB,
  /** An all-zero 8-bit RGBA tile, fully transparent. */
  ZEROS_RGBA,
  /** A float tile filled with NaN. */
  NAN;

  /** Returns the placeholder for a missing {@code size x size} tile. */
  public TileImage missingImage(int size) {
    return switch (this) {
      case NONE -> null;
      case ZEROS_RGB -> TileImage.create(ImageMode.RGB, size);
      case ZEROS_RGBA -> TileImage.create(ImageMode.RGBA, size);
      case NAN -> TileImage.filled(ImageMode.F32, size, size, Double.NaN);
    };
  }
}
