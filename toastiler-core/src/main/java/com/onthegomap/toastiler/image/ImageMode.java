package com.onthegomap.toastiler.image;

/**
 * The pixel layout of a {@link TileImage}.
 */
public enum ImageMode {
  /** 8-bit grayscale. */
  U8(1, true),
  RGB(3, true),
  RGBA(4, true),
  /** Single-channel 32-bit float, for scientific data. */
  F32(1, false);

  private final int channels;
  private final boolean eightBit;

  ImageMode(int channels, boolean eightBit) {
    this.channels = channels;
    this.eightBit = eightBit;
  }

  public int channels() {
    return channels;
  }

  /** Returns true if samples are stored as integers in {@code [0, 255]}. */
  public boolean isEightBit() {
    return eightBit;
  }

  /** Returns the 8-bit mode with {@code channels} channels. */
  public static ImageMode eightBit(int channels) {
    return switch (channels) {
      case 1 -> U8;
      case 3 -> RGB;
      case 4 -> RGBA;
      default -> throw new IllegalArgumentException("Unsupported number of 8-bit channels: " + channels);
    };
  }
}
