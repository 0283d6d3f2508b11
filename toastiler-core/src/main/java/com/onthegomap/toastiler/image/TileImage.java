package com.onthegomap.toastiler.image;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Arrays;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A {@code width x height} raster of samples with {@link ImageMode#channels()} values per pixel.
 * <p>
 * Samples are stored as floats. In 8-bit modes every value written is clamped to {@code [0, 255]} and truncated toward
 * zero. Images are filled by one thread then handed off and only read afterwards.
 */
@NotThreadSafe
public final class TileImage {

  private final ImageMode mode;
  private final int width;
  private final int height;
  private final float[] data;

  private TileImage(ImageMode mode, int width, int height, float[] data) {
    this.mode = mode;
    this.width = width;
    this.height = height;
    this.data = data;
  }

  /** Returns a new image with every sample set to 0. */
  public static TileImage create(ImageMode mode, int width, int height) {
    checkArgument(width > 0 && height > 0, "invalid image size %sx%s", width, height);
    return new TileImage(mode, width, height, new float[width * height * mode.channels()]);
  }

  /** Returns a new square image with every sample set to 0. */
  public static TileImage create(ImageMode mode, int size) {
    return create(mode, size, size);
  }

  /** Returns a new image with every sample set to {@code value}. */
  public static TileImage filled(ImageMode mode, int width, int height, double value) {
    TileImage result = create(mode, width, height);
    Arrays.fill(result.data, result.store(value));
    return result;
  }

  /** Returns an all-zero image with the same size and mode as {@code other}. */
  public static TileImage zerosLike(TileImage other) {
    return create(other.mode, other.width, other.height);
  }

  /**
   * Returns the images laid out in a 2x2 grid: {@code ul} and {@code ur} on top, {@code bl} and {@code br} below.
   *
   * @throws IllegalArgumentException if the images do not all have the same size and mode
   */
  public static TileImage mosaic(TileImage ul, TileImage ur, TileImage bl, TileImage br) {
    checkArgument(ul.sameShape(ur) && ul.sameShape(bl) && ul.sameShape(br),
      "mosaic images must all have the same size and mode");
    int w = ul.width;
    int h = ul.height;
    TileImage result = create(ul.mode, w * 2, h * 2);
    int rowLength = w * ul.mode.channels();
    TileImage[] quadrants = {ul, ur, bl, br};
    for (int q = 0; q < 4; q++) {
      TileImage src = quadrants[q];
      int xOffset = (q % 2) * w;
      int yOffset = (q / 2) * h;
      for (int y = 0; y < h; y++) {
        System.arraycopy(src.data, y * rowLength, result.data, result.index(xOffset, yOffset + y, 0), rowLength);
      }
    }
    return result;
  }

  private float store(double value) {
    if (mode.isEightBit()) {
      if (Double.isNaN(value)) {
        return 0;
      }
      return (float) (int) Math.max(0, Math.min(255, value));
    }
    return (float) value;
  }

  private int index(int x, int y, int channel) {
    return (y * width + x) * mode.channels() + channel;
  }

  /** Returns the sample in column {@code x}, row {@code y} (row 0 at the top). */
  public double get(int x, int y, int channel) {
    return data[index(x, y, channel)];
  }

  /** Returns the first channel of the pixel in column {@code x}, row {@code y}. */
  public double get(int x, int y) {
    return get(x, y, 0);
  }

  public TileImage set(int x, int y, int channel, double value) {
    data[index(x, y, channel)] = store(value);
    return this;
  }

  public TileImage set(int x, int y, double value) {
    return set(x, y, 0, value);
  }

  public ImageMode mode() {
    return mode;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int channels() {
    return mode.channels();
  }

  /** Returns true if {@code other} has the same dimensions and mode. */
  public boolean sameShape(TileImage other) {
    return other != null && width == other.width && height == other.height && mode == other.mode;
  }

  public TileImage copy() {
    return new TileImage(mode, width, height, data.clone());
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof TileImage other && sameShape(other) && Arrays.equals(data, other.data));
  }

  @Override
  public int hashCode() {
    return 31 * (31 * mode.hashCode() + width * 7919 + height) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "TileImage[" + mode + " " + width + "x" + height + "]";
  }
}
