package com.onthegomap.toastiler.image;

import ar.com.hjg.pngj.IImageLine;
import ar.com.hjg.pngj.ImageInfo;
import ar.com.hjg.pngj.ImageLineInt;
import ar.com.hjg.pngj.PngReader;
import ar.com.hjg.pngj.PngWriter;
import ar.com.hjg.pngj.PngjException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodings for tile images on disk.
 */
public enum TileImageFormat {
  /** 8-bit grayscale, RGB, or RGBA PNG. */
  PNG("png") {
    @Override
    public byte[] encode(TileImage image) {
      if (!image.mode().isEightBit()) {
        throw new IllegalArgumentException("PNG tiles must be 8-bit, got " + image.mode());
      }
      ImageMode mode = image.mode();
      ImageInfo info = new ImageInfo(image.width(), image.height(), 8, mode == ImageMode.RGBA, mode == ImageMode.U8,
        false);
      ByteArrayOutputStream baos = new ByteArrayOutputStream();
      PngWriter writer = new PngWriter(baos, info);
      ImageLineInt line = new ImageLineInt(info);
      int[] scanline = line.getScanline();
      int channels = image.channels();
      for (int y = 0; y < image.height(); y++) {
        for (int x = 0; x < image.width(); x++) {
          for (int c = 0; c < channels; c++) {
            scanline[x * channels + c] = (int) image.get(x, y, c);
          }
        }
        writer.writeRow(line);
      }
      writer.end();
      return baos.toByteArray();
    }

    @Override
    public TileImage decode(byte[] bytes) throws IOException {
      PngReader reader;
      try {
        reader = new PngReader(new ByteArrayInputStream(bytes));
      } catch (PngjException e) {
        throw new IOException("Invalid PNG tile", e);
      }
      try {
        ImageInfo info = reader.imgInfo;
        if (info.indexed || info.bitDepth < 8) {
          throw new IOException("Unsupported PNG tile: " + info);
        }
        int shift = info.bitDepth - 8;
        TileImage image = TileImage.create(ImageMode.eightBit(info.channels), info.cols, info.rows);
        for (int y = 0; y < info.rows && reader.hasMoreRows(); y++) {
          IImageLine row = reader.readRow();
          int[] scanline = ((ImageLineInt) row).getScanline();
          for (int x = 0; x < info.cols; x++) {
            for (int c = 0; c < info.channels; c++) {
              image.set(x, y, c, scanline[x * info.channels + c] >> shift);
            }
          }
        }
        return image;
      } catch (PngjException e) {
        throw new IOException("Invalid PNG tile", e);
      } finally {
        reader.end();
      }
    }
  },

  /** Numpy {@code .npy} arrays: float32 for {@link ImageMode#F32}, uint8 otherwise. */
  NPY("npy") {
    @Override
    public byte[] encode(TileImage image) {
      boolean eightBit = image.mode().isEightBit();
      String shape = image.channels() == 1 ?
        "(" + image.height() + ", " + image.width() + ")" :
        "(" + image.height() + ", " + image.width() + ", " + image.channels() + ")";
      String header = "{'descr': '" + (eightBit ? "|u1" : "<f4") + "', 'fortran_order': False, 'shape': " + shape +
        ", }";
      // magic + version + header length + header + newline must be a multiple of 64 bytes
      int unpadded = NPY_MAGIC.length + 2 + 2 + header.length() + 1;
      header = header + " ".repeat((64 - unpadded % 64) % 64) + "\n";
      int samples = image.width() * image.height() * image.channels();
      ByteBuffer buffer = ByteBuffer.allocate(NPY_MAGIC.length + 4 + header.length() + samples * (eightBit ? 1 : 4))
        .order(ByteOrder.LITTLE_ENDIAN);
      buffer.put(NPY_MAGIC).put((byte) 1).put((byte) 0).putShort((short) header.length())
        .put(header.getBytes(StandardCharsets.US_ASCII));
      for (int y = 0; y < image.height(); y++) {
        for (int x = 0; x < image.width(); x++) {
          for (int c = 0; c < image.channels(); c++) {
            double value = image.get(x, y, c);
            if (eightBit) {
              buffer.put((byte) (int) value);
            } else {
              buffer.putFloat((float) value);
            }
          }
        }
      }
      return buffer.array();
    }

    @Override
    public TileImage decode(byte[] bytes) throws IOException {
      if (bytes.length < 10 || !Arrays.equals(Arrays.copyOf(bytes, NPY_MAGIC.length), NPY_MAGIC)) {
        throw new IOException("Not a numpy array");
      }
      ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
      int major = bytes[6];
      buffer.position(8);
      int headerLength = major == 1 ? Short.toUnsignedInt(buffer.getShort()) : buffer.getInt();
      if (buffer.remaining() < headerLength) {
        throw new IOException("Truncated numpy header");
      }
      byte[] headerBytes = new byte[headerLength];
      buffer.get(headerBytes);
      String header = new String(headerBytes, StandardCharsets.ISO_8859_1);
      String descr = findInHeader(NPY_DESCR, header);
      if ("True".equals(findInHeader(NPY_FORTRAN, header))) {
        throw new IOException("Fortran-ordered numpy tiles are not supported");
      }
      int[] shape = Arrays.stream(findInHeader(NPY_SHAPE, header).split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .mapToInt(Integer::parseInt)
        .toArray();
      if (shape.length < 2 || shape.length > 3) {
        throw new IOException("Expected a 2 or 3 dimensional array, got " + header);
      }
      int height = shape[0];
      int width = shape[1];
      int channels = shape.length == 3 ? shape[2] : 1;
      ImageMode mode;
      switch (descr) {
        case "|u1" -> mode = ImageMode.eightBit(channels);
        case "<f4", "<f8" -> {
          if (channels != 1) {
            throw new IOException("Only single-channel float tiles are supported, got " + channels);
          }
          mode = ImageMode.F32;
        }
        default -> throw new IOException("Unsupported numpy dtype " + descr);
      }
      int sampleSize = "<f8".equals(descr) ? 8 : "<f4".equals(descr) ? 4 : 1;
      if (buffer.remaining() < width * height * channels * sampleSize) {
        throw new IOException("Truncated numpy data");
      }
      TileImage image = TileImage.create(mode, width, height);
      for (int y = 0; y < height; y++) {
        for (int x = 0; x < width; x++) {
          for (int c = 0; c < channels; c++) {
            double value = switch (sampleSize) {
              case 8 -> buffer.getDouble();
              case 4 -> buffer.getFloat();
              default -> Byte.toUnsignedInt(buffer.get());
            };
            image.set(x, y, c, value);
          }
        }
      }
      return image;
    }
  };

  private static final byte[] NPY_MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
  private static final Pattern NPY_DESCR = Pattern.compile("'descr'\\s*:\\s*'([^']+)'");
  private static final Pattern NPY_FORTRAN = Pattern.compile("'fortran_order'\\s*:\\s*(True|False)");
  private static final Pattern NPY_SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(([^)]*)\\)");

  private final String extension;

  TileImageFormat(String extension) {
    this.extension = extension;
  }

  /** Returns the file extension without a leading dot. */
  public String extension() {
    return extension;
  }

  /**
   * Returns the bytes of a file holding {@code image}.
   *
   * @throws IllegalArgumentException if this format cannot hold the image's mode
   */
  public abstract byte[] encode(TileImage image);

  /**
   * Parses an image from the bytes of a file.
   *
   * @throws IOException if the bytes are not a valid image in this format
   */
  public abstract TileImage decode(byte[] bytes) throws IOException;

  private static String findInHeader(Pattern pattern, String header) throws IOException {
    Matcher matcher = pattern.matcher(header);
    if (!matcher.find()) {
      throw new IOException("Invalid numpy header: " + header);
    }
    return matcher.group(1);
  }

  /** Returns the format with extension or name {@code id}, ignoring case. */
  public static TileImageFormat from(String id) {
    String normalized = id.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", "");
    for (TileImageFormat format : values()) {
      if (format.extension.equals(normalized)) {
        return format;
      }
    }
    throw new IllegalArgumentException("Unknown tile format '" + id + "', expected png or npy");
  }

  /** Returns the format matching the extension of {@code path}. */
  public static TileImageFormat forPath(Path path) {
    String name = path.getFileName().toString();
    return from(name.substring(name.lastIndexOf('.') + 1));
  }
}
