package com.onthegomap.toastiler.image;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class TileImageFormatTest {

  private static TileImage gradient(ImageMode mode, int size) {
    TileImage image = TileImage.create(mode, size);
    for (int y = 0; y < size; y++) {
      for (int x = 0; x < size; x++) {
        for (int c = 0; c < mode.channels(); c++) {
          image.set(x, y, c, x * 16 + y * 4 + c);
        }
      }
    }
    return image;
  }

  @ParameterizedTest
  @EnumSource(value = ImageMode.class, names = {"U8", "RGB", "RGBA"})
  void testPngRoundTrip(ImageMode mode) throws IOException {
    TileImage image = gradient(mode, 8);
    byte[] bytes = TileImageFormat.PNG.encode(image);
    assertEquals((byte) 0x89, bytes[0]);
    assertEquals(image, TileImageFormat.PNG.decode(bytes));
  }

  @ParameterizedTest
  @EnumSource(ImageMode.class)
  void testNpyRoundTrip(ImageMode mode) throws IOException {
    TileImage image = gradient(mode, 4);
    if (mode == ImageMode.F32) {
      image.set(0, 0, -0.25).set(1, 0, Double.NaN);
    }
    byte[] bytes = TileImageFormat.NPY.encode(image);
    // header is padded to a multiple of 64 bytes
    int headerLength = (bytes[8] & 0xff) | ((bytes[9] & 0xff) << 8);
    assertEquals(0, (10 + headerLength) % 64);
    TileImage decoded = TileImageFormat.NPY.decode(bytes);
    assertEquals(image.mode(), decoded.mode());
    assertEquals(image, decoded);
  }

  @Test
  void testPngRejectsFloat() {
    TileImage image = TileImage.create(ImageMode.F32, 2);
    assertThrows(IllegalArgumentException.class, () -> TileImageFormat.PNG.encode(image));
  }

  @Test
  void testCorruptInput() {
    byte[] garbage = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12};
    assertThrows(IOException.class, () -> TileImageFormat.PNG.decode(garbage));
    assertThrows(IOException.class, () -> TileImageFormat.NPY.decode(garbage));
  }

  @Test
  void testFrom() {
    assertEquals(TileImageFormat.PNG, TileImageFormat.from("png"));
    assertEquals(TileImageFormat.NPY, TileImageFormat.from(".NPY"));
    var e = assertThrows(IllegalArgumentException.class, () -> TileImageFormat.from("jpg"));
    assertTrue(e.getMessage().contains("jpg"));
  }
}
