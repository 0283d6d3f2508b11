package com.onthegomap.toastiler.files;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.onthegomap.toastiler.geo.TilePos;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class TileSchemeEncodingTest {

  @ParameterizedTest
  @CsvSource(textBlock = """
    {n}/{y}/{y}_{x}.{ext},  3/5/5_2.png
    {n}/{x}/{y}.{ext},      3/2/5.png
    {n}-{x}-{y}.{ext},      3-2-5.png
    L{n}/X{x}/Y{y}.{ext},   L3/X2/Y5.png
    """)
  void testEncoder(String tileScheme, String expected) {
    TileSchemeEncoding scheme = new TileSchemeEncoding(tileScheme);
    assertEquals(expected, scheme.encode(new TilePos(3, 2, 5), "png"));
    assertEquals(expected, scheme.encoder("png").apply(new TilePos(3, 2, 5)));
  }

  @ParameterizedTest
  @CsvSource(textBlock = """
    {n}/{y}/{y}_{x}.{ext},  3/5/5_2.png,   true
    {n}/{x}/{y}.{ext},      3/2/5.png,     true
    {n}-{x}-{y}.{ext},      3-2-5.png,     true

    {n}/{y}/{y}_{x}.{ext},  3/5/4_2.png,   false
    {n}/{y}/{y}_{x}.{ext},  3/5/5_2.npy,   false
    {n}/{y}/{y}_{x}.{ext},  3/5/5_2,       false
    {n}/{y}/{y}_{x}.{ext},  a/5/5_2.png,   false
    {n}/{y}/{y}_{x}.{ext},  3/9/9_2.png,   false
    {n}/{x}/{y}.{ext},      3/2/5.png.tmp, false
    """)
  void testDecoder(String tileScheme, String path, boolean valid) {
    Optional<TilePos> decoded = new TileSchemeEncoding(tileScheme).decoder("png").apply(path);
    assertEquals(valid ? Optional.of(new TilePos(3, 2, 5)) : Optional.empty(), decoded);
  }

  @Test
  void testDefaultScheme() {
    TileSchemeEncoding scheme = TileSchemeEncoding.defaultScheme();
    assertEquals("{n}/{y}/{y}_{x}.{ext}", scheme.tileScheme());
    assertEquals("0/0/0_0.png", scheme.encode(TilePos.ROOT, "png"));
    assertEquals("{1}/{3}/{3}_{2}", scheme.wwtUrlTemplate());
    assertEquals(3, scheme.searchDepth());
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "/{n}/{x}/{y}.{ext}",
    "{x}/{y}.{ext}",
    "{n}/{y}.{ext}",
    "{n}/{x}/{y}",
    "{n}/{n}/{x}/{y}.{ext}",
    "{n}/\\Q{x}/{y}.{ext}",
  })
  void testInvalidSchemes(String tileScheme) {
    assertThrows(IllegalArgumentException.class, () -> new TileSchemeEncoding(tileScheme));
  }
}
