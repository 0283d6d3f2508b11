package com.onthegomap.toastiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.onthegomap.toastiler.config.Arguments;
import com.onthegomap.toastiler.files.TileDirectory;
import com.onthegomap.toastiler.geo.TilePos;
import com.onthegomap.toastiler.image.ImageMode;
import com.onthegomap.toastiler.image.TileImage;
import com.onthegomap.toastiler.image.TileImageFormat;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

class ToastilerMainTest {

  @TempDir
  Path tempDir;

  @Test
  @Timeout(30)
  void testBuildsFromPlateCarreeImage() throws IOException {
    Path input = tempDir.resolve("sky.png");
    Files.write(input, TileImageFormat.PNG.encode(TileImage.filled(ImageMode.U8, 8, 4, 50)));
    Path output = tempDir.resolve("toast");

    PyramidResult result = ToastilerMain.run(Arguments.fromArgs(
      "--input", input.toString(),
      "--output", output.toString(),
      "--depth", "1",
      "--tile-size", "4",
      "--wtml", tempDir.resolve("sky.wtml").toString()
    ));

    assertEquals(5, result.tilesWritten());
    var directory = new TileDirectory(output);
    assertEquals(TileImage.filled(ImageMode.U8, 4, 4, 50), directory.read(TilePos.ROOT, TileImageFormat.PNG));
    assertTrue(Files.readString(tempDir.resolve("sky.wtml")).contains("Url=\"" + output + "/"));
  }

  @Test
  void testMissingInput() {
    var arguments = Arguments.of("input", tempDir.resolve("missing.png"), "output", tempDir.resolve("toast"));
    assertThrows(IllegalArgumentException.class, () -> ToastilerMain.run(arguments));
  }
}
