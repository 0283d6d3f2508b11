package com.onthegomap.toastiler.config;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArgumentsTest {

  @TempDir
  Path tempDir;

  private Path configFile() throws IOException {
    Path path = tempDir.resolve("test.properties");
    Files.writeString(path, """
      key1=value1fromfile
      key2=value2fromfile
      """);
    return path;
  }

  @Test
  void testEmpty() {
    assertEquals("fallback", Arguments.of().getString("key", "key", "fallback"));
  }

  @Test
  void testMapBased() {
    assertEquals("value", Arguments.of(
      "key", "value"
    ).getString("key", "key", "fallback"));
  }

  @Test
  void testOrElse() {
    Arguments args = Arguments.of("key1", "value1a", "key2", "value2a")
      .orElse(Arguments.of("key2", "value2b", "key3", "value3b"));

    assertEquals("value1a", args.getString("key1", "key", "fallback"));
    assertEquals("value2a", args.getString("key2", "key", "fallback"));
    assertEquals("value3b", args.getString("key3", "key", "fallback"));
    assertEquals("fallback", args.getString("key4", "key", "fallback"));
  }

  @Test
  void testConfigFileParsing() throws IOException {
    Arguments args = Arguments.fromConfigFile(configFile());

    assertEquals("value1fromfile", args.getString("key1", "key", "fallback"));
    assertEquals("fallback", args.getString("key3", "key", "fallback"));
  }

  @Test
  void testGetConfigFileFromArgs() throws IOException {
    Arguments args = Arguments.fromArgsOrConfigFile(
      "config=" + configFile(),
      "key2=value2fromargs"
    );

    assertEquals("value1fromfile", args.getString("key1", "key", "fallback"));
    assertEquals("value2fromargs", args.getString("key2", "key", "fallback"));
    assertEquals("fallback", args.getString("key3", "key", "fallback"));
  }

  @Test
  void testDuration() {
    Arguments args = Arguments.of(
      "duration", "1h30m"
    );

    assertEquals(Duration.ofMinutes(90), args.getDuration("duration", "key", "10m"));
    assertEquals(Duration.ofSeconds(10), args.getDuration("duration2", "key", "10s"));
  }

  @Test
  void testInteger() {
    Arguments args = Arguments.of(
      "integer", "30"
    );

    assertEquals(30, args.getInteger("integer", "key", 10));
    assertEquals(10, args.getInteger("integer2", "key", 10));
  }

  @Test
  void testThreads() {
    assertEquals(2, Arguments.of("threads", "2").threads());
    assertEquals(1, Arguments.of().threads());
    assertEquals(1, Arguments.of("threads", "0").threads());
  }

  @Test
  void testBoolean() {
    assertTrue(Arguments.of("boolean", "true").getBoolean("boolean", "list", false));
    assertFalse(Arguments.of("boolean", "false").getBoolean("boolean", "list", true));
    assertFalse(Arguments.of("boolean", "true1").getBoolean("boolean", "list", true));
    assertFalse(Arguments.of().getBoolean("boolean", "list", false));
  }

  @Test
  void testFile() throws IOException {
    Path existing = configFile();
    assertEquals(existing, Arguments.of("file", existing).inputFile("file", "file"));
    assertThrows(IllegalArgumentException.class,
      () -> Arguments.of("file", tempDir.resolve("missing")).inputFile("file", "file"));
    assertThrows(IllegalArgumentException.class, () -> Arguments.of().inputFile("file", "file"));
    assertNotNull(Arguments.of("file", tempDir.resolve("missing")).file("file", "file", null));
    assertNull(Arguments.of().file("file", "file", null));
  }

  @Test
  void testRange() {
    assertArrayEquals(new double[]{-10, 20.5}, Arguments.of("ra_range", "-10,20.5").getRange("ra_range", "range"));
    assertArrayEquals(new double[]{1, 2}, Arguments.of("ra_range", "1 2").getRange("ra_range", "range"));
    assertNull(Arguments.of().getRange("ra_range", "range"));
    assertThrows(IllegalArgumentException.class,
      () -> Arguments.of("ra_range", "1,2,3").getRange("ra_range", "range"));
  }

  @Test
  void testStats() {
    assertNotNull(Arguments.of().getStats());
  }

  @Test
  void testArgsKeyPresentImplies() {
    Arguments args = Arguments.fromArgs(
      "--restart"
    );

    assertTrue(args.getBoolean("restart", "restart", false));
  }

  @Test
  void testUnderscoreDashSame() {
    assertTrue(Arguments.fromArgs(
      "--base-level-only=true"
    ).getBoolean("base_level_only", "base", false));
    assertTrue(Arguments.fromArgs(
      "--base_level_only=true"
    ).getBoolean("base-level-only", "base", false));
  }

  @Test
  void testSpaceBetweenArgs() {
    Arguments args = Arguments.fromArgs(
      "--key value --key2 value2 --force1 --force2".split("\\s+")
    );

    assertEquals("value", args.getString("key", "key", null));
    assertEquals("value2", args.getString("key2", "key2", null));
    assertTrue(args.getBoolean("force1", "force1", false));
    assertTrue(args.getBoolean("force2", "force2", false));
  }

  @Test
  void testMissingFlagValueAtEnd() {
    Arguments args = Arguments.fromArgs("--depth", "4", "--restart");
    assertEquals(4, args.getInteger("depth", "depth", 3));
    assertTrue(args.getBoolean("restart", "restart", false));
    assertFalse(args.getBoolean("merge", "merge", false));
  }

  @Test
  void testReadFromEnvironment() {
    Map<String, String> env = Map.of(
      "OTHER", "value",
      "TOASTILERDEPTH", "7",
      "TOASTILER_DEPTH", "5",
      "TOASTILER_TILE_SIZE", "512"
    );
    Arguments args = Arguments.fromEnvironment(env::get);
    assertEquals(5, args.getInteger("depth", "depth", 3));
    assertEquals(512, args.getInteger("tile-size", "size", 256));
    assertEquals("fallback", args.getString("other", "other", "fallback"));
  }

  @Test
  void testReadFromJvmProperties() {
    Map<String, String> jvm = Map.of(
      "TOASTILER_DEPTH", "9",
      "toastiler.depth", "4",
      "toastiler.fail.on.write.error", "true"
    );
    Arguments args = Arguments.fromJvmProperties(jvm::get);
    assertEquals(4, args.getInteger("depth", "depth", 3));
    assertTrue(args.getBoolean("fail_on_write_error", "fail", false));
  }

  @Test
  void testWithDefault() {
    Arguments args = Arguments.of("depth", "5").withDefault("--depth", 3).withDefault("top", 1);
    assertEquals(5, args.getInteger("depth", "depth", 0));
    assertEquals(1, args.getInteger("top", "top", 0));
    assertEquals(5, args.withExactlyOnceLogging().getInteger("depth", "depth", 0));
  }

  @Test
  void testDeprecatedArgs() {
    assertEquals("20s",
      Arguments.of("loginterval", "30s", "log_interval", "20s")
        .getString("log_interval|loginterval", "key", "fallback"));
    assertEquals(Duration.ofSeconds(30),
      Arguments.of("loginterval", "30s")
        .getDuration("log_interval|loginterval", "key", "10s"));
  }
}
