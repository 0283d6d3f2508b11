package com.onthegomap.toastiler.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FormatTest {

  // tile counts of full pyramids at depths 0, 4, 6, 9 and 12
  @ParameterizedTest
  @CsvSource({
    "1,1,en",
    "341,341,en",
    "5461,5.4k,en",
    "349525,349k,en",
    "22369621,22M,en",
    "1431655765,1.4B,en",
    "1431655765,'1,4B',fr",
    "0.5,<1,en",
    "-4,-,en",
  })
  void testFormatTileCounts(Double count, String expected, Locale locale) {
    assertEquals(expected, Format.forLocale(locale).numeric(count, false));
  }

  @ParameterizedTest
  @CsvSource({
    "196608,196k,en",
    "1000,1k,en",
    "5.5e9,5.5G,en",
    "5.5e9,'5,5G',fr",
    "2.5e15,2.5P,en",
  })
  void testFormatBytes(Double bytes, String expected, Locale locale) {
    assertEquals(expected, Format.forLocale(locale).storage(bytes, false));
  }

  @Test
  void testPadded() {
    Format format = Format.forLocale(Locale.ENGLISH);
    assertEquals("  21", format.numeric(21, true));
    assertEquals("5.4k", format.numeric(5461, true));
    assertEquals("pyramid  ", Format.padRight("pyramid", 9));
    assertEquals("abc", Format.padLeft("abc", 2));
  }

  @ParameterizedTest
  @CsvSource({
    "0,0%,en",
    "0.2,20%,en",
    "1,100%,en",
  })
  void testFormatPercent(Double fraction, String formatted, Locale locale) {
    assertEquals(formatted, Format.forLocale(locale).percent(fraction));
  }

  @ParameterizedTest
  @CsvSource({
    "0,0s,en",
    "0.25,0.2s,en",
    "0.25,'0,2s',it",
    "59.6,1m,en",
    "125,2m5s,en",
    "3720,1h2m,en",
  })
  void testFormatStageDuration(double seconds, String out, Locale locale) {
    assertEquals(out, Format.forLocale(locale).duration(Duration.ofMillis((long) (seconds * 1000))));
  }
}
