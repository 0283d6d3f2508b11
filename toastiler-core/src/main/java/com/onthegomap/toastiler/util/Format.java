package com.onthegomap.toastiler.util;

import java.text.NumberFormat;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.apache.commons.lang3.StringUtils;

/**
 * Locale-aware formatting for progress logs: tile counts, bytes, percentages and stage durations.
 */
public class Format {

  public static final Locale DEFAULT_LOCALE = Locale.getDefault(Locale.Category.FORMAT);

  private static final ConcurrentMap<Locale, Format> BY_LOCALE = new ConcurrentHashMap<>();
  private static final String[] COUNT_SUFFIXES = {"", "k", "M", "B", "T", "Q"};
  private static final String[] BYTE_SUFFIXES = {"", "k", "M", "G", "T", "P"};
  private static final int PADDED_WIDTH = 4;

  // NumberFormat is not thread safe
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> percentFormat;
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> decimalFormat;

  private Format(Locale locale) {
    percentFormat = ThreadLocal.withInitial(() -> {
      var format = NumberFormat.getPercentInstance(locale);
      format.setMaximumFractionDigits(0);
      return format;
    });
    decimalFormat = ThreadLocal.withInitial(() -> {
      var format = NumberFormat.getNumberInstance(locale);
      format.setMaximumFractionDigits(1);
      return format;
    });
  }

  public static Format forLocale(Locale locale) {
    return BY_LOCALE.computeIfAbsent(locale, Format::new);
  }

  public static Format defaultInstance() {
    return forLocale(DEFAULT_LOCALE);
  }

  public static String padRight(String str, int size) {
    return StringUtils.rightPad(str, size);
  }

  public static String padLeft(String str, int size) {
    return StringUtils.leftPad(str, size);
  }

  /** Returns a byte count like "123", "1.2k" or "240M". */
  public String storage(Number bytes, boolean pad) {
    return abbreviate(bytes, pad, BYTE_SUFFIXES);
  }

  /** Returns a count like "123", "1.2k" or "2.5B". */
  public String numeric(Number count, boolean pad) {
    return abbreviate(count, pad, COUNT_SUFFIXES);
  }

  private String abbreviate(Number num, boolean pad, String[] suffixes) {
    long value = num.longValue();
    String result;
    if (value < 0) {
      result = "-";
    } else if (value == 0 && num.doubleValue() > 0) {
      result = "<1";
    } else {
      int magnitude = 0;
      long scale = 1;
      while (magnitude < suffixes.length - 1 && value / scale >= 1000) {
        scale *= 1000;
        magnitude++;
      }
      if (magnitude == 0) {
        result = Long.toString(value);
      } else {
        // one decimal place below 10 of a unit, truncated rather than rounded
        long tenths = value / (scale / 10);
        String digits = tenths < 100 && tenths % 10 != 0 ? decimal(tenths / 10d) : Long.toString(tenths / 10);
        result = digits + suffixes[magnitude];
      }
    }
    return pad ? padLeft(result, PADDED_WIDTH) : result;
  }

  /** Returns 0.0-1.0 as "0%" to "100%" with no decimal places. */
  public String percent(double value) {
    return percentFormat.get().format(value);
  }

  /** Returns a number with at most 1 decimal place. */
  public String decimal(double value) {
    return decimalFormat.get().format(value);
  }

  /** Returns a duration like "0.3s", "2m3s" or "1h2m", rounded to the second above one second. */
  public String duration(Duration duration) {
    double seconds = duration.toNanos() / 1e9;
    if (seconds < 1) {
      return decimal(seconds) + "s";
    }
    return Duration.ofSeconds(Math.round(seconds)).toString().substring(2).toLowerCase(Locale.ROOT);
  }
}
