package com.onthegomap.toastiler.files;

import com.onthegomap.toastiler.geo.TilePos;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Encodes tile positions to relative paths in a pyramid directory and decodes them back.
 * <p>
 * The scheme is a {@code /}-separated template with the placeholders {n}, {x}, {y} and {ext}; {x} and {y} may appear
 * more than once. The default {@value #DEFAULT_SCHEME} gives paths like {@code 3/5/5_2.png} for tile {@code 3/2/5}.
 */
public class TileSchemeEncoding {

  public static final String N_TEMPLATE = "{n}";
  public static final String X_TEMPLATE = "{x}";
  public static final String Y_TEMPLATE = "{y}";
  public static final String EXT_TEMPLATE = "{ext}";
  public static final String DEFAULT_SCHEME = "{n}/{y}/{y}_{x}.{ext}";

  private static final TileSchemeEncoding DEFAULT = new TileSchemeEncoding(DEFAULT_SCHEME);

  private final String tileScheme;

  public TileSchemeEncoding(String tileScheme) {
    this.tileScheme = validate(tileScheme);
  }

  /** Returns the {@value #DEFAULT_SCHEME} encoding. */
  public static TileSchemeEncoding defaultScheme() {
    return DEFAULT;
  }

  public String tileScheme() {
    return tileScheme;
  }

  /** Returns the relative path of {@code pos} with {@code extension} (no leading dot). */
  public String encode(TilePos pos, String extension) {
    return tileScheme
      .replace(N_TEMPLATE, Integer.toString(pos.n()))
      .replace(X_TEMPLATE, Integer.toString(pos.x()))
      .replace(Y_TEMPLATE, Integer.toString(pos.y()))
      .replace(EXT_TEMPLATE, extension);
  }

  public Function<TilePos, String> encoder(String extension) {
    return pos -> encode(pos, extension);
  }

  /**
   * Returns a function that parses relative paths with {@code /} separators and {@code extension} back to tile
   * positions, or empty when a path does not follow this scheme.
   */
  public Function<String, Optional<TilePos>> decoder(String extension) {
    String quoted = Pattern.quote(tileScheme.replace(EXT_TEMPLATE, extension));
    quoted = replaceFirstThenBackReference(quoted, N_TEMPLATE, "n");
    quoted = replaceFirstThenBackReference(quoted, X_TEMPLATE, "x");
    quoted = replaceFirstThenBackReference(quoted, Y_TEMPLATE, "y");
    final Pattern pathPattern = Pattern.compile(quoted);
    return path -> {
      Matcher m = pathPattern.matcher(path);
      if (!m.matches()) {
        return Optional.empty();
      }
      try {
        return Optional.of(new TilePos(
          Integer.parseInt(m.group("n")),
          Integer.parseInt(m.group("x")),
          Integer.parseInt(m.group("y"))
        ));
      } catch (IllegalArgumentException e) {
        // out of range coordinates or depth
        return Optional.empty();
      }
    };
  }

  private static String replaceFirstThenBackReference(String quoted, String template, String group) {
    int first = quoted.indexOf(template);
    String head = quoted.substring(0, first) + "\\E(?<" + group + ">\\d+)\\Q";
    String tail = quoted.substring(first + template.length()).replace(template, "\\E\\k<" + group + ">\\Q");
    return head + tail;
  }

  /** Returns the number of directory levels below the base directory that tiles are stored at. */
  public int searchDepth() {
    return tileScheme.split("/").length;
  }

  /**
   * Returns the scheme with WorldWide Telescope URL placeholders: {1} for depth, {2} for x, and {3} for y, without
   * the extension.
   */
  public String wwtUrlTemplate() {
    return StringUtils.removeEnd(tileScheme, "." + EXT_TEMPLATE)
      .replace(N_TEMPLATE, "{1}")
      .replace(X_TEMPLATE, "{2}")
      .replace(Y_TEMPLATE, "{3}");
  }

  private static String validate(String tileScheme) {
    if (tileScheme.startsWith("/")) {
      throw new IllegalArgumentException("tile scheme is not allowed to be absolute");
    }
    if (StringUtils.countMatches(tileScheme, N_TEMPLATE) != 1 ||
      StringUtils.countMatches(tileScheme, X_TEMPLATE) < 1 ||
      StringUtils.countMatches(tileScheme, Y_TEMPLATE) < 1 ||
      StringUtils.countMatches(tileScheme, EXT_TEMPLATE) != 1) {
      throw new IllegalArgumentException(
        "tile scheme must contain '%s' and '%s' once and '%s' and '%s' at least once"
          .formatted(N_TEMPLATE, EXT_TEMPLATE, X_TEMPLATE, Y_TEMPLATE));
    }
    if (tileScheme.contains("\\E") || tileScheme.contains("\\Q")) {
      throw new IllegalArgumentException("regex quotes are not allowed");
    }
    return tileScheme;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof TileSchemeEncoding that && Objects.equals(tileScheme, that.tileScheme));
  }

  @Override
  public int hashCode() {
    return Objects.hash(tileScheme);
  }

  @Override
  public String toString() {
    return "TileSchemeEncoding[tileScheme='" + tileScheme + "']";
  }
}
