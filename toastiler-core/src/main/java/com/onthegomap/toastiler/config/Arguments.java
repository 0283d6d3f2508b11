package com.onthegomap.toastiler.config;

import com.google.common.base.Splitter;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import com.onthegomap.toastiler.stats.Stats;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pyramid build options read from command-line arguments, JVM properties, environmental variables or a properties
 * file.
 * <p>
 * Keys match regardless of case and of {@code -}, {@code _} or {@code .} separators, so {@code --base-level-only},
 * {@code base_level_only} and {@code TOASTILER_BASE_LEVEL_ONLY} are the same option.
 * <p>
 * A key like {@code "log_interval|loginterval"} reads the first option and falls back to the later, deprecated ones.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);
  private static final Splitter ALIASES = Splitter.on('|').trimResults().omitEmptyStrings();
  private static final Splitter RANGE = Splitter.onPattern("[\\s,]+").omitEmptyStrings();

  private final UnaryOperator<String> provider;

  private Arguments(UnaryOperator<String> provider) {
    this.provider = provider;
  }

  /**
   * Returns arguments from JVM system properties prefixed with {@code toastiler.}
   * <p>
   * For example to set {@code depth=6}: {@code java -Dtoastiler.depth=6 -jar ...}
   */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty);
  }

  static Arguments fromJvmProperties(UnaryOperator<String> getter) {
    return new Arguments(key -> getter.apply("toastiler." + key.replace('_', '.')));
  }

  /**
   * Returns arguments from environmental variables prefixed with {@code TOASTILER_}
   * <p>
   * For example to set {@code depth=6}: {@code TOASTILER_DEPTH=6 java -jar ...}
   */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter) {
    return new Arguments(key -> getter.apply("TOASTILER_" + key.toUpperCase(Locale.ROOT)));
  }

  public static Arguments from(Properties properties) {
    Map<String, String> map = new HashMap<>();
    properties.stringPropertyNames().forEach(name -> map.put(name, properties.getProperty(name)));
    return of(map);
  }

  /**
   * Returns arguments parsed from command-line arguments like {@code depth=6} or {@code --depth 6}.
   * <p>
   * A flag with no value like {@code --restart} is {@code true}.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new HashMap<>();
    int i = 0;
    while (i < args.length) {
      String arg = args[i++].strip();
      int equals = arg.indexOf('=');
      String key = (equals < 0 ? arg : arg.substring(0, equals)).replaceFirst("^-+", "");
      if (equals >= 0) {
        parsed.put(key, arg.substring(equals + 1));
      } else if (arg.startsWith("-") && i < args.length && !args[i].strip().startsWith("-")) {
        parsed.put(key, args[i++].strip());
      } else {
        parsed.put(key, "true");
      }
    }
    return of(parsed);
  }

  /** Returns arguments from a {@code .properties} file. */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
    return from(properties);
  }

  /**
   * Returns arguments from the command line, then JVM properties, then environmental variables, then the properties
   * file named by a {@code config} argument from any of those.
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments direct = fromArgs(args).orElse(fromJvmProperties()).orElse(fromEnvironment());
    Path configFile = direct.file("config", "path to config file", null);
    return configFile == null ? direct : direct.orElse(fromConfigFile(configFile));
  }

  private static String normalize(String key) {
    return key.strip().replaceAll("[.-]", "_").toLowerCase(Locale.ROOT);
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> normalized = new HashMap<>();
    map.forEach((key, value) -> normalized.put(normalize(key), value));
    return new Arguments(normalized::get);
  }

  /** Shorthand for {@link #of(Map)} from alternating keys and values. */
  public static Arguments of(Object... args) {
    Map<String, String> map = new HashMap<>();
    for (int i = 0; i < args.length; i += 2) {
      map.put(args[i].toString(), args[i + 1].toString());
    }
    return of(map);
  }

  private String get(String key) {
    List<String> options = ALIASES.splitToList(key);
    for (int i = 0; i < options.size(); i++) {
      String value = provider.apply(normalize(options.get(i)));
      if (value != null) {
        if (i > 0) {
          LOGGER.warn("Argument '{}' is deprecated, use '{}'", options.get(i), options.get(0));
        }
        return value;
      }
    }
    return null;
  }

  /** Returns arguments that read from {@code this} first, then from {@code other}. */
  public Arguments orElse(Arguments other) {
    return new Arguments(key -> {
      String value = get(key);
      return value != null ? value : other.get(key);
    });
  }

  /** Returns a copy where {@code key} defaults to {@code value}. */
  public Arguments withDefault(Object key, Object value) {
    return orElse(Arguments.of(key.toString().replaceFirst("^-+", ""), value));
  }

  /** Returns a copy that logs each option the first time it is read. */
  public Arguments withExactlyOnceLogging() {
    Multiset<String> logged = HashMultiset.create();
    return new Arguments(provider) {
      @Override
      protected void logArgValue(String key, String description, Object result) {
        if (logged.add(key, 1) == 0) {
          super.logArgValue(key, description, result);
        }
      }
    };
  }

  protected void logArgValue(String key, String description, Object result) {
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("argument: {}={} ({})", ALIASES.split(key).iterator().next(), result, description);
    }
  }

  private String getArg(String key, String defaultValue) {
    String value = get(key);
    return value == null ? defaultValue : value.trim();
  }

  private String getRequiredArg(String key, String description) {
    String value = getArg(key, null);
    if (value == null) {
      throw new IllegalArgumentException("Missing required parameter: " + key + " (" + description + ")");
    }
    return value;
  }

  public String getString(String key, String description, String defaultValue) {
    String value = getArg(key, defaultValue);
    logArgValue(key, description, value);
    return value;
  }

  /** Returns the path in {@code key}, or {@code defaultValue} if it is not set. */
  public Path file(String key, String description, Path defaultValue) {
    String value = getArg(key, null);
    Path file = value == null ? defaultValue : Path.of(value);
    logArgValue(key, description, file);
    return file;
  }

  /**
   * Returns the path in a required {@code key}, which may not exist yet.
   *
   * @throws IllegalArgumentException if {@code key} is not set
   */
  public Path file(String key, String description) {
    Path file = Path.of(getRequiredArg(key, description));
    logArgValue(key, description, file);
    return file;
  }

  /**
   * Returns the path in a required {@code key} for a file that must already exist.
   *
   * @throws IllegalArgumentException if the file does not exist or {@code key} is not set
   */
  public Path inputFile(String key, String description) {
    Path path = file(key, description);
    if (!Files.exists(path)) {
      throw new IllegalArgumentException(path + " does not exist");
    }
    return path;
  }

  /** Returns {@code true} only if {@code key} is {@code "true"} ignoring case. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    boolean value = Boolean.parseBoolean(getArg(key, Boolean.toString(defaultValue)));
    logArgValue(key, description, value);
    return value;
  }

  /**
   * Returns the number of sampling threads, 1 (sequential) unless {@code threads} is set.
   *
   * @throws NumberFormatException if {@code threads} can't be parsed as an integer
   */
  public int threads() {
    int threads = Math.max(1, Integer.parseInt(getArg("threads", "1")));
    logArgValue("threads", "num sampling threads", threads);
    return threads;
  }

  /** Returns the in-memory {@link Stats} implementation that is printed at the end of a run. */
  public Stats getStats() {
    LOGGER.debug("argument: stats=use in-memory stats");
    return Stats.inMemory();
  }

  /**
   * @throws NumberFormatException if the argument cannot be parsed as an integer
   */
  public int getInteger(String key, String description, int defaultValue) {
    int parsed = Integer.parseInt(getArg(key, Integer.toString(defaultValue)));
    logArgValue(key, description, parsed);
    return parsed;
  }

  /**
   * Returns a duration like {@code 10s}, {@code 90m} or {@code 1h30m}.
   *
   * @throws DateTimeParseException if the argument cannot be parsed as a duration
   */
  public Duration getDuration(String key, String description, String defaultValue) {
    Duration parsed = Duration.parse("PT" + getArg(key, defaultValue));
    logArgValue(key, description, parsed.toSeconds() + " seconds");
    return parsed;
  }

  /**
   * Returns a {@code min,max} pair of angles in degrees, or {@code null} if {@code key} is not set.
   *
   * @throws IllegalArgumentException if the value does not have exactly 2 numbers
   */
  public double[] getRange(String key, String description) {
    String input = getArg(key, null);
    double[] result = null;
    if (input != null && !input.isBlank()) {
      result = RANGE.splitToStream(input).mapToDouble(Double::parseDouble).toArray();
      if (result.length != 2) {
        throw new IllegalArgumentException(key + " must have 2 values min,max, got: " + input);
      }
    }
    logArgValue(key, description, input);
    return result;
  }

  /** Returns {@code key} converted by {@code converter}, or {@code defaultValue} if it is not set. */
  public <T> T getObject(String key, String description, T defaultValue, Function<String, T> converter) {
    String serialized = getArg(key, null);
    T value = serialized == null ? defaultValue : converter.apply(serialized);
    logArgValue(key, description, value);
    return value;
  }
}
