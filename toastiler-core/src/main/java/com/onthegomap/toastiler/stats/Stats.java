package com.onthegomap.toastiler.stats;

import com.onthegomap.toastiler.util.Format;
import com.onthegomap.toastiler.util.LogStage;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects statistics about a pyramid build to report at the end of the job.
 */
public interface Stats extends AutoCloseable {

  /** Returns a new stat collector that stores stats in-memory to report through {@link #printSummary()}. */
  static Stats inMemory() {
    return new InMemory();
  }

  /** Logs the time each stage took and how many tiles were written at each depth. */
  default void printSummary() {
    Format format = Format.defaultInstance();
    Logger logger = LoggerFactory.getLogger(getClass());
    logger.info("");
    logger.info("-".repeat(40));
    timers().printSummary();
    logger.info("-".repeat(40));
    for (var entry : tilesWrittenByDepth().entrySet()) {
      logger.info("\tdepth {}\t{} tiles", entry.getKey(), format.numeric(entry.getValue(), false));
    }
    for (var entry : dataErrors().entrySet()) {
      logger.info("\t{}\t{}", entry.getKey(), format.numeric(entry.getValue(), false));
    }
  }

  /**
   * Records that a long-running task with {@code name} has started and returns a handle to call when finished.
   * <p>
   * Also sets the "stage" prefix that shows up in the logs to {@code name}.
   */
  default Timers.Finishable startStage(String name) {
    return startStage(name, true);
  }

  /** Same as {@link #startStage(String)} except does not log that it started, or set the logging prefix. */
  default Timers.Finishable startStageQuietly(String name) {
    return startStage(name, false);
  }

  default Timers.Finishable startStage(String name, boolean log) {
    if (log) {
      LogStage.set(name);
    }
    var timer = timers().startTimer(name, log);
    return () -> {
      timer.stop();
      if (log) {
        LogStage.clear();
      }
    };
  }

  /** Records that a tile at {@code depth} was written to the output directory with {@code bytes} encoded size. */
  void wroteTile(int depth, long bytes);

  /** Returns the number of tiles written so far keyed by depth. */
  Map<Integer, Long> tilesWrittenByDepth();

  /** Records that something went wrong in a way that did not abort the run, {@code errorCode} groups failures. */
  void dataError(String errorCode);

  /** Returns the number of times each error code has been recorded. */
  Map<String, Long> dataErrors();

  /** Returns the timers for all stages started with {@link #startStage(String)}. */
  Timers timers();

  /** Tracks a stat with {@code name} that can go up or down over time. */
  void gauge(String name, Supplier<Number> value);

  /** Tracks a stat with {@code name} that has a constant {@code value}. */
  default void gauge(String name, Number value) {
    gauge(name, () -> value);
  }

  /** Returns and starts tracking a new counter with {@code name} that many threads can increment. */
  Counter.MultiThreadCounter longCounter(String name);

  /** Returns and starts tracking a counter where the value is a number of nanoseconds. */
  default Counter.MultiThreadCounter nanoCounter(String name) {
    return longCounter(name);
  }

  @Override
  void close();

  /**
   * A stat collector that keeps top-level metrics in memory to report through {@link #printSummary()}.
   */
  class InMemory implements Stats {

    private final Timers timers = new Timers();
    private final Map<Integer, LongAdder> tilesByDepth = new ConcurrentSkipListMap<>();
    private final Map<String, LongAdder> errors = new ConcurrentHashMap<>();
    private final Map<String, Supplier<Number>> gauges = new ConcurrentHashMap<>();

    /** use {@link #inMemory()} */
    private InMemory() {}

    @Override
    public void wroteTile(int depth, long bytes) {
      tilesByDepth.computeIfAbsent(depth, d -> new LongAdder()).increment();
    }

    @Override
    public Map<Integer, Long> tilesWrittenByDepth() {
      Map<Integer, Long> result = new TreeMap<>();
      tilesByDepth.forEach((depth, count) -> result.put(depth, count.sum()));
      return result;
    }

    @Override
    public void dataError(String errorCode) {
      errors.computeIfAbsent(errorCode, c -> new LongAdder()).increment();
    }

    @Override
    public Map<String, Long> dataErrors() {
      Map<String, Long> result = new TreeMap<>();
      errors.forEach((code, count) -> result.put(code, count.sum()));
      return result;
    }

    @Override
    public Timers timers() {
      return timers;
    }

    @Override
    public void gauge(String name, Supplier<Number> value) {
      gauges.put(name, value);
    }

    @Override
    public Counter.MultiThreadCounter longCounter(String name) {
      Counter.MultiThreadCounter counter = Counter.newMultiThreadCounter();
      gauges.put(name, counter::get);
      return counter;
    }

    @Override
    public void close() {
      gauges.clear();
    }
  }
}
