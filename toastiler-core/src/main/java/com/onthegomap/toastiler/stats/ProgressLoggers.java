package com.onthegomap.toastiler.stats;

import static com.onthegomap.toastiler.util.ToastilerException.rethrow;
import static com.onthegomap.toastiler.util.Format.padLeft;

import com.onthegomap.toastiler.util.Format;
import com.onthegomap.toastiler.worker.WorkQueue;
import com.onthegomap.toastiler.worker.WorkerPipeline;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the progress of a pyramid build (tiles complete, rate, queue sizes, CPU and memory usage).
 */
@SuppressWarnings("UnusedReturnValue")
public class ProgressLoggers {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressLoggers.class);
  private final List<Object> loggers = new ArrayList<>();
  private final Format format;

  private ProgressLoggers(Locale locale) {
    this.format = Format.forLocale(locale);
  }

  public static ProgressLoggers create() {
    return createForLocale(Format.DEFAULT_LOCALE);
  }

  public static ProgressLoggers createForLocale(Locale locale) {
    return new ProgressLoggers(locale);
  }

  /** Adds "name: [ numCompleted rate/s ]" to the logger. */
  public ProgressLoggers addRateCounter(String name, LongSupplier getValue) {
    AtomicLong last = new AtomicLong(getValue.getAsLong());
    AtomicLong lastTime = new AtomicLong(System.nanoTime());
    loggers.add(new ProgressLogger(name, () -> {
      long now = System.nanoTime();
      long valueNow = getValue.getAsLong();
      double timeDiff = (now - lastTime.get()) * 1d / (1d * TimeUnit.SECONDS.toNanos(1));
      double valueDiff = Math.max(0, valueNow - last.get());
      last.set(valueNow);
      lastTime.set(now);
      return "[ " + format.numeric(valueNow, true) + " " + format.numeric(valueDiff / timeDiff, true) + "/s ]";
    }));
    return this;
  }

  /**
   * Adds "name: [ numCompleted pctComplete% rate/s ]" to the logger where {@code total} is the total number of items to
   * process.
   */
  public ProgressLoggers addRatePercentCounter(String name, long total, LongSupplier getValue) {
    // if there's no total, we can't show progress so fall back to rate logger instead
    if (total == 0) {
      return addRateCounter(name, getValue);
    }
    AtomicLong last = new AtomicLong(getValue.getAsLong());
    AtomicLong lastTime = new AtomicLong(System.nanoTime());
    loggers.add(new ProgressLogger(name, () -> {
      long now = System.nanoTime();
      long valueNow = getValue.getAsLong();
      double timeDiff = (now - lastTime.get()) * 1d / (1d * TimeUnit.SECONDS.toNanos(1));
      double valueDiff = Math.max(0, valueNow - last.get());
      last.set(valueNow);
      lastTime.set(now);
      return "[ " + format.numeric(valueNow, true) + " " + padLeft(format.percent(1f * valueNow / total), 4) + " " +
        format.numeric(valueDiff / timeDiff, true) + "/s ]";
    }));
    return this;
  }

  /** Adds "name: [ value ]" to the logger, for counts that only make sense as an absolute number. */
  public ProgressLoggers addCounter(String name, LongSupplier getValue) {
    loggers.add(new ProgressLogger(name, () -> format.numeric(getValue.getAsLong(), false)));
    return this;
  }

  /** Adds the current number of items in a queue and the queue's size to the output. */
  public ProgressLoggers addQueueStats(WorkQueue<?> queue) {
    loggers.add(new PipelineLogger(() -> " -> " + padLeft("(" +
      format.numeric(queue.getPending(), false) + "/" +
      format.numeric(queue.getCapacity(), false) + ")", 9)
    ));
    return this;
  }

  /** Adds the name of each step of {@code pipeline} with the queue that feeds it. */
  public ProgressLoggers addPipelineStats(WorkerPipeline<?> pipeline) {
    if (pipeline != null) {
      addPipelineStats(pipeline.previous());
      if (pipeline.inputQueue() != null) {
        addQueueStats(pipeline.inputQueue());
      }
      loggers.add(new PipelineLogger(() -> " " + pipeline.name()));
    }
    return this;
  }

  /** Adds the CPU load and heap usage of this JVM to the output. */
  public ProgressLoggers addProcessStats() {
    AtomicLong lastCpu = new AtomicLong(cpuNanos());
    AtomicLong lastTime = new AtomicLong(System.nanoTime());
    loggers.add(new ProgressLogger("cpus", () -> {
      long cpu = cpuNanos();
      long now = System.nanoTime();
      if (cpu < 0) {
        return "-";
      }
      double rate = 1d * (cpu - lastCpu.getAndSet(cpu)) / (now - lastTime.getAndSet(now));
      return format.decimal(rate);
    }));
    loggers.add(new ProgressLogger("mem",
      () -> format.storage(ProcessInfo.getUsedMemoryBytes(), false) + "/" +
        format.storage(ProcessInfo.getMaxMemoryBytes(), false)));
    return this;
  }

  private static long cpuNanos() {
    return ProcessInfo.getProcessCpuTime().map(Duration::toNanos).orElse(-1L);
  }

  public ProgressLoggers add(String obj) {
    loggers.add(obj);
    return this;
  }

  public ProgressLoggers add(Supplier<String> obj) {
    loggers.add(new Object() {
      @Override
      public String toString() {
        return obj.get();
      }
    });
    return this;
  }

  /** Adds a linebreak to the output. */
  public ProgressLoggers newLine() {
    return add(System.lineSeparator());
  }

  public void log() {
    LOGGER.info(getLog());
  }

  public String getLog() {
    return loggers.stream()
      .map(Object::toString)
      .collect(Collectors.joining(""))
      .replaceAll(System.lineSeparator() + "\\s*", System.lineSeparator() + "    ");
  }

  /** Invoke {@link #log()} at a fixed duration until {@code future} completes. */
  public void awaitAndLog(Future<?> future, Duration logInterval) {
    while (!await(future, logInterval)) {
      log();
    }
    log();
  }

  /** Returns true if the future is done, false if {@code duration} has elapsed. */
  private static boolean await(Future<?> future, Duration duration) {
    try {
      future.get(duration.toNanos(), TimeUnit.NANOSECONDS);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    } catch (ExecutionException e) {
      return rethrow(e.getCause());
    } catch (TimeoutException e) {
      return false;
    }
  }

  private record ProgressLogger(String name, Supplier<String> fn) {

    @Override
    public String toString() {
      return " " + name + ": " + fn.get();
    }
  }

  private record PipelineLogger(Supplier<String> fn) {

    @Override
    public String toString() {
      return fn.get();
    }
  }
}
