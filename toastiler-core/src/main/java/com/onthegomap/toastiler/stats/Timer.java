package com.onthegomap.toastiler.stats;

import com.onthegomap.toastiler.util.Format;
import java.time.Duration;
import java.util.Optional;
import javax.annotation.concurrent.ThreadSafe;
import net.jcip.annotations.GuardedBy;

/**
 * Measures the wall, CPU and GC time that a pyramid build stage takes.
 */
@ThreadSafe
public class Timer {

  private final long startNanos = System.nanoTime();
  private final Optional<Duration> startCpu = ProcessInfo.getProcessCpuTime();
  private final Duration startGc = ProcessInfo.getGcTime();
  @GuardedBy("this")
  private Elapsed stopped = null;

  private Timer() {}

  public static Timer start() {
    return new Timer();
  }

  /** Freezes the elapsed time. Calling again moves the end time forward. */
  public synchronized Timer stop() {
    stopped = measure();
    return this;
  }

  /** Returns {@code false} once {@link #stop()} has been called. */
  public synchronized boolean running() {
    return stopped == null;
  }

  /** Returns the time from start to now if still running, or from start to the last {@link #stop()}. */
  public synchronized Elapsed elapsed() {
    return stopped == null ? measure() : stopped;
  }

  private Elapsed measure() {
    Optional<Duration> cpu = startCpu.flatMap(start -> ProcessInfo.getProcessCpuTime().map(now -> now.minus(start)));
    return new Elapsed(Duration.ofNanos(System.nanoTime() - startNanos), cpu, ProcessInfo.getGcTime().minus(startGc));
  }

  @Override
  public String toString() {
    return elapsed().toString();
  }

  /** Time a stage has taken, CPU time is empty when the JVM cannot report it. */
  public record Elapsed(Duration wall, Optional<Duration> cpu, Duration gc) {

    /** Formats as {@code 1.2s cpu:3.4s avg:2.8}, with {@code gc:} only when collection took over a second. */
    @Override
    public String toString() {
      Format format = Format.defaultInstance();
      StringBuilder result = new StringBuilder(format.duration(wall))
        .append(" cpu:")
        .append(cpu.map(format::duration).orElse("-"));
      if (gc.compareTo(Duration.ofSeconds(1)) > 0) {
        result.append(" gc:").append(format.duration(gc));
      }
      cpu.ifPresent(time -> result.append(" avg:")
        .append(format.decimal(time.toNanos() * 1d / Math.max(1, wall.toNanos()))));
      return result.toString();
    }
  }
}
