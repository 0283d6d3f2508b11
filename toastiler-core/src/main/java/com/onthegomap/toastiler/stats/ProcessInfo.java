package com.onthegomap.toastiler.stats;

import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Optional;

/**
 * A collection of utilities to read CPU, GC and memory usage of this JVM.
 */
public class ProcessInfo {

  private ProcessInfo() {}

  /** Returns the total CPU time this process has used, if the platform exposes it. */
  public static Optional<Duration> getProcessCpuTime() {
    var bean = ManagementFactory.getOperatingSystemMXBean();
    if (bean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
      long nanos = sunBean.getProcessCpuTime();
      return nanos < 0 ? Optional.empty() : Optional.of(Duration.ofNanos(nanos));
    }
    return Optional.empty();
  }

  /** Returns the total time spent in garbage collection since the JVM started. */
  public static Duration getGcTime() {
    long total = 0;
    for (GarbageCollectorMXBean garbageCollectorMXBean : ManagementFactory.getGarbageCollectorMXBeans()) {
      total += Math.max(0, garbageCollectorMXBean.getCollectionTime());
    }
    return Duration.ofMillis(total);
  }

  /** Returns the amount of heap memory currently in use. */
  public static long getUsedMemoryBytes() {
    var runtime = Runtime.getRuntime();
    return runtime.totalMemory() - runtime.freeMemory();
  }

  /** Returns the maximum amount of heap memory the JVM may use. */
  public static long getMaxMemoryBytes() {
    return Runtime.getRuntime().maxMemory();
  }
}
