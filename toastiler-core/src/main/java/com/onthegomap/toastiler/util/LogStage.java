package com.onthegomap.toastiler.util;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;

/**
 * Tracks the pyramid build stage that the current thread works on in the SLF4J {@link MDC}, so log lines read
 * {@code [pyramid:sample] ...}.
 */
public final class LogStage {

  /** MDC key that the log4j2 pattern prints. */
  public static final String MDC_KEY = "stage";

  private LogStage() {}

  public static void set(String stage) {
    MDC.put(MDC_KEY, stage);
  }

  /**
   * Sets the stage of a worker thread started from {@code parent}, dropping the {@code parent_} prefix that worker
   * names carry: {@code pyramid} and {@code pyramid_sample} give {@code pyramid:sample}.
   */
  public static void setWorker(String parent, String worker) {
    if (parent == null) {
      set(worker);
    } else {
      set(parent + ":" + StringUtils.removeStart(worker, parent + "_"));
    }
  }

  /** Returns the stage of the current thread, or {@code null} outside of any stage. */
  public static String get() {
    return MDC.get(MDC_KEY);
  }

  public static void clear() {
    MDC.remove(MDC_KEY);
  }
}
