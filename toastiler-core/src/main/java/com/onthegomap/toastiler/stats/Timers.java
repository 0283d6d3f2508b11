package com.onthegomap.toastiler.stats;

import com.onthegomap.toastiler.util.Format;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A registry of pyramid build stages that are being timed.
 */
@ThreadSafe
public class Timers {

  private static final Logger LOGGER = LoggerFactory.getLogger(Timers.class);
  private static final Format FORMAT = Format.defaultInstance();
  private final Map<String, Stage> timers = Collections.synchronizedMap(new LinkedHashMap<>());

  public void printSummary() {
    int maxLength = (int) all().keySet().stream().mapToLong(String::length).max().orElse(0);
    for (var entry : all().entrySet()) {
      Stage stage = entry.getValue();
      LOGGER.info("\t{} {}", Format.padRight(entry.getKey(), maxLength), stage.timer.elapsed());
      for (var worker : stage.workers) {
        LOGGER.info("\t  {} {}", worker.prefix, FORMAT.duration(worker.elapsed));
      }
    }
  }

  public Finishable startTimer(String name) {
    return startTimer(name, true);
  }

  public Finishable startTimer(String name, boolean log) {
    Timer timer = Timer.start();
    Stage stage = new Stage(timer);
    timers.put(name, stage);
    if (log) {
      LOGGER.info("");
      LOGGER.info("Starting...");
    }
    return () -> {
      timer.stop();
      if (log) {
        LOGGER.info("Finished in {}", timer);
      }
    };
  }

  /** Records how long one worker thread of {@code stage} spent on its task. */
  public void finishedWorker(String stage, String prefix, Duration elapsed) {
    Stage current = timers.get(stage);
    if (current != null) {
      current.workers.add(new WorkerInfo(prefix, elapsed));
    }
  }

  /** Returns a snapshot of all timers currently running. Will not reflect timers that start after it's called. */
  public Map<String, Stage> all() {
    synchronized (timers) {
      return new LinkedHashMap<>(timers);
    }
  }

  /** A handle that callers can use to indicate a task has finished. */
  public interface Finishable {

    void stop();
  }

  record WorkerInfo(String prefix, Duration elapsed) {}

  public record Stage(Timer timer, List<WorkerInfo> workers) {

    Stage(Timer timer) {
      this(timer, new CopyOnWriteArrayList<>());
    }
  }
}
