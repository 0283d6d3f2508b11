package com.onthegomap.toastiler.worker;

import static com.onthegomap.toastiler.util.ToastilerException.rethrow;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.onthegomap.toastiler.stats.ProgressLoggers;
import com.onthegomap.toastiler.stats.Stats;
import com.onthegomap.toastiler.util.LogStage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a task in a fixed number of daemon threads and exposes a future that completes when they all finish.
 * <p>
 * Each thread logs under the stage of the thread that created the worker, and its run time is added to that stage's
 * timer so the build summary can show time spent per step.
 */
public class Worker {

  private static final Logger LOGGER = LoggerFactory.getLogger(Worker.class);
  private final CompletableFuture<Void> done;
  private final AtomicBoolean firstThreadDied = new AtomicBoolean(false);

  /**
   * Constructs a new worker and immediately starts {@code threads} threads all running {@code task}.
   *
   * @param prefix  name of the step for logs, thread names and stats, like {@code pyramid_sample}
   * @param stats   stats collector for this thread pool
   * @param threads number of parallel threads to run {@code task} in
   * @param task    the work to do in each thread
   */
  @SuppressWarnings("java:S1181")
  public Worker(String prefix, Stats stats, int threads, RunnableThatThrows task) {
    stats.gauge(prefix + "_threads", threads);
    var es = Executors.newFixedThreadPool(threads, new ThreadFactoryBuilder()
      .setNameFormat(prefix + "-%d")
      .setDaemon(true)
      .build());
    String parentStage = LogStage.get();
    List<CompletableFuture<?>> results = new ArrayList<>();
    for (int i = 0; i < threads; i++) {
      results.add(CompletableFuture.runAsync(() -> {
        LogStage.setWorker(parentStage, prefix);
        LOGGER.trace("Starting worker");
        try {
          long start = System.nanoTime();
          task.run();
          stats.timers().finishedWorker(parentStage, prefix, Duration.ofNanos(System.nanoTime() - start));
        } catch (Throwable e) {
          // once one thread fails the others usually fail too, only the first one has a useful stack trace
          if (firstThreadDied.compareAndSet(false, true)) {
            LOGGER.error("Worker {} died", Thread.currentThread().getName(), e);
          }
          rethrow(e);
        } finally {
          LOGGER.trace("Finished worker");
          LogStage.clear();
        }
      }, es));
    }
    es.shutdown();
    done = joinFutures(results);
  }

  /**
   * Returns a future that completes successfully when all {@code futures} complete, or fails immediately when the first
   * one fails.
   */
  public static CompletableFuture<Void> joinFutures(CompletableFuture<?>... futures) {
    return joinFutures(List.of(futures));
  }

  /** Same as {@link #joinFutures(CompletableFuture[])} for a collection of futures. */
  public static CompletableFuture<Void> joinFutures(Collection<CompletableFuture<?>> futures) {
    CompletableFuture<Void> result = CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
    for (CompletableFuture<?> f : futures) {
      f.whenComplete((res, ex) -> {
        if (ex != null) {
          result.completeExceptionally(ex);
          futures.forEach(other -> other.cancel(true));
        }
      });
    }
    return result;
  }

  public CompletableFuture<Void> done() {
    return done;
  }

  /** Blocks until all threads finish, logging progress every {@code logInterval}. */
  public void awaitAndLog(ProgressLoggers loggers, Duration logInterval) {
    loggers.awaitAndLog(done(), logInterval);
  }

  /**
   * Blocks until all threads finish.
   *
   * @throws RuntimeException if interrupted or if one of the threads throws.
   */
  public void await() {
    try {
      done().get();
    } catch (InterruptedException e) {
      rethrow(e);
    } catch (ExecutionException e) {
      rethrow(e.getCause());
    }
  }
}
