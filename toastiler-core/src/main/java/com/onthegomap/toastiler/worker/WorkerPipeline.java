package com.onthegomap.toastiler.worker;

import static com.onthegomap.toastiler.util.ToastilerException.rethrow;
import static com.onthegomap.toastiler.worker.Worker.joinFutures;

import com.onthegomap.toastiler.stats.ProgressLoggers;
import com.onthegomap.toastiler.stats.Stats;
import java.time.Duration;
import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Chains sequential steps that each run in dedicated threads with a {@link WorkQueue} between them.
 * <p>
 * For example, the parallel pyramid build is:
 *
 * <pre>{@code
 * WorkerPipeline.start("pyramid", stats)
 *   .readFrom("traverse", tiles)
 *   .addBuffer("tile_queue", 100)
 *   .addWorker("sample", threads, (prev, next) -> ...)
 *   .addBuffer("sampled_queue", 100)
 *   .sinkTo("write", 1, prev -> ...)
 *   .await();
 * }</pre>
 *
 * @param <T> input type of this pipeline
 */
public record WorkerPipeline<T>(
  String name,
  WorkerPipeline<?> previous,
  WorkQueue<T> inputQueue,
  Worker worker,
  CompletableFuture<Void> done
) {

  /** Returns a new pipeline builder where all worker and queue names will start with {@code prefix_}. */
  public static Empty start(String prefix, Stats stats) {
    return new Empty(prefix, stats);
  }

  /**
   * Blocks until all steps finish, logging progress every {@code logInterval}.
   *
   * @throws RuntimeException if interrupted or if any of the threads die with an exception.
   */
  public void awaitAndLog(ProgressLoggers loggers, Duration logInterval) {
    loggers.awaitAndLog(done, logInterval);
  }

  /**
   * Blocks until all steps finish.
   *
   * @throws RuntimeException the exception that killed the first failing thread, unwrapped
   */
  public void await() {
    try {
      done.get();
    } catch (InterruptedException e) {
      rethrow(e);
    } catch (ExecutionException e) {
      rethrow(e.getCause());
    }
  }

  /** Work at the start of a pipeline that emits the initial elements. */
  @FunctionalInterface
  public interface SourceStep<O> {

    void run(Consumer<O> next) throws Exception;
  }

  /** Work in the middle of a pipeline that reads elements from the previous step and emits to the next one. */
  @FunctionalInterface
  public interface WorkerStep<I, O> {

    void run(IterableOnce<I> prev, Consumer<O> next) throws Exception;
  }

  /** Work at the end of a pipeline that consumes elements from the previous step. */
  @FunctionalInterface
  public interface SinkStep<I> {

    void run(IterableOnce<I> prev) throws Exception;
  }

  /** A step that needs a queue of {@code size} items added after it before the next step. */
  @FunctionalInterface
  public interface Bufferable<E> {

    Builder<E> addBuffer(String name, int size);
  }

  /** Builder for a pipeline that does not have any steps yet. */
  public record Empty(String prefix, Stats stats) {

    /** Adds an initial step that runs {@code producer} in {@code threads} threads. */
    public <T> Bufferable<T> fromGenerator(String name, SourceStep<T> producer, int threads) {
      return (queueName, size) -> {
        var nextQueue = new WorkQueue<T>(prefix + "_" + queueName, size, stats);
        Worker worker = new Worker(prefix + "_" + name, stats, threads, () -> producer.run(nextQueue.writer()));
        return new Builder<>(prefix, name, nextQueue, worker, stats);
      };
    }

    /** Adds an initial step that drains {@code iterator} in a single thread. */
    public <T> Bufferable<T> readFrom(String name, Iterator<T> iterator) {
      return fromGenerator(name, next -> {
        while (iterator.hasNext()) {
          next.accept(iterator.next());
        }
      }, 1);
    }
  }

  /** A step while building a pipeline that needs a subsequent step to process its output. */
  public record Builder<O>(
    String prefix,
    String name,
    WorkerPipeline.Builder<?> previous,
    WorkQueue<?> inputQueue,
    WorkQueue<O> outputQueue,
    Worker worker,
    Stats stats
  ) {

    private Builder(String prefix, String name, WorkQueue<O> outputQueue, Worker worker, Stats stats) {
      this(prefix, name, null, null, outputQueue, worker, stats);
    }

    /** Runs {@code step} in {@code threads} threads that consume items and emit new ones. */
    public <O2> Bufferable<O2> addWorker(String name, int threads, WorkerStep<O, O2> step) {
      Builder<O> curr = this;
      return (queueName, size) -> {
        var nextOutputQueue = new WorkQueue<O2>(prefix + "_" + queueName, size, stats);
        var worker = new Worker(prefix + "_" + name, stats, threads,
          () -> step.run(outputQueue.reader(), nextOutputQueue.writer()));
        return new Builder<>(prefix, name, curr, outputQueue, nextOutputQueue, worker, stats);
      };
    }

    private WorkerPipeline<?> build() {
      var previousPipeline = previous == null || previous.worker == null ? null : previous.build();
      CompletableFuture<Void> doneFuture =
        worker != null ? worker.done() : CompletableFuture.completedFuture(null);
      if (previousPipeline != null) {
        doneFuture = joinFutures(doneFuture, previousPipeline.done);
      }
      if (worker != null && outputQueue != null) {
        doneFuture = doneFuture.thenRun(outputQueue::close);
      }
      return new WorkerPipeline<>(name, previousPipeline, inputQueue, worker, doneFuture);
    }

    /** Runs {@code step} in {@code threads} threads that consume items without emitting any. */
    public WorkerPipeline<O> sinkTo(String name, int threads, SinkStep<O> step) {
      var previousPipeline = build();
      var worker = new Worker(prefix + "_" + name, stats, threads, () -> step.run(outputQueue.reader()));
      var doneFuture = joinFutures(worker.done(), previousPipeline.done);
      return new WorkerPipeline<>(name, previousPipeline, outputQueue, worker, doneFuture);
    }

    /** Runs {@code consumer} for every item in {@code threads} threads. */
    public WorkerPipeline<O> sinkToConsumer(String name, int threads, Consumer<O> consumer) {
      return sinkTo(name, threads, prev -> {
        for (O item : prev) {
          consumer.accept(item);
        }
      });
    }
  }
}
