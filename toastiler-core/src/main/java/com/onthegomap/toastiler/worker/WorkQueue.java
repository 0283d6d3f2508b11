package com.onthegomap.toastiler.worker;

import static com.google.common.base.Preconditions.checkArgument;

import com.onthegomap.toastiler.stats.Counter;
import com.onthegomap.toastiler.stats.Stats;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A bounded hand-off of tiles between two steps of a {@link WorkerPipeline}.
 * <p>
 * Writers block while the queue is full. After {@link #close()} readers drain what is left and then get {@code null}.
 * Nothing may be written once the queue is closed.
 *
 * @param <T> the type of elements held in this queue
 */
@ThreadSafe
public class WorkQueue<T> implements AutoCloseable {

  private static final long POLL_MILLIS = 100;

  private final BlockingQueue<T> items;
  private final int capacity;
  private final Counter.MultiThreadCounter enqueued;
  private final Counter.MultiThreadCounter writeBlockedNanos;
  private final Counter.MultiThreadCounter readBlockedNanos;
  private volatile boolean closed = false;

  /**
   * @param name     prefix for the stats this queue reports
   * @param capacity number of items that can wait in the queue before writers block
   * @param stats    where to report queue size and blocked time
   */
  public WorkQueue(String name, int capacity, Stats stats) {
    checkArgument(capacity > 0, "%s capacity must be positive, got %s", name, capacity);
    this.capacity = capacity;
    items = new ArrayBlockingQueue<>(capacity);
    enqueued = stats.longCounter(name + "_enqueue_count");
    writeBlockedNanos = stats.nanoCounter(name + "_enqueue_block_time_seconds");
    readBlockedNanos = stats.nanoCounter(name + "_dequeue_block_time_seconds");
    stats.gauge(name + "_capacity", capacity);
    stats.gauge(name + "_size", items::size);
  }

  /** Marks that no more items will be written. */
  @Override
  public void close() {
    closed = true;
  }

  /** Returns a writer for the calling thread that blocks while the queue is full. */
  public Consumer<T> writer() {
    Counter count = enqueued.counterForThread();
    Counter blocked = writeBlockedNanos.counterForThread();
    return item -> {
      if (!items.offer(item)) {
        long start = System.nanoTime();
        try {
          items.put(item);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException(e);
        }
        blocked.incBy(System.nanoTime() - start);
      }
      count.inc();
    };
  }

  /**
   * Returns a reader for the calling thread that waits for the next item, or returns {@code null} once the queue is
   * closed and empty or the thread is interrupted.
   */
  public IterableOnce<T> reader() {
    Counter blocked = readBlockedNanos.counterForThread();
    return () -> {
      T item = items.poll();
      if (item == null) {
        long start = System.nanoTime();
        try {
          while (item == null && !(closed && items.isEmpty())) {
            item = items.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        blocked.incBy(System.nanoTime() - start);
      }
      return item;
    };
  }

  /** Returns the number of items waiting to be read. */
  public int getPending() {
    return items.size();
  }

  public int getCapacity() {
    return capacity;
  }
}
