package com.onthegomap.toastiler.stats;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * A {@code long} value that can go up and down.
 * <p>
 * Sampler threads each bump their own {@link SingleThreadCounter} through {@link MultiThreadCounter#counterForThread()}
 * and the progress logger adds them up on read, so hot loops never contend on a shared {@link AtomicLong}.
 */
public interface Counter {

  default void inc() {
    incBy(1);
  }

  void incBy(long value);

  /** A counter that lets clients get the current value. */
  interface Readable extends Counter, LongSupplier {

    long get();

    @Override
    default long getAsLong() {
      return get();
    }
  }

  /** Returns a counter for updates from many threads with infrequent reads. */
  static MultiThreadCounter newMultiThreadCounter() {
    return new MultiThreadCounter();
  }

  class SingleThreadCounter implements Readable {

    private final AtomicLong counter = new AtomicLong(0);

    private SingleThreadCounter() {}

    @Override
    public void incBy(long value) {
      counter.addAndGet(value);
    }

    @Override
    public long get() {
      return counter.get();
    }
  }

  /**
   * Hands out one {@link SingleThreadCounter} per thread and sums them on {@link #get()}.
   * <p>
   * Callers in a loop should grab {@link #counterForThread()} once instead of calling {@link #inc()} repeatedly.
   */
  class MultiThreadCounter implements Readable {

    private final List<SingleThreadCounter> all = new CopyOnWriteArrayList<>();
    private final ThreadLocal<SingleThreadCounter> thread = ThreadLocal.withInitial(() -> {
      SingleThreadCounter counter = new SingleThreadCounter();
      all.add(counter);
      return counter;
    });

    private MultiThreadCounter() {}

    @Override
    public void incBy(long value) {
      thread.get().incBy(value);
    }

    /** Returns the counter owned by the calling thread. */
    public Counter counterForThread() {
      return thread.get();
    }

    @Override
    public long get() {
      return all.stream().mapToLong(SingleThreadCounter::get).sum();
    }
  }
}
