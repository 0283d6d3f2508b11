package com.onthegomap.toastiler.worker;

import com.google.common.collect.AbstractIterator;
import java.util.Iterator;
import java.util.function.Supplier;

/**
 * A source of items for a pipeline step that returns {@code null} once drained, and can be read with a for-each loop.
 *
 * @param <T> Type of element returned
 */
@FunctionalInterface
public interface IterableOnce<T> extends Iterable<T>, Supplier<T> {

  @Override
  default Iterator<T> iterator() {
    return new AbstractIterator<>() {
      @Override
      protected T computeNext() {
        T next = get();
        return next == null ? endOfData() : next;
      }
    };
  }
}
