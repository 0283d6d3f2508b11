package com.onthegomap.toastiler.worker;

/**
 * A worker task that can throw checked exceptions.
 */
@FunctionalInterface
public interface RunnableThatThrows {

  @SuppressWarnings("java:S112")
  void run() throws Exception;
}
