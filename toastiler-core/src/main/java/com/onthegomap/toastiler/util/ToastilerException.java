package com.onthegomap.toastiler.util;

import com.google.common.base.Throwables;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Unchecked wrapper for a checked failure in a worker thread that stops a pyramid build.
 */
public class ToastilerException extends RuntimeException {

  ToastilerException(Throwable cause) {
    super(cause);
  }

  /**
   * Throws {@code failure} from a worker or a future without wrapping it when it is already unchecked.
   * <p>
   * An {@link IOException} becomes an {@link UncheckedIOException}, and any other checked exception a
   * {@link ToastilerException}. An {@link InterruptedException} also restores the thread's interrupt flag.
   *
   * @param <T> lets callers write {@code return rethrow(e)}
   */
  public static <T> T rethrow(Throwable failure) {
    if (failure instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    Throwables.throwIfUnchecked(failure);
    if (failure instanceof IOException ioe) {
      throw new UncheckedIOException(ioe);
    }
    throw new ToastilerException(failure);
  }
}
