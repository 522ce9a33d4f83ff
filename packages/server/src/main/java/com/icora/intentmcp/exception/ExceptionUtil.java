package com.icora.intentmcp.exception;

import java.util.function.Function;

/** Helpers for translating foreign exceptions into the {@link IntentMcpException} family. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Pass an {@link IntentMcpException} through untouched and translate anything else, so an
   * already classified failure keeps its code when it crosses a layer that catches {@code
   * Exception}.
   */
  public static IntentMcpException translate(
      Throwable t, Function<Throwable, ? extends IntentMcpException> translator) {
    if (t instanceof IntentMcpException ime) {
      return ime;
    }
    if (t instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    return translator.apply(t);
  }

  /** Innermost cause, or {@code t} itself when it has none. */
  public static Throwable rootCause(Throwable t) {
    Throwable current = t;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    return current;
  }
}
