package com.finrag.exception;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or API responses. If the
   * throwable is a {@link FinRagException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof FinRagException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        FinRagErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /**
   * Full stack trace of {@code t}, including every chained cause and suppressed exception, exactly
   * as {@link Throwable#printStackTrace()} would print it.
   */
  public static String fullStackTrace(Throwable t) {
    if (t == null) return "";
    StringWriter sw = new StringWriter();
    try (PrintWriter pw = new PrintWriter(sw)) {
      t.printStackTrace(pw);
    }
    return sw.toString();
  }

  /**
   * Extract a user-facing message from a throwable: the first non-blank message found while
   * walking the cause chain, prefixed with the top-level exception type.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    String className = t.getClass().getSimpleName();
    Throwable current = t;
    while (current != null) {
      String message = current.getMessage();
      if (message != null && !message.isBlank()) {
        return className + ": " + message.trim();
      }
      current = current.getCause();
    }
    return className;
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static FinRagException rethrowIfUnchecked(
      Throwable t, Function<Throwable, FinRagException> supplier) {
    if (t instanceof FinRagException) {
      return (FinRagException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
