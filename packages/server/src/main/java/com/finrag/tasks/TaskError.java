package com.finrag.tasks;

import com.finrag.exception.ExceptionUtil;
import java.util.Objects;

/**
 * Structured failure captured for a task: the failure category, a human-readable message and the
 * full diagnostic trace.
 */
public record TaskError(String errorType, String errorMessage, String traceback) {

  public TaskError {
    Objects.requireNonNull(errorType, "errorType");
    errorMessage = errorMessage == null ? "" : errorMessage;
    traceback = traceback == null ? "" : traceback;
  }

  /**
   * Category is the simple class name, or the binary name for anonymous classes, which have none.
   * The trace includes every chained cause.
   */
  public static TaskError from(Throwable t) {
    return new TaskError(errorType(t.getClass()), t.getMessage(), ExceptionUtil.fullStackTrace(t));
  }

  static String errorType(Class<?> type) {
    String simple = type.getSimpleName();
    return simple.isBlank() ? type.getName() : simple;
  }

  /** Failure reported as a value rather than thrown; the trace is the category and message. */
  public static TaskError of(String errorType, String errorMessage) {
    String message = errorMessage == null ? "" : errorMessage;
    return new TaskError(errorType, message, errorType + ": " + message);
  }
}
