package com.finrag.tasks;

/**
 * Result of running a {@link TaskOperation}: either a value or a structured error.
 *
 * @param <T> type of the success value
 */
public sealed interface TaskOutcome<T> {

  record Success<T>(T value) implements TaskOutcome<T> {}

  record Failure<T>(TaskError error) implements TaskOutcome<T> {}

  static <T> TaskOutcome<T> success(T value) {
    return new Success<>(value);
  }

  static <T> TaskOutcome<T> failure(TaskError error) {
    return new Failure<>(error);
  }

  static <T> TaskOutcome<T> failure(Throwable t) {
    return new Failure<>(TaskError.from(t));
  }

  static <T> TaskOutcome<T> failure(String errorType, String errorMessage) {
    return new Failure<>(TaskError.of(errorType, errorMessage));
  }
}
