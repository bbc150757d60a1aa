package com.finrag.tasks;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Immutable snapshot of a task as seen by callers. {@code result} is set only when the status is
 * {@link TaskStatus#COMPLETED} and {@code error} only when it is {@link TaskStatus#FAILED}.
 *
 * <p>The result tree is a private copy; mutating it does not affect the stored task.
 */
public record TaskView(
    String taskId,
    TaskStatus status,
    String operationName,
    JsonNode result,
    TaskError error,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt) {

  public boolean isTerminal() {
    return status.isTerminal();
  }

  /** Time since completion, or empty while the task is still pending or running. */
  public Optional<Duration> ageSinceCompletion(Instant now) {
    return completedAt == null
        ? Optional.empty()
        : Optional.of(Duration.between(completedAt, now));
  }
}
