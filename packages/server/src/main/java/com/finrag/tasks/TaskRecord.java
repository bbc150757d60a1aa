package com.finrag.tasks;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Objects;

/**
 * Internal mutable state of one task. Instances live inside a {@link TaskStore} and are only read
 * or written while holding the store's lock; callers outside the store see {@link TaskView}
 * snapshots.
 */
public final class TaskRecord {
  final String id;
  final String operationName;
  final Instant createdAt;

  TaskStatus status = TaskStatus.PENDING;
  JsonNode result;
  TaskError error;
  Instant startedAt;
  Instant completedAt;

  TaskRecord(String id, String operationName, Instant createdAt) {
    this.id = Objects.requireNonNull(id, "id");
    this.operationName = operationName == null ? "unknown" : operationName;
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
  }

  /** PENDING → RUNNING. Returns false if the record already left PENDING. */
  boolean markRunning(Instant now) {
    if (status != TaskStatus.PENDING) return false;
    status = TaskStatus.RUNNING;
    startedAt = latest(createdAt, now);
    return true;
  }

  /** RUNNING → COMPLETED. Returns false if the record is not RUNNING. */
  boolean markCompleted(JsonNode value, Instant now) {
    if (status != TaskStatus.RUNNING) return false;
    status = TaskStatus.COMPLETED;
    result = value;
    completedAt = latest(startedAt, now);
    return true;
  }

  /**
   * Any non-terminal state → FAILED. A record that never got to run is failed as if it had started
   * at {@code now}.
   */
  boolean markFailed(TaskError failure, Instant now) {
    if (status.isTerminal()) return false;
    if (startedAt == null) startedAt = latest(createdAt, now);
    status = TaskStatus.FAILED;
    error = failure;
    completedAt = latest(startedAt, now);
    return true;
  }

  TaskView snapshot() {
    return new TaskView(
        id,
        status,
        operationName,
        result == null ? null : result.deepCopy(),
        error,
        createdAt,
        startedAt,
        completedAt);
  }

  private static Instant latest(Instant floor, Instant now) {
    return now.isBefore(floor) ? floor : now;
  }
}
