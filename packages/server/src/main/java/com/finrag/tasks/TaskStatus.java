package com.finrag.tasks;

import com.finrag.exception.ValidationException;
import java.util.Locale;

/**
 * Lifecycle state of a queued task.
 *
 * <p>Transitions: PENDING → RUNNING → {COMPLETED, FAILED}. Terminal states never change again.
 */
public enum TaskStatus {
  /** Task accepted but not yet picked up by a worker. */
  PENDING("pending"),
  /** Task is currently executing. */
  RUNNING("running"),
  /** Task finished and produced a result. */
  COMPLETED("completed"),
  /** Task finished with an error. See the error details. */
  FAILED("failed");

  private final String wireName;

  TaskStatus(String wireName) {
    this.wireName = wireName;
  }

  /** Lower-case name used in JSON payloads and query parameters. */
  public String wireName() {
    return wireName;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /**
   * Parse a wire name (case insensitive).
   *
   * @throws ValidationException if the name does not denote a status
   */
  public static TaskStatus fromWireName(String name) {
    if (name != null) {
      String normalized = name.trim().toLowerCase(Locale.ROOT);
      for (TaskStatus status : values()) {
        if (status.wireName.equals(normalized)) return status;
      }
    }
    throw new ValidationException("Unknown task status: " + name);
  }
}
