package com.finrag.tasks;

import com.finrag.exception.FinRagErrorCode;
import com.finrag.exception.FinRagException;

/** Raised when a task id was never issued or has already been cleaned up. */
public class TaskNotFoundException extends FinRagException {
  private final String taskId;

  public TaskNotFoundException(String taskId) {
    super(FinRagErrorCode.NOT_FOUND, "Task " + taskId + " not found in queue");
    this.taskId = taskId;
    withContext("taskId", taskId);
  }

  public String getTaskId() {
    return taskId;
  }
}
