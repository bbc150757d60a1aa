package com.finrag.tasks;

/** Point-in-time census of the queue by status. */
public record TaskStats(long total, long pending, long running, long completed, long failed) {

  public long count(TaskStatus status) {
    return switch (status) {
      case PENDING -> pending;
      case RUNNING -> running;
      case COMPLETED -> completed;
      case FAILED -> failed;
    };
  }
}
