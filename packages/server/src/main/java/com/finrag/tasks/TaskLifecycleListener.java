package com.finrag.tasks;

/**
 * Observer notified by the queue as tasks move through their lifecycle. Callbacks run on the
 * submitting thread (submit) or on the worker thread (start, finish) and must not block.
 * Exceptions thrown by a listener are logged and ignored.
 */
public interface TaskLifecycleListener {

  default void onSubmitted(TaskView task) {}

  default void onStarted(TaskView task) {}

  /** Called once the task reached {@link TaskStatus#COMPLETED} or {@link TaskStatus#FAILED}. */
  default void onFinished(TaskView task) {}

  TaskLifecycleListener NONE = new TaskLifecycleListener() {};
}
