package com.finrag.tasks;

import com.finrag.logging.LoggingService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Asynchronous in-memory task queue. Callers submit an operation and get an id back immediately;
 * the operation runs on a worker thread and its status, result or error can be polled by id until
 * the task is cleaned up.
 *
 * <p>One instance is created at startup and handed to whatever needs it. Instances are
 * thread-safe.
 */
public final class TaskQueue implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(TaskQueue.class);

  private final TaskQueueSettings settings;
  private final TaskStore store;
  private final TaskRunner runner;
  private final Clock clock;
  private final TaskLifecycleListener listener;
  private final Supplier<String> idGenerator;

  // Guarded by this.
  private TaskCleanupScheduler cleanup;
  private boolean closed;

  public TaskQueue(TaskQueueSettings settings) {
    this(settings, Clock.systemUTC(), TaskLifecycleListener.NONE);
  }

  public TaskQueue(TaskQueueSettings settings, Clock clock, TaskLifecycleListener listener) {
    this(settings, clock, listener, new InMemoryTaskStore(), () -> UUID.randomUUID().toString());
  }

  TaskQueue(
      TaskQueueSettings settings,
      Clock clock,
      TaskLifecycleListener listener,
      TaskStore store,
      Supplier<String> idGenerator) {
    this.settings = settings;
    this.store = store;
    this.clock = clock;
    this.listener = listener == null ? TaskLifecycleListener.NONE : listener;
    this.idGenerator = idGenerator;
    this.runner =
        new TaskRunner(
            store,
            TaskRunner.newExecutor(settings.getMaxConcurrency()),
            clock,
            this.listener,
            settings.getShutdownGrace());
    log.info("Task queue created: {}", settings);
  }

  /**
   * Start the periodic cleanup sweep if the settings enable it. Tasks can be submitted before this
   * is called; only the sweep waits for it. Calling it again, or after {@link #close()}, does
   * nothing.
   *
   * @return this queue
   */
  public synchronized TaskQueue start() {
    if (cleanup == null && !closed && settings.isCleanupEnabled()) {
      cleanup =
          new TaskCleanupScheduler(this, settings.getCleanupInterval(), settings.getCleanupMaxAge());
      cleanup.start();
    }
    return this;
  }

  /**
   * Register a new task and schedule it. Returns without waiting for any part of the execution.
   *
   * @param operation the work to run; arguments are bound by the caller
   * @param name label reported as the task's operation name
   * @return the new task id
   */
  public String submit(TaskOperation<?> operation, String name) {
    if (operation == null) {
      throw new IllegalArgumentException("operation must not be null");
    }
    String id = idGenerator.get();
    TaskRecord record = new TaskRecord(id, name, clock.instant());
    store.insert(record);
    log.info("Task {} added to queue: {}", id, record.operationName);
    store.get(id).ifPresent(this::notifySubmitted);
    runner.schedule(id, operation);
    return id;
  }

  /**
   * Current state of a task.
   *
   * @throws TaskNotFoundException if the id was never issued or the task has been cleaned up
   */
  public TaskView getStatus(String taskId) {
    return find(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
  }

  public Optional<TaskView> find(String taskId) {
    if (taskId == null) return Optional.empty();
    return store.get(taskId);
  }

  public List<TaskView> list() {
    return store.list();
  }

  /** Tasks in the given status; {@code null} lists every task. */
  public List<TaskView> list(TaskStatus status) {
    if (status == null) return store.list();
    return store.list(view -> view.status() == status);
  }

  /**
   * Remove finished tasks whose completion is older than {@code maxAge}. Pending and running tasks
   * are never removed.
   *
   * @return number of tasks removed
   */
  public int clean(Duration maxAge) {
    if (maxAge == null || maxAge.isNegative()) {
      throw new IllegalArgumentException("maxAge must not be negative");
    }
    Instant now = clock.instant();
    int removed =
        store.deleteWhere(
            view ->
                view.isTerminal()
                    && view.ageSinceCompletion(now)
                        .map(age -> age.compareTo(maxAge) > 0)
                        .orElse(false));
    if (removed > 0) {
      log.info("Cleaned up {} old task(s)", removed);
    }
    return removed;
  }

  public int clean(long maxAgeSeconds) {
    return clean(Duration.ofSeconds(maxAgeSeconds));
  }

  /** Point-in-time counts by status; not synchronized with in-flight transitions. */
  public TaskStats stats() {
    Map<TaskStatus, Long> counts = store.countByStatus();
    long pending = counts.get(TaskStatus.PENDING);
    long running = counts.get(TaskStatus.RUNNING);
    long completed = counts.get(TaskStatus.COMPLETED);
    long failed = counts.get(TaskStatus.FAILED);
    return new TaskStats(pending + running + completed + failed, pending, running, completed, failed);
  }

  private void notifySubmitted(TaskView view) {
    try {
      listener.onSubmitted(view);
    } catch (RuntimeException e) {
      log.warn("Task listener failed for task {}", view.taskId(), e);
    }
  }

  /** Stop the cleanup sweep and the workers. Tasks that never started are marked failed. */
  @Override
  public void close() {
    TaskCleanupScheduler sweeper;
    synchronized (this) {
      closed = true;
      sweeper = cleanup;
      cleanup = null;
    }
    if (sweeper != null) {
      sweeper.close();
    }
    runner.close();
    log.info("Task queue stopped");
  }
}
