package com.finrag.tasks;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finrag.logging.LoggingService;
import com.finrag.utility.JacksonUtility;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.slf4j.Logger;

/**
 * Drives tasks through PENDING → RUNNING → {COMPLETED, FAILED} on an executor.
 *
 * <p>The runner is the only writer of a task's status, result, error and timestamps once the task
 * has been inserted. A failing operation, whether it returns {@link TaskOutcome.Failure} or throws,
 * is recorded on its own task and never reaches the worker thread, the submitter or any other
 * task.
 *
 * <p>The runner owns the executor passed to it and shuts it down on {@link #close()}.
 */
public final class TaskRunner implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(TaskRunner.class);

  private final TaskStore store;
  private final ExecutorService executor;
  private final Clock clock;
  private final TaskLifecycleListener listener;
  private final Duration shutdownGrace;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public TaskRunner(
      TaskStore store,
      ExecutorService executor,
      Clock clock,
      TaskLifecycleListener listener,
      Duration shutdownGrace) {
    this.store = store;
    this.executor = executor;
    this.clock = clock;
    this.listener = listener == null ? TaskLifecycleListener.NONE : listener;
    this.shutdownGrace = shutdownGrace;
  }

  /**
   * Executor matching a concurrency cap: {@code maxConcurrency <= 0} gives an unbounded pool that
   * grows with the number of in-flight tasks, a positive value gives a fixed pool of that size whose
   * backlog queue is unbounded, so submission never blocks.
   */
  public static ExecutorService newExecutor(int maxConcurrency) {
    ThreadFactory threads = new WorkerThreadFactory();
    if (maxConcurrency <= 0) {
      return Executors.newCachedThreadPool(threads);
    }
    return new ThreadPoolExecutor(
        maxConcurrency,
        maxConcurrency,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        threads);
  }

  /**
   * Hand the task to the executor and return immediately. If the executor refuses the work the
   * task is failed on the spot.
   */
  public void schedule(String taskId, TaskOperation<?> operation) {
    try {
      executor.execute(new ScheduledTask(taskId, operation));
    } catch (RejectedExecutionException e) {
      log.error("Task {} could not be scheduled: {}", taskId, e.getMessage());
      fail(taskId, TaskError.from(e));
    }
  }

  /** Run one task to a terminal state on the calling thread. Never throws. */
  void execute(String taskId, TaskOperation<?> operation) {
    Optional<TaskView> running = transition(taskId, r -> r.markRunning(clock.instant()));
    if (running.isEmpty()) {
      log.warn("Task {} is no longer pending, skipping execution", taskId);
      return;
    }
    log.info("Task {} started execution", taskId);

    // Once RUNNING, every path must end in a terminal state.
    try {
      notifyListener(listener::onStarted, running.get());
      finish(taskId, run(taskId, operation));
    } catch (Throwable t) {
      log.error("Task {} could not be finished normally", taskId, t);
      fail(taskId, TaskError.from(t));
    }
  }

  private TaskOutcome<?> run(String taskId, TaskOperation<?> operation) {
    try {
      TaskOutcome<?> outcome = operation.run();
      if (outcome == null) {
        return TaskOutcome.failure("MissingOutcome", "Operation returned no outcome");
      }
      return outcome;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("Task {} was interrupted", taskId, e);
      return TaskOutcome.failure(e);
    } catch (Throwable t) {
      log.error("Task {} failed: {}", taskId, t.toString(), t);
      return TaskOutcome.failure(t);
    }
  }

  private void finish(String taskId, TaskOutcome<?> outcome) {
    if (outcome instanceof TaskOutcome.Failure<?> failure) {
      fail(taskId, failure.error());
      return;
    }

    Object value = ((TaskOutcome.Success<?>) outcome).value();
    JsonNode result;
    try {
      result = mapper.valueToTree(value);
    } catch (IllegalArgumentException e) {
      log.error("Task {} produced a result that cannot be stored", taskId, e);
      fail(taskId, TaskError.from(e));
      return;
    }

    Optional<TaskView> completed = transition(taskId, r -> r.markCompleted(result, clock.instant()));
    if (completed.isEmpty()) {
      log.debug("Task {} was removed before it completed", taskId);
      return;
    }
    log.info("Task {} completed successfully", taskId);
    notifyListener(listener::onFinished, completed.get());
  }

  private void fail(String taskId, TaskError error) {
    Optional<TaskView> failed = transition(taskId, r -> r.markFailed(error, clock.instant()));
    if (failed.isEmpty()) {
      log.debug("Task {} was removed or already finished, dropping failure", taskId);
      return;
    }
    log.warn("Task {} marked failed: {}: {}", taskId, error.errorType(), error.errorMessage());
    notifyListener(listener::onFinished, failed.get());
  }

  private Optional<TaskView> transition(String taskId, Predicate<TaskRecord> change) {
    AtomicReference<TaskView> after = new AtomicReference<>();
    store.update(
        taskId,
        record -> {
          if (change.test(record)) after.set(record.snapshot());
        });
    return Optional.ofNullable(after.get());
  }

  private void notifyListener(Consumer<TaskView> callback, TaskView view) {
    try {
      callback.accept(view);
    } catch (RuntimeException e) {
      log.warn("Task listener failed for task {}", view.taskId(), e);
    }
  }

  /**
   * Stop accepting work and wait up to the grace period for running tasks. Tasks still waiting in
   * the backlog when the grace period ends are failed, so no task is left pending forever.
   */
  @Override
  public void close() {
    executor.shutdown();
    try {
      if (executor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
        return;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    List<Runnable> neverStarted = executor.shutdownNow();
    for (Runnable runnable : neverStarted) {
      if (runnable instanceof ScheduledTask task) {
        fail(
            task.taskId,
            TaskError.of("RejectedExecutionException", "Queue closed before the task started"));
      }
    }
    log.info("Task runner stopped, {} queued task(s) abandoned", neverStarted.size());
  }

  private final class ScheduledTask implements Runnable {
    private final String taskId;
    private final TaskOperation<?> operation;

    private ScheduledTask(String taskId, TaskOperation<?> operation) {
      this.taskId = taskId;
      this.operation = operation;
    }

    @Override
    public void run() {
      execute(taskId, operation);
    }
  }

  private static final class WorkerThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread thread = new Thread(r, "finrag-task-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
