package com.finrag.tasks;

import com.finrag.logging.LoggingService;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/** Periodically removes old finished tasks from a {@link TaskQueue}. */
public final class TaskCleanupScheduler implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(TaskCleanupScheduler.class);

  private final TaskQueue queue;
  private final Duration interval;
  private final Duration maxAge;
  private final ScheduledExecutorService scheduler;

  public TaskCleanupScheduler(TaskQueue queue, Duration interval, Duration maxAge) {
    this.queue = queue;
    this.interval = interval;
    this.maxAge = maxAge;
    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread thread = new Thread(r, "finrag-task-cleanup");
              thread.setDaemon(true);
              return thread;
            });
  }

  public void start() {
    long millis = interval.toMillis();
    scheduler.scheduleWithFixedDelay(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
    log.info("Task cleanup scheduled every {} (max age {})", interval, maxAge);
  }

  /** One sweep. Failures are logged; a thrown exception would cancel the periodic schedule. */
  void sweep() {
    try {
      int removed = queue.clean(maxAge);
      if (removed > 0) {
        log.debug("Cleanup sweep removed {} task(s)", removed);
      }
    } catch (RuntimeException e) {
      log.error("Task cleanup sweep failed", e);
    }
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
  }
}
