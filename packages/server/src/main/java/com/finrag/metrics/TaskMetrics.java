package com.finrag.metrics;

import com.finrag.logging.LoggingService;
import com.finrag.tasks.TaskLifecycleListener;
import com.finrag.tasks.TaskQueue;
import com.finrag.tasks.TaskStatus;
import com.finrag.tasks.TaskView;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.slf4j.Logger;

/**
 * Micrometer meters for the task queue. Counters and the duration timer are fed by lifecycle
 * callbacks; the per-status gauges read {@link TaskQueue#stats()} on scrape.
 */
public final class TaskMetrics implements TaskLifecycleListener {
  private static final Logger log = LoggingService.getLogger(TaskMetrics.class);

  public static final String SUBMITTED = "finrag.tasks.submitted";
  public static final String FINISHED = "finrag.tasks.finished";
  public static final String DURATION = "finrag.tasks.duration";
  public static final String IN_QUEUE = "finrag.tasks.in.queue";

  private final MeterRegistry registry;
  private final Counter submitted;
  private final Counter completed;
  private final Counter failed;
  private final Timer duration;

  public TaskMetrics(MeterRegistry registry) {
    this.registry = registry;
    this.submitted =
        Counter.builder(SUBMITTED).description("Tasks added to the queue").register(registry);
    this.completed =
        Counter.builder(FINISHED)
            .description("Tasks that reached a terminal state")
            .tag("outcome", TaskStatus.COMPLETED.wireName())
            .register(registry);
    this.failed =
        Counter.builder(FINISHED)
            .description("Tasks that reached a terminal state")
            .tag("outcome", TaskStatus.FAILED.wireName())
            .register(registry);
    this.duration =
        Timer.builder(DURATION)
            .description("Time from start of execution to completion")
            .register(registry);
  }

  /** Register one gauge per status. Call once the queue exists. */
  public void bindQueue(TaskQueue queue) {
    for (TaskStatus status : TaskStatus.values()) {
      Gauge.builder(IN_QUEUE, queue, q -> q.stats().count(status))
          .description("Tasks currently held by the queue")
          .tag("status", status.wireName())
          .register(registry);
    }
    log.debug("Task queue gauges registered");
  }

  @Override
  public void onSubmitted(TaskView task) {
    submitted.increment();
  }

  @Override
  public void onFinished(TaskView task) {
    if (task.status() == TaskStatus.COMPLETED) {
      completed.increment();
    } else {
      failed.increment();
    }
    if (task.startedAt() != null && task.completedAt() != null) {
      duration.record(Duration.between(task.startedAt(), task.completedAt()));
    }
  }
}
