package com.finrag.metrics;

import static org.junit.jupiter.api.Assertions.*;

import com.finrag.tasks.TaskOperation;
import com.finrag.tasks.TaskOutcome;
import com.finrag.tasks.TaskQueue;
import com.finrag.tasks.TaskQueueSettings;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.function.DoubleSupplier;
import org.junit.jupiter.api.Test;

class TaskMetricsTest {

  @Test
  void countsSubmittedAndFinishedTasks() throws Exception {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    TaskMetrics metrics = new TaskMetrics(registry);
    try (TaskQueue queue =
        new TaskQueue(
            TaskQueueSettings.newBuilder().withCleanupEnabled(false).build(),
            Clock.systemUTC(),
            metrics)) {
      metrics.bindQueue(queue);

      queue.submit(TaskOperation.of(() -> 1), "ok-1");
      queue.submit(TaskOperation.of(() -> 2), "ok-2");
      queue.submit(() -> TaskOutcome.failure("E", "no"), "bad");

      assertEquals(3.0, registry.get(TaskMetrics.SUBMITTED).counter().count());
      awaitValue(
          () -> registry.get(TaskMetrics.FINISHED).tag("outcome", "completed").counter().count(),
          2.0);
      awaitValue(
          () -> registry.get(TaskMetrics.FINISHED).tag("outcome", "failed").counter().count(), 1.0);
      awaitValue(() -> registry.get(TaskMetrics.DURATION).timer().count(), 3.0);

      assertEquals(
          2.0, registry.get(TaskMetrics.IN_QUEUE).tag("status", "completed").gauge().value());
      assertEquals(1.0, registry.get(TaskMetrics.IN_QUEUE).tag("status", "failed").gauge().value());
      assertEquals(0.0, registry.get(TaskMetrics.IN_QUEUE).tag("status", "pending").gauge().value());
    }
  }

  private static void awaitValue(DoubleSupplier value, double expected) throws Exception {
    long end = System.currentTimeMillis() + 3000;
    while (System.currentTimeMillis() < end) {
      if (value.getAsDouble() == expected) return;
      Thread.sleep(20);
    }
    assertEquals(expected, value.getAsDouble());
  }
}
