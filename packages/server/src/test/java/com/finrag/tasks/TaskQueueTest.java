package com.finrag.tasks;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TaskQueueTest {
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private final MutableClock clock = new MutableClock(T0);
  private TaskQueue queue;

  private TaskQueue newQueue(int maxConcurrency) {
    queue =
        new TaskQueue(
            TaskQueueSettings.newBuilder()
                .withMaxConcurrency(maxConcurrency)
                .withCleanupEnabled(false)
                .withShutdownGrace(Duration.ofSeconds(1))
                .build(),
            clock,
            TaskLifecycleListener.NONE);
    return queue;
  }

  @AfterEach
  void tearDown() {
    if (queue != null) queue.close();
  }

  @Test
  @DisplayName("Submitted value is stored as the result of a completed task")
  void completesWithResult() throws Exception {
    newQueue(0);
    String id = queue.submit(TaskOperation.of(() -> 42), "add");

    TaskStatus early = queue.getStatus(id).status();
    assertTrue(early != TaskStatus.FAILED, "unexpected early status " + early);

    TaskView view = awaitStatus(queue, id, TaskStatus.COMPLETED, Duration.ofSeconds(3));
    assertEquals("add", view.operationName());
    assertEquals(42, view.result().asInt());
    assertNull(view.error());
    assertNotNull(view.startedAt());
    assertFalse(view.startedAt().isAfter(view.completedAt()));
    assertFalse(view.createdAt().isAfter(view.startedAt()));
  }

  @Test
  @DisplayName("A thrown exception becomes a structured error on the task")
  void thrownExceptionFailsTask() throws Exception {
    newQueue(0);
    String id =
        queue.submit(
            TaskOperation.of(
                () -> {
                  throw new IllegalArgumentException("bad input");
                }),
            "validate");

    TaskView view = awaitStatus(queue, id, TaskStatus.FAILED, Duration.ofSeconds(3));
    assertNull(view.result());
    assertEquals("IllegalArgumentException", view.error().errorType());
    assertTrue(view.error().errorMessage().contains("bad input"));
    assertTrue(view.error().traceback().contains("IllegalArgumentException: bad input"));
    assertNotNull(view.startedAt());
    assertNotNull(view.completedAt());
  }

  @Test
  @DisplayName("A returned failure is recorded without a thrown exception")
  void returnedFailureFailsTask() throws Exception {
    newQueue(0);
    String id = queue.submit(() -> TaskOutcome.failure("ValueError", "bad input"), "parse");

    TaskView view = awaitStatus(queue, id, TaskStatus.FAILED, Duration.ofSeconds(3));
    assertEquals("ValueError", view.error().errorType());
    assertEquals("bad input", view.error().errorMessage());
    assertEquals("ValueError: bad input", view.error().traceback());
  }

  @Test
  @DisplayName("Ids are pairwise distinct")
  void idsAreUnique() {
    newQueue(0);
    Set<String> ids = new HashSet<>();
    for (int i = 0; i < 500; i++) {
      ids.add(queue.submit(TaskOperation.of(() -> "x"), "noop"));
    }
    assertEquals(500, ids.size());
  }

  @Test
  @DisplayName("Submit does not wait for the operation")
  void submitDoesNotBlock() throws Exception {
    newQueue(0);
    CountDownLatch release = new CountDownLatch(1);

    long start = System.nanoTime();
    String id =
        queue.submit(
            TaskOperation.of(
                () -> {
                  release.await(2, TimeUnit.SECONDS);
                  return "done";
                }),
            "slow");
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertTrue(elapsedMs < 200, "submit took " + elapsedMs + " ms");
    assertFalse(queue.getStatus(id).isTerminal());
    release.countDown();
    awaitStatus(queue, id, TaskStatus.COMPLETED, Duration.ofSeconds(3));
  }

  @Test
  @DisplayName("A failing task does not affect tasks running next to it")
  void failuresAreIsolated() throws Exception {
    newQueue(0);
    List<String> ids = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      final int n = i;
      ids.add(
          queue.submit(
              TaskOperation.of(
                  () -> {
                    if (n == 3) throw new IllegalStateException("job 3 fails");
                    Thread.sleep(200);
                    return n * 10;
                  }),
              "job-" + i));
    }

    for (int i = 0; i < 10; i++) {
      TaskStatus expected = i == 3 ? TaskStatus.FAILED : TaskStatus.COMPLETED;
      TaskView view = awaitStatus(queue, ids.get(i), expected, Duration.ofSeconds(5));
      if (i != 3) {
        assertEquals(i * 10, view.result().asInt());
      }
    }
  }

  @Test
  @DisplayName("Terminal tasks carry exactly one of result and error")
  void exactlyOneOutcomeField() throws Exception {
    newQueue(0);
    String ok = queue.submit(TaskOperation.of(() -> null), "returns-null");
    String bad = queue.submit(() -> TaskOutcome.failure("E", "m"), "fails");

    TaskView okView = awaitStatus(queue, ok, TaskStatus.COMPLETED, Duration.ofSeconds(3));
    TaskView badView = awaitStatus(queue, bad, TaskStatus.FAILED, Duration.ofSeconds(3));

    assertNotNull(okView.result());
    assertTrue(okView.result().isNull());
    assertNull(okView.error());
    assertNull(badView.result());
    assertNotNull(badView.error());
  }

  @Test
  @DisplayName("Polling a finished task always returns the same content")
  void pollingIsIdempotent() throws Exception {
    newQueue(0);
    String id = queue.submit(TaskOperation.of(() -> List.of("a", "b")), "list");
    TaskView first = awaitStatus(queue, id, TaskStatus.COMPLETED, Duration.ofSeconds(3));

    for (int i = 0; i < 5; i++) {
      TaskView again = queue.getStatus(id);
      assertEquals(first.result().toString(), again.result().toString());
      assertEquals(first, again);
    }
  }

  @Test
  @DisplayName("Clean removes only finished tasks older than the threshold")
  void cleanRespectsAgeAndStatus() throws Exception {
    newQueue(0);
    String old = queue.submit(TaskOperation.of(() -> "old"), "old");
    awaitStatus(queue, old, TaskStatus.COMPLETED, Duration.ofSeconds(3));

    clock.advance(Duration.ofSeconds(90));
    String recent = queue.submit(TaskOperation.of(() -> "recent"), "recent");
    awaitStatus(queue, recent, TaskStatus.COMPLETED, Duration.ofSeconds(3));

    CountDownLatch release = new CountDownLatch(1);
    String running =
        queue.submit(
            TaskOperation.of(
                () -> {
                  release.await(5, TimeUnit.SECONDS);
                  return "late";
                }),
            "running");
    awaitStatus(queue, running, TaskStatus.RUNNING, Duration.ofSeconds(3));

    clock.advance(Duration.ofSeconds(10));
    assertEquals(1, queue.clean(Duration.ofSeconds(60)));

    assertTrue(queue.find(old).isEmpty());
    assertTrue(queue.find(recent).isPresent());
    assertTrue(queue.find(running).isPresent());

    clock.advance(Duration.ofDays(1));
    assertEquals(1, queue.clean(0));
    assertTrue(queue.find(running).isPresent());

    release.countDown();
    awaitStatus(queue, running, TaskStatus.COMPLETED, Duration.ofSeconds(3));
  }

  @Test
  @DisplayName("A task exactly at the age threshold is kept")
  void cleanUsesStrictComparison() throws Exception {
    newQueue(0);
    String id = queue.submit(TaskOperation.of(() -> 1), "one");
    awaitStatus(queue, id, TaskStatus.COMPLETED, Duration.ofSeconds(3));

    clock.advance(Duration.ofSeconds(60));
    assertEquals(0, queue.clean(60));
    clock.advance(Duration.ofSeconds(1));
    assertEquals(1, queue.clean(60));
  }

  @Test
  @DisplayName("Unknown ids are reported as not found before and after cleanup")
  void unknownIdIsNotFound() throws Exception {
    newQueue(0);
    TaskNotFoundException before =
        assertThrows(TaskNotFoundException.class, () -> queue.getStatus("nonexistent-uuid"));
    assertEquals("nonexistent-uuid", before.getTaskId());

    String id = queue.submit(TaskOperation.of(() -> 1), "one");
    awaitStatus(queue, id, TaskStatus.COMPLETED, Duration.ofSeconds(3));
    clock.advance(Duration.ofSeconds(1));
    assertEquals(1, queue.clean(0));

    assertThrows(TaskNotFoundException.class, () -> queue.getStatus(id));
    assertThrows(TaskNotFoundException.class, () -> queue.getStatus("nonexistent-uuid"));
  }

  @Test
  @DisplayName("List and stats reflect task states")
  void listAndStats() throws Exception {
    newQueue(0);
    String ok = queue.submit(TaskOperation.of(() -> 1), "ok");
    String bad = queue.submit(() -> TaskOutcome.failure("E", "m"), "bad");
    CountDownLatch release = new CountDownLatch(1);
    String running =
        queue.submit(
            TaskOperation.of(
                () -> {
                  release.await(5, TimeUnit.SECONDS);
                  return 2;
                }),
            "running");

    awaitStatus(queue, ok, TaskStatus.COMPLETED, Duration.ofSeconds(3));
    awaitStatus(queue, bad, TaskStatus.FAILED, Duration.ofSeconds(3));
    awaitStatus(queue, running, TaskStatus.RUNNING, Duration.ofSeconds(3));

    assertEquals(3, queue.list().size());
    assertEquals(3, queue.list(null).size());
    assertEquals(ok, queue.list(TaskStatus.COMPLETED).get(0).taskId());
    assertEquals(bad, queue.list(TaskStatus.FAILED).get(0).taskId());
    assertTrue(queue.list(TaskStatus.PENDING).isEmpty());

    TaskStats stats = queue.stats();
    assertEquals(new TaskStats(3, 0, 1, 1, 1), stats);
    release.countDown();
  }

  @Test
  @DisplayName("Concurrency cap keeps extra tasks pending")
  void concurrencyCap() throws Exception {
    newQueue(1);
    CountDownLatch release = new CountDownLatch(1);
    String first =
        queue.submit(
            TaskOperation.of(
                () -> {
                  release.await(5, TimeUnit.SECONDS);
                  return 1;
                }),
            "first");
    String second = queue.submit(TaskOperation.of(() -> 2), "second");

    awaitStatus(queue, first, TaskStatus.RUNNING, Duration.ofSeconds(3));
    Thread.sleep(100);
    assertEquals(TaskStatus.PENDING, queue.getStatus(second).status());

    release.countDown();
    awaitStatus(queue, second, TaskStatus.COMPLETED, Duration.ofSeconds(3));
  }

  @Test
  @DisplayName("Closing fails tasks that never started and rejects new ones")
  void closeFailsQueuedTasks() throws Exception {
    queue =
        new TaskQueue(
            TaskQueueSettings.newBuilder()
                .withMaxConcurrency(1)
                .withCleanupEnabled(false)
                .withShutdownGrace(Duration.ZERO)
                .build(),
            clock,
            TaskLifecycleListener.NONE);
    CountDownLatch never = new CountDownLatch(1);
    String blocking =
        queue.submit(
            TaskOperation.of(
                () -> {
                  never.await();
                  return 1;
                }),
            "blocking");
    String queued = queue.submit(TaskOperation.of(() -> 2), "queued");
    awaitStatus(queue, blocking, TaskStatus.RUNNING, Duration.ofSeconds(3));

    queue.close();

    TaskView queuedView = queue.getStatus(queued);
    assertEquals(TaskStatus.FAILED, queuedView.status());
    assertEquals("RejectedExecutionException", queuedView.error().errorType());
    TaskView blockingView = awaitStatus(queue, blocking, TaskStatus.FAILED, Duration.ofSeconds(3));
    assertEquals("InterruptedException", blockingView.error().errorType());

    String late = queue.submit(TaskOperation.of(() -> 3), "late");
    TaskView lateView = queue.getStatus(late);
    assertEquals(TaskStatus.FAILED, lateView.status());
    assertEquals(lateView.startedAt(), lateView.completedAt());
  }

  @Test
  @DisplayName("An Error raised while storing the result still fails the task")
  void errorDuringResultConversionFailsTask() throws Exception {
    newQueue(0);
    String id = queue.submit(TaskOperation.of(BrokenResult::new), "broken-result");

    TaskView view = awaitStatus(queue, id, TaskStatus.FAILED, Duration.ofSeconds(3));
    assertEquals("AssertionError", view.error().errorType());
    assertNull(view.result());
    assertNotNull(view.completedAt());
  }

  @Test
  @DisplayName("Observed statuses only move forward")
  void statusNeverMovesBackwards() throws Exception {
    newQueue(1);
    CountDownLatch blocker = new CountDownLatch(1);
    queue.submit(
        TaskOperation.of(
            () -> {
              blocker.await(5, TimeUnit.SECONDS);
              return 0;
            }),
        "blocker");
    String id =
        queue.submit(
            TaskOperation.of(
                () -> {
                  Thread.sleep(200);
                  return 1;
                }),
            "watched");

    List<TaskStatus> seen = new ArrayList<>();
    long end = System.currentTimeMillis() + 5000;
    TaskStatus current = queue.getStatus(id).status();
    seen.add(current);
    while (!current.isTerminal() && System.currentTimeMillis() < end) {
      if (seen.size() == 20) blocker.countDown();
      Thread.sleep(2);
      current = queue.getStatus(id).status();
      seen.add(current);
    }

    for (int i = 1; i < seen.size(); i++) {
      assertTrue(
          seen.get(i).ordinal() >= seen.get(i - 1).ordinal(),
          "status went back from " + seen.get(i - 1) + " to " + seen.get(i));
    }
    assertEquals(TaskStatus.PENDING, seen.get(0));
    assertTrue(seen.contains(TaskStatus.RUNNING));
    assertEquals(TaskStatus.COMPLETED, seen.get(seen.size() - 1));
  }

  @Test
  @DisplayName("Concurrent submitters and pollers see consistent task state")
  void concurrentSubmitAndPoll() throws Exception {
    newQueue(4);
    int threads = 8;
    int perThread = 25;
    ExecutorService clients = Executors.newFixedThreadPool(threads + 1);
    AtomicBoolean done = new AtomicBoolean(false);
    Set<String> allIds = ConcurrentHashMap.newKeySet();
    try {
      Future<?> reader =
          clients.submit(
              () -> {
                while (!done.get()) {
                  queue.list();
                  queue.stats();
                }
              });

      List<Future<?>> writers = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        final int thread = t;
        writers.add(
            clients.submit(
                () -> {
                  List<String> mine = new ArrayList<>();
                  for (int i = 0; i < perThread; i++) {
                    final int n = i;
                    mine.add(
                        queue.submit(
                            TaskOperation.of(
                                () -> {
                                  if (n % 5 == 0) throw new IllegalStateException("odd one out");
                                  return thread * 1000 + n;
                                }),
                            "client-" + thread));
                  }
                  for (String id : mine) {
                    awaitTerminal(queue, id, Duration.ofSeconds(10));
                  }
                  allIds.addAll(mine);
                  return null;
                }));
      }
      for (Future<?> writer : writers) {
        writer.get(30, TimeUnit.SECONDS);
      }
      done.set(true);
      reader.get(5, TimeUnit.SECONDS);
    } finally {
      done.set(true);
      clients.shutdownNow();
    }

    assertEquals(threads * perThread, allIds.size());
    for (String id : allIds) {
      TaskView view = queue.getStatus(id);
      assertTrue(view.isTerminal(), id + " is " + view.status());
      if (view.status() == TaskStatus.COMPLETED) {
        assertNotNull(view.result());
        assertNull(view.error());
      } else {
        assertNull(view.result());
        assertEquals("IllegalStateException", view.error().errorType());
      }
    }
    TaskStats stats = queue.stats();
    assertEquals(threads * perThread, stats.total());
    assertEquals(threads * perThread / 5, stats.failed());
    assertEquals(threads * perThread - threads * perThread / 5, stats.completed());
    assertEquals(0, stats.pending() + stats.running());
  }

  @Test
  void rejectsNullOperationAndNegativeAge() {
    newQueue(0);
    assertThrows(IllegalArgumentException.class, () -> queue.submit(null, "x"));
    assertThrows(IllegalArgumentException.class, () -> queue.clean(-1));
  }

  static TaskView awaitTerminal(TaskQueue queue, String id, Duration timeout) throws Exception {
    long end = System.currentTimeMillis() + timeout.toMillis();
    TaskView last = queue.getStatus(id);
    while (!last.isTerminal() && System.currentTimeMillis() < end) {
      Thread.sleep(5);
      last = queue.getStatus(id);
    }
    assertTrue(last.isTerminal(), "Timeout waiting for " + id + ", last seen " + last);
    return last;
  }

  static TaskView awaitStatus(TaskQueue queue, String id, TaskStatus desired, Duration timeout)
      throws Exception {
    long end = System.currentTimeMillis() + timeout.toMillis();
    TaskView last = null;
    while (System.currentTimeMillis() < end) {
      var v = queue.find(id);
      if (v.isPresent()) {
        last = v.get();
        if (last.status() == desired) return last;
      }
      Thread.sleep(20);
    }
    fail("Timeout waiting for status " + desired + ", last seen " + last);
    return null; // Unreachable
  }

  static final class BrokenResult {
    public String getValue() {
      throw new AssertionError("getter broke");
    }
  }
}
