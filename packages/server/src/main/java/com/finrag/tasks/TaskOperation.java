package com.finrag.tasks;

import java.util.concurrent.Callable;

/**
 * A unit of work submitted to the {@link TaskQueue}. Arguments are bound by the caller through the
 * closure; the queue never inspects what the operation does.
 *
 * <p>Operations report failures by returning {@link TaskOutcome.Failure}. A thrown exception is
 * still captured as a failure, so a misbehaving operation cannot take down its worker.
 *
 * @param <T> type of the success value
 */
@FunctionalInterface
public interface TaskOperation<T> {

  TaskOutcome<T> run() throws Exception;

  /** Adapt a plain callable: its return value is the success value, a throw is the failure. */
  static <T> TaskOperation<T> of(Callable<T> callable) {
    return () -> TaskOutcome.success(callable.call());
  }
}
