package com.finrag.tasks;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Storage for task state. Implementations own every {@link TaskRecord} they hold: all mutation goes
 * through {@link #update}, and every read hands out {@link TaskView} copies.
 */
public interface TaskStore {

  /**
   * Add a new record.
   *
   * @throws IllegalStateException if a record with the same id is already stored
   */
  void insert(TaskRecord record);

  Optional<TaskView> get(String id);

  /**
   * Atomically apply {@code mutator} to the record for {@code id}. Does nothing when the id is
   * absent, which happens if the task was cleaned up while it was still executing.
   *
   * @return true if a record was found and the mutator ran
   */
  boolean update(String id, RecordMutator mutator);

  /** Copies of all records matching {@code filter}, in no particular order. */
  List<TaskView> list(Predicate<TaskView> filter);

  /** Atomically remove every record matching {@code filter}; returns how many were removed. */
  int deleteWhere(Predicate<TaskView> filter);

  /** Number of records in each status, with every status present. Copies no task data. */
  Map<TaskStatus, Long> countByStatus();

  default List<TaskView> list() {
    return list(view -> true);
  }

  /** State change applied to a record while the store's lock is held. */
  @FunctionalInterface
  interface RecordMutator {
    void apply(TaskRecord record);
  }
}
