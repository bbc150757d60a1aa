package com.finrag.tasks;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/** {@link TaskStore} backed by a {@link HashMap} under a single read/write lock. */
public final class InMemoryTaskStore implements TaskStore {
  private final Map<String, TaskRecord> tasks = new HashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  @Override
  public void insert(TaskRecord record) {
    lock.writeLock().lock();
    try {
      if (tasks.containsKey(record.id)) {
        throw new IllegalStateException("Task " + record.id + " is already stored");
      }
      tasks.put(record.id, record);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public Optional<TaskView> get(String id) {
    if (id == null) return Optional.empty();
    lock.readLock().lock();
    try {
      TaskRecord record = tasks.get(id);
      return record == null ? Optional.empty() : Optional.of(record.snapshot());
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public boolean update(String id, RecordMutator mutator) {
    lock.writeLock().lock();
    try {
      TaskRecord record = tasks.get(id);
      if (record == null) return false;
      mutator.apply(record);
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<TaskView> list(Predicate<TaskView> filter) {
    lock.readLock().lock();
    try {
      List<TaskView> out = new ArrayList<>(tasks.size());
      for (TaskRecord record : tasks.values()) {
        TaskView view = record.snapshot();
        if (filter.test(view)) out.add(view);
      }
      return out;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public int deleteWhere(Predicate<TaskView> filter) {
    lock.writeLock().lock();
    try {
      int removed = 0;
      Iterator<TaskRecord> it = tasks.values().iterator();
      while (it.hasNext()) {
        if (filter.test(it.next().snapshot())) {
          it.remove();
          removed++;
        }
      }
      return removed;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public Map<TaskStatus, Long> countByStatus() {
    Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
    for (TaskStatus status : TaskStatus.values()) {
      counts.put(status, 0L);
    }
    lock.readLock().lock();
    try {
      for (TaskRecord record : tasks.values()) {
        counts.merge(record.status, 1L, Long::sum);
      }
    } finally {
      lock.readLock().unlock();
    }
    return counts;
  }

  /** Number of stored records. */
  public int size() {
    lock.readLock().lock();
    try {
      return tasks.size();
    } finally {
      lock.readLock().unlock();
    }
  }
}
