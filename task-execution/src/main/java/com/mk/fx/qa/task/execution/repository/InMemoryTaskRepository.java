package com.mk.fx.qa.task.execution.repository;

import com.mk.fx.qa.task.execution.exception.TaskNotFoundException;
import com.mk.fx.qa.task.execution.model.Task;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

/**
 * {@link TaskRepository} backed by a {@link HashMap} guarded by one read/write lock.
 *
 * <p>Tasks are copied on the way in and on the way out, so the stored value only changes through
 * {@link #update(Task)}.
 */
@Slf4j
@Repository
public class InMemoryTaskRepository implements TaskRepository {

  private final Map<String, Task> tasks = new HashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final SequentialTaskIdGenerator idGenerator;

  public InMemoryTaskRepository() {
    this(new SequentialTaskIdGenerator());
  }

  InMemoryTaskRepository(SequentialTaskIdGenerator idGenerator) {
    this.idGenerator = idGenerator;
  }

  @Override
  public Task create(Task task) {
    Objects.requireNonNull(task, "task cannot be null");
    lock.writeLock().lock();
    try {
      Task stored = task.withId(idGenerator.nextId());
      tasks.put(stored.getId(), stored);
      log.debug("Stored task {}", stored.getId());
      return stored.copy();
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<Task> list() {
    lock.readLock().lock();
    try {
      List<Task> snapshot = new ArrayList<>(tasks.size());
      for (Task task : tasks.values()) {
        snapshot.add(task.copy());
      }
      return snapshot;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Task get(String id) {
    lock.readLock().lock();
    try {
      Task task = tasks.get(id);
      if (task == null) {
        throw new TaskNotFoundException(id);
      }
      return task.copy();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Task update(Task task) {
    Objects.requireNonNull(task, "task cannot be null");
    lock.writeLock().lock();
    try {
      if (task.getId() == null || !tasks.containsKey(task.getId())) {
        throw new TaskNotFoundException(task.getId());
      }
      Task stored = task.copy();
      tasks.put(stored.getId(), stored);
      return stored.copy();
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public void delete(String id) {
    lock.writeLock().lock();
    try {
      if (tasks.remove(id) == null) {
        throw new TaskNotFoundException(id);
      }
      log.debug("Removed task {}", id);
    } finally {
      lock.writeLock().unlock();
    }
  }
}
