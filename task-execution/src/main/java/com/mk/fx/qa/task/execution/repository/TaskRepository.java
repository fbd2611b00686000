package com.mk.fx.qa.task.execution.repository;

import com.mk.fx.qa.task.execution.exception.TaskNotFoundException;
import com.mk.fx.qa.task.execution.model.Task;
import java.util.List;

/**
 * Keyed storage for tasks. Implementations own id assignment and must make every operation atomic
 * with respect to the others.
 */
public interface TaskRepository {

  /** Assigns the next id to the task, stores it and returns the stored task. */
  Task create(Task task);

  /** Returns a snapshot of all stored tasks in no particular order. */
  List<Task> list();

  /**
   * @throws TaskNotFoundException if no task has the given id
   */
  Task get(String id);

  /**
   * Replaces the stored task with the same id. Tasks cannot be updated into existence.
   *
   * @throws TaskNotFoundException if no task has the task's id
   */
  Task update(Task task);

  /**
   * @throws TaskNotFoundException if no task has the given id
   */
  void delete(String id);
}
