package com.mk.fx.qa.task.execution.service;

import com.mk.fx.qa.task.execution.dto.request.CreateTaskRequest;
import com.mk.fx.qa.task.execution.dto.response.QueueStatusResponse;
import com.mk.fx.qa.task.execution.exception.InvalidTaskIdException;
import com.mk.fx.qa.task.execution.exception.ServiceShutdownException;
import com.mk.fx.qa.task.execution.exception.ShutdownTimeoutException;
import com.mk.fx.qa.task.execution.exception.TaskNotFoundException;
import com.mk.fx.qa.task.execution.exception.TaskQueueUnavailableException;
import com.mk.fx.qa.task.execution.model.Task;
import com.mk.fx.qa.task.execution.model.TaskStatus;
import java.time.Duration;
import java.util.List;

/** Creates, queries and deletes tasks and owns the lifecycle of the worker pool. */
public interface TaskService {

  /**
   * Stores a new PENDING task and queues it for asynchronous processing. Returns without waiting
   * for a worker.
   *
   * @throws ServiceShutdownException if shutdown has already begun
   * @throws TaskQueueUnavailableException if the task could not be queued
   */
  Task createTask(CreateTaskRequest request);

  List<Task> listTasks();

  /** Returns the tasks currently in the given status. */
  List<Task> listTasks(TaskStatus status);

  /**
   * @throws InvalidTaskIdException if the id is missing or not numeric
   * @throws TaskNotFoundException if no task has the id
   */
  Task getTask(String id);

  /**
   * @throws InvalidTaskIdException if the id is missing or not numeric
   * @throws TaskNotFoundException if no task has the id
   */
  void deleteTask(String id);

  QueueStatusResponse getQueueStatus();

  boolean isHealthy();

  /**
   * Stops accepting tasks, tells the workers to stop and waits up to {@code timeout} for them.
   *
   * @throws ShutdownTimeoutException if workers are still running when the timeout elapses
   */
  void shutdown(Duration timeout);
}
