package com.mk.fx.qa.task.execution.service.impl;

import com.mk.fx.qa.task.execution.cfg.TaskProcessingCfg;
import com.mk.fx.qa.task.execution.dto.request.CreateTaskRequest;
import com.mk.fx.qa.task.execution.dto.response.QueueStatusResponse;
import com.mk.fx.qa.task.execution.exception.InvalidTaskIdException;
import com.mk.fx.qa.task.execution.exception.ServiceShutdownException;
import com.mk.fx.qa.task.execution.exception.ShutdownTimeoutException;
import com.mk.fx.qa.task.execution.model.Task;
import com.mk.fx.qa.task.execution.model.TaskStatus;
import com.mk.fx.qa.task.execution.repository.TaskRepository;
import com.mk.fx.qa.task.execution.service.TaskService;
import com.mk.fx.qa.task.execution.worker.TaskWorkerPool;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Default {@link TaskService}: stores tasks in a {@link TaskRepository} and feeds their ids to a
 * {@link TaskWorkerPool}, which is started on construction.
 *
 * <p>Thread-safety: all methods may be called concurrently. Task state lives in the repository;
 * the only local state is the accepting flag.
 */
@Slf4j
@Service
public class TaskServiceImpl implements TaskService {

  private final TaskRepository repository;
  private final TaskProcessingCfg properties;
  private final TaskWorkerPool workerPool;
  private final AtomicBoolean acceptingTasks = new AtomicBoolean(true);

  public TaskServiceImpl(TaskRepository repository, TaskProcessingCfg properties) {
    this.repository = repository;
    this.properties = properties;
    this.workerPool = new TaskWorkerPool(repository, properties);
    this.workerPool.start();
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "TaskService initialised with workers={} queueCapacity={} processingDelay={}",
        workerPool.getWorkerCount(),
        properties.getQueueCapacity(),
        properties.getProcessingDelay());
  }

  @Override
  public Task createTask(CreateTaskRequest request) {
    if (!acceptingTasks.get()) {
      log.warn("Task creation rejected, service is shutting down");
      throw new ServiceShutdownException("Service is not accepting new tasks");
    }

    Task task =
        repository.create(
            Task.create(request.getTitle(), request.getDescription(), Instant.now()));
    log.info("Task {} created with status {}", task.getId(), task.getStatus());

    workerPool.enqueue(task.getId());
    return task;
  }

  @Override
  public List<Task> listTasks() {
    return repository.list();
  }

  @Override
  public List<Task> listTasks(TaskStatus status) {
    return repository.list().stream()
        .filter(task -> task.getStatus() == status)
        .collect(Collectors.toList());
  }

  @Override
  public Task getTask(String id) {
    validateId(id);
    Task task = repository.get(id);
    log.info("Task {} retrieved with status {}", task.getId(), task.getStatus());
    return task;
  }

  @Override
  public void deleteTask(String id) {
    validateId(id);
    repository.delete(id);
    log.info("Task {} deleted", id);
  }

  private static void validateId(String id) {
    if (id == null || id.isBlank()) {
      throw new InvalidTaskIdException("Task ID is required");
    }
    try {
      Long.parseLong(id);
    } catch (NumberFormatException e) {
      throw new InvalidTaskIdException("Invalid task ID format: " + id);
    }
  }

  @Override
  public QueueStatusResponse getQueueStatus() {
    return new QueueStatusResponse(
        workerPool.getQueueSize(), workerPool.getBusyWorkers(), acceptingTasks.get());
  }

  @Override
  public boolean isHealthy() {
    return acceptingTasks.get() && !workerPool.isStopped();
  }

  @Override
  public void shutdown(Duration timeout) {
    if (acceptingTasks.compareAndSet(true, false)) {
      log.info("Shutting down task service");
    }
    boolean finished;
    try {
      finished = workerPool.stop(timeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ShutdownTimeoutException("Interrupted while waiting for workers to stop", e);
    }
    if (!finished) {
      throw new ShutdownTimeoutException(
          "Workers did not stop within " + timeout.toMillis() + "ms");
    }
    log.info("Task service stopped");
  }

  @PreDestroy
  void onShutdown() {
    try {
      shutdown(properties.getShutdownTimeout());
    } catch (ShutdownTimeoutException e) {
      log.error("Error shutting down task service: {}", e.getMessage());
    }
  }
}
