package com.mk.fx.qa.task.execution.service.impl;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.task.execution.cfg.TaskProcessingCfg;
import com.mk.fx.qa.task.execution.dto.request.CreateTaskRequest;
import com.mk.fx.qa.task.execution.exception.InvalidTaskIdException;
import com.mk.fx.qa.task.execution.exception.ServiceShutdownException;
import com.mk.fx.qa.task.execution.exception.ShutdownTimeoutException;
import com.mk.fx.qa.task.execution.exception.TaskNotFoundException;
import com.mk.fx.qa.task.execution.model.Task;
import com.mk.fx.qa.task.execution.model.TaskStatus;
import com.mk.fx.qa.task.execution.repository.BlockingTaskRepository;
import com.mk.fx.qa.task.execution.repository.InMemoryTaskRepository;
import com.mk.fx.qa.task.execution.repository.TaskRepository;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TaskServiceImplTest {

  private TaskServiceImpl service;

  private static TaskProcessingCfg cfg(int workers, Duration delay, int capacity) {
    TaskProcessingCfg cfg = new TaskProcessingCfg();
    cfg.setWorkerCount(workers);
    cfg.setProcessingDelay(delay);
    cfg.setQueueCapacity(capacity);
    cfg.setPollInterval(Duration.ofMillis(10));
    cfg.setShutdownTimeout(Duration.ofSeconds(2));
    return cfg;
  }

  private static CreateTaskRequest request(String title) {
    return new CreateTaskRequest(title, "D");
  }

  private TaskServiceImpl newService(TaskRepository repository, TaskProcessingCfg cfg) {
    service = new TaskServiceImpl(repository, cfg);
    return service;
  }

  @AfterEach
  void tearDown() {
    if (service != null) {
      service.onShutdown();
    }
  }

  private void awaitStatus(String id, TaskStatus status) {
    Awaitility.await()
        .atMost(5, TimeUnit.SECONDS)
        .pollInterval(20, TimeUnit.MILLISECONDS)
        .until(() -> service.getTask(id).getStatus() == status);
  }

  @Test
  void createTask_returnsPendingTaskWithoutStartTimestamps() {
    newService(new InMemoryTaskRepository(), cfg(1, Duration.ofMinutes(2), 10));

    Task task = service.createTask(request("T"));

    assertEquals(TaskStatus.PENDING, task.getStatus());
    assertNotNull(task.getId());
    assertNotNull(task.getCreatedAt());
    assertNull(task.getStartedAt());
    assertNull(task.getCompletedAt());
    assertNull(task.getDurationMillis());

    TaskStatus current = service.getTask(task.getId()).getStatus();
    assertTrue(current == TaskStatus.PENDING || current == TaskStatus.PROCESSING);
  }

  @Test
  void createTask_withZeroDelay_completesWithResult() {
    newService(new InMemoryTaskRepository(), cfg(1, Duration.ZERO, 10));

    Task created = service.createTask(request("T"));
    awaitStatus(created.getId(), TaskStatus.COMPLETED);

    Task done = service.getTask(created.getId());
    assertEquals("Task completed successfully", done.getResult());
    assertNull(done.getError());
    assertNotNull(done.getStartedAt());
    assertNotNull(done.getCompletedAt());
    assertTrue(done.getDurationMillis() >= 0);
    assertTrue(done.getDurationMillis() < 1000);
  }

  @Test
  void completedTask_durationDoesNotChangeOnLaterReads() throws Exception {
    newService(new InMemoryTaskRepository(), cfg(2, Duration.ofMillis(50), 10));

    Task created = service.createTask(request("T"));
    awaitStatus(created.getId(), TaskStatus.COMPLETED);

    Long first = service.getTask(created.getId()).getDurationMillis();
    Thread.sleep(30);
    Long second = service.getTask(created.getId()).getDurationMillis();

    assertEquals(first, second);
    assertTrue(first >= 50);
  }

  @Test
  void processingTask_hasStartButNoCompletion() {
    newService(new InMemoryTaskRepository(), cfg(1, Duration.ofMinutes(2), 10));

    Task created = service.createTask(request("T"));
    awaitStatus(created.getId(), TaskStatus.PROCESSING);

    Task processing = service.getTask(created.getId());
    assertNotNull(processing.getStartedAt());
    assertNull(processing.getCompletedAt());
    assertNull(processing.getResult());
  }

  @Test
  void deleteTask_thenGet_throwsNotFound() {
    newService(new InMemoryTaskRepository(), cfg(1, Duration.ZERO, 10));
    Task created = service.createTask(request("T"));

    service.deleteTask(created.getId());

    assertThrows(TaskNotFoundException.class, () -> service.getTask(created.getId()));
    assertThrows(TaskNotFoundException.class, () -> service.deleteTask(created.getId()));
  }

  @Test
  void getAndDelete_withMalformedId_throwInvalidId() {
    newService(new InMemoryTaskRepository(), cfg(1, Duration.ZERO, 10));

    assertThrows(InvalidTaskIdException.class, () -> service.getTask("abc"));
    assertThrows(InvalidTaskIdException.class, () -> service.deleteTask("12x"));
    assertThrows(InvalidTaskIdException.class, () -> service.getTask(""));
    assertThrows(InvalidTaskIdException.class, () -> service.deleteTask(null));
    assertThrows(TaskNotFoundException.class, () -> service.getTask("999"));
  }

  @Test
  void listTasks_returnsAllAndFiltersByStatus() {
    newService(new InMemoryTaskRepository(), cfg(1, Duration.ZERO, 10));
    Task a = service.createTask(request("a"));
    Task b = service.createTask(request("b"));
    awaitStatus(a.getId(), TaskStatus.COMPLETED);
    awaitStatus(b.getId(), TaskStatus.COMPLETED);

    assertEquals(2, service.listTasks().size());
    assertEquals(2, service.listTasks(TaskStatus.COMPLETED).size());
    assertTrue(service.listTasks(TaskStatus.PENDING).isEmpty());
  }

  @Test
  void concurrentCreation_beyondQueueCapacity_drainsWithoutLosingTasks() throws Exception {
    newService(new InMemoryTaskRepository(), cfg(2, Duration.ZERO, 2));
    int total = 40;
    ExecutorService callers = Executors.newFixedThreadPool(8);
    Set<String> ids = ConcurrentHashMap.newKeySet();

    for (int i = 0; i < total; i++) {
      int n = i;
      callers.submit(() -> ids.add(service.createTask(request("task-" + n)).getId()));
    }
    callers.shutdown();
    assertTrue(callers.awaitTermination(10, TimeUnit.SECONDS));

    assertEquals(total, ids.size());
    for (String id : ids) {
      awaitStatus(id, TaskStatus.COMPLETED);
    }
    List<Task> all = service.listTasks();
    assertEquals(total, all.size());
    assertTrue(all.stream().allMatch(t -> t.getStatus().isTerminal()));
  }

  @Test
  void shutdown_withGenerousDeadline_succeedsAndRejectsNewTasks() {
    newService(new InMemoryTaskRepository(), cfg(2, Duration.ZERO, 10));
    Task created = service.createTask(request("T"));
    awaitStatus(created.getId(), TaskStatus.COMPLETED);
    assertTrue(service.isHealthy());

    assertDoesNotThrow(() -> service.shutdown(Duration.ofSeconds(2)));

    assertFalse(service.isHealthy());
    assertFalse(service.getQueueStatus().acceptingTasks());
    assertThrows(ServiceShutdownException.class, () -> service.createTask(request("late")));
    assertEquals(1, service.listTasks().size());
  }

  @Test
  void shutdown_interruptsProcessingDelay() {
    newService(new InMemoryTaskRepository(), cfg(1, Duration.ofMinutes(2), 10));
    Task created = service.createTask(request("T"));
    awaitStatus(created.getId(), TaskStatus.PROCESSING);

    assertDoesNotThrow(() -> service.shutdown(Duration.ofSeconds(2)));

    assertEquals(TaskStatus.PROCESSING, service.getTask(created.getId()).getStatus());
  }

  @Test
  void shutdown_deadlineShorterThanInFlightWork_throwsTimeout() throws Exception {
    BlockingTaskRepository repository = new BlockingTaskRepository();
    newService(repository, cfg(1, Duration.ZERO, 10));
    Task created = service.createTask(request("T"));
    assertTrue(repository.processingUpdateStarted.await(2, TimeUnit.SECONDS));

    assertThrows(ShutdownTimeoutException.class, () -> service.shutdown(Duration.ofMillis(20)));

    repository.release();
    assertDoesNotThrow(() -> service.shutdown(Duration.ofSeconds(2)));
    assertEquals(TaskStatus.PROCESSING, repository.get(created.getId()).getStatus());
  }

  @Test
  void queueStatus_reportsBusyWorkersAndQueuedTasks() {
    newService(new InMemoryTaskRepository(), cfg(1, Duration.ofMinutes(2), 10));
    Task running = service.createTask(request("running"));
    service.createTask(request("waiting"));
    awaitStatus(running.getId(), TaskStatus.PROCESSING);

    var status = service.getQueueStatus();
    assertEquals(1, status.busyWorkers());
    assertEquals(1, status.queueSize());
    assertTrue(status.acceptingTasks());
  }
}
