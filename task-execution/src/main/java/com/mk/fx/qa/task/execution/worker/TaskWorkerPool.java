package com.mk.fx.qa.task.execution.worker;

import com.mk.fx.qa.task.execution.cfg.TaskProcessingCfg;
import com.mk.fx.qa.task.execution.exception.TaskNotFoundException;
import com.mk.fx.qa.task.execution.exception.TaskQueueUnavailableException;
import com.mk.fx.qa.task.execution.model.Task;
import com.mk.fx.qa.task.execution.repository.TaskRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Fixed set of worker threads draining a bounded queue of task ids.
 *
 * <p>Each worker loads its own copy of a dequeued task from the {@link TaskRepository}, moves it to
 * PROCESSING, waits for the configured processing delay and moves it to COMPLETED. Every transition
 * is written back through {@link TaskRepository#update(Task)}. A failed read or write is logged and
 * the task is abandoned in its last stored state while the worker moves on. Nothing is retried.
 *
 * <p>Stopping is cooperative. The stop signal is checked before each dequeue, while waiting on an
 * empty queue and during the processing delay. A worker that sees it exits without touching its
 * current task; a worker that already reached the completion step finishes it first.
 */
@Slf4j
public class TaskWorkerPool {

  static final String COMPLETION_RESULT = "Task completed successfully";
  static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

  private final TaskRepository repository;
  private final BlockingQueue<String> queue;
  private final ExecutorService workers;
  private final int workerCount;
  private final int queueCapacity;
  private final Duration processingDelay;
  private final Duration pollInterval;
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicInteger busyWorkers = new AtomicInteger();

  public TaskWorkerPool(TaskRepository repository, TaskProcessingCfg properties) {
    this.repository = repository;
    this.workerCount = clampWorkerCount(properties.getWorkerCount());
    Duration delay = properties.getProcessingDelay();
    this.processingDelay = delay.isNegative() ? Duration.ZERO : delay;
    this.pollInterval = clampPollInterval(properties.getPollInterval());
    this.queueCapacity = properties.getQueueCapacity();
    this.queue = new ArrayBlockingQueue<>(queueCapacity);
    this.workers = createExecutor(workerCount);
  }

  private static int clampWorkerCount(int requested) {
    if (requested < 1) {
      log.warn("Worker count {} is below 1, using a single worker", requested);
      return 1;
    }
    return requested;
  }

  private static Duration clampPollInterval(Duration requested) {
    if (requested == null || requested.isZero() || requested.isNegative()) {
      log.warn("Poll interval {} is not positive, using {}", requested, DEFAULT_POLL_INTERVAL);
      return DEFAULT_POLL_INTERVAL;
    }
    return requested;
  }

  private static ExecutorService createExecutor(int workerCount) {
    AtomicInteger sequence = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("task-worker-" + sequence.getAndIncrement());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(workerCount, threadFactory);
  }

  /** Starts the worker threads. Calling it again has no effect. */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    for (int i = 0; i < workerCount; i++) {
      int workerId = i;
      workers.execute(() -> runWorker(workerId));
    }
    log.info(
        "Started {} workers (queueCapacity={}, processingDelay={})",
        workerCount,
        queueCapacity,
        processingDelay);
  }

  /**
   * Hands a task id to the workers.
   *
   * <p>Tries a non-blocking offer first. When the queue is full and the calling thread has been
   * interrupted the call fails; otherwise it blocks until space frees up, with no upper bound.
   *
   * @throws TaskQueueUnavailableException if the caller was interrupted before the id was queued
   */
  public void enqueue(String taskId) {
    if (queue.offer(taskId)) {
      log.info("Task {} queued for processing", taskId);
      return;
    }
    if (Thread.currentThread().isInterrupted()) {
      throw new TaskQueueUnavailableException("Task queue is full");
    }
    log.warn("Task queue is full, task {} will be processed when space is available", taskId);
    try {
      queue.put(taskId);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TaskQueueUnavailableException("Interrupted while waiting for queue space", e);
    }
    log.info("Task {} queued for processing", taskId);
  }

  /**
   * Signals every worker to stop and waits up to {@code timeout} for all of them to exit.
   *
   * @return true if all workers exited in time; false if some are still running
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public boolean stop(Duration timeout) throws InterruptedException {
    if (stopSignal.getCount() > 0) {
      log.info("Stopping workers, {} tasks left in queue", queue.size());
    }
    stopSignal.countDown();
    workers.shutdown();
    return workers.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  public boolean isStopped() {
    return stopSignal.getCount() == 0;
  }

  public int getQueueSize() {
    return queue.size();
  }

  public int getBusyWorkers() {
    return busyWorkers.get();
  }

  public int getWorkerCount() {
    return workerCount;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  private void runWorker(int workerId) {
    log.info("Worker {} started", workerId);
    try {
      while (!isStopped()) {
        String taskId = queue.poll(pollInterval.toNanos(), TimeUnit.NANOSECONDS);
        if (taskId == null) {
          continue;
        }
        if (isStopped()) {
          log.info("Worker {} stopping, task {} left pending", workerId, taskId);
          return;
        }
        busyWorkers.incrementAndGet();
        MDC.put("taskId", taskId);
        try {
          if (!process(workerId, taskId)) {
            return;
          }
        } finally {
          MDC.remove("taskId");
          busyWorkers.decrementAndGet();
        }
      }
      log.info("Worker {} stopping due to shutdown signal", workerId);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.info("Worker {} interrupted, stopping", workerId);
    }
  }

  /**
   * Runs one task through PROCESSING and COMPLETED.
   *
   * @return false if the worker must exit because it was told to stop
   */
  private boolean process(int workerId, String taskId) throws InterruptedException {
    Task task;
    try {
      task = repository.get(taskId);
      task.markProcessing(Instant.now());
    } catch (TaskNotFoundException e) {
      log.warn("Task {} was removed before processing started", taskId);
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to start processing task {}", taskId, e);
      return true;
    }

    if (!persist(task)) {
      return true;
    }
    log.info(
        "Task {} processing started by worker {} at {}", taskId, workerId, task.getStartedAt());

    if (stopSignal.await(processingDelay.toNanos(), TimeUnit.NANOSECONDS)) {
      log.info("Task {} processing cancelled due to shutdown", taskId);
      return false;
    }

    task.markCompleted(Instant.now(), COMPLETION_RESULT);
    if (!persist(task)) {
      return true;
    }
    log.info(
        "Task {} completed: result='{}' durationMs={}",
        taskId,
        task.getResult(),
        task.getDurationMillis());
    return true;
  }

  private boolean persist(Task task) {
    try {
      repository.update(task);
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to update task {} to status {}", task.getId(), task.getStatus(), e);
      return false;
    }
  }
}
