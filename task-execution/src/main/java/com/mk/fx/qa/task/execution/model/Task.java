package com.mk.fx.qa.task.execution.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A unit of asynchronous work and its state machine.
 *
 * <p>Transitions: PENDING → PROCESSING → COMPLETED/FAILED. Entering PROCESSING stamps
 * {@code startedAt} once; entering a terminal state stamps {@code completedAt}, which freezes the
 * derived processing duration.
 *
 * <p>Instances are not thread-safe. The repository hands out copies, so a caller only ever mutates
 * its own instance and publishes changes through {@code TaskRepository#update}.
 */
public class Task {

  private final String id;
  private final String title;
  private final String description;
  private final Instant createdAt;
  private TaskStatus status;
  private Instant startedAt;
  private Instant completedAt;
  private String result;
  private String error;

  private Task(
      String id,
      String title,
      String description,
      Instant createdAt,
      TaskStatus status,
      Instant startedAt,
      Instant completedAt,
      String result,
      String error) {
    this.id = id;
    this.title = title;
    this.description = description;
    this.createdAt = createdAt;
    this.status = status;
    this.startedAt = startedAt;
    this.completedAt = completedAt;
    this.result = result;
    this.error = error;
  }

  /**
   * Creates a new PENDING task without an id. The id is assigned when the task is stored.
   *
   * @throws IllegalArgumentException if title or description is null or empty
   */
  public static Task create(String title, String description, Instant createdAt) {
    return new Task(
        null,
        requireText(title, "title"),
        requireText(description, "description"),
        Objects.requireNonNull(createdAt, "createdAt cannot be null"),
        TaskStatus.PENDING,
        null,
        null,
        null,
        null);
  }

  private static String requireText(String value, String field) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException(field + " is required");
    }
    return value;
  }

  /** Returns a copy of this task carrying the given id. */
  public Task withId(String newId) {
    return new Task(
        Objects.requireNonNull(newId, "id cannot be null"),
        title,
        description,
        createdAt,
        status,
        startedAt,
        completedAt,
        result,
        error);
  }

  public Task copy() {
    return new Task(
        id, title, description, createdAt, status, startedAt, completedAt, result, error);
  }

  /**
   * Moves the task to PROCESSING. Re-entering PROCESSING keeps the original start time.
   *
   * @throws IllegalStateException if the task is already in a terminal state
   */
  public void markProcessing(Instant now) {
    if (status.isTerminal()) {
      throw new IllegalStateException(
          "Task " + id + " cannot move from " + status + " to " + TaskStatus.PROCESSING);
    }
    status = TaskStatus.PROCESSING;
    if (startedAt == null) {
      startedAt = now;
    }
  }

  /**
   * Moves a PROCESSING task to COMPLETED with the given result.
   *
   * @throws IllegalStateException if the task is not PROCESSING
   */
  public void markCompleted(Instant now, String outcome) {
    finish(TaskStatus.COMPLETED, now);
    this.result = outcome;
  }

  /**
   * Moves a PROCESSING task to FAILED with the given error text.
   *
   * @throws IllegalStateException if the task is not PROCESSING
   */
  public void markFailed(Instant now, String errorMessage) {
    finish(TaskStatus.FAILED, now);
    this.error = errorMessage;
  }

  private void finish(TaskStatus terminal, Instant now) {
    if (status != TaskStatus.PROCESSING) {
      throw new IllegalStateException(
          "Task " + id + " cannot move from " + status + " to " + terminal);
    }
    status = terminal;
    completedAt = now;
  }

  /**
   * Processing time in milliseconds: {@code (completedAt or now) - startedAt}. Null while the task
   * has not started.
   */
  public Long getDurationMillis() {
    if (startedAt == null) {
      return null;
    }
    Instant end = completedAt != null ? completedAt : Instant.now();
    return Math.max(0L, Duration.between(startedAt, end).toMillis());
  }

  public String getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public TaskStatus getStatus() {
    return status;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public String getResult() {
    return result;
  }

  public String getError() {
    return error;
  }

  @Override
  public String toString() {
    return "Task{id=" + id + ", status=" + status + ", title=" + title + "}";
  }
}
