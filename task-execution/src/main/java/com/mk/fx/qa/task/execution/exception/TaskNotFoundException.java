package com.mk.fx.qa.task.execution.exception;

public class TaskNotFoundException extends TaskServiceException {

  private final String taskId;

  public TaskNotFoundException(String taskId) {
    super("Task not found: " + taskId);
    this.taskId = taskId;
  }

  public String getTaskId() {
    return taskId;
  }
}
