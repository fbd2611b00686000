package com.mk.fx.qa.task.execution.exception;

/** A task could not be handed to the worker queue before the caller gave up. */
public class TaskQueueUnavailableException extends TaskServiceException {

  public TaskQueueUnavailableException(String message) {
    super(message);
  }

  public TaskQueueUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
