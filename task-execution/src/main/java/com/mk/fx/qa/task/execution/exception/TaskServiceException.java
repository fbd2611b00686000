package com.mk.fx.qa.task.execution.exception;

/** Base type for errors raised by the task store, scheduler and service. */
public abstract class TaskServiceException extends RuntimeException {

  protected TaskServiceException(String message) {
    super(message);
  }

  protected TaskServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
