package com.mk.fx.qa.task.execution.exception;

public class ServiceShutdownException extends TaskServiceException {

  public ServiceShutdownException(String message) {
    super(message);
  }
}
