package com.mk.fx.qa.task.execution.exception;

/** The supplied task id is missing or not a numeric identifier. */
public class InvalidTaskIdException extends TaskServiceException {

  public InvalidTaskIdException(String message) {
    super(message);
  }
}
