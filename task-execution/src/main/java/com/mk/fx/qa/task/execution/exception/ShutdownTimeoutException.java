package com.mk.fx.qa.task.execution.exception;

/**
 * Workers did not finish before the shutdown deadline. They are not killed and may still be running
 * when this is thrown.
 */
public class ShutdownTimeoutException extends TaskServiceException {

  public ShutdownTimeoutException(String message) {
    super(message);
  }

  public ShutdownTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
