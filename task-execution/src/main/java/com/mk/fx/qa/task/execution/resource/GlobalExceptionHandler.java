package com.mk.fx.qa.task.execution.resource;

import com.mk.fx.qa.task.execution.dto.response.ErrorResponse;
import com.mk.fx.qa.task.execution.exception.InvalidTaskIdException;
import com.mk.fx.qa.task.execution.exception.ServiceShutdownException;
import com.mk.fx.qa.task.execution.exception.TaskNotFoundException;
import com.mk.fx.qa.task.execution.exception.TaskQueueUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps service errors to HTTP status codes and {@link ErrorResponse} bodies. */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

  private final ApiResponseFactory responseFactory;

  @ExceptionHandler(TaskNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(TaskNotFoundException ex) {
    log.info("Task not found: {}", ex.getTaskId());
    return responseFactory.error(HttpStatus.NOT_FOUND, "Not Found", "Task not found");
  }

  @ExceptionHandler(InvalidTaskIdException.class)
  public ResponseEntity<ErrorResponse> handleInvalidId(InvalidTaskIdException ex) {
    log.info("Invalid task id: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Invalid Task ID", ex.getMessage());
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<ErrorResponse> handleInvalidBody(Exception ex) {
    log.info("Invalid request body: {}", ex.getMessage());
    return responseFactory.error(
        HttpStatus.BAD_REQUEST, "Invalid Request", "Invalid request body");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Invalid argument: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage());
  }

  @ExceptionHandler(ServiceShutdownException.class)
  public ResponseEntity<ErrorResponse> handleShutdown(ServiceShutdownException ex) {
    log.warn("Request rejected: {}", ex.getMessage());
    return responseFactory.error(
        HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex.getMessage());
  }

  @ExceptionHandler(TaskQueueUnavailableException.class)
  public ResponseEntity<ErrorResponse> handleQueueUnavailable(TaskQueueUnavailableException ex) {
    log.error("Failed to create task", ex);
    return responseFactory.error(
        HttpStatus.INTERNAL_SERVER_ERROR, "Server Error", "Failed to create task");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
    if (ex instanceof org.springframework.web.ErrorResponse springError) {
      HttpStatus status = HttpStatus.valueOf(springError.getStatusCode().value());
      log.info("Request failed with {}: {}", status, ex.getMessage());
      return responseFactory.error(status, status.getReasonPhrase(), ex.getMessage());
    }
    log.error("Unhandled exception", ex);
    return responseFactory.error(
        HttpStatus.INTERNAL_SERVER_ERROR, "Server Error", ex.getMessage());
  }
}
