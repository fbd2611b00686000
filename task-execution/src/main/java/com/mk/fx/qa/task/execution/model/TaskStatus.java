package com.mk.fx.qa.task.execution.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Lifecycle states of a {@link Task}. COMPLETED and FAILED are terminal. */
public enum TaskStatus {
  PENDING("pending"),
  PROCESSING("processing"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String value;

  TaskStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public static TaskStatus fromValue(String value) {
    return Arrays.stream(values())
        .filter(status -> status.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported task status: " + value));
  }
}
