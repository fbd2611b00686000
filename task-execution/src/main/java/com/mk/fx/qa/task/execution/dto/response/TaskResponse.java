package com.mk.fx.qa.task.execution.dto.response;

import com.mk.fx.qa.task.execution.model.TaskStatus;
import java.time.Instant;

/**
 * API view of a task. Timestamps that have not been reached yet, and the duration of a task that
 * has not started, are null and left out of the JSON.
 *
 * @param duration processing time in milliseconds
 */
public record TaskResponse(
    String id,
    String title,
    String description,
    TaskStatus status,
    String result,
    String error,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Long duration) {}
