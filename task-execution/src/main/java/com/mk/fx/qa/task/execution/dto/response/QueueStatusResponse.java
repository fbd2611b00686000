package com.mk.fx.qa.task.execution.dto.response;

/**
 * Current load of the worker pool: ids waiting in the queue, workers busy with a task, and whether
 * new tasks are accepted.
 */
public record QueueStatusResponse(int queueSize, int busyWorkers, boolean acceptingTasks) {}
