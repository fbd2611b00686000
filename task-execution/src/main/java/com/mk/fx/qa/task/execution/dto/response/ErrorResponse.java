package com.mk.fx.qa.task.execution.dto.response;

/**
 * Body returned for every failed API call.
 *
 * @param error short title of the failure, e.g. {@code Not Found}
 * @param details human readable explanation shown to the client
 */
public record ErrorResponse(String error, String details) {}
