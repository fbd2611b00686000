package com.mk.fx.qa.task.execution.dto.response;

public record HealthResponse(String status) {}
