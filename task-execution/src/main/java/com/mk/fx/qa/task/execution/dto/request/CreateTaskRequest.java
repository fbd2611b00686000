package com.mk.fx.qa.task.execution.dto.request;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of a task creation request. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateTaskRequest {

  @NotEmpty private String title;

  @NotEmpty private String description;
}
