package com.mk.fx.qa.task.execution.resource;

import com.mk.fx.qa.task.execution.dto.response.TaskResponse;
import com.mk.fx.qa.task.execution.model.Task;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface TaskMapper {

  @Mapping(target = "duration", source = "durationMillis")
  TaskResponse toResponse(Task task);

  List<TaskResponse> toResponses(List<Task> tasks);
}
