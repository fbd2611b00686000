package com.mk.fx.qa.task.execution.resource;

import com.mk.fx.qa.task.execution.dto.request.CreateTaskRequest;
import com.mk.fx.qa.task.execution.dto.response.HealthResponse;
import com.mk.fx.qa.task.execution.dto.response.QueueStatusResponse;
import com.mk.fx.qa.task.execution.dto.response.TaskResponse;
import com.mk.fx.qa.task.execution.model.Task;
import com.mk.fx.qa.task.execution.model.TaskStatus;
import com.mk.fx.qa.task.execution.service.TaskService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Tasks", description = "Endpoints for creating, inspecting and deleting tasks")
@RestController
@RequestMapping("/api/v1/tasks")
@Validated
@RequiredArgsConstructor
public class TaskController {

  private final TaskService taskService;
  private final TaskMapper taskMapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Task lifecycle
  // -----------------------------------------------------
  @Operation(
      summary = "Create a task",
      description = "Stores a new task and queues it for asynchronous processing.")
  @PostMapping
  public ResponseEntity<TaskResponse> createTask(@Valid @RequestBody CreateTaskRequest request) {
    Task task = taskService.createTask(request);
    return responseFactory.created(taskMapper.toResponse(task));
  }

  @Operation(summary = "List tasks", description = "Lists all tasks or filters by status.")
  @GetMapping
  public ResponseEntity<?> listTasks(@RequestParam(required = false) String status) {
    if (status == null) {
      return responseFactory.ok(taskMapper.toResponses(taskService.listTasks()));
    }
    try {
      TaskStatus taskStatus = TaskStatus.fromValue(status);
      return responseFactory.ok(taskMapper.toResponses(taskService.listTasks(taskStatus)));
    } catch (IllegalArgumentException ex) {
      log.warn("Invalid status filter: {}", status);
      List<String> allowed = Arrays.stream(TaskStatus.values()).map(TaskStatus::getValue).toList();
      return responseFactory.error(
          HttpStatus.BAD_REQUEST,
          "Invalid Status",
          "Unrecognized status: " + status + ". Allowed: " + allowed);
    }
  }

  @Operation(summary = "Get task", description = "Returns the current state of a task.")
  @GetMapping({"/", "/{taskId}"})
  public ResponseEntity<TaskResponse> getTask(@PathVariable(required = false) String taskId) {
    return responseFactory.ok(taskMapper.toResponse(taskService.getTask(taskId)));
  }

  @Operation(summary = "Delete task", description = "Removes a task regardless of its status.")
  @DeleteMapping({"/", "/{taskId}"})
  public ResponseEntity<Void> deleteTask(@PathVariable(required = false) String taskId) {
    taskService.deleteTask(taskId);
    return responseFactory.noContent();
  }

  // -----------------------------------------------------
  // Queue & health
  // -----------------------------------------------------
  @Operation(summary = "Queue status", description = "Returns current queue and worker load.")
  @GetMapping("/queue")
  public ResponseEntity<QueueStatusResponse> getQueueStatus() {
    return responseFactory.ok(taskService.getQueueStatus());
  }

  @Operation(summary = "Health check", description = "Verifies the service accepts tasks.")
  @GetMapping("/healthy")
  public ResponseEntity<HealthResponse> health() {
    boolean healthy = taskService.isHealthy();
    log.debug("Health check: {}", healthy ? "UP" : "DOWN");
    return responseFactory.ok(new HealthResponse(healthy ? "UP" : "DOWN"));
  }
}
