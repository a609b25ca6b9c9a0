package io.b2mash.taskregistry.task;

import io.b2mash.taskregistry.access.Principal;
import io.b2mash.taskregistry.context.RequestScopes;
import io.b2mash.taskregistry.exception.InvalidRequestException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TaskController {

  private final TaskService taskService;
  private final TaskQueryService taskQueryService;

  public TaskController(TaskService taskService, TaskQueryService taskQueryService) {
    this.taskService = taskService;
    this.taskQueryService = taskQueryService;
  }

  @PostMapping("/api/tasks")
  public ResponseEntity<TaskResponse> createTask(@Valid @RequestBody CreateTaskRequest request) {
    Principal caller = RequestScopes.requireCaller();

    var task =
        taskService.createTask(
            caller, request.description(), request.dueDate(), request.priority());
    return ResponseEntity.created(URI.create("/api/tasks/" + task.id()))
        .body(TaskResponse.from(task));
  }

  @GetMapping("/api/tasks/{id}")
  public ResponseEntity<TaskResponse> getTask(@PathVariable long id) {
    return ResponseEntity.ok(TaskResponse.from(taskQueryService.getTask(id)));
  }

  @PatchMapping("/api/tasks/{id}/complete")
  public ResponseEntity<TaskResponse> completeTask(@PathVariable long id) {
    Principal caller = RequestScopes.requireCaller();

    return ResponseEntity.ok(TaskResponse.from(taskService.completeTask(caller, id)));
  }

  @DeleteMapping("/api/tasks/{id}")
  public ResponseEntity<Void> deleteTask(@PathVariable long id) {
    Principal caller = RequestScopes.requireCaller();

    taskService.deleteTask(caller, id);
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/api/owner/tasks/{id}")
  public ResponseEntity<Void> ownerDeleteTask(@PathVariable long id) {
    Principal caller = RequestScopes.requireCaller();

    taskService.ownerDeleteTask(caller, id);
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/api/tasks/{id}/assignee")
  public ResponseEntity<TaskResponse> reassignTask(
      @PathVariable long id, @Valid @RequestBody ReassignTaskRequest request) {
    Principal caller = RequestScopes.requireCaller();

    var newAssignee = requestPrincipal("newAssignee", request.newAssignee());
    var task = taskService.reassignTask(caller, id, newAssignee);
    return ResponseEntity.ok(TaskResponse.from(task));
  }

  @PutMapping("/api/tasks/{id}/description")
  public ResponseEntity<TaskResponse> updateDescription(
      @PathVariable long id, @Valid @RequestBody UpdateDescriptionRequest request) {
    Principal caller = RequestScopes.requireCaller();

    var task = taskService.updateDescription(caller, id, request.description());
    return ResponseEntity.ok(TaskResponse.from(task));
  }

  @PutMapping("/api/tasks/{id}/due-date")
  public ResponseEntity<TaskResponse> updateDueDate(
      @PathVariable long id, @Valid @RequestBody UpdateDueDateRequest request) {
    Principal caller = RequestScopes.requireCaller();

    var task = taskService.updateDueDate(caller, id, request.dueDate());
    return ResponseEntity.ok(TaskResponse.from(task));
  }

  @PutMapping("/api/tasks/{id}/priority")
  public ResponseEntity<TaskResponse> updatePriority(
      @PathVariable long id, @Valid @RequestBody UpdatePriorityRequest request) {
    Principal caller = RequestScopes.requireCaller();

    var task = taskService.updatePriority(caller, id, request.priority());
    return ResponseEntity.ok(TaskResponse.from(task));
  }

  @GetMapping("/api/tasks/mine")
  public ResponseEntity<TaskPageResponse> listMyTasks(
      @RequestParam(defaultValue = "0") @Min(0) int page,
      @RequestParam(defaultValue = "10") @Min(0) int size) {
    Principal caller = RequestScopes.requireCaller();

    return ResponseEntity.ok(TaskPageResponse.from(taskQueryService.listMine(caller, page, size)));
  }

  @GetMapping("/api/tasks/by-priority/{priority}")
  public ResponseEntity<List<Long>> listByPriority(@PathVariable TaskPriority priority) {
    return ResponseEntity.ok(taskQueryService.listByPriority(priority));
  }

  @GetMapping("/api/tasks/by-completion/{completed}")
  public ResponseEntity<List<Long>> listByCompletion(@PathVariable boolean completed) {
    return ResponseEntity.ok(taskQueryService.listByCompletion(completed));
  }

  @GetMapping("/api/tasks/count-by-assignee")
  public ResponseEntity<AssigneeCountResponse> countByAssignee(
      @RequestParam @NotBlank String assignee) {
    var principal = requestPrincipal("assignee", assignee);
    return ResponseEntity.ok(
        new AssigneeCountResponse(
            principal.value(), taskQueryService.countByAssignee(principal)));
  }

  @GetMapping("/api/tasks/all")
  public ResponseEntity<AllTasksResponse> listAllTasks() {
    return ResponseEntity.ok(AllTasksResponse.from(taskQueryService.listAll()));
  }

  @GetMapping("/api/tasks/count")
  public ResponseEntity<TaskCountResponse> countTasks() {
    return ResponseEntity.ok(new TaskCountResponse(taskQueryService.count()));
  }

  private static Principal requestPrincipal(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidRequestException(field + " must not be blank");
    }
    return Principal.of(value);
  }

  // --- DTOs ---

  public record CreateTaskRequest(
      @Size(max = 10_000, message = "description must be at most 10000 characters")
          String description,
      @NotNull(message = "dueDate is required") Long dueDate,
      @NotNull(message = "priority is required") TaskPriority priority) {}

  public record ReassignTaskRequest(
      @NotBlank(message = "newAssignee is required") String newAssignee) {}

  public record UpdateDescriptionRequest(
      @NotNull(message = "description is required")
          @Size(max = 10_000, message = "description must be at most 10000 characters")
          String description) {}

  public record UpdateDueDateRequest(@NotNull(message = "dueDate is required") Long dueDate) {}

  public record UpdatePriorityRequest(
      @NotNull(message = "priority is required") TaskPriority priority) {}

  public record TaskResponse(
      long id,
      String description,
      String assignedTo,
      boolean completed,
      long dueDate,
      TaskPriority priority,
      long createdAt) {

    public static TaskResponse from(TaskSnapshot task) {
      return new TaskResponse(
          task.id(),
          task.description(),
          task.assignedTo().value(),
          task.completed(),
          task.dueDate(),
          task.priority(),
          task.createdAt());
    }
  }

  public record TaskPageResponse(
      List<TaskResponse> content, int page, int size, int totalElements, boolean last) {

    public static TaskPageResponse from(TaskPage page) {
      return new TaskPageResponse(
          page.content().stream().map(TaskResponse::from).toList(),
          page.page(),
          page.size(),
          page.totalElements(),
          page.isLast());
    }
  }

  /** Column-wise dump of every slot; index {@code i} of each list describes identifier i + 1. */
  public record AllTasksResponse(
      List<Long> ids,
      List<String> descriptions,
      List<String> assignees,
      List<Boolean> completed,
      List<Long> dueDates,
      List<TaskPriority> priorities,
      List<Long> createdAts) {

    public static AllTasksResponse from(List<TaskSnapshot> tasks) {
      return new AllTasksResponse(
          tasks.stream().map(TaskSnapshot::id).toList(),
          tasks.stream().map(TaskSnapshot::description).toList(),
          tasks.stream().map(t -> t.assignedTo().value()).toList(),
          tasks.stream().map(TaskSnapshot::completed).toList(),
          tasks.stream().map(TaskSnapshot::dueDate).toList(),
          tasks.stream().map(TaskSnapshot::priority).toList(),
          tasks.stream().map(TaskSnapshot::createdAt).toList());
    }
  }

  public record AssigneeCountResponse(String assignee, long count) {}

  public record TaskCountResponse(long count) {}
}
