package io.b2mash.taskregistry.task;

import io.b2mash.taskregistry.access.Principal;
import io.b2mash.taskregistry.access.TaskOperation;
import io.b2mash.taskregistry.event.TaskCompletedEvent;
import io.b2mash.taskregistry.event.TaskCreatedEvent;
import io.b2mash.taskregistry.event.TaskDeletedEvent;
import io.b2mash.taskregistry.event.TaskReassignedEvent;
import io.b2mash.taskregistry.event.TaskUpdatedEvent;
import io.b2mash.taskregistry.exception.InvalidRequestException;
import io.b2mash.taskregistry.registry.RegistryGuard;
import io.b2mash.taskregistry.registry.RegistryState;
import java.time.Clock;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Task lifecycle operations. Each call holds the registry write lock for its full gate, mutate and
 * publish sequence; every gate runs before the first state change, so a rejected call leaves the
 * store and both counters untouched.
 */
@Service
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  private final RegistryState state;
  private final RegistryGuard guard;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public TaskService(
      RegistryState state,
      RegistryGuard guard,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.state = state;
    this.guard = guard;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /** Creates a task assigned to {@code caller} and returns it. */
  public TaskSnapshot createTask(
      Principal caller, String description, long dueDate, TaskPriority priority) {
    Objects.requireNonNull(priority, "priority");
    return state.write(
        () -> {
          guard.check(caller, TaskOperation.CREATE);
          var now = clock.instant();
          var task =
              state
                  .taskStore()
                  .create(description, dueDate, priority, caller, now.getEpochSecond());

          log.info(
              "Created task {} for {} (dueDate={}, priority={})",
              task.getId(),
              caller,
              dueDate,
              priority);
          eventPublisher.publishEvent(
              new TaskCreatedEvent(
                  task.getId(),
                  caller.value(),
                  now,
                  task.getDescription(),
                  caller.value(),
                  task.getDueDate(),
                  task.getPriority(),
                  task.getCreatedAt()));
          return task.snapshot();
        });
  }

  public TaskSnapshot completeTask(Principal caller, long taskId) {
    return state.write(
        () -> {
          var task = guard.checkTask(caller, taskId, TaskOperation.COMPLETE);
          task.complete();

          log.info("Task {} completed by {}", taskId, caller);
          eventPublisher.publishEvent(
              new TaskCompletedEvent(taskId, caller.value(), clock.instant()));
          return task.snapshot();
        });
  }

  /** Deletes a task on behalf of its assignee. */
  public void deleteTask(Principal caller, long taskId) {
    delete(caller, taskId, TaskOperation.DELETE);
  }

  /** Deletes any task on behalf of the registry owner. */
  public void ownerDeleteTask(Principal caller, long taskId) {
    delete(caller, taskId, TaskOperation.OWNER_DELETE);
  }

  public TaskSnapshot reassignTask(Principal caller, long taskId, Principal newAssignee) {
    Objects.requireNonNull(newAssignee, "newAssignee");
    if (newAssignee.isNone()) {
      throw new InvalidRequestException("newAssignee must not be blank");
    }
    return state.write(
        () -> {
          var task = guard.checkTask(caller, taskId, TaskOperation.REASSIGN);
          Principal previous = task.getAssignedTo();
          task.reassign(newAssignee);

          log.info("Task {} reassigned from {} to {}", taskId, previous, newAssignee);
          eventPublisher.publishEvent(
              new TaskReassignedEvent(
                  taskId, caller.value(), clock.instant(), previous.value(), newAssignee.value()));
          return task.snapshot();
        });
  }

  public TaskSnapshot updateDescription(Principal caller, long taskId, String description) {
    return update(
        caller,
        taskId,
        TaskOperation.UPDATE_DESCRIPTION,
        task -> task.updateDescription(description));
  }

  public TaskSnapshot updateDueDate(Principal caller, long taskId, long dueDate) {
    return update(
        caller, taskId, TaskOperation.UPDATE_DUE_DATE, task -> task.updateDueDate(dueDate));
  }

  public TaskSnapshot updatePriority(Principal caller, long taskId, TaskPriority priority) {
    Objects.requireNonNull(priority, "priority");
    return update(
        caller, taskId, TaskOperation.UPDATE_PRIORITY, task -> task.updatePriority(priority));
  }

  // --- Private helpers ---

  private void delete(Principal caller, long taskId, TaskOperation operation) {
    state.writeAndRun(
        () -> {
          guard.checkTask(caller, taskId, operation);
          state.taskStore().clear(taskId);

          boolean byOwner = operation == TaskOperation.OWNER_DELETE;
          log.info(
              "Task {} deleted by {}{} (live={})",
              taskId,
              caller,
              byOwner ? " as owner" : "",
              state.taskStore().liveCount());
          eventPublisher.publishEvent(
              new TaskDeletedEvent(taskId, caller.value(), clock.instant(), byOwner));
        });
  }

  private TaskSnapshot update(
      Principal caller, long taskId, TaskOperation operation, Consumer<Task> change) {
    return state.write(
        () -> {
          var task = guard.checkTask(caller, taskId, operation);
          change.accept(task);

          log.debug("Task {} updated by {} ({})", taskId, caller, operation);
          eventPublisher.publishEvent(
              new TaskUpdatedEvent(
                  taskId,
                  caller.value(),
                  clock.instant(),
                  task.getDescription(),
                  task.getDueDate(),
                  task.getPriority()));
          return task.snapshot();
        });
  }
}
