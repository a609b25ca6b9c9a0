package io.b2mash.taskregistry.registry;

import io.b2mash.taskregistry.access.AccessPolicy;
import io.b2mash.taskregistry.access.Principal;
import io.b2mash.taskregistry.access.TaskOperation;
import io.b2mash.taskregistry.exception.InvalidStateException;
import io.b2mash.taskregistry.exception.ResourceNotFoundException;
import io.b2mash.taskregistry.task.Task;
import org.springframework.stereotype.Component;

/**
 * Applies the registry gates for a mutating operation, in order: pause state, identifier range,
 * then role. Must be called while the registry write lock is held, before any state change.
 */
@Component
public class RegistryGuard {

  private final RegistryState state;
  private final AccessPolicy accessPolicy;

  public RegistryGuard(RegistryState state, AccessPolicy accessPolicy) {
    this.state = state;
    this.accessPolicy = accessPolicy;
  }

  /** Rejects {@code operation} if it requires an active registry and the registry is paused. */
  public void requireActive(TaskOperation operation) {
    if (operation.requiresActive() && state.pauseState().isPaused()) {
      throw new InvalidStateException(
          "Registry paused", "Cannot " + describe(operation) + " while the registry is paused");
    }
  }

  /** Gates an operation that does not reference a task. */
  public void check(Principal caller, TaskOperation operation) {
    requireActive(operation);
    accessPolicy.require(caller, state.owner(), Principal.NONE, operation);
  }

  /** Gates an operation on task {@code taskId} and returns its slot. */
  public Task checkTask(Principal caller, long taskId, TaskOperation operation) {
    requireActive(operation);
    Task task = state.taskStore().requireSlot(taskId);
    if (operation == TaskOperation.OWNER_DELETE && task.isCleared()) {
      throw new ResourceNotFoundException("Task", taskId);
    }
    accessPolicy.require(caller, state.owner(), task.getAssignedTo(), operation);
    return task;
  }

  private static String describe(TaskOperation operation) {
    return operation.name().toLowerCase().replace('_', ' ') + " task";
  }
}
