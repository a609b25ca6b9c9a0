package io.b2mash.taskregistry.task;

import io.b2mash.taskregistry.access.Principal;

/**
 * Immutable copy of a task slot taken under the registry lock. A cleared slot surfaces with id 0
 * and default values; {@code priority} is null for such a slot.
 */
public record TaskSnapshot(
    long id,
    String description,
    Principal assignedTo,
    boolean completed,
    long dueDate,
    TaskPriority priority,
    long createdAt) {

  public boolean isCleared() {
    return id == 0;
  }
}
