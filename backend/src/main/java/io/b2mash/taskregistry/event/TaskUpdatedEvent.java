package io.b2mash.taskregistry.event;

import io.b2mash.taskregistry.task.TaskPriority;
import java.time.Instant;
import java.util.Map;

/**
 * Published by every single-field update. Always carries the full current description, due date
 * and priority, whichever field changed.
 */
public record TaskUpdatedEvent(
    long taskId,
    String actor,
    Instant occurredAt,
    String description,
    long dueDate,
    TaskPriority priority)
    implements RegistryEvent {

  @Override
  public String eventType() {
    return "task.updated";
  }

  @Override
  public Map<String, Object> details() {
    return Map.of("description", description, "dueDate", dueDate, "priority", priority.name());
  }
}
