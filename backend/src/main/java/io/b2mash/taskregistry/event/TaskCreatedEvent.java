package io.b2mash.taskregistry.event;

import io.b2mash.taskregistry.task.TaskPriority;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record TaskCreatedEvent(
    long taskId,
    String actor,
    Instant occurredAt,
    String description,
    String assignedTo,
    long dueDate,
    TaskPriority priority,
    long createdAt)
    implements RegistryEvent {

  @Override
  public String eventType() {
    return "task.created";
  }

  @Override
  public Map<String, Object> details() {
    var details = new LinkedHashMap<String, Object>();
    details.put("description", description);
    details.put("assignedTo", assignedTo);
    details.put("dueDate", dueDate);
    details.put("priority", priority.name());
    details.put("createdAt", createdAt);
    return details;
  }
}
