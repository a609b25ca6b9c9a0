package io.b2mash.taskregistry.event;

import java.time.Instant;
import java.util.Map;

public record TaskReassignedEvent(
    long taskId, String actor, Instant occurredAt, String previousAssignee, String newAssignee)
    implements RegistryEvent {

  @Override
  public String eventType() {
    return "task.reassigned";
  }

  @Override
  public Map<String, Object> details() {
    return Map.of("previousAssignee", previousAssignee, "newAssignee", newAssignee);
  }
}
