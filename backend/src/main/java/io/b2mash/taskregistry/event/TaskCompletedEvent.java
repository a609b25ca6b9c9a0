package io.b2mash.taskregistry.event;

import java.time.Instant;
import java.util.Map;

public record TaskCompletedEvent(long taskId, String actor, Instant occurredAt)
    implements RegistryEvent {

  @Override
  public String eventType() {
    return "task.completed";
  }

  @Override
  public Map<String, Object> details() {
    return Map.of();
  }
}
