package io.b2mash.taskregistry.event;

import java.time.Instant;
import java.util.Map;

/**
 * Published for both assignee and owner deletion; {@code byOwner} tells them apart.
 */
public record TaskDeletedEvent(long taskId, String actor, Instant occurredAt, boolean byOwner)
    implements RegistryEvent {

  @Override
  public String eventType() {
    return "task.deleted";
  }

  @Override
  public Map<String, Object> details() {
    return Map.of("byOwner", byOwner);
  }
}
