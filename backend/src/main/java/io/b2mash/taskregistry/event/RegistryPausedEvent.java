package io.b2mash.taskregistry.event;

import java.time.Instant;
import java.util.Map;

public record RegistryPausedEvent(String actor, Instant occurredAt) implements RegistryEvent {

  @Override
  public String eventType() {
    return "registry.paused";
  }

  @Override
  public long taskId() {
    return 0;
  }

  @Override
  public Map<String, Object> details() {
    return Map.of("account", actor);
  }
}
