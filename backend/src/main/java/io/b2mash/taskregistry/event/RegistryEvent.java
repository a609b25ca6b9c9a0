package io.b2mash.taskregistry.event;

import java.time.Instant;
import java.util.Map;

/**
 * Base interface for all registry notifications published via Spring ApplicationEventPublisher.
 * Implementations are records holding plain values only, never live {@code Task} slots, so an
 * event stays valid after the registry lock is released.
 *
 * <p>Events carry enough context for any consumer to act without reading the registry again.
 */
public sealed interface RegistryEvent
    permits TaskCreatedEvent,
        TaskCompletedEvent,
        TaskDeletedEvent,
        TaskReassignedEvent,
        TaskUpdatedEvent,
        RegistryPausedEvent,
        RegistryResumedEvent {

  String eventType();

  /** Task identifier, or 0 for registry-level events. */
  long taskId();

  /** Principal whose call emitted the event. */
  String actor();

  Instant occurredAt();

  Map<String, Object> details();
}
