package io.b2mash.taskregistry.eventlog;

import java.time.Instant;
import java.util.Map;

/**
 * One recorded registry notification, as served by the event feed.
 *
 * @param sequence position in the feed, starting at 1 and never reused
 * @param taskId task identifier, or 0 for registry-level events
 */
public record RegistryEventEntry(
    long sequence,
    String eventType,
    long taskId,
    String actor,
    Instant occurredAt,
    Map<String, Object> details) {}
