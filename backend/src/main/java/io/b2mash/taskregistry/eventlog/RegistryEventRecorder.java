package io.b2mash.taskregistry.eventlog;

import io.b2mash.taskregistry.event.RegistryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Records every registry notification in the {@link RegistryEventLog}. Runs synchronously on the
 * publishing thread after the mutation has been applied. A recording failure is logged and never
 * propagates back into the mutation that emitted the event.
 */
@Component
public class RegistryEventRecorder {

  private static final Logger log = LoggerFactory.getLogger(RegistryEventRecorder.class);

  private final RegistryEventLog eventLog;

  public RegistryEventRecorder(RegistryEventLog eventLog) {
    this.eventLog = eventLog;
  }

  @EventListener
  public void onRegistryEvent(RegistryEvent event) {
    try {
      var entry = eventLog.append(event);
      log.debug(
          "Recorded {} #{} for task={} actor={}",
          entry.eventType(),
          entry.sequence(),
          entry.taskId(),
          entry.actor());
    } catch (RuntimeException e) {
      log.warn(
          "Failed to record {} event for task={}", event.eventType(), event.taskId(), e);
    }
  }
}
