package io.b2mash.taskregistry.pause;

import io.b2mash.taskregistry.access.Principal;
import io.b2mash.taskregistry.access.TaskOperation;
import io.b2mash.taskregistry.event.RegistryPausedEvent;
import io.b2mash.taskregistry.event.RegistryResumedEvent;
import io.b2mash.taskregistry.exception.InvalidStateException;
import io.b2mash.taskregistry.registry.RegistryGuard;
import io.b2mash.taskregistry.registry.RegistryState;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/** Owner-controlled pause switch. Reads of the state are never gated. */
@Service
public class PauseService {

  private static final Logger log = LoggerFactory.getLogger(PauseService.class);

  private final RegistryState state;
  private final RegistryGuard guard;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public PauseService(
      RegistryState state,
      RegistryGuard guard,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.state = state;
    this.guard = guard;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  public void pause(Principal caller) {
    state.writeAndRun(
        () -> {
          guard.check(caller, TaskOperation.PAUSE);
          transition(PauseState.PAUSED, "pause");
          log.info("Registry paused by {}", caller);
          eventPublisher.publishEvent(new RegistryPausedEvent(caller.value(), clock.instant()));
        });
  }

  public void resume(Principal caller) {
    state.writeAndRun(
        () -> {
          guard.check(caller, TaskOperation.RESUME);
          transition(PauseState.ACTIVE, "resume");
          log.info("Registry resumed by {}", caller);
          eventPublisher.publishEvent(new RegistryResumedEvent(caller.value(), clock.instant()));
        });
  }

  public boolean isPaused() {
    return state.read(() -> state.pauseState().isPaused());
  }

  public Principal owner() {
    return state.owner();
  }

  private void transition(PauseState target, String action) {
    PauseState current = state.pauseState();
    if (!current.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid registry state", "Cannot " + action + " registry in state " + current);
    }
    state.pauseState(target);
  }
}
