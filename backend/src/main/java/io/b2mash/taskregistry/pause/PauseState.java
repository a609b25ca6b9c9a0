package io.b2mash.taskregistry.pause;

/** Registry pause state with validated transitions. */
public enum PauseState {
  ACTIVE,
  PAUSED;

  /** Returns true if transitioning from this state to the target is allowed. */
  public boolean canTransitionTo(PauseState target) {
    return target != this;
  }

  public boolean isPaused() {
    return this == PAUSED;
  }
}
