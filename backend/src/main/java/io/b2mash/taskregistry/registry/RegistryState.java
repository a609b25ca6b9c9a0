package io.b2mash.taskregistry.registry;

import io.b2mash.taskregistry.access.Principal;
import io.b2mash.taskregistry.pause.PauseState;
import io.b2mash.taskregistry.task.TaskStore;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * All mutable registry state: the fixed owner, the pause state and the task store with its two
 * counters. One instance is built at startup and injected into every service.
 *
 * <p>Mutations run under the exclusive write lock from their first gate check to their last event,
 * so no other call observes a partial update. Reads share the read lock.
 */
public class RegistryState {

  private final Principal owner;
  private final TaskStore taskStore;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private PauseState pauseState = PauseState.ACTIVE;

  public RegistryState(Principal owner) {
    this.owner = Objects.requireNonNull(owner, "owner");
    if (owner.isNone()) {
      throw new IllegalArgumentException("registry owner must not be the absent principal");
    }
    this.taskStore = new TaskStore();
  }

  public <T> T write(Supplier<T> operation) {
    lock.writeLock().lock();
    try {
      return operation.get();
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void writeAndRun(Runnable operation) {
    write(
        () -> {
          operation.run();
          return null;
        });
  }

  public <T> T read(Supplier<T> operation) {
    lock.readLock().lock();
    try {
      return operation.get();
    } finally {
      lock.readLock().unlock();
    }
  }

  public Principal owner() {
    return owner;
  }

  /** The task store. Callers must hold the read or write lock. */
  public TaskStore taskStore() {
    return taskStore;
  }

  /** Current pause state. Callers must hold the read or write lock. */
  public PauseState pauseState() {
    return pauseState;
  }

  /** Callers must hold the write lock. */
  public void pauseState(PauseState pauseState) {
    this.pauseState = Objects.requireNonNull(pauseState, "pauseState");
  }
}
