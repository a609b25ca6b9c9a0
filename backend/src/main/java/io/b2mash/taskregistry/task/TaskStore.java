package io.b2mash.taskregistry.task;

import io.b2mash.taskregistry.access.Principal;
import io.b2mash.taskregistry.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Authoritative mapping from task identifier to task slot. Identifiers are assigned sequentially
 * from 1 and never reused: slot {@code id} lives at index {@code id - 1}, and deletion clears the
 * slot in place instead of removing it.
 *
 * <p>Keeps two counters: the monotonic {@link #taskCounter()} (highest id ever assigned) and the
 * {@link #liveCount()} of slots not deleted.
 *
 * <p>Not thread-safe. All access goes through {@code RegistryState}, which holds the lock.
 */
public class TaskStore {

  private final List<Task> slots = new ArrayList<>();
  private long liveCount;

  public Task create(
      String description,
      long dueDate,
      TaskPriority priority,
      Principal assignee,
      long createdAt) {
    long id = slots.size() + 1L;
    var task = new Task(id, description, assignee, dueDate, priority, createdAt);
    slots.add(task);
    liveCount++;
    return task;
  }

  /** True if {@code 1 <= id <= taskCounter}. Does not check whether the slot was deleted. */
  public boolean isValidId(long id) {
    return id >= 1 && id <= slots.size();
  }

  /** Returns the slot for {@code id}, cleared or not. Throws if the id was never assigned. */
  public Task requireSlot(long id) {
    if (!isValidId(id)) {
      throw new ResourceNotFoundException("Task", id);
    }
    return slots.get((int) (id - 1));
  }

  /** Clears the slot and decrements the live counter. The slot must not already be cleared. */
  public void clear(long id) {
    var task = requireSlot(id);
    if (task.isCleared()) {
      throw new IllegalStateException("Task slot " + id + " already cleared");
    }
    task.clear();
    liveCount--;
  }

  public long taskCounter() {
    return slots.size();
  }

  public long liveCount() {
    return liveCount;
  }

  /** All slots in ascending identifier order; slot {@code i} has identifier {@code i + 1}. */
  public List<Task> slots() {
    return Collections.unmodifiableList(slots);
  }
}
