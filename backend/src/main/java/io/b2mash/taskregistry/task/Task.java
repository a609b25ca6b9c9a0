package io.b2mash.taskregistry.task;

import io.b2mash.taskregistry.access.Principal;
import io.b2mash.taskregistry.exception.TaskAlreadyCompletedException;
import java.util.Objects;

/**
 * A task slot in the {@link TaskStore}. Mutable, and only ever touched while the registry write
 * lock is held. Callers outside the store see {@link TaskSnapshot} copies.
 *
 * <p>A cleared slot (after deletion) keeps its position but every field is reset to its default:
 * id 0, empty description, {@link Principal#NONE} assignee, not completed, due date 0, no
 * priority, createdAt 0.
 */
public class Task {

  private long id;
  private String description;
  private Principal assignedTo;
  private boolean completed;
  private long dueDate;
  private TaskPriority priority;
  private long createdAt;

  Task(
      long id,
      String description,
      Principal assignedTo,
      long dueDate,
      TaskPriority priority,
      long createdAt) {
    this.id = id;
    this.description = description != null ? description : "";
    this.assignedTo = Objects.requireNonNull(assignedTo, "assignedTo");
    this.completed = false;
    this.dueDate = dueDate;
    this.priority = Objects.requireNonNull(priority, "priority");
    this.createdAt = createdAt;
  }

  // --- Lifecycle transition methods ---

  /** Marks this task complete. Completion is one-way; a second call is rejected. */
  public void complete() {
    if (completed) {
      throw new TaskAlreadyCompletedException(id);
    }
    this.completed = true;
  }

  public void reassign(Principal newAssignee) {
    this.assignedTo = Objects.requireNonNull(newAssignee, "newAssignee");
  }

  public void updateDescription(String description) {
    this.description = description != null ? description : "";
  }

  public void updateDueDate(long dueDate) {
    this.dueDate = dueDate;
  }

  public void updatePriority(TaskPriority priority) {
    this.priority = Objects.requireNonNull(priority, "priority");
  }

  /** Resets every field to its default value. */
  void clear() {
    this.id = 0;
    this.description = "";
    this.assignedTo = Principal.NONE;
    this.completed = false;
    this.dueDate = 0;
    this.priority = null;
    this.createdAt = 0;
  }

  public boolean isCleared() {
    return id == 0;
  }

  public TaskSnapshot snapshot() {
    return new TaskSnapshot(
        id, description, assignedTo, completed, dueDate, priority, createdAt);
  }

  // --- Getters ---

  public long getId() {
    return id;
  }

  public String getDescription() {
    return description;
  }

  public Principal getAssignedTo() {
    return assignedTo;
  }

  public boolean isCompleted() {
    return completed;
  }

  public long getDueDate() {
    return dueDate;
  }

  public TaskPriority getPriority() {
    return priority;
  }

  public long getCreatedAt() {
    return createdAt;
  }
}
