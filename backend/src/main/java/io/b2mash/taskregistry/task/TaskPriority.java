package io.b2mash.taskregistry.task;

/** Task priority. Filters compare by identity only; the declaration order carries no meaning. */
public enum TaskPriority {
  LOW,
  MEDIUM,
  HIGH
}
