package io.b2mash.taskregistry.access;

/**
 * Every mutating registry operation, with the role it requires and whether the registry must be
 * active for it to run.
 */
public enum TaskOperation {
  CREATE(Role.ANYONE, true),
  COMPLETE(Role.ASSIGNEE, true),
  DELETE(Role.ASSIGNEE, true),
  OWNER_DELETE(Role.OWNER, true),
  REASSIGN(Role.ASSIGNEE, true),
  UPDATE_DESCRIPTION(Role.ASSIGNEE, true),
  UPDATE_DUE_DATE(Role.ASSIGNEE, true),
  UPDATE_PRIORITY(Role.ASSIGNEE, true),
  PAUSE(Role.OWNER, false),
  RESUME(Role.OWNER, false);

  private final Role requiredRole;
  private final boolean requiresActive;

  TaskOperation(Role requiredRole, boolean requiresActive) {
    this.requiredRole = requiredRole;
    this.requiresActive = requiresActive;
  }

  public Role requiredRole() {
    return requiredRole;
  }

  /** True if the operation is blocked while the registry is paused. */
  public boolean requiresActive() {
    return requiresActive;
  }
}
