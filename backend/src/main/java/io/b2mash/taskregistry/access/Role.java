package io.b2mash.taskregistry.access;

/** The role a caller must hold for an operation. */
public enum Role {
  /** Any authenticated caller. */
  ANYONE,
  /** The principal a task is currently assigned to. */
  ASSIGNEE,
  /** The registry owner fixed at startup. */
  OWNER
}
