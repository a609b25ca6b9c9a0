package io.b2mash.taskregistry.exception;

/**
 * Caller-visible error kinds. Every problem body carries one of these labels under the {@code
 * kind} property so that clients can branch without parsing titles.
 */
public enum ErrorKind {
  UNAUTHORIZED("Unauthorized"),
  NOT_FOUND("NotFound"),
  INVALID_STATE("InvalidState"),
  ALREADY_COMPLETED("AlreadyCompleted");

  public static final String PROPERTY = "kind";

  private final String label;

  ErrorKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
