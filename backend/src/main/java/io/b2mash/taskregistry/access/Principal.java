package io.b2mash.taskregistry.access;

import java.util.Objects;

/**
 * Identity of a calling party (an account identifier such as a token subject). {@link #NONE} is
 * the absent identity carried by cleared task slots; no authenticated caller ever equals it.
 */
public record Principal(String value) {

  public static final Principal NONE = new Principal("");

  public Principal {
    Objects.requireNonNull(value, "value");
  }

  /** Creates a principal for a real caller. Blank identifiers are rejected. */
  public static Principal of(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("principal must not be blank");
    }
    return new Principal(value.strip());
  }

  public boolean isNone() {
    return value.isEmpty();
  }

  @Override
  public String toString() {
    return isNone() ? "<none>" : value;
  }
}
