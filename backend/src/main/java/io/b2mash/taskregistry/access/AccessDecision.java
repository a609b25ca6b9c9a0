package io.b2mash.taskregistry.access;

/** Outcome of an {@link AccessPolicy} evaluation. {@code reason} is null when allowed. */
public record AccessDecision(boolean allowed, String reason) {

  private static final AccessDecision ALLOW = new AccessDecision(true, null);

  public static AccessDecision allow() {
    return ALLOW;
  }

  public static AccessDecision deny(String reason) {
    return new AccessDecision(false, reason);
  }
}
