package io.b2mash.taskregistry.context;

import io.b2mash.taskregistry.access.Principal;
import java.util.function.Supplier;

/**
 * Request-scoped caller identity. Bound by {@code CallerFilter} from the authenticated token, read
 * by controllers. The caller is never taken from a request parameter or body.
 *
 * <p>A binding is visible only inside the {@code callAs}/{@code runAs} block that created it and is
 * restored to the enclosing value (or removed) on every exit path, exceptions included.
 */
public final class RequestScopes {

  private static final ThreadLocal<Principal> CALLER = new ThreadLocal<>();

  /** Returns the current caller. Throws if not bound by the filter chain. */
  public static Principal requireCaller() {
    Principal caller = CALLER.get();
    if (caller == null) {
      throw new CallerContextNotBoundException();
    }
    return caller;
  }

  /** Returns the current caller, or null if not bound. */
  public static Principal getCallerOrNull() {
    return CALLER.get();
  }

  public static boolean isCallerBound() {
    return CALLER.get() != null;
  }

  /** Runs {@code action} with {@code caller} bound, restoring the previous binding afterwards. */
  public static <T> T callAs(Principal caller, Supplier<T> action) {
    Principal previous = CALLER.get();
    CALLER.set(caller);
    try {
      return action.get();
    } finally {
      restore(previous);
    }
  }

  public static void runAs(Principal caller, Runnable action) {
    callAs(
        caller,
        () -> {
          action.run();
          return null;
        });
  }

  static Principal bind(Principal caller) {
    Principal previous = CALLER.get();
    CALLER.set(caller);
    return previous;
  }

  static void restore(Principal previous) {
    if (previous == null) {
      CALLER.remove();
    } else {
      CALLER.set(previous);
    }
  }

  private RequestScopes() {}
}
