package io.b2mash.taskregistry.context;

import io.b2mash.taskregistry.access.Principal;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * Continues a servlet {@link FilterChain} with a caller bound in {@link RequestScopes}. Checked
 * exceptions from {@code doFilter()} propagate unchanged and the binding is removed on any exit
 * path.
 */
public final class ScopedFilterChain {

  private ScopedFilterChain() {}

  public static void runAs(
      Principal caller,
      FilterChain chain,
      HttpServletRequest request,
      HttpServletResponse response)
      throws ServletException, IOException {
    Principal previous = RequestScopes.bind(caller);
    try {
      chain.doFilter(request, response);
    } finally {
      RequestScopes.restore(previous);
    }
  }
}
