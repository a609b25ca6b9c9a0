package io.b2mash.taskregistry.security;

import io.b2mash.taskregistry.access.Principal;
import io.b2mash.taskregistry.context.ScopedFilterChain;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the authenticated token subject as the request's caller. Runs after bearer-token
 * authentication; requests without a JWT authentication continue unbound.
 */
@Component
public class CallerFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(CallerFilter.class);

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Principal caller = resolveCaller();
    if (caller != null) {
      ScopedFilterChain.runAs(caller, filterChain, request, response);
      return;
    }

    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  private Principal resolveCaller() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      return null;
    }
    String subject = jwtAuth.getToken().getSubject();
    if (subject == null || subject.isBlank()) {
      log.warn("Authenticated token has no subject; caller left unbound");
      return null;
    }
    return Principal.of(subject);
  }
}
