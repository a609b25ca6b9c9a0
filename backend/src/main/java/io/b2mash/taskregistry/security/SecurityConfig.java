package io.b2mash.taskregistry.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Stateless API security. Every {@code /api/**} request needs a bearer JWT; its subject becomes
 * the caller principal via {@link CallerFilter}.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final CallerFilter callerFilter;
  private final CallerLoggingFilter callerLoggingFilter;

  public SecurityConfig(CallerFilter callerFilter, CallerLoggingFilter callerLoggingFilter) {
    this.callerFilter = callerFilter;
    this.callerLoggingFilter = callerLoggingFilter;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health/**", "/actuator/health")
                    .permitAll()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .oauth2ResourceServer(oauth2 -> oauth2.jwt(jwt -> {}))
        .addFilterAfter(callerFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(callerLoggingFilter, CallerFilter.class);

    return http.build();
  }
}
