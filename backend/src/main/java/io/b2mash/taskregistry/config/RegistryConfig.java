package io.b2mash.taskregistry.config;

import io.b2mash.taskregistry.access.Principal;
import io.b2mash.taskregistry.registry.RegistryState;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RegistryProperties.class)
public class RegistryConfig {

  private static final Logger log = LoggerFactory.getLogger(RegistryConfig.class);

  @Bean
  public RegistryState registryState(RegistryProperties properties) {
    var owner = Principal.of(properties.owner());
    log.info("Initialising task registry: owner={}, state=ACTIVE", owner);
    return new RegistryState(owner);
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
