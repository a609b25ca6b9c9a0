package io.b2mash.taskregistry.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Registry configuration.
 *
 * @param owner principal identifier of the registry owner, fixed for the lifetime of the process
 * @param eventLogCapacity maximum number of entries retained by the in-memory event feed
 */
@Validated
@ConfigurationProperties(prefix = "registry")
public record RegistryProperties(
    @NotBlank String owner, @DefaultValue("1000") @Min(1) int eventLogCapacity) {}
