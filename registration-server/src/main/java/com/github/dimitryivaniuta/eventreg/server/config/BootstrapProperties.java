package com.github.dimitryivaniuta.eventreg.server.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * First administrator, created on startup while the {@code users} table is empty. Leaving
 * {@code admin-email} unset disables the bootstrap.
 */
@Data
@ConfigurationProperties(prefix = "registration.bootstrap")
public class BootstrapProperties {

    private String adminEmail;

    private String adminPassword;
}
