package com.github.dimitryivaniuta.eventreg.server.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the server's configuration properties.
 */
@Configuration
@EnableConfigurationProperties({
        TokenProperties.class,
        KeyProperties.class,
        SecurityProperties.class,
        BootstrapProperties.class,
})
public class PropertiesConfig {
    // no beans needed; we just register properties
}
