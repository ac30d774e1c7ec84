package com.github.dimitryivaniuta.eventreg.server;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the event registration server.
 * Bootstraps Spring WebFlux, reactive security and R2DBC persistence.
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
public class RegistrationServerApplication {

    /**
     * Launches the registration server.
     *
     * @param args command-line arguments passed to the application
     */
    public static void main(final String[] args) {
        SpringApplication.run(RegistrationServerApplication.class, args);
        log.info("Registration server started successfully.");
    }
}
