package com.github.dimitryivaniuta.eventreg.server.keys;

import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Creates the first signing key on startup when the store has no active one. Enabled by
 * {@code registration.keys.rotate-on-startup=true}; never replaces an existing active key.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "registration.keys", name = "rotate-on-startup", havingValue = "true")
public class KeyBootstrapRunner implements ApplicationRunner {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final KeyManager keyManager;

    @Override
    public void run(final ApplicationArguments args) {
        final Boolean present = keyManager.hasSigningKey().block(TIMEOUT);
        if (Boolean.TRUE.equals(present)) {
            log.info("Active signing key present; startup rotation skipped");
            return;
        }
        log.info("No active signing key; rotating on startup");
        keyManager.rotate(false).block(TIMEOUT);
    }
}
