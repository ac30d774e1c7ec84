package com.github.dimitryivaniuta.eventreg.server.keys;

import com.github.dimitryivaniuta.eventreg.server.config.KeyProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Checks the active key every {@code check-period} and rotates it once it reaches
 * {@code interval} in age, or when there is none. Also prunes expired keys. On unless
 * {@code registration.keys.scheduled-rotation.enabled=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "registration.keys.scheduled-rotation", name = "enabled", havingValue = "true",
        matchIfMissing = true)
public class KeyRotationScheduler {

    private final KeyManager keyManager;

    private final KeyProperties properties;

    @Scheduled(fixedDelayString = "${registration.keys.scheduled-rotation.check-period:PT1H}")
    public void rotateWhenDue() {
        keyManager.rotateIfDue(properties.getScheduledRotation().getInterval())
                .zipWhen(rotated -> keyManager.pruneExpired())
                .subscribe(
                        result -> log.debug("Scheduled key check done; rotated={} pruned={}",
                                result.getT1(), result.getT2()),
                        e -> log.error("Scheduled key rotation failed", e));
    }
}
