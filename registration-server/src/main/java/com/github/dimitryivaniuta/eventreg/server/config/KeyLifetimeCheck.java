package com.github.dimitryivaniuta.eventreg.server.config;

import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

/**
 * Fails startup when keys would stop being able to sign tokens.
 *
 * <p>A token may only be signed by a key that outlives it, so the active key must always have
 * at least one access token TTL left. With scheduled rotation the active key gets at most
 * {@code interval + checkPeriod} old, which bounds the interval by {@code keyTtl - accessTokenTtl}.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KeyLifetimeCheck implements InitializingBean {

    private final KeyProperties keyProperties;

    private final TokenProperties tokenProperties;

    @Override
    public void afterPropertiesSet() {
        verify(keyProperties, tokenProperties);
        log.info("Key lifetime settings ok: keyTtl={} accessTokenTtl={} scheduledRotation={}",
                keyProperties.getKeyTtl(), tokenProperties.getAccessTokenTtl(),
                keyProperties.getScheduledRotation().isEnabled());
    }

    /**
     * @throws IllegalStateException describing the first inconsistent setting
     */
    static void verify(final KeyProperties keys, final TokenProperties tokens) {
        final Duration keyTtl = keys.getKeyTtl();
        final Duration tokenTtl = tokens.getAccessTokenTtl();
        if (keyTtl.compareTo(tokenTtl) <= 0) {
            throw new IllegalStateException("registration.keys.key-ttl (" + keyTtl
                    + ") must exceed registration.token.access-token-ttl (" + tokenTtl + ")");
        }
        final KeyProperties.ScheduledRotation rotation = keys.getScheduledRotation();
        if (!rotation.isEnabled()) {
            return;
        }
        final Duration signingWindow = keyTtl.minus(tokenTtl);
        final Duration maxKeyAge = rotation.getInterval().plus(rotation.getCheckPeriod());
        if (maxKeyAge.compareTo(signingWindow) > 0) {
            throw new IllegalStateException("registration.keys.scheduled-rotation.interval ("
                    + rotation.getInterval() + ") plus check-period (" + rotation.getCheckPeriod()
                    + ") must not exceed key-ttl minus access-token-ttl (" + signingWindow + ")");
        }
    }
}
