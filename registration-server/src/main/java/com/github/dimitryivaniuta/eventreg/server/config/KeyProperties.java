package com.github.dimitryivaniuta.eventreg.server.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Signing key lifecycle settings. {@link KeyLifetimeCheck} verifies them against the token TTL
 * at startup.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "registration.keys")
public class KeyProperties {

    /**
     * Lifetime of a generated key. Must exceed the access token TTL, otherwise a freshly rotated
     * key cannot sign anything.
     */
    @NotNull
    private Duration keyTtl = Duration.ofDays(365);

    /** Rotate once at startup when the store holds no active key. */
    private boolean rotateOnStartup = false;

    @Valid
    private ScheduledRotation scheduledRotation = new ScheduledRotation();

    @Data
    public static class ScheduledRotation {

        private boolean enabled = true;

        /** Age at which the active key is replaced. */
        @NotNull
        private Duration interval = Duration.ofDays(30);

        /** How often the key age is checked. */
        @NotNull
        private Duration checkPeriod = Duration.ofHours(1);
    }
}
