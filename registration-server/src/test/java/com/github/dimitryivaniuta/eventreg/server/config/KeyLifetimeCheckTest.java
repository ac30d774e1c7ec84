package com.github.dimitryivaniuta.eventreg.server.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KeyLifetimeCheckTest {

    private KeyProperties keys;
    private TokenProperties tokens;

    @BeforeEach
    void setUp() {
        keys = new KeyProperties();
        tokens = new TokenProperties();
    }

    @Test
    void defaultsAreConsistent() {
        assertThatCode(() -> KeyLifetimeCheck.verify(keys, tokens)).doesNotThrowAnyException();
    }

    @Test
    void keyMustOutliveToken() {
        keys.setKeyTtl(Duration.ofDays(180));

        assertThatThrownBy(() -> KeyLifetimeCheck.verify(keys, tokens))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("key-ttl");
    }

    @Test
    void rotationIntervalMustLeaveRoomForAFullToken() {
        keys.getScheduledRotation().setInterval(Duration.ofDays(185));

        assertThatThrownBy(() -> KeyLifetimeCheck.verify(keys, tokens))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("interval");
    }

    @Test
    void checkPeriodCountsTowardsKeyAge() {
        keys.getScheduledRotation().setInterval(Duration.ofDays(185).minusMinutes(30));

        assertThatThrownBy(() -> KeyLifetimeCheck.verify(keys, tokens))
                .isInstanceOf(IllegalStateException.class);

        keys.getScheduledRotation().setCheckPeriod(Duration.ofMinutes(30));
        assertThatCode(() -> KeyLifetimeCheck.verify(keys, tokens)).doesNotThrowAnyException();
    }

    @Test
    void intervalIsIgnoredWithoutScheduledRotation() {
        keys.getScheduledRotation().setEnabled(false);
        keys.getScheduledRotation().setInterval(Duration.ofDays(400));

        assertThatCode(() -> KeyLifetimeCheck.verify(keys, tokens)).doesNotThrowAnyException();
    }
}
