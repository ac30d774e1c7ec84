package com.github.dimitryivaniuta.eventreg.server.keys;

import com.nimbusds.jose.jwk.RSAKey;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * An RSA key pair with its lifecycle metadata. The key id doubles as the JWS {@code kid}.
 */
@Value
@Builder
public class SigningKey {

    String id;

    /** Private + public RSA key, {@code keyID} equal to {@link #id}. */
    RSAKey key;

    KeyStatus status;

    Instant createdAt;

    Instant expiresAt;

    /** Whether the key is at least {@code maxAge} old at {@code now}. */
    public boolean isOlderThan(final Duration maxAge, final Instant now) {
        return !createdAt.plus(maxAge).isAfter(now);
    }

    /** Public half of the key, safe to publish. */
    public RSAKey publicKey() {
        return key.toPublicJWK();
    }
}
