package com.github.dimitryivaniuta.eventreg.server.keys;

import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import java.time.Duration;
import reactor.core.publisher.Mono;

/**
 * Lifecycle of the RSA keys that sign and verify tokens.
 */
public interface KeyManager {

    /**
     * @return the single ACTIVE, unexpired key; {@link NoSigningKeyException} when there is none
     */
    Mono<SigningKey> getSigningKey();

    /**
     * @param kid key id from a token header
     * @return public key of any unexpired key with that id, or empty when unknown or expired
     */
    Mono<RSAKey> getVerifyingKey(String kid);

    /**
     * Generates a fresh key and makes it the ACTIVE one.
     *
     * @param clearOld delete every existing key instead of retiring the active one, which
     *                 invalidates every token issued so far
     * @return the new key
     */
    Mono<SigningKey> rotate(boolean clearOld);

    /**
     * Rotates (retiring, not clearing) when there is no active key or the active key is at least
     * {@code maxAge} old.
     *
     * @return whether a rotation happened
     */
    Mono<Boolean> rotateIfDue(Duration maxAge);

    /** Deletes expired keys; emits how many were removed. */
    Mono<Long> pruneExpired();

    /** Public JWK set of every unexpired key. */
    Mono<JWKSet> publicKeys();

    /** Whether an ACTIVE, unexpired key exists. */
    Mono<Boolean> hasSigningKey();
}
