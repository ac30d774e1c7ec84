package com.github.dimitryivaniuta.eventreg.server.keys;

import java.time.Instant;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistent storage for signing keys.
 */
public interface SigningKeyStore {

    /** The ACTIVE key if it has not expired at {@code now}. */
    Mono<SigningKey> findActive(Instant now);

    /** Any key with id {@code id} that has not expired at {@code now}. */
    Mono<SigningKey> findValid(String id, Instant now);

    /** Every key that has not expired at {@code now}, newest first. */
    Flux<SigningKey> findAllValid(Instant now);

    /**
     * Atomically demotes the current ACTIVE key to RETIRED (or deletes every key when
     * {@code clearOld}) and stores {@code key} as the new ACTIVE key.
     */
    Mono<Void> rotate(SigningKey key, boolean clearOld);

    /** Deletes keys expired at {@code now}; returns how many were removed. */
    Mono<Long> deleteExpired(Instant now);
}
