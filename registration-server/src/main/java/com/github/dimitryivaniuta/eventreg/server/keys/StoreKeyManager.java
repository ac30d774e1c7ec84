package com.github.dimitryivaniuta.eventreg.server.keys;

import com.github.dimitryivaniuta.eventreg.server.config.KeyProperties;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Key manager backed by a {@link SigningKeyStore}. Nothing is cached in process: every call
 * reads the store, so all instances sharing the store observe a rotation at once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StoreKeyManager implements KeyManager {

    /** RSA modulus size of generated keys. */
    static final int KEY_SIZE = 2048;

    private final Clock clock;

    private final KeyProperties properties;

    private final SigningKeyStore store;

    @Override
    public Mono<SigningKey> getSigningKey() {
        return store.findActive(clock.instant())
                .switchIfEmpty(Mono.error(() -> new NoSigningKeyException("no active signing key")));
    }

    @Override
    public Mono<RSAKey> getVerifyingKey(final String kid) {
        if (kid == null || kid.isBlank()) {
            return Mono.empty();
        }
        return store.findValid(kid, clock.instant()).map(SigningKey::publicKey);
    }

    @Override
    public Mono<SigningKey> rotate(final boolean clearOld) {
        // Generate before touching storage so a failure leaves the current key in place.
        return Mono.fromCallable(this::generate)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(key -> store.rotate(key, clearOld).thenReturn(key))
                .doOnSuccess(key -> log.info("Rotated signing key; new kid={} expiresAt={} clearOld={}",
                        key.getId(), key.getExpiresAt(), clearOld))
                .doOnError(e -> log.warn("Signing key rotation failed; previous keys unchanged", e));
    }

    @Override
    public Mono<Boolean> rotateIfDue(final Duration maxAge) {
        return store.findActive(clock.instant())
                .map(active -> active.isOlderThan(maxAge, clock.instant()))
                .defaultIfEmpty(true)
                .flatMap(due -> due ? rotate(false).thenReturn(true) : Mono.just(false));
    }

    @Override
    public Mono<Long> pruneExpired() {
        return store.deleteExpired(clock.instant())
                .doOnNext(n -> {
                    if (n > 0) {
                        log.info("Pruned {} expired signing key(s)", n);
                    }
                });
    }

    @Override
    public Mono<JWKSet> publicKeys() {
        return store.findAllValid(clock.instant())
                .map(key -> (JWK) key.publicKey())
                .collectList()
                .map(JWKSet::new);
    }

    @Override
    public Mono<Boolean> hasSigningKey() {
        return store.findActive(clock.instant()).hasElement();
    }

    private SigningKey generate() throws NoSuchAlgorithmException {
        final KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(KEY_SIZE);
        final KeyPair pair = generator.generateKeyPair();
        final String kid = UUID.randomUUID().toString();
        final Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);

        final RSAKey rsa = new RSAKey.Builder((RSAPublicKey) pair.getPublic())
                .privateKey(pair.getPrivate())
                .keyID(kid)
                .keyUse(KeyUse.SIGNATURE)
                .algorithm(JWSAlgorithm.RS256)
                .build();

        return SigningKey.builder()
                .id(kid)
                .key(rsa)
                .status(KeyStatus.ACTIVE)
                .createdAt(now)
                .expiresAt(now.plus(properties.getKeyTtl()))
                .build();
    }
}
