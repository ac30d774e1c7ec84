package com.github.dimitryivaniuta.eventreg.server.keys;

import com.github.dimitryivaniuta.eventreg.common.error.RegistrationException;
import com.github.dimitryivaniuta.eventreg.common.error.StoreException;
import com.nimbusds.jose.jwk.RSAKey;
import io.r2dbc.spi.Row;
import java.text.ParseException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@link SigningKeyStore} over the {@code signing_keys} table. Keys are kept as JWK JSON
 * including the private exponent.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class R2dbcSigningKeyStore implements SigningKeyStore {

    private static final String SELECT = "SELECT id, jwk, status, created_at, expires_at FROM signing_keys";

    private final DatabaseClient db;
    private final TransactionalOperator tx;

    @Override
    public Mono<SigningKey> findActive(final Instant now) {
        return db.sql(SELECT + " WHERE status = :status AND expires_at > :now ORDER BY created_at DESC")
                .bind("status", KeyStatus.ACTIVE.name())
                .bind("now", toDb(now))
                .map((row, meta) -> toKey(row))
                .all()
                .next()
                .onErrorMap(R2dbcSigningKeyStore::isStoreFailure,
                        e -> new StoreException("error reading active signing key", e));
    }

    @Override
    public Mono<SigningKey> findValid(final String id, final Instant now) {
        return db.sql(SELECT + " WHERE id = :id AND expires_at > :now")
                .bind("id", id)
                .bind("now", toDb(now))
                .map((row, meta) -> toKey(row))
                .one()
                .onErrorMap(R2dbcSigningKeyStore::isStoreFailure,
                        e -> new StoreException("error reading signing key", e));
    }

    @Override
    public Flux<SigningKey> findAllValid(final Instant now) {
        return db.sql(SELECT + " WHERE expires_at > :now ORDER BY created_at DESC")
                .bind("now", toDb(now))
                .map((row, meta) -> toKey(row))
                .all()
                .onErrorMap(R2dbcSigningKeyStore::isStoreFailure,
                        e -> new StoreException("error reading signing keys", e));
    }

    /**
     * Retires or deletes the previous keys and inserts {@code key} as ACTIVE in one transaction.
     * The transaction first updates the rotation lock row, so concurrent rotations queue behind
     * each other and each one sees the key inserted by the one before.
     */
    @Override
    public Mono<Void> rotate(final SigningKey key, final boolean clearOld) {
        final Mono<Long> lock = db.sql("UPDATE signing_key_rotation SET rotated_at = :now WHERE id = 1")
                .bind("now", toDb(key.getCreatedAt()))
                .fetch()
                .rowsUpdated()
                .flatMap(n -> n == 0
                        ? Mono.<Long>error(new StoreException("signing key rotation lock row is missing"))
                        : Mono.just(n));

        final Mono<Long> demote = clearOld
                ? db.sql("DELETE FROM signing_keys").fetch().rowsUpdated()
                : db.sql("UPDATE signing_keys SET status = :retired WHERE status = :active")
                        .bind("retired", KeyStatus.RETIRED.name())
                        .bind("active", KeyStatus.ACTIVE.name())
                        .fetch()
                        .rowsUpdated();

        final Mono<Long> insert = db.sql("INSERT INTO signing_keys (id, jwk, status, created_at, expires_at) "
                        + "VALUES (:id, :jwk, :status, :createdAt, :expiresAt)")
                .bind("id", key.getId())
                .bind("jwk", key.getKey().toJSONString())
                .bind("status", KeyStatus.ACTIVE.name())
                .bind("createdAt", toDb(key.getCreatedAt()))
                .bind("expiresAt", toDb(key.getExpiresAt()))
                .fetch()
                .rowsUpdated();

        final Mono<Long> rotation = lock
                .then(demote)
                .doOnNext(n -> log.debug("Rotation {} {} previous key(s)", clearOld ? "deleted" : "retired", n))
                .then(insert);

        return tx.transactional(rotation)
                .onErrorMap(R2dbcSigningKeyStore::isStoreFailure,
                        e -> new StoreException("error rotating signing keys", e))
                .then();
    }

    @Override
    public Mono<Long> deleteExpired(final Instant now) {
        return db.sql("DELETE FROM signing_keys WHERE expires_at <= :now")
                .bind("now", toDb(now))
                .fetch()
                .rowsUpdated()
                .onErrorMap(R2dbcSigningKeyStore::isStoreFailure,
                        e -> new StoreException("error pruning signing keys", e));
    }

    private static SigningKey toKey(final Row row) {
        final String json = row.get("jwk", String.class);
        final RSAKey key;
        try {
            key = RSAKey.parse(json);
        } catch (ParseException e) {
            throw new StoreException("stored signing key is not a valid RSA JWK", e);
        }
        return SigningKey.builder()
                .id(row.get("id", String.class))
                .key(key)
                .status(KeyStatus.valueOf(row.get("status", String.class)))
                .createdAt(row.get("created_at", OffsetDateTime.class).toInstant())
                .expiresAt(row.get("expires_at", OffsetDateTime.class).toInstant())
                .build();
    }

    private static OffsetDateTime toDb(final Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static boolean isStoreFailure(final Throwable e) {
        return !(e instanceof RegistrationException);
    }
}
