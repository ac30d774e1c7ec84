package com.github.dimitryivaniuta.eventreg.server.keys;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.dimitryivaniuta.eventreg.common.error.StoreException;
import com.github.dimitryivaniuta.eventreg.common.error.UnauthenticatedException;
import com.github.dimitryivaniuta.eventreg.server.MutableClock;
import com.github.dimitryivaniuta.eventreg.server.config.KeyProperties;
import com.github.dimitryivaniuta.eventreg.server.config.TokenProperties;
import com.github.dimitryivaniuta.eventreg.server.token.Audience;
import com.github.dimitryivaniuta.eventreg.server.token.IssuedToken;
import com.github.dimitryivaniuta.eventreg.server.token.JwtTokenService;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import io.r2dbc.h2.H2ConnectionConfiguration;
import io.r2dbc.h2.H2ConnectionFactory;
import io.r2dbc.h2.H2ConnectionOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

class StoreKeyManagerTest {

    private MutableClock clock;
    private DatabaseClient db;
    private R2dbcSigningKeyStore store;
    private StoreKeyManager keyManager;
    private JwtTokenService tokenService;

    @BeforeEach
    void setUp() {
        H2ConnectionFactory cf = new H2ConnectionFactory(H2ConnectionConfiguration.builder()
                .inMemory("keys-" + UUID.randomUUID())
                .property(H2ConnectionOption.DB_CLOSE_DELAY, "-1")
                .property("LOCK_TIMEOUT", "10000")
                .build());
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).populate(cf).block();
        db = DatabaseClient.create(cf);
        store = new R2dbcSigningKeyStore(db, TransactionalOperator.create(new R2dbcTransactionManager(cf)));

        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        KeyProperties keyProperties = new KeyProperties();
        keyProperties.setKeyTtl(Duration.ofDays(10));
        TokenProperties tokenProperties = new TokenProperties();
        tokenProperties.setAccessTokenTtl(Duration.ofDays(1));

        keyManager = new StoreKeyManager(clock, keyProperties, store);
        tokenService = new JwtTokenService(clock, keyManager, tokenProperties);
    }

    @Test
    void emptyStoreHasNoSigningKeyAndNeverGeneratesOne() {
        StepVerifier.create(keyManager.getSigningKey())
                .expectError(NoSigningKeyException.class)
                .verify();
        StepVerifier.create(keyManager.hasSigningKey())
                .expectNext(false)
                .verifyComplete();
        assertThat(countKeys(null)).isZero();
    }

    @Test
    void rotationKeepsExactlyOneActiveKeyAndOlderTokensValid() {
        List<IssuedToken> tokens = new ArrayList<>();
        List<String> kids = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            SigningKey key = keyManager.rotate(false).block();
            kids.add(key.getId());
            tokens.add(tokenService.issue("user-" + i, Audience.ACCESS).block());
            clock.advance(Duration.ofHours(1));
        }

        assertThat(countKeys(KeyStatus.ACTIVE)).isEqualTo(1);
        assertThat(countKeys(KeyStatus.RETIRED)).isEqualTo(2);
        assertThat(keyManager.getSigningKey().block().getId()).isEqualTo(kids.get(2));
        for (IssuedToken token : tokens) {
            StepVerifier.create(tokenService.validate(token.token(), Audience.ACCESS))
                    .expectNext(token.claims())
                    .verifyComplete();
        }
    }

    @Test
    void clearingRotationInvalidatesEveryEarlierToken() {
        keyManager.rotate(false).block();
        IssuedToken before = tokenService.issue("user-1", Audience.ACCESS).block();

        keyManager.rotate(true).block();

        assertThat(countKeys(null)).isEqualTo(1);
        StepVerifier.create(tokenService.validate(before.token(), Audience.ACCESS))
                .expectError(UnauthenticatedException.class)
                .verify();
        IssuedToken after = tokenService.issue("user-1", Audience.ACCESS).block();
        StepVerifier.create(tokenService.validate(after.token(), Audience.ACCESS))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    void expiredKeysStopVerifyingAndArePruned() {
        String oldKid = keyManager.rotate(false).block().getId();
        clock.advance(Duration.ofDays(5));
        String newKid = keyManager.rotate(false).block().getId();

        clock.advance(Duration.ofDays(5));

        StepVerifier.create(keyManager.getVerifyingKey(oldKid)).verifyComplete();
        StepVerifier.create(keyManager.getVerifyingKey(newKid)).expectNextCount(1).verifyComplete();
        StepVerifier.create(keyManager.pruneExpired()).expectNext(1L).verifyComplete();
        assertThat(countKeys(null)).isEqualTo(1);

        clock.advance(Duration.ofDays(5));
        StepVerifier.create(keyManager.getSigningKey())
                .expectError(NoSigningKeyException.class)
                .verify();
    }

    @Test
    void publishedKeySetHoldsOnlyPublicKeysOfUnexpiredKeys() {
        keyManager.rotate(false).block();
        keyManager.rotate(false).block();

        JWKSet set = keyManager.publicKeys().block();

        assertThat(set.getKeys()).hasSize(2).noneMatch(JWK::isPrivate);
    }

    @Test
    void verifyingKeyIsPublicOnly() {
        String kid = keyManager.rotate(false).block().getId();

        assertThat(keyManager.getVerifyingKey(kid).block().isPrivate()).isFalse();
        StepVerifier.create(keyManager.getVerifyingKey("missing")).verifyComplete();
    }

    @Test
    void concurrentRotationsLeaveOneActiveKey() {
        List<SigningKey> rotated = Flux.range(0, 4)
                .flatMap(i -> keyManager.rotate(false).subscribeOn(Schedulers.boundedElastic()))
                .collectList()
                .block(Duration.ofSeconds(60));

        assertThat(rotated).hasSize(4);
        assertThat(countKeys(KeyStatus.ACTIVE)).isEqualTo(1);
        assertThat(countKeys(KeyStatus.RETIRED)).isEqualTo(3);
    }

    @Test
    void rotationFailsWithoutLockRowAndKeepsActiveKey() {
        String kid = keyManager.rotate(false).block().getId();
        db.sql("DELETE FROM signing_key_rotation").then().block();

        StepVerifier.create(keyManager.rotate(false))
                .expectError(StoreException.class)
                .verify();
        assertThat(keyManager.getSigningKey().block().getId()).isEqualTo(kid);
        assertThat(countKeys(null)).isEqualTo(1);
    }

    @Test
    void rotateIfDueCreatesMissingKeyAndReplacesOldOne() {
        StepVerifier.create(keyManager.rotateIfDue(Duration.ofDays(3))).expectNext(true).verifyComplete();
        String first = keyManager.getSigningKey().block().getId();

        clock.advance(Duration.ofDays(2));
        StepVerifier.create(keyManager.rotateIfDue(Duration.ofDays(3))).expectNext(false).verifyComplete();
        assertThat(keyManager.getSigningKey().block().getId()).isEqualTo(first);

        clock.advance(Duration.ofDays(1));
        StepVerifier.create(keyManager.rotateIfDue(Duration.ofDays(3))).expectNext(true).verifyComplete();
        assertThat(keyManager.getSigningKey().block().getId()).isNotEqualTo(first);
        assertThat(countKeys(KeyStatus.RETIRED)).isEqualTo(1);
    }

    @Test
    void defaultSettingsKeepIssuingTokensForOverAYear() {
        KeyProperties keyProperties = new KeyProperties();
        TokenProperties tokenProperties = new TokenProperties();
        StoreKeyManager defaults = new StoreKeyManager(clock, keyProperties, store);
        JwtTokenService issuer = new JwtTokenService(clock, defaults, tokenProperties);
        Duration interval = keyProperties.getScheduledRotation().getInterval();

        for (int day = 0; day < 400; day++) {
            defaults.rotateIfDue(interval).block();
            IssuedToken token = issuer.issue("user-" + day, Audience.ACCESS).block();
            assertThat(token).as("token on day %d", day).isNotNull();
            clock.advance(Duration.ofDays(1));
        }
        assertThat(countKeys(KeyStatus.ACTIVE)).isEqualTo(1);
    }

    private long countKeys(final KeyStatus status) {
        String sql = "SELECT COUNT(*) AS n FROM signing_keys" + (status == null ? "" : " WHERE status = :status");
        DatabaseClient.GenericExecuteSpec spec = db.sql(sql);
        if (status != null) {
            spec = spec.bind("status", status.name());
        }
        return spec.map((row, meta) -> row.get("n", Long.class)).one().block();
    }
}
