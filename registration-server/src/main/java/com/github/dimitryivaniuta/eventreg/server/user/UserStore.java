package com.github.dimitryivaniuta.eventreg.server.user;

import com.github.dimitryivaniuta.eventreg.common.error.StoreException;
import com.github.dimitryivaniuta.eventreg.common.query.Query;
import com.github.dimitryivaniuta.eventreg.common.r2dbc.R2dbcQueryExecutor;
import io.r2dbc.spi.Row;
import java.util.Collection;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive access to the {@code users} table.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class UserStore {

    private static final String SELECT = "SELECT u.id, u.email, u.password_hash, u.status FROM users u";

    private final DatabaseClient db;

    private final R2dbcQueryExecutor executor;

    public Flux<User> find(final Query<UserField> filter) {
        return executor.select(SELECT, filter, " ORDER BY u.id", (row, meta) -> toUser(row));
    }

    /** First user matching {@code filter}, or empty. */
    public Mono<User> findOne(final Query<UserField> filter) {
        return find(filter).next();
    }

    public Mono<User> insert(final User user) {
        return db.sql("INSERT INTO users (id, email, password_hash, status) "
                        + "VALUES (:id, :email, :passwordHash, :status)")
                .bind("id", user.getId())
                .bind("email", user.getEmail().trim().toLowerCase(Locale.ROOT))
                .bind("passwordHash", user.getPasswordHash())
                .bind("status", user.getStatus().name())
                .fetch()
                .rowsUpdated()
                .onErrorMap(e -> new StoreException("error inserting user", e))
                .doOnSuccess(n -> log.info("Created user id={} status={}", user.getId(), user.getStatus()))
                .thenReturn(user);
    }

    /**
     * Updates email, and password hash and status where set. A {@code null} hash or status keeps
     * the stored value.
     */
    public Mono<User> update(final User user) {
        final StringBuilder sql = new StringBuilder("UPDATE users SET email = :email");
        if (user.getPasswordHash() != null) sql.append(", password_hash = :passwordHash");
        if (user.getStatus() != null) sql.append(", status = :status");
        sql.append(" WHERE id = :id");

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql.toString())
                .bind("id", user.getId())
                .bind("email", user.getEmail().trim().toLowerCase(Locale.ROOT));
        if (user.getPasswordHash() != null) spec = spec.bind("passwordHash", user.getPasswordHash());
        if (user.getStatus() != null) spec = spec.bind("status", user.getStatus().name());
        return spec.fetch()
                .rowsUpdated()
                .onErrorMap(e -> new StoreException("error updating user", e))
                .doOnSuccess(n -> log.info("Updated user id={} passwordChanged={}", user.getId(),
                        user.getPasswordHash() != null))
                .thenReturn(user);
    }

    /** Deletes users; their permissions go with them. */
    public Mono<Long> delete(final Collection<String> ids) {
        return executor.execute("DELETE FROM users u", Query.in(UserField.ID, ids));
    }

    /** Whether any user exists at all. */
    public Mono<Boolean> any() {
        return executor.exists("SELECT u.id FROM users u", null);
    }

    private static User toUser(final Row row) {
        return User.builder()
                .id(row.get("id", String.class))
                .email(row.get("email", String.class))
                .passwordHash(row.get("password_hash", String.class))
                .status(UserStatus.fromDbValue(row.get("status", String.class)))
                .build();
    }
}
