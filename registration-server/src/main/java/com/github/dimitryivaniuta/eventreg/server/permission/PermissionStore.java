package com.github.dimitryivaniuta.eventreg.server.permission;

import com.github.dimitryivaniuta.eventreg.common.error.StoreException;
import com.github.dimitryivaniuta.eventreg.common.query.Query;
import com.github.dimitryivaniuta.eventreg.common.r2dbc.R2dbcQueryExecutor;
import com.github.dimitryivaniuta.eventreg.server.persistence.Rows;
import io.r2dbc.spi.Row;
import java.util.Collection;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive access to the {@code permissions} table.
 */
@Repository
@RequiredArgsConstructor
public class PermissionStore {

    private static final String SELECT =
            "SELECT p.id, p.user_id, p.role, p.organization_id, p.event_id FROM permissions p";

    private final DatabaseClient db;

    private final R2dbcQueryExecutor executor;

    public Flux<Permission> find(final Query<PermissionField> filter) {
        return executor.select(SELECT, filter, " ORDER BY p.id", (row, meta) -> toPermission(row));
    }

    public Flux<Permission> findByIds(final Collection<String> ids) {
        return find(Query.in(PermissionField.ID, ids));
    }

    /** Whether any permission row satisfies {@code filter}. */
    public Mono<Boolean> exists(final Query<PermissionField> filter) {
        return executor.exists("SELECT p.id FROM permissions p", filter);
    }

    public Mono<Permission> insert(final Permission permission) {
        return write("INSERT INTO permissions (id, user_id, role, organization_id, event_id) "
                + "VALUES (:id, :userId, :role, :organizationId, :eventId)", permission);
    }

    public Mono<Permission> update(final Permission permission) {
        return write("UPDATE permissions SET user_id = :userId, role = :role, "
                + "organization_id = :organizationId, event_id = :eventId WHERE id = :id", permission);
    }

    public Mono<Long> delete(final Collection<String> ids) {
        return executor.execute("DELETE FROM permissions p", Query.in(PermissionField.ID, ids));
    }

    private Mono<Permission> write(final String sql, final Permission permission) {
        DatabaseClient.GenericExecuteSpec spec = db.sql(sql)
                .bind("id", permission.id())
                .bind("userId", permission.userId())
                .bind("role", permission.role().type().name());
        spec = Rows.bindNullable(spec, "organizationId", permission.role().organizationId(), String.class);
        spec = Rows.bindNullable(spec, "eventId", permission.role().eventId(), String.class);
        return spec.fetch()
                .rowsUpdated()
                .onErrorMap(e -> new StoreException("error writing permission", e))
                .thenReturn(permission);
    }

    private static Permission toPermission(final Row row) {
        final RoleType type = RoleType.valueOf(row.get("role", String.class));
        final String resourceId = switch (type.getResourceType()) {
            case SERVER -> null;
            case ORGANIZATION -> row.get("organization_id", String.class);
            case EVENT -> row.get("event_id", String.class);
        };
        return new Permission(row.get("id", String.class), row.get("user_id", String.class),
                new Role(type, resourceId));
    }
}
