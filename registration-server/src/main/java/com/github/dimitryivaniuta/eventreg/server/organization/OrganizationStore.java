package com.github.dimitryivaniuta.eventreg.server.organization;

import com.github.dimitryivaniuta.eventreg.common.error.StoreException;
import com.github.dimitryivaniuta.eventreg.common.query.Query;
import com.github.dimitryivaniuta.eventreg.common.r2dbc.R2dbcQueryExecutor;
import java.util.Collection;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive access to the {@code organizations} table.
 */
@Repository
@RequiredArgsConstructor
public class OrganizationStore {

    /**
     * Each organization row paired with the permissions that can grant access to it: those bound
     * to the organization and the unbound server-wide ones.
     */
    private static final String SELECT_WITH_GRANTS = "SELECT DISTINCT o.id, o.name FROM organizations o "
            + "JOIN permissions p ON (p.organization_id = o.id "
            + "OR (p.organization_id IS NULL AND p.event_id IS NULL))";

    private final DatabaseClient db;

    private final R2dbcQueryExecutor executor;

    /**
     * @param filter caller query already combined with a row-scoped authorization predicate
     */
    public Flux<Organization> findGranted(final Query<OrganizationField> filter) {
        return executor.select(SELECT_WITH_GRANTS, filter, " ORDER BY o.name, o.id",
                (row, meta) -> new Organization(row.get("id", String.class), row.get("name", String.class)));
    }

    public Mono<Organization> insert(final Organization organization) {
        return write("INSERT INTO organizations (id, name) VALUES (:id, :name)", organization);
    }

    public Mono<Organization> update(final Organization organization) {
        return write("UPDATE organizations SET name = :name WHERE id = :id", organization);
    }

    public Mono<Long> delete(final Collection<String> ids) {
        return executor.execute("DELETE FROM organizations o", Query.in(OrganizationField.ID, ids));
    }

    private Mono<Organization> write(final String sql, final Organization organization) {
        return db.sql(sql)
                .bind("id", organization.id())
                .bind("name", organization.name())
                .fetch()
                .rowsUpdated()
                .onErrorMap(e -> new StoreException("error writing organization", e))
                .thenReturn(organization);
    }
}
