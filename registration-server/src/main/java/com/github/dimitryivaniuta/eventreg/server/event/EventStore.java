package com.github.dimitryivaniuta.eventreg.server.event;

import com.github.dimitryivaniuta.eventreg.common.error.StoreException;
import com.github.dimitryivaniuta.eventreg.common.query.Query;
import com.github.dimitryivaniuta.eventreg.common.r2dbc.R2dbcQueryExecutor;
import io.r2dbc.spi.Row;
import java.util.Collection;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive access to the {@code events} table.
 */
@Repository
@RequiredArgsConstructor
public class EventStore {

    /**
     * Each event paired with the permissions that can grant access to it: bound to the event,
     * bound to its organization, or server-wide.
     */
    private static final String SELECT_WITH_GRANTS = "SELECT DISTINCT e.id, e.organization_id, e.name FROM events e "
            + "JOIN permissions p ON (p.event_id = e.id "
            + "OR p.organization_id = e.organization_id "
            + "OR (p.organization_id IS NULL AND p.event_id IS NULL))";

    private static final String SELECT = "SELECT e.id, e.organization_id, e.name FROM events e";

    private final DatabaseClient db;

    private final R2dbcQueryExecutor executor;

    /**
     * @param filter caller query already combined with a row-scoped authorization predicate
     */
    public Flux<Event> findGranted(final Query<EventField> filter) {
        return executor.select(SELECT_WITH_GRANTS, filter, " ORDER BY e.name, e.id", (row, meta) -> toEvent(row));
    }

    public Flux<Event> findByIds(final Collection<String> ids) {
        return executor.select(SELECT, Query.in(EventField.ID, ids), (row, meta) -> toEvent(row));
    }

    /** Event id to owning organization id, for the ids that exist. */
    public Mono<Map<String, String>> organizationIds(final Collection<String> eventIds) {
        return findByIds(eventIds).collectMap(Event::id, Event::organizationId);
    }

    public Mono<Event> insert(final Event event) {
        return write("INSERT INTO events (id, organization_id, name) VALUES (:id, :organizationId, :name)", event);
    }

    public Mono<Event> update(final Event event) {
        return write("UPDATE events SET organization_id = :organizationId, name = :name WHERE id = :id", event);
    }

    public Mono<Long> delete(final Collection<String> ids) {
        return executor.execute("DELETE FROM events e", Query.in(EventField.ID, ids));
    }

    private Mono<Event> write(final String sql, final Event event) {
        return db.sql(sql)
                .bind("id", event.id())
                .bind("organizationId", event.organizationId())
                .bind("name", event.name())
                .fetch()
                .rowsUpdated()
                .onErrorMap(e -> new StoreException("error writing event", e))
                .thenReturn(event);
    }

    private static Event toEvent(final Row row) {
        return new Event(row.get("id", String.class), row.get("organization_id", String.class),
                row.get("name", String.class));
    }
}
