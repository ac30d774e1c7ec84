package com.github.dimitryivaniuta.eventreg.common.r2dbc;

import com.github.dimitryivaniuta.eventreg.common.error.NotFoundException;
import com.github.dimitryivaniuta.eventreg.common.query.Query;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Verifies that every referenced id exists before an insert or update proceeds.
 *
 * <p>Issues one {@code SELECT id FROM <table> WHERE id IN (...)} and reports the first id, in the
 * caller's order, that the table does not contain.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class ExistenceCheck {

    private final R2dbcQueryExecutor executor;

    /**
     * @param table table that must contain the ids
     * @param ids   referenced ids; an empty collection completes immediately
     * @return empty on success, {@link NotFoundException} naming the first missing id otherwise
     */
    public Mono<Void> requireExisting(final ReferenceTable table, final Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return Mono.empty();
        }
        final Set<String> requested = new LinkedHashSet<>(ids);
        final String select = "SELECT " + table.idField().column() + " FROM " + table.tableName();

        return executor.select(select, Query.in(table.idField(), requested),
                        (row, meta) -> row.get(0, String.class))
                .collect(Collectors.toSet())
                .flatMap(found -> {
                    for (String id : requested) {
                        if (!found.contains(id)) {
                            log.debug("Existence check failed table={} id={}", table.tableName(), id);
                            return Mono.error(new NotFoundException(id));
                        }
                    }
                    return Mono.<Void>empty();
                });
    }
}
