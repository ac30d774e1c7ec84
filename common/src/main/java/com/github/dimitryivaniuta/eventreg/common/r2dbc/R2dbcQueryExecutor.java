package com.github.dimitryivaniuta.eventreg.common.r2dbc;

import com.github.dimitryivaniuta.eventreg.common.error.RegistrationException;
import com.github.dimitryivaniuta.eventreg.common.error.StoreException;
import com.github.dimitryivaniuta.eventreg.common.query.Query;
import com.github.dimitryivaniuta.eventreg.common.query.QueryRenderer;
import com.github.dimitryivaniuta.eventreg.common.query.RenderedQuery;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import java.util.List;
import java.util.function.BiFunction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Runs statements whose filter is a rendered {@link Query} through Spring's {@link DatabaseClient}.
 *
 * <p>The renderer's positional {@code ?} placeholders are rewritten to named markers
 * {@code :p0, :p1, ...} so the driver's dialect-specific bind markers are produced by
 * {@code DatabaseClient}; the Nth placeholder keeps the Nth value.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class R2dbcQueryExecutor {

    private final DatabaseClient db;

    /**
     * Selects rows matching an optional filter.
     *
     * @param select  statement up to (excluding) the WHERE clause
     * @param filter  optional filter; {@code null} selects every row
     * @param suffix  text appended after the WHERE clause (e.g. {@code ORDER BY}); may be empty
     * @param mapper  row mapper
     */
    public <T> Flux<T> select(final String select, final Query<?> filter, final String suffix,
                              final BiFunction<Row, RowMetadata, T> mapper) {
        return Flux.defer(() -> {
            final RenderedQuery rendered = QueryRenderer.render(filter);
            final String sql = select + rendered.whereClause() + (suffix == null ? "" : suffix);
            return bind(sql, rendered.bindValues()).map(mapper).all();
        }).onErrorMap(R2dbcQueryExecutor::isStoreFailure,
                e -> new StoreException("error fetching rows from database", e));
    }

    public <T> Flux<T> select(final String select, final Query<?> filter,
                              final BiFunction<Row, RowMetadata, T> mapper) {
        return select(select, filter, "", mapper);
    }

    /** Whether at least one row of {@code select} matches {@code filter}. */
    public Mono<Boolean> exists(final String select, final Query<?> filter) {
        return select(select, filter, (row, meta) -> Boolean.TRUE).take(1).hasElements();
    }

    /**
     * Executes an UPDATE/DELETE whose WHERE clause is {@code filter}.
     *
     * @return number of affected rows
     */
    public Mono<Long> execute(final String statement, final Query<?> filter) {
        return Mono.defer(() -> {
            final RenderedQuery rendered = QueryRenderer.render(filter);
            return bind(statement + rendered.whereClause(), rendered.bindValues())
                    .fetch()
                    .rowsUpdated();
        }).onErrorMap(R2dbcQueryExecutor::isStoreFailure,
                e -> new StoreException("error executing statement", e));
    }

    private DatabaseClient.GenericExecuteSpec bind(final String sql, final List<Object> values) {
        final String named = toNamedParameters(sql);
        if (log.isDebugEnabled()) {
            log.debug("Executing sql=[{}] binds={}", named, values.size());
        }
        DatabaseClient.GenericExecuteSpec spec = db.sql(named);
        for (int i = 0; i < values.size(); i++) {
            spec = spec.bind("p" + i, values.get(i));
        }
        return spec;
    }

    /**
     * Rewrites each positional {@code ?} to {@code :pN} in order of appearance. Expressions are
     * composed from column constants and operators only, so every {@code ?} is a placeholder.
     */
    static String toNamedParameters(final String sql) {
        final StringBuilder out = new StringBuilder(sql.length() + 16);
        int index = 0;
        for (int i = 0; i < sql.length(); i++) {
            final char c = sql.charAt(i);
            if (c == '?') {
                out.append(":p").append(index++);
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static boolean isStoreFailure(final Throwable e) {
        return !(e instanceof RegistrationException);
    }
}
