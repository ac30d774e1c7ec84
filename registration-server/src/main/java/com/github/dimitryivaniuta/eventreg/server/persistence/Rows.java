package com.github.dimitryivaniuta.eventreg.server.persistence;

import org.springframework.r2dbc.core.DatabaseClient;

/** Binding helpers for hand-written statements. */
public final class Rows {

    private Rows() {
    }

    /** Binds {@code value}, or a typed NULL when it is absent. */
    public static DatabaseClient.GenericExecuteSpec bindNullable(final DatabaseClient.GenericExecuteSpec spec,
                                                                 final String name,
                                                                 final Object value,
                                                                 final Class<?> type) {
        return value == null ? spec.bindNull(name, type) : spec.bind(name, value);
    }
}
