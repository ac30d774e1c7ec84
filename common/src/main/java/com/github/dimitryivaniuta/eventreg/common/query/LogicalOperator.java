package com.github.dimitryivaniuta.eventreg.common.query;

import java.util.Locale;
import java.util.Optional;

/** Comparison applied by a {@link LogicalQuery} leaf. */
public enum LogicalOperator {
    EQUALS("="),
    NOT_EQUALS("<>");

    private final String sql;

    LogicalOperator(final String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }

    /** Lenient parser for the wire shape; returns empty for unknown names. */
    public static Optional<LogicalOperator> from(final String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
