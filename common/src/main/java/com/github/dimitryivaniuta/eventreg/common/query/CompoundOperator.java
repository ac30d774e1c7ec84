package com.github.dimitryivaniuta.eventreg.common.query;

import java.util.Locale;
import java.util.Optional;

/** Boolean connective of a {@link CompoundQuery}. */
public enum CompoundOperator {
    AND(" AND "),
    OR(" OR ");

    private final String separator;

    CompoundOperator(final String separator) {
        this.separator = separator;
    }

    public String separator() {
        return separator;
    }

    /** Lenient parser for the wire shape; returns empty for unknown names. */
    public static Optional<CompoundOperator> from(final String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
