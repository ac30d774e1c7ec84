package com.github.dimitryivaniuta.eventreg.common.query;

import java.util.List;

/**
 * Output of {@link QueryRenderer}: a filter expression with {@code ?} placeholders and the values
 * to bind, where the Nth placeholder corresponds to the Nth value.
 */
public record RenderedQuery(String expression, List<Object> bindValues) {

    public RenderedQuery {
        bindValues = List.copyOf(bindValues);
    }

    /** Rendering of an absent query: no filter, nothing to bind. */
    public static RenderedQuery matchAll() {
        return new RenderedQuery("", List.of());
    }

    public boolean isMatchAll() {
        return expression.isEmpty();
    }

    /** The expression prefixed with {@code WHERE}, or an empty string when matching all rows. */
    public String whereClause() {
        return isMatchAll() ? "" : " WHERE " + expression;
    }
}
