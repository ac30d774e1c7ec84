package com.github.dimitryivaniuta.eventreg.common.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * JSON shape of a query as sent by clients. Either a leaf
 * {@code {"field": "name", "operator": "EQUALS", "value": "x"}} or a compound
 * {@code {"operator": "AND", "queries": [ ... ]}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryRequest(
        /** Field wire name; set on leaves only. */
        String field,
        /** EQUALS / NOT_EQUALS on leaves, AND / OR on compounds. */
        String operator,
        /** Leaf value. */
        Object value,
        /** Compound children. */
        List<QueryRequest> queries
) {

    public static QueryRequest leaf(final String field, final String operator, final Object value) {
        return new QueryRequest(field, operator, value, null);
    }

    public static QueryRequest compound(final String operator, final List<QueryRequest> queries) {
        return new QueryRequest(null, operator, null, queries);
    }

    public boolean isCompound() {
        return queries != null;
    }
}
