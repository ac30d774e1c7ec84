package com.github.dimitryivaniuta.eventreg.common.query;

import com.github.dimitryivaniuta.eventreg.common.error.ValidationException;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts the client-facing {@link QueryRequest} shape into a typed {@link Query}.
 *
 * <p>Fields are resolved only through the entity's {@link FieldCatalog}; anything else is a
 * {@link ValidationException} whose path points at the offending node.</p>
 *
 * @param <F> field enum of the entity
 */
public final class QueryParser<F extends Enum<F> & Field> {

    /** Upper bound on tree depth; deeper requests are rejected rather than recursed into. */
    public static final int MAX_DEPTH = 16;

    private final FieldCatalog<F> catalog;

    public QueryParser(final FieldCatalog<F> catalog) {
        this.catalog = catalog;
    }

    /**
     * Parses an optional request.
     *
     * @param request client query, may be {@code null}
     * @return typed query or {@code null} when the client sent none ("match all")
     */
    public Query<F> parse(final QueryRequest request) {
        if (request == null) {
            return null;
        }
        final Query<F> query;
        try {
            query = parse(request, 0);
        } catch (ValidationException e) {
            throw e.withContext("query");
        }
        QueryRenderer.validate(query, "query");
        return query;
    }

    private Query<F> parse(final QueryRequest request, final int depth) {
        if (depth > MAX_DEPTH) {
            throw ValidationException.tooManyItems("queries");
        }
        if (request.isCompound()) {
            final CompoundOperator operator = CompoundOperator.from(request.operator())
                    .orElseThrow(() -> ValidationException.invalidEnum("operator"));
            if (request.queries().isEmpty()) {
                throw ValidationException.empty("queries");
            }
            final List<Query<F>> children = new ArrayList<>(request.queries().size());
            for (int i = 0; i < request.queries().size(); i++) {
                final QueryRequest child = request.queries().get(i);
                if (child == null) {
                    throw ValidationException.empty("queries[" + i + "]");
                }
                try {
                    children.add(parse(child, depth + 1));
                } catch (ValidationException e) {
                    throw e.withContext("queries[" + i + "]");
                }
            }
            return new CompoundQuery<>(operator, children);
        }
        return parseLeaf(request);
    }

    private Query<F> parseLeaf(final QueryRequest request) {
        if (request.field() == null || request.field().isBlank()) {
            throw ValidationException.empty("field");
        }
        final F field = catalog.find(request.field())
                .orElseThrow(() -> ValidationException.invalidEnum("field"));
        final LogicalOperator operator = LogicalOperator.from(request.operator())
                .orElseThrow(() -> ValidationException.invalidEnum("operator"));
        if (request.value() == null) {
            throw ValidationException.empty("value");
        }
        return new LogicalQuery<>(field, operator, coerce(field, request.value()));
    }

    /** JSON numbers arrive as Integer/Long/Double; widen them to the field's declared type. */
    private Object coerce(final F field, final Object raw) {
        if (raw instanceof Number n) {
            if (field.valueType() == Long.class) return n.longValue();
            if (field.valueType() == Integer.class) return n.intValue();
        }
        return raw;
    }
}
