package com.github.dimitryivaniuta.eventreg.common.query;

import com.github.dimitryivaniuta.eventreg.common.error.ValidationException;
import java.util.List;
import java.util.Objects;

/**
 * AND/OR combination of child queries, rendered in list order.
 * An empty child list is representable but rejected by {@link QueryRenderer}.
 */
public record CompoundQuery<F extends Field>(CompoundOperator operator, List<Query<F>> queries)
        implements Query<F> {

    public CompoundQuery {
        if (operator == null) {
            throw ValidationException.empty("operator");
        }
        queries = List.copyOf(Objects.requireNonNull(queries, "queries"));
    }
}
