package com.github.dimitryivaniuta.eventreg.common.query;

import com.github.dimitryivaniuta.eventreg.common.error.ValidationException;
import java.util.List;
import java.util.Objects;

/**
 * Leaf testing a column against a literal list of values ({@code column IN (?, ?, ...)}).
 * Used by the existence check and by bulk lookups/deletes by id.
 */
public record MembershipQuery<F extends Field>(F field, List<Object> values) implements Query<F> {

    public MembershipQuery {
        Objects.requireNonNull(field, "field");
        values = List.copyOf(Objects.requireNonNull(values, "values"));
        for (int i = 0; i < values.size(); i++) {
            if (!field.accepts(values.get(i))) {
                throw ValidationException.invalidValue("values[" + i + "]");
            }
        }
    }
}
