package com.github.dimitryivaniuta.eventreg.common.query;

import com.github.dimitryivaniuta.eventreg.common.error.ValidationException;
import java.util.Objects;

/**
 * Leaf comparing one column against one bound value.
 *
 * @param field    column being compared
 * @param operator comparison
 * @param value    bound value; must match {@link Field#valueType()}
 */
public record LogicalQuery<F extends Field>(F field, LogicalOperator operator, Object value)
        implements Query<F> {

    public LogicalQuery {
        Objects.requireNonNull(field, "field");
        if (operator == null) {
            throw ValidationException.empty("operator");
        }
        if (value == null) {
            throw ValidationException.empty("value");
        }
        if (!field.accepts(value)) {
            throw ValidationException.invalidValue("value");
        }
    }
}
