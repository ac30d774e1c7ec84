package com.github.dimitryivaniuta.eventreg.common.query;

/**
 * A queryable column of one entity.
 *
 * <p>Implementations are enums, so the set of columns an entity exposes is closed and known at
 * compile time; column text never originates from request input.</p>
 */
public interface Field {

    /** Column expression as it appears in the rendered filter, e.g. {@code o.name}. */
    String column();

    /** Java type every bound value for this column must have. */
    Class<?> valueType();

    /** Name under which the field is addressed in the JSON query shape. */
    String wireName();

    /** Whether callers may address the field through the JSON query shape. */
    default boolean queryable() {
        return true;
    }

    /** Whether {@code value} may be bound against this column. */
    default boolean accepts(final Object value) {
        return valueType().isInstance(value);
    }
}
