package com.github.dimitryivaniuta.eventreg.common.query;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A filter over the rows of one entity: either a leaf comparison or a boolean combination of
 * child queries. Instances are immutable, so a tree can never contain itself.
 *
 * @param <F> field set of the queried entity
 */
public interface Query<F extends Field> {

    static <F extends Field> Query<F> equalTo(final F field, final Object value) {
        return new LogicalQuery<>(field, LogicalOperator.EQUALS, value);
    }

    static <F extends Field> Query<F> notEqualTo(final F field, final Object value) {
        return new LogicalQuery<>(field, LogicalOperator.NOT_EQUALS, value);
    }

    static <F extends Field> Query<F> in(final F field, final Collection<?> values) {
        return new MembershipQuery<>(field, List.<Object>copyOf(values));
    }

    @SafeVarargs
    static <F extends Field> Query<F> and(final Query<F>... queries) {
        return new CompoundQuery<>(CompoundOperator.AND, Arrays.asList(queries));
    }

    static <F extends Field> Query<F> and(final List<Query<F>> queries) {
        return new CompoundQuery<>(CompoundOperator.AND, queries);
    }

    @SafeVarargs
    static <F extends Field> Query<F> or(final Query<F>... queries) {
        return new CompoundQuery<>(CompoundOperator.OR, Arrays.asList(queries));
    }

    static <F extends Field> Query<F> or(final List<Query<F>> queries) {
        return new CompoundQuery<>(CompoundOperator.OR, queries);
    }

    /**
     * Restricts an optional caller query by a mandatory predicate. A missing caller query means
     * "match all", so only the restriction remains.
     */
    static <F extends Field> Query<F> restrict(final Query<F> query, final Query<F> restriction) {
        Objects.requireNonNull(restriction, "restriction");
        return query == null ? restriction : and(query, restriction);
    }
}
