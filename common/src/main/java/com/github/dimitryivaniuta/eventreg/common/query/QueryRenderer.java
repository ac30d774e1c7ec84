package com.github.dimitryivaniuta.eventreg.common.query;

import com.github.dimitryivaniuta.eventreg.common.error.ValidationException;
import java.util.ArrayList;
import java.util.List;

/**
 * Translates a {@link Query} tree into a parameterized filter expression.
 *
 * <p>Values never enter the expression text: each leaf contributes placeholders and appends its
 * values to the bind list in the same left-to-right order. Rendering is pure and thread-safe.</p>
 */
public final class QueryRenderer {

    private static final String PLACEHOLDER = "?";

    private QueryRenderer() {
    }

    /**
     * Renders {@code query}, validating the whole tree first.
     *
     * @param query tree to render; {@code null} renders as "match all"
     * @return expression and ordered bind values
     * @throws ValidationException when the tree is malformed (e.g. an empty compound)
     */
    public static RenderedQuery render(final Query<?> query) {
        if (query == null) {
            return RenderedQuery.matchAll();
        }
        validate(query, "query");
        final StringBuilder sql = new StringBuilder();
        final List<Object> binds = new ArrayList<>();
        append(query, sql, binds);
        return new RenderedQuery(sql.toString(), binds);
    }

    /**
     * Rejects malformed trees, reporting the path of the first offending node.
     *
     * @param query tree to check
     * @param path  path of {@code query} itself, used as the error prefix
     */
    public static void validate(final Query<?> query, final String path) {
        if (query instanceof CompoundQuery<?> compound) {
            if (compound.queries().isEmpty()) {
                throw ValidationException.empty(path + ".queries");
            }
            for (int i = 0; i < compound.queries().size(); i++) {
                validate(compound.queries().get(i), path + ".queries[" + i + "]");
            }
        } else if (query instanceof MembershipQuery<?> membership) {
            if (membership.values().isEmpty()) {
                throw ValidationException.empty(path + ".values");
            }
        } else if (!(query instanceof LogicalQuery<?>)) {
            throw ValidationException.invalidValue(path);
        }
    }

    private static void append(final Query<?> query, final StringBuilder sql, final List<Object> binds) {
        if (query instanceof LogicalQuery<?> logical) {
            sql.append(logical.field().column())
                    .append(' ').append(logical.operator().sql()).append(' ')
                    .append(PLACEHOLDER);
            binds.add(logical.value());
        } else if (query instanceof MembershipQuery<?> membership) {
            sql.append(membership.field().column()).append(" IN (");
            for (int i = 0; i < membership.values().size(); i++) {
                if (i > 0) sql.append(", ");
                sql.append(PLACEHOLDER);
                binds.add(membership.values().get(i));
            }
            sql.append(')');
        } else if (query instanceof CompoundQuery<?> compound) {
            sql.append('(');
            for (int i = 0; i < compound.queries().size(); i++) {
                if (i > 0) sql.append(compound.operator().separator());
                append(compound.queries().get(i), sql, binds);
            }
            sql.append(')');
        }
    }
}
